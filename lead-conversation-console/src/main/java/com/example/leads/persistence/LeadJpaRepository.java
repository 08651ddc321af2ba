package com.example.leads.persistence;

import com.example.leads.domain.LeadStatus;
import com.example.leads.domain.QualificationScore;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeadJpaRepository extends JpaRepository<LeadEntity, String> {

    @Query(
            "select l from LeadEntity l "
                    + "where l.organizationId = :organizationId "
                    + "and (:status is null or l.status = :status) "
                    + "and (:score is null or l.qualificationScore = :score) "
                    + "order by l.createdAt desc")
    List<LeadEntity> findForOrganization(
            @Param("organizationId") String organizationId,
            @Param("status") LeadStatus status,
            @Param("score") QualificationScore score);
}
