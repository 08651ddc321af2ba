package com.example.leads.persistence;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationConfigJpaRepository extends JpaRepository<OrganizationConfigEntity, String> {

    Optional<OrganizationConfigEntity> findByOrganizationIdAndAgentType(String organizationId, String agentType);
}
