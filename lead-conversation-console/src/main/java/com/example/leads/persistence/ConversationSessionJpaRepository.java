package com.example.leads.persistence;

import com.example.leads.domain.ControlMode;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationSessionJpaRepository extends JpaRepository<ConversationSessionEntity, String> {

    List<ConversationSessionEntity> findByOrganizationIdOrderByUpdatedAtDesc(String organizationId);

    List<ConversationSessionEntity> findByControlMode(ControlMode controlMode);
}
