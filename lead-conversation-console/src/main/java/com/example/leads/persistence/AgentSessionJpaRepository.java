package com.example.leads.persistence;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AgentSessionJpaRepository extends JpaRepository<AgentSessionEntity, String> {

    Optional<AgentSessionEntity> findFirstByContactPhoneOrderByUpdatedAtDesc(String contactPhone);
}
