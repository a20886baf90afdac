package com.apogee.repository;

import com.apogee.entity.AgentRun;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AgentRunRepository extends JpaRepository<AgentRun, UUID> {}
