package com.apogee.repository;

import com.apogee.entity.Script;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScriptRepository extends JpaRepository<Script, UUID> {

    Optional<Script> findFirstByVideoIdOrderByCreatedAtDesc(UUID videoId);
}
