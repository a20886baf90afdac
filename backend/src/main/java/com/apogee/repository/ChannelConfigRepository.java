package com.apogee.repository;

import com.apogee.entity.ChannelConfig;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChannelConfigRepository extends JpaRepository<ChannelConfig, UUID> {

    /** The first channel ever configured is the default target of a batch. */
    Optional<ChannelConfig> findFirstByOrderByCreatedAtAsc();
}
