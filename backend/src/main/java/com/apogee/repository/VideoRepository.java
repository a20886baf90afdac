package com.apogee.repository;

import com.apogee.entity.Video;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VideoRepository extends JpaRepository<Video, UUID> {

    Optional<Video> findFirstByTopicIdOrderByCreatedAtDesc(UUID topicId);
}
