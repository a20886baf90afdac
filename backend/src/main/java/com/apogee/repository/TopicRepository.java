package com.apogee.repository;

import com.apogee.entity.Topic;
import com.apogee.entity.TopicStatus;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface TopicRepository extends JpaRepository<Topic, UUID> {

    /**
     * Ids of the given candidates that currently hold {@code status}. Never returns ids outside
     * {@code candidateIds}.
     */
    @Query(
            "SELECT t.id FROM Topic t "
                    + "WHERE t.channelId = :channelId AND t.status = :status "
                    + "AND t.id IN :candidateIds")
    List<UUID> findIdsByChannelIdAndStatusAndIdIn(
            @Param("channelId") UUID channelId,
            @Param("status") TopicStatus status,
            @Param("candidateIds") Collection<UUID> candidateIds);
}
