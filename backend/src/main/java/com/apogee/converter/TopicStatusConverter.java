package com.apogee.converter;

import com.apogee.entity.TopicStatus;
import jakarta.persistence.Converter;

/** Maps {@link TopicStatus} to the PostgreSQL topic_status type. */
@Converter(autoApply = false)
public class TopicStatusConverter extends PostgreSQLEnumConverter<TopicStatus> {

    public TopicStatusConverter() {
        super(TopicStatus.class, "topic_status");
    }
}
