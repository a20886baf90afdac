package com.apogee.converter;

import com.apogee.entity.AgentRunStatus;
import jakarta.persistence.Converter;

/** Maps {@link AgentRunStatus} to the PostgreSQL agent_status type. */
@Converter(autoApply = false)
public class AgentRunStatusConverter extends PostgreSQLEnumConverter<AgentRunStatus> {

    public AgentRunStatusConverter() {
        super(AgentRunStatus.class, "agent_status");
    }
}
