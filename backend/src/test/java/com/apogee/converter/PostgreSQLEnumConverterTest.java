package com.apogee.converter;

import static org.junit.jupiter.api.Assertions.*;

import com.apogee.entity.AgentRunStatus;
import com.apogee.entity.TopicStatus;
import com.apogee.entity.VideoStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

class PostgreSQLEnumConverterTest {

    @Test
    @DisplayName("Writes the lower-case label as a typed PGobject")
    void testConvertToDatabaseColumn() {
        Object column = new VideoStatusConverter().convertToDatabaseColumn(VideoStatus.FAILED);

        PGobject pgObject = assertInstanceOf(PGobject.class, column);
        assertEquals("video_status", pgObject.getType());
        assertEquals("failed", pgObject.getValue());
    }

    @Test
    @DisplayName("Reads both PGobject and plain string values")
    void testConvertToEntityAttribute() throws Exception {
        PGobject pgObject = new PGobject();
        pgObject.setType("topic_status");
        pgObject.setValue("approved");

        TopicStatusConverter converter = new TopicStatusConverter();
        assertEquals(TopicStatus.APPROVED, converter.convertToEntityAttribute(pgObject));
        assertEquals(TopicStatus.PENDING, converter.convertToEntityAttribute("pending"));
        assertEquals(
                AgentRunStatus.SUCCESS,
                new AgentRunStatusConverter().convertToEntityAttribute("success"));
    }

    @Test
    @DisplayName("Null passes through in both directions")
    void testNulls() {
        VideoStatusConverter converter = new VideoStatusConverter();
        assertNull(converter.convertToDatabaseColumn(null));
        assertNull(converter.convertToEntityAttribute(null));
    }

    @Test
    @DisplayName("Unknown labels are rejected with the type name")
    void testUnknownLabel() {
        IllegalArgumentException exception =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> new VideoStatusConverter().convertToEntityAttribute("DRAFT"));
        assertTrue(exception.getMessage().contains("video_status"));
    }
}
