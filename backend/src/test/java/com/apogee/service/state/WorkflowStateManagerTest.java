package com.apogee.service.state;

import static org.junit.jupiter.api.Assertions.*;

import com.apogee.entity.TopicStatus;
import com.apogee.entity.VideoStatus;
import com.apogee.exception.IllegalStatusTransitionException;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class WorkflowStateManagerTest {

    private final WorkflowStateManager stateManager = new WorkflowStateManager();

    @Test
    @DisplayName("Video advances forward through the production states")
    void testVideoForwardTransitions() {
        assertTrue(stateManager.isValidTransition(VideoStatus.DRAFT, VideoStatus.SCRIPTED));
        assertTrue(stateManager.isValidTransition(VideoStatus.SCRIPTED, VideoStatus.RENDERED));
        assertTrue(stateManager.isValidTransition(VideoStatus.RENDERED, VideoStatus.PUBLISHED));
    }

    @ParameterizedTest
    @EnumSource(
            value = VideoStatus.class,
            names = {"DRAFT", "SCRIPTED", "RENDERED"})
    @DisplayName("Every non-terminal video state may fail")
    void testNonTerminalVideoMayFail(VideoStatus from) {
        assertTrue(stateManager.isValidTransition(from, VideoStatus.FAILED));
    }

    @Test
    @DisplayName("Failed and published videos cannot move anywhere else")
    void testTerminalVideoStates() {
        assertFalse(stateManager.isValidTransition(VideoStatus.FAILED, VideoStatus.DRAFT));
        assertFalse(stateManager.isValidTransition(VideoStatus.FAILED, VideoStatus.SCRIPTED));
        assertFalse(stateManager.isValidTransition(VideoStatus.PUBLISHED, VideoStatus.FAILED));
        assertFalse(stateManager.isValidTransition(VideoStatus.PUBLISHED, VideoStatus.RENDERED));
    }

    @Test
    @DisplayName("Videos never move backwards or skip a state")
    void testNoBackwardOrSkippingVideoTransitions() {
        assertFalse(stateManager.isValidTransition(VideoStatus.SCRIPTED, VideoStatus.DRAFT));
        assertFalse(stateManager.isValidTransition(VideoStatus.DRAFT, VideoStatus.RENDERED));
        assertFalse(stateManager.isValidTransition(VideoStatus.DRAFT, VideoStatus.PUBLISHED));
    }

    @ParameterizedTest
    @EnumSource(VideoStatus.class)
    @DisplayName("Same-state video writes are accepted")
    void testSameVideoStateIsValid(VideoStatus status) {
        assertTrue(stateManager.isValidTransition(status, status));
    }

    @Test
    @DisplayName("Topic transitions follow the approval lifecycle")
    void testTopicTransitions() {
        assertTrue(stateManager.isValidTransition(TopicStatus.PENDING, TopicStatus.APPROVED));
        assertTrue(stateManager.isValidTransition(TopicStatus.PENDING, TopicStatus.REJECTED));
        assertTrue(stateManager.isValidTransition(TopicStatus.APPROVED, TopicStatus.PUBLISHED));
        assertTrue(stateManager.isValidTransition(TopicStatus.APPROVED, TopicStatus.REJECTED));
        assertTrue(stateManager.isValidTransition(TopicStatus.REJECTED, TopicStatus.REJECTED));

        assertFalse(stateManager.isValidTransition(TopicStatus.PENDING, TopicStatus.PUBLISHED));
        assertFalse(stateManager.isValidTransition(TopicStatus.REJECTED, TopicStatus.APPROVED));
        assertFalse(stateManager.isValidTransition(TopicStatus.PUBLISHED, TopicStatus.PENDING));
        assertFalse(stateManager.isValidTransition(TopicStatus.APPROVED, TopicStatus.PENDING));
    }

    @Test
    @DisplayName("validateVideoTransition throws with both states in the message")
    void testValidateVideoTransitionThrows() {
        UUID videoId = UUID.randomUUID();

        IllegalStatusTransitionException exception =
                assertThrows(
                        IllegalStatusTransitionException.class,
                        () ->
                                stateManager.validateVideoTransition(
                                        videoId, VideoStatus.FAILED, VideoStatus.DRAFT));

        assertEquals(VideoStatus.FAILED, exception.getFromStatus());
        assertEquals(VideoStatus.DRAFT, exception.getToStatus());
        assertEquals("video", exception.getEntityType());
        assertTrue(exception.getMessage().contains("from FAILED to DRAFT"));
        assertTrue(exception.getMessage().contains(videoId.toString()));
    }

    @Test
    @DisplayName("validateTopicTransition accepts a legal move")
    void testValidateTopicTransitionAccepts() {
        assertDoesNotThrow(
                () ->
                        stateManager.validateTopicTransition(
                                UUID.randomUUID(), TopicStatus.PENDING, TopicStatus.APPROVED));
        assertThrows(
                IllegalStatusTransitionException.class,
                () ->
                        stateManager.validateTopicTransition(
                                UUID.randomUUID(), TopicStatus.PUBLISHED, TopicStatus.APPROVED));
    }
}
