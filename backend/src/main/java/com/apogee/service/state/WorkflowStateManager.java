package com.apogee.service.state;

import com.apogee.entity.TopicStatus;
import com.apogee.entity.VideoStatus;
import com.apogee.exception.IllegalStatusTransitionException;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Transition tables of the topic and video lifecycles. */
@Slf4j
@Component
public class WorkflowStateManager {

    private static final Map<TopicStatus, Set<TopicStatus>> TOPIC_TRANSITIONS =
            new EnumMap<>(TopicStatus.class);

    private static final Map<VideoStatus, Set<VideoStatus>> VIDEO_TRANSITIONS =
            new EnumMap<>(VideoStatus.class);

    static {
        // approval is a human action; publishing belongs to the downstream stages
        TOPIC_TRANSITIONS.put(
                TopicStatus.PENDING, EnumSet.of(TopicStatus.APPROVED, TopicStatus.REJECTED));
        TOPIC_TRANSITIONS.put(
                TopicStatus.APPROVED, EnumSet.of(TopicStatus.PUBLISHED, TopicStatus.REJECTED));
        TOPIC_TRANSITIONS.put(TopicStatus.REJECTED, EnumSet.noneOf(TopicStatus.class));
        TOPIC_TRANSITIONS.put(TopicStatus.PUBLISHED, EnumSet.noneOf(TopicStatus.class));

        VIDEO_TRANSITIONS.put(
                VideoStatus.DRAFT, EnumSet.of(VideoStatus.SCRIPTED, VideoStatus.FAILED));
        VIDEO_TRANSITIONS.put(
                VideoStatus.SCRIPTED, EnumSet.of(VideoStatus.RENDERED, VideoStatus.FAILED));
        VIDEO_TRANSITIONS.put(
                VideoStatus.RENDERED, EnumSet.of(VideoStatus.PUBLISHED, VideoStatus.FAILED));

        // terminal
        VIDEO_TRANSITIONS.put(VideoStatus.PUBLISHED, EnumSet.noneOf(VideoStatus.class));
        VIDEO_TRANSITIONS.put(VideoStatus.FAILED, EnumSet.noneOf(VideoStatus.class));
    }

    public boolean isValidTransition(TopicStatus from, TopicStatus to) {
        if (from == to) {
            return true;
        }
        Set<TopicStatus> validTargets = TOPIC_TRANSITIONS.get(from);
        return validTargets != null && validTargets.contains(to);
    }

    public boolean isValidTransition(VideoStatus from, VideoStatus to) {
        if (from == to) {
            return true;
        }
        Set<VideoStatus> validTargets = VIDEO_TRANSITIONS.get(from);
        return validTargets != null && validTargets.contains(to);
    }

    /**
     * @throws IllegalStatusTransitionException if the video table forbids {@code from -> to}
     */
    public void validateVideoTransition(Object videoId, VideoStatus from, VideoStatus to) {
        if (!isValidTransition(from, to)) {
            log.warn("Rejected video transition {} -> {} for video {}", from, to, videoId);
            throw new IllegalStatusTransitionException("video", videoId, from, to);
        }
    }

    /**
     * @throws IllegalStatusTransitionException if the topic table forbids {@code from -> to}
     */
    public void validateTopicTransition(Object topicId, TopicStatus from, TopicStatus to) {
        if (!isValidTransition(from, to)) {
            log.warn("Rejected topic transition {} -> {} for topic {}", from, to, topicId);
            throw new IllegalStatusTransitionException("topic", topicId, from, to);
        }
    }
}
