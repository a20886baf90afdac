package com.apogee.service.state;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.apogee.dto.pipeline.VideoSpec;
import com.apogee.entity.ChannelConfig;
import com.apogee.entity.Claim;
import com.apogee.entity.Script;
import com.apogee.entity.ScriptBeat;
import com.apogee.entity.Topic;
import com.apogee.entity.TopicStatus;
import com.apogee.entity.Video;
import com.apogee.entity.VideoStatus;
import com.apogee.exception.IllegalStatusTransitionException;
import com.apogee.exception.InvariantViolationException;
import com.apogee.repository.ChannelConfigRepository;
import com.apogee.repository.ClaimRepository;
import com.apogee.repository.ScriptRepository;
import com.apogee.repository.TopicRepository;
import com.apogee.repository.VideoRepository;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkflowStateStoreTest {

    @Mock private ChannelConfigRepository channelConfigRepository;
    @Mock private TopicRepository topicRepository;
    @Mock private VideoRepository videoRepository;
    @Mock private ScriptRepository scriptRepository;
    @Mock private ClaimRepository claimRepository;

    private WorkflowStateStore stateStore;

    private static final UUID CHANNEL_ID = UUID.randomUUID();
    private static final UUID TOPIC_ID = UUID.randomUUID();
    private static final UUID VIDEO_ID = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        stateStore =
                new WorkflowStateStore(
                        channelConfigRepository,
                        topicRepository,
                        videoRepository,
                        scriptRepository,
                        claimRepository,
                        new WorkflowStateManager());
    }

    @Test
    @DisplayName("Default channel is the oldest configured one")
    void testFetchDefaultChannelId() {
        when(channelConfigRepository.findFirstByOrderByCreatedAtAsc())
                .thenReturn(Optional.of(ChannelConfig.builder().id(CHANNEL_ID).build()));

        assertEquals(CHANNEL_ID, stateStore.fetchDefaultChannelId());
    }

    @Test
    @DisplayName("Missing channel is an invariant violation")
    void testFetchDefaultChannelIdMissing() {
        when(channelConfigRepository.findFirstByOrderByCreatedAtAsc()).thenReturn(Optional.empty());

        assertThrows(InvariantViolationException.class, () -> stateStore.fetchDefaultChannelId());
    }

    @Test
    @DisplayName("Empty candidate set short-circuits without a query")
    void testFetchApprovedTopicIdsEmptyCandidates() {
        assertTrue(stateStore.fetchApprovedTopicIds(CHANNEL_ID, List.of()).isEmpty());
        verifyNoInteractions(topicRepository);
    }

    @Test
    @DisplayName("Approved topics are queried with the approved status only")
    void testFetchApprovedTopicIds() {
        List<UUID> candidates = List.of(TOPIC_ID, UUID.randomUUID());
        when(topicRepository.findIdsByChannelIdAndStatusAndIdIn(
                        CHANNEL_ID, TopicStatus.APPROVED, candidates))
                .thenReturn(List.of(TOPIC_ID));

        assertEquals(List.of(TOPIC_ID), stateStore.fetchApprovedTopicIds(CHANNEL_ID, candidates));
    }

    @Test
    @DisplayName("markVideoFailed writes status, reason and update time")
    void testMarkVideoFailed() {
        Video video = createVideo(VideoStatus.DRAFT);
        when(videoRepository.findById(VIDEO_ID)).thenReturn(Optional.of(video));
        OffsetDateTime before = OffsetDateTime.now().minusSeconds(1);

        stateStore.markVideoFailed(VIDEO_ID, "fact_checker: max 2 attempts exhausted");

        ArgumentCaptor<Video> saved = ArgumentCaptor.forClass(Video.class);
        verify(videoRepository).save(saved.capture());
        assertEquals(VideoStatus.FAILED, saved.getValue().getStatus());
        assertEquals("fact_checker: max 2 attempts exhausted", saved.getValue().getErrorMessage());
        assertTrue(saved.getValue().getUpdatedAt().isAfter(before));
    }

    @Test
    @DisplayName("markVideoFailed on an already failed video keeps the first reason")
    void testMarkVideoFailedIdempotent() {
        Video video = createVideo(VideoStatus.FAILED);
        video.setErrorMessage("original reason");
        when(videoRepository.findById(VIDEO_ID)).thenReturn(Optional.of(video));

        stateStore.markVideoFailed(VIDEO_ID, "second reason");

        verify(videoRepository, never()).save(any());
        assertEquals("original reason", video.getErrorMessage());
    }

    @Test
    @DisplayName("markVideoFailed refuses to fail a published video")
    void testMarkVideoFailedPublished() {
        when(videoRepository.findById(VIDEO_ID))
                .thenReturn(Optional.of(createVideo(VideoStatus.PUBLISHED)));

        assertThrows(
                IllegalStatusTransitionException.class,
                () -> stateStore.markVideoFailed(VIDEO_ID, "late failure"));
        verify(videoRepository, never()).save(any());
    }

    @Test
    @DisplayName("buildVideoSpec assembles topic, newest script and claims")
    void testBuildVideoSpec() {
        Video video = createVideo(VideoStatus.SCRIPTED);
        when(videoRepository.findById(VIDEO_ID)).thenReturn(Optional.of(video));
        when(topicRepository.findById(TOPIC_ID))
                .thenReturn(Optional.of(Topic.builder().id(TOPIC_ID).title("Black holes").build()));
        when(scriptRepository.findFirstByVideoIdOrderByCreatedAtDesc(VIDEO_ID))
                .thenReturn(
                        Optional.of(
                                Script.builder()
                                        .videoId(VIDEO_ID)
                                        .hook("Did you know?")
                                        .beats(List.of(new ScriptBeat("fact", "analogy")))
                                        .payoff("payoff")
                                        .cta("")
                                        .templateScore(0.8)
                                        .similarityScore(0.1)
                                        .build()));
        when(claimRepository.findByVideoIdOrderByCreatedAtAsc(VIDEO_ID))
                .thenReturn(
                        List.of(
                                Claim.builder()
                                        .videoId(VIDEO_ID)
                                        .claimText("Light bends")
                                        .sourceUrl("https://example.org")
                                        .riskScore(0.1234567)
                                        .verified(true)
                                        .build()));

        VideoSpec spec = stateStore.buildVideoSpec(VIDEO_ID);

        assertEquals(VIDEO_ID, spec.getVideoId());
        assertEquals(TOPIC_ID, spec.getTopicId());
        assertEquals(CHANNEL_ID, spec.getChannelId());
        assertEquals("Black holes", spec.getTopicTitle());
        assertEquals(VideoStatus.SCRIPTED, spec.getStatus());
        assertNull(spec.getScript().getCta());
        assertEquals(0.8, spec.getTemplateScore());
        assertEquals(1, spec.getClaims().size());
        assertEquals(0.876543, spec.getClaims().get(0).getConfidence(), 1e-9);
        assertEquals("Did you know?\n\nfact\n\nanalogy\n\npayoff", spec.getScript().getFullText());
    }

    @Test
    @DisplayName("buildVideoSpec without a script is an invariant violation")
    void testBuildVideoSpecWithoutScript() {
        when(videoRepository.findById(VIDEO_ID))
                .thenReturn(Optional.of(createVideo(VideoStatus.SCRIPTED)));
        when(topicRepository.findById(TOPIC_ID))
                .thenReturn(Optional.of(Topic.builder().id(TOPIC_ID).title("t").build()));
        when(scriptRepository.findFirstByVideoIdOrderByCreatedAtDesc(VIDEO_ID))
                .thenReturn(Optional.empty());

        assertThrows(InvariantViolationException.class, () -> stateStore.buildVideoSpec(VIDEO_ID));
    }

    @Test
    @DisplayName("Confidence is one minus risk, rounded to six decimals")
    void testConfidenceOf() {
        assertEquals(1.0, WorkflowStateStore.confidenceOf(0.0));
        assertEquals(0.0, WorkflowStateStore.confidenceOf(1.0));
        assertEquals(0.7, WorkflowStateStore.confidenceOf(0.3), 1e-12);
    }

    private Video createVideo(VideoStatus status) {
        return Video.builder()
                .id(VIDEO_ID)
                .channelId(CHANNEL_ID)
                .topicId(TOPIC_ID)
                .status(status)
                .createdAt(OffsetDateTime.now().minusHours(1))
                .updatedAt(OffsetDateTime.now().minusHours(1))
                .build();
    }
}
