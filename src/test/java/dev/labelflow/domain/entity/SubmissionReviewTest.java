package dev.labelflow.domain.entity;

import dev.labelflow.domain.enums.SubmissionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionReviewTest {

    private final UUID reviewer = UUID.randomUUID();
    private final UUID first = UUID.randomUUID();
    private final UUID second = UUID.randomUUID();

    private SubmissionReview submission() {
        return SubmissionReview.submit(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                List.of(first, second, first), null);
    }

    @Test
    @DisplayName("a new submission snapshots distinct images and starts SUBMITTED")
    void submit() {
        SubmissionReview submission = submission();

        assertThat(submission.getImageIds()).containsExactly(first, second);
        assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.SUBMITTED);
        assertThat(submission.getMessage()).isEmpty();
        assertThat(submission.getReviewHistory()).isEmpty();
    }

    @Test
    @DisplayName("the latest decision replaces flags while history keeps every round")
    void historyAccumulates() {
        SubmissionReview submission = submission();
        Instant t1 = Instant.parse("2026-03-01T10:00:00Z");
        Instant t2 = t1.plusSeconds(60);

        submission.recordDecision(reviewer, t1, SubmissionStatus.UNDER_REVIEW, "looking",
                List.of(), List.of(new ImageFeedback(first, "tighten box")));
        submission.recordDecision(reviewer, t2, SubmissionStatus.REJECTED, "fix the first image",
                List.of(new FlaggedImage(first, "loose box")), List.of());

        assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.REJECTED);
        assertThat(submission.getReviewedAt()).isEqualTo(t2);
        assertThat(submission.getFlaggedImages()).extracting(FlaggedImage::getImageId).containsExactly(first);
        assertThat(submission.feedbackFor(first)).isEmpty();
        assertThat(submission.getReviewHistory())
                .extracting(ReviewHistoryEntry::getStatus)
                .containsExactly(SubmissionStatus.UNDER_REVIEW, SubmissionStatus.REJECTED);
    }

    @Test
    @DisplayName("terminal submissions take no further decisions")
    void terminal() {
        SubmissionReview submission = submission();
        submission.recordDecision(reviewer, Instant.now(), SubmissionStatus.APPROVED, "", List.of(), List.of());

        assertThat(submission.isPending()).isFalse();
        assertThatThrownBy(() -> submission.autoReject(reviewer, Instant.now(), "closed"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(submission.getReviewHistory()).hasSize(1);
    }

    @Test
    @DisplayName("SUBMITTED is not a reviewer decision")
    void submittedIsNotADecision() {
        SubmissionReview submission = submission();

        assertThatThrownBy(() -> submission.recordDecision(reviewer, Instant.now(), SubmissionStatus.SUBMITTED,
                "", List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(submission.getReviewHistory()).isEmpty();
    }
}
