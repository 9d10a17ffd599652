package com.sentinel.core.domain;

import com.sentinel.core.domain.ModeratorReviewItem.ReviewStatus;
import com.sentinel.core.domain.ModeratorReviewItem.SourceType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModeratorReviewItemTest {

    private final Instant now = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void newItemIsPending() {
        ModeratorReviewItem item = newItem("short preview");

        assertThat(item.isPending()).isTrue();
        assertThat(item.getStatus()).isEqualTo(ReviewStatus.PENDING);
    }

    @Test
    void previewIsTruncated() {
        ModeratorReviewItem item = newItem("x".repeat(1000));

        assertThat(item.getContentPreview()).hasSize(ModeratorReviewItem.MAX_PREVIEW_LENGTH);
    }

    @Test
    void resolvedItemCannotTransitionAgain() {
        ModeratorReviewItem item = newItem("preview");
        UUID moderator = UUID.randomUUID();

        item.resolve(ReviewStatus.REJECTED, moderator, "upheld", now);

        assertThat(item.getResolvedBy()).isEqualTo(moderator);
        assertThatThrownBy(() -> item.resolve(ReviewStatus.APPROVED, moderator, "changed mind", now))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> item.escalate(moderator, "late", now))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void escalatedIsNotAModeratorOutcome() {
        ModeratorReviewItem item = newItem("preview");

        assertThatThrownBy(() -> item.resolve(ReviewStatus.ESCALATED, UUID.randomUUID(), null, now))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(item.isPending()).isTrue();
    }

    private ModeratorReviewItem newItem(String preview) {
        return ModeratorReviewItem.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                SourceType.CHAT_MESSAGE, true, preview, 0.65, PolicyCategory.HATE_SPEECH, now);
    }
}
