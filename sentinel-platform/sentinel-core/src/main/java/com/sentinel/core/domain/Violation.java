package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Record of one classified content event that crossed the flag threshold.
 * Scores and action are fixed at creation; only resolution (appeal / moderator
 * approval) and admin soft delete touch the row afterwards.
 */
@Entity
@Table(name = "ai_violations", indexes = {
    @Index(name = "idx_violation_user", columnList = "user_id"),
    @Index(name = "idx_violation_scope", columnList = "scope_id"),
    @Index(name = "idx_violation_created", columnList = "created_at")
})
public class Violation {

    public static final int MAX_SNIPPET_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "scope_type", nullable = false)
    private ScopeType scopeType;

    @NotNull
    @Column(name = "scope_id", nullable = false)
    private UUID scopeId;

    @Column(name = "content_id")
    private UUID contentId;

    @Column(name = "content_snippet", length = MAX_SNIPPET_LENGTH)
    private String contentSnippet;

    @Column(name = "toxicity_score", nullable = false)
    private double toxicityScore;

    @Column(name = "harassment_score", nullable = false)
    private double harassmentScore;

    @Column(name = "hate_speech_score", nullable = false)
    private double hateSpeechScore;

    @Column(name = "sexual_content_score", nullable = false)
    private double sexualContentScore;

    @Column(name = "threat_score", nullable = false)
    private double threatScore;

    @Column(name = "spam_score", nullable = false)
    private double spamScore;

    @Column(name = "overall_score", nullable = false)
    private double overallScore;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "action_taken", nullable = false)
    private ModerationAction action;

    @Column(name = "hidden_from_others", nullable = false)
    private boolean hiddenFromOthers;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false)
    private PolicyCategory category;

    @Column(nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "deleted_by")
    private UUID deletedBy;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected Violation() {}

    /**
     * Creates a violation from a classification. The snippet is truncated to 500 characters.
     *
     * @param scores the six category scores in toxicity, harassment, hate speech,
     *               sexual content, threat, spam order
     */
    public static Violation create(
            UUID userId,
            ScopeType scopeType,
            UUID scopeId,
            UUID contentId,
            String content,
            double[] scores,
            double overallScore,
            ModerationAction action,
            PolicyCategory category,
            Instant now) {

        if (scores == null || scores.length != 6) {
            throw new IllegalArgumentException("Exactly six category scores are required");
        }
        var violation = new Violation();
        violation.userId = userId;
        violation.scopeType = scopeType;
        violation.scopeId = scopeId;
        violation.contentId = contentId;
        violation.contentSnippet = truncate(content);
        violation.toxicityScore = scores[0];
        violation.harassmentScore = scores[1];
        violation.hateSpeechScore = scores[2];
        violation.sexualContentScore = scores[3];
        violation.threatScore = scores[4];
        violation.spamScore = scores[5];
        violation.overallScore = overallScore;
        violation.action = action;
        violation.hiddenFromOthers = action.hidesContent();
        violation.category = category;
        violation.resolved = false;
        violation.deleted = false;
        violation.createdAt = now;
        return violation;
    }

    private static String truncate(String content) {
        if (content == null) {
            return null;
        }
        return content.length() > MAX_SNIPPET_LENGTH ? content.substring(0, MAX_SNIPPET_LENGTH) : content;
    }

    /**
     * Marks the violation resolved in the user's favour. Idempotent.
     */
    public void resolve(Instant now) {
        if (!resolved) {
            this.resolved = true;
            this.resolvedAt = now;
        }
    }

    public void softDelete(UUID adminId, Instant now) {
        if (deleted) {
            throw new IllegalStateException("Violation already deleted: " + id);
        }
        this.deleted = true;
        this.deletedAt = now;
        this.deletedBy = adminId;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public ScopeType getScopeType() { return scopeType; }
    public UUID getScopeId() { return scopeId; }
    public UUID getContentId() { return contentId; }
    public String getContentSnippet() { return contentSnippet; }
    public double getToxicityScore() { return toxicityScore; }
    public double getHarassmentScore() { return harassmentScore; }
    public double getHateSpeechScore() { return hateSpeechScore; }
    public double getSexualContentScore() { return sexualContentScore; }
    public double getThreatScore() { return threatScore; }
    public double getSpamScore() { return spamScore; }
    public double getOverallScore() { return overallScore; }
    public ModerationAction getAction() { return action; }
    public boolean isHiddenFromOthers() { return hiddenFromOthers; }
    public PolicyCategory getCategory() { return category; }
    public boolean isResolved() { return resolved; }
    public Instant getResolvedAt() { return resolvedAt; }
    public boolean isDeleted() { return deleted; }
    public Instant getDeletedAt() { return deletedAt; }
    public UUID getDeletedBy() { return deletedBy; }
    public Instant getCreatedAt() { return createdAt; }
}
