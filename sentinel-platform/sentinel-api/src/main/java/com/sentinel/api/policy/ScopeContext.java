package com.sentinel.api.policy;

import com.sentinel.core.domain.ScopeType;

import java.util.Objects;
import java.util.UUID;

/**
 * Where an event happened. {@code scopeId} is the id strikes and restrictions are keyed by
 * (typically the creator's stream); {@code contentId} optionally names the message or post.
 */
public record ScopeContext(ScopeType scopeType, UUID scopeId, UUID contentId) {

    public ScopeContext {
        Objects.requireNonNull(scopeType, "scopeType");
        Objects.requireNonNull(scopeId, "scopeId");
    }

    public static ScopeContext stream(UUID streamId) {
        return new ScopeContext(ScopeType.STREAM, streamId, null);
    }

    public static ScopeContext profile(UUID userId) {
        return new ScopeContext(ScopeType.PROFILE, userId, null);
    }
}
