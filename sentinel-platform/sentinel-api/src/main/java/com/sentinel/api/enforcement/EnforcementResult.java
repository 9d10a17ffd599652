package com.sentinel.api.enforcement;

import com.sentinel.api.classifier.ClassificationScore;
import com.sentinel.core.domain.ModerationAction;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.Strike;

import java.util.UUID;

/**
 * What enforcing one event did.
 *
 * @param allowed          true when the content stays visible to others
 * @param violationId      null for ALLOW and for events refused before classification
 * @param strike           strike issued for this event, if any
 * @param restriction      timeout or block applied for this event, if any
 * @param escalationQueued true when a review item exists for the violation
 * @param notified         true when the user was told about the action
 * @param degraded         true when the classifier failed open
 * @param reason           user-facing explanation, null when allowed
 */
public record EnforcementResult(
        boolean allowed,
        ModerationAction action,
        ClassificationScore scores,
        UUID violationId,
        Strike strike,
        ScopeRestriction restriction,
        boolean escalationQueued,
        boolean notified,
        boolean degraded,
        String reason
) {

    static EnforcementResult allow(ClassificationScore scores, boolean degraded) {
        return new EnforcementResult(true, ModerationAction.ALLOW, scores, null, null, null,
                false, false, degraded, null);
    }

    /**
     * The user may not post in the scope at all; nothing was classified or written.
     */
    public static EnforcementResult refused(ModerationAction action, String reason) {
        return new EnforcementResult(false, action, ClassificationScore.zero(), null, null, null,
                false, false, false, reason);
    }
}
