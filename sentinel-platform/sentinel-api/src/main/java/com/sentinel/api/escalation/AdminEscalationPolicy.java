package com.sentinel.api.escalation;

import com.sentinel.core.domain.ModeratorReviewItem;

/**
 * Decides whether a moderator may hand a review item to admins.
 */
public interface AdminEscalationPolicy {

    /**
     * @param priorRejections review items previously rejected for the same user
     */
    boolean allowsEscalation(ModeratorReviewItem item, long priorRejections);
}
