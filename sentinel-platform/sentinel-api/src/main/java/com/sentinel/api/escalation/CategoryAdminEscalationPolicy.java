package com.sentinel.api.escalation;

import com.sentinel.core.domain.ModeratorReviewItem;
import com.sentinel.core.domain.PolicyCategory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Escalates severe categories, and repeat offenders with at least two prior rejections.
 */
@Component
public class CategoryAdminEscalationPolicy implements AdminEscalationPolicy {

    public static final Set<PolicyCategory> TRIGGER_CATEGORIES = Set.of(
            PolicyCategory.HATE_SPEECH,
            PolicyCategory.THREAT,
            PolicyCategory.SEXUAL_CONTENT_MINORS,
            PolicyCategory.IMPERSONATION,
            PolicyCategory.RACISM);

    static final long REPEAT_OFFENDER_REJECTIONS = 2;

    @Override
    public boolean allowsEscalation(ModeratorReviewItem item, long priorRejections) {
        return TRIGGER_CATEGORIES.contains(item.getCategory()) || priorRejections >= REPEAT_OFFENDER_REJECTIONS;
    }
}
