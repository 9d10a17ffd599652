package com.sentinel.api.appeal;

import com.sentinel.core.domain.AdminPenalty;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.Strike;
import com.sentinel.core.domain.Violation;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Hard denylist of enforcement that cannot be appealed: permanent penalties and
 * level 4 strikes issued for the denylisted categories.
 */
@Component
public class NonAppealablePolicy {

    public static final Set<PolicyCategory> DENYLISTED_CATEGORIES = Set.of(PolicyCategory.SEXUAL_CONTENT_MINORS);

    static final String APPEAL_HINT = " If you believe this is a mistake, you can appeal from your account settings.";

    public boolean isAppealable(AdminPenalty penalty) {
        return !(penalty.getSeverity() == AdminPenalty.Severity.PERMANENT
                && DENYLISTED_CATEGORIES.contains(penalty.getCategory()));
    }

    public boolean isAppealable(Strike strike) {
        return !(strike.isPermanent() && DENYLISTED_CATEGORIES.contains(strike.getType()));
    }

    public boolean isAppealable(Violation violation) {
        return !DENYLISTED_CATEGORIES.contains(violation.getCategory());
    }

    /**
     * Appends the appeal path to a user-facing message when the category allows it.
     */
    public String withAppealHint(String message, PolicyCategory category, boolean permanent) {
        if (permanent && DENYLISTED_CATEGORIES.contains(category)) {
            return message;
        }
        return message + APPEAL_HINT;
    }
}
