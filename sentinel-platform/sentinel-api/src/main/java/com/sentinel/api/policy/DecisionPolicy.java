package com.sentinel.api.policy;

import com.sentinel.core.domain.ModerationAction;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Maps an overall risk score to an enforcement action.
 *
 * <pre>
 * [0.00, 0.30)  ALLOW
 * [0.30, 0.50)  FLAG      logged, not hidden
 * [0.50, 0.60)  HIDE      hidden from others, sender notified
 * [0.60, 0.70)  ESCALATE  hidden pending moderator review
 * [0.70, 0.85)  TIMEOUT   2 minutes in the scope
 * [0.85, 1.00]  BLOCK     removed from the scope
 * </pre>
 *
 * Escalation is confined to [0.60, 0.70) so a higher score can never land on a
 * milder action than a lower one. The bands are the same for every scope type.
 */
@Component
public class DecisionPolicy {

    public static final double FLAG_THRESHOLD = 0.30;
    public static final double HIDE_THRESHOLD = 0.50;
    public static final double ESCALATE_THRESHOLD = 0.60;
    public static final double TIMEOUT_THRESHOLD = 0.70;
    public static final double BLOCK_THRESHOLD = 0.85;

    public static final Duration POLICY_TIMEOUT = Duration.ofMinutes(2);

    public ModerationAction decide(double overall, ScopeContext context) {
        double score = normalize(overall);
        if (score >= BLOCK_THRESHOLD) return ModerationAction.BLOCK;
        if (score >= TIMEOUT_THRESHOLD) return ModerationAction.TIMEOUT;
        if (score >= ESCALATE_THRESHOLD) return ModerationAction.ESCALATE;
        if (score >= HIDE_THRESHOLD) return ModerationAction.HIDE;
        if (score >= FLAG_THRESHOLD) return ModerationAction.FLAG;
        return ModerationAction.ALLOW;
    }

    /**
     * Clamps into [0,1]; NaN counts as zero.
     */
    static double normalize(double overall) {
        if (Double.isNaN(overall) || overall < 0.0) {
            return 0.0;
        }
        return Math.min(overall, 1.0);
    }
}
