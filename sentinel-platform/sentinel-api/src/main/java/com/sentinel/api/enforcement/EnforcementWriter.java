package com.sentinel.api.enforcement;

import com.sentinel.api.audit.ModerationAuditService;
import com.sentinel.api.classifier.ClassificationScore;
import com.sentinel.api.policy.DecisionPolicy;
import com.sentinel.api.policy.ScopeContext;
import com.sentinel.api.strike.StrikeLedgerService;
import com.sentinel.core.domain.ModerationAction;
import com.sentinel.core.domain.ModerationAuditEntry.EventType;
import com.sentinel.core.domain.PolicyCategory;
import com.sentinel.core.domain.ScopeRestriction;
import com.sentinel.core.domain.ScopeRestriction.RestrictionSource;
import com.sentinel.core.domain.Strike;
import com.sentinel.core.domain.Violation;
import com.sentinel.core.repository.ViolationRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Persists everything one enforcement decision implies in a single transaction:
 * the violation, its restriction and, for repeat-offence categories, the strike.
 */
@Component
public class EnforcementWriter {

    private final ViolationRepository violationRepository;
    private final RestrictionService restrictionService;
    private final StrikeLedgerService strikeLedgerService;
    private final ModerationAuditService auditService;
    private final Clock clock;

    public EnforcementWriter(
            ViolationRepository violationRepository,
            RestrictionService restrictionService,
            StrikeLedgerService strikeLedgerService,
            ModerationAuditService auditService,
            Clock clock) {
        this.violationRepository = violationRepository;
        this.restrictionService = restrictionService;
        this.strikeLedgerService = strikeLedgerService;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public Written write(UUID userId, String content, ClassificationScore score,
                         ModerationAction action, ScopeContext context) {
        PolicyCategory category = score.dominantPolicyCategory();
        Violation violation = violationRepository.save(Violation.create(
                userId,
                context.scopeType(),
                context.scopeId(),
                context.contentId(),
                content,
                score.categoryScores(),
                score.overall(),
                action,
                category,
                clock.instant()));
        auditService.recordSystem(EventType.VIOLATION_RECORDED, userId, violation.getId(), "Violation",
                action + " " + category + " overall=" + String.format("%.3f", score.overall()));

        String reason = "Automated " + action.name().toLowerCase() + " for " + describe(category);
        ScopeRestriction restriction = switch (action) {
            case TIMEOUT -> restrictionService.applyTimeout(userId, context.scopeId(), DecisionPolicy.POLICY_TIMEOUT,
                    RestrictionSource.AI_POLICY, reason, violation.getId(), null);
            case BLOCK -> restrictionService.applyBlock(userId, context.scopeId(), null,
                    RestrictionSource.AI_POLICY, reason, violation.getId(), null);
            default -> null;
        };

        Strike strike = null;
        if (action.isAtLeast(ModerationAction.TIMEOUT) && category.isRepeatOffence()) {
            strike = strikeLedgerService.applyStrike(userId, context.scopeId(), category, reason,
                    true, violation.getId());
        }
        return new Written(violation, restriction, strike);
    }

    static String describe(PolicyCategory category) {
        return category.name().toLowerCase().replace('_', ' ');
    }

    public record Written(Violation violation, ScopeRestriction restriction, Strike strike) {}
}
