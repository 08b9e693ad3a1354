package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.scoring.model.RiskFactor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Payment-domain rule engine.
 *
 * <p>Every rule is evaluated on every call; the resulting floor is the
 * maximum over the rules that fired, so one rule never hides another's
 * factor. Stateless and thread-safe.
 */
@Slf4j
@Component
public class HeuristicRuleEngine {

    private final List<HeuristicRule> rules;

    public HeuristicRuleEngine() {
        this(PaymentRuleTable.rules());
    }

    public HeuristicRuleEngine(List<HeuristicRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public HeuristicAssessment evaluate(TransactionRecord record, double errorBalanceOrg) {
        double floor = 0.0;
        List<RiskFactor> factors = new ArrayList<>();
        for (HeuristicRule rule : rules) {
            Optional<RiskFactor> factor = rule.evaluate(record, errorBalanceOrg);
            if (factor.isPresent()) {
                log.debug("Rule {} fired: {}", rule.id(), factor.get().getDescription());
                factors.add(factor.get());
                floor = Math.max(floor, rule.probabilityFloor());
            }
        }
        return new HeuristicAssessment(floor, List.copyOf(factors));
    }

    public List<HeuristicRule> rules() {
        return rules;
    }
}
