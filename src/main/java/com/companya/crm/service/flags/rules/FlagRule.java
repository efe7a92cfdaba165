package com.companya.crm.service.flags.rules;

import com.companya.crm.model.FlagPriority;
import com.companya.crm.model.dto.FlagResult;

import java.util.Optional;

/**
 * A business rule that inspects one customer's timeline and may emit a flag.
 * Implementations are stateless and read only the {@link RuleInput} fields they need.
 */
public interface FlagRule {

    String getFlagType();

    String getDescription();

    FlagPriority getPriority();

    Optional<FlagResult> evaluate(RuleInput input);
}
