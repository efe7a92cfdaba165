package com.companya.crm.service.flags.rules;

import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Ordered set of active rules. Evaluation order is registration order.
 */
@Slf4j
public class FlagRuleRegistry {

    private final List<FlagRule> rules;

    public FlagRuleRegistry(List<FlagRule> rules) {
        Set<String> flagTypes = new HashSet<>();
        for (FlagRule rule : rules) {
            if (!flagTypes.add(rule.getFlagType())) {
                throw new IllegalStateException("Duplicate flag rule registered: " + rule.getFlagType());
            }
        }
        this.rules = List.copyOf(rules);
        log.info("Registered {} flag rules: {}", this.rules.size(), flagTypes());
    }

    public List<FlagRule> getRules() {
        return rules;
    }

    public List<String> flagTypes() {
        return rules.stream().map(FlagRule::getFlagType).toList();
    }

    public Optional<FlagRule> findByFlagType(String flagType) {
        return rules.stream().filter(rule -> rule.getFlagType().equals(flagType)).findFirst();
    }
}
