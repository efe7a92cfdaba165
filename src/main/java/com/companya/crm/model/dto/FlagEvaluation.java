package com.companya.crm.model.dto;

import com.companya.crm.model.domain.CustomerFlag;
import com.companya.crm.model.domain.ExperimentEntry;

import java.util.List;

/**
 * Output of one batch evaluation, before merging with previously persisted flags.
 */
public record FlagEvaluation(
    List<CustomerFlag> flags,
    List<ExperimentEntry> experimentEntries,
    int customersEvaluated,
    int customersFlagged
) {
    public static FlagEvaluation empty() {
        return new FlagEvaluation(List.of(), List.of(), 0, 0);
    }
}
