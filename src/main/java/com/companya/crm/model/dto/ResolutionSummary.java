package com.companya.crm.model.dto;

import com.companya.crm.model.MatchConfidence;

import java.util.Map;

public record ResolutionSummary(
    int recordsProcessed,
    int recordsDiscarded,
    int customersCreated,
    int totalCustomers,
    int identifiersAdded,
    Map<MatchConfidence, Long> confidenceCounts
) {}
