package com.companya.crm.model.dto;

import java.time.LocalDateTime;

public record FlagRunSummary(
    LocalDateTime referenceDate,
    int customersEvaluated,
    int customersFlagged,
    int newFlags,
    int activeFlags,
    int expiredFlags,
    int flagSetEvents,
    int experimentEntries
) {}
