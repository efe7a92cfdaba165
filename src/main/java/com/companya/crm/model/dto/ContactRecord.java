package com.companya.crm.model.dto;

import java.time.LocalDateTime;

/**
 * One raw contact observation from an upstream system, before normalization.
 * email, phone and name may be null or malformed.
 */
public record ContactRecord(
    String email,
    String phone,
    String name,
    String source,
    String sourceRecordId,
    LocalDateTime firstSeen
) {}
