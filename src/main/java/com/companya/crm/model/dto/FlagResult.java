package com.companya.crm.model.dto;

import com.companya.crm.model.FlagPriority;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A flag emitted by one rule for one customer during an evaluation run.
 */
public record FlagResult(
    String customerId,
    String flagType,
    LocalDateTime triggeredDate,
    Map<String, Object> flagData,
    FlagPriority priority
) {
    public static final String CHILD_SUFFIX = "_child";
    public static final String USING_PARENT_CONTACT = "is_using_parent_contact";
    public static final String EXPERIMENT_ID = "experiment_id";
    public static final String AB_GROUP = "ab_group";

    public FlagResult {
        flagData = flagData != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(flagData))
                : Collections.emptyMap();
    }

    /**
     * Copy addressed to the parent whose contact details stand in for this customer.
     */
    public FlagResult addressedToParent() {
        Map<String, Object> data = new LinkedHashMap<>(flagData);
        data.put(USING_PARENT_CONTACT, true);
        return new FlagResult(customerId, flagType + CHILD_SUFFIX, triggeredDate, data, priority);
    }

    public boolean isExperimentEntry() {
        return flagData.get(EXPERIMENT_ID) != null && flagData.get(AB_GROUP) != null;
    }
}
