package com.companya.crm.service.flags.rules;

import com.companya.crm.model.FlagPriority;
import com.companya.crm.model.dto.FlagResult;
import lombok.Getter;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;

@Getter
public abstract class AbstractFlagRule implements FlagRule {

    private final String flagType;
    private final String description;
    private final FlagPriority priority;

    protected AbstractFlagRule(String flagType, String description, FlagPriority priority) {
        this.flagType = flagType;
        this.description = description;
        this.priority = priority;
    }

    /**
     * Builds the flag triggered at the reference date. The rule description is appended to the data.
     */
    protected Optional<FlagResult> flag(RuleInput input, Map<String, Object> flagData) {
        flagData.put("description", description);
        return Optional.of(new FlagResult(input.getCustomerId(), flagType, input.getReferenceDate(), flagData, priority));
    }

    /**
     * True when this rule's flag was written back or synced downstream inside the given windows.
     */
    protected boolean recentlyFlagged(RuleInput input, int flaggedDays, int syncedDays) {
        CustomerTimeline timeline = input.getTimeline();
        return timeline.flaggedWithin(flagType, flaggedDays, input.getReferenceDate())
                || timeline.syncedWithin(flagType, syncedDays, input.getReferenceDate());
    }

    protected static long daysBetween(LocalDateTime from, LocalDateTime to) {
        return ChronoUnit.DAYS.between(from, to);
    }
}
