package com.companya.crm.service.flags.rules;

import com.companya.crm.model.FlagPriority;
import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.dto.FlagResult;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the day-pass conversion experiment: a day-pass visitor who is new,
 * or back after at least two months, and belongs to this rule's A/B group.
 */
public abstract class DayPassReturnRule extends AbstractFlagRule {

    public static final String DAY_PASS_EXPERIMENT = "day_pass_conversion_2026_02";

    static final int RECENT_CHECKIN_DAYS = 3;
    static final int BREAK_DAYS = 60;
    static final int FLAG_LOOKBACK_DAYS = 180;
    static final int SYNC_LOOKBACK_DAYS = 30;

    private final AbGroupAssigner abGroupAssigner;
    private final String abGroup;

    protected DayPassReturnRule(String flagType, String description, AbGroupAssigner abGroupAssigner, String abGroup) {
        super(flagType, description, FlagPriority.HIGH);
        this.abGroupAssigner = abGroupAssigner;
        this.abGroup = abGroup;
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        if (!abGroup.equals(abGroupAssigner.assign(input.getCustomerId(), input.getEmail(), input.getPhone()))) {
            return Optional.empty();
        }

        LocalDateTime today = input.getReferenceDate();
        CustomerTimeline timeline = input.getTimeline();
        List<CustomerEvent> checkins = timeline.dayPassCheckins();
        if (checkins.isEmpty()) {
            return Optional.empty();
        }

        CustomerEvent mostRecent = checkins.get(checkins.size() - 1);
        LocalDateTime lastVisit = mostRecent.getEventDate();
        if (lastVisit.isBefore(today.minusDays(RECENT_CHECKIN_DAYS))) {
            return Optional.empty();
        }

        LocalDateTime breakStart = lastVisit.minusDays(BREAK_DAYS);
        boolean visitedDuringBreak = checkins.stream()
                .anyMatch(e -> e.getEventDate().isBefore(lastVisit) && !e.getEventDate().isBefore(breakStart));
        if (visitedDuringBreak || timeline.isActiveMember()
                || recentlyFlagged(input, FLAG_LOOKBACK_DAYS, SYNC_LOOKBACK_DAYS)) {
            return Optional.empty();
        }

        Long daysSincePrevious = checkins.size() > 1
                ? daysBetween(checkins.get(checkins.size() - 2).getEventDate(), lastVisit)
                : null;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put(FlagResult.AB_GROUP, abGroup);
        data.put(FlagResult.EXPERIMENT_ID, DAY_PASS_EXPERIMENT);
        data.put("most_recent_checkin_date", lastVisit.toString());
        data.put("days_since_checkin", daysBetween(lastVisit, today));
        data.put("total_day_pass_checkins", checkins.size());
        data.put("days_since_previous_checkin", daysSincePrevious);
        data.put("returning_after_break", daysSincePrevious == null || daysSincePrevious >= BREAK_DAYS);
        return flag(input, data);
    }
}
