package com.companya.crm.service.flags.rules;

import com.companya.crm.model.FlagPriority;
import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.dto.FlagResult;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.companya.crm.service.flags.rules.CustomerTimeline.*;

/**
 * Day pass bought in the last two weeks by someone who never held a membership.
 */
public class ReadyForMembershipRule extends AbstractFlagRule {

    public ReadyForMembershipRule() {
        super("ready_for_membership",
                "Customer purchased day pass(es) in last 2 weeks but has no membership",
                FlagPriority.HIGH);
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        LocalDateTime today = input.getReferenceDate();
        CustomerTimeline timeline = input.getTimeline();

        List<CustomerEvent> recentDayPasses = timeline.between(today.minusDays(14), today, DAY_PASS_PURCHASE);
        if (recentDayPasses.isEmpty() || !timeline.ofTypes(MEMBERSHIP_PURCHASE, MEMBERSHIP_RENEWAL).isEmpty()) {
            return Optional.empty();
        }

        CustomerEvent mostRecent = latestOf(recentDayPasses).orElseThrow();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("day_pass_count_last_14_days", recentDayPasses.size());
        data.put("most_recent_day_pass_date", mostRecent.getEventDate().toString());
        data.put("days_since_last_pass", daysBetween(mostRecent.getEventDate(), today));
        return flag(input, data);
    }
}
