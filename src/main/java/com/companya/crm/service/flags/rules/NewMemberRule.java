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
 * Membership started in the last three days after at least six months without any membership activity.
 */
public class NewMemberRule extends AbstractFlagRule {

    public NewMemberRule() {
        super("new_member", "Customer is a new member (joined after 6+ months of no membership)", FlagPriority.HIGH);
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        LocalDateTime today = input.getReferenceDate();
        CustomerTimeline timeline = input.getTimeline();

        Optional<CustomerEvent> start = timeline.latest(MEMBERSHIP_STARTED, MEMBERSHIP_PURCHASE);
        if (start.isEmpty() || start.get().getEventDate().isBefore(today.minusDays(3))) {
            return Optional.empty();
        }
        LocalDateTime startedAt = start.get().getEventDate();

        List<CustomerEvent> priorActivity = timeline
                .ofTypes(MEMBERSHIP_STARTED, MEMBERSHIP_PURCHASE, MEMBERSHIP_RENEWAL, MEMBERSHIP_CANCELLED).stream()
                .filter(e -> e.getEventDate().isBefore(startedAt))
                .toList();
        LocalDateTime gapStart = startedAt.minusDays(180);
        boolean activeDuringGap = priorActivity.stream().anyMatch(e -> !e.getEventDate().isBefore(gapStart));
        if (activeDuringGap || recentlyFlagged(input, 14, 14)) {
            return Optional.empty();
        }

        Long daysSinceLastMembership = latestOf(priorActivity)
                .map(e -> daysBetween(e.getEventDate(), startedAt))
                .orElse(null);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("membership_start_date", startedAt.toString());
        data.put("days_since_start", daysBetween(startedAt, today));
        data.put("membership_name", start.get().payloadString(MEMBERSHIP_NAME));
        data.put("membership_id", start.get().payloadString(MEMBERSHIP_ID));
        data.put("is_first_time_member", priorActivity.isEmpty());
        data.put("days_since_last_membership", daysSinceLastMembership);
        return flag(input, data);
    }
}
