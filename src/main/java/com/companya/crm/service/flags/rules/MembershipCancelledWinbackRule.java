package com.companya.crm.service.flags.rules;

import com.companya.crm.model.FlagPriority;
import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.dto.FlagResult;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.companya.crm.service.flags.rules.CustomerTimeline.*;

/**
 * A cancellation in the last week that was not a plan switch and left no other membership running.
 */
public class MembershipCancelledWinbackRule extends AbstractFlagRule {

    public MembershipCancelledWinbackRule() {
        super("membership_cancelled_winback", "Recently cancelled member eligible for win-back outreach",
                FlagPriority.HIGH);
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        LocalDateTime today = input.getReferenceDate();
        CustomerTimeline timeline = input.getTimeline();

        Optional<CustomerEvent> cancellation = timeline.latest(MEMBERSHIP_CANCELLED);
        if (cancellation.isEmpty() || cancellation.get().getEventDate().isBefore(today.minusDays(7))) {
            return Optional.empty();
        }
        LocalDateTime cancelledAt = cancellation.get().getEventDate();

        boolean switchedPlan = timeline.ofTypes(MEMBERSHIP_PURCHASE, MEMBERSHIP_RENEWAL, MEMBERSHIP_STARTED).stream()
                .anyMatch(e -> e.getEventDate().isAfter(cancelledAt));
        boolean lastWordIsCancellation = timeline
                .latest(MEMBERSHIP_PURCHASE, MEMBERSHIP_RENEWAL, MEMBERSHIP_CANCELLED, MEMBERSHIP_STARTED)
                .map(e -> MEMBERSHIP_CANCELLED.equals(e.getEventType()))
                .orElse(true);
        if (switchedPlan || !lastWordIsCancellation || recentlyFlagged(input, 180, 30)) {
            return Optional.empty();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("cancellation_date", cancelledAt.toString());
        data.put("days_since_cancellation", daysBetween(cancelledAt, today));
        data.put("cancelled_membership_name", cancellation.get().payloadString(MEMBERSHIP_NAME));
        data.put("cancelled_membership_id", cancellation.get().payloadString(MEMBERSHIP_ID));
        data.put("total_cancellations", timeline.ofTypes(MEMBERSHIP_CANCELLED).size());
        return flag(input, data);
    }
}
