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
 * Group B arm, step two: the customer came back after the second-visit offer,
 * so offer the 2-week pass.
 */
public class SecondVisitTwoWeekOfferRule extends AbstractFlagRule {

    public SecondVisitTwoWeekOfferRule() {
        super("second_visit_2wk_offer",
                "[Group B - Step 2] Customer returned after 2nd pass offer, eligible for 2-week membership",
                FlagPriority.HIGH);
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        CustomerTimeline timeline = input.getTimeline();
        Optional<CustomerEvent> offer = CustomerTimeline.latestOf(
                timeline.flagSets(SecondVisitOfferEligibleRule.FLAG_TYPE));
        if (offer.isEmpty()) {
            return Optional.empty();
        }

        LocalDateTime offerDate = offer.get().getEventDate();
        List<CustomerEvent> returnVisits = timeline.ofTypes(CustomerTimeline.CHECKIN).stream()
                .filter(e -> e.getEventDate().isAfter(offerDate))
                .toList();
        if (returnVisits.isEmpty() || timeline.isActiveMember()
                || recentlyFlagged(input, DayPassReturnRule.FLAG_LOOKBACK_DAYS, DayPassReturnRule.SYNC_LOOKBACK_DAYS)) {
            return Optional.empty();
        }

        LocalDateTime firstReturn = returnVisits.get(0).getEventDate();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(FlagResult.AB_GROUP, AbGroupAssigner.GROUP_B);
        data.put(FlagResult.EXPERIMENT_ID, DayPassReturnRule.DAY_PASS_EXPERIMENT);
        data.put("second_pass_flag_date", offerDate.toString());
        data.put("return_visit_date", firstReturn.toString());
        data.put("days_to_return", daysBetween(offerDate, firstReturn));
        data.put("total_checkins_after_flag", returnVisits.size());
        return flag(input, data);
    }
}
