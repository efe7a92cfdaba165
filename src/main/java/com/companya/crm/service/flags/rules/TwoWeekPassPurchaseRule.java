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

public class TwoWeekPassPurchaseRule extends AbstractFlagRule {

    public TwoWeekPassPurchaseRule() {
        super("2_week_pass_purchase", "Customer purchased a 2-week climbing or fitness pass", FlagPriority.MEDIUM);
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        LocalDateTime today = input.getReferenceDate();
        CustomerTimeline timeline = input.getTimeline();

        List<CustomerEvent> passes = timeline.ofTypes(MEMBERSHIP_STARTED).stream()
                .filter(e -> MembershipNames.isPrepaidPass(e.payloadString(MEMBERSHIP_NAME)))
                .toList();
        if (passes.isEmpty() || timeline.flaggedWithin(getFlagType(), 14, today)) {
            return Optional.empty();
        }

        CustomerEvent latestPass = latestOf(passes).orElseThrow();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("membership_start_date", latestPass.getEventDate().toString());
        data.put("days_since_start", daysBetween(latestPass.getEventDate(), today));
        data.put("membership_name", latestPass.payloadString(MEMBERSHIP_NAME));
        data.put("membership_id", latestPass.payloadString(MEMBERSHIP_ID));
        data.put("end_date", latestPass.payloadString(END_DATE));
        data.put("billing_amount", latestPass.getPayload().getOrDefault("billing_amount", 0));
        data.put("total_2wk_memberships", passes.size());
        return flag(input, data);
    }
}
