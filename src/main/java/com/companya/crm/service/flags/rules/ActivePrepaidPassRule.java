package com.companya.crm.service.flags.rules;

import com.companya.crm.model.FlagPriority;
import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.dto.FlagResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ActivePrepaidPassRule extends AbstractFlagRule {

    public ActivePrepaidPassRule() {
        super("active-prepaid-pass", "Customer has an active prepaid pass (2-week pass, etc.)", FlagPriority.LOW);
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        List<CustomerEvent> passes = input.getTimeline().openMemberships(input.getReferenceDate()).stream()
                .filter(e -> MembershipNames.isPrepaidPass(e.payloadString(CustomerTimeline.MEMBERSHIP_NAME)))
                .toList();
        if (passes.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("pass_count", passes.size());
        data.put("pass_names", ActiveMembershipRule.distinctNames(passes));
        return flag(input, data);
    }
}
