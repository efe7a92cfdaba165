package com.companya.crm.service.flags.rules;

import com.companya.crm.model.FlagPriority;
import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.dto.FlagResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status flag for customers holding at least one open membership that is not a prepaid pass.
 */
public class ActiveMembershipRule extends AbstractFlagRule {

    public ActiveMembershipRule() {
        super("active-membership", "Customer has an active membership", FlagPriority.LOW);
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        List<CustomerEvent> memberships = input.getTimeline().openMemberships(input.getReferenceDate()).stream()
                .filter(e -> !MembershipNames.isPrepaidPass(e.payloadString(CustomerTimeline.MEMBERSHIP_NAME)))
                .toList();
        if (memberships.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("membership_count", memberships.size());
        data.put("membership_names", distinctNames(memberships));
        return flag(input, data);
    }

    static List<String> distinctNames(List<CustomerEvent> memberships) {
        return memberships.stream()
                .map(e -> e.payloadString(CustomerTimeline.MEMBERSHIP_NAME))
                .filter(name -> !name.isBlank())
                .distinct()
                .toList();
    }
}
