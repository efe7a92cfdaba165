package com.companya.crm.service.flags.rules;

import com.companya.crm.model.FlagPriority;
import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.dto.FlagResult;

import java.util.*;

/**
 * Status flag for households with youth: an open youth or family membership,
 * or at least one child linked in the family graph.
 */
public class HasYouthRule extends AbstractFlagRule {

    public HasYouthRule() {
        super("has-youth", "Customer has youth in family/membership", FlagPriority.LOW);
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        List<String> reasons = new ArrayList<>();

        List<CustomerEvent> youthMemberships = input.getTimeline().openMemberships(input.getReferenceDate()).stream()
                .filter(e -> MembershipNames.isYouth(e.payloadString(CustomerTimeline.MEMBERSHIP_NAME)))
                .toList();
        if (!youthMemberships.isEmpty()) {
            reasons.add("youth/family membership: " + String.join(", ", ActiveMembershipRule.distinctNames(youthMemberships)));
        }
        if (!input.getChildCustomerIds().isEmpty()) {
            reasons.add("parent in family relationships");
        }
        if (reasons.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reasons", reasons);
        data.put("child_count", input.getChildCustomerIds().size());
        return flag(input, data);
    }
}
