package com.companya.crm.service.flags.rules;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Everything a rule may consult for one customer. Email and phone are the resolved
 * contact details and may belong to a parent.
 */
@Value
@Builder
public class RuleInput {

    String customerId;
    CustomerTimeline timeline;
    LocalDateTime referenceDate;
    String email;
    String phone;
    @Builder.Default
    Set<String> childCustomerIds = Set.of();
}
