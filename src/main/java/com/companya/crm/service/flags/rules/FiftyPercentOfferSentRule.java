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
 * Records that a 50%-off offer email went out, so the offer is not repeated within a month.
 */
public class FiftyPercentOfferSentRule extends AbstractFlagRule {

    private static final List<String> COPIED_FIELDS = List.of(
            "campaign_title", "offer_amount", "offer_type", "offer_code",
            "offer_expires", "offer_description", "email_subject");

    public FiftyPercentOfferSentRule() {
        super("fifty_percent_offer_sent", "Customer received email with 50% off offer", FlagPriority.MEDIUM);
    }

    @Override
    public Optional<FlagResult> evaluate(RuleInput input) {
        LocalDateTime today = input.getReferenceDate();
        CustomerTimeline timeline = input.getTimeline();

        List<CustomerEvent> offers = timeline.between(today.minusDays(3), today, CustomerTimeline.EMAIL_SENT).stream()
                .filter(e -> e.payloadString("offer_amount").contains("50%"))
                .toList();
        if (offers.isEmpty() || timeline.flaggedWithin(getFlagType(), 30, today)) {
            return Optional.empty();
        }

        CustomerEvent email = CustomerTimeline.latestOf(offers).orElseThrow();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("email_sent_date", email.getEventDate().toString());
        COPIED_FIELDS.forEach(field -> data.put(field, email.payloadString(field)));
        data.put("days_since_email", daysBetween(email.getEventDate(), today));
        return flag(input, data);
    }
}
