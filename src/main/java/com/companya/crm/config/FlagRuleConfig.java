package com.companya.crm.config;

import com.companya.crm.service.flags.PersistentFlagPolicy;
import com.companya.crm.service.flags.rules.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Slf4j
@Configuration
public class FlagRuleConfig {

    @Bean
    public AbGroupAssigner abGroupAssigner(@Value("#{${app.flags.ab-group-overrides:{:}}}") Map<String, String> overrides) {
        return new AbGroupAssigner(overrides);
    }

    /**
     * Active rules in evaluation order.
     */
    @Bean
    public FlagRuleRegistry flagRuleRegistry(AbGroupAssigner abGroupAssigner) {
        return new FlagRuleRegistry(List.of(
                new ReadyForMembershipRule(),
                new FirstTimeDayPassOfferRule(abGroupAssigner),
                new SecondVisitOfferEligibleRule(abGroupAssigner),
                new SecondVisitTwoWeekOfferRule(),
                new TwoWeekPassPurchaseRule(),
                new FiftyPercentOfferSentRule(),
                new MembershipCancelledWinbackRule(),
                new NewMemberRule(),
                new ActiveMembershipRule(),
                new ActivePrepaidPassRule(),
                new HasYouthRule()
        ));
    }

    @Bean
    public PersistentFlagPolicy persistentFlagPolicy(
            @Value("${app.flags.persistent-types:active-membership,active-prepaid-pass,has-youth}") List<String> persistentTypes) {
        log.info("Persistent flag types: {}", persistentTypes);
        return new PersistentFlagPolicy(persistentTypes);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
