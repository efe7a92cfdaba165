package com.companya.crm.service.flags.rules;

/**
 * Group B arm, step one: offer a half-price second visit.
 */
public class SecondVisitOfferEligibleRule extends DayPassReturnRule {

    public static final String FLAG_TYPE = "second_visit_offer_eligible";

    public SecondVisitOfferEligibleRule(AbGroupAssigner abGroupAssigner) {
        super(FLAG_TYPE,
                "[Group B] Customer eligible for half-price second visit offer (returning after 2+ month break)",
                abGroupAssigner, AbGroupAssigner.GROUP_B);
    }
}
