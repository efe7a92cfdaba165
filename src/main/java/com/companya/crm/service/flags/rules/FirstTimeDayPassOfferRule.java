package com.companya.crm.service.flags.rules;

/**
 * Group A arm: offer the 2-week pass straight away.
 */
public class FirstTimeDayPassOfferRule extends DayPassReturnRule {

    public FirstTimeDayPassOfferRule(AbGroupAssigner abGroupAssigner) {
        super("first_time_day_pass_2wk_offer",
                "[Group A] Customer eligible for 2-week membership offer (first-time or returning after 2+ month break)",
                abGroupAssigner, AbGroupAssigner.GROUP_A);
    }
}
