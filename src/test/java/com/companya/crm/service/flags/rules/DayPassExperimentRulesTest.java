package com.companya.crm.service.flags.rules;

import com.companya.crm.model.dto.FlagResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.companya.crm.service.flags.rules.CustomerTimeline.*;
import static com.companya.crm.service.flags.rules.TimelineFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Day-pass experiment rules")
class DayPassExperimentRulesTest {

    // alice@example.com hashes into group A, carol@example.com into group B
    private static final String GROUP_A_EMAIL = "alice@example.com";
    private static final String GROUP_B_EMAIL = "carol@example.com";

    private final AbGroupAssigner assigner = new AbGroupAssigner(Map.of());
    private final FirstTimeDayPassOfferRule groupARule = new FirstTimeDayPassOfferRule(assigner);
    private final SecondVisitOfferEligibleRule groupBRule = new SecondVisitOfferEligibleRule(assigner);

    @Nested
    @DisplayName("Entry rules")
    class EntryRules {

        @Test
        void firstVisitInGroupAEntersExperiment() {
            RuleInput input = inputFor(GROUP_A_EMAIL, null, Set.of(), dayPassCheckin(TODAY.minusDays(1)));

            FlagResult flag = groupARule.evaluate(input).orElseThrow();

            assertThat(flag.flagType()).isEqualTo("first_time_day_pass_2wk_offer");
            assertThat(flag.triggeredDate()).isEqualTo(TODAY);
            assertThat(flag.isExperimentEntry()).isTrue();
            assertThat(flag.flagData())
                    .containsEntry(FlagResult.AB_GROUP, "A")
                    .containsEntry(FlagResult.EXPERIMENT_ID, DayPassReturnRule.DAY_PASS_EXPERIMENT)
                    .containsEntry("total_day_pass_checkins", 1)
                    .containsEntry("returning_after_break", true)
                    .containsEntry("days_since_checkin", 1L);
            assertThat(groupBRule.evaluate(input)).isEmpty();
        }

        @Test
        void groupBGetsSecondVisitOfferInstead() {
            RuleInput input = inputFor(GROUP_B_EMAIL, null, Set.of(), dayPassCheckin(TODAY.minusDays(2)));

            assertThat(groupARule.evaluate(input)).isEmpty();
            assertThat(groupBRule.evaluate(input))
                    .map(FlagResult::flagData)
                    .hasValueSatisfying(data -> assertThat(data).containsEntry(FlagResult.AB_GROUP, "B"));
        }

        @Test
        void returningAfterLongBreakQualifies() {
            RuleInput input = inputFor(GROUP_A_EMAIL, null, Set.of(),
                    dayPassCheckin(TODAY.minusDays(91)),
                    dayPassCheckin(TODAY.minusDays(1)));

            FlagResult flag = groupARule.evaluate(input).orElseThrow();

            assertThat(flag.flagData())
                    .containsEntry("days_since_previous_checkin", 90L)
                    .containsEntry("returning_after_break", true);
        }

        @Test
        void recentRegularIsNotEligible() {
            RuleInput input = inputFor(GROUP_A_EMAIL, null, Set.of(),
                    dayPassCheckin(TODAY.minusDays(30)),
                    dayPassCheckin(TODAY.minusDays(1)));

            assertThat(groupARule.evaluate(input)).isEmpty();
        }

        @Test
        void staleCheckinIsNotEligible() {
            RuleInput input = inputFor(GROUP_A_EMAIL, null, Set.of(), dayPassCheckin(TODAY.minusDays(4)));

            assertThat(groupARule.evaluate(input)).isEmpty();
        }

        @Test
        void activeMemberIsNotEligible() {
            RuleInput input = inputFor(GROUP_A_EMAIL, null, Set.of(),
                    event(MEMBERSHIP_PURCHASE, TODAY.minusDays(300)),
                    dayPassCheckin(TODAY.minusDays(1)));

            assertThat(groupARule.evaluate(input)).isEmpty();
        }

        @Test
        void previouslyFlaggedOrSyncedIsNotEligible() {
            RuleInput flagged = inputFor(GROUP_A_EMAIL, null, Set.of(),
                    flagSet("first_time_day_pass_2wk_offer", TODAY.minusDays(170)),
                    dayPassCheckin(TODAY.minusDays(1)));
            RuleInput synced = inputFor(GROUP_A_EMAIL, null, Set.of(),
                    event(FLAG_SYNCED, TODAY.minusDays(20), "flag_type", "first_time_day_pass_2wk_offer"),
                    dayPassCheckin(TODAY.minusDays(1)));

            assertThat(groupARule.evaluate(flagged)).isEmpty();
            assertThat(groupARule.evaluate(synced)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Second visit 2-week offer")
    class SecondVisitFollowUp {

        private final SecondVisitTwoWeekOfferRule rule = new SecondVisitTwoWeekOfferRule();

        @Test
        void returnAfterOfferTriggersTwoWeekOffer() {
            RuleInput input = input(
                    flagSet(SecondVisitOfferEligibleRule.FLAG_TYPE, TODAY.minusDays(10)),
                    event(CHECKIN, TODAY.minusDays(4)),
                    event(CHECKIN, TODAY.minusDays(1)));

            FlagResult flag = rule.evaluate(input).orElseThrow();

            assertThat(flag.flagType()).isEqualTo("second_visit_2wk_offer");
            assertThat(flag.flagData())
                    .containsEntry(FlagResult.AB_GROUP, "B")
                    .containsEntry("days_to_return", 6L)
                    .containsEntry("total_checkins_after_flag", 2);
        }

        @Test
        void noReturnVisitMeansNoFlag() {
            RuleInput input = input(
                    event(CHECKIN, TODAY.minusDays(12)),
                    flagSet(SecondVisitOfferEligibleRule.FLAG_TYPE, TODAY.minusDays(10)));

            assertThat(rule.evaluate(input)).isEmpty();
        }

        @Test
        void withoutEarlierOfferNothingHappens() {
            assertThat(rule.evaluate(input(event(CHECKIN, TODAY.minusDays(1))))).isEqualTo(Optional.empty());
        }
    }
}
