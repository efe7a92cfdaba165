package com.companya.crm.service.flags.rules;

import com.companya.crm.model.domain.CustomerEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.companya.crm.service.flags.rules.CustomerTimeline.*;
import static com.companya.crm.service.flags.rules.TimelineFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CustomerTimeline Tests")
class CustomerTimelineTest {

    @Test
    void activeMember_dependsOnLatestMembershipEvent() {
        assertThat(input(event(MEMBERSHIP_PURCHASE, TODAY.minusDays(40))).getTimeline().isActiveMember()).isTrue();
        assertThat(input(
                event(MEMBERSHIP_PURCHASE, TODAY.minusDays(40)),
                event(MEMBERSHIP_CANCELLED, TODAY.minusDays(5))).getTimeline().isActiveMember()).isFalse();
        assertThat(input(event(CHECKIN, TODAY)).getTimeline().isActiveMember()).isFalse();
    }

    @Test
    void flaggedWithin_includesBothWindowEnds() {
        CustomerTimeline timeline = input(
                flagSet("new_member", TODAY.minusDays(14)),
                flagSet("ready_for_membership", TODAY.minusDays(15))).getTimeline();

        assertThat(timeline.flaggedWithin("new_member", 14, TODAY)).isTrue();
        assertThat(timeline.flaggedWithin("ready_for_membership", 14, TODAY)).isFalse();
        assertThat(timeline.flaggedWithin("ready_for_membership", 15, TODAY)).isTrue();
    }

    @Test
    void syncedWithin_readsDownstreamSyncEvents() {
        CustomerTimeline timeline = input(event(FLAG_SYNCED, TODAY.minusDays(3), "flag_type", "new_member")).getTimeline();

        assertThat(timeline.syncedWithin("new_member", 14, TODAY)).isTrue();
        assertThat(timeline.flaggedWithin("new_member", 14, TODAY)).isFalse();
    }

    @Test
    void dayPassCheckins_matchEntryMethodCaseInsensitively() {
        CustomerTimeline timeline = input(
                dayPassCheckin(TODAY.minusDays(2)),
                event(CHECKIN, TODAY.minusDays(1), "entry_method_description", "Member Scan"),
                event(CHECKIN, TODAY, "entry_method_description", "DAY PASS")).getTimeline();

        assertThat(timeline.dayPassCheckins()).hasSize(2);
    }

    @Test
    void openMemberships_honourCancellationAndEndDate() {
        CustomerTimeline timeline = input(
                membership(MEMBERSHIP_STARTED, TODAY.minusDays(100), "m1", "Adult Monthly"),
                membership(MEMBERSHIP_CANCELLED, TODAY.minusDays(10), "m1", "Adult Monthly"),
                event(MEMBERSHIP_STARTED, TODAY.minusDays(20), MEMBERSHIP_ID, "m2",
                        MEMBERSHIP_NAME, "2-Week Climbing Pass", END_DATE, "2026-03-01"),
                event(MEMBERSHIP_STARTED, TODAY.minusDays(5), MEMBERSHIP_ID, "m3",
                        MEMBERSHIP_NAME, "Family Annual", END_DATE, "2027-03-05")).getTimeline();

        List<CustomerEvent> open = timeline.openMemberships(TODAY);

        assertThat(open).extracting(e -> e.payloadString(MEMBERSHIP_ID)).containsExactly("m3");
    }

    @Test
    void latest_prefersEarliestListedOnTies() {
        CustomerEvent cancelled = event(MEMBERSHIP_CANCELLED, TODAY.minusDays(1));
        CustomerEvent renewed = event(MEMBERSHIP_RENEWAL, TODAY.minusDays(1));

        assertThat(input(cancelled, renewed).getTimeline().latest(MEMBERSHIP_CANCELLED, MEMBERSHIP_RENEWAL))
                .containsSame(cancelled);
    }
}
