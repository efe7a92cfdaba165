package com.companya.crm.service.flags.rules;

import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.util.TimestampUtils;

import java.time.LocalDateTime;
import java.util.*;

/**
 * One customer's events in ascending date order, with the look-ups the flag rules share.
 * Every event is expected to carry a date; the engine drops undated events beforehand.
 */
public class CustomerTimeline {

    public static final String CHECKIN = "checkin";
    public static final String DAY_PASS_PURCHASE = "day_pass_purchase";
    public static final String MEMBERSHIP_PURCHASE = "membership_purchase";
    public static final String MEMBERSHIP_RENEWAL = "membership_renewal";
    public static final String MEMBERSHIP_STARTED = "membership_started";
    public static final String MEMBERSHIP_CANCELLED = "membership_cancelled";
    public static final String MEMBERSHIP_ENDED = "membership_ended";
    public static final String EMAIL_SENT = "email_sent";
    public static final String FLAG_SYNCED = "flag_synced_to_shopify";

    public static final String MEMBERSHIP_NAME = "membership_name";
    public static final String MEMBERSHIP_ID = "membership_id";
    public static final String END_DATE = "end_date";

    private static final Set<String> MEMBERSHIP_OPENING_TYPES =
            Set.of(MEMBERSHIP_STARTED, MEMBERSHIP_PURCHASE, MEMBERSHIP_RENEWAL);

    private final List<CustomerEvent> events;

    public CustomerTimeline(List<CustomerEvent> sortedEvents) {
        this.events = List.copyOf(sortedEvents);
    }

    public List<CustomerEvent> getEvents() {
        return events;
    }

    public List<CustomerEvent> ofTypes(String... eventTypes) {
        Set<String> types = Set.of(eventTypes);
        return events.stream()
                .filter(event -> types.contains(event.getEventType()))
                .toList();
    }

    /**
     * Latest event of the given types. Among events sharing the latest date the earliest listed wins.
     */
    public Optional<CustomerEvent> latest(String... eventTypes) {
        return latestOf(ofTypes(eventTypes));
    }

    public static Optional<CustomerEvent> latestOf(List<CustomerEvent> candidates) {
        CustomerEvent latest = null;
        for (CustomerEvent event : candidates) {
            if (latest == null || event.getEventDate().isAfter(latest.getEventDate())) {
                latest = event;
            }
        }
        return Optional.ofNullable(latest);
    }

    /**
     * Events of the given types dated within [from, to], both ends inclusive.
     */
    public List<CustomerEvent> between(LocalDateTime from, LocalDateTime to, String... eventTypes) {
        return ofTypes(eventTypes).stream()
                .filter(event -> !event.getEventDate().isBefore(from) && !event.getEventDate().isAfter(to))
                .toList();
    }

    public boolean flaggedWithin(String flagType, int days, LocalDateTime referenceDate) {
        return hasFlagEventWithin(CustomerEvent.FLAG_SET, flagType, days, referenceDate);
    }

    public boolean syncedWithin(String flagType, int days, LocalDateTime referenceDate) {
        return hasFlagEventWithin(FLAG_SYNCED, flagType, days, referenceDate);
    }

    private boolean hasFlagEventWithin(String eventType, String flagType, int days, LocalDateTime referenceDate) {
        return between(referenceDate.minusDays(days), referenceDate, eventType).stream()
                .anyMatch(event -> flagType.equals(event.payloadString("flag_type")));
    }

    public List<CustomerEvent> flagSets(String flagType) {
        return ofTypes(CustomerEvent.FLAG_SET).stream()
                .filter(event -> flagType.equals(event.payloadString("flag_type")))
                .toList();
    }

    /**
     * A customer is an active member when their latest purchase, renewal or cancellation is not a cancellation.
     */
    public boolean isActiveMember() {
        return latest(MEMBERSHIP_PURCHASE, MEMBERSHIP_RENEWAL, MEMBERSHIP_CANCELLED)
                .map(event -> !MEMBERSHIP_CANCELLED.equals(event.getEventType()))
                .orElse(false);
    }

    /**
     * Check-ins whose entry method names a day pass.
     */
    public List<CustomerEvent> dayPassCheckins() {
        return ofTypes(CHECKIN).stream()
                .filter(event -> event.payloadString("entry_method_description").toLowerCase(Locale.ROOT).contains("day pass"))
                .toList();
    }

    /**
     * Memberships still open at the reference date, one event per membership.
     *
     * Membership events are grouped by membership id (or name when no id is recorded). A membership
     * is open when its latest event starts, buys or renews it and its end date, if any, has not passed.
     */
    public List<CustomerEvent> openMemberships(LocalDateTime referenceDate) {
        Map<String, CustomerEvent> latestByMembership = new LinkedHashMap<>();
        for (CustomerEvent event : ofTypes(MEMBERSHIP_STARTED, MEMBERSHIP_PURCHASE, MEMBERSHIP_RENEWAL,
                MEMBERSHIP_CANCELLED, MEMBERSHIP_ENDED)) {
            latestByMembership.put(membershipKey(event), event);
        }
        List<CustomerEvent> open = new ArrayList<>();
        for (CustomerEvent event : latestByMembership.values()) {
            if (!MEMBERSHIP_OPENING_TYPES.contains(event.getEventType())) {
                continue;
            }
            LocalDateTime endDate = TimestampUtils.toNaive(event.getPayload().get(END_DATE));
            if (endDate == null || !endDate.isBefore(referenceDate)) {
                open.add(event);
            }
        }
        return open;
    }

    private static String membershipKey(CustomerEvent event) {
        String id = event.payloadString(MEMBERSHIP_ID);
        if (!id.isBlank()) {
            return "id:" + id;
        }
        return "name:" + event.payloadString(MEMBERSHIP_NAME).trim().toLowerCase(Locale.ROOT);
    }

    public int size() {
        return events.size();
    }
}
