package com.companya.crm.service.flags;

import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.domain.CustomerFlag;
import com.companya.crm.model.domain.CustomerFlagId;
import com.companya.crm.model.domain.ExperimentEntry;
import com.companya.crm.model.dto.ContactInfo;
import com.companya.crm.model.dto.FlagEvaluation;
import com.companya.crm.model.dto.FlagResult;
import com.companya.crm.service.flags.rules.CustomerTimeline;
import com.companya.crm.service.flags.rules.FlagRule;
import com.companya.crm.service.flags.rules.FlagRuleRegistry;
import com.companya.crm.service.flags.rules.RuleInput;
import com.companya.crm.service.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Runs the registered rules over customer timelines and maintains the live flag set:
 * merging with earlier output, expiring stale flags and producing flag_set write-back events.
 */
@Slf4j
@Component
public class FlaggingEngine {

    static final String FLAG_SET_SOURCE = "customer_flags";

    private static final Comparator<CustomerFlag> PRIORITY_ORDER = Comparator
            .comparing(CustomerFlag::getPriority, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CustomerFlag::getTriggeredDate, Comparator.nullsLast(Comparator.naturalOrder()));

    private final FlagRuleRegistry flagRuleRegistry;
    private final PersistentFlagPolicy persistentFlagPolicy;
    private final PipelineMetrics pipelineMetrics;
    private final int ttlDays;

    public FlaggingEngine(FlagRuleRegistry flagRuleRegistry,
                          PersistentFlagPolicy persistentFlagPolicy,
                          PipelineMetrics pipelineMetrics,
                          @Value("${app.flags.ttl-days:14}") int ttlDays) {
        this.flagRuleRegistry = flagRuleRegistry;
        this.persistentFlagPolicy = persistentFlagPolicy;
        this.pipelineMetrics = pipelineMetrics;
        this.ttlDays = ttlDays;
    }

    /**
     * Evaluates every rule against one customer's events. A rule that throws is skipped for
     * this customer only. Flags for a customer reached through a parent's contact details are
     * renamed with the child suffix.
     */
    public List<FlagResult> evaluateCustomer(String customerId, List<CustomerEvent> events,
                                             LocalDateTime referenceDate, ContactDirectory directory) {
        List<CustomerEvent> dated = events.stream()
                .filter(event -> event.getEventDate() != null)
                .sorted(Comparator.comparing(CustomerEvent::getEventDate))
                .toList();

        ContactInfo contact = directory.contactFor(customerId);
        RuleInput input = RuleInput.builder()
                .customerId(customerId)
                .timeline(new CustomerTimeline(dated))
                .referenceDate(referenceDate)
                .email(contact.email())
                .phone(contact.phone())
                .childCustomerIds(directory.childrenOf(customerId))
                .build();

        List<FlagResult> results = new ArrayList<>();
        for (FlagRule rule : flagRuleRegistry.getRules()) {
            try {
                rule.evaluate(input).ifPresent(result ->
                        results.add(contact.usingParentContact() ? result.addressedToParent() : result));
            } catch (RuntimeException e) {
                log.error("❌ Rule {} failed for customer {}, skipping: {}",
                        rule.getFlagType(), customerId, e.getMessage(), e);
            }
        }
        return results;
    }

    public FlagEvaluation evaluateAllCustomers(List<CustomerEvent> events, LocalDateTime referenceDate,
                                               ContactDirectory directory) {
        Map<String, List<CustomerEvent>> eventsByCustomer = events.stream()
                .filter(event -> event.getCustomerId() != null)
                .collect(Collectors.groupingBy(CustomerEvent::getCustomerId, TreeMap::new, Collectors.toList()));
        log.info("🔍 Evaluating {} flag rules for {} customers ({} events) as of {}",
                flagRuleRegistry.getRules().size(), eventsByCustomer.size(), events.size(), referenceDate);

        List<CustomerFlag> flags = new ArrayList<>();
        List<ExperimentEntry> experimentEntries = new ArrayList<>();
        int customersFlagged = 0;
        for (Map.Entry<String, List<CustomerEvent>> entry : eventsByCustomer.entrySet()) {
            List<FlagResult> results = evaluateCustomer(entry.getKey(), entry.getValue(), referenceDate, directory);
            if (!results.isEmpty()) {
                customersFlagged++;
            }
            for (FlagResult result : results) {
                flags.add(new CustomerFlag(result.customerId(), result.flagType(), result.triggeredDate(),
                        result.flagData(), result.priority(), referenceDate));
                pipelineMetrics.recordFlagEmitted(result.flagType());
                if (result.isExperimentEntry()) {
                    experimentEntries.add(new ExperimentEntry(result.customerId(),
                            String.valueOf(result.flagData().get(FlagResult.EXPERIMENT_ID)),
                            String.valueOf(result.flagData().get(FlagResult.AB_GROUP)),
                            result.flagType(), result.triggeredDate()));
                }
            }
        }
        flags.sort(PRIORITY_ORDER);

        if (!flags.isEmpty()) {
            Map<String, Long> byType = flags.stream()
                    .collect(Collectors.groupingBy(CustomerFlag::getFlagType, TreeMap::new, Collectors.counting()));
            byType.forEach((flagType, count) -> log.info("   🚩 {}: {}", flagType, count));
        }
        log.info("✅ {} flags emitted for {} of {} customers",
                flags.size(), customersFlagged, eventsByCustomer.size());
        return new FlagEvaluation(flags, experimentEntries, eventsByCustomer.size(), customersFlagged);
    }

    /**
     * Keeps one row per (customer, flag type): the one added last, with fresh rows winning ties.
     */
    public List<CustomerFlag> mergeFlags(List<CustomerFlag> existing, List<CustomerFlag> fresh) {
        Map<CustomerFlagId, CustomerFlag> merged = new LinkedHashMap<>();
        for (CustomerFlag flag : existing) {
            merged.merge(flag.getId(), flag, (kept, candidate) -> addedNoEarlier(candidate, kept) ? candidate : kept);
        }
        for (CustomerFlag flag : fresh) {
            merged.merge(flag.getId(), flag, (kept, candidate) -> addedNoEarlier(candidate, kept) ? candidate : kept);
        }
        return new ArrayList<>(merged.values());
    }

    private static boolean addedNoEarlier(CustomerFlag candidate, CustomerFlag kept) {
        if (kept.getFlagAddedDate() == null) {
            return true;
        }
        return candidate.getFlagAddedDate() != null && !candidate.getFlagAddedDate().isBefore(kept.getFlagAddedDate());
    }

    /**
     * Drops non-persistent flags triggered more than the TTL before the reference date.
     */
    public List<CustomerFlag> removeExpiredFlags(List<CustomerFlag> flags, LocalDateTime referenceDate) {
        LocalDateTime cutoff = referenceDate.minusDays(ttlDays);
        List<CustomerFlag> active = new ArrayList<>();
        int expired = 0;
        for (CustomerFlag flag : flags) {
            boolean stale = flag.getTriggeredDate() != null && flag.getTriggeredDate().isBefore(cutoff);
            if (stale && !persistentFlagPolicy.isPersistent(flag.getFlagType())) {
                log.debug("Expiring flag {} triggered {}", flag.getId(), flag.getTriggeredDate());
                expired++;
            } else {
                active.add(flag);
            }
        }
        if (expired > 0) {
            log.info("🧹 Expired {} flags older than {} days", expired, ttlDays);
            pipelineMetrics.recordFlagsExpired(expired);
        }
        return active;
    }

    public List<CustomerEvent> toFlagSetEvents(List<CustomerFlag> flags) {
        List<CustomerEvent> events = new ArrayList<>();
        for (CustomerFlag flag : flags) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("flag_type", flag.getFlagType());
            payload.put("priority", flag.getPriority() != null ? flag.getPriority().name().toLowerCase(Locale.ROOT) : null);
            payload.put("triggered_date", flag.getTriggeredDate() != null ? flag.getTriggeredDate().toString() : null);
            events.add(new CustomerEvent(flag.getCustomerId(), CustomerEvent.FLAG_SET, flag.getFlagAddedDate(),
                    FLAG_SET_SOURCE, payload));
        }
        return events;
    }
}
