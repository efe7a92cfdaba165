package com.companya.crm.service.identity;

import com.companya.crm.model.IdentifierType;
import com.companya.crm.model.MatchConfidence;
import com.companya.crm.model.domain.Customer;
import com.companya.crm.model.domain.CustomerIdentifier;
import com.companya.crm.model.dto.ContactRecord;
import com.companya.crm.model.dto.MatchResult;
import com.companya.crm.util.EmailSimilarity;
import com.companya.crm.util.IdentifierNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Supplier;

/**
 * Three-tier identity matcher over an in-memory customer registry.
 *
 * Tiers, in the order they are tried:
 * - exact (HIGH): the normalized email, else the normalized phone, is already indexed.
 *   A record whose email and phone both hit the same customer is corroborated and
 *   resolves through the email as {@code exact_email}.
 * - fuzzy (LOW): an indexed email on the same (typo-corrected) domain is at least
 *   {@code fuzzyThreshold} similar
 *
 * Indices are first-writer-wins: a value already indexed is matched, never re-pointed.
 * One instance serves one resolution run and is not thread-safe.
 */
@Slf4j
public class CustomerMatcher {

    public static final String EXACT_EMAIL = "exact_email";
    public static final String EXACT_PHONE = "exact_phone";
    public static final String FUZZY_EMAIL_PREFIX = "fuzzy_email_";

    private final double fuzzyThreshold;
    private final Supplier<String> customerIdGenerator;

    private final Map<String, Customer> customers = new LinkedHashMap<>();
    private final Map<String, String> emailIndex = new HashMap<>();
    private final Map<String, String> phoneIndex = new HashMap<>();
    // typo-corrected domain -> indexed emails in insertion order
    private final Map<String, List<String>> emailsByDomain = new HashMap<>();

    private final Set<String> recordedObservations = new HashSet<>();
    private final Set<String> touchedCustomerIds = new LinkedHashSet<>();
    private final List<CustomerIdentifier> newIdentifiers = new ArrayList<>();
    private int conflictCount;

    public CustomerMatcher(double fuzzyThreshold) {
        this(fuzzyThreshold, () -> UUID.randomUUID().toString());
    }

    public CustomerMatcher(double fuzzyThreshold, Supplier<String> customerIdGenerator) {
        this.fuzzyThreshold = fuzzyThreshold;
        this.customerIdGenerator = customerIdGenerator;
    }

    /**
     * Loads a previously persisted registry. Identifiers must be supplied in the order
     * they were written so the indices come out exactly as before.
     */
    public void seed(Collection<Customer> existingCustomers, List<CustomerIdentifier> existingIdentifiers) {
        existingCustomers.forEach(customer -> customers.put(customer.getCustomerId(), customer));

        for (CustomerIdentifier identifier : existingIdentifiers) {
            if (!customers.containsKey(identifier.getCustomerId())) {
                log.warn("⚠️ Identifier {} references unknown customer {}, not indexed",
                        identifier.getNormalizedValue(), identifier.getCustomerId());
                continue;
            }
            index(identifier.getIdentifierType(), identifier.getNormalizedValue(), identifier.getCustomerId());
            recordedObservations.add(observationKey(identifier.getIdentifierType(), identifier.getNormalizedValue(),
                    identifier.getSource(), identifier.getSourceRecordId()));
        }

        // a registry written without its identifier log still answers exact look-ups
        for (Customer customer : existingCustomers) {
            index(IdentifierType.EMAIL, customer.getPrimaryEmail(), customer.getCustomerId());
            index(IdentifierType.PHONE, customer.getPrimaryPhone(), customer.getCustomerId());
        }

        log.debug("Seeded matcher with {} customers, {} emails, {} phones",
                customers.size(), emailIndex.size(), phoneIndex.size());
    }

    /**
     * Resolves one contact record against the registry, creating a customer when nothing matches.
     *
     * @return the match decision, or empty when the record has neither a usable email nor phone
     */
    public Optional<MatchResult> addContactRecord(ContactRecord record) {
        String email = IdentifierNormalizer.normalizeEmail(record.email());
        String phone = IdentifierNormalizer.normalizePhone(record.phone());
        String name = IdentifierNormalizer.normalizeName(record.name());

        if (email == null && phone == null) {
            log.debug("Discarding {} record {}: no usable email or phone", record.source(), record.sourceRecordId());
            return Optional.empty();
        }

        MatchResult match = findMatchingCustomer(email, phone);
        Customer customer;
        if (match == null) {
            String customerId = customerIdGenerator.get();
            customer = new Customer(customerId, email, phone, name, record.firstSeen(), record.source());
            customers.put(customerId, customer);
            match = new MatchResult(customerId, MatchConfidence.EXACT, MatchResult.NEW_CUSTOMER);
        } else {
            customer = customers.get(match.customerId());
            customer.recordSighting(record.source(), record.firstSeen());
        }
        touchedCustomerIds.add(customer.getCustomerId());

        index(IdentifierType.EMAIL, email, customer.getCustomerId());
        index(IdentifierType.PHONE, phone, customer.getCustomerId());

        if (email != null) {
            recordIdentifier(customer, IdentifierType.EMAIL, record.email(), email, record, match);
        }
        if (phone != null) {
            recordIdentifier(customer, IdentifierType.PHONE, record.phone(), phone, record, match);
        }
        return Optional.of(match);
    }

    /**
     * Applies the match tiers. Returns null when the record belongs to nobody yet.
     */
    MatchResult findMatchingCustomer(String email, String phone) {
        String emailHit = email != null ? emailIndex.get(email) : null;
        String phoneHit = phone != null ? phoneIndex.get(phone) : null;

        // An agreeing phone hit always comes with an email hit, so corroborated records
        // resolve here as exact_email.
        if (emailHit != null) {
            if (phoneHit != null && !phoneHit.equals(emailHit)) {
                // No merge rule is defined for two existing customers; the email wins.
                conflictCount++;
                log.warn("⚠️ Conflicting identity signals: email {} -> customer {}, phone {} -> customer {}",
                        email, emailHit, phone, phoneHit);
            }
            return new MatchResult(emailHit, MatchConfidence.HIGH, EXACT_EMAIL);
        }
        if (phoneHit != null) {
            return new MatchResult(phoneHit, MatchConfidence.HIGH, EXACT_PHONE);
        }
        if (email != null) {
            return findFuzzyEmailMatch(email);
        }
        return null;
    }

    private MatchResult findFuzzyEmailMatch(String email) {
        String domain = EmailSimilarity.fixDomainTypo(IdentifierNormalizer.extractDomain(email));
        // Every candidate in the bucket already passes the typo-tolerant domain check.
        for (String candidate : emailsByDomain.getOrDefault(domain, List.of())) {
            double similarity = EmailSimilarity.similarity(email, candidate);
            if (EmailSimilarity.meetsThreshold(similarity, fuzzyThreshold)) {
                String reason = FUZZY_EMAIL_PREFIX + EmailSimilarity.toPercent(similarity);
                log.debug("Fuzzy match {} ~ {} ({})", email, candidate, reason);
                return new MatchResult(emailIndex.get(candidate), MatchConfidence.LOW, reason);
            }
        }
        return null;
    }

    private void index(IdentifierType type, String normalizedValue, String customerId) {
        if (normalizedValue == null) {
            return;
        }
        if (type == IdentifierType.EMAIL) {
            if (emailIndex.putIfAbsent(normalizedValue, customerId) == null) {
                String domain = EmailSimilarity.fixDomainTypo(IdentifierNormalizer.extractDomain(normalizedValue));
                emailsByDomain.computeIfAbsent(domain, d -> new ArrayList<>()).add(normalizedValue);
            }
        } else {
            phoneIndex.putIfAbsent(normalizedValue, customerId);
        }
    }

    private void recordIdentifier(Customer customer, IdentifierType type, String rawValue, String normalizedValue,
                                  ContactRecord record, MatchResult match) {
        String key = observationKey(type, normalizedValue, record.source(), record.sourceRecordId());
        if (!recordedObservations.add(key)) {
            log.debug("Observation {} already recorded, skipping identifier row", key);
            return;
        }
        String primaryValue = type == IdentifierType.EMAIL ? customer.getPrimaryEmail() : customer.getPrimaryPhone();
        newIdentifiers.add(new CustomerIdentifier(
                customer.getCustomerId(),
                type,
                rawValue,
                normalizedValue,
                record.source(),
                record.sourceRecordId(),
                match.confidence(),
                match.reason(),
                record.firstSeen(),
                normalizedValue.equals(primaryValue)
        ));
    }

    private static String observationKey(IdentifierType type, String normalizedValue, String source,
                                         String sourceRecordId) {
        return type + "|" + normalizedValue + "|" + source + "|" + sourceRecordId;
    }

    /**
     * @return every known customer, oldest first
     */
    public List<Customer> getCustomers() {
        List<Customer> sorted = new ArrayList<>(customers.values());
        sorted.sort(Comparator.comparing(Customer::getFirstSeen, Comparator.nullsLast(Comparator.naturalOrder())));
        return sorted;
    }

    /**
     * @return customers created or updated since the matcher was seeded
     */
    public List<Customer> getTouchedCustomers() {
        return touchedCustomerIds.stream().map(customers::get).toList();
    }

    /**
     * @return identifier rows appended since the matcher was seeded, by customer then observation time
     */
    public List<CustomerIdentifier> getNewIdentifiers() {
        List<CustomerIdentifier> sorted = new ArrayList<>(newIdentifiers);
        sorted.sort(Comparator.comparing(CustomerIdentifier::getCustomerId)
                .thenComparing(CustomerIdentifier::getObservedAt, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder())));
        return sorted;
    }

    public int getConflictCount() {
        return conflictCount;
    }
}
