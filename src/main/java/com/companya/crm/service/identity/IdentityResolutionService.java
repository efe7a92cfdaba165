package com.companya.crm.service.identity;

import com.companya.crm.client.ContactSourceClient;
import com.companya.crm.model.MatchConfidence;
import com.companya.crm.model.domain.Customer;
import com.companya.crm.model.domain.CustomerIdentifier;
import com.companya.crm.model.dto.ContactRecord;
import com.companya.crm.model.dto.MatchResult;
import com.companya.crm.model.dto.ResolutionSummary;
import com.companya.crm.repository.CustomerIdentifierRepository;
import com.companya.crm.repository.CustomerRepository;
import com.companya.crm.service.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Merges per-source contact records into the persisted customer registry.
 *
 * Each run seeds a {@link CustomerMatcher} from the registry and identifier log, feeds it
 * every record oldest first, then writes back the touched customers and the new
 * identifier rows. Re-running the same input creates neither customers nor identifier rows.
 */
@Slf4j
@Service
public class IdentityResolutionService {

    private final CustomerRepository customerRepository;
    private final CustomerIdentifierRepository customerIdentifierRepository;
    private final List<ContactSourceClient> contactSourceClients;
    private final PipelineMetrics pipelineMetrics;
    private final Clock clock;
    private final double fuzzyThreshold;

    public IdentityResolutionService(CustomerRepository customerRepository,
                                     CustomerIdentifierRepository customerIdentifierRepository,
                                     List<ContactSourceClient> contactSourceClients,
                                     PipelineMetrics pipelineMetrics,
                                     Clock clock,
                                     @Value("${app.identity.fuzzy-threshold:0.90}") double fuzzyThreshold) {
        this.customerRepository = customerRepository;
        this.customerIdentifierRepository = customerIdentifierRepository;
        this.contactSourceClients = contactSourceClients;
        this.pipelineMetrics = pipelineMetrics;
        this.clock = clock;
        this.fuzzyThreshold = fuzzyThreshold;
    }

    /**
     * Pulls records from every registered contact source and resolves them.
     * A source that fails to load is logged and skipped.
     */
    @Transactional
    public ResolutionSummary runResolution() {
        log.info("🔄 Collecting contact records from {} sources...", contactSourceClients.size());
        List<ContactRecord> records = new ArrayList<>();
        for (ContactSourceClient client : contactSourceClients) {
            try {
                List<ContactRecord> fetched = client.fetchContacts();
                log.info("📥 {} supplied {} contact records", client.name(), fetched.size());
                records.addAll(fetched);
            } catch (RuntimeException e) {
                log.error("❌ Could not load contacts from {}: {}", client.name(), e.getMessage(), e);
            }
        }
        return resolve(records);
    }

    @Transactional
    public ResolutionSummary resolve(List<ContactRecord> records) {
        log.info("🚀 Starting identity resolution for {} contact records", records.size());

        CustomerMatcher matcher = new CustomerMatcher(fuzzyThreshold);
        List<Customer> existingCustomers = customerRepository.findAll();
        matcher.seed(existingCustomers, customerIdentifierRepository.findAllByOrderByObservedAtAscIdAsc());

        LocalDateTime now = LocalDateTime.now(clock);
        List<ContactRecord> ordered = records.stream()
                .map(record -> record.firstSeen() != null ? record : withFirstSeen(record, now))
                .sorted(Comparator.comparing(ContactRecord::firstSeen))
                .toList();

        Map<MatchConfidence, Long> confidenceCounts = new EnumMap<>(MatchConfidence.class);
        int discarded = 0;
        for (ContactRecord record : ordered) {
            Optional<MatchResult> match = matcher.addContactRecord(record);
            if (match.isPresent()) {
                confidenceCounts.merge(match.get().confidence(), 1L, Long::sum);
                pipelineMetrics.recordMatch(match.get().confidence());
            } else {
                discarded++;
                pipelineMetrics.recordDiscarded();
            }
        }
        pipelineMetrics.recordConflicts(matcher.getConflictCount());

        List<Customer> touched = matcher.getTouchedCustomers();
        List<CustomerIdentifier> newIdentifiers = matcher.getNewIdentifiers();
        try {
            customerRepository.saveAllAndFlush(touched);
            customerIdentifierRepository.saveAllAndFlush(newIdentifiers);
        } catch (DataAccessException e) {
            throw new IdentityResolutionException("Failed to persist customer registry", e);
        }

        List<Customer> allCustomers = matcher.getCustomers();
        ResolutionSummary summary = new ResolutionSummary(
                ordered.size(),
                discarded,
                confidenceCounts.getOrDefault(MatchConfidence.EXACT, 0L).intValue(),
                allCustomers.size(),
                newIdentifiers.size(),
                confidenceCounts
        );
        logSummary(summary, allCustomers, existingCustomers.size());
        return summary;
    }

    private static ContactRecord withFirstSeen(ContactRecord record, LocalDateTime firstSeen) {
        return new ContactRecord(record.email(), record.phone(), record.name(), record.source(),
                record.sourceRecordId(), firstSeen);
    }

    private void logSummary(ResolutionSummary summary, List<Customer> allCustomers, int customersBefore) {
        log.info("✅ Identity resolution complete:");
        log.info("   📊 {} records processed, {} discarded without identifiers",
                summary.recordsProcessed(), summary.recordsDiscarded());
        log.info("   👥 {} customers ({} before, {} created)",
                summary.totalCustomers(), customersBefore, summary.customersCreated());
        log.info("   🪪 {} identifier rows appended", summary.identifiersAdded());

        int matched = summary.recordsProcessed() - summary.recordsDiscarded();
        if (matched > 0) {
            double dedupRate = (1.0 - (double) summary.customersCreated() / matched) * 100;
            log.info("   🔗 Deduplication rate: {}%", String.format("%.1f", dedupRate));
            summary.confidenceCounts().forEach((confidence, count) ->
                    log.info("   {} {} records ({}%)", confidence, count,
                            String.format("%.1f", count * 100.0 / matched)));
        }

        Map<String, Long> customersPerSource = allCustomers.stream()
                .flatMap(customer -> customer.getSources().stream())
                .collect(Collectors.groupingBy(source -> source, TreeMap::new, Collectors.counting()));
        customersPerSource.forEach((source, count) -> log.debug("   📁 {} {} customers", source, count));
    }
}
