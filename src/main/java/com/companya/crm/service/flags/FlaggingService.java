package com.companya.crm.service.flags;

import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.domain.CustomerFlag;
import com.companya.crm.model.domain.CustomerFlagId;
import com.companya.crm.model.dto.FlagEvaluation;
import com.companya.crm.model.dto.FlagRunSummary;
import com.companya.crm.repository.CustomerEventRepository;
import com.companya.crm.repository.CustomerFlagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One daily flagging pass: evaluate, merge with the previous flag table, expire, persist.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlaggingService {

    private final FlaggingEngine flaggingEngine;
    private final ContactDirectoryLoader contactDirectoryLoader;
    private final CustomerEventRepository customerEventRepository;
    private final CustomerFlagRepository customerFlagRepository;
    private final FlagStore flagStore;

    public FlagRunSummary runFlagging(LocalDateTime referenceDate) {
        log.info("🚀 Starting customer flagging as of {}", referenceDate);

        List<CustomerEvent> events = customerEventRepository.findAll();
        List<CustomerFlag> existingFlags = customerFlagRepository.findAll();
        ContactDirectory directory = contactDirectoryLoader.load();

        FlagEvaluation evaluation = flaggingEngine.evaluateAllCustomers(events, referenceDate, directory);
        List<CustomerFlag> merged = flaggingEngine.mergeFlags(existingFlags, evaluation.flags());
        List<CustomerFlag> active = flaggingEngine.removeExpiredFlags(merged, referenceDate);

        Set<CustomerFlagId> activeIds = active.stream().map(CustomerFlag::getId).collect(Collectors.toSet());
        List<CustomerFlag> newSurvivors = evaluation.flags().stream()
                .filter(flag -> activeIds.contains(flag.getId()))
                .toList();
        List<CustomerEvent> flagSetEvents = flaggingEngine.toFlagSetEvents(newSurvivors);

        FlagStore.PersistOutcome outcome = flagStore.persist(active, flagSetEvents, evaluation.experimentEntries());

        FlagRunSummary summary = new FlagRunSummary(
                referenceDate,
                evaluation.customersEvaluated(),
                evaluation.customersFlagged(),
                evaluation.flags().size(),
                active.size(),
                merged.size() - active.size(),
                outcome.eventsAppended(),
                outcome.experimentEntriesLogged()
        );
        log.info("✅ Flagging complete: {} new, {} active, {} expired, {} flag_set events, {} experiment entries",
                summary.newFlags(), summary.activeFlags(), summary.expiredFlags(),
                summary.flagSetEvents(), summary.experimentEntries());
        return summary;
    }
}
