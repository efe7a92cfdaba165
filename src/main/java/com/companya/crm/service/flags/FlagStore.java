package com.companya.crm.service.flags;

import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.domain.CustomerFlag;
import com.companya.crm.model.domain.ExperimentEntry;
import com.companya.crm.repository.CustomerEventRepository;
import com.companya.crm.repository.CustomerFlagRepository;
import com.companya.crm.service.experiment.ExperimentTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.*;

/**
 * Writes a flagging run's output atomically: the live flag table, the flag_set write-back
 * events and the experiment entries either all land or none do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlagStore {

    private final CustomerFlagRepository customerFlagRepository;
    private final CustomerEventRepository customerEventRepository;
    private final ExperimentTracker experimentTracker;

    public record PersistOutcome(int flagsWritten, int eventsAppended, int experimentEntriesLogged) {}

    @Transactional
    public PersistOutcome persist(List<CustomerFlag> activeFlags, List<CustomerEvent> flagSetEvents,
                                  List<ExperimentEntry> experimentEntries) {
        try {
            customerFlagRepository.deleteAllInBatch();
            customerFlagRepository.saveAllAndFlush(activeFlags);

            List<CustomerEvent> toAppend = withoutRecordedFlagSets(flagSetEvents);
            customerEventRepository.saveAllAndFlush(toAppend);

            int logged = experimentTracker.logEntries(experimentEntries);
            log.info("💾 Persisted {} active flags, {} flag_set events, {} experiment entries",
                    activeFlags.size(), toAppend.size(), logged);
            return new PersistOutcome(activeFlags.size(), toAppend.size(), logged);
        } catch (DataAccessException e) {
            throw new FlagPersistenceException("Failed to persist flagging output", e);
        }
    }

    /**
     * Skips flag_set events already recorded for the same customer and flag type on the same
     * calendar day, so re-running a day, at any time of day, does not duplicate the write-back.
     */
    private List<CustomerEvent> withoutRecordedFlagSets(List<CustomerEvent> flagSetEvents) {
        Map<LocalDate, Set<String>> recordedByDay = new HashMap<>();
        List<CustomerEvent> toAppend = new ArrayList<>();
        for (CustomerEvent event : flagSetEvents) {
            if (event.getEventDate() == null) {
                toAppend.add(event);
                continue;
            }
            Set<String> recorded = recordedByDay.computeIfAbsent(event.getEventDate().toLocalDate(), day ->
                    customerEventRepository.findByEventTypeAndEventDateGreaterThanEqualAndEventDateLessThan(
                                    CustomerEvent.FLAG_SET, day.atStartOfDay(), day.plusDays(1).atStartOfDay())
                            .stream()
                            .map(FlagStore::dedupKey)
                            .collect(HashSet::new, Set::add, Set::addAll));
            if (recorded.add(dedupKey(event))) {
                toAppend.add(event);
            } else {
                log.debug("flag_set already recorded for {} {}", event.getCustomerId(), event.payloadString("flag_type"));
            }
        }
        return toAppend;
    }

    private static String dedupKey(CustomerEvent event) {
        return event.getCustomerId() + "|" + event.payloadString("flag_type");
    }
}
