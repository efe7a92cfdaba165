package com.companya.crm.service.experiment;

import com.companya.crm.model.domain.ExperimentEntry;
import com.companya.crm.repository.ExperimentEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaExperimentTracker implements ExperimentTracker {

    private final ExperimentEntryRepository experimentEntryRepository;

    @Override
    @Transactional
    public int logEntries(List<ExperimentEntry> entries) {
        Set<String> seen = new HashSet<>();
        List<ExperimentEntry> toSave = new ArrayList<>();
        for (ExperimentEntry entry : entries) {
            String key = entry.getCustomerId() + "|" + entry.getExperimentId();
            if (!seen.add(key)) {
                continue;
            }
            if (experimentEntryRepository.existsByCustomerIdAndExperimentId(entry.getCustomerId(), entry.getExperimentId())) {
                log.debug("Customer {} already entered experiment {}", entry.getCustomerId(), entry.getExperimentId());
                continue;
            }
            toSave.add(entry);
        }
        experimentEntryRepository.saveAll(toSave);
        if (!toSave.isEmpty()) {
            log.info("🧪 Logged {} new experiment entries", toSave.size());
        }
        return toSave.size();
    }
}
