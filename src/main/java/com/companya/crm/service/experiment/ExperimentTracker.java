package com.companya.crm.service.experiment;

import com.companya.crm.model.domain.ExperimentEntry;

import java.util.List;

/**
 * Sink for A/B experiment entries. A customer enters a given experiment at most once;
 * the first recorded entry is kept and later ones are ignored.
 */
public interface ExperimentTracker {

    /**
     * @return the number of entries actually recorded
     */
    int logEntries(List<ExperimentEntry> entries);
}
