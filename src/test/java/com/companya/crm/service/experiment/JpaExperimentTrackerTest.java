package com.companya.crm.service.experiment;

import com.companya.crm.model.domain.ExperimentEntry;
import com.companya.crm.repository.ExperimentEntryRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaExperimentTrackerTest {

    private static final String EXPERIMENT = "day_pass_conversion_2026_02";
    private static final LocalDateTime TODAY = LocalDateTime.of(2026, 3, 10, 6, 0);

    @Mock
    private ExperimentEntryRepository experimentEntryRepository;

    @InjectMocks
    private JpaExperimentTracker tracker;

    @Captor
    private ArgumentCaptor<List<ExperimentEntry>> savedCaptor;

    @Test
    void firstEntryPerCustomerAndExperimentWins() {
        ExperimentEntry first = new ExperimentEntry("c1", EXPERIMENT, "A", "first_time_day_pass_2wk_offer", TODAY);
        ExperimentEntry repeat = new ExperimentEntry("c1", EXPERIMENT, "A", "first_time_day_pass_2wk_offer", TODAY.plusDays(1));
        ExperimentEntry alreadyLogged = new ExperimentEntry("c2", EXPERIMENT, "B", "second_visit_offer_eligible", TODAY);
        when(experimentEntryRepository.existsByCustomerIdAndExperimentId("c1", EXPERIMENT)).thenReturn(false);
        when(experimentEntryRepository.existsByCustomerIdAndExperimentId("c2", EXPERIMENT)).thenReturn(true);

        int logged = tracker.logEntries(List.of(first, repeat, alreadyLogged));

        assertThat(logged).isEqualTo(1);
        verify(experimentEntryRepository).saveAll(savedCaptor.capture());
        assertThat(savedCaptor.getValue()).containsExactly(first);
    }

    @Test
    void emptyBatchLogsNothing() {
        assertThat(tracker.logEntries(List.of())).isZero();
    }
}
