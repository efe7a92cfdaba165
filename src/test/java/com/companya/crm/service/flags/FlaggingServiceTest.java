package com.companya.crm.service.flags;

import com.companya.crm.model.FlagPriority;
import com.companya.crm.model.domain.CustomerEvent;
import com.companya.crm.model.domain.CustomerFlag;
import com.companya.crm.model.dto.FlagRunSummary;
import com.companya.crm.repository.CustomerEventRepository;
import com.companya.crm.repository.CustomerFlagRepository;
import com.companya.crm.service.flags.rules.CustomerTimeline;
import com.companya.crm.service.flags.rules.FlagRuleRegistry;
import com.companya.crm.service.flags.rules.ReadyForMembershipRule;
import com.companya.crm.service.metrics.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FlaggingService Tests")
class FlaggingServiceTest {

    private static final LocalDateTime TODAY = LocalDateTime.of(2026, 3, 10, 6, 0);

    @Mock
    private ContactDirectoryLoader contactDirectoryLoader;

    @Mock
    private CustomerEventRepository customerEventRepository;

    @Mock
    private CustomerFlagRepository customerFlagRepository;

    @Mock
    private FlagStore flagStore;

    @Captor
    private ArgumentCaptor<List<CustomerFlag>> flagsCaptor;

    @Captor
    private ArgumentCaptor<List<CustomerEvent>> eventsCaptor;

    private FlaggingService flaggingService;

    @BeforeEach
    void setUp() {
        FlaggingEngine engine = new FlaggingEngine(
                new FlagRuleRegistry(List.of(new ReadyForMembershipRule())),
                new PersistentFlagPolicy(List.of("active-membership")),
                new PipelineMetrics(new SimpleMeterRegistry()),
                14);
        flaggingService = new FlaggingService(engine, contactDirectoryLoader, customerEventRepository,
                customerFlagRepository, flagStore);
        when(contactDirectoryLoader.load()).thenReturn(ContactDirectory.empty());
    }

    @Test
    void runFlagging_mergesExpiresAndWritesBack() {
        when(customerEventRepository.findAll()).thenReturn(List.of(
                new CustomerEvent("c1", CustomerTimeline.DAY_PASS_PURCHASE, TODAY.minusDays(2), "capitan", Map.of())));
        CustomerFlag stale = new CustomerFlag("c2", "new_member", TODAY.minusDays(20), Map.of(), FlagPriority.HIGH,
                TODAY.minusDays(20));
        CustomerFlag persistent = new CustomerFlag("c3", "active-membership", TODAY.minusDays(60), Map.of(),
                FlagPriority.LOW, TODAY.minusDays(60));
        when(customerFlagRepository.findAll()).thenReturn(List.of(stale, persistent));
        when(flagStore.persist(anyList(), anyList(), anyList())).thenReturn(new FlagStore.PersistOutcome(2, 1, 0));

        FlagRunSummary summary = flaggingService.runFlagging(TODAY);

        verify(flagStore).persist(flagsCaptor.capture(), eventsCaptor.capture(), anyList());
        assertThat(flagsCaptor.getValue()).extracting(CustomerFlag::getFlagType)
                .containsExactly("active-membership", "ready_for_membership");
        assertThat(eventsCaptor.getValue()).singleElement()
                .satisfies(event -> assertThat(event.payloadString("flag_type")).isEqualTo("ready_for_membership"));

        assertThat(summary.customersEvaluated()).isEqualTo(1);
        assertThat(summary.newFlags()).isEqualTo(1);
        assertThat(summary.activeFlags()).isEqualTo(2);
        assertThat(summary.expiredFlags()).isEqualTo(1);
        assertThat(summary.flagSetEvents()).isEqualTo(1);
    }

    @Test
    void runFlagging_surfacesPersistenceFailure() {
        when(customerEventRepository.findAll()).thenReturn(List.of());
        when(customerFlagRepository.findAll()).thenReturn(List.of());
        when(flagStore.persist(anyList(), anyList(), anyList()))
                .thenThrow(new FlagPersistenceException("write failed", new DataAccessResourceFailureException("db down")));

        assertThatThrownBy(() -> flaggingService.runFlagging(TODAY))
                .isInstanceOf(FlagPersistenceException.class)
                .hasMessage("write failed");
    }
}
