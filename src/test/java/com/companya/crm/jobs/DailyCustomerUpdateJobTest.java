package com.companya.crm.jobs;

import com.companya.crm.model.dto.FlagRunSummary;
import com.companya.crm.model.dto.ResolutionSummary;
import com.companya.crm.service.flags.FlaggingService;
import com.companya.crm.service.identity.IdentityResolutionException;
import com.companya.crm.service.identity.IdentityResolutionService;
import com.companya.crm.service.metrics.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DailyCustomerUpdateJobTest {

    private static final LocalDateTime TODAY = LocalDateTime.of(2026, 3, 10, 6, 0);

    @Mock
    private IdentityResolutionService identityResolutionService;

    @Mock
    private FlaggingService flaggingService;

    private SimpleMeterRegistry meterRegistry;
    private DailyCustomerUpdateJob job;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(TODAY.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        job = new DailyCustomerUpdateJob(identityResolutionService, flaggingService,
                new PipelineMetrics(meterRegistry), clock);
    }

    private static ResolutionSummary resolution() {
        return new ResolutionSummary(6, 1, 2, 2, 4, Map.of());
    }

    private static FlagRunSummary flagging() {
        return new FlagRunSummary(TODAY, 2, 1, 1, 1, 0, 1, 0);
    }

    @Test
    void scheduledRunResolvesThenFlagsAsOfNow() {
        when(identityResolutionService.runResolution()).thenReturn(resolution());
        when(flaggingService.runFlagging(TODAY)).thenReturn(flagging());

        job.runScheduled();

        var inOrder = inOrder(identityResolutionService, flaggingService);
        inOrder.verify(identityResolutionService).runResolution();
        inOrder.verify(flaggingService).runFlagging(TODAY);
    }

    @Test
    void failureIsCountedAndRethrown() {
        when(identityResolutionService.runResolution())
                .thenThrow(new IdentityResolutionException("write failed", new IllegalStateException("db")));

        assertThatThrownBy(() -> job.run(TODAY))
                .isInstanceOf(RuntimeException.class)
                .hasMessage("Daily customer update job failed")
                .hasCauseInstanceOf(IdentityResolutionException.class);

        verifyNoInteractions(flaggingService);
        assertThat(meterRegistry.counter("crm.pipeline.failures").count()).isEqualTo(1.0);
    }

    @Test
    void overlappingTriggerIsSkipped() {
        AtomicReference<Boolean> overlapping = new AtomicReference<>();
        when(identityResolutionService.runResolution()).thenAnswer(invocation -> {
            overlapping.set(CompletableFuture.supplyAsync(() -> job.run(TODAY)).join());
            return resolution();
        });
        when(flaggingService.runFlagging(any())).thenReturn(flagging());

        assertThat(job.run(TODAY)).isTrue();
        assertThat(overlapping.get()).isFalse();
        verify(identityResolutionService, times(1)).runResolution();

        // lock is released afterwards
        reset(identityResolutionService);
        when(identityResolutionService.runResolution()).thenReturn(resolution());
        assertThat(job.run(TODAY)).isTrue();
    }
}
