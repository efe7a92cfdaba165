package com.companya.crm.jobs;

import com.companya.crm.model.dto.FlagRunSummary;
import com.companya.crm.model.dto.ResolutionSummary;
import com.companya.crm.service.flags.FlaggingService;
import com.companya.crm.service.identity.IdentityResolutionService;
import com.companya.crm.service.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Daily batch: resolve contact records into customers, then re-flag every customer.
 * Overlapping triggers inside one process are skipped.
 */
@Slf4j
@Component
public class DailyCustomerUpdateJob {

    private final IdentityResolutionService identityResolutionService;
    private final FlaggingService flaggingService;
    private final PipelineMetrics pipelineMetrics;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    public DailyCustomerUpdateJob(IdentityResolutionService identityResolutionService,
                                  FlaggingService flaggingService,
                                  PipelineMetrics pipelineMetrics,
                                  Clock clock) {
        this.identityResolutionService = identityResolutionService;
        this.flaggingService = flaggingService;
        this.pipelineMetrics = pipelineMetrics;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.pipeline.cron}")
    public void runScheduled() {
        run(LocalDateTime.now(clock));
    }

    /**
     * @return false when another run was already in progress
     */
    public boolean run(LocalDateTime referenceDate) {
        if (!runLock.tryLock()) {
            log.warn("⏭️ Daily customer update already running, skipping trigger for {}", referenceDate);
            return false;
        }
        try {
            log.info("=== Starting daily customer update for {} ===", referenceDate);
            ResolutionSummary resolution = identityResolutionService.runResolution();
            FlagRunSummary flagging = flaggingService.runFlagging(referenceDate);
            log.info("=== Daily customer update complete: {} customers, {} active flags ===",
                    resolution.totalCustomers(), flagging.activeFlags());
            return true;
        } catch (Exception e) {
            pipelineMetrics.recordRunFailure();
            log.error("❌ Daily customer update failed", e);
            throw new RuntimeException("Daily customer update job failed", e);
        } finally {
            runLock.unlock();
        }
    }
}
