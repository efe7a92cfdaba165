package com.companya.crm.service.metrics;

import com.companya.crm.model.MatchConfidence;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Counters for the identity and flagging runs, published through Micrometer.
 */
@Slf4j
@Service
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter recordsDiscarded;
    private final Counter customersCreated;
    private final Counter identityConflicts;
    private final Counter flagsExpired;
    private final Counter runFailures;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.recordsDiscarded = Counter.builder("crm.identity.records.discarded")
                .description("Contact records without a usable email or phone")
                .register(meterRegistry);
        this.customersCreated = Counter.builder("crm.identity.customers.created")
                .register(meterRegistry);
        this.identityConflicts = Counter.builder("crm.identity.conflicts")
                .description("Records whose email and phone point at different customers")
                .register(meterRegistry);
        this.flagsExpired = Counter.builder("crm.flags.expired")
                .register(meterRegistry);
        this.runFailures = Counter.builder("crm.pipeline.failures")
                .register(meterRegistry);
    }

    public void recordMatch(MatchConfidence confidence) {
        meterRegistry.counter("crm.identity.records", "confidence", confidence.name().toLowerCase()).increment();
        if (confidence == MatchConfidence.EXACT) {
            customersCreated.increment();
        }
    }

    public void recordDiscarded() {
        recordsDiscarded.increment();
    }

    public void recordConflicts(int count) {
        if (count > 0) {
            identityConflicts.increment(count);
            log.debug("Recorded {} identity conflicts - Total: {}", count, identityConflicts.count());
        }
    }

    public void recordFlagEmitted(String flagType) {
        meterRegistry.counter("crm.flags.emitted", "flag_type", flagType).increment();
    }

    public void recordFlagsExpired(int count) {
        flagsExpired.increment(count);
    }

    public void recordRunFailure() {
        runFailures.increment();
    }
}
