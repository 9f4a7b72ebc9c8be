package net.recache.integration.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import net.recache.core.model.RecoveryReport;
import net.recache.core.model.ResumeOutcome;
import net.recache.core.spi.RecoveryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;

/**
 * 복구 이벤트를 Micrometer 카운터로 남긴다.
 * <ul>
 *   <li>recache.recovery.jobs{result=recovered|failed|timeout}: 일괄 복구 집계</li>
 *   <li>recache.recovery.resume{disposition=...}: 잡 단위 재개 결과(운영자 단건 포함)</li>
 *   <li>recache.recovery.items.skipped / recache.recovery.messages.published</li>
 *   <li>recache.recovery.disabled / recache.cleanup.deleted</li>
 * </ul>
 */
public class MicrometerRecoveryListener implements RecoveryListener {
    private static final Logger log = LoggerFactory.getLogger(MicrometerRecoveryListener.class);

    public static final String JOBS = "recache.recovery.jobs";
    public static final String RESUME = "recache.recovery.resume";
    public static final String ITEMS_SKIPPED = "recache.recovery.items.skipped";
    public static final String MESSAGES_PUBLISHED = "recache.recovery.messages.published";
    public static final String DISABLED = "recache.recovery.disabled";
    public static final String CLEANUP_DELETED = "recache.cleanup.deleted";

    private final MeterRegistry registry;
    private final Counter recovered;
    private final Counter failed;
    private final Counter timedOut;
    private final Counter skipped;
    private final Counter published;
    private final Counter disabled;
    private final Counter cleaned;

    public MicrometerRecoveryListener(MeterRegistry registry) {
        this.registry = registry;
        this.recovered = Counter.builder(JOBS).tag("result", "recovered")
                .description("Jobs resumed successfully by a recovery pass").register(registry);
        this.failed = Counter.builder(JOBS).tag("result", "failed")
                .description("Jobs a recovery pass could not resume").register(registry);
        this.timedOut = Counter.builder(JOBS).tag("result", "timeout")
                .description("Resume attempts cut off by the per-job timeout").register(registry);
        this.skipped = Counter.builder(ITEMS_SKIPPED)
                .description("Items skipped because they left their collection").register(registry);
        this.published = Counter.builder(MESSAGES_PUBLISHED)
                .description("Work messages published by resume").register(registry);
        this.disabled = Counter.builder(DISABLED)
                .description("Jobs whose resumption was disabled").register(registry);
        this.cleaned = Counter.builder(CLEANUP_DELETED)
                .description("Completed jobs removed by retention cleanup").register(registry);
    }

    @Override
    public void onJobResumed(ResumeOutcome outcome) {
        resumeCounter(outcome).increment();
    }

    @Override
    public void onResumeFailed(ResumeOutcome outcome) {
        resumeCounter(outcome).increment();
    }

    @Override
    public void onItemSkipped(String jobId, String itemId) {
        skipped.increment();
    }

    @Override
    public void onMessagePublished(String jobId, String itemId) {
        published.increment();
    }

    @Override
    public void onResumeDisabled(String jobId, String reason) {
        disabled.increment();
    }

    @Override
    public void onRecoveryFinished(RecoveryReport report) {
        recovered.increment(report.recovered());
        failed.increment(report.failed());
        timedOut.increment(report.timedOut());
        if (!report.failures().isEmpty()) {
            log.warn("Recovery pass left {} failures: {}", report.failures().size(), report.failures());
        }
    }

    @Override
    public void onCleanupFinished(int deleted, Instant cutoff) {
        cleaned.increment(deleted);
    }

    private Counter resumeCounter(ResumeOutcome outcome) {
        return registry.counter(RESUME, "disposition", outcome.disposition().name().toLowerCase(Locale.ROOT));
    }
}
