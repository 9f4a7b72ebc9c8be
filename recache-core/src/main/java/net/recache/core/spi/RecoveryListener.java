package net.recache.core.spi;

import net.recache.core.model.RecoveryReport;
import net.recache.core.model.ResumeOutcome;

import java.time.Instant;

/** 복구 경로 관측 지점(메트릭/구조화 로그). 구현체는 예외를 던지지 않아야 한다. */
public interface RecoveryListener {
    RecoveryListener NOOP = new RecoveryListener() {};

    default void onJobResumed(ResumeOutcome outcome) {}

    default void onResumeFailed(ResumeOutcome outcome) {}

    default void onItemSkipped(String jobId, String itemId) {}

    default void onMessagePublished(String jobId, String itemId) {}

    default void onResumeDisabled(String jobId, String reason) {}

    default void onRecoveryFinished(RecoveryReport report) {}

    default void onCleanupFinished(int deleted, Instant cutoff) {}
}
