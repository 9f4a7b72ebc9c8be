package net.recache.core.model;

import java.time.Instant;
import java.util.Map;

/** 일괄 복구 1회 집계. timedOut은 failed에 포함된다. */
public record RecoveryReport(
        Instant startedAt,
        Instant finishedAt,
        int recovered,
        int failed,
        int timedOut,
        Map<String, String> failures
) {
    public RecoveryReport {
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }

    public int total() { return recovered + failed; }

    public static RecoveryReport empty(Instant at, Map<String, String> failures) {
        return new RecoveryReport(at, at, 0, 0, 0, failures);
    }
}
