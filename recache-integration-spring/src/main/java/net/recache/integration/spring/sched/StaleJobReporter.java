package net.recache.integration.spring.sched;

import net.recache.core.error.RecoveryException;
import net.recache.core.service.RecoveryCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.List;

/** 진단: 진행 없이 오래 RUNNING 인 잡을 경고 로그로 남긴다. 상태는 바꾸지 않음 */
public class StaleJobReporter {
    private static final Logger log = LoggerFactory.getLogger(StaleJobReporter.class);

    private final RecoveryCoordinator coordinator;

    private Duration staleThreshold = Duration.ofMinutes(30);

    public StaleJobReporter(RecoveryCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(initialDelayString = "${recache.stale.delay-ms:600000}",
            fixedDelayString = "${recache.stale.delay-ms:600000}")
    public void reportStale() {
        try {
            List<String> stale = coordinator.findStaleJobIds(staleThreshold);
            if (!stale.isEmpty()) {
                log.warn("{} running jobs without progress for over {}: {}", stale.size(), staleThreshold, stale);
            }
        } catch (RecoveryException e) {
            log.error("Stale job check failed ({})", e.kind(), e);
        }
    }

    public void setStaleThreshold(Duration staleThreshold) {
        if (staleThreshold == null || staleThreshold.isNegative()) {
            throw new IllegalArgumentException("staleThreshold must be >= 0: " + staleThreshold);
        }
        this.staleThreshold = staleThreshold;
    }

    public Duration getStaleThreshold() { return staleThreshold; }
}
