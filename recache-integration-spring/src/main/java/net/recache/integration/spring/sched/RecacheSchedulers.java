package net.recache.integration.spring.sched;

import net.recache.core.error.RecoveryException;
import net.recache.core.service.RecoveryCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/** 주기 작업: 오래된 완료 잡 정리 */
public class RecacheSchedulers {
    private static final Logger log = LoggerFactory.getLogger(RecacheSchedulers.class);

    private final RecoveryCoordinator coordinator;

    private int retentionDays = RecoveryCoordinator.DEFAULT_RETENTION_DAYS;

    public RecacheSchedulers(RecoveryCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(initialDelayString = "${recache.cleanup.delay-ms:3600000}",
            fixedDelayString = "${recache.cleanup.delay-ms:3600000}")
    public void cleanup() {
        try {
            coordinator.cleanupOldCompletedJobs(retentionDays);
        } catch (RecoveryException e) {
            // 다음 주기에 다시 시도
            log.error("Scheduled cleanup failed ({})", e.kind(), e);
        }
    }

    public void setRetentionDays(int retentionDays) {
        if (retentionDays < 0) throw new IllegalArgumentException("retentionDays must be >= 0");
        this.retentionDays = retentionDays;
    }

    public int getRetentionDays() { return retentionDays; }
}
