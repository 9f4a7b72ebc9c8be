package net.recache.adapter.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.recache.adapter.jdbc.repo.JdbcCollectionSource;
import net.recache.adapter.jdbc.repo.JdbcJobStateRepository;
import net.recache.adapter.jdbc.repo.JdbcWorkQueuePublisher;
import net.recache.core.model.JobState;
import net.recache.core.model.JobStatus;
import net.recache.core.model.RecoveryReport;
import net.recache.core.model.ResumeOutcome;
import net.recache.core.service.RecoveryCoordinator;
import net.recache.core.service.ResumeExecutor;
import net.recache.core.spi.Clock;
import net.recache.core.spi.JobStateRepository;
import net.recache.core.spi.RecoveryListener;
import net.recache.core.spi.TxRunner;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 코어 복구 흐름을 실제 Oracle 저장소/아웃박스 위에서 돌리는 인수 테스트
 */
class RecoveryAcceptanceTest extends TestSupport {

    TxRunner tx;
    JobStateRepository jobs;
    RecoveryCoordinator coordinator;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        jobs = new JdbcJobStateRepository(ds);
        Clock clock = Clock.system();
        ResumeExecutor executor = new ResumeExecutor(jobs, new JdbcCollectionSource(ds),
                new JdbcWorkQueuePublisher(ds, new ObjectMapper()), tx, clock, RecoveryListener.NOOP);
        coordinator = new RecoveryCoordinator(jobs, executor, tx, clock, RecoveryListener.NOOP, Duration.ofMinutes(1));
    }

    @AfterAll
    void closeCoordinator() {
        if (coordinator != null) coordinator.close();
    }

    @BeforeEach
    void truncate() throws Exception {
        truncateAll(tx);
    }

    private void seedJob(String jobId, String collectionId, String... planned) throws Exception {
        tx.run(() -> jobs.insert(JobState.ofNew(jobId, collectionId, "n", List.of(planned),
                "/cache", 100, 100, 80, "jpeg", Instant.now())));
    }

    @Test
    void interruptedJobIsResumedThroughTheOutbox() throws Exception {
        seedCollection(tx, "C1", "/photos", "a", "b", "c", "d");
        seedJob("J1", "C1", "a", "b", "c", "d");
        tx.run(() -> jobs.atomicAddProcessed("J1", "a"));
        tx.run(() -> jobs.atomicAddProcessed("J1", "b"));

        RecoveryReport report = coordinator.recoverIncompleteJobs();

        assertThat(report.recovered()).isEqualTo(1);
        assertThat(report.failed()).isZero();
        assertThat(count(tx, "SELECT COUNT(*) FROM TB_WORK_QUEUE WHERE JOB_ID = 'J1' AND STATUS = 'PENDING'")).isEqualTo(2);
        assertThat(count(tx, "SELECT COUNT(*) FROM TB_WORK_QUEUE WHERE ITEM_ID IN ('a','b')")).isZero();
        assertThat(count(tx, """
                SELECT COUNT(*) FROM TB_WORK_QUEUE
                 WHERE JSON_VALUE(PAYLOAD, '$.origin') = 'JobRecovery_J1'
                   AND JSON_VALUE(PAYLOAD, '$.forceRegenerate') = 'false'
            """)).isEqualTo(2);
        assertThat(tx.required(() -> jobs.findByJobId("J1").orElseThrow()).status()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void removedItemsAreSkippedAndJobCompletes() throws Exception {
        seedCollection(tx, "C2", "/photos", "a", "b", "c");
        seedJob("J2", "C2", "a", "b", "c");
        tx.run(() -> jobs.atomicAddProcessed("J2", "a"));
        removeCollectionItem(tx, "C2", "b");
        removeCollectionItem(tx, "C2", "c");

        ResumeOutcome out = coordinator.resumeJob("J2");

        assertThat(out.success()).isTrue();
        JobState j = tx.required(() -> jobs.findByJobId("J2").orElseThrow());
        assertThat(j.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(j.skippedImageIds()).isEqualTo(Set.of("b", "c"));
        assertThat(count(tx, "SELECT SKIPPED_CNT FROM TB_CACHE_JOB WHERE JOB_ID = 'J2'")).isEqualTo(2);
        assertThat(count(tx, "SELECT COUNT(*) FROM TB_WORK_QUEUE")).isZero();
    }

    @Test
    void missingCollectionDisablesJob() throws Exception {
        seedJob("J3", "ghost", "a");

        RecoveryReport report = coordinator.recoverIncompleteJobs();

        assertThat(report.failed()).isEqualTo(1);
        JobState j = tx.required(() -> jobs.findByJobId("J3").orElseThrow());
        assertThat(j.canResume()).isFalse();
        assertThat(j.status()).isEqualTo(JobStatus.FAILED);
        assertThat(coordinator.getResumableJobIds()).doesNotContain("J3");
    }
}
