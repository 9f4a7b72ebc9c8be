package net.recache.core.service;

import net.recache.core.error.RecoveryException;
import net.recache.core.model.JobState;
import net.recache.core.model.JobStatus;
import net.recache.core.model.RecoveryReport;
import net.recache.core.spi.CollectionSource;
import net.recache.core.spi.JobStateRepository;
import net.recache.core.spi.RecoveryListener;
import net.recache.core.spi.TxRunner;
import net.recache.core.support.InMemoryCollectionSource;
import net.recache.core.support.InMemoryJobStateRepository;
import net.recache.core.support.MutableClock;
import net.recache.core.support.RecordingPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RecoveryCoordinatorTest {

    MutableClock clock;
    InMemoryJobStateRepository jobs;
    InMemoryCollectionSource collections;
    RecordingPublisher queue;
    RecoveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        jobs = new InMemoryJobStateRepository(clock);
        collections = new InMemoryCollectionSource();
        queue = new RecordingPublisher();
        coordinator = newCoordinator(collections, Duration.ofSeconds(10), RecoveryListener.NOOP);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private RecoveryCoordinator newCoordinator(CollectionSource source, Duration timeout, RecoveryListener listener) {
        ResumeExecutor ex = new ResumeExecutor(jobs, source, queue, TxRunner.direct(), clock, listener);
        return new RecoveryCoordinator(jobs, ex, TxRunner.direct(), clock, listener, timeout);
    }

    private void seed(String jobId, String collectionId, String... planned) {
        jobs.insert(JobState.ofNew(jobId, collectionId, "n", List.of(planned), "/cache", 100, 100, 80, "jpeg", clock.now()));
    }

    private void seedCompleted(String jobId, Instant completedAt) {
        jobs.put(new JobState(jobId, "C", "n", JobStatus.COMPLETED, 1, Set.of("a"), Set.of("a"), Set.of(), true,
                100, 100, 80, "jpeg", "/cache", null, completedAt, completedAt, completedAt, completedAt, completedAt));
    }

    @Test
    void recoversEveryIncompleteJobAndCountsFailures() {
        seed("ok1", "C1", "a", "b");
        seed("ok2", "C1", "a");
        seed("orphan", "missing", "a");
        collections.put("C1", "/photos", "a", "b");
        seedCompleted("done", clock.now());

        RecoveryReport report = coordinator.recoverIncompleteJobs();

        assertEquals(2, report.recovered());
        assertEquals(1, report.failed());
        assertEquals(0, report.timedOut());
        assertEquals(3, report.total());
        assertTrue(report.failures().containsKey("orphan"));
        assertFalse(jobs.get("orphan").canResume());
        // ok2 는 계획이 a 뿐이지만 컬렉션에 b 가 추가돼 있어 함께 발행
        assertEquals(4, queue.published.size());
    }

    @Test
    void nothingToRecoverYieldsEmptyReport() {
        seedCompleted("done", clock.now());

        RecoveryReport report = coordinator.recoverIncompleteJobs();

        assertEquals(0, report.total());
        assertTrue(report.failures().isEmpty());
        assertTrue(queue.published.isEmpty());
    }

    @Test
    void listingFailureIsContained() throws Exception {
        JobStateRepository broken = mock(JobStateRepository.class);
        when(broken.findIncomplete()).thenThrow(new SQLException("db down"));
        RecoveryListener listener = mock(RecoveryListener.class);
        ResumeExecutor ex = new ResumeExecutor(broken, collections, queue, TxRunner.direct(), clock, listener);

        try (RecoveryCoordinator c = new RecoveryCoordinator(broken, ex, TxRunner.direct(), clock, listener, Duration.ofSeconds(1))) {
            RecoveryReport report = c.recoverIncompleteJobs();
            assertEquals(0, report.total());
            assertTrue(report.failures().get("*").contains("db down"));
            verify(listener).onRecoveryFinished(report);
        }
    }

    @Test
    void oneJobThrowingDoesNotStopTheScan() {
        seed("j1", "C1", "a");
        seed("j2", "C2", "a");
        collections.put("C2", "/photos", "a");
        CollectionSource flaky = id -> {
            if (id.equals("C1")) throw new IllegalStateException("boom");
            return collections.findById(id);
        };
        try (RecoveryCoordinator c = newCoordinator(flaky, Duration.ofSeconds(10), null)) {
            RecoveryReport report = c.recoverIncompleteJobs();
            assertEquals(1, report.recovered());
            assertEquals(1, report.failed());
            assertTrue(jobs.get("j1").canResume());
        }
    }

    @Test
    void hangingJobTimesOutAndScanContinues() throws Exception {
        seed("hang", "H", "a");
        seed("fine", "C1", "a");
        collections.put("C1", "/photos", "a");
        CountDownLatch never = new CountDownLatch(1);
        CollectionSource hanging = id -> {
            if (id.equals("H")) never.await();
            return collections.findById(id);
        };
        RecoveryListener listener = mock(RecoveryListener.class);

        try (RecoveryCoordinator c = newCoordinator(hanging, Duration.ofMillis(300), listener)) {
            RecoveryReport report = c.recoverIncompleteJobs();
            assertEquals(1, report.recovered());
            assertEquals(1, report.failed());
            assertEquals(1, report.timedOut());
            assertTrue(report.failures().get("hang").startsWith("timed out"));
            verify(listener, atLeastOnce()).onResumeFailed(any());
        }
        assertTrue(jobs.get("hang").canResume());
    }

    @Test
    void resumableIdsExcludeBlockedAndCompletedJobs() throws Exception {
        seed("a", "C1", "x");
        seed("b", "C1", "x");
        seedCompleted("c", clock.now());
        coordinator.disableResumption("b", "operator");

        assertEquals(List.of("a"), coordinator.getResumableJobIds());
    }

    @Test
    void resumableIdsWrapRepositoryFailure() throws Exception {
        JobStateRepository broken = mock(JobStateRepository.class);
        when(broken.findIncomplete()).thenThrow(new SQLException("db down"));
        ResumeExecutor ex = new ResumeExecutor(broken, collections, queue, TxRunner.direct(), clock, null);
        try (RecoveryCoordinator c = new RecoveryCoordinator(broken, ex, TxRunner.direct(), clock, null, Duration.ofSeconds(1))) {
            RecoveryException e = assertThrows(RecoveryException.class, c::getResumableJobIds);
            assertEquals(RecoveryException.Kind.COLLABORATOR_UNAVAILABLE, e.kind());
        }
    }

    @Test
    void cleanupDeletesOnlyOldCompletedJobs() throws Exception {
        Instant now = clock.now();
        seedCompleted("old", now.minus(Duration.ofDays(45)));
        seedCompleted("recent", now.minus(Duration.ofDays(5)));
        seed("ancientRunning", "C1", "a");
        jobs.updateStatus("ancientRunning", JobStatus.RUNNING, null);
        clock.advance(Duration.ofDays(100));
        seedCompleted("fresh", clock.now());

        int deleted = coordinator.cleanupOldCompletedJobs();

        // 기준 시각이 100일 앞으로 갔으므로 old, recent 모두 30일 초과
        assertEquals(2, deleted);
        assertNull(jobs.get("old"));
        assertNull(jobs.get("recent"));
        assertNotNull(jobs.get("fresh"));
        assertNotNull(jobs.get("ancientRunning"));
    }

    @Test
    void cleanupHonoursRetentionArgument() throws Exception {
        Instant now = clock.now();
        seedCompleted("d10", now.minus(Duration.ofDays(10)));
        seedCompleted("d3", now.minus(Duration.ofDays(3)));

        assertEquals(1, coordinator.cleanupOldCompletedJobs(7));
        assertNotNull(jobs.get("d3"));
        assertThrows(IllegalArgumentException.class, () -> coordinator.cleanupOldCompletedJobs(-1));
    }

    @Test
    void staleRunningJobsAreReported() throws Exception {
        seed("s", "C1", "a");
        jobs.updateStatus("s", JobStatus.RUNNING, null);
        clock.advance(Duration.ofHours(1));
        seed("live", "C1", "a");
        jobs.updateStatus("live", JobStatus.RUNNING, null);

        assertEquals(List.of("s"), coordinator.findStaleJobIds(Duration.ofMinutes(30)));
    }

    @Test
    void rejectsNonPositiveTimeout() {
        ResumeExecutor ex = new ResumeExecutor(jobs, collections, queue, TxRunner.direct(), clock, null);
        assertThrows(IllegalArgumentException.class,
                () -> new RecoveryCoordinator(jobs, ex, TxRunner.direct(), clock, null, Duration.ZERO));
    }

    @Test
    void operatorResumeOfSingleJob() {
        seed("one", "C1", "a");
        collections.put("C1", "/photos", "a");

        assertTrue(coordinator.resumeJob("one").success());
        assertEquals(1, queue.published.size());
        assertEquals(JobStatus.RUNNING, jobs.get("one").status());
    }

    @Test
    void exceptionFormMapsFailuresToErrorKinds() throws Exception {
        seed("ok", "C1", "a");
        collections.put("C1", "/photos", "a");
        seed("orphan", "missing", "a");
        seed("blocked", "C1", "a");
        coordinator.disableResumption("blocked", "operator");

        assertTrue(coordinator.resumeJobOrThrow("ok").success());
        assertEquals(RecoveryException.Kind.NOT_FOUND,
                assertThrows(RecoveryException.class, () -> coordinator.resumeJobOrThrow("nope")).kind());
        assertEquals(RecoveryException.Kind.NOT_FOUND,
                assertThrows(RecoveryException.class, () -> coordinator.resumeJobOrThrow("orphan")).kind());
        assertEquals(RecoveryException.Kind.NON_RESUMABLE,
                assertThrows(RecoveryException.class, () -> coordinator.resumeJobOrThrow("blocked")).kind());
    }

    @Test
    void exceptionFormReportsCollaboratorOutage() {
        seed("j", "C9", "a");
        CollectionSource down = id -> { throw new SQLException("share offline"); };
        try (RecoveryCoordinator c = newCoordinator(down, Duration.ofSeconds(5), null)) {
            RecoveryException e = assertThrows(RecoveryException.class, () -> c.resumeJobOrThrow("j"));
            assertEquals(RecoveryException.Kind.COLLABORATOR_UNAVAILABLE, e.kind());
            assertTrue(e.getMessage().contains("share offline"));
        }
    }
}
