package net.recache.core.service;

import net.recache.core.error.RecoveryException;
import net.recache.core.model.JobState;
import net.recache.core.model.RecoveryReport;
import net.recache.core.model.ResumeOutcome;
import net.recache.core.model.ResumeOutcome.Disposition;
import net.recache.core.spi.Clock;
import net.recache.core.spi.JobStateRepository;
import net.recache.core.spi.RecoveryListener;
import net.recache.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 기동 시/운영자 요청 시 호출되는 복구 진입점.
 * <ul>
 *   <li>미완료 잡 일괄 재개 (잡 단위 실패는 집계만 하고 스캔을 멈추지 않음)</li>
 *   <li>재개 가능 잡 조회, 재개 차단, 오래된 완료 잡 정리</li>
 * </ul>
 * 잡 단위 재개는 별도 워커 스레드에서 타임아웃을 걸고 돌린다. 멈춘 잡 하나가 뒤 잡들을 막지 않도록.
 */
public final class RecoveryCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final Duration DEFAULT_RESUME_TIMEOUT = Duration.ofMinutes(5);

    private final JobStateRepository jobs;
    private final ResumeExecutor executor;
    private final TxRunner tx;
    private final Clock clock;
    private final RecoveryListener listener;
    private final Duration resumeTimeout;
    private final ExecutorService workers;
    private final boolean ownsWorkers;

    public RecoveryCoordinator(JobStateRepository jobs,
                               ResumeExecutor executor,
                               TxRunner tx,
                               Clock clock,
                               RecoveryListener listener,
                               Duration resumeTimeout) {
        this(jobs, executor, tx, clock, listener, resumeTimeout, newWorkerPool(), true);
    }

    public RecoveryCoordinator(JobStateRepository jobs,
                               ResumeExecutor executor,
                               TxRunner tx,
                               Clock clock,
                               RecoveryListener listener,
                               Duration resumeTimeout,
                               ExecutorService workers) {
        this(jobs, executor, tx, clock, listener, resumeTimeout, workers, false);
    }

    private RecoveryCoordinator(JobStateRepository jobs,
                                ResumeExecutor executor,
                                TxRunner tx,
                                Clock clock,
                                RecoveryListener listener,
                                Duration resumeTimeout,
                                ExecutorService workers,
                                boolean ownsWorkers) {
        if (resumeTimeout == null || resumeTimeout.isZero() || resumeTimeout.isNegative()) {
            throw new IllegalArgumentException("resumeTimeout must be positive: " + resumeTimeout);
        }
        this.jobs = jobs;
        this.executor = executor;
        this.tx = tx;
        this.clock = clock;
        this.listener = listener == null ? RecoveryListener.NOOP : listener;
        this.resumeTimeout = resumeTimeout;
        this.workers = workers;
        this.ownsWorkers = ownsWorkers;
    }

    /**
     * status != COMPLETED 인 잡 전부를 순차 재개한다(canResume=false 잡도 대상, 실행기가 걸러냄).
     * 절대 던지지 않는다. 목록 조회 자체가 실패하면 0건 리포트에 사유를 담아 돌려준다.
     */
    public RecoveryReport recoverIncompleteJobs() {
        Instant started = clock.now();
        log.info("Starting recovery of incomplete cache jobs");

        final List<JobState> incomplete;
        try {
            incomplete = tx.required(jobs::findIncomplete);
        } catch (Exception e) {
            log.error("Listing incomplete jobs failed, recovery pass skipped", e);
            RecoveryReport report = RecoveryReport.empty(started, Map.of("*", "listing failed: " + e.getMessage()));
            listener.onRecoveryFinished(report);
            return report;
        }

        if (incomplete.isEmpty()) {
            log.info("No incomplete jobs found to recover");
            RecoveryReport report = RecoveryReport.empty(started, Map.of());
            listener.onRecoveryFinished(report);
            return report;
        }
        log.info("Found {} incomplete cache jobs to recover", incomplete.size());

        int recovered = 0;
        int failed = 0;
        int timedOut = 0;
        Map<String, String> failures = new LinkedHashMap<>();

        for (JobState job : incomplete) {
            String jobId = job.jobId();
            Future<ResumeOutcome> f = workers.submit(() -> executor.resume(jobId));
            try {
                ResumeOutcome outcome = f.get(resumeTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (outcome.success()) {
                    recovered++;
                } else {
                    failed++;
                    failures.put(jobId, outcome.disposition() + (outcome.reason() == null ? "" : ": " + outcome.reason()));
                }
            } catch (TimeoutException e) {
                f.cancel(true);
                failed++;
                timedOut++;
                failures.put(jobId, "timed out after " + resumeTimeout);
                log.error("Resuming job {} timed out after {}, moving on", jobId, resumeTimeout);
                listener.onResumeFailed(ResumeOutcome.of(jobId, Disposition.FAILED, "timeout"));
            } catch (ExecutionException e) {
                failed++;
                failures.put(jobId, String.valueOf(e.getCause()));
                log.error("Failed to recover job {}", jobId, e.getCause());
            } catch (InterruptedException e) {
                f.cancel(true);
                Thread.currentThread().interrupt();
                log.warn("Recovery pass interrupted after {} of {} jobs", recovered + failed, incomplete.size());
                break;
            }
        }

        RecoveryReport report = new RecoveryReport(started, clock.now(), recovered, failed, timedOut, failures);
        log.info("Job recovery complete: {} recovered, {} failed ({} timed out)", recovered, failed, timedOut);
        listener.onRecoveryFinished(report);
        return report;
    }

    /** 운영자 단건 재개 */
    public ResumeOutcome resumeJob(String jobId) {
        return executor.resume(jobId);
    }

    /**
     * 운영자 단건 재개(예외 형태). 성공 결과는 그대로 돌려주고, 실패는 종류별 RecoveryException 으로 바꾼다.
     * 컬렉션 부재는 NOT_FOUND, 협력자 장애/타임아웃성 실패는 COLLABORATOR_UNAVAILABLE.
     */
    public ResumeOutcome resumeJobOrThrow(String jobId) throws RecoveryException {
        ResumeOutcome outcome = executor.resume(jobId);
        return switch (outcome.disposition()) {
            case RESUMED, ALREADY_COMPLETED, COMPLETED_NOTHING_REMAINING -> outcome;
            case NOT_FOUND -> throw RecoveryException.notFound("job " + jobId);
            case COLLECTION_MISSING -> throw RecoveryException.notFound("collection of job " + jobId);
            case NON_RESUMABLE -> throw RecoveryException.nonResumable(jobId);
            case FAILED -> throw new RecoveryException(RecoveryException.Kind.COLLABORATOR_UNAVAILABLE,
                    "resuming job " + jobId + " failed: " + outcome.reason(), null);
        };
    }

    /** 미완료이면서 canResume=true 인 잡 ID. 읽기 전용 */
    public List<String> getResumableJobIds() throws RecoveryException {
        try {
            List<JobState> incomplete = tx.required(jobs::findIncomplete);
            List<String> ids = new ArrayList<>();
            for (JobState j : incomplete) {
                if (j.canResume()) ids.add(j.jobId());
            }
            return ids;
        } catch (Exception e) {
            throw RecoveryException.unavailable("listing resumable jobs", e);
        }
    }

    /** best-effort. 기록 실패는 로그만 남긴다 */
    public boolean disableResumption(String jobId, String reason) {
        return executor.disable(jobId, reason);
    }

    public int cleanupOldCompletedJobs() throws RecoveryException {
        return cleanupOldCompletedJobs(DEFAULT_RETENTION_DAYS);
    }

    /** COMPLETED 이면서 보관 기간이 지난 잡만 삭제. 미완료 잡은 나이와 무관하게 건드리지 않는다 */
    public int cleanupOldCompletedJobs(int olderThanDays) throws RecoveryException {
        if (olderThanDays < 0) throw new IllegalArgumentException("olderThanDays must be >= 0: " + olderThanDays);

        Instant cutoff = clock.now().minus(Duration.ofDays(olderThanDays));
        log.info("Cleaning up completed cache jobs older than {}", cutoff);
        try {
            int deleted = tx.required(() -> jobs.deleteCompletedBefore(cutoff));
            log.info("Cleaned up {} old completed jobs", deleted);
            listener.onCleanupFinished(deleted, cutoff);
            return deleted;
        } catch (Exception e) {
            throw RecoveryException.unavailable("cleanup of completed jobs", e);
        }
    }

    /** 진단용: RUNNING인데 stalePeriod 동안 진행이 없는 잡 */
    public List<String> findStaleJobIds(Duration stalePeriod) throws RecoveryException {
        if (stalePeriod == null || stalePeriod.isNegative()) {
            throw new IllegalArgumentException("stalePeriod must be >= 0: " + stalePeriod);
        }
        Instant threshold = clock.now().minus(stalePeriod);
        try {
            List<JobState> stale = tx.required(() -> jobs.findStaleRunning(threshold));
            List<String> ids = new ArrayList<>(stale.size());
            for (JobState j : stale) ids.add(j.jobId());
            return ids;
        } catch (Exception e) {
            throw RecoveryException.unavailable("listing stale jobs", e);
        }
    }

    public Duration resumeTimeout() { return resumeTimeout; }

    @Override
    public void close() {
        if (ownsWorkers) workers.shutdownNow();
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "recache-resume-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
