package net.recache.core.service;

import net.recache.core.model.CollectionItem;
import net.recache.core.model.JobState;
import net.recache.core.model.JobStatus;
import net.recache.core.model.ResumeOutcome;
import net.recache.core.model.ResumeOutcome.Disposition;
import net.recache.core.model.SourceCollection;
import net.recache.core.model.WorkMessage;
import net.recache.core.path.CachePathResolver;
import net.recache.core.spi.Clock;
import net.recache.core.spi.CollectionSource;
import net.recache.core.spi.JobStateRepository;
import net.recache.core.spi.RecoveryListener;
import net.recache.core.spi.TxRunner;
import net.recache.core.spi.WorkQueuePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 잡 1건 재개.
 * <p>
 * 남은 작업은 저장된 대기 목록이 아니라 매번 "계획된 아이템 ∪ 현재 컬렉션 아이템 − 처리 완료 − 스킵"로 다시 계산한다.
 * 같은 잡을 동시에 재개해도 처리 완료 집합이 늘어나는 만큼 남은 작업이 줄어 수렴한다.
 * 인-프로세스 락은 잡지 않는다. 아이템 단위 배타성은 저장소의 원자 연산에 맡긴다.
 */
public final class ResumeExecutor {
    private static final Logger log = LoggerFactory.getLogger(ResumeExecutor.class);

    public static final String REASON_COLLECTION_NOT_FOUND = "collection not found";

    private final JobStateRepository jobs;
    private final CollectionSource collections;
    private final WorkQueuePublisher queue;
    private final TxRunner tx;
    private final Clock clock;
    private final RecoveryListener listener;

    public ResumeExecutor(JobStateRepository jobs,
                          CollectionSource collections,
                          WorkQueuePublisher queue,
                          TxRunner tx,
                          Clock clock,
                          RecoveryListener listener) {
        this.jobs = jobs;
        this.collections = collections;
        this.queue = queue;
        this.tx = tx;
        this.clock = clock;
        this.listener = listener == null ? RecoveryListener.NOOP : listener;
    }

    /** 재개 결정 순서: 로드 → 재개 게이트 → 완료 여부 → 컬렉션 → 남은 작업 계산 → 발행/스킵 */
    public ResumeOutcome resume(String jobId) {
        requireJobId(jobId);
        log.info("Resuming cache job {}", jobId);

        // 1) 잡 상태
        final JobState job;
        try {
            Optional<JobState> found = tx.required(() -> jobs.findByJobId(jobId));
            if (found.isEmpty()) {
                log.warn("Job {} not found", jobId);
                return failed(ResumeOutcome.of(jobId, Disposition.NOT_FOUND, "job not found"));
            }
            job = found.get();
        } catch (Exception e) {
            log.error("Loading job state failed for {}", jobId, e);
            return failed(ResumeOutcome.of(jobId, Disposition.FAILED, "job state unavailable: " + e.getMessage()));
        }

        // 2) 단방향 게이트: 부수효과 없이 종료
        if (!job.canResume()) {
            log.info("Job {} is marked non-resumable, leaving it alone", jobId);
            return failed(ResumeOutcome.of(jobId, Disposition.NON_RESUMABLE, "resume disabled"));
        }

        // 3) 이미 끝난 잡은 그대로 성공
        if (job.status() == JobStatus.COMPLETED) {
            log.info("Job {} is already completed", jobId);
            return resumed(ResumeOutcome.of(jobId, Disposition.ALREADY_COMPLETED, null));
        }

        // 4) 컬렉션: 비어 있음 = 실제 부재(영구 차단), 예외 = 일시 장애(차단하지 않음)
        final SourceCollection collection;
        try {
            Optional<SourceCollection> found = tx.required(() -> collections.findById(job.collectionId()));
            if (found.isEmpty()) {
                log.warn("Collection {} not found for job {}, disabling resumption", job.collectionId(), jobId);
                disable(jobId, REASON_COLLECTION_NOT_FOUND);
                return failed(ResumeOutcome.of(jobId, Disposition.COLLECTION_MISSING, REASON_COLLECTION_NOT_FOUND));
            }
            collection = found.get();
        } catch (Exception e) {
            log.error("Collection source unavailable for job {} (collection {})", jobId, job.collectionId(), e);
            return failed(ResumeOutcome.of(jobId, Disposition.FAILED, "collection source unavailable: " + e.getMessage()));
        }

        try {
            return dispatchRemaining(job, collection);
        } catch (Exception e) {
            log.error("Resuming job {} failed while dispatching", jobId, e);
            return failed(ResumeOutcome.of(jobId, Disposition.FAILED, "dispatch failed: " + e.getMessage()));
        }
    }

    /**
     * 재개 차단: canResume=false, status=FAILED(reason). 이미 차단된 잡이면 사유만 다시 기록한다.
     * 실패해도 던지지 않는다. 잡이 다음 주기까지 재개 가능 상태로 남는 편이 낫다.
     *
     * @return 잡을 찾아 기록했으면 true
     */
    public boolean disable(String jobId, String reason) {
        requireJobId(jobId);
        log.warn("Disabling resumption for job {}: {}", jobId, reason);
        try {
            boolean done = tx.required(() -> {
                Optional<JobState> found = jobs.findByJobId(jobId);
                if (found.isEmpty()) return false;
                jobs.update(found.get().withResumeDisabled(clock.now()));
                jobs.updateStatus(jobId, JobStatus.FAILED, reason);
                return true;
            });
            if (done) listener.onResumeDisabled(jobId, reason);
            else log.warn("Job {} not found, nothing to disable", jobId);
            return done;
        } catch (Exception e) {
            log.error("Disabling resumption failed for job {}", jobId, e);
            return false;
        }
    }

    private ResumeOutcome dispatchRemaining(JobState job, SourceCollection collection) throws Exception {
        final String jobId = job.jobId();

        // 5) 남은 작업: 계획분(생성 시 스냅샷) 먼저, 이후 새로 들어온 아이템.
        //    스킵으로 기록된 아이템은 처리 완료와 같이 취급한다(컬렉션에 다시 들어와도 재발행하지 않음)
        var candidates = new LinkedHashSet<String>(job.plannedImageIds());
        candidates.addAll(collection.itemIds());
        List<String> remaining = new ArrayList<>();
        for (String id : candidates) {
            if (!job.isProcessed(id) && !job.isSkipped(id)) remaining.add(id);
        }

        // 6) 처리는 끝났는데 상태 기록이 유실된 경우
        if (remaining.isEmpty()) {
            log.info("All items processed for job {}, marking as completed", jobId);
            tx.run(() -> jobs.updateStatus(jobId, JobStatus.COMPLETED, null));
            return resumed(ResumeOutcome.dispatched(jobId, Disposition.COMPLETED_NOTHING_REMAINING, 0, 0, 0));
        }

        log.info("Resuming job {}: {} items remaining out of {}", jobId, remaining.size(), job.totalImages());

        // 7) RUNNING 전환 후 아이템별 처리
        tx.run(() -> jobs.updateStatus(jobId, JobStatus.RUNNING, null));

        Map<String, CollectionItem> byId = collection.itemsById();
        int published = 0;
        int skipped = 0;
        for (String itemId : remaining) {
            CollectionItem item = byId.get(itemId);
            if (item == null) {
                boolean recorded = tx.required(() -> jobs.atomicAddSkipped(jobId, itemId));
                log.warn("Item {} not found in collection {}, skipping (newly recorded={})",
                        itemId, job.collectionId(), recorded);
                listener.onItemSkipped(jobId, itemId);
                skipped++;
                continue;
            }

            WorkMessage message = toMessage(job, collection, item);
            tx.run(() -> queue.publish(message));
            listener.onMessagePublished(jobId, itemId);
            published++;
        }

        // 전부 스킵됐다면 남은 작업이 없는 것과 같다
        if (published == 0) {
            log.info("No publishable items left for job {} ({} skipped), marking as completed", jobId, skipped);
            tx.run(() -> jobs.updateStatus(jobId, JobStatus.COMPLETED, null));
            return resumed(ResumeOutcome.dispatched(jobId, Disposition.COMPLETED_NOTHING_REMAINING,
                    remaining.size(), 0, skipped));
        }

        // 8) 계약은 발행 성공까지. 실제 렌더링 결과는 워커 몫
        log.info("Resumed job {}: queued {} items, skipped {}", jobId, published, skipped);
        return resumed(ResumeOutcome.dispatched(jobId, Disposition.RESUMED, remaining.size(), published, skipped));
    }

    private static WorkMessage toMessage(JobState job, SourceCollection collection, CollectionItem item) {
        String destination = CachePathResolver.resolve(
                job.cacheFolderPath(),
                job.collectionId(),
                item.id(),
                job.cacheWidth(),
                job.cacheHeight(),
                job.format());

        return new WorkMessage(
                job.jobId(),
                item.id(),
                job.collectionId(),
                item.fullPath(collection.rootPath()),
                destination,
                job.cacheWidth(),
                job.cacheHeight(),
                job.quality(),
                job.format(),
                false, // 재개는 이전 시도가 써 둔 결과를 덮어쓰지 않는다
                WorkMessage.recoveryOrigin(job.jobId()));
    }

    private ResumeOutcome resumed(ResumeOutcome outcome) {
        listener.onJobResumed(outcome);
        return outcome;
    }

    private ResumeOutcome failed(ResumeOutcome outcome) {
        listener.onResumeFailed(outcome);
        return outcome;
    }

    static void requireJobId(String jobId) {
        if (jobId == null || jobId.isBlank()) throw new IllegalArgumentException("jobId is required");
    }
}
