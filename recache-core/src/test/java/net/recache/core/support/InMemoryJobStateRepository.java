package net.recache.core.support;

import net.recache.core.model.JobState;
import net.recache.core.model.JobStatus;
import net.recache.core.spi.Clock;
import net.recache.core.spi.JobStateRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** 테스트용 저장소. 잡 단위 synchronized로 아이템 기록의 1회성을 흉내낸다 */
public final class InMemoryJobStateRepository implements JobStateRepository {
    private final Map<String, JobState> rows = new ConcurrentHashMap<>();
    private final Clock clock;
    public final AtomicInteger writes = new AtomicInteger();

    public InMemoryJobStateRepository(Clock clock) { this.clock = clock; }

    public JobState get(String jobId) { return rows.get(jobId); }

    @Override
    public List<JobState> findIncomplete() {
        List<JobState> out = new ArrayList<>();
        for (JobState j : rows.values()) if (j.status() != JobStatus.COMPLETED) out.add(j);
        return out;
    }

    @Override
    public Optional<JobState> findByJobId(String jobId) { return Optional.ofNullable(rows.get(jobId)); }

    @Override
    public void insert(JobState job) {
        if (rows.putIfAbsent(job.jobId(), job) != null) throw new IllegalStateException("duplicate job " + job.jobId());
        writes.incrementAndGet();
    }

    @Override
    public synchronized void updateStatus(String jobId, JobStatus status, String reason) {
        JobState j = rows.get(jobId);
        if (j == null) return;
        Instant now = clock.now();
        rows.put(jobId, new JobState(j.jobId(), j.collectionId(), j.collectionName(), status, j.totalImages(),
                j.plannedImageIds(), j.processedImageIds(), j.skippedImageIds(), j.canResume(),
                j.cacheWidth(), j.cacheHeight(), j.quality(), j.format(), j.cacheFolderPath(),
                reason == null ? j.errorMessage() : reason, j.createdAt(), now,
                status == JobStatus.RUNNING && j.startedAt() == null ? now : j.startedAt(),
                status == JobStatus.COMPLETED ? now : j.completedAt(), now));
        writes.incrementAndGet();
    }

    @Override
    public synchronized void update(JobState job) {
        JobState j = rows.get(job.jobId());
        if (j == null) throw new IllegalStateException("job not found: " + job.jobId());
        rows.put(job.jobId(), j.canResume() && !job.canResume() ? j.withResumeDisabled(clock.now()) : j);
        writes.incrementAndGet();
    }

    @Override
    public synchronized boolean atomicAddSkipped(String jobId, String itemId) {
        JobState j = rows.get(jobId);
        if (j == null || j.isProcessed(itemId) || j.isSkipped(itemId)) return false;
        Set<String> skipped = new LinkedHashSet<>(j.skippedImageIds());
        skipped.add(itemId);
        rows.put(jobId, copy(j, j.processedImageIds(), skipped));
        writes.incrementAndGet();
        return true;
    }

    @Override
    public synchronized boolean atomicAddProcessed(String jobId, String itemId) {
        JobState j = rows.get(jobId);
        if (j == null || j.isProcessed(itemId) || j.isSkipped(itemId)) return false;
        Set<String> processed = new LinkedHashSet<>(j.processedImageIds());
        processed.add(itemId);
        rows.put(jobId, copy(j, processed, j.skippedImageIds()));
        writes.incrementAndGet();
        return true;
    }

    @Override
    public List<JobState> findStaleRunning(Instant threshold) {
        List<JobState> out = new ArrayList<>();
        for (JobState j : rows.values()) {
            if (j.status() == JobStatus.RUNNING && j.lastProgressAt() != null && j.lastProgressAt().isBefore(threshold)) {
                out.add(j);
            }
        }
        return out;
    }

    @Override
    public synchronized int deleteCompletedBefore(Instant cutoff) {
        int n = 0;
        for (JobState j : new ArrayList<>(rows.values())) {
            if (j.status() == JobStatus.COMPLETED && j.completedAt() != null && j.completedAt().isBefore(cutoff)) {
                rows.remove(j.jobId());
                n++;
            }
        }
        writes.incrementAndGet();
        return n;
    }

    /** 테스트 시드용: 상태/타임스탬프를 직접 지정 */
    public void put(JobState job) { rows.put(job.jobId(), job); }

    private JobState copy(JobState j, Set<String> processed, Set<String> skipped) {
        Instant now = clock.now();
        return new JobState(j.jobId(), j.collectionId(), j.collectionName(), j.status(), j.totalImages(),
                j.plannedImageIds(), processed, skipped, j.canResume(),
                j.cacheWidth(), j.cacheHeight(), j.quality(), j.format(), j.cacheFolderPath(),
                j.errorMessage(), j.createdAt(), now, j.startedAt(), j.completedAt(), now);
    }
}
