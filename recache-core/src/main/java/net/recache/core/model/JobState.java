package net.recache.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 캐시 생성 잡 1건의 영속 상태.
 * <p>
 * plannedImageIds는 잡 생성 시점의 컬렉션 구성 스냅샷(없으면 빈 집합)이며,
 * processedImageIds / skippedImageIds는 저장소의 원자적 연산으로만 늘어난다.
 * 캐시 파라미터(width/height/quality/format/cacheFolderPath)는 생성 후 불변.
 */
public record JobState(
        String jobId,
        String collectionId,
        String collectionName,
        JobStatus status,
        int totalImages,
        Set<String> plannedImageIds,
        Set<String> processedImageIds,
        Set<String> skippedImageIds,
        boolean canResume,
        int cacheWidth,
        int cacheHeight,
        int quality,
        String format,
        String cacheFolderPath,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt,
        Instant lastProgressAt
) {
    public static final String DEFAULT_FORMAT = "jpeg";

    public JobState {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(collectionId, "collectionId");
        Objects.requireNonNull(status, "status");
        if (totalImages < 0) throw new IllegalArgumentException("totalImages must be >= 0: " + totalImages);
        plannedImageIds = frozen(plannedImageIds);
        processedImageIds = frozen(processedImageIds);
        skippedImageIds = frozen(skippedImageIds);
        for (String id : skippedImageIds) {
            if (processedImageIds.contains(id)) {
                throw new IllegalArgumentException("item " + id + " is both processed and skipped in job " + jobId);
            }
        }
        if (format == null || format.isBlank()) format = DEFAULT_FORMAT;
    }

    /** 제출 직후 상태: PENDING, 재개 가능, 처리/스킵 없음 */
    public static JobState ofNew(String jobId,
                                 String collectionId,
                                 String collectionName,
                                 Collection<String> plannedImageIds,
                                 String cacheFolderPath,
                                 int cacheWidth,
                                 int cacheHeight,
                                 int quality,
                                 String format,
                                 Instant now) {
        Set<String> planned = frozen(plannedImageIds);
        return new JobState(jobId, collectionId, collectionName, JobStatus.PENDING, planned.size(),
                planned, Set.of(), Set.of(), true,
                cacheWidth, cacheHeight, quality, format, cacheFolderPath,
                null, now, now, null, null, null);
    }

    public boolean isProcessed(String itemId) { return processedImageIds.contains(itemId); }

    public boolean isSkipped(String itemId) { return skippedImageIds.contains(itemId); }

    /** (processed + skipped) / total, 0..100. 컬렉션이 늘어난 경우 100에서 자른다. */
    public int progressPercent() {
        if (totalImages == 0) return 0;
        long done = (long) processedImageIds.size() + skippedImageIds.size();
        return (int) Math.min(100, done * 100 / totalImages);
    }

    /** 보고용 잔여 추정치. 재개 판단에는 쓰지 않는다. */
    public int remainingEstimate() {
        return Math.max(0, totalImages - processedImageIds.size() - skippedImageIds.size());
    }

    public JobState withResumeDisabled(Instant at) {
        return new JobState(jobId, collectionId, collectionName, status, totalImages,
                plannedImageIds, processedImageIds, skippedImageIds, false,
                cacheWidth, cacheHeight, quality, format, cacheFolderPath,
                errorMessage, createdAt, at, startedAt, completedAt, lastProgressAt);
    }

    private static Set<String> frozen(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) return Set.of();
        return Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }
}
