package net.recache.core.model;

import java.util.Objects;

/**
 * 캐시 렌더링 워커로 가는 작업 메시지 1건 (아이템 1개 = 메시지 1개).
 * origin은 진단용 출처 태그. 복구 경로는 "JobRecovery_{jobId}".
 */
public record WorkMessage(
        String jobId,
        String itemId,
        String collectionId,
        String sourcePath,
        String destinationPath,
        int width,
        int height,
        int quality,
        String format,
        boolean forceRegenerate,
        String origin
) {
    public static final String RECOVERY_ORIGIN_PREFIX = "JobRecovery_";

    public WorkMessage {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(collectionId, "collectionId");
        if (quality < 0 || quality > 100) {
            throw new IllegalArgumentException("quality must be within 0..100: " + quality);
        }
    }

    public static String recoveryOrigin(String jobId) {
        return RECOVERY_ORIGIN_PREFIX + jobId;
    }

    public boolean fromRecovery() {
        return origin != null && origin.startsWith(RECOVERY_ORIGIN_PREFIX);
    }
}
