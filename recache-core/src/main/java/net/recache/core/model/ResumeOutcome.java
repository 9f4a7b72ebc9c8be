package net.recache.core.model;

/**
 * 잡 1건 재개 결과. success()가 재개 계약상의 boolean 결과이고,
 * disposition이 실패 사유(에러 종류)를 구분한다.
 */
public record ResumeOutcome(
        String jobId,
        Disposition disposition,
        int remaining,
        int published,
        int skipped,
        String reason
) {
    public enum Disposition {
        /** 남은 아이템을 큐에 발행함 */
        RESUMED,
        /** 이미 COMPLETED. 아무것도 바꾸지 않음 */
        ALREADY_COMPLETED,
        /** 남은 작업이 없거나 전부 스킵되어 COMPLETED로 마감 */
        COMPLETED_NOTHING_REMAINING,
        NOT_FOUND,
        NON_RESUMABLE,
        /** 컬렉션이 사라져 재개를 영구 차단함 */
        COLLECTION_MISSING,
        /** 협력자 I/O 실패 또는 타임아웃. 다음 기동 때 다시 시도 가능 */
        FAILED;

        public boolean success() {
            return this == RESUMED || this == ALREADY_COMPLETED || this == COMPLETED_NOTHING_REMAINING;
        }
    }

    public boolean success() { return disposition.success(); }

    public static ResumeOutcome of(String jobId, Disposition d, String reason) {
        return new ResumeOutcome(jobId, d, 0, 0, 0, reason);
    }

    public static ResumeOutcome dispatched(String jobId, Disposition d, int remaining, int published, int skipped) {
        return new ResumeOutcome(jobId, d, remaining, published, skipped, null);
    }
}
