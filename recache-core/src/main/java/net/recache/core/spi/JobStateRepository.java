package net.recache.core.spi;

import net.recache.core.model.JobState;
import net.recache.core.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 잡 상태 저장소. 아이템 단위 기록(처리/스킵)의 원자성과 1회성은 구현체가 보장하며,
 * 코어는 이를 유일한 상호배제 수단으로 취급한다.
 */
public interface JobStateRepository {
    /** status != COMPLETED 인 잡 전부 (canResume 무관) */
    List<JobState> findIncomplete() throws Exception;

    Optional<JobState> findByJobId(String jobId) throws Exception;

    void insert(JobState job) throws Exception;

    /** COMPLETED면 completedAt 기록. reason이 null이면 기존 메시지 유지 */
    void updateStatus(String jobId, JobStatus status, String reason) throws Exception;

    /** 카운터/아이템 집합을 제외한 필드 갱신. canResume은 true→false 방향만 반영 */
    void update(JobState job) throws Exception;

    /** 스킵 기록: itemId당 1회만 반영. 새로 기록했으면 true */
    boolean atomicAddSkipped(String jobId, String itemId) throws Exception;

    /** 처리 완료 기록(렌더링 워커 쪽): itemId당 1회만 반영. 새로 기록했으면 true */
    boolean atomicAddProcessed(String jobId, String itemId) throws Exception;

    /** RUNNING인데 lastProgressAt이 threshold 이전인 잡 */
    List<JobState> findStaleRunning(Instant threshold) throws Exception;

    /** status=COMPLETED 이고 completedAt < cutoff 인 잡 삭제 */
    int deleteCompletedBefore(Instant cutoff) throws Exception;
}
