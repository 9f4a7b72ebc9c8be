package net.recache.adapter.jdbc.repo;

import net.recache.adapter.jdbc.JdbcUtil;
import net.recache.adapter.jdbc.TxContext;
import net.recache.adapter.jdbc.mapper.RowMappers;
import net.recache.core.model.JobState;
import net.recache.core.model.JobStatus;
import net.recache.core.spi.JobStateRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * TB_CACHE_JOB + 아이템 기록(TB_CACHE_JOB_ITEM) + 계획 목록(TB_CACHE_JOB_PLAN).
 * - 모든 메서드는 TxContext 커넥션만 사용
 * - 처리/스킵 카운터는 아이템 행이 새로 들어갔을 때만 같은 트랜잭션에서 +1
 */
public final class JdbcJobStateRepository implements JobStateRepository {
    static final String PROCESSED = "PROCESSED";
    static final String SKIPPED = "SKIPPED";

    private static final int ERROR_MESSAGE_MAX = 2000;

    private final DataSource ds;

    public JdbcJobStateRepository(DataSource ds) { this.ds = ds; }

    @Override
    public List<JobState> findIncomplete() throws Exception {
        return findMany("""
                SELECT *
                  FROM TB_CACHE_JOB
                 WHERE STATUS <> 'COMPLETED'
                 ORDER BY CREATED_AT ASC, JOB_ID ASC
            """, ps -> {});
    }

    @Override
    public Optional<JobState> findByJobId(String jobId) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM TB_CACHE_JOB WHERE JOB_ID = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(load(c, rs));
            }
        }
    }

    @Override
    public void insert(JobState job) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_CACHE_JOB
                    (JOB_ID, COLLECTION_ID, COLLECTION_NAME, STATUS, TOTAL_IMAGES, PROCESSED_CNT, SKIPPED_CNT,
                     CAN_RESUME, CACHE_WIDTH, CACHE_HEIGHT, QUALITY, FORMAT, CACHE_FOLDER_PATH, ERROR_MESSAGE,
                     CREATED_AT, UPDATED_AT, STARTED_AT, COMPLETED_AT, LAST_PROGRESS_AT)
                VALUES (?, ?, ?, ?, ?, 0, 0, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """)) {
            int i = 1;
            ps.setString(i++, job.jobId());
            ps.setString(i++, job.collectionId());
            ps.setString(i++, job.collectionName());
            ps.setString(i++, job.status().code());
            ps.setInt(i++, job.totalImages());
            ps.setString(i++, JdbcUtil.yn(job.canResume()));
            ps.setInt(i++, job.cacheWidth());
            ps.setInt(i++, job.cacheHeight());
            ps.setInt(i++, job.quality());
            ps.setString(i++, job.format());
            ps.setString(i++, job.cacheFolderPath());
            ps.setString(i++, truncate(job.errorMessage()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.createdAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.updatedAt() == null ? job.createdAt() : job.updatedAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.startedAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.completedAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(job.lastProgressAt()));
            ps.executeUpdate();
        }

        if (!job.plannedImageIds().isEmpty()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO TB_CACHE_JOB_PLAN (JOB_ID, ITEM_ID, SEQ) VALUES (?, ?, ?)")) {
                int seq = 0;
                for (String itemId : job.plannedImageIds()) {
                    ps.setString(1, job.jobId());
                    ps.setString(2, itemId);
                    ps.setInt(3, seq++);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }

        // 이미 기록된 아이템이 있는 상태로 옮겨오는 경우(마이그레이션 등)
        for (String itemId : job.processedImageIds()) addItem(c, job.jobId(), itemId, PROCESSED);
        for (String itemId : job.skippedImageIds()) addItem(c, job.jobId(), itemId, SKIPPED);
    }

    @Override
    public void updateStatus(String jobId, JobStatus status, String reason) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_CACHE_JOB
                   SET STATUS           = ?,
                       ERROR_MESSAGE    = NVL(?, ERROR_MESSAGE),
                       STARTED_AT       = CASE WHEN ? = 'RUNNING' AND STARTED_AT IS NULL THEN CURRENT_TIMESTAMP ELSE STARTED_AT END,
                       COMPLETED_AT     = CASE WHEN ? = 'COMPLETED' THEN CURRENT_TIMESTAMP ELSE COMPLETED_AT END,
                       LAST_PROGRESS_AT = CURRENT_TIMESTAMP,
                       UPDATED_AT       = CURRENT_TIMESTAMP
                 WHERE JOB_ID = ?
            """)) {
            ps.setString(1, status.code());
            ps.setString(2, truncate(reason));
            ps.setString(3, status.code());
            ps.setString(4, status.code());
            ps.setString(5, jobId);
            ps.executeUpdate();
        }
    }

    /** 카운터/아이템 집합/캐시 파라미터는 건드리지 않는다. CAN_RESUME 는 'N' 에서 되돌아가지 않음 */
    @Override
    public void update(JobState job) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_CACHE_JOB
                   SET COLLECTION_NAME = ?,
                       CAN_RESUME      = CASE WHEN CAN_RESUME = 'N' THEN 'N' ELSE ? END,
                       ERROR_MESSAGE   = ?,
                       UPDATED_AT      = CURRENT_TIMESTAMP
                 WHERE JOB_ID = ?
            """)) {
            ps.setString(1, job.collectionName());
            ps.setString(2, JdbcUtil.yn(job.canResume()));
            ps.setString(3, truncate(job.errorMessage()));
            ps.setString(4, job.jobId());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_CACHE_JOB not found for JOB_ID=" + job.jobId());
            }
        }
    }

    @Override
    public boolean atomicAddSkipped(String jobId, String itemId) throws Exception {
        return addItem(TxContext.required(), jobId, itemId, SKIPPED);
    }

    @Override
    public boolean atomicAddProcessed(String jobId, String itemId) throws Exception {
        return addItem(TxContext.required(), jobId, itemId, PROCESSED);
    }

    @Override
    public List<JobState> findStaleRunning(Instant threshold) throws Exception {
        return findMany("""
                SELECT *
                  FROM TB_CACHE_JOB
                 WHERE STATUS = 'RUNNING'
                   AND LAST_PROGRESS_AT < ?
                 ORDER BY LAST_PROGRESS_AT ASC
            """, ps -> ps.setTimestamp(1, JdbcUtil.ts(threshold)));
    }

    /** 아이템/계획 행은 FK ON DELETE CASCADE 로 함께 삭제 */
    @Override
    public int deleteCompletedBefore(Instant cutoff) throws Exception {
        Connection c = TxContext.required();
        try (PreparedStatement ps = c.prepareStatement("""
                DELETE FROM TB_CACHE_JOB
                 WHERE STATUS = 'COMPLETED'
                   AND COMPLETED_AT < ?
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(cutoff));
            return ps.executeUpdate();
        }
    }

    // --- helpers ---

    /**
     * 아이템 기록 1회성: (JOB_ID, ITEM_ID) PK 에 MERGE 로 넣고, 실제로 들어갔을 때만 카운터 증가.
     * 동시 삽입으로 PK 위반이 나면 다른 쪽이 먼저 기록한 것이므로 false.
     */
    private static boolean addItem(Connection c, String jobId, String itemId, String disposition) throws SQLException {
        int inserted;
        try (PreparedStatement ps = c.prepareStatement("""
                MERGE INTO TB_CACHE_JOB_ITEM d
                USING (SELECT ? JOB_ID, ? ITEM_ID FROM dual) s
                   ON (d.JOB_ID = s.JOB_ID AND d.ITEM_ID = s.ITEM_ID)
                WHEN NOT MATCHED THEN INSERT (JOB_ID, ITEM_ID, DISPOSITION, RECORDED_AT)
                VALUES (s.JOB_ID, s.ITEM_ID, ?, CURRENT_TIMESTAMP)
            """)) {
            ps.setString(1, jobId);
            ps.setString(2, itemId);
            ps.setString(3, disposition);
            inserted = ps.executeUpdate();
        } catch (SQLIntegrityConstraintViolationException dup) {
            // ORA-02291(부모 잡 없음)은 중복이 아니므로 그대로 던진다
            if (dup.getErrorCode() != 1) throw dup;
            return false;
        }
        if (inserted == 0) return false;

        String counter = PROCESSED.equals(disposition) ? "PROCESSED_CNT" : "SKIPPED_CNT";
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE TB_CACHE_JOB SET " + counter + " = " + counter + " + 1,"
                        + " LAST_PROGRESS_AT = CURRENT_TIMESTAMP, UPDATED_AT = CURRENT_TIMESTAMP"
                        + " WHERE JOB_ID = ?")) {
            ps.setString(1, jobId);
            ps.executeUpdate();
        }
        return true;
    }

    private List<JobState> findMany(String sql, Binder binder) throws Exception {
        Connection c = TxContext.required();
        List<JobState> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(load(c, rs));
            }
        }
        return out;
    }

    private static JobState load(Connection c, ResultSet rs) throws SQLException {
        String jobId = rs.getString("JOB_ID");
        Set<String> planned = new LinkedHashSet<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT ITEM_ID FROM TB_CACHE_JOB_PLAN WHERE JOB_ID = ? ORDER BY SEQ")) {
            ps.setString(1, jobId);
            try (ResultSet r = ps.executeQuery()) {
                while (r.next()) planned.add(r.getString(1));
            }
        }

        Set<String> processed = new LinkedHashSet<>();
        Set<String> skipped = new LinkedHashSet<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT ITEM_ID, DISPOSITION FROM TB_CACHE_JOB_ITEM WHERE JOB_ID = ? ORDER BY RECORDED_AT, ITEM_ID")) {
            ps.setString(1, jobId);
            try (ResultSet r = ps.executeQuery()) {
                while (r.next()) {
                    if (PROCESSED.equals(r.getString(2))) processed.add(r.getString(1));
                    else skipped.add(r.getString(1));
                }
            }
        }
        return RowMappers.toJobState(rs, planned, processed, skipped);
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= ERROR_MESSAGE_MAX) return s;
        return s.substring(0, ERROR_MESSAGE_MAX);
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
