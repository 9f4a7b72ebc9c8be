package net.recache.adapter.jdbc.mapper;

import net.recache.adapter.jdbc.JdbcUtil;
import net.recache.core.model.CollectionItem;
import net.recache.core.model.JobState;
import net.recache.core.model.JobStatus;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Set;

public final class RowMappers {
    private RowMappers() {}

    // --- TB_CACHE_JOB (+ 아이템 집합은 호출 측에서 채운다) ---
    public static JobState toJobState(ResultSet rs,
                                      Set<String> planned,
                                      Set<String> processed,
                                      Set<String> skipped) throws SQLException {
        return new JobState(
                rs.getString("JOB_ID"),
                rs.getString("COLLECTION_ID"),
                rs.getString("COLLECTION_NAME"),
                JobStatus.from(rs.getString("STATUS")),
                rs.getInt("TOTAL_IMAGES"),
                planned,
                processed,
                skipped,
                JdbcUtil.isY(rs.getString("CAN_RESUME")),
                rs.getInt("CACHE_WIDTH"),
                rs.getInt("CACHE_HEIGHT"),
                rs.getInt("QUALITY"),
                rs.getString("FORMAT"),
                rs.getString("CACHE_FOLDER_PATH"),
                rs.getString("ERROR_MESSAGE"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("COMPLETED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_PROGRESS_AT"))
        );
    }

    // --- TB_COLLECTION_ITEM ---
    public static CollectionItem toCollectionItem(ResultSet rs) throws SQLException {
        return new CollectionItem(
                rs.getString("ITEM_ID"),
                rs.getString("RELATIVE_PATH"),
                rs.getString("FILENAME")
        );
    }
}
