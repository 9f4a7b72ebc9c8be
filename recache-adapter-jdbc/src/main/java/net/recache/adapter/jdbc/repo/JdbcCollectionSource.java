package net.recache.adapter.jdbc.repo;

import net.recache.adapter.jdbc.TxContext;
import net.recache.adapter.jdbc.mapper.RowMappers;
import net.recache.core.model.CollectionItem;
import net.recache.core.model.SourceCollection;
import net.recache.core.spi.CollectionSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** TB_COLLECTION / TB_COLLECTION_ITEM 읽기 전용. 행이 없으면 empty, DB 오류는 그대로 던진다 */
public final class JdbcCollectionSource implements CollectionSource {
    private final DataSource ds;

    public JdbcCollectionSource(DataSource ds) { this.ds = ds; }

    @Override
    public Optional<SourceCollection> findById(String collectionId) throws Exception {
        Connection c = TxContext.required();

        String name;
        String rootPath;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT NAME, ROOT_PATH FROM TB_COLLECTION WHERE COLLECTION_ID = ?")) {
            ps.setString(1, collectionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                name = rs.getString("NAME");
                rootPath = rs.getString("ROOT_PATH");
            }
        }

        List<CollectionItem> items = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT ITEM_ID, RELATIVE_PATH, FILENAME
                  FROM TB_COLLECTION_ITEM
                 WHERE COLLECTION_ID = ?
                 ORDER BY SEQ ASC, ITEM_ID ASC
            """)) {
            ps.setString(1, collectionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) items.add(RowMappers.toCollectionItem(rs));
            }
        }
        return Optional.of(new SourceCollection(collectionId, name, rootPath, items));
    }
}
