package com.websearch.document;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * documents.db：docId → (url, source) 的 SQLite 表。
 *
 * <p>表内容只在构建提交或文档映射重建时整体替换，查询期只读。
 */
public final class DocumentTable implements AutoCloseable {
    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS documents (
                doc_id  INTEGER PRIMARY KEY,
                url     TEXT NOT NULL,
                source  TEXT NOT NULL
            )
            """;
    private static final String INSERT_SQL = "INSERT INTO documents(doc_id, url, source) VALUES (?, ?, ?)";
    private static final String SELECT_SQL = "SELECT doc_id, url, source FROM documents";

    private final Path dbPath;
    private final Connection connection;

    public DocumentTable(Path dbPath) {
        this.dbPath = dbPath;
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            try (Statement statement = connection.createStatement()) {
                statement.execute(CREATE_TABLE_SQL);
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("打开文档表失败: " + dbPath, sqlException);
        }
    }

    /**
     * 在同一事务内清空表并写入全部文档；失败时回滚，表保持原样。
     *
     * @throws IllegalStateException 写入失败（例如 docId 重复）时抛出
     */
    public void replaceAll(Collection<Document> documents) {
        try {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement();
                 PreparedStatement insert = connection.prepareStatement(INSERT_SQL)) {
                statement.executeUpdate("DELETE FROM documents");
                for (Document document : documents) {
                    insert.setInt(1, document.docId());
                    insert.setString(2, document.url());
                    insert.setString(3, document.source());
                    insert.addBatch();
                }
                insert.executeBatch();
                connection.commit();
            } catch (SQLException sqlException) {
                rollbackAfterFailure(sqlException);
                throw sqlException;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("写入文档表失败: " + dbPath + ", count=" + documents.size(), sqlException);
        }
    }

    public Optional<Document> findById(int docId) {
        try (PreparedStatement query = connection.prepareStatement(SELECT_SQL + " WHERE doc_id = ?")) {
            query.setInt(1, docId);
            try (ResultSet resultSet = query.executeQuery()) {
                return resultSet.next() ? Optional.of(toDocument(resultSet)) : Optional.empty();
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询文档失败, docId=" + docId, sqlException);
        }
    }

    /**
     * 按 docId 升序返回全部文档。
     */
    public List<Document> findAll() {
        List<Document> documents = new ArrayList<>();
        try (PreparedStatement query = connection.prepareStatement(SELECT_SQL + " ORDER BY doc_id");
             ResultSet resultSet = query.executeQuery()) {
            while (resultSet.next()) {
                documents.add(toDocument(resultSet));
            }
            return documents;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取文档表失败: " + dbPath, sqlException);
        }
    }

    public int count() {
        try (PreparedStatement query = connection.prepareStatement("SELECT COUNT(*) FROM documents");
             ResultSet resultSet = query.executeQuery()) {
            return resultSet.getInt(1);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("统计文档数失败: " + dbPath, sqlException);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭文档表失败: " + dbPath, sqlException);
        }
    }

    private static Document toDocument(ResultSet resultSet) throws SQLException {
        return new Document(resultSet.getInt("doc_id"), resultSet.getString("url"), resultSet.getString("source"));
    }

    private void rollbackAfterFailure(SQLException cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackException) {
            cause.addSuppressed(rollbackException);
        }
    }
}
