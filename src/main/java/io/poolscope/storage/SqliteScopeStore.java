package io.poolscope.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.poolscope.error.NotFoundException;
import io.poolscope.error.StoreException;
import io.poolscope.store.ConditionalOutcome;
import io.poolscope.store.FieldPath;
import io.poolscope.store.ScopeCollection;
import io.poolscope.store.ScopeDocument;
import io.poolscope.store.ScopeFilter;
import io.poolscope.store.ScopeStore;
import io.poolscope.store.UpsertOutcome;
import io.poolscope.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Scope store persisted in a single SQLite table keyed by (collection, scope id). Entry values are
 * stored as compact JSON text; field-path writes are read-modify-write inside an immediate
 * transaction.
 */
public final class SqliteScopeStore implements ScopeStore {
    private final Database database;

    public SqliteScopeStore(Database database) {
        this.database = database;
    }

    @Override
    public ScopeCollection collection(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("collection name must not be blank");
        }
        try {
            return new SqliteCollection(name, database.openConnection());
        } catch (SQLException e) {
            throw new StoreException("Failed to open collection: " + name, e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<R> {
        R run(Connection c) throws SQLException;
    }

    private static final class SqliteCollection implements ScopeCollection {
        private final String name;
        private final Connection connection;

        private SqliteCollection(String name, Connection connection) {
            this.name = name;
            this.connection = connection;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<ScopeDocument> findById(String id) {
            try {
                return Optional.ofNullable(read(connection, id)).map(value -> new ScopeDocument(id, value));
            } catch (SQLException e) {
                throw new StoreException("Failed to find scope '" + id + "' in " + name, e);
            }
        }

        @Override
        public UpsertOutcome upsertById(String id, ObjectNode value) {
            return inTransaction("upsert scope '" + id + "'", c -> {
                boolean exists = read(c, id) != null;
                write(c, id, value);
                return exists ? UpsertOutcome.UPDATED : UpsertOutcome.CREATED;
            });
        }

        @Override
        public ConditionalOutcome conditionalUpsert(String id, String fieldPath, JsonNode value) {
            FieldPath path = FieldPath.parse(fieldPath);
            return inTransaction("conditionally set " + fieldPath + " on scope '" + id + "'", c -> {
                ObjectNode current = read(c, id);
                if (current != null && !path.isVacant(current)) {
                    return ConditionalOutcome.NOT_APPLIED;
                }
                ObjectNode next = current == null ? Jsons.storageMapper().createObjectNode() : current;
                path.write(next, value);
                write(c, id, next);
                return ConditionalOutcome.APPLIED;
            });
        }

        @Override
        public List<ScopeDocument> find(ScopeFilter filter) {
            StringBuilder sql = new StringBuilder("SELECT scope_id,value FROM scope_entries WHERE collection=?");
            List<String> ids = filter.ids();
            if (filter.isExcludingBase()) {
                sql.append(" AND scope_id<>''");
            } else {
                sql.append(" AND scope_id IN (").append(String.join(",", Collections.nCopies(ids.size(), "?"))).append(")");
            }
            sql.append(" ORDER BY scope_id");
            List<ScopeDocument> out = new ArrayList<>();
            try (PreparedStatement ps = connection.prepareStatement(sql.toString())) {
                ps.setString(1, name);
                for (int i = 0; i < ids.size(); i++) {
                    ps.setString(i + 2, ids.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new ScopeDocument(rs.getString("scope_id"), parse(rs.getString("value"))));
                    }
                }
                return out;
            } catch (SQLException e) {
                throw new StoreException("Failed to find scopes " + filter + " in " + name, e);
            }
        }

        @Override
        public List<String> listIds() {
            List<String> out = new ArrayList<>();
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT scope_id FROM scope_entries WHERE collection=? ORDER BY scope_id")) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(rs.getString(1));
                    }
                }
                return out;
            } catch (SQLException e) {
                throw new StoreException("Failed to list scopes in " + name, e);
            }
        }

        @Override
        public void updateFieldById(String id, String fieldPath, JsonNode value) {
            FieldPath path = FieldPath.parse(fieldPath);
            inTransaction("set " + fieldPath + " on scope '" + id + "'", c -> {
                ObjectNode current = read(c, id);
                ObjectNode next = current == null ? Jsons.storageMapper().createObjectNode() : current;
                path.write(next, value);
                write(c, id, next);
                return null;
            });
        }

        @Override
        public void unsetFieldById(String id, String fieldPath) {
            FieldPath path = FieldPath.parse(fieldPath);
            inTransaction("unset " + fieldPath + " on scope '" + id + "'", c -> {
                ObjectNode current = read(c, id);
                if (current == null) {
                    throw new NotFoundException(name, id);
                }
                path.remove(current);
                write(c, id, current);
                return null;
            });
        }

        @Override
        public void removeById(String id) {
            try (PreparedStatement ps = connection.prepareStatement(
                    "DELETE FROM scope_entries WHERE collection=? AND scope_id=?")) {
                ps.setString(1, name);
                ps.setString(2, id);
                if (ps.executeUpdate() == 0) {
                    throw new NotFoundException(name, id);
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to remove scope '" + id + "' from " + name, e);
            }
        }

        @Override
        public void close() {
            try {
                connection.close();
            } catch (SQLException e) {
                throw new StoreException("Failed to close collection: " + name, e);
            }
        }

        private <R> R inTransaction(String action, SqlWork<R> work) {
            try {
                connection.setAutoCommit(false);
                try {
                    R result = work.run(connection);
                    connection.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    connection.rollback();
                    throw e;
                } finally {
                    connection.setAutoCommit(true);
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to " + action + " in " + name, e);
            }
        }

        private ObjectNode read(Connection c, String id) throws SQLException {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT value FROM scope_entries WHERE collection=? AND scope_id=?")) {
                ps.setString(1, name);
                ps.setString(2, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? parse(rs.getString(1)) : null;
                }
            }
        }

        private void write(Connection c, String id, ObjectNode value) throws SQLException {
            long now = Instant.now().toEpochMilli();
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO scope_entries(collection,scope_id,value,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?)
                    ON CONFLICT(collection,scope_id) DO UPDATE SET value=excluded.value, updated_at_ms=excluded.updated_at_ms
                    """)) {
                ps.setString(1, name);
                ps.setString(2, id);
                ps.setString(3, Jsons.toCompactJson(value));
                ps.setLong(4, now);
                ps.setLong(5, now);
                ps.executeUpdate();
            }
        }

        private ObjectNode parse(String json) throws SQLException {
            try {
                JsonNode node = Jsons.storageMapper().readTree(json);
                if (node == null || !node.isObject()) {
                    throw new SQLException("Stored scope value is not a JSON object in " + name);
                }
                return (ObjectNode) node;
            } catch (JsonProcessingException e) {
                throw new SQLException("Stored scope value is not valid JSON in " + name, e);
            }
        }
    }
}
