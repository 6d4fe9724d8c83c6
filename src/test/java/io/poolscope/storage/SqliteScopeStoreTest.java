package io.poolscope.storage;

import io.poolscope.config.PoolScopeConfig;
import io.poolscope.fixtures.TempDirs;
import io.poolscope.store.ScopeCollection;
import io.poolscope.store.ScopeCollectionContract;
import io.poolscope.store.ScopeStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

final class SqliteScopeStoreTest extends ScopeCollectionContract {
    private final List<Path> roots = new ArrayList<>();

    @Override
    protected ScopeStore store() throws Exception {
        Path root = Files.createTempDirectory("poolscope-sqlite-");
        roots.add(root);
        Database db = new Database(PoolScopeConfig.fromRoot(root.toString()));
        db.init();
        return new SqliteScopeStore(db);
    }

    @AfterEach
    void cleanup() throws Exception {
        for (Path root : roots) {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void entriesSurviveReopeningTheDatabase() throws Exception {
        Path root = Files.createTempDirectory("poolscope-sqlite-reopen-");
        roots.add(root);
        PoolScopeConfig config = PoolScopeConfig.fromRoot(root.toString());
        Database first = new Database(config);
        first.init();
        try (ScopeCollection coll = new SqliteScopeStore(first).collection("scoped_test")) {
            coll.upsertById("p1", json("{\"image\":\"a\"}"));
        }

        Database second = new Database(config);
        second.init();
        try (ScopeCollection coll = new SqliteScopeStore(second).collection("scoped_test")) {
            Assertions.assertEquals("a", coll.findById("p1").orElseThrow().value().path("image").asText());
        }
        Assertions.assertTrue(Files.exists(config.dbFile()));
    }

    @Test
    void initEnablesWalJournal() throws Exception {
        Path root = Files.createTempDirectory("poolscope-sqlite-wal-");
        roots.add(root);
        Database db = new Database(PoolScopeConfig.fromRoot(root.toString()));
        db.init();
        try (Connection conn = db.openConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
            Assertions.assertTrue(rs.next());
            Assertions.assertEquals("wal", rs.getString(1).toLowerCase());
        }
    }
}
