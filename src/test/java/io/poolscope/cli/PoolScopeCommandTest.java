package io.poolscope.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.poolscope.config.PoolScopeConfig;
import io.poolscope.engine.RawScopedConfig;
import io.poolscope.fixtures.TempDirs;
import io.poolscope.storage.Database;
import io.poolscope.storage.SqliteScopeStore;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class PoolScopeCommandTest {

    @Test
    void setFieldWritesIntoNamespaceCollection() throws Exception {
        Path root = Files.createTempDirectory("poolscope-cli-set-");
        try {
            assertEquals(0, run(root, "init"));
            assertEquals(0, run(root, "--namespace", "agents", "set-field", "--scope", "p1", "MaxContainers", "5"));
            assertEquals(0, run(root, "--namespace", "agents", "set-field", "--scope", "p1", "image", "agent:2"));
            assertEquals(0, run(root, "--namespace", "agents", "set-field", "limits", "{\"cpu\":2}"));

            RawScopedConfig raw = raw(root, "agents");
            JsonNode pool = raw.find("p1").orElseThrow().value();
            assertEquals(5, pool.path("maxcontainers").asInt());
            assertEquals("agent:2", pool.path("image").asText());
            assertEquals(2, raw.find("").orElseThrow().value().path("limits").path("cpu").asInt());
            assertEquals(List.of("", "p1"), raw.scopes());
            assertEquals(0, run(root, "--namespace", "agents", "scopes"));
            assertEquals(0, run(root, "--namespace", "agents", "show", "--scope", "p1"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void ifEmptySetsOnlyOnce() throws Exception {
        Path root = Files.createTempDirectory("poolscope-cli-atomic-");
        try {
            assertEquals(0, run(root, "set-field", "--scope", "p1", "--if-empty", "owner", "node-a"));
            assertEquals(3, run(root, "set-field", "--scope", "p1", "--if-empty", "owner", "node-b"));
            assertEquals(0, run(root, "unset-field", "--scope", "p1", "owner"));
            assertEquals(0, run(root, "set-field", "--scope", "p1", "--if-empty", "owner", "node-c"));

            assertEquals("node-c", raw(root, "default").find("p1").orElseThrow().value().path("owner").asText());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void removeAndShowReportMissingScopes() throws Exception {
        Path root = Files.createTempDirectory("poolscope-cli-remove-");
        try {
            assertEquals(2, run(root, "remove", "--scope", "ghost"));
            assertEquals(2, run(root, "show", "--scope", "ghost"));
            assertEquals(0, run(root, "unset-field", "--scope", "ghost", "image"));

            assertEquals(0, run(root, "set-field", "--scope", "p1", "image", "agent:1"));
            assertEquals(0, run(root, "remove", "--scope", "p1"));
            assertTrue(raw(root, "default").find("p1").isEmpty());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void auditCommandsReadTheChain() throws Exception {
        Path root = Files.createTempDirectory("poolscope-cli-audit-");
        try {
            assertEquals(0, run(root, "set-field", "--scope", "p1", "image", "agent:1"));
            assertEquals(0, run(root, "remove", "--scope", "p1"));
            assertEquals(0, run(root, "audit-tail", "--limit", "5"));
            assertEquals(0, run(root, "audit-verify"));

            Path auditFile = PoolScopeConfig.fromRoot(root.toString()).auditFile();
            assertEquals(2, Files.readAllLines(auditFile).size());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void parseValueFallsBackToText() {
        assertTrue(PoolScopeCommand.parseValue("42").isInt());
        assertTrue(PoolScopeCommand.parseValue("{\"a\":1}").isObject());
        assertEquals("agent:1", PoolScopeCommand.parseValue("agent:1").asText());
        assertEquals("", PoolScopeCommand.parseValue("").asText());
        assertEquals("<base>", PoolScopeCommand.label(""));
    }

    private static int run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new PoolScopeCommand()).execute(full);
    }

    private static RawScopedConfig raw(Path root, String namespace) {
        Database db = new Database(PoolScopeConfig.fromRoot(root.toString()));
        db.init();
        return new RawScopedConfig(new SqliteScopeStore(db), namespace);
    }
}
