package io.poolscope.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.poolscope.config.PoolScopeConfig;
import io.poolscope.engine.RawScopedConfig;
import io.poolscope.error.NotFoundException;
import io.poolscope.observability.ScopeAuditLog;
import io.poolscope.store.ScopeDocument;
import io.poolscope.storage.Database;
import io.poolscope.storage.SqliteScopeStore;
import io.poolscope.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "poolscope",
        mixinStandardHelpOptions = true,
        description = "Pool-scoped configuration store CLI",
        subcommands = {
                PoolScopeCommand.InitCommand.class,
                PoolScopeCommand.ScopesCommand.class,
                PoolScopeCommand.ShowCommand.class,
                PoolScopeCommand.SetFieldCommand.class,
                PoolScopeCommand.UnsetFieldCommand.class,
                PoolScopeCommand.RemoveCommand.class,
                PoolScopeCommand.AuditTailCommand.class,
                PoolScopeCommand.AuditVerifyCommand.class
        }
)
public final class PoolScopeCommand implements Runnable {
    static final String BASE_LABEL = "<base>";

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Configuration namespace (maps to collection scoped_<namespace>)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | scopes | show | set-field | unset-field | remove | audit-tail | audit-verify");
    }

    PoolScopeConfig config() {
        return PoolScopeConfig.fromRoot(root);
    }

    RawScopedConfig scopedConfig() {
        Database database = new Database(config());
        database.init();
        return new RawScopedConfig(new SqliteScopeStore(database), namespace, new ScopeAuditLog(config().auditFile()));
    }

    static String label(String scope) {
        return scope.isEmpty() ? BASE_LABEL : scope;
    }

    static JsonNode parseValue(String raw) {
        try {
            JsonNode node = Jsons.mapper().readTree(raw);
            return node == null || node.isMissingNode() ? TextNode.valueOf(raw) : node;
        } catch (JsonProcessingException e) {
            // not JSON, store the literal text
            return TextNode.valueOf(raw);
        }
    }

    @Command(name = "init", description = "Initialize data directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PoolScopeCommand parent;

        @Override
        public Integer call() {
            new Database(parent.config()).init();
            System.out.println("Initialized poolscope at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "scopes", description = "List stored scopes of the namespace")
    static final class ScopesCommand implements Callable<Integer> {
        @ParentCommand
        PoolScopeCommand parent;

        @Override
        public Integer call() {
            List<String> scopes = parent.scopedConfig().scopes();
            for (String scope : scopes) {
                System.out.println(label(scope));
            }
            return 0;
        }
    }

    @Command(name = "show", description = "Print the stored entry of a scope")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        PoolScopeCommand parent;

        @Option(names = {"--scope"}, description = "Pool scope, base scope when omitted", defaultValue = "")
        String scope;

        @Override
        public Integer call() {
            Optional<ScopeDocument> doc = parent.scopedConfig().find(scope);
            if (doc.isEmpty()) {
                System.err.println("No entry for scope: " + label(scope));
                return 2;
            }
            System.out.println(Jsons.toJson(doc.get().value()));
            return 0;
        }
    }

    @Command(name = "set-field", description = "Set one field of a scope entry, creating the entry if needed")
    static final class SetFieldCommand implements Callable<Integer> {
        @ParentCommand
        PoolScopeCommand parent;

        @Option(names = {"--scope"}, description = "Pool scope, base scope when omitted", defaultValue = "")
        String scope;

        @Option(names = {"--if-empty"}, description = "Only set when the field is absent or empty (atomic)")
        boolean ifEmpty;

        @Parameters(index = "0", description = "Field name, case-insensitive, dots for nested fields")
        String field;

        @Parameters(index = "1", description = "JSON value; non-JSON input is stored as a string")
        String value;

        @Override
        public Integer call() {
            RawScopedConfig config = parent.scopedConfig();
            JsonNode parsed = parseValue(value);
            if (ifEmpty) {
                boolean applied = config.setFieldAtomic(scope, field, parsed);
                System.out.println(applied ? "applied" : "not applied: field already set");
                return applied ? 0 : 3;
            }
            config.setField(scope, field, parsed);
            System.out.println("updated");
            return 0;
        }
    }

    @Command(name = "unset-field", description = "Remove one field of a scope entry")
    static final class UnsetFieldCommand implements Callable<Integer> {
        @ParentCommand
        PoolScopeCommand parent;

        @Option(names = {"--scope"}, description = "Pool scope, base scope when omitted", defaultValue = "")
        String scope;

        @Parameters(index = "0", description = "Field name")
        String field;

        @Override
        public Integer call() {
            parent.scopedConfig().removeField(scope, field);
            System.out.println("updated");
            return 0;
        }
    }

    @Command(name = "remove", description = "Delete the whole entry of a scope")
    static final class RemoveCommand implements Callable<Integer> {
        @ParentCommand
        PoolScopeCommand parent;

        @Option(names = {"--scope"}, description = "Pool scope, base scope when omitted", defaultValue = "")
        String scope;

        @Override
        public Integer call() {
            try {
                parent.scopedConfig().remove(scope);
            } catch (NotFoundException e) {
                System.err.println("No entry for scope: " + label(scope));
                return 2;
            }
            System.out.println("removed " + label(scope));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        PoolScopeCommand parent;

        @Option(names = {"--limit"}, description = "Number of rows", defaultValue = "20")
        int limit;

        @Override
        public Integer call() {
            ScopeAuditLog auditLog = new ScopeAuditLog(parent.config().auditFile());
            for (JsonNode row : auditLog.tail(limit)) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        PoolScopeCommand parent;

        @Override
        public Integer call() {
            int broken = new ScopeAuditLog(parent.config().auditFile()).verify();
            if (broken > 0) {
                System.out.println("audit chain broken at row " + broken);
                return 1;
            }
            System.out.println("audit chain ok");
            return 0;
        }
    }
}
