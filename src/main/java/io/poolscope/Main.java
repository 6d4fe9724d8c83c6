package io.poolscope;

import io.poolscope.cli.PoolScopeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PoolScopeCommand()).execute(args);
        System.exit(code);
    }
}
