package com.exforge.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * exforge CLI 入口点（picocli）
 */
@Command(name = "exforge", version = "exforge 0.1.0",
         mixinStandardHelpOptions = true,
         description = "将类型化表达式树转译为 Elixir 源码",
         subcommands = {TranspileCommand.class, PassesCommand.class})
public class Main implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static CommandLine commandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
