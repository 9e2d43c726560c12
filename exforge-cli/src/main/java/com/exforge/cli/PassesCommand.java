package com.exforge.cli;

import com.exforge.ir.pass.ElixirPass;
import com.exforge.ir.pass.PassPipeline;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

/**
 * picocli passes 子命令：按执行顺序列出默认流水线
 */
@Command(name = "passes", description = "列出默认 pass 流水线")
public class PassesCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        int index = 1;
        for (ElixirPass pass : PassPipeline.createDefault().getPasses()) {
            out.printf("%2d. %s%n", index++, pass.getName());
        }
        out.flush();
    }
}
