package com.exforge.cli;

import com.exforge.compiler.ast.TypedExpr;
import com.exforge.ir.ExforgeCompiler;
import com.exforge.ir.InternalCompilerError;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * picocli transpile 子命令：读取 JSON 类型化树，输出 Elixir 源码
 */
@Command(name = "transpile", description = "将 JSON 类型化树转译为 Elixir 源码")
public class TranspileCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(TranspileCommand.class.getName());

    /** 输入或配置错误 */
    static final int EXIT_USAGE = 2;
    /** 编译器内部错误 */
    static final int EXIT_INTERNAL = 3;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "JSON 类型化树文件")
    Path input;

    @Option(names = {"-o", "--output"}, description = "输出 .ex 文件（默认写到标准输出）")
    Path output;

    @Option(names = "--config", description = "JSON 配置文件")
    Path config;

    @Option(names = "--disable-pass", description = "禁用指定 pass（可重复）")
    List<String> disabledPasses = new ArrayList<>();

    @Option(names = "--indent-size", description = "缩进空格数（覆盖配置文件）")
    Integer indentSize;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            CompilerSettings settings = config != null
                    ? new PassConfigLoader().load(config)
                    : CompilerSettings.defaults();
            for (String pass : disabledPasses) {
                PassConfigLoader.requireKnown(pass, PassConfigLoader.knownPasses());
                settings.getPassConfig().disable(pass);
            }
            if (indentSize != null) {
                settings.getPrintConfig().setIndentSize(indentSize);
            }

            String json = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
            TypedExpr tree = new TypedTreeJsonReader(input.getFileName().toString()).read(json);
            String source = new ExforgeCompiler(settings.getPassConfig(), settings.getPrintConfig()).compile(tree);

            if (output != null) {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.write(output, source.getBytes(StandardCharsets.UTF_8));
                LOG.info("wrote " + output);
            } else {
                PrintWriter out = spec.commandLine().getOut();
                out.print(source);
                out.flush();
            }
            return 0;
        } catch (IOException e) {
            err.println("错误: 无法读写文件 - " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            return EXIT_USAGE;
        } catch (InternalCompilerError e) {
            LOG.log(Level.SEVERE, "internal compiler error", e);
            err.println("内部错误: " + e.getMessage());
            return EXIT_INTERNAL;
        } finally {
            err.flush();
        }
    }
}
