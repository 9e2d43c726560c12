package com.exforge.ir;

import com.exforge.compiler.ast.TypedExpr;
import com.exforge.compiler.naming.ElixirNaming;
import com.exforge.compiler.naming.IdentifierNaming;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.backend.PrintConfig;
import com.exforge.ir.lowering.TypedTreeBuilder;
import com.exforge.ir.lowering.patterns.PatternRegistry;
import com.exforge.ir.pass.FreshNameGenerator;
import com.exforge.ir.pass.PassConfig;
import com.exforge.ir.pass.PassContext;
import com.exforge.ir.pass.PassPipeline;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * 编译器门面。
 * 管线：类型化树 → 中间 AST（模式库参与构建）→ pass 流水线 → Elixir 源码。
 * <p>
 * 每次编译使用新的 {@link FreshNameGenerator}，构建、pass 和打印共享它，
 * 同一编译单元内生成的名字不会重复。实例本身没有可变状态，可被多个线程同时使用。
 */
public class ExforgeCompiler {

    private final PassPipeline pipeline;
    private final PrintConfig printConfig;
    private final IdentifierNaming naming;

    public ExforgeCompiler() {
        this(PassConfig.defaults(), new PrintConfig());
    }

    public ExforgeCompiler(PassConfig passConfig, PrintConfig printConfig) {
        this(passConfig, printConfig, new ElixirNaming());
    }

    public ExforgeCompiler(PassConfig passConfig, PrintConfig printConfig, IdentifierNaming naming) {
        this.pipeline = PassPipeline.createDefault(passConfig);
        this.printConfig = printConfig != null ? printConfig : new PrintConfig();
        this.naming = naming != null ? naming : new ElixirNaming();
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    /**
     * 编译一棵类型化树，返回 Elixir 源码。
     */
    public String compile(TypedExpr root) {
        FreshNameGenerator names = new FreshNameGenerator();
        ElixirNode lowered = lower(root, names);
        return new ElixirPrinter(printConfig, names).print(lowered);
    }

    /**
     * 构建并执行 pass 流水线，返回打印前的中间 AST。
     */
    public ElixirNode lower(TypedExpr root) {
        return lower(root, new FreshNameGenerator());
    }

    private ElixirNode lower(TypedExpr root, FreshNameGenerator names) {
        if (root == null) {
            throw new IllegalArgumentException("typed tree root is required");
        }
        TypedTreeBuilder builder = new TypedTreeBuilder(naming, names, PatternRegistry.createDefault());
        ElixirNode tree = builder.build(root);
        return pipeline.run(tree, new PassContext(names));
    }

    /**
     * 编译并写入文件（UTF-8），必要时创建父目录。
     */
    public void compileToFile(TypedExpr root, File outFile) throws IOException {
        String source = compile(root);
        File parent = outFile.getAbsoluteFile().getParentFile();
        if (parent != null) {
            Files.createDirectories(parent.toPath());
        }
        Files.write(outFile.toPath(), source.getBytes(StandardCharsets.UTF_8));
    }
}
