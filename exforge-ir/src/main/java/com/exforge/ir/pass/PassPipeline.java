package com.exforge.ir.pass;

import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.pass.elixir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 变换 pass 管线。
 * 按顺序对树折叠每个已启用的 pass；顺序有依赖关系，后面的 pass 依赖前面留下的形状。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<ElixirPass> passes = new ArrayList<>();
    private final PassConfig config;

    public PassPipeline(PassConfig config) {
        this.config = config != null ? config : PassConfig.defaults();
    }

    public PassPipeline() {
        this(PassConfig.defaults());
    }

    /**
     * 创建默认管线。
     */
    public static PassPipeline createDefault(PassConfig config) {
        PassPipeline pipeline = new PassPipeline(config);
        // 名字与结构
        pipeline.addPass(new ClauseLocalResolution());
        pipeline.addPass(new TempBindingCollapse());
        // 可变 → 不可变
        pipeline.addPass(new MutableToImmutable());
        pipeline.addPass(new ConditionalReassignment());
        pipeline.addPass(new RedundantNilInit());
        pipeline.addPass(new StatementContext());
        pipeline.addPass(new EffectLifting());
        // 惯用法重建
        pipeline.addPass(new LoopReconstruction());
        pipeline.addPass(new EnumTagPatterns());
        pipeline.addPass(new PipeIdioms());
        // 卫生与模块级收尾
        pipeline.addPass(new UsageHygiene());
        pipeline.addPass(new UnusedPrivateFunctions());
        pipeline.addPass(new ExceptionModules());
        pipeline.addPass(new BitwiseImport());
        return pipeline;
    }

    public static PassPipeline createDefault() {
        return createDefault(PassConfig.defaults());
    }

    public void addPass(ElixirPass pass) {
        passes.add(pass);
    }

    public List<ElixirPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public PassConfig getConfig() {
        return config;
    }

    /**
     * 依次执行所有已启用的 pass。
     *
     * @param root    中间 AST 根节点
     * @param context 当前编译单元的上下文
     * @return 变换后的根节点
     */
    public ElixirNode run(ElixirNode root, PassContext context) {
        ElixirNode current = root;
        for (ElixirPass pass : passes) {
            if (!config.isEnabled(pass.getName())) {
                LOG.finer("skip pass " + pass.getName());
                continue;
            }
            ElixirNode next = pass.run(current, context);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("pass " + pass.getName() + (next == current ? " (unchanged)" : " (rewritten)"));
            }
            current = next;
        }
        return current;
    }

    public ElixirNode run(ElixirNode root) {
        return run(root, new PassContext());
    }
}
