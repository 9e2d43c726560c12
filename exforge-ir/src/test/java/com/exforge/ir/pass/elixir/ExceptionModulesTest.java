package com.exforge.ir.pass.elixir;

import com.exforge.compiler.ast.SourceLocation;
import com.exforge.ir.ast.ElixirNode;
import com.exforge.ir.ast.Metadata;
import com.exforge.ir.ast.decl.EDef;
import com.exforge.ir.ast.decl.EModule;
import com.exforge.ir.ast.pattern.ElixirPattern;
import com.exforge.ir.backend.ElixirPrinter;
import com.exforge.ir.pass.PassContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.exforge.ir.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("ExceptionModules 测试")
class ExceptionModulesTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private static EModule run(EModule module) {
        return (EModule) new ExceptionModules().run(module, new PassContext());
    }

    private static EModule exceptionModule(List<String> fields, ElixirNode... body) {
        EModule module = new EModule(LOC, "MyError", Arrays.asList(body));
        Metadata metadata = Metadata.of(Metadata.EXCEPTION_MODULE, Boolean.TRUE);
        if (fields != null) metadata = metadata.with(Metadata.EXCEPTION_FIELDS, fields);
        return module.withMetadata(metadata);
    }

    private static EDef describe() {
        return new EDef(LOC, EDef.DefKind.DEF, "describe", Collections.<ElixirPattern>emptyList(), null,
                string("error"));
    }

    @Test
    @DisplayName("按字段元数据插入 defexception")
    void testFieldsFromMetadata() {
        EModule result = run(exceptionModule(Arrays.asList("message", "code"), describe()));
        assertThat(ElixirPrinter.canonical(result.getBody().get(0))).isEqualTo("defexception [:message, :code]");
        assertThat(result.getBody()).hasSize(2);
        assertThat(result.hasFlag(Metadata.EXCEPTION_MODULE)).isTrue();
    }

    @Test
    @DisplayName("没有字段时默认 message")
    void testDefaultField() {
        EModule result = run(exceptionModule(null));
        assertThat(ElixirPrinter.canonical(result)).isEqualTo("defmodule MyError do\n  defexception [:message]\nend");
    }

    @Test
    @DisplayName("已有 defexception 时不重复插入")
    void testNotDuplicated() {
        EModule once = run(exceptionModule(null, describe()));
        EModule twice = run(once);
        assertThat(twice.getBody()).hasSize(2);
    }

    @Test
    @DisplayName("没有异常标记的模块不变")
    void testPlainModule() {
        EModule module = new EModule(LOC, "Plain", Collections.<ElixirNode>singletonList(describe()));
        assertThat(run(module).getBody()).hasSize(1);
    }
}
