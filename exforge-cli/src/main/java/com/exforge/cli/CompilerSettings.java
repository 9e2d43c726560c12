package com.exforge.cli;

import com.exforge.ir.backend.PrintConfig;
import com.exforge.ir.pass.PassConfig;

/**
 * 一次转译使用的 pass 开关和打印配置
 */
public class CompilerSettings {

    private final PassConfig passConfig;
    private final PrintConfig printConfig;

    public CompilerSettings(PassConfig passConfig, PrintConfig printConfig) {
        this.passConfig = passConfig;
        this.printConfig = printConfig;
    }

    public static CompilerSettings defaults() {
        return new CompilerSettings(PassConfig.defaults(), new PrintConfig());
    }

    public PassConfig getPassConfig() {
        return passConfig;
    }

    public PrintConfig getPrintConfig() {
        return printConfig;
    }
}
