package com.astxlang.cli;

import com.astxlang.ir.AstxVersion;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * ASTx CLI 入口点（picocli）
 */
@Command(name = "astx",
         versionProvider = Main.VersionProvider.class,
         mixinStandardHelpOptions = true,
         description = "把 JSON 形式的 ASTx 树渲染为目标语言源码",
         subcommands = {RenderCommand.class})
public class Main implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    /**
     * 版本号来自 astx-ir 打包的版本资源
     */
    static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{"ASTx v" + AstxVersion.get()};
        }
    }
}
