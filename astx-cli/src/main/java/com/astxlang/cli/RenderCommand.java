package com.astxlang.cli;

import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.UnimplementedConstructException;
import com.astxlang.transpiler.TranspilerConfig;
import com.astxlang.transpiler.python.PythonTranspiler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * picocli render 子命令：读取 JSON 树并输出 Python 源码
 */
@Command(name = "render", description = "把 JSON 树渲染为 Python 源码")
public class RenderCommand implements Callable<Integer> {
    private static final Logger LOG = Logger.getLogger(RenderCommand.class.getName());

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "JSON 树文件路径")
    Path file;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进空格数（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认标准输出）")
    Path output;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        if (!Files.exists(file)) {
            err.println("错误: 文件不存在 - " + file);
            return 1;
        }

        TranspilerConfig config = new TranspilerConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);

        try {
            String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            AstNode root = new JsonTreeReader().read(json);
            String rendered = new PythonTranspiler(config).render(root);

            if (output != null) {
                Files.write(output, (rendered + "\n").getBytes(StandardCharsets.UTF_8));
            } else {
                PrintWriter out = spec.commandLine().getOut();
                out.println(rendered);
                out.flush();
            }
            return 0;
        } catch (TreeFormatException e) {
            LOG.log(Level.WARNING, "解析树失败: " + file, e);
            err.println("树格式错误: " + e.getMessage());
            return 1;
        } catch (UnimplementedConstructException e) {
            err.println("渲染失败: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读写文件失败: " + file, e);
            err.println("IO 错误: " + e.getMessage());
            return 1;
        }
    }
}
