package com.astxlang.ir.ast;

/**
 * 当前后端没有为某个节点变体注册处理器
 *
 * <p>在分派点抛出并中止整个渲染调用，已累积的部分输出一律丢弃。</p>
 */
public class UnimplementedConstructException extends RuntimeException {
    private final String variant;
    private final String nodeName;

    public UnimplementedConstructException(String variant, String nodeName) {
        super("Unimplemented construct " + variant + " (" + nodeName + ")");
        this.variant = variant;
        this.nodeName = nodeName;
    }

    public UnimplementedConstructException(AstNode node) {
        this(node.getKind().getDisplayName(), node.getName());
    }

    /** 未实现的变体名 */
    public String getVariant() {
        return variant;
    }

    /** 出错节点的诊断名 */
    public String getNodeName() {
        return nodeName;
    }
}
