package com.astxlang.ir.ast;

/**
 * 节点构造异常：值超出声明位宽，或缺少结构上必需的子节点。
 *
 * <p>只在构造时抛出，不会延迟到渲染阶段。</p>
 */
public class AstConstructionException extends IllegalArgumentException {
    private final NodeKind kind;

    public AstConstructionException(NodeKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public NodeKind getKind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return "Cannot construct " + kind.getDisplayName() + ": " + super.getMessage();
    }
}
