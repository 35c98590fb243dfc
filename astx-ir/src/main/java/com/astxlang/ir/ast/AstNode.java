package com.astxlang.ir.ast;

/**
 * AST 节点基类
 *
 * <p>节点在构造后不可变。除根节点外，每个节点恰好归属于一个父节点；
 * 对其他绑定的引用（如 {@code Variable}）只按名字，不持有结构边。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 节点的具体变体 */
    public abstract NodeKind getKind();

    /**
     * 诊断用名称：有名字的节点返回自身名字，其余返回变体名。
     */
    public String getName() {
        return getKind().getDisplayName();
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return getKind().getDisplayName() + "[" + getName() + "]";
    }
}
