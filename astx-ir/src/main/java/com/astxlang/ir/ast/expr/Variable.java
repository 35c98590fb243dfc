package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 变量引用：按名字指向此前声明的绑定，不持有指向声明节点的结构边。
 * 名字是否可解析由前端借助符号表判断，核心不检查。
 */
public final class Variable extends Expression {
    private final String name;

    public Variable(SourceLocation location, String name) {
        super(location);
        this.name = AstChecks.name(NodeKind.VARIABLE, name, "variable name");
    }

    public Variable(String name) {
        this(null, name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }
}
