package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.stmt.Block;

/**
 * 表达式形式的 while 循环，供支持循环表达式的目标语法使用
 */
public final class WhileExpr extends Expression {
    private final Expression condition;
    private final Block body;

    public WhileExpr(SourceLocation location, Expression condition, Block body) {
        super(location);
        this.condition = AstChecks.required(NodeKind.WHILE_EXPR, condition, "condition");
        this.body = AstChecks.required(NodeKind.WHILE_EXPR, body, "body");
    }

    public WhileExpr(Expression condition, Block body) {
        this(null, condition, body);
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.WHILE_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileExpr(this, context);
    }
}
