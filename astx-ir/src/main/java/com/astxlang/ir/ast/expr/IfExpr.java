package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 条件表达式。作为值使用时必须完整，else 分支不可省略；
 * 可省略 else 的形式见 {@link com.astxlang.ir.ast.stmt.IfStmt}。
 */
public final class IfExpr extends Expression {
    private final Expression condition;
    private final Expression thenExpr;
    private final Expression elseExpr;

    public IfExpr(SourceLocation location, Expression condition, Expression thenExpr, Expression elseExpr) {
        super(location);
        this.condition = AstChecks.required(NodeKind.IF_EXPR, condition, "condition");
        this.thenExpr = AstChecks.required(NodeKind.IF_EXPR, thenExpr, "then branch");
        this.elseExpr = AstChecks.required(NodeKind.IF_EXPR, elseExpr, "else branch");
    }

    public IfExpr(Expression condition, Expression thenExpr, Expression elseExpr) {
        this(null, condition, thenExpr, elseExpr);
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getThenExpr() {
        return thenExpr;
    }

    public Expression getElseExpr() {
        return elseExpr;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IF_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpr(this, context);
    }
}
