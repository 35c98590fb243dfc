package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.expr.Expression;

/**
 * 表达式语句：把表达式放进 Block
 */
public final class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = AstChecks.required(NodeKind.EXPRESSION_STMT, expression, "expression");
    }

    public ExpressionStmt(Expression expression) {
        this(null, expression);
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPRESSION_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
