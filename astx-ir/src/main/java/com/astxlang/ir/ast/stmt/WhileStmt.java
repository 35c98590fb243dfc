package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.expr.Expression;

/**
 * While 语句
 */
public final class WhileStmt extends Statement {
    private final Expression condition;
    private final Block body;

    public WhileStmt(SourceLocation location, Expression condition, Block body) {
        super(location);
        this.condition = AstChecks.required(NodeKind.WHILE_STMT, condition, "condition");
        this.body = AstChecks.required(NodeKind.WHILE_STMT, body, "body");
    }

    public WhileStmt(Expression condition, Block body) {
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
        return NodeKind.WHILE_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
