package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.expr.Expression;

/**
 * If 语句，else 分支可选
 */
public final class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBlock;
    private final Block elseBlock;  // 可选

    public IfStmt(SourceLocation location, Expression condition, Block thenBlock, Block elseBlock) {
        super(location);
        this.condition = AstChecks.required(NodeKind.IF_STMT, condition, "condition");
        this.thenBlock = AstChecks.required(NodeKind.IF_STMT, thenBlock, "then block");
        this.elseBlock = elseBlock;
    }

    public IfStmt(Expression condition, Block thenBlock, Block elseBlock) {
        this(null, condition, thenBlock, elseBlock);
    }

    public IfStmt(Expression condition, Block thenBlock) {
        this(null, condition, thenBlock, null);
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IF_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
