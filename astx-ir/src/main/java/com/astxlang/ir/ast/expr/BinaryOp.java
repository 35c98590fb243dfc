package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 二元运算。运算符以目标语法中的符号保存（如 "+"、"and"），核心不解释其含义。
 */
public final class BinaryOp extends Expression {
    private final String opCode;
    private final Expression lhs;
    private final Expression rhs;

    public BinaryOp(SourceLocation location, String opCode, Expression lhs, Expression rhs) {
        super(location);
        this.opCode = AstChecks.name(NodeKind.BINARY_OP, opCode, "operator");
        this.lhs = AstChecks.required(NodeKind.BINARY_OP, lhs, "left operand");
        this.rhs = AstChecks.required(NodeKind.BINARY_OP, rhs, "right operand");
    }

    public BinaryOp(String opCode, Expression lhs, Expression rhs) {
        this(null, opCode, lhs, rhs);
    }

    public String getOpCode() {
        return opCode;
    }

    public Expression getLhs() {
        return lhs;
    }

    public Expression getRhs() {
        return rhs;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY_OP;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryOp(this, context);
    }
}
