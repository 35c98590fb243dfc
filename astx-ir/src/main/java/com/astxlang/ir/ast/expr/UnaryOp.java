package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 一元（前缀）运算
 */
public final class UnaryOp extends Expression {
    private final String opCode;
    private final Expression operand;

    public UnaryOp(SourceLocation location, String opCode, Expression operand) {
        super(location);
        this.opCode = AstChecks.name(NodeKind.UNARY_OP, opCode, "operator");
        this.operand = AstChecks.required(NodeKind.UNARY_OP, operand, "operand");
    }

    public UnaryOp(String opCode, Expression operand) {
        this(null, opCode, operand);
    }

    public String getOpCode() {
        return opCode;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryOp(this, context);
    }
}
