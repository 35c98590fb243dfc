package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.expr.Expression;

/**
 * 赋值语句
 */
public final class VariableAssignment extends Statement {
    private final String name;
    private final Expression value;

    public VariableAssignment(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = AstChecks.name(NodeKind.VARIABLE_ASSIGNMENT, name, "target name");
        this.value = AstChecks.required(NodeKind.VARIABLE_ASSIGNMENT, value, "value");
    }

    public VariableAssignment(String name, Expression value) {
        this(null, name, value);
    }

    @Override
    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE_ASSIGNMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableAssignment(this, context);
    }
}
