package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.expr.Expression;

/**
 * return 语句
 */
public final class FunctionReturn extends Statement {
    private final Expression value;  // 可选

    public FunctionReturn(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public FunctionReturn(Expression value) {
        this(null, value);
    }

    public FunctionReturn() {
        this(null, null);
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_RETURN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionReturn(this, context);
    }
}
