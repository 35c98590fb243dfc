package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用。被调函数按名字引用。
 */
public final class FunctionCall extends Expression {
    private final String callee;
    private final List<Expression> args;

    public FunctionCall(SourceLocation location, String callee, List<? extends Expression> args) {
        super(location);
        this.callee = AstChecks.name(NodeKind.FUNCTION_CALL, callee, "callee");
        this.args = AstChecks.elements(NodeKind.FUNCTION_CALL, args, "arguments");
    }

    public FunctionCall(String callee, List<? extends Expression> args) {
        this(null, callee, args);
    }

    public FunctionCall(String callee) {
        this(null, callee, Collections.<Expression>emptyList());
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public String getName() {
        return callee;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_CALL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCall(this, context);
    }
}
