package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.type.DataType;

/**
 * 类型转换
 */
public final class TypeCastExpr extends Expression {
    private final Expression expr;
    private final DataType targetType;

    public TypeCastExpr(SourceLocation location, Expression expr, DataType targetType) {
        super(location);
        this.expr = AstChecks.required(NodeKind.TYPE_CAST_EXPR, expr, "expression");
        this.targetType = AstChecks.required(NodeKind.TYPE_CAST_EXPR, targetType, "target type");
    }

    public TypeCastExpr(Expression expr, DataType targetType) {
        this(null, expr, targetType);
    }

    public Expression getExpr() {
        return expr;
    }

    public DataType getTargetType() {
        return targetType;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TYPE_CAST_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeCastExpr(this, context);
    }
}
