package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.MutabilityKind;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.type.DataType;

/**
 * 表达式位置上的变量声明（如 for 循环初始化部分）
 */
public final class InlineVariableDeclaration extends Expression {
    private final String name;
    private final DataType type;
    private final Expression value;  // 可选
    private final MutabilityKind mutability;

    public InlineVariableDeclaration(SourceLocation location, String name, DataType type,
                                     Expression value, MutabilityKind mutability) {
        super(location);
        this.name = AstChecks.name(NodeKind.INLINE_VARIABLE_DECLARATION, name, "variable name");
        this.type = AstChecks.required(NodeKind.INLINE_VARIABLE_DECLARATION, type, "type");
        this.value = value;
        this.mutability = mutability != null ? mutability : MutabilityKind.MUTABLE;
    }

    public InlineVariableDeclaration(String name, DataType type, Expression value) {
        this(null, name, type, value, MutabilityKind.MUTABLE);
    }

    @Override
    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public MutabilityKind getMutability() {
        return mutability;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INLINE_VARIABLE_DECLARATION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInlineVariableDeclaration(this, context);
    }
}
