package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.MutabilityKind;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.expr.Expression;
import com.astxlang.ir.ast.type.DataType;

/**
 * 变量声明语句
 */
public final class VariableDeclaration extends Statement {
    private final String name;
    private final DataType type;
    private final Expression value;  // 可选
    private final MutabilityKind mutability;

    public VariableDeclaration(SourceLocation location, String name, DataType type,
                               Expression value, MutabilityKind mutability) {
        super(location);
        this.name = AstChecks.name(NodeKind.VARIABLE_DECLARATION, name, "variable name");
        this.type = AstChecks.required(NodeKind.VARIABLE_DECLARATION, type, "type");
        this.value = value;
        this.mutability = mutability != null ? mutability : MutabilityKind.MUTABLE;
    }

    public VariableDeclaration(String name, DataType type, Expression value) {
        this(null, name, type, value, MutabilityKind.MUTABLE);
    }

    public VariableDeclaration(String name, DataType type) {
        this(null, name, type, null, MutabilityKind.MUTABLE);
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
        return NodeKind.VARIABLE_DECLARATION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableDeclaration(this, context);
    }
}
