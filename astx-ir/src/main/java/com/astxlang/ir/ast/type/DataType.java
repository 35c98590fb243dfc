package com.astxlang.ir.ast.type;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 类型引用（用于参数/返回值注解和类型转换），表示类型而非值
 */
public final class DataType extends AstNode {
    private final TypeKind typeKind;

    public DataType(SourceLocation location, TypeKind typeKind) {
        super(location);
        this.typeKind = AstChecks.required(NodeKind.DATA_TYPE, typeKind, "type kind");
    }

    public DataType(TypeKind typeKind) {
        this(null, typeKind);
    }

    public TypeKind getTypeKind() {
        return typeKind;
    }

    public boolean isA(TypeKind family) {
        return typeKind.isA(family);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DATA_TYPE;
    }

    @Override
    public String getName() {
        return typeKind.getDisplayName();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDataType(this, context);
    }
}
