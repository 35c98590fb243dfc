package com.astxlang.ir.ast.decl;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.type.DataType;

/**
 * 函数形参：名字 + 类型。这一层不求值默认值。
 */
public final class Argument extends AstNode {
    private final String name;
    private final DataType type;

    public Argument(SourceLocation location, String name, DataType type) {
        super(location);
        this.name = AstChecks.name(NodeKind.ARGUMENT, name, "argument name");
        this.type = AstChecks.required(NodeKind.ARGUMENT, type, "argument type");
    }

    public Argument(String name, DataType type) {
        this(null, name, type);
    }

    @Override
    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARGUMENT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArgument(this, context);
    }
}
