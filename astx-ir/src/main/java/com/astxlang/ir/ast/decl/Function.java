package com.astxlang.ir.ast.decl;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.stmt.Block;
import com.astxlang.ir.ast.stmt.Statement;
import com.astxlang.ir.ast.type.DataType;

/**
 * 函数定义
 */
public final class Function extends Statement {
    private final String name;
    private final Arguments args;
    private final DataType returnType;  // 可选
    private final Block body;

    public Function(SourceLocation location, String name, Arguments args, DataType returnType, Block body) {
        super(location);
        this.name = AstChecks.name(NodeKind.FUNCTION, name, "function name");
        this.args = args != null ? args : Arguments.empty();
        this.returnType = returnType;
        this.body = AstChecks.required(NodeKind.FUNCTION, body, "body");
    }

    public Function(String name, Arguments args, DataType returnType, Block body) {
        this(null, name, args, returnType, body);
    }

    @Override
    public String getName() {
        return name;
    }

    public Arguments getArgs() {
        return args;
    }

    public DataType getReturnType() {
        return returnType;
    }

    public boolean hasReturnType() {
        return returnType != null;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunction(this, context);
    }
}
