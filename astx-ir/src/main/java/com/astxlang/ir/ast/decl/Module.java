package com.astxlang.ir.ast.decl;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.stmt.Statement;

import java.util.Arrays;
import java.util.List;

/**
 * 模块：命名的顶层语句序列，通常作为渲染根节点
 */
public final class Module extends AstNode {
    private final String name;
    private final List<Statement> statements;

    public Module(SourceLocation location, String name, List<? extends Statement> statements) {
        super(location);
        this.name = AstChecks.name(NodeKind.MODULE, name, "module name");
        this.statements = AstChecks.elements(NodeKind.MODULE, statements, "statements");
    }

    public Module(String name, List<? extends Statement> statements) {
        this(null, name, statements);
    }

    public Module(String name, Statement... statements) {
        this(null, name, Arrays.asList(statements));
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModule(this, context);
    }
}
