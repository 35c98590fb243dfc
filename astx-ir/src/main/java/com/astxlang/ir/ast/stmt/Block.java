package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 代码块：有序的语句序列，构成一个词法作用域
 *
 * <p>由引入函数体、分支或循环体的结构独占持有。空块合法。</p>
 */
public final class Block extends AstNode {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<? extends Statement> statements) {
        super(location);
        this.statements = AstChecks.elements(NodeKind.BLOCK, statements, "statements");
    }

    public Block(List<? extends Statement> statements) {
        this(null, statements);
    }

    public Block(Statement... statements) {
        this(null, Arrays.asList(statements));
    }

    public static Block empty() {
        return new Block(null, Collections.<Statement>emptyList());
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BLOCK;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
