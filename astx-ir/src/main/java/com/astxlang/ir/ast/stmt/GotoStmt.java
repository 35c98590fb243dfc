package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 跳转到标签
 */
public final class GotoStmt extends Statement {
    private final String label;

    public GotoStmt(SourceLocation location, String label) {
        super(location);
        this.label = AstChecks.name(NodeKind.GOTO_STMT, label, "label");
    }

    public GotoStmt(String label) {
        this(null, label);
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String getName() {
        return label;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GOTO_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGotoStmt(this, context);
    }
}
