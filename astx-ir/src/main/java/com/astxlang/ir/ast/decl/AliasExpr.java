package com.astxlang.ir.ast.decl;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 导入项：名字 + 可选别名
 */
public final class AliasExpr extends AstNode {
    private final String name;
    private final String alias;  // 可选

    public AliasExpr(SourceLocation location, String name, String alias) {
        super(location);
        this.name = AstChecks.name(NodeKind.ALIAS_EXPR, name, "imported name");
        this.alias = alias != null && !alias.isEmpty() ? alias : null;
    }

    public AliasExpr(String name, String alias) {
        this(null, name, alias);
    }

    public AliasExpr(String name) {
        this(null, name, null);
    }

    @Override
    public String getName() {
        return name;
    }

    public String getAlias() {
        return alias;
    }

    public boolean hasAlias() {
        return alias != null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ALIAS_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAliasExpr(this, context);
    }
}
