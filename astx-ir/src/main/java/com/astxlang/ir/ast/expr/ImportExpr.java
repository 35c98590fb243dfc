package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.decl.AliasExpr;
import com.astxlang.ir.ast.decl.ImportSpec;

import java.util.List;

/**
 * 表达式形式的 import，供没有独立 import 语句的目标语法使用
 */
public final class ImportExpr extends Expression {
    private final List<AliasExpr> names;

    public ImportExpr(SourceLocation location, List<AliasExpr> names) {
        super(location);
        this.names = ImportSpec.names(NodeKind.IMPORT_EXPR, names);
    }

    public ImportExpr(List<AliasExpr> names) {
        this(null, names);
    }

    public List<AliasExpr> getNames() {
        return names;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportExpr(this, context);
    }
}
