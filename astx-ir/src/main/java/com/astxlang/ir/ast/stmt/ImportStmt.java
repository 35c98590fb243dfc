package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.decl.AliasExpr;
import com.astxlang.ir.ast.decl.ImportSpec;

import java.util.List;

/**
 * import 语句，名字按出现顺序保存，不排序也不去重
 */
public final class ImportStmt extends Statement {
    private final List<AliasExpr> names;

    public ImportStmt(SourceLocation location, List<AliasExpr> names) {
        super(location);
        this.names = ImportSpec.names(NodeKind.IMPORT_STMT, names);
    }

    public ImportStmt(List<AliasExpr> names) {
        this(null, names);
    }

    public List<AliasExpr> getNames() {
        return names;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportStmt(this, context);
    }
}
