package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.decl.AliasExpr;
import com.astxlang.ir.ast.decl.ImportSpec;

import java.util.List;

/**
 * from-import 语句。level 为相对导入层级，0 表示绝对导入。
 */
public final class ImportFromStmt extends Statement {
    private final String module;  // 可选
    private final List<AliasExpr> names;
    private final int level;

    public ImportFromStmt(SourceLocation location, String module, List<AliasExpr> names, int level) {
        super(location);
        this.module = module != null && !module.isEmpty() ? module : null;
        this.names = ImportSpec.names(NodeKind.IMPORT_FROM_STMT, names);
        this.level = ImportSpec.level(NodeKind.IMPORT_FROM_STMT, level, this.module);
    }

    public ImportFromStmt(String module, List<AliasExpr> names, int level) {
        this(null, module, names, level);
    }

    public ImportFromStmt(String module, List<AliasExpr> names) {
        this(null, module, names, 0);
    }

    public String getModule() {
        return module;
    }

    public List<AliasExpr> getNames() {
        return names;
    }

    public int getLevel() {
        return level;
    }

    /** 带相对层级点号的模块名 */
    public String getQualifiedModule() {
        return ImportSpec.qualifiedModule(level, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT_FROM_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportFromStmt(this, context);
    }
}
