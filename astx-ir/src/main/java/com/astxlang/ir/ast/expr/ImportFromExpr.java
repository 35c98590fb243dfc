package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.decl.AliasExpr;
import com.astxlang.ir.ast.decl.ImportSpec;

import java.util.List;

/**
 * 表达式形式的 from-import
 */
public final class ImportFromExpr extends Expression {
    private final String module;  // 可选
    private final List<AliasExpr> names;
    private final int level;

    public ImportFromExpr(SourceLocation location, String module, List<AliasExpr> names, int level) {
        super(location);
        this.module = module != null && !module.isEmpty() ? module : null;
        this.names = ImportSpec.names(NodeKind.IMPORT_FROM_EXPR, names);
        this.level = ImportSpec.level(NodeKind.IMPORT_FROM_EXPR, level, this.module);
    }

    public ImportFromExpr(String module, List<AliasExpr> names, int level) {
        this(null, module, names, level);
    }

    public ImportFromExpr(String module, List<AliasExpr> names) {
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
        return NodeKind.IMPORT_FROM_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportFromExpr(this, context);
    }
}
