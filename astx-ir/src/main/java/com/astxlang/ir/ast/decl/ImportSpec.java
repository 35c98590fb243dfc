package com.astxlang.ir.ast.decl;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstConstructionException;
import com.astxlang.ir.ast.NodeKind;

import java.util.List;

/**
 * 导入语句与导入表达式共用的结构字段校验
 */
public final class ImportSpec {

    private ImportSpec() {}

    public static List<AliasExpr> names(NodeKind kind, List<AliasExpr> names) {
        return AstChecks.nonEmpty(kind, names, "imported names");
    }

    public static int level(NodeKind kind, int level, String module) {
        if (level < 0) {
            throw new AstConstructionException(kind, "relative level must not be negative, got " + level);
        }
        if (level == 0 && (module == null || module.isEmpty())) {
            throw new AstConstructionException(kind, "absolute import requires a module name");
        }
        return level;
    }

    /** 相对层级渲染为同等数量的前导点号，没有模块名时只有点号 */
    public static String qualifiedModule(int level, String module) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < level; i++) {
            sb.append('.');
        }
        if (module != null) {
            sb.append(module);
        }
        return sb.toString();
    }
}
