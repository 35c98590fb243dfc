package com.astxlang.ir.symbol;

import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final AstNode declaration;    // 声明的 AST 节点

    public Symbol(String name, SymbolKind kind, AstNode declaration) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("symbol name is required");
        }
        this.name = name;
        this.kind = kind;
        this.declaration = declaration;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public AstNode getDeclaration() { return declaration; }

    public SourceLocation getLocation() {
        return declaration != null ? declaration.getLocation() : SourceLocation.UNKNOWN;
    }

    @Override
    public String toString() {
        return kind + " " + name;
    }
}
