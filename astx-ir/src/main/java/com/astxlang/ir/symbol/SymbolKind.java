package com.astxlang.ir.symbol;

/**
 * 符号种类
 */
public enum SymbolKind {
    VARIABLE,
    CONSTANT,
    FUNCTION,
    ARGUMENT,
    MODULE,
    IMPORT
}
