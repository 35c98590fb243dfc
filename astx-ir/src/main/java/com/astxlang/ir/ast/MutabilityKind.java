package com.astxlang.ir.ast;

/**
 * 变量可变性
 */
public enum MutabilityKind {
    CONSTANT,
    MUTABLE
}
