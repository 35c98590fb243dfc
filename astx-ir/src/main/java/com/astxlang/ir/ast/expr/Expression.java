package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 表达式基类：产生一个值，可嵌套在其他表达式或语句中
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
