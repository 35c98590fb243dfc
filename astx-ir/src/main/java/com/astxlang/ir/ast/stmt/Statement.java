package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.SourceLocation;

/**
 * 语句基类：只能作为 {@link Block} 的直接成员出现
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
