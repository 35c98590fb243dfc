package com.astxlang.ir.backend;

import com.astxlang.ir.ast.AstNode;

/**
 * 后端：把一棵 IR 树渲染为某种目标语法的源码
 */
public interface Transpiler {

    /**
     * 渲染整棵树。任何节点缺少处理器都会中止整个调用并抛出
     * {@link com.astxlang.ir.ast.UnimplementedConstructException}，不返回部分结果。
     */
    String render(AstNode root);
}
