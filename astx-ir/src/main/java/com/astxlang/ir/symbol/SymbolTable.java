package com.astxlang.ir.symbol;

import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.expr.Variable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 符号表：前端构造树时用来确认 {@code Variable} 等按名引用能否解析。
 *
 * <p>IR 核心和渲染后端都不会调用它。按名引用始终只是标识符，
 * 这里也不会在树上添加任何结构边。</p>
 */
public final class SymbolTable {
    private final Scope globalScope;
    private final Map<AstNode, Scope> nodeToScope = new IdentityHashMap<AstNode, Scope>();
    private Scope current;

    public SymbolTable() {
        this.globalScope = new Scope(Scope.ScopeType.GLOBAL, null);
        this.current = globalScope;
    }

    public Scope getGlobalScope() { return globalScope; }

    public Scope getCurrentScope() { return current; }

    /** 进入由 node 引入的新作用域 */
    public Scope enterScope(Scope.ScopeType type, AstNode node) {
        Scope scope = new Scope(type, current);
        if (node != null) {
            nodeToScope.put(node, scope);
        }
        current = scope;
        return scope;
    }

    /** 退出当前作用域 */
    public Scope exitScope() {
        if (current == globalScope) {
            throw new IllegalStateException("cannot exit the global scope");
        }
        Scope left = current;
        current = current.getEnclosing();
        return left;
    }

    public Symbol define(String name, SymbolKind kind, AstNode declaration) {
        Symbol symbol = new Symbol(name, kind, declaration);
        current.bind(symbol);
        return symbol;
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        return current.resolve(name);
    }

    /** 变量引用能否解析到已声明的绑定 */
    public boolean isBound(Variable variable) {
        return resolve(variable.getName()) != null;
    }

    /** 查询某个节点引入的作用域 */
    public Scope getScope(AstNode node) {
        return nodeToScope.get(node);
    }
}
