package com.astxlang.ir.symbol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 名字绑定的一层作用域，由 {@link SymbolTable} 创建
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,
        MODULE,
        FUNCTION,
        BLOCK
    }

    private final ScopeType type;
    private final Scope enclosing;
    private final Map<String, Symbol> bindings = new HashMap<String, Symbol>();
    private final List<String> order = new ArrayList<String>();

    Scope(ScopeType type, Scope enclosing) {
        this.type = type;
        this.enclosing = enclosing;
    }

    public ScopeType getType() {
        return type;
    }

    public Scope getEnclosing() {
        return enclosing;
    }

    /** 重复绑定同一名字时，新符号替换旧符号，但保留首次绑定的顺序 */
    void bind(Symbol symbol) {
        if (bindings.put(symbol.getName(), symbol) == null) {
            order.add(symbol.getName());
        }
    }

    /** 由内向外查找 */
    public Symbol resolve(String name) {
        for (Scope s = this; s != null; s = s.enclosing) {
            Symbol found = s.bindings.get(name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public Symbol resolveLocal(String name) {
        return bindings.get(name);
    }

    /**
     * 当前位置可见的全部符号，外层在前；被内层遮蔽的外层同名符号不出现
     */
    public List<Symbol> getAllVisible() {
        Deque<Scope> chain = new ArrayDeque<Scope>();
        for (Scope s = this; s != null; s = s.enclosing) {
            chain.push(s);
        }
        Map<String, Symbol> visible = new HashMap<String, Symbol>();
        List<String> names = new ArrayList<String>();
        for (Scope s : chain) {
            for (String name : s.order) {
                if (visible.put(name, s.bindings.get(name)) == null) {
                    names.add(name);
                }
            }
        }
        List<Symbol> result = new ArrayList<Symbol>(names.size());
        for (String name : names) {
            result.add(visible.get(name));
        }
        return result;
    }
}
