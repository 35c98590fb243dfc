package com.astxlang.ir.backend;

import com.astxlang.ir.ast.UnimplementedConstructException;
import com.astxlang.ir.ast.type.DataType;
import com.astxlang.ir.ast.type.TypeKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * 按类型分类格分派的处理器注册表
 *
 * <p>查找从最具体的 {@link TypeKind} 开始，沿 {@link TypeKind#getParent()}
 * 逐级向上，返回第一个已注册的处理器。每个分类只有一个父节点，候选链是线性的，
 * 不会出现两个注册项同时匹配；对同一分类重复注册时后者覆盖前者。</p>
 *
 * @param <V> 处理器类型
 */
public final class KindDispatchTable<V> {
    private final Map<TypeKind, V> handlers = new EnumMap<TypeKind, V>(TypeKind.class);

    public KindDispatchTable<V> register(TypeKind kind, V handler) {
        if (kind == null || handler == null) {
            throw new IllegalArgumentException("kind and handler are required");
        }
        handlers.put(kind, handler);
        return this;
    }

    /**
     * 解析处理器，找不到返回 null
     */
    public V resolve(TypeKind kind) {
        for (TypeKind k = kind; k != null; k = k.getParent()) {
            V handler = handlers.get(k);
            if (handler != null) {
                return handler;
            }
        }
        return null;
    }

    /**
     * 解析处理器，找不到时抛出 {@link UnimplementedConstructException}
     */
    public V require(TypeKind kind, String nodeName) {
        V handler = resolve(kind);
        if (handler == null) {
            throw new UnimplementedConstructException(kind.getDisplayName(), nodeName);
        }
        return handler;
    }

    public V require(DataType node) {
        return require(node.getTypeKind(), node.getName());
    }

    public boolean supports(TypeKind kind) {
        return resolve(kind) != null;
    }
}
