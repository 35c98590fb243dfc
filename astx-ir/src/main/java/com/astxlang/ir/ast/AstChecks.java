package com.astxlang.ir.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 构造期的局部不变量检查
 */
public final class AstChecks {

    private AstChecks() {}

    public static <T> T required(NodeKind kind, T value, String what) {
        if (value == null) {
            throw new AstConstructionException(kind, what + " is required");
        }
        return value;
    }

    public static String name(NodeKind kind, String value, String what) {
        if (value == null || value.trim().isEmpty()) {
            throw new AstConstructionException(kind, what + " must not be blank");
        }
        return value;
    }

    /** 复制为不可变列表，拒绝 null 元素 */
    public static <T> List<T> elements(NodeKind kind, List<? extends T> values, String what) {
        required(kind, values, what);
        List<T> copy = new ArrayList<T>(values.size());
        for (T value : values) {
            if (value == null) {
                throw new AstConstructionException(kind, what + " must not contain null");
            }
            copy.add(value);
        }
        return Collections.unmodifiableList(copy);
    }

    public static <T> List<T> nonEmpty(NodeKind kind, List<? extends T> values, String what) {
        List<T> copy = elements(kind, values, what);
        if (copy.isEmpty()) {
            throw new AstConstructionException(kind, what + " must not be empty");
        }
        return copy;
    }
}
