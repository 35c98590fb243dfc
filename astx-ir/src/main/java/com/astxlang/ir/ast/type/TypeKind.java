package com.astxlang.ir.ast.type;

/**
 * 数据类型分类
 *
 * <p>通过 {@link #getParent()} 组成分类格：</p>
 * <pre>
 * NUMBER
 *   INTEGER
 *     SIGNED_INTEGER    INT8 INT16 INT32 INT64 INT128
 *     UNSIGNED_INTEGER  UINT8 UINT16 UINT32 UINT64 UINT128
 *   FLOATING            FLOAT16 FLOAT32 FLOAT64
 *   COMPLEX             COMPLEX32 COMPLEX64
 * BOOLEAN
 * STRING                UTF8_STRING UTF8_CHAR
 * TEMPORAL              DATE TIME TIMESTAMP DATETIME
 * NONE
 * </pre>
 * 文本与时间类型位于数值格之外。后端可以只为某个家族注册处理器，
 * 不必逐个位宽处理。
 */
public enum TypeKind {
    NUMBER("Number", null, 0),
    INTEGER("Integer", NUMBER, 0),
    SIGNED_INTEGER("SignedInteger", INTEGER, 0),
    INT8("Int8", SIGNED_INTEGER, 8),
    INT16("Int16", SIGNED_INTEGER, 16),
    INT32("Int32", SIGNED_INTEGER, 32),
    INT64("Int64", SIGNED_INTEGER, 64),
    INT128("Int128", SIGNED_INTEGER, 128),
    UNSIGNED_INTEGER("UnsignedInteger", INTEGER, 0),
    UINT8("UInt8", UNSIGNED_INTEGER, 8),
    UINT16("UInt16", UNSIGNED_INTEGER, 16),
    UINT32("UInt32", UNSIGNED_INTEGER, 32),
    UINT64("UInt64", UNSIGNED_INTEGER, 64),
    UINT128("UInt128", UNSIGNED_INTEGER, 128),
    FLOATING("Floating", NUMBER, 0),
    FLOAT16("Float16", FLOATING, 16),
    FLOAT32("Float32", FLOATING, 32),
    FLOAT64("Float64", FLOATING, 64),
    COMPLEX("Complex", NUMBER, 0),
    COMPLEX32("Complex32", COMPLEX, 32),
    COMPLEX64("Complex64", COMPLEX, 64),

    BOOLEAN("Boolean", null, 1),

    STRING("String", null, 0),
    UTF8_STRING("UTF8String", STRING, 0),
    UTF8_CHAR("UTF8Char", STRING, 0),

    TEMPORAL("Temporal", null, 0),
    DATE("Date", TEMPORAL, 0),
    TIME("Time", TEMPORAL, 0),
    TIMESTAMP("Timestamp", TEMPORAL, 0),
    DATETIME("DateTime", TEMPORAL, 0),

    NONE("None", null, 0);

    private final String displayName;
    private final TypeKind parent;
    private final int bitWidth;

    TypeKind(String displayName, TypeKind parent, int bitWidth) {
        this.displayName = displayName;
        this.parent = parent;
        this.bitWidth = bitWidth;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** 分类格中的直接上级，顶层返回 null */
    public TypeKind getParent() {
        return parent;
    }

    /** 固定位宽，家族或无位宽类型返回 0 */
    public int getBitWidth() {
        return bitWidth;
    }

    /** 是否为具体类型（非家族节点） */
    public boolean isConcrete() {
        for (TypeKind kind : values()) {
            if (kind.parent == this) {
                return false;
            }
        }
        return true;
    }

    /** 是否属于 family（含自身） */
    public boolean isA(TypeKind family) {
        for (TypeKind k = this; k != null; k = k.parent) {
            if (k == family) {
                return true;
            }
        }
        return false;
    }

    /** 按类型名查找，未知返回 null */
    public static TypeKind fromDisplayName(String name) {
        for (TypeKind kind : values()) {
            if (kind.displayName.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
