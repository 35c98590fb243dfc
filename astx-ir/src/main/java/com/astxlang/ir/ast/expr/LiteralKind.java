package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.type.TypeKind;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 字面量种类，每种对应一个具体的 {@link TypeKind}
 */
public enum LiteralKind {
    BOOLEAN("LiteralBoolean", TypeKind.BOOLEAN, Family.BOOLEAN),
    INT8("LiteralInt8", TypeKind.INT8, Family.INTEGER),
    INT16("LiteralInt16", TypeKind.INT16, Family.INTEGER),
    INT32("LiteralInt32", TypeKind.INT32, Family.INTEGER),
    INT64("LiteralInt64", TypeKind.INT64, Family.INTEGER),
    INT128("LiteralInt128", TypeKind.INT128, Family.INTEGER),
    UINT8("LiteralUInt8", TypeKind.UINT8, Family.INTEGER),
    UINT16("LiteralUInt16", TypeKind.UINT16, Family.INTEGER),
    UINT32("LiteralUInt32", TypeKind.UINT32, Family.INTEGER),
    UINT64("LiteralUInt64", TypeKind.UINT64, Family.INTEGER),
    UINT128("LiteralUInt128", TypeKind.UINT128, Family.INTEGER),
    FLOAT16("LiteralFloat16", TypeKind.FLOAT16, Family.FLOATING),
    FLOAT32("LiteralFloat32", TypeKind.FLOAT32, Family.FLOATING),
    FLOAT64("LiteralFloat64", TypeKind.FLOAT64, Family.FLOATING),
    COMPLEX32("LiteralComplex32", TypeKind.COMPLEX32, Family.COMPLEX),
    COMPLEX64("LiteralComplex64", TypeKind.COMPLEX64, Family.COMPLEX),
    UTF8_CHAR("LiteralUTF8Char", TypeKind.UTF8_CHAR, Family.STRING),
    UTF8_STRING("LiteralUTF8String", TypeKind.UTF8_STRING, Family.STRING),
    DATE("LiteralDate", TypeKind.DATE, Family.TEMPORAL),
    TIME("LiteralTime", TypeKind.TIME, Family.TEMPORAL),
    TIMESTAMP("LiteralTimestamp", TypeKind.TIMESTAMP, Family.TEMPORAL),
    DATETIME("LiteralDateTime", TypeKind.DATETIME, Family.TEMPORAL),
    NONE("LiteralNone", TypeKind.NONE, Family.NONE);

    private final String displayName;
    private final TypeKind typeKind;
    private final Family family;

    LiteralKind(String displayName, TypeKind typeKind, Family family) {
        this.displayName = displayName;
        this.typeKind = typeKind;
        this.family = family;
    }

    public String getDisplayName() {
        return displayName;
    }

    public TypeKind getTypeKind() {
        return typeKind;
    }

    public Family getFamily() {
        return family;
    }

    /** 时间类字面量对应的 java.time 类型 */
    Class<?> getValueType() {
        switch (this) {
            case DATE:      return LocalDate.class;
            case TIME:      return LocalTime.class;
            case TIMESTAMP:
            case DATETIME:  return LocalDateTime.class;
            default:        return Object.class;
        }
    }

    /** 按字面量名查找，未知返回 null */
    public static LiteralKind fromDisplayName(String name) {
        for (LiteralKind kind : values()) {
            if (kind.displayName.equals(name)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * 值的存放形式分组
     */
    public enum Family {
        BOOLEAN,
        INTEGER,
        FLOATING,
        COMPLEX,
        STRING,
        TEMPORAL,
        NONE
    }
}
