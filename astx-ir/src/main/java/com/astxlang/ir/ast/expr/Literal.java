package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstConstructionException;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.type.TypeKind;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 字面量表达式
 *
 * <p>携带不可变的标量值和固定的位宽/类型标记。值必须能以声明的位宽表示，
 * 否则在构造时抛出 {@link AstConstructionException}。</p>
 *
 * <p>值的存放形式：整数为 {@link BigInteger}，浮点为 {@link Double}，
 * 复数为 {@link Complex}，字符与字符串为 {@link String}，
 * 时间类为 {@code java.time} 对象，NONE 为 null。</p>
 */
public final class Literal extends Expression {
    private static final double FLOAT16_MAX = 65504.0;

    private final LiteralKind literalKind;
    private final Object value;

    private Literal(SourceLocation location, LiteralKind literalKind, Object value) {
        super(location);
        this.literalKind = literalKind;
        this.value = value;
    }

    /**
     * 通用构造入口：按 kind 校验并归一化 value
     */
    public static Literal of(SourceLocation location, LiteralKind kind, Object value) {
        if (kind == null) {
            throw new AstConstructionException(NodeKind.LITERAL, "literal kind is required");
        }
        switch (kind.getFamily()) {
            case BOOLEAN:
                return new Literal(location, kind, expect(kind, value, Boolean.class));
            case INTEGER:
                return new Literal(location, kind, checkInteger(kind, toBigInteger(kind, value)));
            case FLOATING:
                return new Literal(location, kind, checkFloat(kind, kind.getTypeKind(), toDouble(kind, value)));
            case COMPLEX: {
                Complex c = expect(kind, value, Complex.class);
                TypeKind part = kind == LiteralKind.COMPLEX32 ? TypeKind.FLOAT16 : TypeKind.FLOAT32;
                checkFloat(kind, part, c.getReal());
                checkFloat(kind, part, c.getImaginary());
                return new Literal(location, kind, c);
            }
            case STRING: {
                String s = value instanceof Character ? String.valueOf(value) : expect(kind, value, String.class);
                if (kind == LiteralKind.UTF8_CHAR && s.codePointCount(0, s.length()) != 1) {
                    throw new AstConstructionException(NodeKind.LITERAL,
                            "UTF8Char literal must hold exactly one code point, got '" + s + "'");
                }
                return new Literal(location, kind, s);
            }
            case TEMPORAL:
                return new Literal(location, kind, checkTemporal(kind, expect(kind, value, kind.getValueType())));
            case NONE:
                if (value != null) {
                    throw new AstConstructionException(NodeKind.LITERAL, "None literal carries no value");
                }
                return new Literal(location, kind, null);
            default:
                throw new AstConstructionException(NodeKind.LITERAL, "unsupported literal kind " + kind);
        }
    }

    public static Literal of(LiteralKind kind, Object value) {
        return of(null, kind, value);
    }

    // ============ 便捷工厂 ============

    public static Literal bool(boolean value) {
        return of(LiteralKind.BOOLEAN, value);
    }

    public static Literal int8(long value) {
        return of(LiteralKind.INT8, value);
    }

    public static Literal int16(long value) {
        return of(LiteralKind.INT16, value);
    }

    public static Literal int32(long value) {
        return of(LiteralKind.INT32, value);
    }

    public static Literal int64(long value) {
        return of(LiteralKind.INT64, value);
    }

    public static Literal int128(BigInteger value) {
        return of(LiteralKind.INT128, value);
    }

    public static Literal uint8(long value) {
        return of(LiteralKind.UINT8, value);
    }

    public static Literal uint16(long value) {
        return of(LiteralKind.UINT16, value);
    }

    public static Literal uint32(long value) {
        return of(LiteralKind.UINT32, value);
    }

    public static Literal uint64(BigInteger value) {
        return of(LiteralKind.UINT64, value);
    }

    public static Literal uint128(BigInteger value) {
        return of(LiteralKind.UINT128, value);
    }

    public static Literal float16(double value) {
        return of(LiteralKind.FLOAT16, value);
    }

    public static Literal float32(double value) {
        return of(LiteralKind.FLOAT32, value);
    }

    public static Literal float64(double value) {
        return of(LiteralKind.FLOAT64, value);
    }

    public static Literal complex32(double real, double imaginary) {
        return of(LiteralKind.COMPLEX32, new Complex(real, imaginary));
    }

    public static Literal complex64(double real, double imaginary) {
        return of(LiteralKind.COMPLEX64, new Complex(real, imaginary));
    }

    public static Literal utf8Char(String value) {
        return of(LiteralKind.UTF8_CHAR, value);
    }

    public static Literal utf8String(String value) {
        return of(LiteralKind.UTF8_STRING, value);
    }

    public static Literal date(LocalDate value) {
        return of(LiteralKind.DATE, value);
    }

    public static Literal time(LocalTime value) {
        return of(LiteralKind.TIME, value);
    }

    public static Literal timestamp(LocalDateTime value) {
        return of(LiteralKind.TIMESTAMP, value);
    }

    public static Literal dateTime(LocalDateTime value) {
        return of(LiteralKind.DATETIME, value);
    }

    public static Literal none() {
        return of(LiteralKind.NONE, null);
    }

    // ============ 访问器 ============

    public LiteralKind getLiteralKind() {
        return literalKind;
    }

    public TypeKind getTypeKind() {
        return literalKind.getTypeKind();
    }

    public Object getValue() {
        return value;
    }

    public BigInteger getIntegerValue() {
        return (BigInteger) value;
    }

    public double getDoubleValue() {
        return (Double) value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LITERAL;
    }

    @Override
    public String getName() {
        return literalKind.getDisplayName();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    // ============ 校验 ============

    private static <T> T expect(LiteralKind kind, Object value, Class<T> type) {
        if (!type.isInstance(value)) {
            throw new AstConstructionException(NodeKind.LITERAL, kind.getDisplayName() + " expects a "
                    + type.getSimpleName() + " value, got " + describe(value));
        }
        return type.cast(value);
    }

    private static BigInteger toBigInteger(LiteralKind kind, Object value) {
        if (value instanceof BigInteger) {
            return (BigInteger) value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        throw new AstConstructionException(NodeKind.LITERAL,
                kind.getDisplayName() + " expects an integral value, got " + describe(value));
    }

    /**
     * NaN 与无穷只能以 Double/Float 原值传入；其他数值类型换算成 double 后溢出即视为超出位宽
     */
    private static Double toDouble(LiteralKind kind, Object value) {
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new AstConstructionException(NodeKind.LITERAL, "value " + value + " does not fit "
                        + kind.getTypeKind().getDisplayName() + " in " + kind.getDisplayName());
            }
            return d;
        }
        throw new AstConstructionException(NodeKind.LITERAL,
                kind.getDisplayName() + " expects a numeric value, got " + describe(value));
    }

    private static BigInteger checkInteger(LiteralKind kind, BigInteger value) {
        TypeKind type = kind.getTypeKind();
        int bits = type.getBitWidth();
        BigInteger min;
        BigInteger max;
        if (type.isA(TypeKind.SIGNED_INTEGER)) {
            min = BigInteger.ONE.shiftLeft(bits - 1).negate();
            max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        } else {
            min = BigInteger.ZERO;
            max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        }
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new AstConstructionException(NodeKind.LITERAL, "value " + value + " does not fit "
                    + type.getDisplayName() + " [" + min + ", " + max + "]");
        }
        return value;
    }

    private static Double checkFloat(LiteralKind kind, TypeKind width, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double max;
        switch (width) {
            case FLOAT16: max = FLOAT16_MAX; break;
            case FLOAT32: max = Float.MAX_VALUE; break;
            default:      max = Double.MAX_VALUE; break;
        }
        if (Math.abs(value) > max) {
            throw new AstConstructionException(NodeKind.LITERAL, "value " + value + " does not fit "
                    + width.getDisplayName() + " in " + kind.getDisplayName());
        }
        return value;
    }

    /** 时间值精度为微秒 */
    private static Object checkTemporal(LiteralKind kind, Object value) {
        LocalTime time = null;
        if (value instanceof LocalTime) {
            time = (LocalTime) value;
        } else if (value instanceof LocalDateTime) {
            time = ((LocalDateTime) value).toLocalTime();
        }
        if (time != null && time.getNano() % 1000 != 0) {
            throw new AstConstructionException(NodeKind.LITERAL, kind.getDisplayName()
                    + " supports microsecond precision, got " + time.getNano() + " ns");
        }
        return value;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
