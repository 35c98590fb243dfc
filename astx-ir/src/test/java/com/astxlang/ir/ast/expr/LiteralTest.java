package com.astxlang.ir.ast.expr;

import com.astxlang.ir.ast.AstConstructionException;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.type.TypeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.*;

/**
 * Literal 构造与位宽校验测试
 */
class LiteralTest {

    @Nested
    @DisplayName("有符号整数")
    class SignedIntegerTests {

        @Test
        @DisplayName("边界值可以构造")
        void testBoundsAccepted() {
            assertThat(Literal.int8(-128).getIntegerValue()).isEqualTo(BigInteger.valueOf(-128));
            assertThat(Literal.int8(127).getIntegerValue()).isEqualTo(BigInteger.valueOf(127));
            assertThat(Literal.int16(32767).getIntegerValue()).isEqualTo(BigInteger.valueOf(32767));
            assertThat(Literal.int32(Integer.MIN_VALUE).getIntegerValue())
                    .isEqualTo(BigInteger.valueOf(Integer.MIN_VALUE));
            assertThat(Literal.int64(Long.MAX_VALUE).getIntegerValue()).isEqualTo(BigInteger.valueOf(Long.MAX_VALUE));
        }

        @Test
        @DisplayName("超出位宽在构造时失败")
        void testOutOfRangeRejected() {
            assertThatThrownBy(() -> Literal.int8(128)).isInstanceOf(AstConstructionException.class)
                    .hasMessageContaining("Int8");
            assertThatThrownBy(() -> Literal.int8(-129)).isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.int16(32768)).isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.int32(2147483648L)).isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("128 位整数")
        void testInt128() {
            BigInteger max = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
            assertThat(Literal.int128(max).getIntegerValue()).isEqualTo(max);
            assertThatThrownBy(() -> Literal.int128(max.add(BigInteger.ONE)))
                    .isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.int128(max.negate().subtract(BigInteger.TWO)))
                    .isInstanceOf(AstConstructionException.class);
        }
    }

    @Nested
    @DisplayName("无符号整数")
    class UnsignedIntegerTests {

        @Test
        @DisplayName("负数被拒绝")
        void testNegativeRejected() {
            assertThatThrownBy(() -> Literal.uint8(-1)).isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.uint32(-1)).isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("上界")
        void testUpperBound() {
            assertThat(Literal.uint8(255).getIntegerValue()).isEqualTo(BigInteger.valueOf(255));
            assertThatThrownBy(() -> Literal.uint8(256)).isInstanceOf(AstConstructionException.class);
            assertThat(Literal.uint16(65535).getIntegerValue()).isEqualTo(BigInteger.valueOf(65535));
            assertThat(Literal.uint32(4294967295L).getIntegerValue()).isEqualTo(BigInteger.valueOf(4294967295L));
            assertThatThrownBy(() -> Literal.uint32(4294967296L)).isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("64/128 位用 BigInteger 表示")
        void testWideUnsigned() {
            BigInteger u64Max = new BigInteger("18446744073709551615");
            assertThat(Literal.uint64(u64Max).getIntegerValue()).isEqualTo(u64Max);
            assertThatThrownBy(() -> Literal.uint64(u64Max.add(BigInteger.ONE)))
                    .isInstanceOf(AstConstructionException.class);
            BigInteger u128Max = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
            assertThat(Literal.uint128(u128Max).getIntegerValue()).isEqualTo(u128Max);
        }
    }

    @Nested
    @DisplayName("浮点与复数")
    class FloatingTests {

        @Test
        @DisplayName("Float16 最大有限值为 65504")
        void testFloat16Range() {
            assertThat(Literal.float16(65504.0).getDoubleValue()).isEqualTo(65504.0);
            assertThatThrownBy(() -> Literal.float16(70000.0)).isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("Float32 超出范围")
        void testFloat32Range() {
            assertThat(Literal.float32(1.5).getDoubleValue()).isEqualTo(1.5);
            assertThatThrownBy(() -> Literal.float32(1e39)).isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("非有限值可以构造")
        void testNonFinite() {
            assertThat(Literal.float32(Double.NaN).getDoubleValue()).isNaN();
            assertThat(Literal.float16(Double.POSITIVE_INFINITY).getDoubleValue()).isInfinite();
        }

        @Test
        @DisplayName("换算为 double 后溢出的数值被拒绝")
        void testOverflowingNumberRejected() {
            assertThatThrownBy(() -> Literal.of(LiteralKind.FLOAT32, new BigDecimal("1e400")))
                    .isInstanceOf(AstConstructionException.class)
                    .hasMessageContaining("does not fit Float32");
            assertThatThrownBy(() -> Literal.of(LiteralKind.FLOAT64, new BigDecimal("-1e400")))
                    .isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.of(LiteralKind.FLOAT16, new BigDecimal("70000")))
                    .isInstanceOf(AstConstructionException.class);
            assertThat(Literal.of(LiteralKind.FLOAT64, new BigDecimal("2.5")).getDoubleValue()).isEqualTo(2.5);
            assertThat(Literal.of(LiteralKind.FLOAT16, 3).getDoubleValue()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("复数分量按半宽浮点校验")
        void testComplexComponents() {
            Literal c = Literal.complex64(1.0, -2.0);
            assertThat(c.getValue()).isEqualTo(new Complex(1.0, -2.0));
            assertThatThrownBy(() -> Literal.complex32(1.0, 1e5)).isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.complex64(1e39, 0.0)).isInstanceOf(AstConstructionException.class);
        }
    }

    @Nested
    @DisplayName("文本、时间与其他")
    class OtherTests {

        @Test
        @DisplayName("UTF8Char 必须恰好一个码点")
        void testUtf8Char() {
            assertThat(Literal.utf8Char("a").getValue()).isEqualTo("a");
            assertThat(Literal.utf8Char("😀").getValue()).isEqualTo("😀");
            assertThatThrownBy(() -> Literal.utf8Char("ab")).isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.utf8Char("")).isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("值类型不匹配")
        void testWrongValueType() {
            assertThatThrownBy(() -> Literal.of(LiteralKind.BOOLEAN, "true"))
                    .isInstanceOf(AstConstructionException.class)
                    .hasMessageContaining("LiteralBoolean");
            assertThatThrownBy(() -> Literal.of(LiteralKind.INT32, 1.5))
                    .isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.of(LiteralKind.DATE, "2024-01-01"))
                    .isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.utf8String(null))
                    .isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("时间字面量精度为微秒")
        void testTemporalPrecision() {
            assertThat(Literal.time(LocalTime.of(1, 2, 3, 4000)).getValue()).isEqualTo(LocalTime.of(1, 2, 3, 4000));
            assertThatThrownBy(() -> Literal.time(LocalTime.of(1, 2, 3, 500)))
                    .isInstanceOf(AstConstructionException.class)
                    .hasMessageContaining("microsecond");
            assertThatThrownBy(() -> Literal.timestamp(LocalDateTime.of(2024, 1, 1, 0, 0, 0, 1)))
                    .isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> Literal.dateTime(LocalDateTime.of(2024, 1, 1, 0, 0, 0, 999)))
                    .isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("None 不携带值")
        void testNone() {
            assertThat(Literal.none().getValue()).isNull();
            assertThatThrownBy(() -> Literal.of(LiteralKind.NONE, 0))
                    .isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("类型标记与诊断名")
        void testTypeAndName() {
            Literal d = Literal.date(LocalDate.of(2024, 2, 29));
            assertThat(d.getTypeKind()).isEqualTo(TypeKind.DATE);
            assertThat(d.getKind()).isEqualTo(NodeKind.LITERAL);
            assertThat(Literal.int32(42).getName()).isEqualTo("LiteralInt32");
            assertThat(Literal.bool(true).getTypeKind()).isEqualTo(TypeKind.BOOLEAN);
        }

        @Test
        @DisplayName("每种字面量都映射到具体类型")
        void testEveryKindMapsToConcreteType() {
            for (LiteralKind kind : LiteralKind.values()) {
                assertThat(kind.getTypeKind().isConcrete()).as(kind.name()).isTrue();
                assertThat(LiteralKind.fromDisplayName(kind.getDisplayName())).isEqualTo(kind);
            }
        }
    }
}
