package com.astxlang.ir.ast.type;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TypeKind 分类格测试")
class TypeKindTest {

    @Test
    @DisplayName("整数位宽属于整数家族和数值家族")
    void testIntegerLattice() {
        assertThat(TypeKind.INT32.isA(TypeKind.SIGNED_INTEGER)).isTrue();
        assertThat(TypeKind.INT32.isA(TypeKind.INTEGER)).isTrue();
        assertThat(TypeKind.INT32.isA(TypeKind.NUMBER)).isTrue();
        assertThat(TypeKind.INT32.isA(TypeKind.UNSIGNED_INTEGER)).isFalse();
        assertThat(TypeKind.UINT8.isA(TypeKind.UNSIGNED_INTEGER)).isTrue();
        assertThat(TypeKind.UINT8.isA(TypeKind.FLOATING)).isFalse();
    }

    @Test
    @DisplayName("浮点与复数是数值的兄弟家族")
    void testFloatingAndComplex() {
        assertThat(TypeKind.FLOAT16.isA(TypeKind.FLOATING)).isTrue();
        assertThat(TypeKind.COMPLEX64.isA(TypeKind.NUMBER)).isTrue();
        assertThat(TypeKind.COMPLEX64.isA(TypeKind.FLOATING)).isFalse();
    }

    @Test
    @DisplayName("文本与时间类型在数值格之外")
    void testSiblingsOutsideLattice() {
        assertThat(TypeKind.UTF8_STRING.isA(TypeKind.NUMBER)).isFalse();
        assertThat(TypeKind.UTF8_CHAR.isA(TypeKind.STRING)).isTrue();
        assertThat(TypeKind.TIMESTAMP.isA(TypeKind.TEMPORAL)).isTrue();
        assertThat(TypeKind.DATE.isA(TypeKind.NUMBER)).isFalse();
        assertThat(TypeKind.BOOLEAN.getParent()).isNull();
    }

    @Test
    @DisplayName("家族节点不是具体类型")
    void testConcrete() {
        assertThat(TypeKind.INTEGER.isConcrete()).isFalse();
        assertThat(TypeKind.NUMBER.isConcrete()).isFalse();
        assertThat(TypeKind.INT64.isConcrete()).isTrue();
        assertThat(TypeKind.NONE.isConcrete()).isTrue();
    }

    @Test
    @DisplayName("位宽")
    void testBitWidth() {
        assertThat(TypeKind.INT128.getBitWidth()).isEqualTo(128);
        assertThat(TypeKind.FLOAT16.getBitWidth()).isEqualTo(16);
        assertThat(TypeKind.INTEGER.getBitWidth()).isZero();
    }

    @Test
    @DisplayName("按名字查找")
    void testFromDisplayName() {
        assertThat(TypeKind.fromDisplayName("UInt64")).isEqualTo(TypeKind.UINT64);
        assertThat(TypeKind.fromDisplayName("nope")).isNull();
    }
}
