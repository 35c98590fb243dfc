package com.astxlang.ir.backend;

import com.astxlang.ir.ast.UnimplementedConstructException;
import com.astxlang.ir.ast.type.DataType;
import com.astxlang.ir.ast.type.TypeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("KindDispatchTable 测试")
class KindDispatchTableTest {

    private KindDispatchTable<String> table;

    @BeforeEach
    void setUp() {
        table = new KindDispatchTable<String>()
                .register(TypeKind.INTEGER, "int")
                .register(TypeKind.INT8, "byte")
                .register(TypeKind.FLOATING, "float");
    }

    @Test
    @DisplayName("最具体的注册项优先")
    void testMostSpecificWins() {
        assertThat(table.resolve(TypeKind.INT8)).isEqualTo("byte");
        assertThat(table.resolve(TypeKind.INT32)).isEqualTo("int");
        assertThat(table.resolve(TypeKind.UINT64)).isEqualTo("int");
        assertThat(table.resolve(TypeKind.FLOAT16)).isEqualTo("float");
    }

    @Test
    @DisplayName("家族本身也可以解析")
    void testFamilyResolves() {
        assertThat(table.resolve(TypeKind.SIGNED_INTEGER)).isEqualTo("int");
        assertThat(table.resolve(TypeKind.NUMBER)).isNull();
    }

    @Test
    @DisplayName("重复注册时后者覆盖前者")
    void testReRegistrationReplaces() {
        table.register(TypeKind.INTEGER, "long");
        assertThat(table.resolve(TypeKind.INT32)).isEqualTo("long");
    }

    @Test
    @DisplayName("找不到处理器时报告未实现")
    void testRequireMissing() {
        assertThatThrownBy(() -> table.require(new DataType(TypeKind.DATE)))
                .isInstanceOfSatisfying(UnimplementedConstructException.class, e -> {
                    assertThat(e.getVariant()).isEqualTo("Date");
                    assertThat(e.getNodeName()).isEqualTo("Date");
                });
        assertThat(table.supports(TypeKind.DATE)).isFalse();
        assertThat(table.supports(TypeKind.INT16)).isTrue();
    }
}
