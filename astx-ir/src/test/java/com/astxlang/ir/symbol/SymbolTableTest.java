package com.astxlang.ir.symbol;

import com.astxlang.ir.ast.decl.Arguments;
import com.astxlang.ir.ast.decl.Function;
import com.astxlang.ir.ast.expr.Literal;
import com.astxlang.ir.ast.expr.Variable;
import com.astxlang.ir.ast.stmt.Block;
import com.astxlang.ir.ast.stmt.VariableAssignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SymbolTable 测试")
class SymbolTableTest {

    private SymbolTable table;

    @BeforeEach
    void setUp() {
        table = new SymbolTable();
    }

    @Test
    @DisplayName("内层作用域可见外层符号")
    void testResolveUpward() {
        VariableAssignment x = new VariableAssignment("x", Literal.int32(1));
        table.define("x", SymbolKind.VARIABLE, x);

        Function f = new Function("f", Arguments.empty(), null, Block.empty());
        table.enterScope(Scope.ScopeType.FUNCTION, f);
        assertThat(table.resolve("x").getDeclaration()).isSameAs(x);
        assertThat(table.isBound(new Variable("x"))).isTrue();
        assertThat(table.isBound(new Variable("y"))).isFalse();
        assertThat(table.getScope(f)).isSameAs(table.getCurrentScope());
    }

    @Test
    @DisplayName("退出作用域后局部符号不可见")
    void testExitScope() {
        table.enterScope(Scope.ScopeType.BLOCK, null);
        table.define("tmp", SymbolKind.VARIABLE, null);
        assertThat(table.resolve("tmp")).isNotNull();
        table.exitScope();
        assertThat(table.resolve("tmp")).isNull();
        assertThat(table.getCurrentScope()).isSameAs(table.getGlobalScope());
    }

    @Test
    @DisplayName("可见符号外层在前，遮蔽的外层符号被替换")
    void testVisibleOrder() {
        table.define("a", SymbolKind.VARIABLE, null);
        table.define("b", SymbolKind.VARIABLE, null);
        Scope inner = table.enterScope(Scope.ScopeType.FUNCTION, null);
        Symbol shadow = table.define("a", SymbolKind.ARGUMENT, null);
        table.define("c", SymbolKind.VARIABLE, null);

        assertThat(inner.getAllVisible()).extracting("name").containsExactly("a", "b", "c");
        assertThat(inner.getAllVisible().get(0)).isSameAs(shadow);
        assertThat(inner.getEnclosing()).isSameAs(table.getGlobalScope());
        assertThat(table.getGlobalScope().getAllVisible()).extracting("name").containsExactly("a", "b");
    }

    @Test
    @DisplayName("不能退出全局作用域")
    void testExitGlobal() {
        assertThatThrownBy(() -> table.exitScope()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("子作用域同名符号遮蔽父作用域")
    void testShadowing() {
        table.define("v", SymbolKind.CONSTANT, null);
        Scope inner = table.enterScope(Scope.ScopeType.BLOCK, null);
        table.define("v", SymbolKind.VARIABLE, null);
        assertThat(table.resolve("v").getKind()).isEqualTo(SymbolKind.VARIABLE);
        assertThat(inner.getAllVisible()).hasSize(1);
        assertThat(table.getGlobalScope().resolveLocal("v").getKind()).isEqualTo(SymbolKind.CONSTANT);
    }
}
