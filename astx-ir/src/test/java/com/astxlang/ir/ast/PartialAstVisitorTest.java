package com.astxlang.ir.ast;

import com.astxlang.ir.ast.expr.Literal;
import com.astxlang.ir.ast.expr.Variable;
import com.astxlang.ir.ast.stmt.GotoStmt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PartialAstVisitor 测试")
class PartialAstVisitorTest {

    /** 只支持变量引用的访问者 */
    static final class VariableOnly extends PartialAstVisitor<String, Void> {
        @Override
        public String visitVariable(Variable node, Void ctx) {
            return node.getName();
        }
    }

    @Test
    @DisplayName("覆盖的变体正常分派")
    void testHandledVariant() {
        assertThat(new Variable("x").accept(new VariableOnly(), null)).isEqualTo("x");
    }

    @Test
    @DisplayName("未覆盖的变体报告变体名和节点名")
    void testUnhandledVariant() {
        assertThatThrownBy(() -> new GotoStmt("retry").accept(new VariableOnly(), null))
                .isInstanceOfSatisfying(UnimplementedConstructException.class, e -> {
                    assertThat(e.getVariant()).isEqualTo("GotoStmt");
                    assertThat(e.getNodeName()).isEqualTo("retry");
                    assertThat(e.getMessage()).isEqualTo("Unimplemented construct GotoStmt (retry)");
                });
    }

    @Test
    @DisplayName("字面量同样走统一出口")
    void testLiteralUnhandled() {
        assertThatThrownBy(() -> Literal.int32(1).accept(new VariableOnly(), null))
                .isInstanceOf(UnimplementedConstructException.class)
                .hasMessageContaining("Literal (LiteralInt32)");
    }
}
