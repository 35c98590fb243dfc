package com.astxlang.ir.ast;

import com.astxlang.ir.ast.decl.*;
import com.astxlang.ir.ast.decl.Module;
import com.astxlang.ir.ast.expr.*;
import com.astxlang.ir.ast.stmt.*;
import com.astxlang.ir.ast.type.DataType;
import com.astxlang.ir.ast.type.TypeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 节点构造期不变量测试
 */
class AstNodeConstructionTest {

    private static final DataType INT32 = new DataType(TypeKind.INT32);

    @Nested
    @DisplayName("必需子节点")
    class RequiredChildrenTests {

        @Test
        @DisplayName("二元运算缺少操作数")
        void testBinaryOpMissingOperand() {
            assertThatThrownBy(() -> new BinaryOp("+", new Variable("a"), null))
                    .isInstanceOf(AstConstructionException.class)
                    .hasMessageContaining("BinaryOp")
                    .hasMessageContaining("right operand");
        }

        @Test
        @DisplayName("函数缺少函数体")
        void testFunctionMissingBody() {
            assertThatThrownBy(() -> new Function("f", Arguments.empty(), null, null))
                    .isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("条件表达式必须有 else 分支")
        void testIfExprIsTotal() {
            assertThatThrownBy(() -> new IfExpr(Literal.bool(true), Literal.int32(1), null))
                    .isInstanceOf(AstConstructionException.class)
                    .hasMessageContaining("else");
        }

        @Test
        @DisplayName("条件语句可以省略 else")
        void testIfStmtIsPartial() {
            IfStmt stmt = new IfStmt(Literal.bool(true), Block.empty());
            assertThat(stmt.hasElse()).isFalse();
        }

        @Test
        @DisplayName("空白名字被拒绝")
        void testBlankNames() {
            assertThatThrownBy(() -> new Variable(" ")).isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> new Argument("", INT32)).isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> new VariableAssignment(null, Literal.int32(1)))
                    .isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("列表中的 null 元素被拒绝")
        void testNullElements() {
            List<Statement> stmts = new ArrayList<Statement>();
            stmts.add(null);
            assertThatThrownBy(() -> new Block(stmts)).isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("return 的值可选")
        void testReturnValueOptional() {
            assertThat(new FunctionReturn().hasValue()).isFalse();
            assertThat(new FunctionReturn(Literal.int32(0)).hasValue()).isTrue();
        }
    }

    @Nested
    @DisplayName("导入")
    class ImportTests {

        @Test
        @DisplayName("导入列表不能为空")
        void testEmptyNames() {
            assertThatThrownBy(() -> new ImportStmt(Collections.<AliasExpr>emptyList()))
                    .isInstanceOf(AstConstructionException.class);
            assertThatThrownBy(() -> new ImportFromExpr("os", Collections.<AliasExpr>emptyList()))
                    .isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("相对层级不能为负")
        void testNegativeLevel() {
            assertThatThrownBy(() -> new ImportFromStmt("pkg", Arrays.asList(new AliasExpr("x")), -1))
                    .isInstanceOf(AstConstructionException.class);
        }

        @Test
        @DisplayName("绝对导入需要模块名")
        void testAbsoluteNeedsModule() {
            assertThatThrownBy(() -> new ImportFromStmt(null, Arrays.asList(new AliasExpr("x")), 0))
                    .isInstanceOf(AstConstructionException.class);
            ImportFromStmt relative = new ImportFromStmt(null, Arrays.asList(new AliasExpr("x")), 2);
            assertThat(relative.getModule()).isNull();
        }

        @Test
        @DisplayName("模块名带相对层级点号")
        void testQualifiedModule() {
            assertThat(new ImportFromStmt(null, Arrays.asList(new AliasExpr("x")), 2).getQualifiedModule())
                    .isEqualTo("..");
            assertThat(new ImportFromExpr("pkg", Arrays.asList(new AliasExpr("x")), 1).getQualifiedModule())
                    .isEqualTo(".pkg");
            assertThat(new ImportFromStmt("os.path", Arrays.asList(new AliasExpr("join"))).getQualifiedModule())
                    .isEqualTo("os.path");
        }

        @Test
        @DisplayName("空别名视为无别名")
        void testEmptyAlias() {
            assertThat(new AliasExpr("numpy", "").hasAlias()).isFalse();
            assertThat(new AliasExpr("numpy", "np").getAlias()).isEqualTo("np");
        }
    }

    @Nested
    @DisplayName("树的形状")
    class ShapeTests {

        @Test
        @DisplayName("子节点列表在构造时复制且不可修改")
        void testListsAreCopied() {
            List<Statement> stmts = new ArrayList<Statement>();
            stmts.add(new FunctionReturn());
            Block block = new Block(stmts);
            stmts.add(new FunctionReturn());
            assertThat(block.getStatements()).hasSize(1);
            assertThatThrownBy(() -> block.getStatements().add(new FunctionReturn()))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("形参名字不要求唯一")
        void testDuplicateArgumentNames() {
            Arguments args = new Arguments(new Argument("x", INT32), new Argument("x", INT32));
            assertThat(args.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("诊断名")
        void testDiagnosticNames() {
            assertThat(new Function("add", null, null, Block.empty()).getName()).isEqualTo("add");
            assertThat(new BinaryOp("+", new Variable("a"), new Variable("b")).getName()).isEqualTo("BinaryOp");
            assertThat(new Module("main").getName()).isEqualTo("main");
            assertThat(INT32.getName()).isEqualTo("Int32");
        }

        @Test
        @DisplayName("未指定位置时为 UNKNOWN")
        void testLocation() {
            assertThat(new Variable("a").getLocation()).isSameAs(SourceLocation.UNKNOWN);
            SourceLocation loc = new SourceLocation("main.py", 3, 7);
            Variable v = new Variable(loc, "a");
            assertThat(v.getLocation().getLine()).isEqualTo(3);
            assertThat(v.getLocation().isKnown()).isTrue();
            assertThat(loc.toString()).isEqualTo("main.py:3:7");
            assertThat(new SourceLocation(3, 4).toString()).isEqualTo("<unknown>:3:4");
        }

        @Test
        @DisplayName("表达式与语句角色互斥")
        void testRoles() {
            for (NodeKind kind : NodeKind.values()) {
                assertThat(NodeKind.fromDisplayName(kind.getDisplayName())).isEqualTo(kind);
            }
            assertThat(NodeKind.IF_EXPR.getRole()).isEqualTo(NodeKind.Role.EXPRESSION);
            assertThat(NodeKind.IF_STMT.getRole()).isEqualTo(NodeKind.Role.STATEMENT);
            assertThat(new IfExpr(Literal.bool(true), Literal.int32(1), Literal.int32(2)))
                    .isInstanceOf(Expression.class)
                    .isNotInstanceOf(Statement.class);
        }
    }
}
