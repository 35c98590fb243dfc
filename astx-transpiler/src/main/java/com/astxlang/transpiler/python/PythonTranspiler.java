package com.astxlang.transpiler.python;

import com.astxlang.ir.ast.*;
import com.astxlang.ir.ast.decl.*;
import com.astxlang.ir.ast.decl.Module;
import com.astxlang.ir.ast.expr.*;
import com.astxlang.ir.ast.stmt.*;
import com.astxlang.ir.ast.type.DataType;
import com.astxlang.ir.ast.type.TypeKind;
import com.astxlang.ir.backend.KindDispatchTable;
import com.astxlang.ir.backend.Transpiler;
import com.astxlang.transpiler.TranspilerConfig;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * IR 到 Python 源码的转译器
 *
 * <p>访问者上下文是当前缩进深度，按值沿递归传递：渲染中途抛出异常时不存在需要恢复的状态，
 * 同一个实例也可以被多个线程同时用于渲染不同的树。</p>
 *
 * <p>{@link WhileExpr} 与 {@link GotoStmt} 在 Python 中没有对应语法，有意不支持，
 * 这两个方法直接抛出 {@link UnimplementedConstructException}。其余变体全部实现。</p>
 *
 * <p>类型引用按分类格查找类型名：所有整数位宽都渲染为 {@code int}，
 * 所有浮点位宽渲染为 {@code float}。NUMBER 与 TEMPORAL 家族本身没有对应的类型名。</p>
 */
public class PythonTranspiler implements AstVisitor<String, Integer>, Transpiler {
    private static final Logger LOG = Logger.getLogger(PythonTranspiler.class.getName());

    private final String indentUnit;
    private final KindDispatchTable<String> typeNames = new KindDispatchTable<String>()
            .register(TypeKind.BOOLEAN, "bool")
            .register(TypeKind.INTEGER, "int")
            .register(TypeKind.FLOATING, "float")
            .register(TypeKind.COMPLEX, "complex")
            .register(TypeKind.STRING, "str")
            .register(TypeKind.DATE, "datetime.date")
            .register(TypeKind.TIME, "datetime.time")
            .register(TypeKind.TIMESTAMP, "datetime.datetime")
            .register(TypeKind.DATETIME, "datetime.datetime")
            .register(TypeKind.NONE, "None");

    public PythonTranspiler(TranspilerConfig config) {
        this.indentUnit = config.getIndentString();
    }

    public PythonTranspiler() {
        this(new TranspilerConfig());
    }

    @Override
    public String render(AstNode root) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("渲染 " + root + " @ " + root.getLocation());
        }
        try {
            return root.accept(this, 0);
        } catch (UnimplementedConstructException e) {
            LOG.log(Level.FINE, "渲染中止: " + e.getMessage(), e);
            throw e;
        }
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    // ============ 结构 ============

    @Override
    public String visitModule(Module node, Integer depth) {
        List<String> lines = new ArrayList<String>();
        for (Statement stmt : node.getStatements()) {
            lines.add(indent(depth) + stmt.accept(this, depth));
        }
        return String.join("\n", lines);
    }

    /**
     * 每条语句占 depth+1 层缩进；空块输出一行 pass
     */
    @Override
    public String visitBlock(Block node, Integer depth) {
        int inner = depth + 1;
        String prefix = indent(inner);
        if (node.isEmpty()) {
            return prefix + "pass";
        }
        List<String> lines = new ArrayList<String>();
        for (Statement stmt : node.getStatements()) {
            lines.add(prefix + stmt.accept(this, inner));
        }
        return String.join("\n", lines);
    }

    @Override
    public String visitArgument(Argument node, Integer depth) {
        return node.getName() + ": " + node.getType().accept(this, depth);
    }

    @Override
    public String visitArguments(Arguments node, Integer depth) {
        return join(node.getArgs(), depth);
    }

    @Override
    public String visitAliasExpr(AliasExpr node, Integer depth) {
        if (node.hasAlias()) {
            return node.getName() + " as " + node.getAlias();
        }
        return node.getName();
    }

    @Override
    public String visitDataType(DataType node, Integer depth) {
        return typeNames.require(node);
    }

    // ============ 语句 ============

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Integer depth) {
        return node.getExpression().accept(this, depth);
    }

    @Override
    public String visitFunction(Function node, Integer depth) {
        StringBuilder header = new StringBuilder();
        header.append("def ").append(node.getName());
        header.append('(').append(node.getArgs().accept(this, depth)).append(')');
        if (node.hasReturnType()) {
            header.append(" -> ").append(node.getReturnType().accept(this, depth));
        }
        header.append(':');
        return header + "\n" + node.getBody().accept(this, depth);
    }

    @Override
    public String visitFunctionReturn(FunctionReturn node, Integer depth) {
        if (node.hasValue()) {
            return "return " + node.getValue().accept(this, depth);
        }
        return "return";
    }

    @Override
    public String visitVariableAssignment(VariableAssignment node, Integer depth) {
        return node.getName() + " = " + node.getValue().accept(this, depth);
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node, Integer depth) {
        return declaration(node.getName(), node.getType(), node.getValue(), depth);
    }

    @Override
    public String visitIfStmt(IfStmt node, Integer depth) {
        StringBuilder sb = new StringBuilder();
        sb.append("if ").append(node.getCondition().accept(this, depth)).append(":\n");
        sb.append(node.getThenBlock().accept(this, depth));
        if (node.hasElse()) {
            sb.append('\n').append(indent(depth)).append("else:\n");
            sb.append(node.getElseBlock().accept(this, depth));
        }
        return sb.toString();
    }

    @Override
    public String visitWhileStmt(WhileStmt node, Integer depth) {
        return "while " + node.getCondition().accept(this, depth) + ":\n"
                + node.getBody().accept(this, depth);
    }

    @Override
    public String visitForRangeLoopStmt(ForRangeLoopStmt node, Integer depth) {
        StringBuilder sb = new StringBuilder();
        sb.append("for ").append(node.getVariable()).append(" in range(");
        sb.append(node.getStart().accept(this, depth)).append(", ");
        sb.append(node.getEnd().accept(this, depth));
        if (node.hasStep()) {
            sb.append(", ").append(node.getStep().accept(this, depth));
        }
        sb.append("):\n");
        sb.append(node.getBody().accept(this, depth));
        return sb.toString();
    }

    @Override
    public String visitGotoStmt(GotoStmt node, Integer depth) {
        throw new UnimplementedConstructException(node);
    }

    @Override
    public String visitImportStmt(ImportStmt node, Integer depth) {
        return "import " + join(node.getNames(), depth);
    }

    @Override
    public String visitImportFromStmt(ImportFromStmt node, Integer depth) {
        return "from " + node.getQualifiedModule() + " import " + join(node.getNames(), depth);
    }

    // ============ 表达式 ============

    @Override
    public String visitLiteral(Literal node, Integer depth) {
        Object value = node.getValue();
        switch (node.getLiteralKind().getFamily()) {
            case BOOLEAN:
                return ((Boolean) value) ? "True" : "False";
            case INTEGER:
                return value.toString();
            case FLOATING:
                return formatFloat((Double) value);
            case COMPLEX: {
                Complex c = (Complex) value;
                return "complex(" + formatFloat(c.getReal()) + ", " + formatFloat(c.getImaginary()) + ")";
            }
            case STRING:
                return PythonStringUtils.quote((String) value);
            case TEMPORAL:
                return formatTemporal(node.getLiteralKind(), value);
            case NONE:
                return "None";
            default:
                throw new UnimplementedConstructException(node);
        }
    }

    @Override
    public String visitVariable(Variable node, Integer depth) {
        return node.getName();
    }

    @Override
    public String visitBinaryOp(BinaryOp node, Integer depth) {
        String lhs = node.getLhs().accept(this, depth);
        String rhs = node.getRhs().accept(this, depth);
        return "(" + lhs + " " + node.getOpCode() + " " + rhs + ")";
    }

    /**
     * 符号运算符紧贴操作数，如 {@code (-x)}；单词运算符需要空格，如 {@code (not x)}
     */
    @Override
    public String visitUnaryOp(UnaryOp node, Integer depth) {
        String op = node.getOpCode();
        String operand = node.getOperand().accept(this, depth);
        String sep = Character.isLetter(op.charAt(op.length() - 1)) ? " " : "";
        return "(" + op + sep + operand + ")";
    }

    @Override
    public String visitFunctionCall(FunctionCall node, Integer depth) {
        return node.getCallee() + "(" + join(node.getArgs(), depth) + ")";
    }

    @Override
    public String visitTypeCastExpr(TypeCastExpr node, Integer depth) {
        return node.getTargetType().accept(this, depth) + "(" + node.getExpr().accept(this, depth) + ")";
    }

    @Override
    public String visitIfExpr(IfExpr node, Integer depth) {
        return "(" + node.getThenExpr().accept(this, depth)
                + " if " + node.getCondition().accept(this, depth)
                + " else " + node.getElseExpr().accept(this, depth) + ")";
    }

    @Override
    public String visitWhileExpr(WhileExpr node, Integer depth) {
        throw new UnimplementedConstructException(node);
    }

    /**
     * 每个模块变成一次 {@code __import__} 调用，结果按位置赋给 module 或 module1..moduleN
     */
    @Override
    public String visitImportExpr(ImportExpr node, Integer depth) {
        List<String> calls = new ArrayList<String>();
        for (AliasExpr name : node.getNames()) {
            calls.add("__import__(" + PythonStringUtils.quote(name.getName()) + ")");
        }
        return syntheticAssignment("module", calls);
    }

    /**
     * 每个名字变成一次从模块中取属性的调用，结果按位置赋给 name 或 name1..nameN
     */
    @Override
    public String visitImportFromExpr(ImportFromExpr node, Integer depth) {
        String module = PythonStringUtils.quote(node.getQualifiedModule());
        List<String> calls = new ArrayList<String>();
        for (AliasExpr name : node.getNames()) {
            String quoted = PythonStringUtils.quote(name.getName());
            calls.add("getattr(__import__(" + module + ", fromlist=[" + quoted + "]), " + quoted + ")");
        }
        return syntheticAssignment("name", calls);
    }

    @Override
    public String visitInlineVariableDeclaration(InlineVariableDeclaration node, Integer depth) {
        return declaration(node.getName(), node.getType(), node.getValue(), depth);
    }

    // ============ 辅助 ============

    private String indent(int depth) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            sb.append(indentUnit);
        }
        return sb.toString();
    }

    private String join(List<? extends AstNode> nodes, int depth) {
        List<String> parts = new ArrayList<String>(nodes.size());
        for (AstNode n : nodes) {
            parts.add(n.accept(this, depth));
        }
        return String.join(", ", parts);
    }

    private String declaration(String name, DataType type, Expression value, int depth) {
        String head = name + ": " + type.accept(this, depth);
        if (value == null) {
            return head;
        }
        return head + " = " + value.accept(this, depth);
    }

    /**
     * 单个绑定不加括号：{@code name = call}；多个绑定右侧是元组：
     * {@code name1, name2 = (call1, call2)}
     */
    private static String syntheticAssignment(String prefix, List<String> calls) {
        if (calls.size() == 1) {
            return prefix + " = " + calls.get(0);
        }
        List<String> targets = new ArrayList<String>(calls.size());
        for (int i = 1; i <= calls.size(); i++) {
            targets.add(prefix + i);
        }
        return String.join(", ", targets) + " = (" + String.join(", ", calls) + ")";
    }

    private static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "float('nan')";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "float('inf')" : "float('-inf')";
        }
        return Double.toString(value);
    }

    private static String formatTemporal(LiteralKind kind, Object value) {
        switch (kind) {
            case DATE: {
                LocalDate d = (LocalDate) value;
                return "datetime.date(" + d.getYear() + ", " + d.getMonthValue() + ", " + d.getDayOfMonth() + ")";
            }
            case TIME: {
                LocalTime t = (LocalTime) value;
                return "datetime.time(" + timeFields(t) + ")";
            }
            default: {
                LocalDateTime dt = (LocalDateTime) value;
                return "datetime.datetime(" + dt.getYear() + ", " + dt.getMonthValue() + ", "
                        + dt.getDayOfMonth() + ", " + timeFields(dt.toLocalTime()) + ")";
            }
        }
    }

    private static String timeFields(LocalTime t) {
        String fields = t.getHour() + ", " + t.getMinute() + ", " + t.getSecond();
        int micros = t.getNano() / 1000;
        return micros != 0 ? fields + ", " + micros : fields;
    }
}
