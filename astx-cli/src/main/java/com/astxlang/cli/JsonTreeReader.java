package com.astxlang.cli;

import com.astxlang.ir.ast.AstConstructionException;
import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.MutabilityKind;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.decl.*;
import com.astxlang.ir.ast.decl.Module;
import com.astxlang.ir.ast.expr.*;
import com.astxlang.ir.ast.stmt.*;
import com.astxlang.ir.ast.type.DataType;
import com.astxlang.ir.ast.type.TypeKind;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * 从 JSON 读取 IR 树
 *
 * <p>每个节点是一个对象，{@code "kind"} 为变体名（如 {@code "Function"}），
 * 其余字段与节点构造参数同名。可选的 {@code "location"} 为
 * {@code {"file", "line", "column"}}。字面量用 {@code "type"} 指定类型名
 * （如 {@code "Int32"}），时间类值为 ISO-8601 字符串，复数值为
 * {@code {"real", "imag"}}。导入名既可以是字符串，也可以是 AliasExpr 对象。</p>
 */
public class JsonTreeReader {

    public AstNode read(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new TreeFormatException("malformed JSON: " + e.getMessage(), "$", e);
        }
        return node(root, "$");
    }

    // ============ 节点 ============

    private AstNode node(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new TreeFormatException("expected a node object", path);
        }
        JsonObject obj = element.getAsJsonObject();
        String kindName = string(obj, "kind", path);
        NodeKind kind = NodeKind.fromDisplayName(kindName);
        if (kind == null) {
            throw new TreeFormatException("unknown node kind '" + kindName + "'", path);
        }
        SourceLocation loc = location(obj, path);
        try {
            return build(kind, obj, loc, path);
        } catch (AstConstructionException e) {
            throw new TreeFormatException(e.getMessage(), path, e);
        }
    }

    private AstNode build(NodeKind kind, JsonObject obj, SourceLocation loc, String path) {
        switch (kind) {
            case MODULE:
                return new Module(loc, string(obj, "name", path), statements(obj, "statements", path));
            case BLOCK:
                return new Block(loc, statements(obj, "statements", path));
            case ARGUMENT:
                return new Argument(loc, string(obj, "name", path), dataType(obj, "type", path));
            case ARGUMENTS:
                return arguments(obj, loc, path);
            case ALIAS_EXPR:
                return new AliasExpr(loc, string(obj, "name", path), optionalString(obj, "alias", path));
            case DATA_TYPE:
                return new DataType(loc, typeKind(obj, path));

            case EXPRESSION_STMT:
                return new ExpressionStmt(loc, expression(obj, "expression", path));
            case FUNCTION: {
                Arguments args = obj.has("args")
                        ? arguments(obj.get("args"), path + ".args")
                        : Arguments.empty();
                return new Function(loc, string(obj, "name", path), args,
                        optionalDataType(obj, "returnType", path), block(obj, "body", path));
            }
            case FUNCTION_RETURN:
                return new FunctionReturn(loc, optionalExpression(obj, "value", path));
            case VARIABLE_ASSIGNMENT:
                return new VariableAssignment(loc, string(obj, "name", path), expression(obj, "value", path));
            case VARIABLE_DECLARATION:
                return new VariableDeclaration(loc, string(obj, "name", path), dataType(obj, "type", path),
                        optionalExpression(obj, "value", path), mutability(obj, path));
            case IF_STMT:
                return new IfStmt(loc, expression(obj, "condition", path), block(obj, "then", path),
                        obj.has("else") ? block(obj, "else", path) : null);
            case WHILE_STMT:
                return new WhileStmt(loc, expression(obj, "condition", path), block(obj, "body", path));
            case FOR_RANGE_LOOP_STMT:
                return new ForRangeLoopStmt(loc, string(obj, "variable", path),
                        expression(obj, "start", path), expression(obj, "end", path),
                        optionalExpression(obj, "step", path), block(obj, "body", path));
            case GOTO_STMT:
                return new GotoStmt(loc, string(obj, "label", path));
            case IMPORT_STMT:
                return new ImportStmt(loc, aliases(obj, path));
            case IMPORT_FROM_STMT:
                return new ImportFromStmt(loc, optionalString(obj, "module", path), aliases(obj, path), level(obj, path));

            case LITERAL:
                return literal(obj, loc, path);
            case VARIABLE:
                return new Variable(loc, string(obj, "name", path));
            case BINARY_OP:
                return new BinaryOp(loc, string(obj, "op", path),
                        expression(obj, "lhs", path), expression(obj, "rhs", path));
            case UNARY_OP:
                return new UnaryOp(loc, string(obj, "op", path), expression(obj, "operand", path));
            case FUNCTION_CALL:
                return new FunctionCall(loc, string(obj, "callee", path), expressions(obj, "args", path));
            case TYPE_CAST_EXPR:
                return new TypeCastExpr(loc, expression(obj, "expr", path), dataType(obj, "type", path));
            case IF_EXPR:
                return new IfExpr(loc, expression(obj, "condition", path),
                        expression(obj, "then", path), expression(obj, "else", path));
            case WHILE_EXPR:
                return new WhileExpr(loc, expression(obj, "condition", path), block(obj, "body", path));
            case IMPORT_EXPR:
                return new ImportExpr(loc, aliases(obj, path));
            case IMPORT_FROM_EXPR:
                return new ImportFromExpr(loc, optionalString(obj, "module", path), aliases(obj, path), level(obj, path));
            case INLINE_VARIABLE_DECLARATION:
                return new InlineVariableDeclaration(loc, string(obj, "name", path), dataType(obj, "type", path),
                        optionalExpression(obj, "value", path), mutability(obj, path));
            default:
                throw new TreeFormatException("unsupported node kind " + kind.getDisplayName(), path);
        }
    }

    // ============ 字面量 ============

    private Literal literal(JsonObject obj, SourceLocation loc, String path) {
        TypeKind type = typeKind(obj, path);
        LiteralKind kind = null;
        for (LiteralKind k : LiteralKind.values()) {
            if (k.getTypeKind() == type) {
                kind = k;
                break;
            }
        }
        if (kind == null) {
            throw new TreeFormatException("no literal of type " + type.getDisplayName(), path);
        }
        JsonElement raw = obj.get("value");
        if (kind == LiteralKind.NONE) {
            return Literal.of(loc, kind, null);
        }
        if (raw == null || raw.isJsonNull()) {
            throw new TreeFormatException("missing field 'value'", path);
        }
        String valuePath = path + ".value";
        switch (kind.getFamily()) {
            case BOOLEAN:
                return Literal.of(loc, kind, bool(raw, valuePath));
            case INTEGER:
                try {
                    return Literal.of(loc, kind, number(raw, valuePath).getAsBigInteger());
                } catch (NumberFormatException e) {
                    throw new TreeFormatException("expected an integral value, got " + raw, valuePath, e);
                }
            case FLOATING:
                return Literal.of(loc, kind, decimal(raw, valuePath));
            case COMPLEX: {
                if (!raw.isJsonObject()) {
                    throw new TreeFormatException("expected {\"real\", \"imag\"}", valuePath);
                }
                JsonObject c = raw.getAsJsonObject();
                double real = component(c.get("real"), valuePath + ".real");
                double imag = component(c.get("imag"), valuePath + ".imag");
                return Literal.of(loc, kind, new Complex(real, imag));
            }
            case STRING:
                return Literal.of(loc, kind, text(raw, valuePath));
            case TEMPORAL:
                return Literal.of(loc, kind, temporal(kind, text(raw, valuePath), valuePath));
            default:
                throw new TreeFormatException("unsupported literal " + kind.getDisplayName(), path);
        }
    }

    private static Object temporal(LiteralKind kind, String text, String path) {
        try {
            switch (kind) {
                case DATE: return LocalDate.parse(text);
                case TIME: return LocalTime.parse(text);
                default:   return LocalDateTime.parse(text);
            }
        } catch (DateTimeParseException e) {
            throw new TreeFormatException("invalid ISO-8601 value '" + text + "'", path, e);
        }
    }

    // ============ 子节点 ============

    private <T extends AstNode> T child(JsonObject obj, String field, String path, Class<T> type, String role) {
        String childPath = path + "." + field;
        if (!obj.has(field) || obj.get(field).isJsonNull()) {
            throw new TreeFormatException("missing field '" + field + "'", path);
        }
        AstNode n = node(obj.get(field), childPath);
        if (!type.isInstance(n)) {
            throw new TreeFormatException("expected " + role + ", got " + n.getKind().getDisplayName(), childPath);
        }
        return type.cast(n);
    }

    private Expression expression(JsonObject obj, String field, String path) {
        return child(obj, field, path, Expression.class, "an expression");
    }

    private Expression optionalExpression(JsonObject obj, String field, String path) {
        if (!obj.has(field) || obj.get(field).isJsonNull()) {
            return null;
        }
        return expression(obj, field, path);
    }

    private Block block(JsonObject obj, String field, String path) {
        JsonElement raw = obj.get(field);
        if (raw != null && raw.isJsonArray()) {
            return new Block(statementList(raw.getAsJsonArray(), path + "." + field));
        }
        return child(obj, field, path, Block.class, "a Block");
    }

    private DataType dataType(JsonObject obj, String field, String path) {
        JsonElement raw = obj.get(field);
        if (raw != null && raw.isJsonPrimitive()) {
            return new DataType(typeKind(text(raw, path + "." + field), path + "." + field));
        }
        return child(obj, field, path, DataType.class, "a DataType");
    }

    private DataType optionalDataType(JsonObject obj, String field, String path) {
        if (!obj.has(field) || obj.get(field).isJsonNull()) {
            return null;
        }
        return dataType(obj, field, path);
    }

    private List<Statement> statements(JsonObject obj, String field, String path) {
        return statementList(array(obj, field, path), path + "." + field);
    }

    private List<Statement> statementList(JsonArray array, String path) {
        List<Statement> result = new ArrayList<Statement>();
        for (int i = 0; i < array.size(); i++) {
            String itemPath = path + "[" + i + "]";
            AstNode n = node(array.get(i), itemPath);
            if (!(n instanceof Statement)) {
                throw new TreeFormatException("expected a statement, got " + n.getKind().getDisplayName(), itemPath);
            }
            result.add((Statement) n);
        }
        return result;
    }

    private List<Expression> expressions(JsonObject obj, String field, String path) {
        if (!obj.has(field)) {
            return new ArrayList<Expression>();
        }
        JsonArray array = array(obj, field, path);
        List<Expression> result = new ArrayList<Expression>();
        for (int i = 0; i < array.size(); i++) {
            String itemPath = path + "." + field + "[" + i + "]";
            AstNode n = node(array.get(i), itemPath);
            if (!(n instanceof Expression)) {
                throw new TreeFormatException("expected an expression, got " + n.getKind().getDisplayName(), itemPath);
            }
            result.add((Expression) n);
        }
        return result;
    }

    private Arguments arguments(JsonObject obj, SourceLocation loc, String path) {
        return new Arguments(loc, argumentList(array(obj, "args", path), path + ".args"));
    }

    private Arguments arguments(JsonElement raw, String path) {
        if (raw.isJsonArray()) {
            return new Arguments(null, argumentList(raw.getAsJsonArray(), path));
        }
        AstNode n = node(raw, path);
        if (!(n instanceof Arguments)) {
            throw new TreeFormatException("expected Arguments, got " + n.getKind().getDisplayName(), path);
        }
        return (Arguments) n;
    }

    private List<Argument> argumentList(JsonArray array, String path) {
        List<Argument> result = new ArrayList<Argument>();
        for (int i = 0; i < array.size(); i++) {
            String itemPath = path + "[" + i + "]";
            AstNode n = node(array.get(i), itemPath);
            if (!(n instanceof Argument)) {
                throw new TreeFormatException("expected an Argument, got " + n.getKind().getDisplayName(), itemPath);
            }
            result.add((Argument) n);
        }
        return result;
    }

    private List<AliasExpr> aliases(JsonObject obj, String path) {
        JsonArray array = array(obj, "names", path);
        List<AliasExpr> result = new ArrayList<AliasExpr>();
        for (int i = 0; i < array.size(); i++) {
            JsonElement item = array.get(i);
            String itemPath = path + ".names[" + i + "]";
            if (item.isJsonPrimitive()) {
                result.add(new AliasExpr(text(item, itemPath)));
                continue;
            }
            AstNode n = node(item, itemPath);
            if (!(n instanceof AliasExpr)) {
                throw new TreeFormatException("expected an AliasExpr, got " + n.getKind().getDisplayName(), itemPath);
            }
            result.add((AliasExpr) n);
        }
        return result;
    }

    // ============ 标量字段 ============

    private static SourceLocation location(JsonObject obj, String path) {
        if (!obj.has("location")) {
            return null;
        }
        JsonElement raw = obj.get("location");
        if (!raw.isJsonObject()) {
            throw new TreeFormatException("location must be an object", path + ".location");
        }
        JsonObject loc = raw.getAsJsonObject();
        String locPath = path + ".location";
        String file = optionalString(loc, "file", locPath);
        int line = loc.has("line") ? integer(loc.get("line"), locPath + ".line") : -1;
        int column = loc.has("column") ? integer(loc.get("column"), locPath + ".column") : -1;
        return new SourceLocation(file, line, column);
    }

    private static TypeKind typeKind(JsonObject obj, String path) {
        return typeKind(string(obj, "type", path), path + ".type");
    }

    private static TypeKind typeKind(String name, String path) {
        TypeKind kind = TypeKind.fromDisplayName(name);
        if (kind == null) {
            throw new TreeFormatException("unknown type '" + name + "'", path);
        }
        return kind;
    }

    private static MutabilityKind mutability(JsonObject obj, String path) {
        String raw = optionalString(obj, "mutability", path);
        if (raw == null) {
            return MutabilityKind.MUTABLE;
        }
        try {
            return MutabilityKind.valueOf(raw.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new TreeFormatException("unknown mutability '" + raw + "'", path + ".mutability", e);
        }
    }

    private static int level(JsonObject obj, String path) {
        if (!obj.has("level")) {
            return 0;
        }
        return integer(obj.get("level"), path + ".level");
    }

    private static String string(JsonObject obj, String field, String path) {
        if (!obj.has(field) || obj.get(field).isJsonNull()) {
            throw new TreeFormatException("missing field '" + field + "'", path);
        }
        return text(obj.get(field), path + "." + field);
    }

    private static String optionalString(JsonObject obj, String field, String path) {
        if (!obj.has(field) || obj.get(field).isJsonNull()) {
            return null;
        }
        return text(obj.get(field), path + "." + field);
    }

    private static JsonArray array(JsonObject obj, String field, String path) {
        JsonElement raw = obj.get(field);
        if (raw == null || !raw.isJsonArray()) {
            throw new TreeFormatException("field '" + field + "' must be an array", path);
        }
        return raw.getAsJsonArray();
    }

    private static JsonPrimitive primitive(JsonElement raw, String path) {
        if (raw == null || !raw.isJsonPrimitive()) {
            throw new TreeFormatException("expected a scalar value", path);
        }
        return raw.getAsJsonPrimitive();
    }

    private static JsonPrimitive number(JsonElement raw, String path) {
        JsonPrimitive p = primitive(raw, path);
        if (!p.isNumber()) {
            throw new TreeFormatException("expected a number", path);
        }
        return p;
    }

    private static String text(JsonElement raw, String path) {
        JsonPrimitive p = primitive(raw, path);
        if (!p.isString()) {
            throw new TreeFormatException("expected a string, got " + p, path);
        }
        return p.getAsString();
    }

    private static boolean bool(JsonElement raw, String path) {
        JsonPrimitive p = primitive(raw, path);
        if (!p.isBoolean()) {
            throw new TreeFormatException("expected true or false, got " + p, path);
        }
        return p.getAsBoolean();
    }

    private static int integer(JsonElement raw, String path) {
        JsonPrimitive p = number(raw, path);
        try {
            return p.getAsBigDecimal().intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new TreeFormatException("expected an int value, got " + p, path, e);
        }
    }

    /**
     * 浮点值保留原始精度交给 {@link Literal} 校验位宽；宽松模式下的 NaN/Infinity 记号按 double 读取
     */
    private static Number decimal(JsonElement raw, String path) {
        JsonPrimitive p = number(raw, path);
        try {
            return p.getAsBigDecimal();
        } catch (NumberFormatException e) {
            return p.getAsDouble();
        }
    }

    private static double component(JsonElement raw, String path) {
        Number n = decimal(raw, path);
        double d = n.doubleValue();
        if (n instanceof BigDecimal && Double.isInfinite(d)) {
            throw new TreeFormatException("value " + n + " is out of floating-point range", path);
        }
        return d;
    }
}
