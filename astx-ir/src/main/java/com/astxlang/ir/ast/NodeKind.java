package com.astxlang.ir.ast;

/**
 * 节点变体判别值
 *
 * <p>核心在编译期已知的全部具体变体。新增变体需要同步更新 {@link AstVisitor}
 * 及所有后端；新增后端则无需改动本枚举。</p>
 */
public enum NodeKind {
    // 表达式
    LITERAL("Literal", Role.EXPRESSION),
    VARIABLE("Variable", Role.EXPRESSION),
    BINARY_OP("BinaryOp", Role.EXPRESSION),
    UNARY_OP("UnaryOp", Role.EXPRESSION),
    FUNCTION_CALL("FunctionCall", Role.EXPRESSION),
    TYPE_CAST_EXPR("TypeCastExpr", Role.EXPRESSION),
    IF_EXPR("IfExpr", Role.EXPRESSION),
    WHILE_EXPR("WhileExpr", Role.EXPRESSION),
    IMPORT_EXPR("ImportExpr", Role.EXPRESSION),
    IMPORT_FROM_EXPR("ImportFromExpr", Role.EXPRESSION),
    INLINE_VARIABLE_DECLARATION("InlineVariableDeclaration", Role.EXPRESSION),

    // 语句
    EXPRESSION_STMT("ExpressionStmt", Role.STATEMENT),
    FUNCTION("Function", Role.STATEMENT),
    FUNCTION_RETURN("FunctionReturn", Role.STATEMENT),
    VARIABLE_ASSIGNMENT("VariableAssignment", Role.STATEMENT),
    VARIABLE_DECLARATION("VariableDeclaration", Role.STATEMENT),
    IF_STMT("IfStmt", Role.STATEMENT),
    WHILE_STMT("WhileStmt", Role.STATEMENT),
    FOR_RANGE_LOOP_STMT("ForRangeLoopStmt", Role.STATEMENT),
    GOTO_STMT("GotoStmt", Role.STATEMENT),
    IMPORT_STMT("ImportStmt", Role.STATEMENT),
    IMPORT_FROM_STMT("ImportFromStmt", Role.STATEMENT),

    // 结构
    BLOCK("Block", Role.STRUCTURE),
    MODULE("Module", Role.STRUCTURE),
    ARGUMENT("Argument", Role.STRUCTURE),
    ARGUMENTS("Arguments", Role.STRUCTURE),
    ALIAS_EXPR("AliasExpr", Role.STRUCTURE),
    DATA_TYPE("DataType", Role.STRUCTURE);

    private final String displayName;
    private final Role role;

    NodeKind(String displayName, Role role) {
        this.displayName = displayName;
        this.role = role;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Role getRole() {
        return role;
    }

    /** 按变体名查找，未知返回 null */
    public static NodeKind fromDisplayName(String name) {
        for (NodeKind kind : values()) {
            if (kind.displayName.equals(name)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * 节点的语法角色。表达式与语句互斥，语句只能直接出现在 Block 中。
     */
    public enum Role {
        EXPRESSION,
        STATEMENT,
        STRUCTURE
    }
}
