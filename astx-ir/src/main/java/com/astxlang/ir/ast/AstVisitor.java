package com.astxlang.ir.ast;

import com.astxlang.ir.ast.decl.*;
import com.astxlang.ir.ast.decl.Module;
import com.astxlang.ir.ast.expr.*;
import com.astxlang.ir.ast.stmt.*;
import com.astxlang.ir.ast.type.DataType;

/**
 * AST 访问者接口
 *
 * <p>每个具体变体一个方法且没有默认实现，后端必须显式处理所有变体，
 * 漏掉的变体在编译期即报错。只打算支持部分变体的后端应继承
 * {@link PartialAstVisitor}。</p>
 *
 * @param <R> 返回类型
 * @param <C> 沿递归按值传递的上下文（如缩进深度）
 */
public interface AstVisitor<R, C> {

    // ============ 结构 ============

    R visitModule(Module node, C ctx);

    R visitBlock(Block node, C ctx);

    R visitArgument(Argument node, C ctx);

    R visitArguments(Arguments node, C ctx);

    R visitAliasExpr(AliasExpr node, C ctx);

    R visitDataType(DataType node, C ctx);

    // ============ 语句 ============

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitFunction(Function node, C ctx);

    R visitFunctionReturn(FunctionReturn node, C ctx);

    R visitVariableAssignment(VariableAssignment node, C ctx);

    R visitVariableDeclaration(VariableDeclaration node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitForRangeLoopStmt(ForRangeLoopStmt node, C ctx);

    R visitGotoStmt(GotoStmt node, C ctx);

    R visitImportStmt(ImportStmt node, C ctx);

    R visitImportFromStmt(ImportFromStmt node, C ctx);

    // ============ 表达式 ============

    R visitLiteral(Literal node, C ctx);

    R visitVariable(Variable node, C ctx);

    R visitBinaryOp(BinaryOp node, C ctx);

    R visitUnaryOp(UnaryOp node, C ctx);

    R visitFunctionCall(FunctionCall node, C ctx);

    R visitTypeCastExpr(TypeCastExpr node, C ctx);

    R visitIfExpr(IfExpr node, C ctx);

    R visitWhileExpr(WhileExpr node, C ctx);

    R visitImportExpr(ImportExpr node, C ctx);

    R visitImportFromExpr(ImportFromExpr node, C ctx);

    R visitInlineVariableDeclaration(InlineVariableDeclaration node, C ctx);
}
