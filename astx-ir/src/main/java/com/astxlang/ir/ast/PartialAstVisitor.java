package com.astxlang.ir.ast;

import com.astxlang.ir.ast.decl.*;
import com.astxlang.ir.ast.decl.Module;
import com.astxlang.ir.ast.expr.*;
import com.astxlang.ir.ast.stmt.*;
import com.astxlang.ir.ast.type.DataType;

/**
 * 只支持部分变体的访问者基类
 *
 * <p>所有方法默认转到 {@link #unimplemented(AstNode, Object)}，抛出
 * {@link UnimplementedConstructException}。子类覆盖自己支持的变体即可；
 * 未覆盖的变体在渲染时报错，绝不静默返回空文本。</p>
 */
public abstract class PartialAstVisitor<R, C> implements AstVisitor<R, C> {

    /**
     * 未支持变体的统一出口
     */
    protected R unimplemented(AstNode node, C ctx) {
        throw new UnimplementedConstructException(node);
    }

    @Override
    public R visitModule(Module node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitBlock(Block node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitArgument(Argument node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitArguments(Arguments node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitAliasExpr(AliasExpr node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitDataType(DataType node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitExpressionStmt(ExpressionStmt node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitFunction(Function node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitFunctionReturn(FunctionReturn node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitVariableAssignment(VariableAssignment node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitVariableDeclaration(VariableDeclaration node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitIfStmt(IfStmt node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitWhileStmt(WhileStmt node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitForRangeLoopStmt(ForRangeLoopStmt node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitGotoStmt(GotoStmt node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitImportStmt(ImportStmt node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitImportFromStmt(ImportFromStmt node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitLiteral(Literal node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitVariable(Variable node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitBinaryOp(BinaryOp node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitUnaryOp(UnaryOp node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitFunctionCall(FunctionCall node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitTypeCastExpr(TypeCastExpr node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitIfExpr(IfExpr node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitWhileExpr(WhileExpr node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitImportExpr(ImportExpr node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitImportFromExpr(ImportFromExpr node, C ctx) {
        return unimplemented(node, ctx);
    }

    @Override
    public R visitInlineVariableDeclaration(InlineVariableDeclaration node, C ctx) {
        return unimplemented(node, ctx);
    }
}
