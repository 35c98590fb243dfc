package com.astxlang.ir.ast.stmt;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;
import com.astxlang.ir.ast.expr.Expression;

/**
 * 区间计数循环：变量从 start 递增到 end（不含），步长可选
 */
public final class ForRangeLoopStmt extends Statement {
    private final String variable;
    private final Expression start;
    private final Expression end;
    private final Expression step;  // 可选
    private final Block body;

    public ForRangeLoopStmt(SourceLocation location, String variable, Expression start, Expression end,
                            Expression step, Block body) {
        super(location);
        this.variable = AstChecks.name(NodeKind.FOR_RANGE_LOOP_STMT, variable, "loop variable");
        this.start = AstChecks.required(NodeKind.FOR_RANGE_LOOP_STMT, start, "start");
        this.end = AstChecks.required(NodeKind.FOR_RANGE_LOOP_STMT, end, "end");
        this.step = step;
        this.body = AstChecks.required(NodeKind.FOR_RANGE_LOOP_STMT, body, "body");
    }

    public ForRangeLoopStmt(String variable, Expression start, Expression end, Expression step, Block body) {
        this(null, variable, start, end, step, body);
    }

    public String getVariable() {
        return variable;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    public Expression getStep() {
        return step;
    }

    public boolean hasStep() {
        return step != null;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOR_RANGE_LOOP_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForRangeLoopStmt(this, context);
    }
}
