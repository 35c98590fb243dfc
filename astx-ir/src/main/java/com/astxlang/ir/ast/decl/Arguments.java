package com.astxlang.ir.ast.decl;

import com.astxlang.ir.ast.AstChecks;
import com.astxlang.ir.ast.AstNode;
import com.astxlang.ir.ast.AstVisitor;
import com.astxlang.ir.ast.NodeKind;
import com.astxlang.ir.ast.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 有序形参列表。名字不要求唯一，唯一性由前端负责。
 */
public final class Arguments extends AstNode {
    private final List<Argument> args;

    public Arguments(SourceLocation location, List<Argument> args) {
        super(location);
        this.args = AstChecks.elements(NodeKind.ARGUMENTS, args, "arguments");
    }

    public Arguments(Argument... args) {
        this(null, Arrays.asList(args));
    }

    public static Arguments empty() {
        return new Arguments(null, Collections.<Argument>emptyList());
    }

    public List<Argument> getArgs() {
        return args;
    }

    public int size() {
        return args.size();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARGUMENTS;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArguments(this, context);
    }
}
