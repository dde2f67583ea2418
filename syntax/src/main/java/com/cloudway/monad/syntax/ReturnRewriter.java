/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.cloudway.monad.Config;
import com.cloudway.monad.syntax.Expr.*;

/**
 * Qualifies every unqualified {@code return} in a tree to the active
 * strategy. Both calls ({@code return(x)}) and bare references
 * ({@code return} used as a function value) are rewritten. Nested
 * do-blocks of another strategy are left alone since they resolve
 * their own {@code return} when they are expanded. Patterns are never
 * rewritten.
 */
public class ReturnRewriter implements ExprVisitor<Expr> {
    private final Strategy strategy;
    private final String keyword;

    public ReturnRewriter(Strategy strategy) {
        this(strategy, Config.RETURN_KEYWORD.get());
    }

    public ReturnRewriter(Strategy strategy, String keyword) {
        this.strategy = strategy;
        this.keyword = keyword;
    }

    public static Expr rewrite(Strategy strategy, Expr expr) {
        return expr.accept(new ReturnRewriter(strategy));
    }

    public Expr rewrite(Expr expr) {
        return expr.accept(this);
    }

    private ImmutableList<Expr> rewriteAll(List<Expr> exprs) {
        ImmutableList.Builder<Expr> result = ImmutableList.builder();
        for (Expr e : exprs) {
            result.add(e.accept(this));
        }
        return result.build();
    }

    private boolean isKeyword(Expr e) {
        return e instanceof Var && !(e instanceof GenSym) && keyword.equals(((Var)e).name);
    }

    @Override
    public Expr visitLiteral(Literal e) {
        return e;
    }

    @Override
    public Expr visitVar(Var e) {
        return isKeyword(e) ? strategy.returnRef() : e;
    }

    @Override
    public Expr visitWildcard(Wildcard e) {
        return e;
    }

    @Override
    public Expr visitQualified(Qualified e) {
        return e;
    }

    @Override
    public Expr visitCall(Call e) {
        return new Call(e.target.accept(this), rewriteAll(e.args));
    }

    @Override
    public Expr visitLambda(Lambda e) {
        return new Lambda(e.params, e.body.accept(this));
    }

    @Override
    public Expr visitBlock(Block e) {
        return new Block(rewriteAll(e.body));
    }

    @Override
    public Expr visitAssign(Assign e) {
        return new Assign(e.pattern, e.value.accept(this));
    }

    @Override
    public Expr visitIf(If e) {
        return new If(e.cond.accept(this), e.then.accept(this), e.otherwise.accept(this));
    }

    @Override
    public Expr visitBinaryOp(BinaryOp e) {
        return new BinaryOp(e.op, e.left.accept(this), e.right.accept(this));
    }

    @Override
    public Expr visitList(ListExpr e) {
        return new ListExpr(rewriteAll(e.elements));
    }

    @Override
    public Expr visitTuple(TupleExpr e) {
        return new TupleExpr(rewriteAll(e.elements));
    }

    @Override
    public Expr visitPipe(Pipe e) {
        return new Pipe(e.left.accept(this), e.right.accept(this));
    }

    @Override
    public Expr visitDoBlock(DoBlock e) {
        if (!strategy.equals(e.strategy)) {
            return e;
        }
        ImmutableList.Builder<Stmt> stmts = ImmutableList.builder();
        for (Stmt s : e.stmts) {
            stmts.add(s.map(this::rewrite));
        }
        return new DoBlock(e.strategy, stmts.build());
    }
}
