/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

import static com.cloudway.monad.syntax.Expr.*;

/**
 * A visitor over the finite set of expression nodes.
 *
 * @param <R> the result type of the visitor
 */
public interface ExprVisitor<R> {
    R visitLiteral(Literal e);
    R visitVar(Var e);
    R visitWildcard(Wildcard e);
    R visitQualified(Qualified e);
    R visitCall(Call e);
    R visitLambda(Lambda e);
    R visitBlock(Block e);
    R visitAssign(Assign e);
    R visitIf(If e);
    R visitBinaryOp(BinaryOp e);
    R visitList(ListExpr e);
    R visitTuple(TupleExpr e);
    R visitPipe(Pipe e);
    R visitDoBlock(DoBlock e);
}
