/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

import java.util.List;

import com.cloudway.monad.syntax.Expr.*;

/**
 * Renders expressions and statements as surface text.
 */
public class Printer implements ExprVisitor<Void> {
    private final StringBuilder buffer = new StringBuilder();

    public static String show(Expr expr) {
        Printer pr = new Printer();
        pr.add(expr);
        return pr.toString();
    }

    public static String show(Stmt stmt) {
        Printer pr = new Printer();
        pr.add(stmt);
        return pr.toString();
    }

    public void add(Expr expr) {
        expr.accept(this);
    }

    public void add(String literal) {
        buffer.append(literal);
    }

    public void add(Stmt stmt) {
        if (stmt instanceof Stmt.Bind) {
            Stmt.Bind b = (Stmt.Bind)stmt;
            add(b.pattern);
            add(" <- ");
            add(b.action);
        } else if (stmt instanceof Stmt.Let) {
            List<Assign> bindings = ((Stmt.Let)stmt).bindings;
            if (bindings.size() == 1) {
                add("let ");
                add(bindings.get(0));
            } else {
                add("let {");
                addAll(bindings, "; ");
                add("}");
            }
        } else if (stmt instanceof Stmt.Plain) {
            add(((Stmt.Plain)stmt).action);
        } else if (stmt instanceof Stmt.Tail) {
            add(((Stmt.Tail)stmt).expr);
        } else {
            throw new IllegalArgumentException("unknown statement: " + stmt.getClass().getName());
        }
    }

    private void addAll(List<? extends Expr> exprs, String sep) {
        boolean first = true;
        for (Expr e : exprs) {
            if (!first)
                add(sep);
            add(e);
            first = false;
        }
    }

    private void addOperand(Expr e) {
        if (e instanceof BinaryOp || e instanceof Pipe || e instanceof Lambda) {
            add("(");
            add(e);
            add(")");
        } else {
            add(e);
        }
    }

    @Override
    public Void visitLiteral(Literal e) {
        if (e.value instanceof String) {
            add("\"");
            add(((String)e.value).replace("\\", "\\\\").replace("\"", "\\\""));
            add("\"");
        } else {
            add(String.valueOf(e.value));
        }
        return null;
    }

    @Override
    public Void visitVar(Var e) {
        if (e instanceof GenSym)
            add("#");
        add(e.name);
        return null;
    }

    @Override
    public Void visitWildcard(Wildcard e) {
        add("_");
        return null;
    }

    @Override
    public Void visitQualified(Qualified e) {
        add(e.module);
        add(".");
        add(e.name);
        return null;
    }

    @Override
    public Void visitCall(Call e) {
        addOperand(e.target);
        add("(");
        addAll(e.args, ", ");
        add(")");
        return null;
    }

    @Override
    public Void visitLambda(Lambda e) {
        add("fn ");
        if (!e.params.isEmpty()) {
            addAll(e.params, ", ");
            add(" ");
        }
        add("-> ");
        add(e.body);
        add(" end");
        return null;
    }

    @Override
    public Void visitBlock(Block e) {
        add("(");
        addAll(e.body, "; ");
        add(")");
        return null;
    }

    @Override
    public Void visitAssign(Assign e) {
        add(e.pattern);
        add(" = ");
        add(e.value);
        return null;
    }

    @Override
    public Void visitIf(If e) {
        add("if ");
        add(e.cond);
        add(" then ");
        add(e.then);
        add(" else ");
        add(e.otherwise);
        add(" end");
        return null;
    }

    @Override
    public Void visitBinaryOp(BinaryOp e) {
        addOperand(e.left);
        add(" " + e.op + " ");
        addOperand(e.right);
        return null;
    }

    @Override
    public Void visitList(ListExpr e) {
        add("[");
        addAll(e.elements, ", ");
        add("]");
        return null;
    }

    @Override
    public Void visitTuple(TupleExpr e) {
        add("{");
        addAll(e.elements, ", ");
        add("}");
        return null;
    }

    @Override
    public Void visitPipe(Pipe e) {
        add(e.left);
        add(" |> ");
        add(e.right);
        return null;
    }

    @Override
    public Void visitDoBlock(DoBlock e) {
        add(e.strategy.name());
        add(".m do ");
        boolean first = true;
        for (Stmt s : e.stmts) {
            if (!first)
                add("; ");
            add(s);
            first = false;
        }
        add(" end");
        return null;
    }

    public String toString() {
        return buffer.toString();
    }
}
