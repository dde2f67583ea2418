/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.collect.ImmutableList;

import com.cloudway.monad.Config;
import static java.util.Objects.requireNonNull;

/**
 * Represents an expression node. Nodes are immutable and compare
 * structurally, except {@link GenSym} variables which are only equal
 * to themselves.
 */
public interface Expr {
    /**
     * Dispatch on the node type.
     */
    <R> R accept(ExprVisitor<R> visitor);

    /**
     * Returns the surface text of this expression.
     */
    default String show() {
        return Printer.show(this);
    }

    // -----------------------------------------------------------------------
    // Factories

    static Literal lit(Object value) {
        return new Literal(value);
    }

    static Var var(String name) {
        return new Var(name);
    }

    static Wildcard wildcard() {
        return Wildcard.INSTANCE;
    }

    static Qualified qualified(String module, String name) {
        return new Qualified(module, name);
    }

    static Call call(Expr target, Expr... args) {
        return new Call(target, ImmutableList.copyOf(args));
    }

    static Call call(String function, Expr... args) {
        return call(var(function), args);
    }

    static Lambda lambda(Expr param, Expr body) {
        return new Lambda(ImmutableList.of(param), body);
    }

    static Lambda lambda(List<? extends Expr> params, Expr body) {
        return new Lambda(ImmutableList.copyOf(params), body);
    }

    static Block block(Expr... body) {
        return new Block(ImmutableList.copyOf(body));
    }

    static Assign assign(Expr pattern, Expr value) {
        return new Assign(pattern, value);
    }

    static If if_(Expr cond, Expr then, Expr otherwise) {
        return new If(cond, then, otherwise);
    }

    static BinaryOp op(String op, Expr left, Expr right) {
        return new BinaryOp(op, left, right);
    }

    static ListExpr list(Expr... elements) {
        return new ListExpr(ImmutableList.copyOf(elements));
    }

    static TupleExpr tuple(Expr... elements) {
        return new TupleExpr(ImmutableList.copyOf(elements));
    }

    static Pipe pipe(Expr left, Expr right) {
        return new Pipe(left, right);
    }

    /**
     * Build a left-associative pipe chain from the given stages.
     */
    static Expr pipeline(Expr first, Expr... rest) {
        Expr chain = first;
        for (Expr stage : rest) {
            chain = new Pipe(chain, stage);
        }
        return chain;
    }

    static DoBlock doBlock(Strategy strategy, Stmt... stmts) {
        return new DoBlock(strategy, ImmutableList.copyOf(stmts));
    }

    // -----------------------------------------------------------------------
    // Nodes

    final class Literal implements Expr {
        public final Object value;

        Literal(Object value) {
            this.value = requireNonNull(value);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        public boolean equals(Object obj) {
            return obj instanceof Literal && value.equals(((Literal)obj).value);
        }

        public int hashCode() {
            return value.hashCode();
        }

        public String toString() {
            return show();
        }
    }

    class Var implements Expr {
        public final String name;

        Var(String name) {
            this.name = requireNonNull(name);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVar(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (obj != null && obj.getClass() == this.getClass())
                return name.equals(((Var)obj).name);
            return false;
        }

        public int hashCode() {
            return name.hashCode();
        }

        public String toString() {
            return show();
        }
    }

    /**
     * A generated variable. Its identity, not its name, decides equality,
     * so it never captures or shadows a program variable.
     */
    final class GenSym extends Var {
        private static final AtomicLong counter = new AtomicLong();

        GenSym(String name) {
            super(name);
        }

        public static GenSym fresh() {
            return new GenSym(Config.GENSYM_PREFIX.get() + counter.incrementAndGet());
        }

        public boolean equals(Object obj) {
            return obj == this;
        }

        public int hashCode() {
            return System.identityHashCode(this);
        }
    }

    /**
     * The ignored pattern.
     */
    final class Wildcard implements Expr {
        static final Wildcard INSTANCE = new Wildcard();

        private Wildcard() {}

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitWildcard(this);
        }

        public String toString() {
            return "_";
        }
    }

    /**
     * A function reference qualified by its module, such as {@code Maybe.bind}.
     */
    final class Qualified implements Expr {
        public final String module;
        public final String name;

        Qualified(String module, String name) {
            this.module = requireNonNull(module);
            this.name = requireNonNull(name);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitQualified(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Qualified))
                return false;
            Qualified other = (Qualified)obj;
            return module.equals(other.module) && name.equals(other.name);
        }

        public int hashCode() {
            return Objects.hash(module, name);
        }

        public String toString() {
            return show();
        }
    }

    final class Call implements Expr {
        public final Expr target;
        public final ImmutableList<Expr> args;

        Call(Expr target, ImmutableList<Expr> args) {
            this.target = requireNonNull(target);
            this.args = args;
        }

        /**
         * Returns a copy of this call with the given argument inserted
         * in front of the existing arguments.
         */
        public Call prepend(Expr arg) {
            return new Call(target, ImmutableList.<Expr>builder().add(arg).addAll(args).build());
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Call))
                return false;
            Call other = (Call)obj;
            return target.equals(other.target) && args.equals(other.args);
        }

        public int hashCode() {
            return Objects.hash(target, args);
        }

        public String toString() {
            return show();
        }
    }

    final class Lambda implements Expr {
        public final ImmutableList<Expr> params;
        public final Expr body;

        Lambda(ImmutableList<Expr> params, Expr body) {
            this.params = params;
            this.body = requireNonNull(body);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLambda(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Lambda))
                return false;
            Lambda other = (Lambda)obj;
            return params.equals(other.params) && body.equals(other.body);
        }

        public int hashCode() {
            return Objects.hash(params, body);
        }

        public String toString() {
            return show();
        }
    }

    /**
     * A sequence of expressions evaluated in order; the value of the
     * last one is the value of the block.
     */
    final class Block implements Expr {
        public final ImmutableList<Expr> body;

        Block(ImmutableList<Expr> body) {
            if (body.isEmpty())
                throw new IllegalArgumentException("empty block");
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBlock(this);
        }

        public boolean equals(Object obj) {
            return obj instanceof Block && body.equals(((Block)obj).body);
        }

        public int hashCode() {
            return body.hashCode();
        }

        public String toString() {
            return show();
        }
    }

    final class Assign implements Expr {
        public final Expr pattern;
        public final Expr value;

        Assign(Expr pattern, Expr value) {
            this.pattern = requireNonNull(pattern);
            this.value = requireNonNull(value);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssign(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Assign))
                return false;
            Assign other = (Assign)obj;
            return pattern.equals(other.pattern) && value.equals(other.value);
        }

        public int hashCode() {
            return Objects.hash(pattern, value);
        }

        public String toString() {
            return show();
        }
    }

    final class If implements Expr {
        public final Expr cond, then, otherwise;

        If(Expr cond, Expr then, Expr otherwise) {
            this.cond = requireNonNull(cond);
            this.then = requireNonNull(then);
            this.otherwise = requireNonNull(otherwise);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIf(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof If))
                return false;
            If other = (If)obj;
            return cond.equals(other.cond) && then.equals(other.then) && otherwise.equals(other.otherwise);
        }

        public int hashCode() {
            return Objects.hash(cond, then, otherwise);
        }

        public String toString() {
            return show();
        }
    }

    final class BinaryOp implements Expr {
        public final String op;
        public final Expr left, right;

        BinaryOp(String op, Expr left, Expr right) {
            this.op = requireNonNull(op);
            this.left = requireNonNull(left);
            this.right = requireNonNull(right);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof BinaryOp))
                return false;
            BinaryOp other = (BinaryOp)obj;
            return op.equals(other.op) && left.equals(other.left) && right.equals(other.right);
        }

        public int hashCode() {
            return Objects.hash(op, left, right);
        }

        public String toString() {
            return show();
        }
    }

    final class ListExpr implements Expr {
        public final ImmutableList<Expr> elements;

        ListExpr(ImmutableList<Expr> elements) {
            this.elements = elements;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitList(this);
        }

        public boolean equals(Object obj) {
            return obj instanceof ListExpr && elements.equals(((ListExpr)obj).elements);
        }

        public int hashCode() {
            return elements.hashCode();
        }

        public String toString() {
            return show();
        }
    }

    final class TupleExpr implements Expr {
        public final ImmutableList<Expr> elements;

        TupleExpr(ImmutableList<Expr> elements) {
            this.elements = elements;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }

        public boolean equals(Object obj) {
            return obj instanceof TupleExpr && elements.equals(((TupleExpr)obj).elements);
        }

        public int hashCode() {
            return 31 * elements.hashCode() + 1;
        }

        public String toString() {
            return show();
        }
    }

    /**
     * The {@code left |> right} operator. Chains are left-associative.
     */
    final class Pipe implements Expr {
        public final Expr left, right;

        Pipe(Expr left, Expr right) {
            this.left = requireNonNull(left);
            this.right = requireNonNull(right);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitPipe(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Pipe))
                return false;
            Pipe other = (Pipe)obj;
            return left.equals(other.left) && right.equals(other.right);
        }

        public int hashCode() {
            return Objects.hash(left, right);
        }

        public String toString() {
            return show();
        }
    }

    /**
     * A do-block that has not been expanded yet.
     */
    final class DoBlock implements Expr {
        public final Strategy strategy;
        public final ImmutableList<Stmt> stmts;

        DoBlock(Strategy strategy, ImmutableList<Stmt> stmts) {
            this.strategy = requireNonNull(strategy);
            this.stmts = stmts;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDoBlock(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof DoBlock))
                return false;
            DoBlock other = (DoBlock)obj;
            return strategy.equals(other.strategy) && stmts.equals(other.stmts);
        }

        public int hashCode() {
            return Objects.hash(strategy, stmts);
        }

        public String toString() {
            return show();
        }
    }
}
