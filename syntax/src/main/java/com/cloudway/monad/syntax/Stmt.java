/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

import com.cloudway.monad.syntax.Expr.Assign;
import static java.util.Objects.requireNonNull;

/**
 * Represents a statement of a do-block. A block is an ordered, non-empty
 * sequence of statements that must end with a {@link Tail} expression.
 */
public interface Stmt {
    /**
     * Returns a statement with all the expressions (but not the patterns)
     * transformed by the given function.
     */
    Stmt map(Function<? super Expr, ? extends Expr> f);

    /**
     * Returns the surface text of this statement.
     */
    default String show() {
        return Printer.show(this);
    }

    /**
     * {@code pattern <- action}
     */
    static Bind bind(Expr pattern, Expr action) {
        return new Bind(pattern, action);
    }

    /**
     * {@code let pattern = value}
     */
    static Let let(Expr pattern, Expr value) {
        return new Let(ImmutableList.of(Expr.assign(pattern, value)));
    }

    /**
     * {@code let { pattern = value; ... }}
     */
    static Let let(List<Assign> bindings) {
        return new Let(ImmutableList.copyOf(bindings));
    }

    static Plain plain(Expr action) {
        return new Plain(action);
    }

    static Tail tail(Expr expr) {
        return new Tail(expr);
    }

    final class Bind implements Stmt {
        public final Expr pattern;
        public final Expr action;

        Bind(Expr pattern, Expr action) {
            this.pattern = requireNonNull(pattern);
            this.action = requireNonNull(action);
        }

        @Override
        public Stmt map(Function<? super Expr, ? extends Expr> f) {
            return new Bind(pattern, f.apply(action));
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Bind))
                return false;
            Bind other = (Bind)obj;
            return pattern.equals(other.pattern) && action.equals(other.action);
        }

        public int hashCode() {
            return Objects.hash(pattern, action);
        }

        public String toString() {
            return show();
        }
    }

    final class Let implements Stmt {
        public final ImmutableList<Assign> bindings;

        Let(ImmutableList<Assign> bindings) {
            this.bindings = bindings;
        }

        @Override
        public Stmt map(Function<? super Expr, ? extends Expr> f) {
            ImmutableList.Builder<Assign> mapped = ImmutableList.builder();
            for (Assign b : bindings) {
                mapped.add(Expr.assign(b.pattern, f.apply(b.value)));
            }
            return new Let(mapped.build());
        }

        public boolean equals(Object obj) {
            return obj instanceof Let && bindings.equals(((Let)obj).bindings);
        }

        public int hashCode() {
            return bindings.hashCode();
        }

        public String toString() {
            return show();
        }
    }

    final class Plain implements Stmt {
        public final Expr action;

        Plain(Expr action) {
            this.action = requireNonNull(action);
        }

        @Override
        public Stmt map(Function<? super Expr, ? extends Expr> f) {
            return new Plain(f.apply(action));
        }

        public boolean equals(Object obj) {
            return obj instanceof Plain && action.equals(((Plain)obj).action);
        }

        public int hashCode() {
            return action.hashCode();
        }

        public String toString() {
            return show();
        }
    }

    final class Tail implements Stmt {
        public final Expr expr;

        Tail(Expr expr) {
            this.expr = requireNonNull(expr);
        }

        @Override
        public Stmt map(Function<? super Expr, ? extends Expr> f) {
            return new Tail(f.apply(expr));
        }

        public boolean equals(Object obj) {
            return obj instanceof Tail && expr.equals(((Tail)obj).expr);
        }

        public int hashCode() {
            return 31 * expr.hashCode() + 7;
        }

        public String toString() {
            return show();
        }
    }
}
