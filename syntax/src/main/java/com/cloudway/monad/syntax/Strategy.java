/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

import com.cloudway.monad.syntax.Expr.Call;
import com.cloudway.monad.syntax.Expr.GenSym;
import com.cloudway.monad.syntax.Expr.Qualified;
import static java.util.Objects.requireNonNull;
import static com.cloudway.monad.syntax.Expr.*;

/**
 * The syntactic side of a computation strategy. A strategy names the
 * module that implements the monad operations and produces the qualified
 * calls that expanded code uses to reach them.
 */
public final class Strategy {
    /**
     * Produces the syntax that threads the result of a pipeline stage
     * into the next stage.
     */
    @FunctionalInterface
    public interface PipeBinder {
        /**
         * @param strategy the active strategy
         * @param acc the pipeline expanded so far
         * @param stage the next stage, a call missing its first argument
         */
        Expr pipebind(Strategy strategy, Expr acc, Call stage);
    }

    private final String name;
    private final PipeBinder pipeBinder;

    private Strategy(String name, PipeBinder pipeBinder) {
        this.name = requireNonNull(name);
        this.pipeBinder = pipeBinder;
    }

    public static Strategy of(String name) {
        return new Strategy(name, null);
    }

    public static Strategy of(String name, PipeBinder pipeBinder) {
        return new Strategy(name, requireNonNull(pipeBinder));
    }

    public String name() {
        return name;
    }

    /**
     * Returns the qualified reference to the named operation of this strategy.
     */
    public Qualified ref(String operation) {
        return qualified(name, operation);
    }

    /**
     * {@code S.return}
     */
    public Qualified returnRef() {
        return ref("return");
    }

    /**
     * {@code S.return(value)}
     */
    public Expr pure(Expr value) {
        return call(returnRef(), value);
    }

    /**
     * {@code S.bind(action, fn pattern -> body end)}
     */
    public Expr bind(Expr action, Expr pattern, Expr body) {
        return call(ref("bind"), action, lambda(pattern, body));
    }

    /**
     * Thread the result of {@code acc} into {@code stage} as its first
     * argument. Unless a custom binder is supplied this is
     * {@code S.bind(acc, fn v -> stage(v, args...) end)} where {@code v}
     * is a fresh {@link GenSym}.
     */
    public Expr pipebind(Expr acc, Call stage) {
        if (pipeBinder != null) {
            return pipeBinder.pipebind(this, acc, stage);
        }
        GenSym v = GenSym.fresh();
        return bind(acc, v, stage.prepend(v));
    }

    public boolean equals(Object obj) {
        return obj instanceof Strategy && name.equals(((Strategy)obj).name);
    }

    public int hashCode() {
        return name.hashCode();
    }

    public String toString() {
        return name;
    }
}
