/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.control;

import java.util.function.Function;
import java.util.function.Supplier;

import com.cloudway.monad.$;
import com.cloudway.monad.data.Unit;

/**
 * This class contains keywords for writing do-blocks directly in Java.
 * Each helper finds the strategy of its first computation through
 * {@link $#getTypeClass()} and simply calls '>>=' or '>>' on it, so a
 * nested chain of {@code do_} calls reads like the desugared form of a
 * do-block:
 *
 * <pre>{@code
 * do_(Maybe.of(2), x ->
 * do_(Maybe.of(4), y ->
 * Maybe.of(x * y)))
 * }</pre>
 */
public final class Syntax {
    private Syntax() {}

    /**
     * Introduce a local variable.
     */
    public static <T, R> R let(T t, Function<? super T, ? extends R> f) {
        return f.apply(t);
    }

    /**
     * Helper method to chain monad actions together.
     */
    public static <M extends Monad<M>, A, B>
    $<M, B> do_($<M, A> m, Function<? super A, ? extends $<M, B>> k) {
        return m.getTypeClass().bind(m, k);
    }

    /**
     * Helper method to chain monad actions together, discard intermediate result.
     */
    public static <M extends Monad<M>, A, B>
    $<M, B> do_($<M, A> a, Supplier<? extends $<M, B>> b) {
        return a.getTypeClass().seqR(a, b);
    }

    /**
     * Helper method to wrap an action.
     */
    public static <A> A do_(A a) {
        return a;
    }

    /**
     * Conditional execution of monad action.
     */
    public static <M extends Monad<M>>
    $<M, Unit> when(boolean test, $<M, Unit> then) {
        return test ? then : then.getTypeClass().pure(Unit.U);
    }

    /**
     * The reverse of when.
     */
    public static <M extends Monad<M>>
    $<M, Unit> unless(boolean test, $<M, Unit> orElse) {
        return test ? orElse.getTypeClass().pure(Unit.U) : orElse;
    }
}
