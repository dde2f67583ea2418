/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.control;

import java.util.function.Function;

import com.cloudway.monad.$;
import com.cloudway.monad.data.Unit;

/**
 * An {@code Applicative} describes a structure intermediate between a functor
 * and a monad.
 *
 * <p><strong>identity</strong>
 * <pre>{@code pure id <*> v = v}</pre>
 *
 * <p><strong>homomorphism</strong>
 * <pre>{@code pure f <*> pure x = pure (f x)}</pre>
 *
 * <p>If {@code f} is also a Monad, it should satisfy
 * <pre>{@code
 * pure = return
 * (<*>) = ap
 * }</pre>
 */
public interface Applicative<F> extends Functor<F> {
    /**
     * Lift a value. This is the {@code return} operation of a computation
     * strategy.
     *
     * <pre>{@code pure :: a -> f a}</pre>
     */
    <A> $<F,A> pure(A a);

    /**
     * Returns a do nothing action.
     */
    default $<F, Unit> unit() {
        return pure(Unit.U);
    }

    /**
     * Sequential application.
     *
     * <pre>{@code (<*>) :: f (a -> b) -> f a -> f b}</pre>
     */
    <A, B> $<F,B> ap($<F, Function<? super A, ? extends B>> fs, $<F,A> a);
}
