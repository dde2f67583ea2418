/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.control;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.cloudway.monad.$;

/**
 * The {@code Monad} typeclass defines the basic operations of a computation
 * strategy: {@link #pure(Object) pure} (the {@code return} operation) lifts a
 * plain value into a computation, and {@link #bind bind} sequences a
 * computation with a continuation that receives its result and produces the
 * next computation.
 *
 * <p>Instances of {@code Monad} should satisfy the following laws:
 *
 * <pre>{@code
 * pure a >>= k = k a
 * m >>= pure = m
 * m >>= (\x -> k x >>= h) = (m >>= k) >>= h
 * }</pre>
 *
 * <p>The above laws imply:
 *
 * <pre>{@code
 * map f xs = xs >>= pure . f
 * (>>) = (*>)
 * }</pre>
 */
public interface Monad<M> extends Applicative<M> {
    /**
     * Sequentially compose two actions, passing any value produced by the
     * first as an argument to the second.
     *
     * <pre>{@code (>>=) :: m a -> (a -> m b) -> m b}</pre>
     */
    <A, B> $<M,B> bind($<M,A> m, Function<? super A, ? extends $<M,B>> k);

    /**
     * Sequentially compose two actions, discarding any value produced by the
     * first.
     *
     * <pre>{@code (>>) :: m a -> m b -> m b}</pre>
     */
    default <A, B> $<M,B> seqR($<M,A> a, $<M,B> b) {
        return bind(a, __ -> b);
    }

    /**
     * Sequentially compose two actions, discarding any value produced by the
     * first. The second action is not created until the first completes.
     */
    default <A, B> $<M,B> seqR($<M,A> a, Supplier<? extends $<M,B>> b) {
        return bind(a, __ -> b.get());
    }

    /**
     * Returns a container consisting of the results of applying the given
     * function to the elements of given container.
     */
    @Override
    default <A, B> $<M,B> map($<M,A> m, Function<? super A, ? extends B> f) {
        return bind(m, x -> pure(f.apply(x)));
    }

    /**
     * Sequential application.
     */
    @Override
    default <A, B> $<M,B> ap($<M, Function<? super A, ? extends B>> mf, $<M,A> v) {
        return bind(mf, f -> map(v, f));
    }

    /**
     * Signal failure with a reason. This operation is not part of the
     * mathematical definition of a monad. Strategies that carry a failure
     * case map the reason directly into it, bypassing {@code pure}; the
     * others reject it.
     *
     * @throws UnsupportedOperationException if the strategy has no failure case
     */
    default <A> $<M,A> fail(Object reason) {
        throw new UnsupportedOperationException(
            getClass().getName() + " cannot signal failure: " + reason);
    }

    /**
     * The join function is the conventional monad join operator. It is used
     * to remove one level of monadic structure, projecting its bound argument
     * into the outer level.
     */
    default <A> $<M, A> join($<M, ? extends $<M, A>> x) {
        return bind(x, y -> y);
    }

    /**
     * Promote a function to a monad.
     *
     * <pre>{@code liftM :: Monad m => (a -> b) -> m a -> m b}</pre>
     */
    default <A, B> Function<$<M,A>, $<M,B>> liftM(Function<? super A, ? extends B> f) {
        return m -> map(m, f);
    }

    /**
     * Promote a function to a monad and apply it immediately, scanning the
     * monadic arguments from left to right.
     *
     * <pre>{@code liftM2 :: Monad m => (a -> b -> c) -> m a -> m b -> m c}</pre>
     */
    default <A, B, C> $<M,C>
    liftM2(BiFunction<? super A, ? super B, ? extends C> f, $<M,A> m1, $<M,B> m2) {
        return bind(m1, x1 -> map(m2, x2 -> f.apply(x1, x2)));
    }

    /**
     * Kleisli composition of monads.
     */
    default <A, B, C> Function<A, $<M, C>>
    compose(Function<? super A, ? extends $<M, B>> f, Function<? super B, ? extends $<M, C>> g) {
        return x -> bind(f.apply(x), g);
    }
}
