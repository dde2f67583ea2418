/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.control;

import java.util.function.Function;

import com.cloudway.monad.$;

import static java.util.Objects.requireNonNull;

/**
 * The reader monad, passing a read-only environment "under the hood" to
 * every step of a computation.
 *
 * @param <R> the type of the environment
 * @param <A> the type of result of computation
 */
public final class Reader<R, A> implements $<Reader.µ<R>, A> {
    private final Function<? super R, ? extends A> rf;

    private Reader(Function<? super R, ? extends A> rf) {
        this.rf = requireNonNull(rf);
    }

    /**
     * Create a reader from the given function of the environment.
     */
    public static <R, A> Reader<R, A> reader(Function<? super R, ? extends A> f) {
        return new Reader<>(f);
    }

    /**
     * Constructs a computation that ignores the environment and results
     * in the given value.
     */
    public static <R, A> Reader<R, A> pure(A a) {
        return new Reader<>(r -> a);
    }

    /**
     * Run the reader by supplying the given environment to it.
     */
    public A run(R r) {
        return rf.apply(r);
    }

    /**
     * Run the given reader by supplying the environment to it.
     */
    public static <R, A> A run(R r, $<µ<R>, A> m) {
        return narrow(m).run(r);
    }

    /**
     * Retrieves the environment.
     */
    public static <R> Reader<R, R> ask() {
        return new Reader<>(r -> r);
    }

    /**
     * Retrieves a function of the current environment.
     */
    public static <R, A> Reader<R, A> asks(Function<? super R, ? extends A> f) {
        return new Reader<>(f);
    }

    /**
     * Executes a computation in a modified environment.
     *
     * @param m the computation to run in the modified environment
     * @param f the function to modify the environment
     */
    public static <R, A> Reader<R, A> local($<µ<R>, A> m, Function<? super R, ? extends R> f) {
        Reader<R, A> r = narrow(m);
        return new Reader<>(e -> r.run(f.apply(e)));
    }

    /**
     * Transform the value returned by this reader.
     */
    public <B> Reader<R, B> map(Function<? super A, ? extends B> f) {
        return new Reader<>(r -> f.apply(run(r)));
    }

    /**
     * Feed the value of this reader to the continuation and run the resulting
     * reader with the same environment.
     */
    public <B> Reader<R, B> bind(Function<? super A, ? extends $<µ<R>, B>> f) {
        return new Reader<>(r -> narrow(f.apply(run(r))).run(r));
    }

    // Type Class

    public static final class µ<R> implements Monad<µ<R>> {
        private µ() {}

        @Override
        public <A> Reader<R, A> pure(A a) {
            return Reader.pure(a);
        }

        @Override
        public <A, B> Reader<R, B> map($<µ<R>, A> a, Function<? super A, ? extends B> f) {
            return narrow(a).map(f);
        }

        @Override
        public <A, B> Reader<R, B> bind($<µ<R>, A> a, Function<? super A, ? extends $<µ<R>, B>> k) {
            return narrow(a).bind(k);
        }

        public Reader<R, R> ask() {
            return Reader.ask();
        }

        public <A> Reader<R, A> local($<µ<R>, A> m, Function<? super R, ? extends R> f) {
            return Reader.local(m, f);
        }
    }

    public static <R, A> Reader<R, A> narrow($<µ<R>, A> value) {
        return (Reader<R,A>)value;
    }

    private static final µ<?> _TCLASS = new µ<>();

    @SuppressWarnings("unchecked")
    public static <R> µ<R> tclass() {
        return (µ<R>)_TCLASS;
    }

    @Override
    public µ<R> getTypeClass() {
        return tclass();
    }
}
