/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.control;

import java.util.function.Function;
import java.util.function.Supplier;

import com.cloudway.monad.$;
import com.cloudway.monad.data.Monoid;
import com.cloudway.monad.data.Tuple;
import com.cloudway.monad.data.Unit;

import static java.util.Objects.requireNonNull;

/**
 * The writer monad, saving output values "under the hood".
 *
 * <p>A writer strategy is created for a given output type from a
 * {@link Monoid}: the monoid's identity is the initial output and its
 * associative operation combines the output of two steps.
 *
 * <p>The writer is lazy. A writer value holds a deferred computation and
 * does no work until it is {@link #run() run}.
 *
 * <pre>{@code
 * Writer.µ<List<Integer>> w = Writer.on(Monoid.list());
 * Writer<List<Integer>, Integer> m =
 *     w.tell(ImmutableList.of(1)).then(() ->
 *     w.pure(2).bind(x ->
 *     w.tell(ImmutableList.of(2)).then(() ->
 *     w.pure(x))));
 * m.run(); // (2, [1, 2])
 * }</pre>
 *
 * @param <W> the type of the output
 * @param <A> the type of result of computation
 */
public final class Writer<W, A> implements $<Writer.µ<W>, A> {
    private final µ<W> tc;
    private final Supplier<Tuple<A, W>> thunk;

    private Writer(µ<W> tc, Supplier<Tuple<A, W>> thunk) {
        this.tc = tc;
        this.thunk = requireNonNull(thunk);
    }

    /**
     * Create a writer strategy that collects output with the given monoid.
     *
     * @param monoid the monoid used to combine outputs
     * @return the writer type class
     */
    public static <W> µ<W> on(Monoid<W> monoid) {
        return new µ<>(monoid);
    }

    /**
     * Force the deferred computation and return the result value paired
     * with the accumulated output.
     */
    public Tuple<A, W> run() {
        return thunk.get();
    }

    /**
     * Run the given writer computation.
     */
    public static <W, A> Tuple<A, W> run($<µ<W>, A> m) {
        return narrow(m).run();
    }

    /**
     * Transform the result value, keeping the output.
     */
    public <B> Writer<W, B> map(Function<? super A, ? extends B> f) {
        return new Writer<>(tc, () -> run().mapFirst(f));
    }

    /**
     * Feed the result value to the continuation and combine the output of
     * both steps.
     */
    public <B> Writer<W, B> bind(Function<? super A, ? extends $<µ<W>, B>> f) {
        return new Writer<>(tc, () -> {
            Tuple<A, W> t1 = run();
            Tuple<B, W> t2 = narrow(f.apply(t1.first())).run();
            return Tuple.of(t2.first(), tc.monoid.append(t1.second(), t2.second()));
        });
    }

    /**
     * Sequence with the next computation, discarding the intermediate value.
     */
    public <B> Writer<W, B> then(Supplier<? extends $<µ<W>, B>> next) {
        return bind(__ -> next.get());
    }

    // Type Class

    public static final class µ<W> implements Monad<µ<W>> {
        private final Monoid<W> monoid;

        private µ(Monoid<W> monoid) {
            this.monoid = requireNonNull(monoid);
        }

        /**
         * Returns the monoid used to combine outputs.
         */
        public Monoid<W> monoid() {
            return monoid;
        }

        @Override
        public <A> Writer<W, A> pure(A a) {
            return new Writer<>(this, () -> Tuple.of(a, monoid.empty()));
        }

        @Override
        public <A, B> Writer<W, B> map($<µ<W>, A> a, Function<? super A, ? extends B> f) {
            return narrow(a).map(f);
        }

        @Override
        public <A, B> Writer<W, B> bind($<µ<W>, A> a, Function<? super A, ? extends $<µ<W>, B>> k) {
            return narrow(a).bind(k);
        }

        /**
         * Construct a writer from a result value and an output.
         */
        public <A> Writer<W, A> writer(A a, W w) {
            return new Writer<>(this, () -> Tuple.of(a, w));
        }

        /**
         * Add a value to the output.
         */
        public Writer<W, Unit> tell(W w) {
            return writer(Unit.U, w);
        }
    }

    public static <W, A> Writer<W, A> narrow($<µ<W>, A> value) {
        return (Writer<W,A>)value;
    }

    @Override
    public µ<W> getTypeClass() {
        return tc;
    }
}
