/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.control;

import java.util.function.Function;
import java.util.function.Supplier;

import com.cloudway.monad.$;
import com.cloudway.monad.data.Tuple;
import com.cloudway.monad.data.Unit;

import static java.util.Objects.requireNonNull;

/**
 * The state monad, passing an updatable state through a computation.
 * Computations of this kind are state transformers, i.e. functions that map
 * an initial state to a result value paired with a final state.
 *
 * @param <S> the type of state passing to the computation
 * @param <A> the type of result of computation
 */
public final class State<S, A> implements $<State.µ<S>, A> {
    private final Function<? super S, Tuple<A, S>> sf;

    private State(Function<? super S, Tuple<A, S>> sf) {
        this.sf = requireNonNull(sf);
    }

    /**
     * Create a state monad from the given state transfer function.
     *
     * @param f the state transfer function
     * @return the state monad
     */
    public static <S, A> State<S, A> state(Function<? super S, Tuple<A, S>> f) {
        return new State<>(f);
    }

    /**
     * Constructs a pure computation that results in the given value.
     *
     * @param a the final result
     * @return the state monad that hold the final result
     */
    public static <S, A> State<S, A> pure(A a) {
        return new State<>(s -> Tuple.of(a, s));
    }

    /**
     * Evaluate a state computation with the given initial state and return
     * a tuple of final value and final state.
     *
     * @param s the initial state
     * @return the tuple of final value and final state
     */
    public Tuple<A, S> run(S s) {
        return sf.apply(s);
    }

    /**
     * Run the given state computation with the initial state.
     *
     * @param s the initial state
     * @param m the state computation
     * @return the tuple of final value and final state
     */
    public static <S, A> Tuple<A, S> run(S s, $<µ<S>, A> m) {
        return narrow(m).run(s);
    }

    /**
     * Evaluate a state computation with the given initial state and return
     * the final value, discarding the final state.
     */
    public A eval(S s) {
        return run(s).first();
    }

    /**
     * Evaluate a state computation with the given initial state and return
     * the final state, discarding the final value.
     */
    public S exec(S s) {
        return run(s).second();
    }

    /**
     * Transfer a state computation by feeding the value to the given function
     * and wrapping the result to new state.
     */
    public <B> State<S, B> map(Function<? super A, ? extends B> f) {
        return new State<>(s -> run(s).mapFirst(f));
    }

    /**
     * Transfer a state computation by feeding the value to the given function.
     */
    public <B> State<S, B> bind(Function<? super A, ? extends $<µ<S>, B>> f) {
        return new State<>(s -> {
            Tuple<A, S> t = run(s);
            return narrow(f.apply(t.first())).run(t.second());
        });
    }

    /**
     * Transfer a state computation by discarding the intermediate value.
     */
    public <B> State<S, B> then(Supplier<? extends $<µ<S>, B>> next) {
        return bind(__ -> next.get());
    }

    /**
     * Transfer a state computation by discarding the intermediate value.
     */
    public <B> State<S, B> then($<µ<S>, B> next) {
        return bind(__ -> next);
    }

    /**
     * Fetch the current value of the state within the monad.
     */
    public static <S> State<S, S> get() {
        return new State<>(s -> Tuple.of(s, s));
    }

    /**
     * Sets the state within the monad.
     */
    public static <S> State<S, Unit> put(S s) {
        return new State<>(__ -> Tuple.of(Unit.U, s));
    }

    /**
     * Updates the state to the result of applying a function to the current state.
     */
    public static <S> State<S, Unit> modify(Function<? super S, ? extends S> f) {
        return new State<>(s -> Tuple.of(Unit.U, f.apply(s)));
    }

    /**
     * Get a specific component of the state, using a projection function supplied.
     */
    public static <S, A> State<S, A> gets(Function<? super S, ? extends A> f) {
        return new State<>(s -> Tuple.of(f.apply(s), s));
    }

    // Type Class

    public static final class µ<S> implements Monad<µ<S>> {
        private µ() {}

        @Override
        public <A> State<S, A> pure(A a) {
            return State.pure(a);
        }

        @Override
        public <A, B> State<S, B> map($<µ<S>, A> a, Function<? super A, ? extends B> f) {
            return narrow(a).map(f);
        }

        @Override
        public <A, B> State<S, B> bind($<µ<S>, A> a, Function<? super A, ? extends $<µ<S>, B>> k) {
            return narrow(a).bind(k);
        }

        public State<S, S> get() {
            return State.get();
        }

        public State<S, Unit> put(S s) {
            return State.put(s);
        }

        public State<S, Unit> modify(Function<? super S, ? extends S> f) {
            return State.modify(f);
        }
    }

    public static <S, A> State<S, A> narrow($<µ<S>, A> value) {
        return (State<S,A>)value;
    }

    private static final µ<?> _TCLASS = new µ<>();

    @SuppressWarnings("unchecked")
    public static <S> µ<S> tclass() {
        return (µ<S>)_TCLASS;
    }

    @Override
    public µ<S> getTypeClass() {
        return tclass();
    }
}
