/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.data;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;

import com.cloudway.monad.$;
import com.cloudway.monad.control.Monad;

/**
 * A container object which may or may not contain a non-null value.
 * If a value is present, {@code isPresent()} will return {@code true} and
 * {@code get()} will return the value.
 *
 * <p>As a computation strategy an absent value short-circuits: binding it
 * skips the continuation and propagates the absent value unchanged.
 *
 * @param <A> the type of the value
 */
public final class Maybe<A> implements $<Maybe.µ, A> {
    /**
     * Common instance for {@code empty()}.
     */
    private static final Maybe<?> EMPTY = new Maybe<>();

    /**
     * If non-null, the value; if null, indicates no value is present
     */
    private final A value;

    /**
     * Constructs an empty instance.
     */
    private Maybe() {
        this.value = null;
    }

    /**
     * Construct an instance with the value present.
     *
     * @param value the non-null value to be present
     * @throws NullPointerException if value is null
     */
    private Maybe(A value) {
        this.value = Objects.requireNonNull(value);
    }

    /**
     * Returns an empty {@code Maybe} instance.  No value is present for this
     * Maybe.
     *
     * @param <A> type of the non-existent value
     * @return an empty {@code Maybe}
     */
    public static <A> Maybe<A> empty() {
        @SuppressWarnings("unchecked")
        Maybe<A> t = (Maybe<A>)EMPTY;
        return t;
    }

    /**
     * Returns a {@code Maybe} with the specified present non-null value.
     *
     * @param <A> the class of the value
     * @param value the value to be present, which must be non-null
     * @return a {@code Maybe} with the value present
     * @throws NullPointerException if value is null
     */
    public static <A> Maybe<A> of(A value) {
        return new Maybe<>(value);
    }

    /**
     * Returns an {@code Maybe} describing the specified value, if non-null,
     * otherwise returns an empty {@code Maybe}.
     */
    public static <A> Maybe<A> ofNullable(A value) {
        return value == null ? empty() : of(value);
    }

    /**
     * Signal failure. The reason is discarded.
     */
    public static <A> Maybe<A> fail(Object reason) {
        return empty();
    }

    /**
     * Convert a {@code java.util.Optional} to {@code Maybe}.
     */
    public static <A> Maybe<A> fromOptional(Optional<A> optional) {
        return optional.isPresent() ? of(optional.get()) : empty();
    }

    /**
     * Convert this {@code Maybe} to {@code java.util.Optional}.
     */
    public Optional<A> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * If a value is present in this {@code Maybe}, returns the value
     * otherwise throws {@code NoSuchElementException}.
     *
     * @return the non-null value held by this {@code Maybe}
     * @throws NoSuchElementException if there is no value present
     */
    public A get() {
        if (value == null) {
            throw new NoSuchElementException("No value present");
        }
        return value;
    }

    /**
     * Returns {@code true} if there is a value present, otherwise {@code false}.
     */
    public boolean isPresent() {
        return value != null;
    }

    /**
     * Returns {@code true} if this {@code Maybe} is empty, otherwise {@code false}.
     */
    public boolean isAbsent() {
        return value == null;
    }

    /**
     * If a value is present, invoke the specified consumer with the value,
     * otherwise do nothing.
     */
    public void ifPresent(Consumer<? super A> consumer) {
        if (value != null) {
            consumer.accept(value);
        }
    }

    /**
     * If a value is present, and the value matches the given predicate,
     * return an {@code Maybe} describing the value, otherwise return an
     * empty {@code Maybe}.
     */
    public Maybe<A> filter(Predicate<? super A> predicate) {
        return isPresent() && predicate.test(value) ? this : empty();
    }

    /**
     * If a value is present, apply the provided mapping function to it,
     * and if the result is non-null, return an {@code Maybe} describing the
     * result. Otherwise return an empty {@code Maybe}.
     */
    public <B> Maybe<B> map(Function<? super A, ? extends B> mapper) {
        return isPresent() ? ofNullable(mapper.apply(value)) : empty();
    }

    /**
     * If a value is present, apply the provided {@code Maybe}-bearing
     * mapping function to it, return that result, otherwise return an empty
     * {@code Maybe}.
     */
    public <B> Maybe<B> flatMap(Function<? super A, ? extends $<µ, B>> mapper) {
        return isPresent() ? narrow(mapper.apply(value)) : empty();
    }

    /**
     * Return the value if present, otherwise return {@code other}.
     */
    public A orElse(A other) {
        return value != null ? value : other;
    }

    /**
     * Return the value if present, otherwise invoke {@code other} and return
     * the result of that invocation.
     */
    public A orElseGet(Supplier<? extends A> other) {
        return value != null ? value : other.get();
    }

    /**
     * Apply the function to the value if present, otherwise return the
     * default value.
     */
    public <B> B maybe(B deflt, Function<? super A, ? extends B> f) {
        return value != null ? f.apply(value) : deflt;
    }

    /**
     * Returns a singleton list holding the value if present, otherwise
     * an empty list.
     */
    public List<A> toList() {
        return value != null ? ImmutableList.of(value) : ImmutableList.of();
    }

    /**
     * Returns the first element of the list, or an empty {@code Maybe} if
     * the list is empty.
     */
    public static <A> Maybe<A> fromList(List<? extends A> list) {
        return list.isEmpty() ? empty() : of(list.get(0));
    }

    /**
     * Takes a sequence of {@code Maybe}s and returns a list of all present
     * values.
     */
    public static <A> List<A> catMaybes(Iterable<? extends Maybe<? extends A>> ms) {
        ImmutableList.Builder<A> res = ImmutableList.builder();
        for (Maybe<? extends A> m : ms) {
            if (m.isPresent())
                res.add(m.get());
        }
        return res.build();
    }

    /**
     * Apply the function to each element, keeping the present results.
     */
    public static <A, B> List<B> mapMaybe(Iterable<? extends A> xs, Function<? super A, ? extends Maybe<? extends B>> f) {
        ImmutableList.Builder<B> res = ImmutableList.builder();
        for (A x : xs) {
            Maybe<? extends B> m = f.apply(x);
            if (m.isPresent())
                res.add(m.get());
        }
        return res.build();
    }

    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Maybe))
            return false;
        return Objects.equals(value, ((Maybe<?>)obj).value);
    }

    public int hashCode() {
        return Objects.hashCode(value);
    }

    public String toString() {
        return value != null ? "Just(" + value + ")" : "Nothing";
    }

    // Type Class

    public static final class µ implements Monad<µ> {
        private µ() {}

        @Override
        public <A> Maybe<A> pure(A a) {
            return of(a);
        }

        @Override
        public <A, B> Maybe<B> map($<µ, A> a, Function<? super A, ? extends B> f) {
            return narrow(a).map(f);
        }

        @Override
        public <A, B> Maybe<B> bind($<µ, A> a, Function<? super A, ? extends $<µ, B>> k) {
            return narrow(a).flatMap(k);
        }

        @Override
        public <A> Maybe<A> fail(Object reason) {
            return Maybe.fail(reason);
        }
    }

    public static <A> Maybe<A> narrow($<µ, A> value) {
        return (Maybe<A>)value;
    }

    public static final µ tclass = new µ();

    @Override
    public µ getTypeClass() {
        return tclass;
    }
}
