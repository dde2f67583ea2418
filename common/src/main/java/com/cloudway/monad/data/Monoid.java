/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.data;

import java.util.List;
import java.util.function.BinaryOperator;

import com.google.common.collect.ImmutableList;

import static java.util.Objects.requireNonNull;

/**
 * A class for monoids (types with an associative binary operation that has
 * an identity) with various general-purpose instances. Instances should satisfy
 * the following laws:
 *
 * <pre>{@code
 *      0 + x = x
 *      x + 0 = x
 *      x + (y + z) = (x + y) + z
 * }</pre>
 *
 * <p>Monoids supply the initial output and the combining operation of
 * a {@link com.cloudway.monad.control.Writer Writer} strategy.
 */
public abstract class Monoid<A> {
    /**
     * Returns the identity value for this monoid.
     *
     * @return the identity value for this monoid
     */
    public abstract A empty();

    /**
     * Appends the two given values.
     *
     * @param a1 the value on the left
     * @param a2 the value on the right
     * @return the concatenation of the two given values
     */
    public abstract A append(A a1, A a2);

    /**
     * Fold a sequence of values using the monoid.
     */
    public A concat(Iterable<A> xs) {
        A r = empty();
        for (A x : xs) {
            r = append(r, x);
        }
        return r;
    }

    /**
     * Construct a monoid from an identity value and an associative operation.
     */
    public static <A> Monoid<A> monoid(A empty, BinaryOperator<A> append) {
        requireNonNull(append);
        return new Monoid<A>() {
            @Override
            public A empty() {
                return empty;
            }

            @Override
            public A append(A a1, A a2) {
                return append.apply(a1, a2);
            }
        };
    }

    private static final Monoid<List<Object>> LIST = monoid(ImmutableList.of(), (xs, ys) ->
        xs.isEmpty() ? ys :
        ys.isEmpty() ? xs :
        ImmutableList.builder().addAll(xs).addAll(ys).build());

    /**
     * The list monoid, concatenates lists in order.
     */
    @SuppressWarnings("unchecked")
    public static <A> Monoid<List<A>> list() {
        return (Monoid<List<A>>)(Monoid<?>)LIST;
    }

    /**
     * The string monoid, concatenates strings in order.
     */
    public static final Monoid<String> string = monoid("", String::concat);

    /**
     * The integer addition monoid.
     */
    public static final Monoid<Integer> intAdd = monoid(0, Integer::sum);

    /**
     * The long addition monoid.
     */
    public static final Monoid<Long> longAdd = monoid(0L, Long::sum);
}
