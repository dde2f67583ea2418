/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

import com.cloudway.monad.$;
import com.cloudway.monad.control.Monad;

/**
 * The error monad. A {@code Result} is either an {@code Ok} value holding
 * the outcome of a successful computation, or an {@code Error} value holding
 * the reason of a failure. Binding an error returns it immediately without
 * running the continuation.
 *
 * @param <E> the type of the error reason
 * @param <A> the type of the successful value
 */
public abstract class Result<E, A> implements $<Result.µ<E>, A> {
    private final Object value;

    Result(Object value) {
        this.value = value;
    }

    private static final class Ok<E, A> extends Result<E, A> {
        Ok(A value) {
            super(value);
        }

        @Override
        public boolean isOk() {
            return true;
        }

        public String toString() {
            return "Ok(" + get() + ")";
        }
    }

    private static final class Error<E, A> extends Result<E, A> {
        Error(E reason) {
            super(reason);
        }

        @Override
        public boolean isOk() {
            return false;
        }

        public String toString() {
            return "Error(" + getError() + ")";
        }
    }

    /**
     * Construct a successful result.
     */
    public static <E, A> Result<E, A> ok(A value) {
        return new Ok<>(value);
    }

    /**
     * Construct a failed result.
     */
    public static <E, A> Result<E, A> error(E reason) {
        return new Error<>(reason);
    }

    /**
     * Signal failure, an alias of {@link #error(Object) error}.
     */
    public static <E, A> Result<E, A> fail(E reason) {
        return error(reason);
    }

    /**
     * Returns true if this is a successful result.
     */
    public abstract boolean isOk();

    /**
     * Returns true if this is a failed result.
     */
    public boolean isError() {
        return !isOk();
    }

    /**
     * Returns the successful value.
     *
     * @throws NoSuchElementException if this is a failed result
     */
    @SuppressWarnings("unchecked")
    public A get() {
        if (!isOk())
            throw new NoSuchElementException("Error(" + value + ")");
        return (A)value;
    }

    /**
     * Returns the failure reason.
     *
     * @throws NoSuchElementException if this is a successful result
     */
    @SuppressWarnings("unchecked")
    public E getError() {
        if (isOk())
            throw new NoSuchElementException("Ok(" + value + ")");
        return (E)value;
    }

    /**
     * Transform the successful value, leaving a failure untouched.
     */
    @SuppressWarnings("unchecked")
    public <B> Result<E, B> map(Function<? super A, ? extends B> f) {
        return isOk() ? ok(f.apply(get())) : (Result<E,B>)this;
    }

    /**
     * Feed the successful value to the continuation, leaving a failure
     * untouched.
     */
    @SuppressWarnings("unchecked")
    public <B> Result<E, B> flatMap(Function<? super A, ? extends $<µ<E>, B>> f) {
        return isOk() ? narrow(f.apply(get())) : (Result<E,B>)this;
    }

    /**
     * Returns the successful value, otherwise throw an exception created by
     * the given function from the failure reason.
     */
    public <X extends Throwable> A getOrThrow(Function<? super E, ? extends X> exceptionSupplier) throws X {
        if (isOk()) {
            return get();
        } else {
            throw exceptionSupplier.apply(getError());
        }
    }

    /**
     * Convert to an {@code Either} with the failure on the left.
     */
    public Either<E, A> toEither() {
        return isOk() ? Either.right(get()) : Either.left(getError());
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Result))
            return false;
        Result<?,?> other = (Result<?,?>)obj;
        return isOk() == other.isOk() && Objects.equals(value, other.value);
    }

    public int hashCode() {
        return 31 * Objects.hashCode(value) + (isOk() ? 1 : 2);
    }

    // Type Class

    public static final class µ<E> implements Monad<µ<E>> {
        private µ() {}

        @Override
        public <A> Result<E, A> pure(A a) {
            return ok(a);
        }

        @Override
        public <A, B> Result<E, B> map($<µ<E>, A> a, Function<? super A, ? extends B> f) {
            return narrow(a).map(f);
        }

        @Override
        public <A, B> Result<E, B> bind($<µ<E>, A> a, Function<? super A, ? extends $<µ<E>, B>> k) {
            return narrow(a).flatMap(k);
        }

        @Override
        @SuppressWarnings("unchecked")
        public <A> Result<E, A> fail(Object reason) {
            return error((E)reason);
        }
    }

    public static <E, A> Result<E, A> narrow($<µ<E>, A> value) {
        return (Result<E,A>)value;
    }

    private static final µ<?> _TCLASS = new µ<>();

    @SuppressWarnings("unchecked")
    public static <E> µ<E> tclass() {
        return (µ<E>)_TCLASS;
    }

    @Override
    public µ<E> getTypeClass() {
        return tclass();
    }
}
