/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import com.cloudway.monad.$;
import com.cloudway.monad.control.Monad;
import com.cloudway.monad.data.Maybe;
import static java.util.Objects.requireNonNull;

/**
 * Binds a strategy name to its monad type class and the operations it
 * exports to evaluated code. Every module exports {@code return},
 * {@code bind} and {@code fail}.
 */
public final class StrategyModule {
    private final String name;
    private final Monad<?> typeClass;
    private final ImmutableMap<String, Procedure> exports;

    private StrategyModule(String name, Monad<?> typeClass, ImmutableMap<String, Procedure> exports) {
        this.name = name;
        this.typeClass = typeClass;
        this.exports = exports;
    }

    public String name() {
        return name;
    }

    public Monad<?> typeClass() {
        return typeClass;
    }

    public ImmutableMap<String, Procedure> exports() {
        return exports;
    }

    public Maybe<Procedure> lookup(String op) {
        return Maybe.ofNullable(exports.get(op));
    }

    /**
     * Cast an evaluated value to a computation of the given type class.
     *
     * @throws EvalError.TypeMismatch if the value is not a computation of
     * the type class
     */
    @SuppressWarnings("unchecked")
    public static <T, A> $<T, A> narrow(Monad<?> typeClass, Object value) {
        if (value instanceof $ && (($<?,?>)value).getTypeClass() == typeClass) {
            return ($<T, A>)value;
        }
        throw new EvalError.TypeMismatch(typeClass.getClass().getName(), value);
    }

    public static <M> Builder builder(String name, Monad<M> tc) {
        return new Builder(name, tc)
            .export("return", Procedure.of(x -> tc.pure(x)))
            .export("bind", Procedure.of((m, k) -> {
                Procedure f = Procedure.from(k);
                return tc.bind(StrategyModule.<M, Object>narrow(tc, m),
                               x -> StrategyModule.<M, Object>narrow(tc, f.call(x)));
            }))
            .export("fail", Procedure.of(reason -> tc.fail(reason)));
    }

    public static final class Builder {
        private final String name;
        private final Monad<?> typeClass;
        private final ImmutableMap.Builder<String, Procedure> exports = ImmutableMap.builder();

        Builder(String name, Monad<?> typeClass) {
            this.name = requireNonNull(name);
            this.typeClass = requireNonNull(typeClass);
        }

        public Builder export(String op, Procedure proc) {
            exports.put(op, proc);
            return this;
        }

        public StrategyModule build() {
            return new StrategyModule(name, typeClass, exports.build());
        }
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("exports", exports.keySet())
            .toString();
    }
}
