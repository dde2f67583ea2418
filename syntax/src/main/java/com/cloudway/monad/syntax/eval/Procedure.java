/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;

/**
 * A value that can be applied to arguments.
 */
@FunctionalInterface
public interface Procedure {
    Object apply(List<Object> args);

    default Object call(Object... args) {
        return apply(ImmutableList.copyOf(args));
    }

    static Procedure of(Supplier<?> f) {
        return args -> {
            checkArity(0, args);
            return f.get();
        };
    }

    static Procedure of(Function<Object, ?> f) {
        return args -> {
            checkArity(1, args);
            return f.apply(args.get(0));
        };
    }

    static Procedure of(BiFunction<Object, Object, ?> f) {
        return args -> {
            checkArity(2, args);
            return f.apply(args.get(0), args.get(1));
        };
    }

    static Procedure of(TriFunction f) {
        return args -> {
            checkArity(3, args);
            return f.apply(args.get(0), args.get(1), args.get(2));
        };
    }

    @FunctionalInterface
    interface TriFunction {
        Object apply(Object a, Object b, Object c);
    }

    static void checkArity(int expected, List<Object> args) {
        if (args.size() != expected) {
            throw new EvalError.NumArgs(expected, args.size());
        }
    }

    /**
     * Cast the given value to a procedure.
     *
     * @throws EvalError.NotAFunction if the value is not a procedure
     */
    static Procedure from(Object value) {
        if (value instanceof Procedure) {
            return (Procedure)value;
        }
        throw new EvalError.NotAFunction(value);
    }
}
