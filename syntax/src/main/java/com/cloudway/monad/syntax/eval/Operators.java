/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import java.util.List;

import com.google.common.collect.ImmutableList;

import com.cloudway.monad.syntax.Expr.BinaryOp;

/**
 * Strict binary operators. Integer arithmetic stays in {@code int} when
 * both operands are integers and widens to {@code long} or {@code double}
 * otherwise.
 */
final class Operators {
    private Operators() {}

    static Object apply(BinaryOp e, Object x, Object y) {
        switch (e.op) {
        case "==":
            return x.equals(y);
        case "!=":
            return !x.equals(y);
        case "++":
            return concat(x, y);
        case "+": case "-": case "*": case "/": case "%":
            return arith(e.op, number(x), number(y));
        case "<":
            return compare(x, y) < 0;
        case "<=":
            return compare(x, y) <= 0;
        case ">":
            return compare(x, y) > 0;
        case ">=":
            return compare(x, y) >= 0;
        default:
            throw new EvalError.BadForm("unknown operator " + e.op, e);
        }
    }

    private static Number number(Object value) {
        if (value instanceof Number)
            return (Number)value;
        throw new EvalError.TypeMismatch("number", value);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static Object arith(String op, Number x, Number y) {
        if (isIntegral(x) && isIntegral(y)) {
            long a = x.longValue(), b = y.longValue();
            if ((op.equals("/") || op.equals("%")) && b == 0)
                throw new EvalError("division by zero");
            long r;
            switch (op) {
            case "+": r = a + b; break;
            case "-": r = a - b; break;
            case "*": r = a * b; break;
            case "/": r = a / b; break;
            default:  r = a % b; break;
            }
            if (x instanceof Long || y instanceof Long || r != (int)r)
                return r;
            return (int)r;
        }

        double a = x.doubleValue(), b = y.doubleValue();
        switch (op) {
        case "+": return a + b;
        case "-": return a - b;
        case "*": return a * b;
        case "/": return a / b;
        default:  return a % b;
        }
    }

    @SuppressWarnings("unchecked")
    private static int compare(Object x, Object y) {
        if (x instanceof Number && y instanceof Number) {
            Number a = (Number)x, b = (Number)y;
            if (isIntegral(a) && isIntegral(b))
                return Long.compare(a.longValue(), b.longValue());
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (x instanceof Comparable && x.getClass() == y.getClass()) {
            return ((Comparable<Object>)x).compareTo(y);
        }
        throw new EvalError.TypeMismatch("comparable", y);
    }

    private static Object concat(Object x, Object y) {
        if (x instanceof String && y instanceof String) {
            return (String)x + y;
        }
        if (x instanceof List && y instanceof List) {
            return ImmutableList.builder().addAll((List<?>)x).addAll((List<?>)y).build();
        }
        throw new EvalError.TypeMismatch("string or list", y);
    }
}
