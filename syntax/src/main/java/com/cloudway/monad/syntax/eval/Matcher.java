/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import java.util.List;

import com.cloudway.monad.data.Tuple;
import com.cloudway.monad.syntax.Expr;
import com.cloudway.monad.syntax.Expr.ListExpr;
import com.cloudway.monad.syntax.Expr.Literal;
import com.cloudway.monad.syntax.Expr.TupleExpr;
import com.cloudway.monad.syntax.Expr.Var;
import com.cloudway.monad.syntax.Expr.Wildcard;

/**
 * A structural pattern matcher. Variables bind, the wildcard ignores,
 * literals compare, tuples and lists destructure.
 */
final class Matcher {
    private Matcher() {}

    /**
     * Match a value against a pattern, binding variables in the given scope.
     *
     * @throws EvalError.PatternMismatch if the value does not match
     */
    static void match(Env env, Expr pattern, Object value) {
        if (!tryMatch(env, pattern, value)) {
            throw new EvalError.PatternMismatch(pattern, value);
        }
    }

    private static boolean tryMatch(Env env, Expr pattern, Object value) {
        if (pattern instanceof Wildcard) {
            return true;
        }

        if (pattern instanceof Var) {
            env.put((Var)pattern, value);
            return true;
        }

        if (pattern instanceof Literal) {
            return ((Literal)pattern).value.equals(value);
        }

        if (pattern instanceof TupleExpr) {
            List<Expr> elements = ((TupleExpr)pattern).elements;
            if (elements.size() != 2 || !(value instanceof Tuple))
                return false;
            Tuple<?,?> t = (Tuple<?,?>)value;
            return tryMatch(env, elements.get(0), t.first())
                && tryMatch(env, elements.get(1), t.second());
        }

        if (pattern instanceof ListExpr) {
            List<Expr> elements = ((ListExpr)pattern).elements;
            if (!(value instanceof List))
                return false;
            List<?> list = (List<?>)value;
            if (list.size() != elements.size())
                return false;
            for (int i = 0; i < list.size(); i++) {
                if (!tryMatch(env, elements.get(i), list.get(i)))
                    return false;
            }
            return true;
        }

        throw new EvalError.BadForm("invalid pattern", pattern);
    }
}
