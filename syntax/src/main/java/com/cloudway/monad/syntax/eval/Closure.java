/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import java.util.List;

import com.cloudway.monad.syntax.Expr;
import com.cloudway.monad.syntax.Expr.Lambda;

/**
 * A lambda expression captured together with its defining scope.
 */
final class Closure implements Procedure {
    private final Lambda lambda;
    private final Env env;
    private final Evaluator evaluator;

    Closure(Lambda lambda, Env env, Evaluator evaluator) {
        this.lambda = lambda;
        this.env = env;
        this.evaluator = evaluator;
    }

    @Override
    public Object apply(List<Object> args) {
        List<Expr> params = lambda.params;
        Procedure.checkArity(params.size(), args);

        Env scope = env.extend();
        for (int i = 0; i < params.size(); i++) {
            Matcher.match(scope, params.get(i), args.get(i));
        }
        return evaluator.eval(scope, lambda.body);
    }

    public String toString() {
        return "#<procedure:" + lambda.show() + ">";
    }
}
