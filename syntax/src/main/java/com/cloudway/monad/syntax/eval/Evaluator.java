/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import com.cloudway.monad.Config;
import com.cloudway.monad.data.Either;
import com.cloudway.monad.data.Tuple;
import com.cloudway.monad.syntax.DoExpander;
import com.cloudway.monad.syntax.Expr;
import com.cloudway.monad.syntax.ExprVisitor;
import com.cloudway.monad.syntax.Expr.*;

/**
 * A reference evaluator for expression trees. It runs expanded do-blocks
 * against the strategy modules registered in the environment.
 */
public class Evaluator {
    private static final Logger logger = Logger.getLogger(Evaluator.class.getName());

    private final Env rootEnv;

    /**
     * Construct an evaluator with the standard strategy modules registered.
     */
    public Evaluator() {
        rootEnv = new Env();
        StrategyModules.registerAll(rootEnv);
    }

    public Env getRootEnv() {
        return rootEnv;
    }

    /**
     * Create a fresh top-level scope with the exports of the given
     * modules visible unqualified.
     */
    public Env newEnv(String... imports) {
        Env env = rootEnv.extend();
        for (String name : imports) {
            env.importModule(name);
        }
        return env;
    }

    public Either<EvalError, Object> evaluate(Expr expr) {
        return evaluate(rootEnv.extend(), expr);
    }

    /**
     * Evaluate the expression, returning any evaluation fault as a left value.
     */
    public Either<EvalError, Object> evaluate(Env env, Expr expr) {
        try {
            return Either.right(eval(env, expr));
        } catch (EvalError ex) {
            logger.log(Level.FINE, "Evaluation failed: " + expr.show(), ex);
            return Either.left(ex);
        }
    }

    /**
     * Evaluate the expression.
     *
     * @throws EvalError if evaluation fails
     */
    public Object eval(Env env, Expr expr) {
        return expr.accept(new Interp(env));
    }

    /**
     * Apply a procedure. Hard faults raised by strategy operations are
     * reported as evaluation errors.
     */
    public Object apply(Object proc, List<Object> args) {
        Procedure p = Procedure.from(proc);
        try {
            return p.apply(args);
        } catch (EvalError ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new EvalError(ex);
        }
    }

    private final class Interp implements ExprVisitor<Object> {
        private final Env env;

        Interp(Env env) {
            this.env = env;
        }

        private Object eval(Expr e) {
            return e.accept(this);
        }

        private List<Object> evalAll(List<Expr> exprs) {
            List<Object> result = new ArrayList<>(exprs.size());
            for (Expr e : exprs) {
                result.add(eval(e));
            }
            return result;
        }

        @Override
        public Object visitLiteral(Literal e) {
            return e.value;
        }

        @Override
        public Object visitVar(Var e) {
            return env.get(e);
        }

        @Override
        public Object visitWildcard(Wildcard e) {
            throw new EvalError.BadForm("'_' is only allowed in patterns", e);
        }

        @Override
        public Object visitQualified(Qualified e) {
            return env.getModule(e.module).lookup(e.name).orElseGet(() -> {
                throw new EvalError.Unbound(e.show());
            });
        }

        @Override
        public Object visitCall(Call e) {
            Object proc = eval(e.target);
            return apply(proc, evalAll(e.args));
        }

        @Override
        public Object visitLambda(Lambda e) {
            return new Closure(e, env, Evaluator.this);
        }

        @Override
        public Object visitBlock(Block e) {
            Object result = null;
            for (Expr x : e.body) {
                result = eval(x);
            }
            return result;
        }

        @Override
        public Object visitAssign(Assign e) {
            Object value = eval(e.value);
            Matcher.match(env, e.pattern, value);
            return value;
        }

        @Override
        public Object visitIf(If e) {
            Object cond = eval(e.cond);
            if (!(cond instanceof Boolean)) {
                throw new EvalError.TypeMismatch("boolean", cond);
            }
            return (Boolean)cond ? eval(e.then) : eval(e.otherwise);
        }

        @Override
        public Object visitBinaryOp(BinaryOp e) {
            switch (e.op) {
            case "and":
                return truth(eval(e.left)) && truth(eval(e.right));
            case "or":
                return truth(eval(e.left)) || truth(eval(e.right));
            default:
                return Operators.apply(e, eval(e.left), eval(e.right));
            }
        }

        private boolean truth(Object value) {
            if (value instanceof Boolean)
                return (Boolean)value;
            throw new EvalError.TypeMismatch("boolean", value);
        }

        @Override
        public Object visitList(ListExpr e) {
            return ImmutableList.copyOf(evalAll(e.elements));
        }

        @Override
        public Object visitTuple(TupleExpr e) {
            if (e.elements.size() != 2) {
                throw new EvalError.BadForm("only pairs are supported", e);
            }
            return Tuple.of(eval(e.elements.get(0)), eval(e.elements.get(1)));
        }

        @Override
        public Object visitPipe(Pipe e) {
            throw new EvalError.BadForm("pipeline must be expanded against a strategy", e);
        }

        @Override
        public Object visitDoBlock(DoBlock e) {
            Expr expanded = new DoExpander(e.strategy).expand(e.stmts);
            if (Config.TRACE.get()) {
                logger.info("Evaluating " + expanded.show());
            }
            return eval(expanded);
        }
    }
}
