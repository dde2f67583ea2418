/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.cloudway.monad.Config;
import com.cloudway.monad.syntax.Expr.Call;
import com.cloudway.monad.syntax.Expr.Pipe;
import com.cloudway.monad.syntax.Expr.Qualified;
import com.cloudway.monad.syntax.Expr.Var;
import com.cloudway.monad.syntax.SyntaxError.BadPipeline;
import static java.util.Objects.requireNonNull;

/**
 * Expands a pipeline {@code a |> f(x) |> g} against a strategy. Every
 * stage but the first is a call with its first argument missing; the
 * result of the previous stages is threaded into that argument through
 * the strategy's {@code pipebind}:
 *
 * <pre>{@code
 * S.pipebind(S.pipebind(a, f(x)), g())
 * }</pre>
 */
public class PipelineExpander {
    private static final Logger logger = Logger.getLogger(PipelineExpander.class.getName());

    private final Strategy strategy;

    public PipelineExpander(Strategy strategy) {
        this.strategy = requireNonNull(strategy);
    }

    public static Expr expand(Strategy strategy, Expr chain) {
        return new PipelineExpander(strategy).expand(chain);
    }

    /**
     * Expand a left-associative chain of {@code |>} operators.
     *
     * @throws BadPipeline if the expression is not a pipe chain or a
     * stage is not a call
     */
    public Expr expand(Expr chain) {
        if (!(chain instanceof Pipe)) {
            throw new BadPipeline("pipeline requires a '|>' chain", chain);
        }

        List<Expr> stages = new ArrayList<>();
        flatten(chain, stages);
        return expand(stages, chain);
    }

    /**
     * Expand an explicit list of stages.
     */
    public Expr expand(List<Expr> stages) {
        return expand(stages, stages.isEmpty() ? Expr.list() : Expr.list(stages.toArray(new Expr[0])));
    }

    private Expr expand(List<Expr> stages, Expr form) {
        if (stages.size() < 2) {
            throw new BadPipeline("pipeline requires at least two stages", form);
        }

        Expr acc = stages.get(0);
        for (Expr stage : stages.subList(1, stages.size())) {
            acc = strategy.pipebind(acc, asCall(stage));
        }

        Level level = Config.TRACE.get() ? Level.INFO : Level.FINE;
        if (logger.isLoggable(level)) {
            logger.log(level, "Expanded pipeline for " + strategy + ": " + acc.show());
        }
        return acc;
    }

    private static void flatten(Expr e, List<Expr> stages) {
        if (e instanceof Pipe) {
            Pipe p = (Pipe)e;
            flatten(p.left, stages);
            stages.add(p.right);
        } else {
            stages.add(e);
        }
    }

    // a bare function name is a call without parentheses
    private static Call asCall(Expr stage) {
        if (stage instanceof Call) {
            return (Call)stage;
        }
        if (stage instanceof Var || stage instanceof Qualified) {
            return Expr.call(stage);
        }
        throw new BadPipeline("pipeline stage must be a call", stage);
    }
}
