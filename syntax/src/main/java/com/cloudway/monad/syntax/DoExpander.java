/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import com.cloudway.monad.Config;
import com.cloudway.monad.syntax.Expr.Assign;
import com.cloudway.monad.syntax.Expr.Block;
import com.cloudway.monad.syntax.SyntaxError.BadStatement;
import com.cloudway.monad.syntax.SyntaxError.MissingBlock;
import static java.util.Objects.requireNonNull;

/**
 * Expands the statements of a do-block into nested {@code bind} calls
 * against a strategy:
 *
 * <pre>{@code
 * x <- a; y <- b; return(f(x, y))
 *   ==>
 * S.bind(a, fn x -> S.bind(b, fn y -> S.return(f(x, y)) end) end)
 * }</pre>
 *
 * <p>{@code let} bindings are spliced in place without a {@code bind},
 * and a statement evaluated only for its effect is bound to the ignored
 * pattern {@code _}.
 */
public class DoExpander {
    private static final Logger logger = Logger.getLogger(DoExpander.class.getName());

    private final Strategy strategy;

    public DoExpander(Strategy strategy) {
        this.strategy = requireNonNull(strategy);
    }

    public static Expr expand(Strategy strategy, Stmt... stmts) {
        return new DoExpander(strategy).expand(ImmutableList.copyOf(stmts));
    }

    public Strategy getStrategy() {
        return strategy;
    }

    /**
     * Expand the given block.
     *
     * @throws MissingBlock if the block is absent or empty
     * @throws BadStatement if a statement appears where it is not allowed
     */
    public Expr expand(List<Stmt> stmts) {
        if (stmts == null || stmts.isEmpty()) {
            throw new MissingBlock(strategy);
        }
        check(stmts);

        Expr result = new ReturnRewriter(strategy).rewrite(expand(stmts, 0));

        Level level = Config.TRACE.get() ? Level.INFO : Level.FINE;
        if (logger.isLoggable(level)) {
            logger.log(level, "Expanded do-block for " + strategy + ": " + result.show());
        }
        return result;
    }

    private static void check(List<Stmt> stmts) {
        int last = stmts.size() - 1;
        for (int i = 0; i <= last; i++) {
            Stmt s = stmts.get(i);
            if (s instanceof Stmt.Let && ((Stmt.Let)s).bindings.isEmpty()) {
                throw new BadStatement("let without bindings", s);
            }
            if (i < last && s instanceof Stmt.Tail) {
                throw new BadStatement("tail expression must be last", s);
            }
            if (i == last && (s instanceof Stmt.Bind || s instanceof Stmt.Let)) {
                throw new BadStatement("block must end with an expression", s);
            }
        }
    }

    private Expr expand(List<Stmt> stmts, int pos) {
        Stmt head = stmts.get(pos);

        if (pos == stmts.size() - 1) {
            return head instanceof Stmt.Tail
                ? ((Stmt.Tail)head).expr
                : ((Stmt.Plain)head).action;
        }

        Expr rest = expand(stmts, pos + 1);

        if (head instanceof Stmt.Bind) {
            Stmt.Bind b = (Stmt.Bind)head;
            return strategy.bind(b.action, b.pattern, rest);
        }

        if (head instanceof Stmt.Plain) {
            return strategy.bind(((Stmt.Plain)head).action, Expr.wildcard(), rest);
        }

        if (head instanceof Stmt.Let) {
            ImmutableList.Builder<Expr> body = ImmutableList.builder();
            for (Assign a : ((Stmt.Let)head).bindings) {
                body.add(a);
            }
            if (stmts.get(pos + 1) instanceof Stmt.Let) {
                body.addAll(((Block)rest).body);
            } else {
                body.add(rest);
            }
            return new Block(body.build());
        }

        throw new BadStatement("unknown statement", head);
    }
}
