/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;


import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.Matchers.*;

import com.cloudway.monad.syntax.Expr.Assign;
import com.cloudway.monad.syntax.SyntaxError.BadStatement;
import com.cloudway.monad.syntax.SyntaxError.MissingBlock;
import static com.cloudway.monad.syntax.Expr.*;
import static com.cloudway.monad.syntax.Stmt.*;

public class DoExpanderTest {
    private static final Strategy S = Strategy.of("Maybe");

    private static Expr bindS(Expr action, Expr pattern, Expr body) {
        return call(qualified("Maybe", "bind"), action, lambda(pattern, body));
    }

    private static Expr returnS(Expr value) {
        return call(qualified("Maybe", "return"), value);
    }

    @Test
    public void bindsBecomeNestedContinuations() {
        Expr result = DoExpander.expand(S,
            bind(var("x"), var("a")),
            bind(var("y"), var("b")),
            tail(call("return", call("f", var("x"), var("y")))));

        assertEquals(
            bindS(var("a"), var("x"),
                bindS(var("b"), var("y"),
                    returnS(call("f", var("x"), var("y"))))),
            result);
        assertEquals(
            "Maybe.bind(a, fn x -> Maybe.bind(b, fn y -> Maybe.return(f(x, y)) end) end)",
            result.show());
    }

    @Test
    public void plainStatementBindsWildcard() {
        Expr result = DoExpander.expand(S,
            plain(call("tell", list(lit(1)))),
            tail(call("return", lit(2))));

        assertEquals(bindS(call("tell", list(lit(1))), wildcard(), returnS(lit(2))), result);
        assertEquals("Maybe.bind(tell([1]), fn _ -> Maybe.return(2) end)", result.show());
    }

    @Test
    public void letIntroducesNoBind() {
        Expr result = DoExpander.expand(S,
            let(var("x"), lit(2)),
            tail(call("return", var("x"))));

        assertEquals(block(assign(var("x"), lit(2)), returnS(var("x"))), result);
        assertEquals("(x = 2; Maybe.return(x))", result.show());
    }

    @Test
    public void consecutiveLetsShareOneBlock() {
        Expr result = DoExpander.expand(S,
            let(var("x"), lit(1)),
            let(ImmutableList.of(assign(var("y"), lit(2)), assign(var("z"), lit(3)))),
            tail(var("x")));

        assertEquals(
            block(assign(var("x"), lit(1)), assign(var("y"), lit(2)), assign(var("z"), lit(3)), var("x")),
            result);
    }

    @Test
    public void letBetweenBinds() {
        Expr result = DoExpander.expand(S,
            bind(var("x"), var("a")),
            let(var("y"), op("+", var("x"), lit(1))),
            tail(call("return", var("y"))));

        assertEquals(
            bindS(var("a"), var("x"),
                block(assign(var("y"), op("+", var("x"), lit(1))), returnS(var("y")))),
            result);
    }

    @Test
    public void patternsArePassedThrough() {
        Expr pattern = tuple(var("a"), wildcard());
        Expr result = DoExpander.expand(S,
            bind(pattern, var("m")),
            tail(var("a")));

        assertEquals(bindS(var("m"), pattern, var("a")), result);
    }

    @Test
    public void singleStatementIsReturnedVerbatim() {
        assertEquals(var("a"), DoExpander.expand(S, tail(var("a"))));
        assertEquals(call("f", lit(1)), DoExpander.expand(S, plain(call("f", lit(1)))));
    }

    @Test
    public void singleStatementStillQualifiesReturn() {
        assertEquals(returnS(lit(1)), DoExpander.expand(S, tail(call("return", lit(1)))));
    }

    @Test
    public void inputIsNotModified() {
        ImmutableList<Stmt> stmts = ImmutableList.of(
            bind(var("x"), var("a")),
            tail(call("return", var("x"))));
        new DoExpander(S).expand(stmts);
        assertEquals(tail(call("return", var("x"))), stmts.get(1));
    }

    private static SyntaxError failure(Stmt... stmts) {
        try {
            DoExpander.expand(S, stmts);
        } catch (SyntaxError ex) {
            return ex;
        }
        throw new AssertionError("expected a syntax error");
    }

    @Test
    public void emptyBlockIsMissing() {
        SyntaxError ex = failure();
        assertThat(ex, instanceOf(MissingBlock.class));
        assertEquals("Syntax error: missing block in do-block for Maybe", ex.getMessage());
    }

    @Test(expected = MissingBlock.class)
    public void absentBlockIsMissing() {
        new DoExpander(S).expand(null);
    }

    @Test
    public void bindAsLastStatementIsRejected() {
        SyntaxError ex = failure(bind(var("y"), var("a")), bind(var("x"), var("b")));
        assertThat(ex, instanceOf(BadStatement.class));
        assertThat(ex.getMessage(), endsWith("block must end with an expression: x <- b"));
    }

    @Test(expected = BadStatement.class)
    public void bindAsOnlyStatementIsRejected() {
        DoExpander.expand(S, bind(var("x"), var("a")));
    }

    @Test
    public void letAsLastStatementIsRejected() {
        SyntaxError ex = failure(plain(var("a")), let(var("x"), lit(1)));
        assertThat(ex.getMessage(), endsWith("block must end with an expression: let x = 1"));
    }

    @Test
    public void tailMustBeLast() {
        SyntaxError ex = failure(tail(var("a")), tail(var("b")));
        assertThat(ex, instanceOf(BadStatement.class));
        assertThat(ex.getMessage(), containsString("tail expression must be last"));
    }

    @Test
    public void emptyLetIsRejected() {
        SyntaxError ex = failure(let(ImmutableList.<Assign>of()), tail(var("a")));
        assertThat(ex.getMessage(), containsString("let without bindings"));
    }

    @Test
    public void diagnosticsCarryTheConstruct() {
        SyntaxError ex = failure(bind(var("x"), call("f", lit(1))));
        assertThat(((BadStatement)ex).stmt, is((Stmt)bind(var("x"), call("f", lit(1)))));
        assertThat(ex.getMessage(), startsWith("Syntax error: "));
    }
}
