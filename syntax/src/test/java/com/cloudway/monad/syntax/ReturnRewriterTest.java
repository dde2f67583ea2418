/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

import org.junit.Test;
import static org.junit.Assert.*;

import static com.cloudway.monad.syntax.Expr.*;
import static com.cloudway.monad.syntax.Stmt.*;

public class ReturnRewriterTest {
    private static final Strategy S = Strategy.of("State");
    private static final Expr RETURN = qualified("State", "return");

    private static Expr expandTail(Expr expr) {
        return DoExpander.expand(S, bind(var("x"), var("m")), tail(expr));
    }

    private static Expr body(Expr expanded) {
        return ((Lambda)((Call)expanded).args.get(1)).body;
    }

    @Test
    public void conditionalBranches() {
        Expr result = body(expandTail(
            if_(var("x"), call("return", lit(1)), call("return", lit(2)))));
        assertEquals(if_(var("x"), call(RETURN, lit(1)), call(RETURN, lit(2))), result);
    }

    @Test
    public void lambdaBodies() {
        Expr result = body(expandTail(
            call("map", var("xs"), lambda(var("y"), call("return", var("y"))))));
        assertEquals(call("map", var("xs"), lambda(var("y"), call(RETURN, var("y")))), result);
    }

    @Test
    public void listsAndTuples() {
        Expr result = body(expandTail(
            call("sequence", list(call("return", lit(1)), tuple(call("return", lit(2)), lit(3))))));
        assertEquals(
            call("sequence", list(call(RETURN, lit(1)), tuple(call(RETURN, lit(2)), lit(3)))),
            result);
    }

    @Test
    public void bareReferenceAsFunctionValue() {
        Expr result = body(expandTail(call("bind", var("x"), var("return"))));
        assertEquals(call("bind", var("x"), RETURN), result);
        assertEquals("bind(x, State.return)", result.show());
    }

    @Test
    public void actionsOfEarlierStatements() {
        Expr result = DoExpander.expand(S,
            bind(var("x"), call("return", lit(1))),
            plain(call("put", var("x"))),
            tail(call("return", var("x"))));
        assertEquals(
            "State.bind(State.return(1), fn x -> State.bind(put(x), fn _ -> State.return(x) end) end)",
            result.show());
    }

    @Test
    public void stopsAtBlockOfAnotherStrategy() {
        DoBlock inner = doBlock(Strategy.of("Maybe"), tail(call("return", lit(1))));
        Expr result = body(expandTail(call("return", inner)));
        assertEquals(call(RETURN, inner), result);
    }

    @Test
    public void descendsIntoBlockOfSameStrategy() {
        DoBlock inner = doBlock(S, bind(var("y"), var("n")), tail(call("return", var("y"))));
        Expr result = body(expandTail(inner));
        assertEquals(doBlock(S, bind(var("y"), var("n")), tail(call(RETURN, var("y")))), result);
    }

    @Test
    public void patternsAreNotRewritten() {
        Expr result = new ReturnRewriter(S).rewrite(
            lambda(var("return"), call("return", lit(1))));
        assertEquals(lambda(var("return"), call(RETURN, lit(1))), result);
    }

    @Test
    public void qualifiedReturnIsUntouched() {
        Expr other = call(qualified("Maybe", "return"), lit(1));
        assertEquals(other, new ReturnRewriter(S).rewrite(other));
    }

    @Test
    public void customKeyword() {
        ReturnRewriter rewriter = new ReturnRewriter(S, "yield");
        assertEquals(call(RETURN, lit(1)), rewriter.rewrite(call("yield", lit(1))));
        assertEquals(call("return", lit(1)), rewriter.rewrite(call("return", lit(1))));
    }

    @Test
    public void generatedVariablesAreNotKeywords() {
        Expr gensym = new GenSym("return");
        assertSame(gensym, new ReturnRewriter(S).rewrite(gensym));
    }
}
