/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.Matchers.*;

import com.cloudway.monad.data.Either;
import com.cloudway.monad.data.Maybe;
import com.cloudway.monad.data.Result;
import com.cloudway.monad.data.Tuple;
import com.cloudway.monad.data.Unit;
import com.cloudway.monad.syntax.Expr;
import com.cloudway.monad.syntax.PipelineExpander;
import com.cloudway.monad.syntax.Strategy;
import static com.cloudway.monad.syntax.Expr.*;
import static com.cloudway.monad.syntax.Stmt.*;

public class EvaluatorTest {
    private static final Strategy MAYBE = Strategy.of("Maybe");
    private static final Strategy ERROR = Strategy.of("Error");
    private static final Strategy STATE = Strategy.of("State");
    private static final Strategy READER = Strategy.of("Reader");
    private static final Strategy WRITER = Strategy.of("ListWriter");

    private final Evaluator evaluator = new Evaluator();

    private Object eval(Expr expr, String... imports) {
        return evaluator.eval(evaluator.newEnv(imports), expr);
    }

    private EvalError failure(Expr expr, String... imports) {
        Either<EvalError, Object> result = evaluator.evaluate(evaluator.newEnv(imports), expr);
        assertTrue("expected an evaluation error", result.isLeft());
        return result.left();
    }

    @Test
    public void maybeBindSuccess() {
        Expr m = doBlock(MAYBE,
            bind(var("x"), call("return", lit(2))),
            bind(var("y"), call("return", lit(4))),
            tail(call("return", op("*", var("x"), var("y")))));
        assertEquals(Maybe.of(8), eval(m));
    }

    @Test
    public void maybeBindFail() {
        Expr m = doBlock(MAYBE,
            bind(var("x"), call("return", lit(2))),
            bind(var("y"), call("fail", lit("Yes, we can"))),
            tail(call("return", op("*", var("x"), var("y")))));
        assertEquals(Maybe.empty(), eval(m, "Maybe"));
    }

    @Test
    public void maybeShortCircuitsContinuation() {
        Expr m = doBlock(MAYBE,
            bind(var("x"), call("nothing")),
            tail(call("from_just", call("nothing"))));
        assertEquals(Maybe.empty(), eval(m, "Maybe"));
    }

    @Test
    public void maybeExtras() {
        assertEquals(true, eval(call("is_just", call("just", lit(1))), "Maybe"));
        assertEquals(true, eval(call("is_nothing", call("nothing")), "Maybe"));
        assertEquals(3, eval(call("from_maybe", lit(3), call("nothing")), "Maybe"));
        assertEquals(1, eval(call("from_just", call("just", lit(1))), "Maybe"));
        assertEquals(ImmutableList.of(1, 3),
            eval(call("cat_maybes", list(call("just", lit(1)), call("nothing"), call("just", lit(3)))), "Maybe"));
        assertEquals(Maybe.of(1), eval(call("list_to_maybe", list(lit(1), lit(2))), "Maybe"));
        assertEquals(ImmutableList.of(), eval(call("maybe_to_list", call("nothing")), "Maybe"));
        assertEquals(20, eval(call("maybe", lit(0), lambda(var("x"), op("*", var("x"), lit(10))),
                                   call("just", lit(2))), "Maybe"));
    }

    @Test
    public void fromJustOnNothingIsAFault() {
        EvalError ex = failure(call("from_just", call("nothing")), "Maybe");
        assertThat(ex.getCause(), instanceOf(NoSuchElementException.class));
    }

    @Test
    public void letInsideBlock() {
        Expr m = doBlock(MAYBE,
            let(var("x"), lit(2)),
            bind(var("y"), call("just", op("+", var("x"), lit(1)))),
            tail(call("return", op("*", var("x"), var("y")))));
        assertEquals(Maybe.of(6), eval(m, "Maybe"));
    }

    @Test
    public void errorBindSuccess() {
        Expr m = doBlock(ERROR,
            bind(var("x"), call("ok", lit(2))),
            tail(call("return", op("*", var("x"), var("x")))));
        assertEquals(Result.ok(4), eval(m, "Error"));
    }

    @Test
    public void errorBindFailure() {
        Expr m = doBlock(ERROR,
            bind(var("x"), call("error", lit(2))),
            tail(call("return", op("*", var("x"), var("x")))));
        assertEquals(Result.error(2), eval(m, "Error"));
    }

    @Test
    public void errorFail() {
        assertEquals(Result.error("boom"), eval(call(qualified("Error", "fail"), lit("boom"))));
    }

    @Test
    public void eitherCaseSplit() {
        Expr onLeft = lambda(var("x"), op("*", var("x"), lit(10)));
        Expr onRight = lambda(var("y"), var("y"));
        assertEquals(10, eval(call("either", call("left", lit(1)), onLeft, onRight), "Either"));
        assertEquals(7, eval(call("either", call("right", lit(7)), onLeft, onRight), "Either"));
        assertEquals(Either.left("no"), eval(call(qualified("Either", "fail"), lit("no"))));
    }

    @Test
    public void stateGetAndPut() {
        Expr m = doBlock(STATE,
            bind(var("x"), call("get")),
            plain(call("put", op("+", var("x"), lit(1)))),
            tail(call("return", op("*", var("x"), lit(10)))));
        assertEquals(Tuple.of(40, 5), eval(call("run", lit(4), m), "State"));
    }

    @Test
    public void stateModify() {
        Expr m = doBlock(STATE,
            plain(call("modify", lambda(var("s"), op("*", var("s"), lit(3))))),
            tail(call("gets", lambda(var("s"), op("+", var("s"), lit(1))))));
        assertEquals(Tuple.of(7, 6), eval(call("run", lit(2), m), "State"));
        assertEquals(6, eval(call("exec", lit(2), m), "State"));
        assertEquals(Tuple.of(Unit.U, 9), eval(call("run", lit(4), call("put", lit(9))), "State"));
    }

    @Test
    public void stateHasNoFailure() {
        EvalError ex = failure(call(qualified("State", "fail"), lit("no")));
        assertThat(ex.getCause(), instanceOf(UnsupportedOperationException.class));
    }

    @Test
    public void readerAsk() {
        Expr m = doBlock(READER,
            bind(var("x"), call("return", lit(2))),
            bind(var("y"), call("ask")),
            tail(call("return", op("*", var("x"), var("y")))));
        assertEquals(8, eval(call("run", lit(4), m), "Reader"));
    }

    @Test
    public void readerLocal() {
        Expr m = call("local", call("ask"), lambda(var("r"), op("+", var("r"), lit(1))));
        assertEquals(5, eval(call("run", lit(4), m), "Reader"));
    }

    @Test
    public void readerPipeline() {
        Expr chain = pipe(call("ask"),
            call(lambda(var("x"), call(qualified("Reader", "return"), op("+", var("x"), lit(1))))));
        Expr m = PipelineExpander.expand(READER, chain);
        assertEquals(11, eval(call("run", lit(10), m), "Reader"));
    }

    @Test
    public void writerTell() {
        Expr m = doBlock(WRITER,
            plain(call("tell", list(lit(1)))),
            bind(var("x"), call("return", lit(2))),
            plain(call("tell", list(lit(2)))),
            tail(call("return", var("x"))));
        assertEquals(Tuple.of(2, ImmutableList.of(1, 2)), eval(call("run", m), "ListWriter"));
    }

    @Test
    public void writerTellAfterReturn() {
        Expr m = doBlock(WRITER,
            bind(var("x"), call("return", lit(2))),
            plain(call("tell", list(lit(3)))),
            plain(call("tell", list(lit(4)))),
            tail(call("return", var("x"))));
        assertEquals(Tuple.of(2, ImmutableList.of(3, 4)), eval(call("run", m), "ListWriter"));
    }

    @Test
    public void destructureRunResult() {
        Expr m = doBlock(WRITER,
            plain(call("tell", list(lit("a")))),
            tail(call("return", lit(1))));
        Expr prog = block(
            assign(tuple(var("v"), var("w")), call("run", m)),
            tuple(var("w"), var("v")));
        assertEquals(Tuple.of(ImmutableList.of("a"), 1), eval(prog, "ListWriter"));
    }

    @Test
    public void nestedBlockOfAnotherStrategy() {
        Expr inner = doBlock(ERROR,
            bind(var("y"), call(qualified("Error", "ok"), var("x"))),
            tail(call("return", op("+", var("y"), lit(1)))));
        Expr outer = doBlock(MAYBE,
            bind(var("x"), call(qualified("Maybe", "just"), lit(2))),
            tail(call("return", inner)));
        assertEquals(Maybe.of(Result.ok(3)), eval(outer));
    }

    @Test
    public void pipelineIsHygienic() {
        Strategy s = Strategy.of("Maybe");
        Expr probe = PipelineExpander.expand(s, pipe(var("a"), call("f")));
        Var first = (Var)((Lambda)((Call)probe).args.get(1)).params.get(0);
        String prefix = first.name.replaceAll("[0-9]+$", "");
        long n = Long.parseLong(first.name.substring(prefix.length()));
        String next = prefix + (n + 1);

        // the program variable has the same name as the next hidden parameter
        Expr m = PipelineExpander.expand(s, pipe(call("just", lit(10)), call("add", var(next))));
        Var hidden = (Var)((Lambda)((Call)m).args.get(1)).params.get(0);
        assertEquals(next, hidden.name);

        Env env = evaluator.newEnv("Maybe");
        env.put(next, 5);
        env.put("add", Procedure.of((a, b) -> Maybe.of((Integer)a + (Integer)b)));
        assertEquals(Maybe.of(15), evaluator.eval(env, m));
    }

    @Test
    public void conditionalsAndOperators() {
        Expr e = if_(op("and", op("<", lit(1), lit(2)), op("==", lit("a"), lit("a"))),
                     op("++", list(lit(1)), list(lit(2))),
                     lit(0));
        assertEquals(ImmutableList.of(1, 2), eval(e));
        assertEquals("ab", eval(op("++", lit("a"), lit("b"))));
        assertEquals(2.5, eval(op("/", lit(5.0), lit(2))));
        assertEquals(1, eval(op("%", lit(7), lit(3))));
    }

    @Test
    public void divisionByZero() {
        assertThat(failure(op("/", lit(1), lit(0))).getMessage(), containsString("division by zero"));
    }

    @Test
    public void unboundVariable() {
        EvalError ex = failure(var("nope"));
        assertThat(ex, instanceOf(EvalError.Unbound.class));
        assertEquals("Error: unbound variable: nope", ex.getMessage());
    }

    @Test
    public void unknownModule() {
        assertThat(failure(call(qualified("List", "bind"))), instanceOf(EvalError.Unbound.class));
    }

    @Test
    public void applyNonFunction() {
        assertThat(failure(call(lit(1))), instanceOf(EvalError.NotAFunction.class));
    }

    @Test
    public void arityMismatch() {
        EvalError ex = failure(call(lambda(var("x"), var("x")), lit(1), lit(2)));
        assertThat(ex, instanceOf(EvalError.NumArgs.class));
        assertEquals("Error: expected 1 args; found 2", ex.getMessage());
    }

    @Test
    public void patternMismatch() {
        EvalError ex = failure(assign(tuple(lit(1), var("x")), tuple(lit(2), lit(3))));
        assertThat(ex, instanceOf(EvalError.PatternMismatch.class));
    }

    @Test
    public void bindRequiresComputationOfTheStrategy() {
        EvalError ex = failure(call(qualified("Maybe", "bind"), lit(1), lambda(var("x"), var("x"))));
        assertThat(ex, instanceOf(EvalError.TypeMismatch.class));
    }

    @Test
    public void writerRejectsComputationOfAnotherWriter() {
        Expr m = doBlock(Strategy.of("StringWriter"),
            bind(var("x"), call(qualified("ListWriter", "return"), lit(1))),
            tail(call("return", var("x"))));
        EvalError ex = failure(call("run", m), "StringWriter");
        assertThat(ex, instanceOf(EvalError.TypeMismatch.class));
    }

    @Test
    public void unexpandedPipelineIsRejected() {
        EvalError ex = failure(pipe(lit(1), call("f")));
        assertThat(ex, instanceOf(EvalError.BadForm.class));
        assertThat(ex.getMessage(), containsString("pipeline must be expanded"));
    }

    @Test
    public void wildcardIsOnlyAPattern() {
        assertThat(failure(wildcard()), instanceOf(EvalError.BadForm.class));
    }

    @Test
    public void closuresCaptureScope() {
        Expr prog = block(
            assign(var("n"), lit(10)),
            assign(var("add"), lambda(var("x"), op("+", var("x"), var("n")))),
            assign(var("n"), lit(20)),
            call("add", lit(1)));
        assertEquals(21, eval(prog));
    }
}
