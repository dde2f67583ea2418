/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import java.util.List;

import com.cloudway.monad.control.Reader;
import com.cloudway.monad.control.State;
import com.cloudway.monad.control.Writer;
import com.cloudway.monad.data.Either;
import com.cloudway.monad.data.Maybe;
import com.cloudway.monad.data.Monoid;
import com.cloudway.monad.data.Result;

/**
 * The standard strategy modules available to evaluated code.
 */
public final class StrategyModules {
    private StrategyModules() {}

    public static final StrategyModule MAYBE = maybe();
    public static final StrategyModule EITHER = either();
    public static final StrategyModule ERROR = error();
    public static final StrategyModule STATE = state();
    public static final StrategyModule READER = reader();
    public static final StrategyModule LIST_WRITER = writer("ListWriter", Monoid.list());
    public static final StrategyModule STRING_WRITER = writer("StringWriter", Monoid.string);

    /**
     * Register all standard modules in the given environment.
     */
    public static void registerAll(Env env) {
        env.register(MAYBE);
        env.register(EITHER);
        env.register(ERROR);
        env.register(STATE);
        env.register(READER);
        env.register(LIST_WRITER);
        env.register(STRING_WRITER);
    }

    private static Maybe<Object> asMaybe(Object value) {
        return Maybe.narrow(StrategyModule.narrow(Maybe.tclass, value));
    }

    private static StrategyModule maybe() {
        return StrategyModule.builder("Maybe", Maybe.tclass)
            .export("just", Procedure.of(x -> Maybe.of(x)))
            .export("nothing", Procedure.of(() -> Maybe.empty()))
            .export("is_just", Procedure.of(m -> asMaybe(m).isPresent()))
            .export("is_nothing", Procedure.of(m -> asMaybe(m).isAbsent()))
            .export("from_just", Procedure.of(m -> asMaybe(m).get()))
            .export("from_maybe", Procedure.of((d, m) -> asMaybe(m).orElse(d)))
            .export("maybe", Procedure.of((d, f, m) -> asMaybe(m).maybe(d, x -> Procedure.from(f).call(x))))
            .export("maybe_to_list", Procedure.of(m -> asMaybe(m).toList()))
            .export("list_to_maybe", Procedure.of(xs -> Maybe.fromList(asList(xs))))
            .export("cat_maybes", Procedure.of(xs -> Maybe.catMaybes(asMaybeList(xs))))
            .build();
    }

    private static Either<Object, Object> asEither(Object value) {
        return Either.narrow(StrategyModule.narrow(Either.tclass(), value));
    }

    private static StrategyModule either() {
        return StrategyModule.builder("Either", Either.tclass())
            .export("left", Procedure.of(x -> Either.left(x)))
            .export("right", Procedure.of(x -> Either.right(x)))
            .export("is_left", Procedure.of(e -> asEither(e).isLeft()))
            .export("is_right", Procedure.of(e -> asEither(e).isRight()))
            .export("either", Procedure.of((e, f, g) ->
                asEither(e).either(x -> Procedure.from(f).call(x), y -> Procedure.from(g).call(y))))
            .build();
    }

    private static Result<Object, Object> asResult(Object value) {
        return Result.narrow(StrategyModule.narrow(Result.tclass(), value));
    }

    private static StrategyModule error() {
        return StrategyModule.builder("Error", Result.tclass())
            .export("ok", Procedure.of(x -> Result.ok(x)))
            .export("error", Procedure.of(x -> Result.error(x)))
            .export("is_ok", Procedure.of(r -> asResult(r).isOk()))
            .export("is_error", Procedure.of(r -> asResult(r).isError()))
            .build();
    }

    private static State<Object, Object> asState(Object value) {
        return State.narrow(StrategyModule.narrow(State.tclass(), value));
    }

    private static StrategyModule state() {
        return StrategyModule.builder("State", State.tclass())
            .export("get", Procedure.of(() -> State.get()))
            .export("put", Procedure.of(s -> State.put(s)))
            .export("modify", Procedure.of(f -> State.modify(s -> Procedure.from(f).call(s))))
            .export("gets", Procedure.of(f -> State.gets(s -> Procedure.from(f).call(s))))
            .export("run", Procedure.of((s, m) -> asState(m).run(s)))
            .export("eval", Procedure.of((s, m) -> asState(m).eval(s)))
            .export("exec", Procedure.of((s, m) -> asState(m).exec(s)))
            .build();
    }

    private static Reader<Object, Object> asReader(Object value) {
        return Reader.narrow(StrategyModule.narrow(Reader.tclass(), value));
    }

    private static StrategyModule reader() {
        return StrategyModule.builder("Reader", Reader.tclass())
            .export("ask", Procedure.of(() -> Reader.ask()))
            .export("asks", Procedure.of(f -> Reader.asks(r -> Procedure.from(f).call(r))))
            .export("local", Procedure.of((m, f) -> Reader.local(asReader(m), r -> Procedure.from(f).call(r))))
            .export("run", Procedure.of((r, m) -> asReader(m).run(r)))
            .build();
    }

    /**
     * Create a writer module that accumulates output with the given monoid.
     */
    public static <W> StrategyModule writer(String name, Monoid<W> monoid) {
        Writer.µ<W> tc = Writer.on(monoid);
        return StrategyModule.builder(name, tc)
            .export("tell", Procedure.of(w -> tc.tell(StrategyModules.<W>cast(w))))
            .export("run", Procedure.of(m -> Writer.run(StrategyModule.<Writer.µ<W>, Object>narrow(tc, m))))
            .build();
    }

    @SuppressWarnings("unchecked")
    private static <W> W cast(Object value) {
        return (W)value;
    }

    private static List<Object> asList(Object value) {
        if (value instanceof List) {
            return cast(value);
        }
        throw new EvalError.TypeMismatch("list", value);
    }

    private static List<Maybe<Object>> asMaybeList(Object value) {
        List<Object> xs = asList(value);
        for (Object x : xs) {
            asMaybe(x);
        }
        return cast(xs);
    }
}
