/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.data;

import java.util.NoSuchElementException;
import java.util.function.Function;

import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.monad.$;
import static com.cloudway.monad.control.Syntax.*;

public class ResultTest {
    private static final Result.µ<Object> M = Result.tclass();

    private static final Function<Integer, $<Result.µ<Object>, Integer>> f = x -> Result.ok(x * x);
    private static final Function<Integer, $<Result.µ<Object>, Integer>> g = x -> Result.ok(x - 1);

    @Test
    public void leftIdentity() {
        assertEquals(f.apply(2), M.bind(M.pure(2), f));
    }

    @Test
    public void rightIdentity() {
        Result<Object, Integer> m = Result.ok(42);
        assertEquals(m, M.bind(m, M::pure));
    }

    @Test
    public void associativity() {
        $<Result.µ<Object>, Integer> m = M.pure(2);
        assertEquals(M.bind(M.bind(m, f), g), M.bind(m, x -> M.bind(f.apply(x), g)));
    }

    @Test
    public void successfulBind() {
        assertEquals(Result.ok(4), do_(Result.<Object, Integer>ok(2), x -> M.pure(x * x)));
    }

    @Test
    public void failingBind() {
        assertEquals(Result.error(2), do_(Result.<Object, Integer>error(2), x -> M.pure(x * x)));
    }

    @Test
    public void fail() {
        assertEquals(Result.error("reason"), do_(Result.<Object, Integer>fail("reason"), x -> M.pure(x * x)));
        assertEquals(Result.error("reason"), M.fail("reason"));
    }

    @Test
    public void okAndErrorAreDistinct() {
        assertNotEquals(Result.ok(2), Result.error(2));
        assertTrue(Result.error(2).isError());
        assertEquals("Ok(2)", Result.ok(2).toString());
    }

    @Test(expected = NoSuchElementException.class)
    public void getOnError() {
        Result.error("boom").get();
    }

    @Test
    public void toEither() {
        assertEquals(Either.left("boom"), Result.error("boom").toEither());
        assertEquals(Either.right(1), Result.ok(1).toEither());
    }

    @Test
    public void getOrThrowReturnsValue() {
        Result<String, Integer> r = Result.ok(9);
        assertEquals(9, (int)r.getOrThrow(IllegalArgumentException::new));
    }

    @Test(expected = IllegalArgumentException.class)
    public void getOrThrowRaisesFromError() {
        Result<String, Integer> r = Result.error("bad input");
        r.getOrThrow(IllegalArgumentException::new);
    }
}
