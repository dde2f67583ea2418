/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.data;

import org.junit.Test;
import static org.junit.Assert.*;

public class TupleTest {
    @Test
    public void accessors() {
        Tuple<Integer, String> t = Tuple.of(1, "a");
        assertEquals(1, (int)t.first());
        assertEquals("a", t.second());
        assertEquals(Tuple.of("a", 1), t.swap());
        assertEquals("1a", t.as((x, y) -> x + y));
    }

    @Test
    public void mapping() {
        Tuple<Integer, Integer> t = Tuple.of(1, 2);
        assertEquals(Tuple.of(10, 2), t.mapFirst(x -> x * 10));
        assertEquals(Tuple.of(1, 20), t.mapSecond(x -> x * 10));
    }

    @Test
    public void equality() {
        assertEquals(Tuple.of(1, 2), Tuple.of(1, 2));
        assertEquals(Tuple.of(1, 2).hashCode(), Tuple.of(1, 2).hashCode());
        assertNotEquals(Tuple.of(1, 2), Tuple.of(2, 1));
        assertEquals("(1, 2)", Tuple.of(1, 2).toString());
    }
}
