/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import com.cloudway.monad.data.Maybe;
import com.cloudway.monad.syntax.Expr;
import com.cloudway.monad.syntax.Expr.Var;
import static java.util.Objects.requireNonNull;

/**
 * A lexical scope. Each scope holds its own variable bindings and
 * refers to its enclosing scope; all scopes of a chain share the
 * registry of strategy modules.
 */
public final class Env {
    private static final Logger logger = Logger.getLogger(Env.class.getName());

    private final Env outer;
    private final Map<Var, Object> bindings = new HashMap<>();
    private final Map<String, StrategyModule> modules;

    /**
     * Construct a top-level environment.
     */
    public Env() {
        this.outer = null;
        this.modules = new ConcurrentHashMap<>();
    }

    private Env(Env outer) {
        this.outer = outer;
        this.modules = outer.modules;
    }

    public Env getOuter() {
        return outer;
    }

    /**
     * Create a nested scope.
     */
    public Env extend() {
        return new Env(this);
    }

    public Maybe<Object> lookup(Var id) {
        for (Env env = this; env != null; env = env.outer) {
            Object value = env.bindings.get(id);
            if (value != null) {
                return Maybe.of(value);
            }
        }
        return Maybe.empty();
    }

    public Object get(Var id) {
        return lookup(id).orElseGet(() -> { throw new EvalError.Unbound(id.show()); });
    }

    public void put(Var id, Object value) {
        bindings.put(requireNonNull(id), requireNonNull(value));
    }

    public void put(String name, Object value) {
        put(Expr.var(name), value);
    }

    public void register(StrategyModule module) {
        modules.put(module.name(), module);
    }

    public Maybe<StrategyModule> lookupModule(String name) {
        return Maybe.ofNullable(modules.get(name));
    }

    public StrategyModule getModule(String name) {
        return lookupModule(name).orElseGet(() -> { throw new EvalError.Unbound(name); });
    }

    /**
     * Make the exports of a registered module visible unqualified in
     * this scope.
     */
    public void importModule(String name) {
        StrategyModule module = getModule(name);
        module.exports().forEach(this::put);
        logger.fine("Imported module " + name + " " + module.exports().keySet());
    }
}
