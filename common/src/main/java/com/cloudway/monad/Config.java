/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad;

import java.util.function.Supplier;

import com.cloudway.monad.data.Maybe;

public final class Config
{
    private static final Configuration.Provider DEFAULT_PROVIDER = new DefaultConfiguration.Provider();
    private static volatile Configuration.Provider provider = DEFAULT_PROVIDER;

    public static void setProvider(Configuration.Provider prov) {
        provider = prov != null ? prov : DEFAULT_PROVIDER;
    }

    public static final String DEFAULT_RESOURCE = "monad.properties";

    private final Configuration conf;

    public Config(String name) {
        conf = provider.load(name);
    }

    public static Config getDefault() {
        return new Config(DEFAULT_RESOURCE);
    }

    public String get(String name, String deflt) {
        return conf.getProperty(name).orElse(deflt);
    }

    public boolean getBoolean(String name, boolean deflt) {
        return conf.getProperty(name).map(Boolean::valueOf).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        return conf.getProperty(name).flatMap(Config::parseInt).orElse(deflt);
    }

    private static Maybe<Integer> parseInt(String value) {
        try {
            return Maybe.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException ex) {
            return Maybe.empty();
        }
    }

    public String toString() {
        return conf.toString();
    }

    public static Supplier<String> property(String key, String deflt) {
        return () -> getDefault().get(key, deflt);
    }

    public static Supplier<Boolean> flag(String key, boolean deflt) {
        return () -> getDefault().getBoolean(key, deflt);
    }

    /**
     * The keyword that a do-block rewrites to the active strategy's
     * {@code return} operation.
     */
    public static final Supplier<String> RETURN_KEYWORD = property("monad.syntax.return-keyword", "return");

    /**
     * The display prefix of hidden parameters introduced by pipelines.
     */
    public static final Supplier<String> GENSYM_PREFIX = property("monad.syntax.gensym-prefix", "v");

    /**
     * Log every expansion at INFO level instead of FINE.
     */
    public static final Supplier<Boolean> TRACE = flag("monad.syntax.trace", false);
}
