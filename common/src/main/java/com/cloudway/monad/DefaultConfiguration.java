/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Properties;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.io.Resources;

import com.cloudway.monad.data.Maybe;

import static java.util.Objects.requireNonNull;

/**
 * Properties loaded from a classpath resource. System properties take
 * precedence over the values in the resource.
 */
class DefaultConfiguration implements Configuration
{
    private final Properties props = new Properties();

    @Override
    public Maybe<String> getProperty(String name) {
        Maybe<String> val = Maybe.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Maybe.ofNullable(props.getProperty(name));
    }

    public String toString() {
        return props.toString();
    }

    static DefaultConfiguration load(String name) {
        DefaultConfiguration conf = new DefaultConfiguration();
        URL url = DefaultConfiguration.class.getClassLoader().getResource(name);
        if (url != null) {
            try (InputStream in = Resources.asByteSource(url).openStream()) {
                conf.props.load(in);
            } catch (IOException ex) {
                throw new UncheckedIOException("failed to load " + name, ex);
            }
        }
        // use defaults if configuration resource not found
        return conf;
    }

    static class ConfigurationLoader extends CacheLoader<String, DefaultConfiguration> {
        @Override
        public DefaultConfiguration load(String name) {
            return DefaultConfiguration.load(name);
        }
    }

    @SuppressWarnings("ClassNameSameAsAncestorName")
    static class Provider implements Configuration.Provider {
        private final LoadingCache<String, DefaultConfiguration> cache =
            CacheBuilder.newBuilder().build(new ConfigurationLoader());

        @Override
        public Configuration load(String name) {
            return cache.getUnchecked(requireNonNull(name));
        }
    }
}
