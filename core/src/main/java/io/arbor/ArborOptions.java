/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2026 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.arbor;

import java.util.Properties;

import org.xnio.Option;
import org.xnio.OptionMap;

/**
 * Options understood by the routing core and its transport adapters.
 */
public class ArborOptions {

    /**
     * Prefix used for option keys read from {@link Properties}, i.e. {@code arbor.reject-duplicate-routes}.
     */
    public static final String PROPERTY_PREFIX = "arbor.";

    /**
     * If two different nodes producing the same full path should fail route registration. Defaults to false, in which
     * case the last declared route wins and a warning is logged.
     */
    public static final Option<Boolean> REJECT_DUPLICATE_ROUTES = Option.simple(ArborOptions.class, "REJECT_DUPLICATE_ROUTES", Boolean.class);

    /**
     * If a request log event should be emitted once a handler has returned. Defaults to true.
     */
    public static final Option<Boolean> LOG_REQUESTS = Option.simple(ArborOptions.class, "LOG_REQUESTS", Boolean.class);

    /**
     * If the transport adapter should strip a trailing '/' from requested paths before matching. Defaults to false.
     */
    public static final Option<Boolean> TRIM_TRAILING_SLASH = Option.simple(ArborOptions.class, "TRIM_TRAILING_SLASH", Boolean.class);

    private static final Option<?>[] OPTIONS = {REJECT_DUPLICATE_ROUTES, LOG_REQUESTS, TRIM_TRAILING_SLASH};

    private ArborOptions() {

    }

    /**
     * Reads every known option from the given properties. Keys are the option names in lower case with '_' replaced
     * by '-', prefixed with {@link #PROPERTY_PREFIX}.
     *
     * @param properties The properties
     * @return The options that were present
     */
    public static OptionMap fromProperties(Properties properties) {
        OptionMap.Builder builder = OptionMap.builder();
        for (Option<?> option : OPTIONS) {
            String value = properties.getProperty(propertyName(option));
            if (value != null) {
                builder.parse(option, value.trim());
            }
        }
        return builder.getMap();
    }

    static String propertyName(Option<?> option) {
        return PROPERTY_PREFIX + option.getName().toLowerCase().replace('_', '-');
    }
}
