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

package io.arbor.util;

import io.arbor.ArborMessages;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The methods a route node can define handlers for. {@link #ALL} stands for every other method.
 */
public enum HttpMethod {

    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS,
    ALL;

    /**
     * Every method except {@link #ALL}.
     */
    public static final Set<HttpMethod> CONCRETE = Collections.unmodifiableSet(EnumSet.range(GET, OPTIONS));

    /**
     * @return The method name as sent on the wire, i.e. {@code GET}.
     */
    public String methodName() {
        return name();
    }

    /**
     * Parses a request method name, ignoring case.
     *
     * @param method The method name
     * @return The method
     * @throws IllegalArgumentException If the method is not one of the supported methods
     */
    public static HttpMethod fromString(final String method) {
        if (method == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("method");
        }
        try {
            return valueOf(method.toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException e) {
            throw ArborMessages.MESSAGES.unsupportedMethod(method);
        }
    }
}
