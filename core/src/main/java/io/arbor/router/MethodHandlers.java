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

package io.arbor.router;

import io.arbor.ArborMessages;
import io.arbor.server.RequestHandler;
import io.arbor.util.HttpMethod;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * The handlers a route node defines, per method.
 * <p>
 * Either {@link HttpMethod#ALL} is defined, or any subset of the concrete methods is: defining a concrete method
 * removes the {@code ALL} handler, and defining {@code ALL} removes every concrete handler. Defining a method that is
 * already defined replaces its handler.
 */
public final class MethodHandlers {

    private final EnumMap<HttpMethod, RequestHandler> handlers = new EnumMap<>(HttpMethod.class);

    /**
     * Defines the handler for a method.
     *
     * @param method  the method
     * @param handler the handler
     * @return this
     */
    public MethodHandlers define(final HttpMethod method, final RequestHandler handler) {
        if (method == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("method");
        }
        if (handler == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("handler");
        }
        if (method == HttpMethod.ALL) {
            handlers.clear();
        } else {
            handlers.remove(HttpMethod.ALL);
        }
        handlers.put(method, handler);
        return this;
    }

    /**
     * @return the handler defined for exactly this method, or null
     */
    public RequestHandler get(final HttpMethod method) {
        return handlers.get(method);
    }

    /**
     * @return the handler that serves a request with the given method: the handler for that method, or the
     * {@code ALL} handler, or null
     */
    public RequestHandler resolve(final HttpMethod method) {
        final RequestHandler handler = handlers.get(method);
        return handler != null ? handler : handlers.get(HttpMethod.ALL);
    }

    public boolean isDefined(final HttpMethod method) {
        return handlers.containsKey(method);
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public Set<HttpMethod> definedMethods() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * @return an immutable copy of the current handlers
     */
    public Map<HttpMethod, RequestHandler> snapshot() {
        return handlers.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new EnumMap<>(handlers));
    }

    @Override
    public String toString() {
        return "MethodHandlers" + handlers.keySet();
    }
}
