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

package io.arbor.server;

import io.arbor.ArborLogger;
import io.arbor.ArborMessages;

import java.util.List;

/**
 * Links middlewares and a route handler into a single handler.
 * <p>
 * Each middleware is created once, here, and {@code init} is called with the stage that follows it: the next
 * middleware, or the route handler for the last one. The returned handler is the first middleware, or the route
 * handler itself if there are no middlewares.
 */
public final class MiddlewareChainBuilder {

    private MiddlewareChainBuilder() {
    }

    /**
     * @param middlewares the middlewares, outermost first
     * @param handler     the route handler
     * @param path        the route, used in messages only
     * @return the composed handler
     * @throws MiddlewareInitException if a middleware cannot be created or its {@code init} fails
     */
    public static RequestHandler build(
            final List<MiddlewareFactory> middlewares,
            final RequestHandler handler,
            final String path
    ) {
        if (handler == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("handler");
        }
        if (middlewares.isEmpty()) {
            return handler;
        }
        final Middleware first = create(middlewares.get(0), path);
        Middleware previous = first;
        for (int i = 1; i < middlewares.size(); ++i) {
            final Middleware next = create(middlewares.get(i), path);
            init(previous, next, path);
            previous = next;
        }
        init(previous, handler, path);
        ArborLogger.ROOT_LOGGER.middlewareChainBuilt(middlewares.size() + 1, path);
        return first;
    }

    private static Middleware create(final MiddlewareFactory factory, final String path) {
        final Middleware middleware;
        try {
            middleware = factory.create();
        } catch (Exception e) {
            throw ArborMessages.MESSAGES.middlewareInitFailed(String.valueOf(factory), path, e);
        }
        if (middleware == null) {
            throw ArborMessages.MESSAGES.middlewareInitFailed(String.valueOf(factory), path,
                    ArborMessages.MESSAGES.argumentCannotBeNull("middleware"));
        }
        return middleware;
    }

    private static void init(final Middleware middleware, final RequestHandler next, final String path) {
        try {
            middleware.init(next);
        } catch (Exception e) {
            throw ArborMessages.MESSAGES.middlewareInitFailed(middleware.getClass().getName(), path, e);
        }
    }
}
