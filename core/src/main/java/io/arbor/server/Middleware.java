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

/**
 * A stage of a middleware chain.
 * <p>
 * A middleware is instantiated once per registered route and method, and {@link #init(RequestHandler)} is called
 * once, before the first request. The same instance then handles every request routed through it, concurrently,
 * so fields must only hold configuration that is set up by {@code init} and never changed by
 * {@link #handleRequest(RouteRequest)}.
 */
public interface Middleware extends RequestHandler {

    /**
     * Binds the next stage of the chain. An exception thrown here aborts route registration.
     *
     * @param next the next middleware, or the route handler for the last middleware of a chain
     */
    void init(RequestHandler next) throws Exception;
}
