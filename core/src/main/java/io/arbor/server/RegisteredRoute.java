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

import io.arbor.router.RouteEntry;
import io.arbor.util.HttpMethod;

import java.util.Objects;

/**
 * A route and method ready to be registered with a transport: the path in the transport's own template syntax and the
 * dispatcher requests should be handed to.
 */
public final class RegisteredRoute {

    private final HttpMethod method;
    private final String path;
    private final RouteDispatcher dispatcher;

    public RegisteredRoute(final HttpMethod method, final String path, final RouteDispatcher dispatcher) {
        this.method = Objects.requireNonNull(method);
        this.path = Objects.requireNonNull(path);
        this.dispatcher = Objects.requireNonNull(dispatcher);
    }

    /**
     * @return the method, {@link HttpMethod#ALL} if the route serves every method
     */
    public HttpMethod getMethod() {
        return method;
    }

    /**
     * @return the path translated by {@link ServerAdapter#translatePathParameter}
     */
    public String getPath() {
        return path;
    }

    public RouteDispatcher getDispatcher() {
        return dispatcher;
    }

    public RouteEntry getRoute() {
        return dispatcher.getRoute();
    }

    @Override
    public String toString() {
        return "RegisteredRoute{" + method + " " + path + '}';
    }
}
