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

import io.arbor.router.RouteEntry;
import io.arbor.router.RouteNode;
import io.arbor.server.RequestLogListener;
import io.arbor.server.RouteDispatcher;
import io.arbor.util.HttpMethod;

/**
 * Utility methods for assembling route trees.
 */
public class Routes {

    /**
     * Creates a root node.
     *
     * @param path the path template of the node, may be empty
     * @return a new node
     */
    public static RouteNode path(final String path) {
        return new RouteNode(path);
    }

    /**
     * Creates a node that is meant to be nested inside the given parent, and nests it.
     *
     * @param parent the parent
     * @param path   the path template of the node, relative to the parent
     * @return the new node
     */
    public static RouteNode nested(final RouteNode parent, final String path) {
        final RouteNode child = new RouteNode(path);
        parent.nested(child);
        return child;
    }

    /**
     * Creates a dispatcher that writes request log events to the {@code io.arbor.request} category.
     *
     * @param route  the route
     * @param method the method
     * @return the dispatcher
     */
    public static RouteDispatcher dispatcher(final RouteEntry route, final HttpMethod method) {
        return new RouteDispatcher(route, method, RequestLogListener.LOGGING);
    }

    private Routes() {

    }
}
