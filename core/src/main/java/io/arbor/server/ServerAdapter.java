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
import io.arbor.ArborOptions;
import io.arbor.router.RouteEntry;
import io.arbor.router.RouteNode;
import io.arbor.util.HttpMethod;
import io.arbor.util.ParameterDescriptor;
import io.arbor.util.ParsedPath;
import org.xnio.OptionMap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for transport adapters, which register the routes of a tree with an actual HTTP server.
 * <p>
 * Adapters must override {@link #translatePathParameter(String, ParameterDescriptor)}, which turns a declared
 * parameter such as {@code <id: number>} into the template syntax of the server, and
 * {@link #initialize(List)}, which registers the translated routes. For each request the adapter then hands a
 * {@link RawRequest} to the {@link RouteDispatcher} of the matching route and writes the returned value back.
 */
public abstract class ServerAdapter {

    private final OptionMap options;
    private volatile RequestLogListener requestLogListener = RequestLogListener.LOGGING;

    protected ServerAdapter(final OptionMap options) {
        if (options == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("options");
        }
        this.options = options;
    }

    protected ServerAdapter() {
        this(OptionMap.EMPTY);
    }

    /**
     * Translates a path parameter to the template syntax of the server, i.e. {@code :id} or {@code {id}}.
     *
     * @param name       the parameter name
     * @param descriptor the declared parameter
     * @return the translated segment
     */
    protected String translatePathParameter(final String name, final ParameterDescriptor descriptor) {
        throw ArborMessages.MESSAGES.unimplementedCollaboratorMethod(getClass().getName(), "translatePathParameter");
    }

    /**
     * Registers the routes with the server.
     *
     * @param routes the routes, in tree order
     */
    protected void initialize(final List<RegisteredRoute> routes) throws Exception {
        throw ArborMessages.MESSAGES.unimplementedCollaboratorMethod(getClass().getName(), "initialize");
    }

    /**
     * Registers every route of the tree below and including the given root.
     */
    public void start(final RouteNode root) throws Exception {
        initialize(getRegisteredRoutes(root));
    }

    /**
     * Builds a dispatcher for every route and method of the tree. Middleware chains are built here, so a failing
     * middleware fails this call.
     *
     * @throws DuplicateRouteException if two nodes declare the same full path and
     *                                 {@link ArborOptions#REJECT_DUPLICATE_ROUTES} is set
     * @throws MiddlewareInitException if a middleware cannot be initialized
     */
    public List<RegisteredRoute> getRegisteredRoutes(final RouteNode root) {
        final boolean rejectDuplicates = options.get(ArborOptions.REJECT_DUPLICATE_ROUTES, false);
        if (rejectDuplicates) {
            rejectOverwrittenRoutes(root);
        }
        final RequestLogListener listener = options.get(ArborOptions.LOG_REQUESTS, true) ? requestLogListener : null;

        final List<RegisteredRoute> result = new ArrayList<>();
        final Map<String, RouteEntry> seen = new HashMap<>();
        for (RouteEntry entry : root.flatten()) {
            final RouteEntry previous = seen.put(entry.getFullUrlPath(), entry);
            if (previous != null) {
                if (rejectDuplicates) {
                    throw ArborMessages.MESSAGES.duplicateRoute(entry.getFullUrlPath(),
                            String.valueOf(previous.getOrigin()), String.valueOf(entry.getOrigin()));
                }
                ArborLogger.ROUTER_LOGGER.routeOverwritten(entry.getFullUrlPath(),
                        String.valueOf(entry.getOrigin()), String.valueOf(previous.getOrigin()));
            }
            final String path = translatePath(entry);
            for (HttpMethod method : entry.getHandlers().keySet()) {
                result.add(new RegisteredRoute(method, path, new RouteDispatcher(entry, method, listener)));
                ArborLogger.ROUTER_LOGGER.routeRegistered(method.methodName(), entry.getFullUrlPath(), path);
            }
        }
        return result;
    }

    private static void rejectOverwrittenRoutes(final RouteNode node) {
        for (Map.Entry<String, RouteNode> overwritten : node.getOverwrittenRoutes().entrySet()) {
            final RouteEntry winner = node.getRouteTable().get(overwritten.getKey());
            throw ArborMessages.MESSAGES.duplicateRoute(overwritten.getKey(),
                    String.valueOf(overwritten.getValue()), String.valueOf(winner.getOrigin()));
        }
        for (RouteNode child : node.getChildren()) {
            rejectOverwrittenRoutes(child);
        }
    }

    /**
     * Rebuilds the url path of a route from its segments, translating every path parameter.
     */
    public String translatePath(final RouteEntry route) {
        final StringBuilder path = new StringBuilder();
        for (ParsedPath.Segment segment : route.getSegments()) {
            path.append('/');
            if (segment.isParameter()) {
                path.append(translatePathParameter(segment.getValue(), route.getPathParameters().get(segment.getValue())));
            } else {
                path.append(segment.getValue());
            }
        }
        return path.length() == 0 ? "/" : path.toString();
    }

    public OptionMap getOptions() {
        return options;
    }

    public RequestLogListener getRequestLogListener() {
        return requestLogListener;
    }

    public ServerAdapter setRequestLogListener(final RequestLogListener requestLogListener) {
        if (requestLogListener == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("requestLogListener");
        }
        this.requestLogListener = requestLogListener;
        return this;
    }
}
