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
import io.arbor.server.MiddlewareFactory;
import io.arbor.server.RequestHandler;
import io.arbor.util.HttpMethod;
import io.arbor.util.ParsedPath;
import io.arbor.util.PathTemplateParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * A node of a router tree.
 * <p>
 * A node has a path template, middlewares, handlers per method and nested child nodes. Every node keeps a route table
 * with one {@link RouteEntry} for each descendant that defines handlers, keyed by the full path from this node down to
 * that descendant. The tables of a node and of all of its ancestors are rebuilt whenever the node gains handlers,
 * middlewares or children, so looking up a route never walks the tree and the order in which a tree is assembled does
 * not change the result:
 *
 * <pre>
 * RouteNode root = Routes.path("");
 * RouteNode users = Routes.path("/users").nested(child -&gt; List.of(
 *         child.path("/&lt;id: number&gt;").get(request -&gt; findUser(request.getPathParameter("id")))));
 * root.nested(users);
 * root.middlewares(AuthenticationMiddleware::new);
 * // root.getRouteTable() now contains "/users/&lt;id: number&gt;", behind AuthenticationMiddleware
 * </pre>
 *
 * Trees are assembled by a single thread before requests are served. Nodes are not thread safe.
 */
public class RouteNode {

    /**
     * Creates nodes that are nested through {@link #nested(Function)}.
     */
    @FunctionalInterface
    public interface ChildFactory {

        RouteNode path(String path);
    }

    private final String path;
    private final ParsedPath parsedPath;
    private final List<RouteNode> children = new ArrayList<>();
    private final List<MiddlewareFactory> middlewares = new ArrayList<>();
    private final MethodHandlers handlers = new MethodHandlers();

    // Not owned, the parent owns this node through its children.
    private RouteNode parent;
    private boolean createdFromNested;

    private Map<String, RouteEntry> routeTable = Collections.emptyMap();
    private Map<String, RouteNode> overwrittenRoutes = Collections.emptyMap();

    public RouteNode(final String path) {
        this.path = path == null ? "" : path;
        this.parsedPath = PathTemplateParser.parse(this.path);
    }

    public RouteNode get(final RequestHandler handler) {
        return handle(HttpMethod.GET, handler);
    }

    public RouteNode post(final RequestHandler handler) {
        return handle(HttpMethod.POST, handler);
    }

    public RouteNode put(final RequestHandler handler) {
        return handle(HttpMethod.PUT, handler);
    }

    public RouteNode patch(final RequestHandler handler) {
        return handle(HttpMethod.PATCH, handler);
    }

    public RouteNode delete(final RequestHandler handler) {
        return handle(HttpMethod.DELETE, handler);
    }

    public RouteNode head(final RequestHandler handler) {
        return handle(HttpMethod.HEAD, handler);
    }

    public RouteNode options(final RequestHandler handler) {
        return handle(HttpMethod.OPTIONS, handler);
    }

    /**
     * Defines a handler for every method, removing any method specific handler.
     */
    public RouteNode all(final RequestHandler handler) {
        return handle(HttpMethod.ALL, handler);
    }

    /**
     * Defines the handler for a method. See {@link MethodHandlers} for how {@link HttpMethod#ALL} interacts with the
     * other methods.
     */
    public RouteNode handle(final HttpMethod method, final RequestHandler handler) {
        handlers.define(method, handler);
        TreeComposer.propagate(this);
        return this;
    }

    /**
     * Appends middlewares to this node. They apply to the handlers of this node and of every descendant, including
     * routes that were composed before this call.
     */
    public RouteNode middlewares(final MiddlewareFactory... middlewares) {
        return middlewares(Arrays.asList(middlewares));
    }

    public RouteNode middlewares(final List<? extends MiddlewareFactory> middlewares) {
        if (middlewares == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("middlewares");
        }
        for (MiddlewareFactory middleware : middlewares) {
            if (middleware == null) {
                throw ArborMessages.MESSAGES.argumentCannotBeNull("middleware");
            }
        }
        this.middlewares.addAll(middlewares);
        TreeComposer.propagate(this);
        return this;
    }

    public RouteNode nested(final RouteNode... children) {
        return nested(Arrays.asList(children));
    }

    /**
     * Nests the given nodes inside this node. A node can only be nested once.
     *
     * @throws IllegalStateException    if a node is already nested inside another node
     * @throws IllegalArgumentException if a node is this node or one of its ancestors
     */
    public RouteNode nested(final List<RouteNode> children) {
        if (children == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("children");
        }
        final Set<RouteNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (RouteNode child : children) {
            if (child == null) {
                throw ArborMessages.MESSAGES.argumentCannotBeNull("child");
            }
            if (!seen.add(child)) {
                throw ArborMessages.MESSAGES.nodeAlreadyAttached(child.path, path);
            }
            for (RouteNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
                if (ancestor == child) {
                    throw ArborMessages.MESSAGES.cyclicNesting(child.path);
                }
            }
            if (child.parent != null) {
                throw ArborMessages.MESSAGES.nodeAlreadyAttached(child.path, child.parent.path);
            }
        }
        for (RouteNode child : children) {
            child.parent = this;
            this.children.add(child);
        }
        TreeComposer.propagate(this);
        return this;
    }

    /**
     * Nests the nodes created by the given function, which receives a factory for the child nodes:
     *
     * <pre>
     * root.nested(child -&gt; List.of(child.path("/a").get(handlerA), child.path("/b").get(handlerB)));
     * </pre>
     */
    public RouteNode nested(final Function<ChildFactory, List<RouteNode>> children) {
        if (children == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("children");
        }
        return nested(children.apply(childPath -> {
            final RouteNode child = new RouteNode(childPath);
            child.createdFromNested = true;
            return child;
        }));
    }

    /**
     * Rebuilds the route table of this node from the current state of its children. Tables are kept up to date
     * automatically; rebuilding an unchanged tree yields an equal table.
     */
    public RouteNode compose() {
        TreeComposer.compose(this);
        return this;
    }

    /**
     * @return the route of this node's own handlers, if it has any, followed by every entry of the route table
     */
    public List<RouteEntry> flatten() {
        final List<RouteEntry> result = new ArrayList<>(routeTable.size() + 1);
        if (hasHandlers()) {
            result.add(RouteEntry.of(this));
        }
        result.addAll(routeTable.values());
        return result;
    }

    public String getPath() {
        return path;
    }

    public ParsedPath getParsedPath() {
        return parsedPath;
    }

    /**
     * @return the node this node is nested in, or null for a root node
     */
    public RouteNode getParent() {
        return parent;
    }

    public List<RouteNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<MiddlewareFactory> getMiddlewares() {
        return Collections.unmodifiableList(middlewares);
    }

    /**
     * @return an immutable copy of the handlers currently defined on this node
     */
    public Map<HttpMethod, RequestHandler> getHandlers() {
        return handlers.snapshot();
    }

    public Set<HttpMethod> getDefinedMethods() {
        return handlers.definedMethods();
    }

    public boolean hasHandlers() {
        return !handlers.isEmpty();
    }

    /**
     * @return true if this node was created by the child factory of {@link #nested(Function)}
     */
    public boolean isCreatedFromNested() {
        return createdFromNested;
    }

    /**
     * @return the routes of every descendant with handlers, keyed by full path relative to this node
     */
    public Map<String, RouteEntry> getRouteTable() {
        return routeTable;
    }

    /**
     * @return full paths of this node's route table that more than one descendant declares, mapped to the node whose
     * route was replaced
     */
    public Map<String, RouteNode> getOverwrittenRoutes() {
        return overwrittenRoutes;
    }

    void updateRouteTable(final Map<String, RouteEntry> routeTable, final Map<String, RouteNode> overwrittenRoutes) {
        this.routeTable = Collections.unmodifiableMap(routeTable);
        this.overwrittenRoutes = overwrittenRoutes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(overwrittenRoutes);
    }

    @Override
    public String toString() {
        return "RouteNode{" + "path=" + path + ", methods=" + handlers.definedMethods() + ", children="
                + children.size() + '}';
    }
}
