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

import io.arbor.server.MiddlewareFactory;
import io.arbor.server.RequestHandler;
import io.arbor.util.HttpMethod;
import io.arbor.util.ParameterDescriptor;
import io.arbor.util.ParsedPath;
import io.arbor.util.PathTemplateParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A route as seen from one node of the tree: the full path from that node down to the node that defines the handlers,
 * with the middlewares and parameters of every node along the way merged in.
 * <p>
 * Middlewares are ordered outermost ancestor first. When two nodes declare a parameter with the same name the
 * declaration of the deeper node wins.
 *
 * Instances of this class are immutable.
 */
public final class RouteEntry {

    private final String fullUrlPath;
    private final String fullQueryPath;
    private final List<MiddlewareFactory> middlewares;
    private final Map<String, ParameterDescriptor> pathParameters;
    private final Map<String, ParameterDescriptor> queryParameters;
    private final List<ParsedPath.Segment> segments;
    private final Map<HttpMethod, RequestHandler> handlers;
    private final RouteNode origin;

    private RouteEntry(
            final String fullUrlPath,
            final String fullQueryPath,
            final List<MiddlewareFactory> middlewares,
            final Map<String, ParameterDescriptor> pathParameters,
            final Map<String, ParameterDescriptor> queryParameters,
            final List<ParsedPath.Segment> segments,
            final Map<HttpMethod, RequestHandler> handlers,
            final RouteNode origin
    ) {
        this.fullUrlPath = fullUrlPath;
        this.fullQueryPath = fullQueryPath;
        this.middlewares = List.copyOf(middlewares);
        this.pathParameters = Collections.unmodifiableMap(pathParameters);
        this.queryParameters = Collections.unmodifiableMap(queryParameters);
        this.segments = List.copyOf(segments);
        this.handlers = handlers;
        this.origin = Objects.requireNonNull(origin);
    }

    /**
     * Creates the entry for the handlers a node defines itself, relative to that node.
     */
    static RouteEntry of(final RouteNode node) {
        final ParsedPath path = node.getParsedPath();
        return new RouteEntry(
                path.getUrlPath(),
                path.getQueryTemplate(),
                node.getMiddlewares(),
                new LinkedHashMap<>(path.getPathParameters()),
                new LinkedHashMap<>(path.getQueryParameters()),
                path.getSegments(),
                node.getHandlers(),
                node
        );
    }

    /**
     * Creates the entry as seen from the given ancestor: the ancestor's path, middlewares and parameters go in front
     * of this entry's own.
     */
    RouteEntry prefixedWith(final RouteNode ancestor) {
        final ParsedPath path = ancestor.getParsedPath();

        final List<MiddlewareFactory> mergedMiddlewares = new ArrayList<>(ancestor.getMiddlewares());
        mergedMiddlewares.addAll(middlewares);

        final Map<String, ParameterDescriptor> mergedPathParameters = new LinkedHashMap<>(path.getPathParameters());
        mergedPathParameters.putAll(pathParameters);
        final Map<String, ParameterDescriptor> mergedQueryParameters = new LinkedHashMap<>(path.getQueryParameters());
        mergedQueryParameters.putAll(queryParameters);

        final List<ParsedPath.Segment> mergedSegments = new ArrayList<>(path.getSegments());
        mergedSegments.addAll(segments);

        return new RouteEntry(
                path.getUrlPath() + fullUrlPath,
                PathTemplateParser.joinQueryTemplates(path.getQueryTemplate(), fullQueryPath),
                mergedMiddlewares,
                mergedPathParameters,
                mergedQueryParameters,
                mergedSegments,
                handlers,
                origin
        );
    }

    /**
     * @return the concatenated url paths of every node from the table owner down to the origin node
     */
    public String getFullUrlPath() {
        return fullUrlPath;
    }

    /**
     * @return the query templates of every node along the way, joined with '&amp;'
     */
    public String getFullQueryPath() {
        return fullQueryPath;
    }

    public List<MiddlewareFactory> getMiddlewares() {
        return middlewares;
    }

    public Map<String, ParameterDescriptor> getPathParameters() {
        return pathParameters;
    }

    public Map<String, ParameterDescriptor> getQueryParameters() {
        return queryParameters;
    }

    public List<ParsedPath.Segment> getSegments() {
        return segments;
    }

    public Map<HttpMethod, RequestHandler> getHandlers() {
        return handlers;
    }

    /**
     * @return the handler serving requests with the given method, falling back to the {@code ALL} handler, or null
     */
    public RequestHandler getHandler(final HttpMethod method) {
        final RequestHandler handler = handlers.get(method);
        return handler != null ? handler : handlers.get(HttpMethod.ALL);
    }

    /**
     * @return the node that defines the handlers of this route
     */
    public RouteNode getOrigin() {
        return origin;
    }

    @Override
    public String toString() {
        return "RouteEntry{" + "fullUrlPath=" + fullUrlPath + ", fullQueryPath=" + fullQueryPath + ", middlewares="
                + middlewares.size() + ", methods=" + handlers.keySet() + '}';
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 67 * hash + fullUrlPath.hashCode();
        hash = 67 * hash + fullQueryPath.hashCode();
        hash = 67 * hash + middlewares.hashCode();
        hash = 67 * hash + handlers.hashCode();
        hash = 67 * hash + System.identityHashCode(origin);
        return hash;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final RouteEntry other = (RouteEntry) obj;
        return origin == other.origin
                && fullUrlPath.equals(other.fullUrlPath)
                && fullQueryPath.equals(other.fullQueryPath)
                && middlewares.equals(other.middlewares)
                && pathParameters.equals(other.pathParameters)
                && queryParameters.equals(other.queryParameters)
                && segments.equals(other.segments)
                && handlers.equals(other.handlers);
    }
}
