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

import io.arbor.ArborMessages;
import io.arbor.router.RouteEntry;
import io.arbor.util.AttachmentKey;
import io.arbor.util.HttpMethod;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * A request that was matched to a route, as seen by middlewares and handlers. Path and query parameters have been
 * converted according to the parameters the route declares.
 * <p>
 * Attachments let middlewares hand values to later stages of the same request.
 */
public class RouteRequest {

    private final RawRequest rawRequest;
    private final RouteEntry route;
    private final HttpMethod method;
    private final Map<String, Object> pathParameters;
    private final Map<String, Object> queryParameters;
    private Map<AttachmentKey<?>, Object> attachments;

    public RouteRequest(
            final RawRequest rawRequest,
            final RouteEntry route,
            final Map<String, Object> pathParameters,
            final Map<String, Object> queryParameters
    ) {
        this.rawRequest = rawRequest;
        this.route = route;
        this.method = HttpMethod.fromString(rawRequest.getMethod());
        this.pathParameters = Collections.unmodifiableMap(pathParameters);
        this.queryParameters = Collections.unmodifiableMap(queryParameters);
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getPath() {
        return rawRequest.getPath();
    }

    public RawRequest getRawRequest() {
        return rawRequest;
    }

    public RouteEntry getRoute() {
        return route;
    }

    /**
     * @return the converted path parameters. Parameters whose raw value could not be converted are absent.
     */
    public Map<String, Object> getPathParameters() {
        return pathParameters;
    }

    public Object getPathParameter(final String name) {
        return pathParameters.get(name);
    }

    /**
     * @return the converted query parameters. Array parameters map to a {@link java.util.List}.
     */
    public Map<String, Object> getQueryParameters() {
        return queryParameters;
    }

    public Object getQueryParameter(final String name) {
        return queryParameters.get(name);
    }

    public <T> T getAttachment(final AttachmentKey<T> key) {
        if (key == null || attachments == null) {
            return null;
        }
        return key.cast(attachments.get(key));
    }

    public <T> T putAttachment(final AttachmentKey<T> key, final T value) {
        if (key == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("key");
        }
        if (attachments == null) {
            attachments = new IdentityHashMap<>(5);
        }
        return key.cast(attachments.put(key, key.cast(value)));
    }

    public <T> T removeAttachment(final AttachmentKey<T> key) {
        if (key == null || attachments == null) {
            return null;
        }
        return key.cast(attachments.remove(key));
    }

    @Override
    public String toString() {
        return "RouteRequest{" + method + " " + getPath() + ", route=" + route.getFullUrlPath() + '}';
    }
}
