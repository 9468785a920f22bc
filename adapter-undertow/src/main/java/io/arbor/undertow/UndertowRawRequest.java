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

package io.arbor.undertow;

import io.arbor.server.RawRequest;
import io.arbor.server.RouteRequest;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.PathTemplateMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Exposes an {@link HttpServerExchange} routed by a {@link io.undertow.server.RoutingHandler} to the dispatcher.
 */
public class UndertowRawRequest implements RawRequest {

    private final HttpServerExchange exchange;

    public UndertowRawRequest(final HttpServerExchange exchange) {
        this.exchange = exchange;
    }

    @Override
    public String getMethod() {
        return exchange.getRequestMethod().toString();
    }

    @Override
    public String getPath() {
        return exchange.getRequestPath();
    }

    @Override
    public String getPathParameter(final String name) {
        final PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        if (match == null) {
            return null;
        }
        return match.getParameters().get(name);
    }

    @Override
    public List<String> getQueryParameter(final String name) {
        final Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(values);
    }

    public HttpServerExchange getExchange() {
        return exchange;
    }

    /**
     * @return the exchange a routed request was received on, or null if it was not received by this adapter
     */
    public static HttpServerExchange exchange(final RouteRequest request) {
        if (request.getRawRequest() instanceof UndertowRawRequest) {
            return ((UndertowRawRequest) request.getRawRequest()).exchange;
        }
        return null;
    }
}
