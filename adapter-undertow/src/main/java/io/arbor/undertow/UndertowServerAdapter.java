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

import io.arbor.ArborOptions;
import io.arbor.server.RegisteredRoute;
import io.arbor.server.ServerAdapter;
import io.arbor.util.HttpMethod;
import io.arbor.util.ParameterDescriptor;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import org.xnio.OptionMap;

import java.util.List;

/**
 * Registers route trees with an Undertow {@link RoutingHandler}.
 * <p>
 * Path parameters are translated to Undertow's {@code {name}} syntax; types and patterns are enforced by the
 * dispatcher, which drops values that do not convert. Routes for {@link HttpMethod#ALL} are registered for every
 * concrete method.
 *
 * <pre>
 * UndertowServerAdapter adapter = new UndertowServerAdapter();
 * adapter.start(root);
 * Undertow.builder().addHttpListener(8080, "localhost").setHandler(adapter.getHandler()).build().start();
 * </pre>
 */
public class UndertowServerAdapter extends ServerAdapter {

    private final RoutingHandler routingHandler = Handlers.routing(false);

    public UndertowServerAdapter(final OptionMap options) {
        super(options);
    }

    public UndertowServerAdapter() {
        super();
    }

    @Override
    protected String translatePathParameter(final String name, final ParameterDescriptor descriptor) {
        return "{" + name + "}";
    }

    @Override
    protected void initialize(final List<RegisteredRoute> routes) {
        for (RegisteredRoute route : routes) {
            final HttpHandler handler = new DispatchingHttpHandler(route.getDispatcher());
            if (route.getMethod() == HttpMethod.ALL) {
                for (HttpMethod method : HttpMethod.CONCRETE) {
                    routingHandler.add(method.methodName(), route.getPath(), handler);
                }
            } else {
                routingHandler.add(route.getMethod().methodName(), route.getPath(), handler);
            }
        }
    }

    /**
     * Sets the handler for requests that match no route. Defaults to a 404 response.
     */
    public UndertowServerAdapter setFallbackHandler(final HttpHandler fallbackHandler) {
        routingHandler.setFallbackHandler(fallbackHandler);
        return this;
    }

    /**
     * @return the handler to install on the server
     */
    public HttpHandler getHandler() {
        if (!getOptions().get(ArborOptions.TRIM_TRAILING_SLASH, false)) {
            return routingHandler;
        }
        return new HttpHandler() {
            @Override
            public void handleRequest(final HttpServerExchange exchange) throws Exception {
                final String path = exchange.getRelativePath();
                if (path.length() > 1 && path.endsWith("/")) {
                    exchange.setRelativePath(path.substring(0, path.length() - 1));
                }
                routingHandler.handleRequest(exchange);
            }
        };
    }
}
