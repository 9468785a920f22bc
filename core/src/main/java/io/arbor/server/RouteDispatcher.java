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
import io.arbor.router.RouteEntry;
import io.arbor.util.HttpMethod;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for requests matched to one route and method.
 * <p>
 * The middleware chain is built once, when the dispatcher is created. For each request the raw parameter values are
 * converted, the chain is invoked, and a {@link RequestLogEvent} is emitted once the handler's result is available.
 * For a {@link CompletionStage} result that is when the stage completes normally.
 * <p>
 * Exceptions thrown by middlewares or handlers are not caught: they propagate to the transport adapter, and no event
 * is emitted for such requests.
 */
public class RouteDispatcher {

    private final RouteEntry route;
    private final HttpMethod method;
    private final RequestHandler chain;
    private final ParameterResolver parameterResolver;
    private final RequestLogListener logListener;

    /**
     * @param route       the route
     * @param method      the method requests are dispatched for
     * @param logListener the listener for request log events, or null to not emit events
     * @throws IllegalStateException   if the route has no handler for the method
     * @throws MiddlewareInitException if the middleware chain cannot be built
     */
    public RouteDispatcher(final RouteEntry route, final HttpMethod method, final RequestLogListener logListener) {
        this.route = route;
        this.method = method;
        final RequestHandler handler = route.getHandler(method);
        if (handler == null) {
            throw ArborMessages.MESSAGES.noHandlersDefined(route.getFullUrlPath());
        }
        this.chain = MiddlewareChainBuilder.build(route.getMiddlewares(), handler, route.getFullUrlPath());
        this.parameterResolver = ParameterResolver.forRoute(route);
        this.logListener = logListener;
    }

    public Object dispatch(final RawRequest rawRequest) throws Exception {
        final long start = System.nanoTime();
        final RouteRequest request = new RouteRequest(
                rawRequest,
                route,
                parameterResolver.resolvePathParameters(rawRequest),
                parameterResolver.resolveQueryParameters(rawRequest)
        );
        final Object result = chain.handleRequest(request);
        if (logListener != null) {
            if (result instanceof CompletionStage) {
                ((CompletionStage<?>) result).whenComplete((value, failure) -> {
                    if (failure == null) {
                        requestLogged(rawRequest, start);
                    }
                });
            } else {
                requestLogged(rawRequest, start);
            }
        }
        return result;
    }

    private void requestLogged(final RawRequest rawRequest, final long start) {
        final double elapsedTime = (System.nanoTime() - start) / (double) TimeUnit.MILLISECONDS.toNanos(1);
        try {
            logListener.requestLogged(new RequestLogEvent(rawRequest.getMethod(), rawRequest.getPath(), elapsedTime));
        } catch (RuntimeException e) {
            ArborLogger.REQUEST_LOGGER.requestLogListenerFailed(logListener, e);
        }
    }

    public RouteEntry getRoute() {
        return route;
    }

    public HttpMethod getMethod() {
        return method;
    }
}
