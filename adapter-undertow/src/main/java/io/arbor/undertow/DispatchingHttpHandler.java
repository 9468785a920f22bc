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

import io.arbor.ArborLogger;
import io.arbor.server.RouteDispatcher;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.SameThreadExecutor;
import io.undertow.util.StatusCodes;

import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;

/**
 * Hands exchanges to a {@link RouteDispatcher} and writes the returned value to the response.
 * <p>
 * Route handlers may block, so requests are dispatched to a worker thread first. Exceptions thrown by the dispatcher
 * propagate to Undertow, which ends the exchange with a 500 response. A {@link CompletionStage} result keeps the
 * exchange open until the stage completes.
 */
public class DispatchingHttpHandler implements HttpHandler {

    private final RouteDispatcher dispatcher;

    public DispatchingHttpHandler(final RouteDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }
        final Object result = dispatcher.dispatch(new UndertowRawRequest(exchange));
        if (result instanceof CompletionStage) {
            final CompletionStage<?> stage = (CompletionStage<?>) result;
            exchange.dispatch(SameThreadExecutor.INSTANCE, () -> stage.whenComplete((value, failure) -> {
                if (failure != null) {
                    ArborLogger.REQUEST_LOGGER.exceptionProcessingRequest(failure);
                    if (!exchange.isResponseStarted()) {
                        exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
                    }
                    exchange.endExchange();
                } else {
                    send(exchange, value);
                }
            }));
        } else {
            send(exchange, result);
        }
    }

    static void send(final HttpServerExchange exchange, final Object value) {
        if (value == null) {
            exchange.endExchange();
        } else if (value instanceof String) {
            exchange.getResponseSender().send((String) value);
        } else if (value instanceof byte[]) {
            exchange.getResponseSender().send(ByteBuffer.wrap((byte[]) value));
        } else if (value instanceof ByteBuffer) {
            exchange.getResponseSender().send((ByteBuffer) value);
        } else {
            exchange.getResponseSender().send(value.toString());
        }
    }

    public RouteDispatcher getDispatcher() {
        return dispatcher;
    }
}
