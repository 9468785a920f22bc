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

/**
 * A handler for a routed request. Handlers are the terminal stage of a middleware chain.
 */
@FunctionalInterface
public interface RequestHandler {

    /**
     * Handle the request.
     *
     * @param request the routed request
     * @return the response value handed back to the transport adapter. May be a
     *         {@link java.util.concurrent.CompletionStage} for responses that complete asynchronously.
     */
    Object handleRequest(RouteRequest request) throws Exception;
}
