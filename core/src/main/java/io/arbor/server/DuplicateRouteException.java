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
 * Thrown at registration when two nodes declare the same full path and
 * {@link io.arbor.ArborOptions#REJECT_DUPLICATE_ROUTES} is enabled.
 */
public class DuplicateRouteException extends IllegalStateException {

    private static final long serialVersionUID = 5027013325938612473L;

    public DuplicateRouteException(String message) {
        super(message);
    }
}
