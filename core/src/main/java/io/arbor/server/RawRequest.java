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

import java.util.List;

/**
 * The view of a request a transport adapter hands to the dispatcher. All values are raw strings; conversion
 * according to the declared parameters happens in the dispatcher.
 */
public interface RawRequest {

    String getMethod();

    String getPath();

    /**
     * @param name the path parameter name
     * @return the raw value, or null if the transport did not match a value for the parameter
     */
    String getPathParameter(String name);

    /**
     * @param name the query parameter name
     * @return every raw value sent for the parameter, in request order. Never null.
     */
    List<String> getQueryParameter(String name);
}
