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

import io.arbor.router.RouteEntry;
import io.arbor.util.ParameterDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the raw parameter values of a request according to the parameters a route declares.
 * <p>
 * Conversion never fails a request: a value that does not convert is left out of the result, and values for
 * parameters the route does not declare are ignored.
 *
 * Instances of this class are immutable and thread-safe.
 */
public final class ParameterResolver {

    private final Collection<ParameterDescriptor> pathParameters;
    private final Collection<ParameterDescriptor> queryParameters;

    public ParameterResolver(
            final Map<String, ParameterDescriptor> pathParameters,
            final Map<String, ParameterDescriptor> queryParameters
    ) {
        this.pathParameters = List.copyOf(pathParameters.values());
        this.queryParameters = List.copyOf(queryParameters.values());
    }

    public static ParameterResolver forRoute(final RouteEntry route) {
        return new ParameterResolver(route.getPathParameters(), route.getQueryParameters());
    }

    public Map<String, Object> resolvePathParameters(final RawRequest request) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (ParameterDescriptor descriptor : pathParameters) {
            final String value = request.getPathParameter(descriptor.getName());
            if (value == null || value.isEmpty()) {
                continue;
            }
            final Object converted = descriptor.convert(value);
            if (converted != null) {
                result.put(descriptor.getName(), converted);
            }
        }
        return result;
    }

    /**
     * Array parameters resolve to the list of every value that converts. Other parameters resolve to the first value
     * that converts.
     */
    public Map<String, Object> resolveQueryParameters(final RawRequest request) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (ParameterDescriptor descriptor : queryParameters) {
            final List<String> values = request.getQueryParameter(descriptor.getName());
            if (values == null || values.isEmpty()) {
                continue;
            }
            if (descriptor.isArray()) {
                final List<Object> converted = new ArrayList<>(values.size());
                for (String value : values) {
                    final Object item = descriptor.convert(value);
                    if (item != null) {
                        converted.add(item);
                    }
                }
                if (!converted.isEmpty()) {
                    result.put(descriptor.getName(), List.copyOf(converted));
                }
            } else {
                for (String value : values) {
                    final Object converted = descriptor.convert(value);
                    if (converted != null) {
                        result.put(descriptor.getName(), converted);
                        break;
                    }
                }
            }
        }
        return result;
    }
}
