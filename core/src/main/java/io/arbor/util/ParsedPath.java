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

package io.arbor.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The result of parsing a path template with {@link PathTemplateParser#parse(String)}.
 *
 * Instances of this class are immutable.
 */
public class ParsedPath {

    //<editor-fold defaultstate="collapsed" desc="Segment inner classes">
    /**
     * Parent class for the parts of a path template that are separated by '/' characters.
     */
    public abstract static class Segment {

        private final String value;

        private Segment(final String value) {
            this.value = Objects.requireNonNull(value);
        }

        /**
         * @return The literal text, or the name of the referenced path parameter.
         */
        public String getValue() {
            return value;
        }

        public abstract boolean isParameter();

        @Override
        public int hashCode() {
            return 31 * value.hashCode() + (isParameter() ? 1 : 0);
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
            return value.equals(((Segment) obj).value);
        }
    }

    /**
     * Literal text that must appear as is in a requested path.
     */
    public static class LiteralSegment extends Segment {

        public LiteralSegment(final String value) {
            super(value);
        }

        @Override
        public boolean isParameter() {
            return false;
        }

        @Override
        public String toString() {
            return "LiteralSegment{" + getValue() + '}';
        }
    }

    /**
     * A reference to a declared path parameter.
     */
    public static class ParameterSegment extends Segment {

        public ParameterSegment(final String name) {
            super(name);
        }

        @Override
        public boolean isParameter() {
            return true;
        }

        @Override
        public String toString() {
            return "ParameterSegment{" + getValue() + '}';
        }
    }
    //</editor-fold>

    private final String template;
    private final String urlPath;
    private final String queryTemplate;
    private final Map<String, ParameterDescriptor> pathParameters;
    private final Map<String, ParameterDescriptor> queryParameters;
    private final List<Segment> segments;

    ParsedPath(
            final String template,
            final String urlPath,
            final String queryTemplate,
            final Map<String, ParameterDescriptor> pathParameters,
            final Map<String, ParameterDescriptor> queryParameters,
            final List<Segment> segments
    ) {
        this.template = template;
        this.urlPath = urlPath;
        this.queryTemplate = queryTemplate;
        this.pathParameters = Collections.unmodifiableMap(new LinkedHashMap<>(pathParameters));
        this.queryParameters = Collections.unmodifiableMap(new LinkedHashMap<>(queryParameters));
        this.segments = List.copyOf(segments);
    }

    /**
     * @return The template string this path was parsed from.
     */
    public String getTemplate() {
        return template;
    }

    /**
     * @return The template up to (excluding) the query section. Path parameters are kept in their declared form.
     */
    public String getUrlPath() {
        return urlPath;
    }

    /**
     * @return The query section without the leading '?'. Empty if the template has no query section.
     */
    public String getQueryTemplate() {
        return queryTemplate;
    }

    /**
     * @return The path parameters, in declaration order.
     */
    public Map<String, ParameterDescriptor> getPathParameters() {
        return pathParameters;
    }

    /**
     * @return The query parameters, in declaration order.
     */
    public Map<String, ParameterDescriptor> getQueryParameters() {
        return queryParameters;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    @Override
    public String toString() {
        return "ParsedPath{" + "template=" + template + ", segments=" + segments + ", pathParameters="
                + pathParameters.keySet() + ", queryParameters=" + queryParameters.keySet() + '}';
    }
}
