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

/**
 * The types a path or query parameter may be declared with.
 * <p>
 * {@link #REGEX} is never written in a template. It is the type of a parameter that only declares a
 * {@code {pattern}} override, i.e. {@code <code: {^[A-Z]{3}$}>}.
 */
public enum ParameterType {

    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    REGEX("regex");

    private final String typeName;

    ParameterType(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * Converts a raw value to this type.
     *
     * @param value The raw value, never null
     * @return The converted value, or null if the value cannot be represented by this type
     */
    Object convert(final String value) {
        switch (this) {
            case STRING:
            case REGEX:
                return value;
            case NUMBER:
                return parseNumber(value);
            case BOOLEAN:
                if (value.equalsIgnoreCase("true")) {
                    return Boolean.TRUE;
                } else if (value.equalsIgnoreCase("false")) {
                    return Boolean.FALSE;
                }
                return null;
            default:
                throw new IllegalStateException();
        }
    }

    private static Number parseNumber(final String value) {
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            try {
                return Long.valueOf(value);
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
    }

    /**
     * Returns the type with the given template name. {@code regex} is not a template name.
     *
     * @param typeName The name as written in a template
     * @return The type, or null if the name is not a declarable type
     */
    public static ParameterType forName(final String typeName) {
        for (ParameterType type : values()) {
            if (type != REGEX && type.typeName.equals(typeName)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
