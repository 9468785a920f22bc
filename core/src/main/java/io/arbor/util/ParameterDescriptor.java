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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A typed path or query parameter declared by a path template.
 *
 * Instances of this class are immutable.
 */
public class ParameterDescriptor {

    private final String name;
    private final Set<ParameterType> types;
    private final boolean array;
    private final boolean optional;
    private final Pattern regex;
    private final List<String> allowedValues;

    public ParameterDescriptor(
            final String name,
            final Set<ParameterType> types,
            final boolean array,
            final boolean optional,
            final Pattern regex,
            final List<String> allowedValues
    ) {
        this.name = Objects.requireNonNull(name);
        this.types = Collections.unmodifiableSet(new LinkedHashSet<>(types));
        this.array = array;
        this.optional = optional;
        this.regex = regex;
        this.allowedValues = Collections.unmodifiableList(new ArrayList<>(allowedValues));
        if (this.types.isEmpty()) {
            throw new IllegalArgumentException("No type declared for parameter " + name);
        }
    }

    /**
     * Creates a plain descriptor, neither array nor optional, without a pattern.
     */
    public static ParameterDescriptor of(final String name, final ParameterType... types) {
        final Set<ParameterType> set = new LinkedHashSet<>();
        Collections.addAll(set, types);
        return new ParameterDescriptor(name, set, false, false, null, List.of());
    }

    public String getName() {
        return name;
    }

    /**
     * @return The declared types, in declaration order.
     */
    public Set<ParameterType> getTypes() {
        return types;
    }

    public boolean isArray() {
        return array;
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * @return The pattern override, or null if none was declared.
     */
    public Pattern getRegex() {
        return regex;
    }

    /**
     * @return The literal values of an enum declaration such as {@code string(asc|desc)}. Empty if any value is allowed.
     */
    public List<String> getAllowedValues() {
        return allowedValues;
    }

    /**
     * Converts a raw request value according to this descriptor. A value that does not match the pattern, is not one
     * of the allowed values, or cannot be converted to any of the declared types is dropped.
     *
     * @param value The raw value
     * @return The converted value, or null if the value was dropped
     */
    public Object convert(final String value) {
        if (value == null) {
            return null;
        }
        if (regex != null && !regex.matcher(value).find()) {
            return null;
        }
        if (!allowedValues.isEmpty() && !allowedValues.contains(value)) {
            return null;
        }
        for (ParameterType type : types) {
            final Object converted = type.convert(value);
            if (converted != null) {
                return converted;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "ParameterDescriptor{" + "name=" + name + ", types=" + types + ", array=" + array
                + ", optional=" + optional + ", regex=" + regex + ", allowedValues=" + allowedValues + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 31 * hash + name.hashCode();
        hash = 31 * hash + types.hashCode();
        hash = 31 * hash + (array ? 1 : 0);
        hash = 31 * hash + (optional ? 1 : 0);
        hash = 31 * hash + (regex == null ? 0 : regex.pattern().hashCode());
        hash = 31 * hash + allowedValues.hashCode();
        return hash;
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
        final ParameterDescriptor other = (ParameterDescriptor) obj;
        if (array != other.array || optional != other.optional) {
            return false;
        }
        if (!name.equals(other.name) || !types.equals(other.types) || !allowedValues.equals(other.allowedValues)) {
            return false;
        }
        if (regex == null || other.regex == null) {
            return regex == other.regex;
        }
        return regex.pattern().equals(other.regex.pattern());
    }
}
