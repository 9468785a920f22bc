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
 * Thrown when a path template cannot be parsed. Path templates are parsed when routes are declared, so this always
 * surfaces while the route tree is being assembled.
 */
public class PathTemplateSyntaxException extends IllegalArgumentException {

    private static final long serialVersionUID = 6253428115672359031L;

    private final String template;
    private final String fragment;
    private final int position;

    public PathTemplateSyntaxException(String message, String template, String fragment, int position) {
        super(message);
        this.template = template;
        this.fragment = fragment;
        this.position = position;
    }

    public PathTemplateSyntaxException(String message, String template, String fragment, int position, Throwable cause) {
        super(message, cause);
        this.template = template;
        this.fragment = fragment;
        this.position = position;
    }

    public String getTemplate() {
        return template;
    }

    /**
     * @return The part of the template that could not be parsed.
     */
    public String getFragment() {
        return fragment;
    }

    /**
     * @return The 0-based index into the template where the fragment starts.
     */
    public int getPosition() {
        return position;
    }
}
