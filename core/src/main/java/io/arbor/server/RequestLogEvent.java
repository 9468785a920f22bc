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

import java.util.Objects;

/**
 * Emitted once per dispatched request, after its handler returned.
 *
 * Instances of this class are immutable.
 */
public final class RequestLogEvent {

    private final String method;
    private final String path;
    private final double elapsedTime;

    public RequestLogEvent(final String method, final String path, final double elapsedTime) {
        this.method = Objects.requireNonNull(method);
        this.path = Objects.requireNonNull(path);
        this.elapsedTime = elapsedTime;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return the wall clock time between the start of parameter resolution and the handler returning, in milliseconds
     */
    public double getElapsedTime() {
        return elapsedTime;
    }

    @Override
    public String toString() {
        return "RequestLogEvent{" + "method=" + method + ", path=" + path + ", elapsedTime=" + elapsedTime + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 41 * hash + method.hashCode();
        hash = 41 * hash + path.hashCode();
        hash = 41 * hash + Double.hashCode(elapsedTime);
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
        final RequestLogEvent other = (RequestLogEvent) obj;
        return method.equals(other.method)
                && path.equals(other.path)
                && Double.compare(elapsedTime, other.elapsedTime) == 0;
    }
}
