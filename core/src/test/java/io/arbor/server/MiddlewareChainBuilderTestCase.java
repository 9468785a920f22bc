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

import io.arbor.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Category(UnitTest.class)
public class MiddlewareChainBuilderTestCase {

    private static RouteRequest request() {
        return new RouteRequest(new MockRawRequest("GET", "/"), null, Map.of(), Map.of());
    }

    private static MiddlewareFactory recording(final String name, final List<String> calls) {
        return () -> new AbstractMiddleware() {
            @Override
            public Object handleRequest(final RouteRequest request) throws Exception {
                calls.add(name);
                return getNext().handleRequest(request);
            }
        };
    }

    @Test
    public void testEmptyChainIsTheHandler() {
        final RequestHandler handler = request -> "done";
        Assert.assertSame(handler, MiddlewareChainBuilder.build(List.of(), handler, "/"));
    }

    @Test
    public void testMiddlewaresRunOutermostFirst() throws Exception {
        final List<String> calls = new ArrayList<>();
        final RequestHandler chain = MiddlewareChainBuilder.build(
                List.of(recording("outer", calls), recording("inner", calls)),
                request -> {
                    calls.add("handler");
                    return "done";
                },
                "/");
        Assert.assertEquals("done", chain.handleRequest(request()));
        Assert.assertEquals(List.of("outer", "inner", "handler"), calls);
    }

    @Test
    public void testMiddlewareCanShortCircuit() throws Exception {
        final MiddlewareFactory deny = () -> new AbstractMiddleware() {
            @Override
            public Object handleRequest(final RouteRequest request) {
                return "denied";
            }
        };
        final AtomicInteger handled = new AtomicInteger();
        final RequestHandler chain = MiddlewareChainBuilder.build(List.of(deny), request -> handled.incrementAndGet(), "/");
        Assert.assertEquals("denied", chain.handleRequest(request()));
        Assert.assertEquals(0, handled.get());
    }

    @Test
    public void testEachMiddlewareIsCreatedAndInitializedOnce() throws Exception {
        final AtomicInteger created = new AtomicInteger();
        final AtomicInteger initialized = new AtomicInteger();
        final MiddlewareFactory counting = () -> {
            created.incrementAndGet();
            return new AbstractMiddleware() {
                @Override
                public void init(final RequestHandler next) throws Exception {
                    initialized.incrementAndGet();
                    super.init(next);
                }
            };
        };
        final RequestHandler chain = MiddlewareChainBuilder.build(List.of(counting), request -> "done", "/");
        chain.handleRequest(request());
        chain.handleRequest(request());
        Assert.assertEquals(1, created.get());
        Assert.assertEquals(1, initialized.get());
    }

    @Test
    public void testInitFailureIsWrapped() {
        final IllegalStateException cause = new IllegalStateException("no database");
        final MiddlewareFactory failing = () -> new AbstractMiddleware() {
            @Override
            public void init(final RequestHandler next) {
                throw cause;
            }
        };
        final MiddlewareInitException e = Assert.assertThrows(MiddlewareInitException.class,
                () -> MiddlewareChainBuilder.build(List.of(failing), request -> "done", "/users"));
        Assert.assertSame(cause, e.getCause());
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("/users"));
    }

    @Test
    public void testFactoryFailureIsWrapped() {
        final Exception cause = new Exception("boom");
        final MiddlewareFactory failing = () -> {
            throw cause;
        };
        final MiddlewareInitException e = Assert.assertThrows(MiddlewareInitException.class,
                () -> MiddlewareChainBuilder.build(List.of(failing), request -> "done", "/"));
        Assert.assertSame(cause, e.getCause());

        Assert.assertThrows(MiddlewareInitException.class,
                () -> MiddlewareChainBuilder.build(List.of(() -> null), request -> "done", "/"));
    }
}
