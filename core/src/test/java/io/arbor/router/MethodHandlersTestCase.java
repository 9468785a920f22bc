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

package io.arbor.router;

import io.arbor.server.RequestHandler;
import io.arbor.testutils.category.UnitTest;
import io.arbor.util.HttpMethod;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.util.EnumSet;
import java.util.Map;

@Category(UnitTest.class)
public class MethodHandlersTestCase {

    private static final RequestHandler FIRST = request -> "first";
    private static final RequestHandler SECOND = request -> "second";

    @Test
    public void testAllReplacesSpecificMethods() {
        final MethodHandlers handlers = new MethodHandlers()
                .define(HttpMethod.GET, FIRST)
                .define(HttpMethod.POST, FIRST)
                .define(HttpMethod.ALL, SECOND);
        Assert.assertEquals(Map.of(HttpMethod.ALL, SECOND), handlers.snapshot());
    }

    @Test
    public void testSpecificMethodReplacesAll() {
        final MethodHandlers handlers = new MethodHandlers()
                .define(HttpMethod.ALL, SECOND)
                .define(HttpMethod.GET, FIRST);
        Assert.assertEquals(Map.of(HttpMethod.GET, FIRST), handlers.snapshot());
        Assert.assertNull(handlers.resolve(HttpMethod.POST));
    }

    @Test
    public void testSpecificMethodsAccumulate() {
        final MethodHandlers handlers = new MethodHandlers()
                .define(HttpMethod.GET, FIRST)
                .define(HttpMethod.DELETE, SECOND)
                .define(HttpMethod.GET, SECOND);
        Assert.assertEquals(EnumSet.of(HttpMethod.GET, HttpMethod.DELETE), handlers.definedMethods());
        Assert.assertSame(SECOND, handlers.get(HttpMethod.GET));
    }

    @Test
    public void testResolveFallsBackToAll() {
        final MethodHandlers handlers = new MethodHandlers().define(HttpMethod.ALL, FIRST);
        Assert.assertSame(FIRST, handlers.resolve(HttpMethod.PATCH));
        Assert.assertNull(handlers.get(HttpMethod.PATCH));
        Assert.assertTrue(handlers.isDefined(HttpMethod.ALL));
    }

    @Test
    public void testSnapshotIsDetached() {
        final MethodHandlers handlers = new MethodHandlers();
        Assert.assertTrue(handlers.snapshot().isEmpty());
        handlers.define(HttpMethod.GET, FIRST);
        final Map<HttpMethod, RequestHandler> snapshot = handlers.snapshot();
        handlers.define(HttpMethod.POST, SECOND);
        Assert.assertEquals(Map.of(HttpMethod.GET, FIRST), snapshot);
        Assert.assertThrows(UnsupportedOperationException.class, () -> snapshot.put(HttpMethod.PUT, FIRST));
    }

    @Test
    public void testNullArguments() {
        final MethodHandlers handlers = new MethodHandlers();
        Assert.assertThrows(IllegalArgumentException.class, () -> handlers.define(null, FIRST));
        Assert.assertThrows(IllegalArgumentException.class, () -> handlers.define(HttpMethod.GET, null));
        Assert.assertTrue(handlers.isEmpty());
    }

    @Test
    public void testMethodNames() {
        Assert.assertEquals(HttpMethod.GET, HttpMethod.fromString("get"));
        Assert.assertEquals(HttpMethod.OPTIONS, HttpMethod.fromString("OPTIONS"));
        Assert.assertThrows(IllegalArgumentException.class, () -> HttpMethod.fromString("TRACE"));
        Assert.assertFalse(HttpMethod.CONCRETE.contains(HttpMethod.ALL));
        Assert.assertEquals(7, HttpMethod.CONCRETE.size());
    }
}
