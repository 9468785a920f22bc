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

import io.arbor.Routes;
import io.arbor.router.RouteEntry;
import io.arbor.router.RouteNode;
import io.arbor.testutils.category.UnitTest;
import io.arbor.util.AttachmentKey;
import io.arbor.util.HttpMethod;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tests parameter resolution, middleware execution and request logging of a dispatched request.
 */
@Category(UnitTest.class)
public class RouteDispatcherTestCase {

    private static RouteEntry route(final String template, final RequestHandler handler) {
        final RouteNode root = Routes.path("");
        Routes.nested(root, template).get(handler);
        return root.getRouteTable().values().iterator().next();
    }

    @Test
    public void testNumberPathParameterIsConverted() throws Exception {
        final AtomicReference<RouteRequest> seen = new AtomicReference<>();
        final RouteDispatcher dispatcher = new RouteDispatcher(route("/users/<id: number>", request -> {
            seen.set(request);
            return "ok";
        }), HttpMethod.GET, null);

        Assert.assertEquals("ok", dispatcher.dispatch(new MockRawRequest("GET", "/users/7").pathParameter("id", "7")));
        Assert.assertEquals(Map.of("id", 7), seen.get().getPathParameters());
        Assert.assertEquals(7, seen.get().getPathParameter("id"));
        Assert.assertEquals(HttpMethod.GET, seen.get().getMethod());
        Assert.assertEquals("/users/7", seen.get().getPath());

        dispatcher.dispatch(new MockRawRequest("GET", "/users/abc").pathParameter("id", "abc"));
        Assert.assertTrue(seen.get().getPathParameters().isEmpty());
        Assert.assertNull(seen.get().getPathParameter("id"));
    }

    @Test
    public void testRegexPathParameter() throws Exception {
        final AtomicReference<RouteRequest> seen = new AtomicReference<>();
        final RouteDispatcher dispatcher = new RouteDispatcher(route("/currencies/<code: {^[A-Z]{3}$}>", request -> {
            seen.set(request);
            return null;
        }), HttpMethod.GET, null);

        dispatcher.dispatch(new MockRawRequest("GET", "/currencies/EUR").pathParameter("code", "EUR"));
        Assert.assertEquals("EUR", seen.get().getPathParameter("code"));
        dispatcher.dispatch(new MockRawRequest("GET", "/currencies/euro").pathParameter("code", "euro"));
        Assert.assertNull(seen.get().getPathParameter("code"));
    }

    @Test
    public void testQueryParameters() throws Exception {
        final AtomicReference<RouteRequest> seen = new AtomicReference<>();
        final RouteDispatcher dispatcher = new RouteDispatcher(route("/posts?page=number&tags=string[]&ids=number[]&sort=string(asc|desc)?&draft=boolean?", request -> {
            seen.set(request);
            return null;
        }), HttpMethod.GET, null);

        dispatcher.dispatch(new MockRawRequest("GET", "/posts")
                .queryParameter("page", "x")
                .queryParameter("page", "2")
                .queryParameter("tags", "java")
                .queryParameter("tags", "http")
                .queryParameter("ids", "1")
                .queryParameter("ids", "two")
                .queryParameter("sort", "random")
                .queryParameter("draft", "TRUE")
                .queryParameter("unknown", "1"));

        final RouteRequest request = seen.get();
        Assert.assertEquals(2, request.getQueryParameter("page"));
        Assert.assertEquals(List.of("java", "http"), request.getQueryParameter("tags"));
        Assert.assertEquals(List.of(1), request.getQueryParameter("ids"));
        Assert.assertNull(request.getQueryParameter("sort"));
        Assert.assertEquals(Boolean.TRUE, request.getQueryParameter("draft"));
        Assert.assertFalse(request.getQueryParameters().containsKey("unknown"));
    }

    @Test
    public void testInheritedParametersAreResolved() throws Exception {
        final AtomicReference<RouteRequest> seen = new AtomicReference<>();
        final RouteNode root = Routes.path("/users/<userId: number>");
        Routes.nested(root, "/posts/<postId: number>").get(request -> {
            seen.set(request);
            return null;
        });
        final RouteDispatcher dispatcher = Routes.dispatcher(root.flatten().get(0), HttpMethod.GET);
        dispatcher.dispatch(new MockRawRequest("GET", "/users/1/posts/2")
                .pathParameter("userId", "1")
                .pathParameter("postId", "2"));
        Assert.assertEquals(Map.of("userId", 1, "postId", 2), seen.get().getPathParameters());
    }

    @Test
    public void testMiddlewaresRunBeforeHandler() throws Exception {
        final AttachmentKey<String> user = AttachmentKey.create(String.class);
        final List<String> calls = new ArrayList<>();
        final RouteNode root = Routes.path("").middlewares(() -> new AbstractMiddleware() {
            @Override
            public Object handleRequest(final RouteRequest request) throws Exception {
                calls.add("auth");
                request.putAttachment(user, "alice");
                return getNext().handleRequest(request);
            }
        });
        Routes.nested(root, "/me").get(request -> {
            calls.add("handler");
            return request.getAttachment(user);
        });
        final RouteDispatcher dispatcher = new RouteDispatcher(root.getRouteTable().get("/me"), HttpMethod.GET, null);
        Assert.assertEquals("alice", dispatcher.dispatch(new MockRawRequest("GET", "/me")));
        Assert.assertEquals(List.of("auth", "handler"), calls);
    }

    @Test
    public void testRequestLogEvent() throws Exception {
        final List<RequestLogEvent> events = new ArrayList<>();
        final RouteDispatcher dispatcher = new RouteDispatcher(route("/ping", request -> "pong"), HttpMethod.GET, events::add);
        Assert.assertEquals("pong", dispatcher.dispatch(new MockRawRequest("GET", "/ping")));
        Assert.assertEquals(1, events.size());
        Assert.assertEquals("GET", events.get(0).getMethod());
        Assert.assertEquals("/ping", events.get(0).getPath());
        Assert.assertTrue(events.get(0).getElapsedTime() >= 0);
    }

    @Test
    public void testAsynchronousResultIsLoggedOnCompletion() throws Exception {
        final List<RequestLogEvent> events = new ArrayList<>();
        final CompletableFuture<String> response = new CompletableFuture<>();
        final RouteDispatcher dispatcher = new RouteDispatcher(route("/slow", request -> response), HttpMethod.GET, events::add);

        Assert.assertSame(response, dispatcher.dispatch(new MockRawRequest("GET", "/slow")));
        Assert.assertTrue(events.isEmpty());
        response.complete("done");
        Assert.assertEquals(1, events.size());
    }

    @Test
    public void testFailedAsynchronousResultIsNotLogged() throws Exception {
        final List<RequestLogEvent> events = new ArrayList<>();
        final CompletableFuture<String> response = new CompletableFuture<>();
        final RouteDispatcher dispatcher = new RouteDispatcher(route("/slow", request -> response), HttpMethod.GET, events::add);
        dispatcher.dispatch(new MockRawRequest("GET", "/slow"));
        response.completeExceptionally(new IOException());
        Assert.assertTrue(events.isEmpty());
    }

    @Test
    public void testHandlerExceptionPropagatesWithoutLogEvent() {
        final List<RequestLogEvent> events = new ArrayList<>();
        final IOException failure = new IOException("database down");
        final RouteDispatcher dispatcher = new RouteDispatcher(route("/fail", request -> {
            throw failure;
        }), HttpMethod.GET, events::add);
        final IOException e = Assert.assertThrows(IOException.class, () -> dispatcher.dispatch(new MockRawRequest("GET", "/fail")));
        Assert.assertSame(failure, e);
        Assert.assertTrue(events.isEmpty());
    }

    @Test
    public void testFailingListenerDoesNotFailRequest() throws Exception {
        final RouteDispatcher dispatcher = new RouteDispatcher(route("/ping", request -> "pong"), HttpMethod.GET, event -> {
            throw new IllegalStateException("listener");
        });
        Assert.assertEquals("pong", dispatcher.dispatch(new MockRawRequest("GET", "/ping")));
    }

    @Test
    public void testAllHandlerServesEveryMethod() throws Exception {
        final RouteNode root = Routes.path("");
        Routes.nested(root, "/any").all(request -> request.getMethod().methodName());
        final RouteDispatcher dispatcher = new RouteDispatcher(root.getRouteTable().get("/any"), HttpMethod.PATCH, null);
        Assert.assertEquals("PATCH", dispatcher.dispatch(new MockRawRequest("PATCH", "/any")));
    }

    @Test
    public void testMissingHandlerIsRejected() {
        Assert.assertThrows(IllegalStateException.class,
                () -> new RouteDispatcher(route("/ping", request -> "pong"), HttpMethod.POST, null));
    }
}
