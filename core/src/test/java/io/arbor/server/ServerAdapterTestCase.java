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

import io.arbor.ArborOptions;
import io.arbor.Routes;
import io.arbor.router.RouteNode;
import io.arbor.testutils.category.UnitTest;
import io.arbor.util.HttpMethod;
import io.arbor.util.ParameterDescriptor;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.xnio.OptionMap;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Category(UnitTest.class)
public class ServerAdapterTestCase {

    private static final RequestHandler HANDLER = request -> "ok";

    private static class ColonAdapter extends ServerAdapter {

        private final List<RegisteredRoute> routes = new ArrayList<>();

        ColonAdapter(final OptionMap options) {
            super(options);
        }

        ColonAdapter() {
        }

        @Override
        protected String translatePathParameter(final String name, final ParameterDescriptor descriptor) {
            return ":" + name;
        }

        @Override
        protected void initialize(final List<RegisteredRoute> routes) {
            this.routes.addAll(routes);
        }
    }

    private static RouteNode tree() {
        final RouteNode root = Routes.path("/api");
        final RouteNode users = Routes.nested(root, "/users").get(HANDLER).post(HANDLER);
        Routes.nested(users, "/<id: number>/posts/<slug>").get(HANDLER);
        return root;
    }

    @Test
    public void testUnimplementedAdapter() {
        final ServerAdapter adapter = new ServerAdapter() {
        };
        final UnimplementedCollaboratorMethodException e = Assert.assertThrows(UnimplementedCollaboratorMethodException.class,
                () -> adapter.start(tree()));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("translatePathParameter"));

        final ServerAdapter translating = new ServerAdapter() {
            @Override
            protected String translatePathParameter(final String name, final ParameterDescriptor descriptor) {
                return name;
            }
        };
        final UnimplementedCollaboratorMethodException initialize = Assert.assertThrows(UnimplementedCollaboratorMethodException.class,
                () -> translating.start(tree()));
        Assert.assertTrue(initialize.getMessage(), initialize.getMessage().contains("initialize"));
    }

    @Test
    public void testStartRegistersEveryMethod() throws Exception {
        final ColonAdapter adapter = new ColonAdapter();
        adapter.start(tree());
        final List<String> registered = adapter.routes.stream()
                .map(route -> route.getMethod() + " " + route.getPath())
                .collect(Collectors.toList());
        Assert.assertEquals(List.of(
                "GET /api/users",
                "POST /api/users",
                "GET /api/users/:id/posts/:slug"), registered);
        Assert.assertSame(HttpMethod.GET, adapter.routes.get(2).getDispatcher().getMethod());
        Assert.assertEquals("/api/users/<id: number>/posts/<slug>", adapter.routes.get(2).getRoute().getFullUrlPath());
    }

    @Test
    public void testTranslateRootPath() {
        final ColonAdapter adapter = new ColonAdapter();
        final RouteNode root = Routes.path("").get(HANDLER);
        Assert.assertEquals("/", adapter.translatePath(root.flatten().get(0)));
    }

    @Test
    public void testRegisteredPathMatchesFullPath() {
        final ColonAdapter adapter = new ColonAdapter();
        final RouteNode root = Routes.path("/api");
        Routes.nested(root, "/what\\?").get(HANDLER);
        Routes.nested(root, "/files").get(HANDLER);
        for (RegisteredRoute route : adapter.getRegisteredRoutes(root)) {
            Assert.assertEquals(route.getRoute().getFullUrlPath(), route.getPath());
        }
    }

    @Test
    public void testAllIsRegisteredOnce() throws Exception {
        final ColonAdapter adapter = new ColonAdapter();
        adapter.start(Routes.path("/any").all(HANDLER));
        Assert.assertEquals(1, adapter.routes.size());
        Assert.assertEquals(HttpMethod.ALL, adapter.routes.get(0).getMethod());
    }

    @Test
    public void testDuplicateRoutesWinByDefault() {
        final RouteNode root = Routes.path("");
        final RouteNode first = new RouteNode("/a").get(HANDLER);
        final RouteNode second = new RouteNode("/a").post(HANDLER);
        root.nested(first, second);

        final List<RegisteredRoute> routes = new ColonAdapter().getRegisteredRoutes(root);
        Assert.assertEquals(1, routes.size());
        Assert.assertEquals(HttpMethod.POST, routes.get(0).getMethod());
    }

    @Test
    public void testDuplicateRoutesCanBeRejected() {
        final RouteNode root = Routes.path("");
        final RouteNode group = Routes.nested(root, "/g");
        group.nested(new RouteNode("/a").get(HANDLER), new RouteNode("/a").post(HANDLER));

        final ColonAdapter adapter = new ColonAdapter(OptionMap.create(ArborOptions.REJECT_DUPLICATE_ROUTES, true));
        Assert.assertThrows(DuplicateRouteException.class, () -> adapter.start(root));
        Assert.assertTrue(adapter.routes.isEmpty());
    }

    @Test
    public void testOwnRouteCollidingWithChildCanBeRejected() {
        final RouteNode root = Routes.path("/a").get(HANDLER);
        Routes.nested(root, "").post(HANDLER);

        Assert.assertEquals(2, new ColonAdapter().getRegisteredRoutes(root).size());
        final ColonAdapter adapter = new ColonAdapter(OptionMap.create(ArborOptions.REJECT_DUPLICATE_ROUTES, true));
        Assert.assertThrows(DuplicateRouteException.class, () -> adapter.getRegisteredRoutes(root));
    }

    @Test
    public void testRequestLogging() throws Exception {
        final List<RequestLogEvent> events = new ArrayList<>();
        final ColonAdapter logging = new ColonAdapter();
        logging.setRequestLogListener(events::add);
        logging.start(Routes.path("/ping").get(HANDLER));
        logging.routes.get(0).getDispatcher().dispatch(new MockRawRequest("GET", "/ping"));
        Assert.assertEquals(1, events.size());

        final ColonAdapter silent = new ColonAdapter(OptionMap.create(ArborOptions.LOG_REQUESTS, false));
        silent.setRequestLogListener(events::add);
        silent.start(Routes.path("/ping").get(HANDLER));
        silent.routes.get(0).getDispatcher().dispatch(new MockRawRequest("GET", "/ping"));
        Assert.assertEquals(1, events.size());
    }

    @Test
    public void testMiddlewareFailureFailsStart() {
        final RouteNode root = Routes.path("").middlewares(() -> {
            throw new IllegalStateException("not configured");
        });
        Routes.nested(root, "/a").get(HANDLER);
        final ColonAdapter adapter = new ColonAdapter();
        Assert.assertThrows(MiddlewareInitException.class, () -> adapter.start(root));
        Assert.assertTrue(adapter.routes.isEmpty());
    }
}
