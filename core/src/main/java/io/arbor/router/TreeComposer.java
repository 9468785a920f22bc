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

import io.arbor.ArborLogger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Materializes the routes of descendants into the route tables of their ancestors.
 */
final class TreeComposer {

    private TreeComposer() {
    }

    /**
     * Rebuilds the route table of the given node and then of every ancestor, closest first. Each table is built from
     * the already rebuilt tables of its children, so a change anywhere in the tree reaches the root.
     */
    static void propagate(final RouteNode node) {
        for (RouteNode current = node; current != null; current = current.getParent()) {
            compose(current);
        }
    }

    /**
     * Rebuilds the route table of one node from its children. A child with handlers contributes its own route; a
     * child with a non-empty table contributes each of its entries. All of them are prefixed with the owner's path,
     * middlewares and parameters, but keyed by the path below the owner. On a key collision the child nested last
     * wins.
     */
    static void compose(final RouteNode owner) {
        final Map<String, RouteEntry> table = new LinkedHashMap<>();
        final Map<String, RouteNode> overwritten = new LinkedHashMap<>();
        for (RouteNode child : owner.getChildren()) {
            final String childPath = child.getParsedPath().getUrlPath();
            if (child.hasHandlers()) {
                put(owner, table, overwritten, childPath, RouteEntry.of(child).prefixedWith(owner));
            }
            for (Map.Entry<String, RouteEntry> entry : child.getRouteTable().entrySet()) {
                put(owner, table, overwritten, childPath + entry.getKey(), entry.getValue().prefixedWith(owner));
            }
        }

        final Map<String, RouteNode> previouslyOverwritten = owner.getOverwrittenRoutes();
        for (Map.Entry<String, RouteNode> entry : overwritten.entrySet()) {
            if (previouslyOverwritten.get(entry.getKey()) != entry.getValue()) {
                ArborLogger.ROUTER_LOGGER.routeOverwritten(entry.getKey(),
                        String.valueOf(table.get(entry.getKey()).getOrigin()), String.valueOf(entry.getValue()));
            }
        }
        owner.updateRouteTable(table, overwritten);
    }

    private static void put(
            final RouteNode owner,
            final Map<String, RouteEntry> table,
            final Map<String, RouteNode> overwritten,
            final String key,
            final RouteEntry entry
    ) {
        final RouteEntry previous = table.put(key, entry);
        if (previous != null && previous.getOrigin() != entry.getOrigin()) {
            overwritten.put(key, previous.getOrigin());
        }
        ArborLogger.ROUTER_LOGGER.routeComposed(entry.getFullUrlPath(), owner.getPath(), entry.getMiddlewares().size());
    }
}
