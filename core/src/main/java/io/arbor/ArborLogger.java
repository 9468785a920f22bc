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

package io.arbor;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;
import static org.jboss.logging.Logger.Level.ERROR;
import static org.jboss.logging.Logger.Level.WARN;

/**
 * log messages start at 5000
 */
@MessageLogger(projectCode = "ARB")
public interface ArborLogger extends BasicLogger {

    ArborLogger ROOT_LOGGER = Logger.getMessageLogger(ArborLogger.class, ArborLogger.class.getPackage().getName());
    ArborLogger ROUTER_LOGGER = Logger.getMessageLogger(ArborLogger.class, ArborLogger.class.getPackage().getName() + ".router");
    ArborLogger REQUEST_LOGGER = Logger.getMessageLogger(ArborLogger.class, ArborLogger.class.getPackage().getName() + ".request");

    @LogMessage(level = DEBUG)
    @Message(id = 5001, value = "Composed route %s into the table of %s with %d middlewares")
    void routeComposed(String fullPath, String owner, int middlewareCount);

    @LogMessage(level = WARN)
    @Message(id = 5002, value = "Route %s declared by %s replaces the route previously declared by %s")
    void routeOverwritten(String fullPath, String origin, String previousOrigin);

    @LogMessage(level = DEBUG)
    @Message(id = 5003, value = "%s %s handled in %s ms")
    void requestHandled(String method, String path, double elapsedTime);

    @LogMessage(level = ERROR)
    @Message(id = 5004, value = "Request log listener %s failed")
    void requestLogListenerFailed(Object listener, @Cause Throwable cause);

    @LogMessage(level = DEBUG)
    @Message(id = 5005, value = "Registered %s %s as %s")
    void routeRegistered(String method, String fullPath, String translatedPath);

    @LogMessage(level = DEBUG)
    @Message(id = 5006, value = "Built a middleware chain of %d stages for %s")
    void middlewareChainBuilt(int stages, String fullPath);

    @LogMessage(level = ERROR)
    @Message(id = 5007, value = "An exception occurred processing the request")
    void exceptionProcessingRequest(@Cause Throwable cause);
}
