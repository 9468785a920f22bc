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

import io.arbor.server.DuplicateRouteException;
import io.arbor.server.MiddlewareInitException;
import io.arbor.server.UnimplementedCollaboratorMethodException;
import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

/**
 * Exception and message bundle for the routing core.
 */
@MessageBundle(projectCode = "ARB")
public interface ArborMessages {

    ArborMessages MESSAGES = Messages.getBundle(ArborMessages.class);

    @Message(id = 1, value = "Unterminated '%s' starting at position %d in path template '%s'")
    String unterminatedDelimiter(char delimiter, int position, String template);

    @Message(id = 2, value = "Empty parameter name at position %d in path template '%s'")
    String emptyParameterName(int position, String template);

    @Message(id = 3, value = "Unknown type '%s' for parameter '%s' in path template '%s'")
    String unknownParameterType(String type, String name, String template);

    @Message(id = 4, value = "Invalid regular expression '%s' for parameter '%s' in path template '%s'")
    String invalidParameterRegex(String regex, String name, String template);

    @Message(id = 5, value = "Parameter '%s' is declared more than once in path template '%s'")
    String duplicateParameterName(String name, String template);

    @Message(id = 6, value = "Unexpected character '%s' at position %d in path template '%s'")
    String unexpectedCharacter(char c, int position, String template);

    @Message(id = 7, value = "Path template '%s' must start with '/'")
    String missingLeadingSlash(String template);

    @Message(id = 8, value = "Middleware %s failed to initialize for route %s")
    MiddlewareInitException middlewareInitFailed(String middleware, String path, @Cause Throwable cause);

    @Message(id = 9, value = "%s must implement %s()")
    UnimplementedCollaboratorMethodException unimplementedCollaboratorMethod(String adapter, String method);

    @Message(id = 10, value = "Route %s is declared by both %s and %s")
    DuplicateRouteException duplicateRoute(String path, String first, String second);

    @Message(id = 11, value = "Route node %s is already nested inside %s")
    IllegalStateException nodeAlreadyAttached(String path, String parent);

    @Message(id = 12, value = "Route node %s cannot be nested inside itself or one of its descendants")
    IllegalArgumentException cyclicNesting(String path);

    @Message(id = 13, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(String argument);

    @Message(id = 14, value = "Unsupported HTTP method %s")
    IllegalArgumentException unsupportedMethod(String method);

    @Message(id = 15, value = "No handler is defined for route %s")
    IllegalStateException noHandlersDefined(String path);
}
