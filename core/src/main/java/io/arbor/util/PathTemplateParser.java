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

import io.arbor.ArborMessages;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses path templates into {@link ParsedPath} instances.
 *
 * <p>
 * <b>Path template strings</b>
 *
 * <ol>
 * <li>Segments are delimited by {@code /} characters. A segment that does not start with {@code <} is literal text.</li>
 * <li>Path parameters are enclosed inside {@code <} and {@code >}: {@code <slug>} declares a string parameter,
 * {@code <id: number>} declares a typed parameter and {@code <code: {^[A-Z]{3}$}>} declares a parameter that must match
 * the pattern between the braces. Supported types are {@code string}, {@code number} and {@code boolean}.</li>
 * <li>The query section starts at the first {@code ?} outside of a path parameter and contains {@code &} separated
 * {@code name=declaration} pairs. A declaration is a type name, optionally preceded by a {@code {pattern}} and
 * optionally followed by {@code []} (array) and/or {@code ?} (optional). A parenthesized {@code |} separated list
 * declares a union of types, i.e. {@code (string|number)}, or the literal values of an enum when the names are not
 * types, i.e. {@code string(asc|desc)}.</li>
 * <li>A {@code \} escapes the next character of a literal segment, so {@code \?} does not start the query section.</li>
 * </ol>
 *
 * <p>
 * Examples:
 * <pre>
 * /users/&lt;id: number&gt;                          path parameter id, number
 * /&lt;slug&gt;                                      path parameter slug, string
 * /?page=number&amp;tags=string[]&amp;sort=string(asc|desc)?
 * </pre>
 */
public class PathTemplateParser {

    //<editor-fold defaultstate="collapsed" desc="Implementation notes">
    /*
    The template is scanned exactly once. Every inner loop checks the template length before reading the next character,
    so a '<', '{' or '(' that is never closed results in a PathTemplateSyntaxException pointing at the opening character
    instead of reading past the end of the template.

    Braces inside a pattern are counted, so quantifiers such as {3} do not terminate the pattern. A '\' inside a pattern
    escapes the following character from that count, and braces inside a [...] class are skipped.

    A non-empty url part must start with '/', so joining a parent and a child path never merges two segments.
     */
    //</editor-fold>

    private PathTemplateParser() {
    }

    //<editor-fold defaultstate="collapsed" desc="Cursor inner class">
    private static final class Cursor {

        private final String template;
        private final char[] chars;
        private int idx;

        private Cursor(final String template) {
            this.template = template;
            this.chars = template.toCharArray();
        }

        private boolean hasNext() {
            return idx < chars.length;
        }

        private char peek() {
            return chars[idx];
        }

        private PathTemplateSyntaxException unterminated(final char delimiter, final int start) {
            return new PathTemplateSyntaxException(
                    ArborMessages.MESSAGES.unterminatedDelimiter(delimiter, start, template),
                    template, template.substring(start), start
            );
        }

        private PathTemplateSyntaxException unexpected(final int position) {
            return new PathTemplateSyntaxException(
                    ArborMessages.MESSAGES.unexpectedCharacter(chars[position], position, template),
                    template, String.valueOf(chars[position]), position
            );
        }
    }
    //</editor-fold>

    /**
     * Parses a path template.
     *
     * @param template The path template, may be empty
     * @return The parsed path
     * @throws PathTemplateSyntaxException If the template is malformed
     */
    public static ParsedPath parse(final String template) {
        if (template == null) {
            throw ArborMessages.MESSAGES.argumentCannotBeNull("template");
        }
        final Cursor cursor = new Cursor(template);
        final List<ParsedPath.Segment> segments = new ArrayList<>();
        final Map<String, ParameterDescriptor> pathParameters = new LinkedHashMap<>();
        final Map<String, ParameterDescriptor> queryParameters = new LinkedHashMap<>();

        int queryStart = -1;
        final StringBuilder urlPath = new StringBuilder();
        final StringBuilder literal = new StringBuilder();
        while (cursor.hasNext()) {
            final char c = cursor.peek();
            if (c == '?') {
                queryStart = cursor.idx;
                cursor.idx++;
                parseQuery(cursor, queryParameters);
                break;
            }
            if (cursor.idx == 0 && c != '/') {
                throw new PathTemplateSyntaxException(
                        ArborMessages.MESSAGES.missingLeadingSlash(template),
                        template, String.valueOf(c), 0
                );
            }
            if (c == '<') {
                flushLiteral(literal, segments);
                final int parameterStart = cursor.idx;
                final ParameterDescriptor parameter = parsePathParameter(cursor);
                putUnique(cursor, pathParameters, parameter, parameterStart);
                segments.add(new ParsedPath.ParameterSegment(parameter.getName()));
                urlPath.append(template, parameterStart, cursor.idx);
            } else if (c == '/') {
                flushLiteral(literal, segments);
                urlPath.append(c);
                cursor.idx++;
            } else if (c == '\\' && cursor.idx + 1 < cursor.chars.length) {
                literal.append(cursor.chars[cursor.idx + 1]);
                urlPath.append(cursor.chars[cursor.idx + 1]);
                cursor.idx += 2;
            } else {
                literal.append(c);
                urlPath.append(c);
                cursor.idx++;
            }
        }
        flushLiteral(literal, segments);

        final String queryTemplate = queryStart == -1 ? "" : template.substring(queryStart + 1);
        return new ParsedPath(template, urlPath.toString(), queryTemplate, pathParameters, queryParameters, segments);
    }

    private static void flushLiteral(final StringBuilder literal, final List<ParsedPath.Segment> segments) {
        if (literal.length() > 0) {
            segments.add(new ParsedPath.LiteralSegment(literal.toString()));
            literal.setLength(0);
        }
    }

    private static void putUnique(
            final Cursor cursor,
            final Map<String, ParameterDescriptor> parameters,
            final ParameterDescriptor parameter,
            final int position
    ) {
        if (parameters.containsKey(parameter.getName())) {
            throw new PathTemplateSyntaxException(
                    ArborMessages.MESSAGES.duplicateParameterName(parameter.getName(), cursor.template),
                    cursor.template, parameter.getName(), position
            );
        }
        parameters.put(parameter.getName(), parameter);
    }

    /**
     * Parses {@code <name>} or {@code <name: type_or_pattern>}. The cursor is positioned on the '<' and is left on the
     * character following the '>'.
     */
    private static ParameterDescriptor parsePathParameter(final Cursor cursor) {
        final int start = cursor.idx++;
        final StringBuilder name = new StringBuilder();
        while (true) {
            if (!cursor.hasNext()) {
                throw cursor.unterminated('<', start);
            }
            final char c = cursor.peek();
            if (c == '>' || c == ':') {
                break;
            }
            if (c == '<' || c == '/' || c == '{') {
                throw cursor.unexpected(cursor.idx);
            }
            if (!Character.isWhitespace(c)) {
                name.append(c);
            }
            cursor.idx++;
        }
        if (name.length() == 0) {
            throw new PathTemplateSyntaxException(
                    ArborMessages.MESSAGES.emptyParameterName(start, cursor.template),
                    cursor.template, cursor.template.substring(start, cursor.idx + 1), start
            );
        }

        final StringBuilder type = new StringBuilder();
        String regex = null;
        if (cursor.peek() == ':') {
            cursor.idx++;
            while (true) {
                if (!cursor.hasNext()) {
                    throw cursor.unterminated('<', start);
                }
                final char c = cursor.peek();
                if (c == '>') {
                    break;
                } else if (c == '{') {
                    regex = readPattern(cursor);
                } else if (c == '<') {
                    throw cursor.unexpected(cursor.idx);
                } else {
                    if (!Character.isWhitespace(c)) {
                        type.append(c);
                    }
                    cursor.idx++;
                }
            }
        }
        cursor.idx++;

        final String parameterName = name.toString();
        final Set<ParameterType> types = new LinkedHashSet<>();
        if (type.length() > 0) {
            types.add(typeFor(cursor, parameterName, type.toString(), start));
        } else {
            types.add(regex == null ? ParameterType.STRING : ParameterType.REGEX);
        }
        return new ParameterDescriptor(parameterName, types, false, false,
                compile(cursor, parameterName, regex, start), List.of());
    }

    /**
     * Parses the {@code name=declaration} pairs of the query section. The cursor is positioned on the first character after
     * the '?' and is left at the end of the template.
     */
    private static void parseQuery(final Cursor cursor, final Map<String, ParameterDescriptor> queryParameters) {
        while (cursor.hasNext()) {
            final int start = cursor.idx;
            final StringBuilder name = new StringBuilder();
            while (cursor.hasNext() && cursor.peek() != '=' && cursor.peek() != '&') {
                final char c = cursor.peek();
                if (!Character.isWhitespace(c)) {
                    name.append(c);
                }
                cursor.idx++;
            }
            if (name.length() == 0) {
                if (cursor.hasNext() && cursor.peek() == '&') {
                    cursor.idx++;
                    continue;
                }
                throw new PathTemplateSyntaxException(
                        ArborMessages.MESSAGES.emptyParameterName(start, cursor.template),
                        cursor.template, cursor.template.substring(start), start
                );
            }
            final String parameterName = name.toString();

            final Set<ParameterType> types = new LinkedHashSet<>();
            final List<String> allowedValues = new ArrayList<>();
            final StringBuilder type = new StringBuilder();
            String regex = null;
            boolean array = false;
            boolean optional = false;
            int regexStart = start;
            if (cursor.hasNext() && cursor.peek() == '=') {
                cursor.idx++;
                while (cursor.hasNext() && cursor.peek() != '&') {
                    final char c = cursor.peek();
                    if (c == '{') {
                        regexStart = cursor.idx;
                        regex = readPattern(cursor);
                    } else if (c == '(') {
                        addType(cursor, parameterName, type, types, start);
                        readAlternatives(cursor, types, allowedValues);
                    } else if (c == '[') {
                        if (cursor.idx + 1 >= cursor.chars.length || cursor.chars[cursor.idx + 1] != ']') {
                            throw cursor.unterminated('[', cursor.idx);
                        }
                        array = true;
                        cursor.idx += 2;
                    } else if (c == '?') {
                        optional = true;
                        cursor.idx++;
                    } else if (c == ':' || Character.isWhitespace(c)) {
                        cursor.idx++;
                    } else if (c == '<' || c == '>' || c == ')' || c == ']' || c == '}') {
                        throw cursor.unexpected(cursor.idx);
                    } else {
                        type.append(c);
                        cursor.idx++;
                    }
                }
                addType(cursor, parameterName, type, types, start);
            }
            if (types.isEmpty()) {
                types.add(regex != null && allowedValues.isEmpty() ? ParameterType.REGEX : ParameterType.STRING);
            }
            putUnique(cursor, queryParameters, new ParameterDescriptor(parameterName, types, array, optional,
                    compile(cursor, parameterName, regex, regexStart), allowedValues), start);
            if (cursor.hasNext()) {
                cursor.idx++; // the '&'
            }
        }
    }

    private static void addType(
            final Cursor cursor,
            final String parameterName,
            final StringBuilder type,
            final Set<ParameterType> types,
            final int start
    ) {
        if (type.length() > 0) {
            types.add(typeFor(cursor, parameterName, type.toString(), start));
            type.setLength(0);
        }
    }

    /**
     * Reads {@code (a|b|c)}. Alternatives that are type names are added to the types, all others are enum literals.
     */
    private static void readAlternatives(
            final Cursor cursor,
            final Set<ParameterType> types,
            final List<String> allowedValues
    ) {
        final int open = cursor.idx++;
        final StringBuilder alternative = new StringBuilder();
        while (true) {
            if (!cursor.hasNext()) {
                throw cursor.unterminated('(', open);
            }
            final char c = cursor.peek();
            cursor.idx++;
            if (c == '|' || c == ')') {
                final String value = alternative.toString();
                if (value.isEmpty()) {
                    throw new PathTemplateSyntaxException(
                            ArborMessages.MESSAGES.emptyParameterName(open, cursor.template),
                            cursor.template, cursor.template.substring(open, cursor.idx), open
                    );
                }
                final ParameterType type = ParameterType.forName(value);
                if (type != null) {
                    types.add(type);
                } else {
                    allowedValues.add(value);
                }
                alternative.setLength(0);
                if (c == ')') {
                    return;
                }
            } else if (!Character.isWhitespace(c)) {
                alternative.append(c);
            }
        }
    }

    /**
     * Reads a {@code {pattern}}, honouring nested braces. Braces inside a character class do not count. The cursor is positioned on the '{' and is left on the
     * character following the matching '}'.
     */
    private static String readPattern(final Cursor cursor) {
        final int open = cursor.idx;
        int depth = 0;
        int classDepth = 0;
        for (int i = open; i < cursor.chars.length; i++) {
            final char c = cursor.chars[i];
            if (c == '\\') {
                i++;
            } else if (c == '[') {
                classDepth++;
            } else if (classDepth > 0) {
                if (c == ']') {
                    classDepth--;
                }
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (--depth == 0) {
                    cursor.idx = i + 1;
                    return cursor.template.substring(open + 1, i);
                }
            }
        }
        throw cursor.unterminated('{', open);
    }

    private static ParameterType typeFor(
            final Cursor cursor,
            final String parameterName,
            final String typeName,
            final int start
    ) {
        final ParameterType type = ParameterType.forName(typeName);
        if (type == null) {
            throw new PathTemplateSyntaxException(
                    ArborMessages.MESSAGES.unknownParameterType(typeName, parameterName, cursor.template),
                    cursor.template, typeName, start
            );
        }
        return type;
    }

    private static Pattern compile(
            final Cursor cursor,
            final String parameterName,
            final String regex,
            final int start
    ) {
        if (regex == null) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new PathTemplateSyntaxException(
                    ArborMessages.MESSAGES.invalidParameterRegex(regex, parameterName, cursor.template),
                    cursor.template, regex, start, e
            );
        }
    }

    /**
     * Joins two query templates with '&amp;', skipping empty ones.
     */
    public static String joinQueryTemplates(final String first, final String second) {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
        if (first.isEmpty()) {
            return second;
        }
        if (second.isEmpty()) {
            return first;
        }
        return first + '&' + second;
    }
}
