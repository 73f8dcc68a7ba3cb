package com.routedoc.service.impl;

import com.routedoc.exception.DuplicateParameterNameException;
import com.routedoc.exception.MalformedTemplateException;
import com.routedoc.model.RouteSegment;
import com.routedoc.service.api.RouteTemplateParser;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.springframework.stereotype.Service;

/**
 * Scans a route template left to right. At each position it expects optional static text, then a
 * placeholder of the form {@code <converter(args):variable>}, where the converter and the
 * arguments are optional. Scanning stops at the first position where no placeholder can be
 * matched; whatever is left becomes trailing static text unless it holds an angle bracket.
 * <p>
 * Converter and variable names are ASCII identifiers. The argument text may not contain a line
 * break and ends at the first {@code )} that is directly followed by {@code :variable>}.
 */
@Service
public class RouteTemplateParserImpl implements RouteTemplateParser {

    static final String DEFAULT_CONVERTER = "default";

    @Override
    public Stream<RouteSegment> parse(String rule) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(new SegmentIterator(rule), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private record Placeholder(String staticText, String converter, String arguments, String variable, int end) {
    }

    private static final class SegmentIterator implements Iterator<RouteSegment> {

        private final String rule;
        private final int end;
        private final Deque<RouteSegment> pending = new ArrayDeque<>();
        private final Set<String> usedNames = new HashSet<>();
        private int pos;
        private boolean finished;

        SegmentIterator(String rule) {
            this.rule = rule;
            this.end = rule.length();
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !finished) {
                advance();
            }
            return !pending.isEmpty();
        }

        @Override
        public RouteSegment next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RouteSegment segment = pending.poll();
            if (segment instanceof RouteSegment.Dynamic) {
                String variable = ((RouteSegment.Dynamic) segment).variable();
                if (!usedNames.add(variable)) {
                    finished = true;
                    pending.clear();
                    throw new DuplicateParameterNameException(rule, variable);
                }
            }
            return segment;
        }

        private void advance() {
            if (pos >= end) {
                finished = true;
                return;
            }
            Placeholder match = matchAt(pos);
            if (match == null) {
                finished = true;
                String remaining = rule.substring(pos);
                if (remaining.indexOf('<') >= 0 || remaining.indexOf('>') >= 0) {
                    throw new MalformedTemplateException(rule);
                }
                pending.add(new RouteSegment.Static(remaining));
                return;
            }
            if (!match.staticText().isEmpty()) {
                pending.add(new RouteSegment.Static(match.staticText()));
            }
            String converter = match.converter() != null ? match.converter() : DEFAULT_CONVERTER;
            String arguments = match.arguments() == null || match.arguments().isEmpty() ? null : match.arguments();
            pending.add(new RouteSegment.Dynamic(converter, arguments, match.variable()));
            pos = match.end();
        }

        private Placeholder matchAt(int from) {
            int open = rule.indexOf('<', from);
            if (open < 0) {
                return null;
            }
            String staticText = rule.substring(from, open);
            int start = open + 1;

            int converterEnd = identifierEnd(start);
            if (converterEnd > start) {
                String converter = rule.substring(start, converterEnd);
                if (charAt(converterEnd) == '(') {
                    for (int close = converterEnd + 1; close < end && rule.charAt(close) != '\n'; close++) {
                        if (rule.charAt(close) == ')' && charAt(close + 1) == ':') {
                            Placeholder withArgs = variableAt(close + 2, staticText, converter,
                                    rule.substring(converterEnd + 1, close));
                            if (withArgs != null) {
                                return withArgs;
                            }
                        }
                    }
                }
                if (charAt(converterEnd) == ':') {
                    Placeholder withConverter = variableAt(converterEnd + 1, staticText, converter, null);
                    if (withConverter != null) {
                        return withConverter;
                    }
                }
            }
            return variableAt(start, staticText, null, null);
        }

        private Placeholder variableAt(int start, String staticText, String converter, String arguments) {
            int variableEnd = identifierEnd(start);
            if (variableEnd == start || charAt(variableEnd) != '>') {
                return null;
            }
            return new Placeholder(staticText, converter, arguments, rule.substring(start, variableEnd), variableEnd + 1);
        }

        private int identifierEnd(int start) {
            if (start >= end || !isIdentifierStart(rule.charAt(start))) {
                return start;
            }
            int i = start + 1;
            while (i < end && isIdentifierPart(rule.charAt(i))) {
                i++;
            }
            return i;
        }

        private char charAt(int index) {
            return index < end ? rule.charAt(index) : '\0';
        }

        private static boolean isIdentifierStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isIdentifierPart(char c) {
            return isIdentifierStart(c) || (c >= '0' && c <= '9');
        }
    }
}
