package com.routedoc.service.support;

import com.routedoc.model.ConverterArguments;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Tokenizes the argument text of a converter, e.g. the {@code min=1, max=10} in
 * {@code <int(min=1, max=10):id>}, into positional and keyword values.
 * <p>
 * Values are typed the way route declarations write them: {@code True}, {@code False} and
 * {@code None} become booleans and {@code null}, numeric literals become numbers, quoted text
 * loses its quotes and any other word stays a string. Text between recognized arguments is
 * skipped, so {@code min=1 max=5} yields only {@code max=5}.
 */
@Slf4j
public final class ConverterArgumentParser {

    private static final Pattern ARGUMENT = Pattern.compile(
            "\\s*((?<name>\\w+)\\s*=\\s*)?"
                    + "(?<value>True|False|\\d+.\\d+|\\d+.|\\d+|[\\w.]+|[urUR]?(?<stringval>\"[^\"]*?\"|'[^']*'))"
                    + "\\s*,",
            Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?", Pattern.UNICODE_CHARACTER_CLASS);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private ConverterArgumentParser() {
    }

    /**
     * @param rule      The route template the arguments belong to, for logging.
     * @param arguments The raw argument text, without the parentheses.
     * @return The parsed arguments.
     */
    public static ConverterArguments parse(String rule, String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return ConverterArguments.none();
        }
        String text = arguments + ",";
        List<Object> positional = new ArrayList<>();
        Map<String, Object> keyword = new LinkedHashMap<>();
        Matcher matcher = ARGUMENT.matcher(text);
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() != position) {
                log.debug("Skipping converter argument text '{}' in rule '{}'.", text.substring(position, matcher.start()), rule);
            }
            String raw = matcher.group("stringval") != null ? matcher.group("stringval") : matcher.group("value");
            Object value = toValue(raw);
            String name = matcher.group("name");
            if (name == null) {
                positional.add(value);
            } else {
                keyword.put(name, value);
            }
            position = matcher.end();
        }
        return new ConverterArguments(Collections.unmodifiableList(positional), Collections.unmodifiableMap(keyword));
    }

    static Object toValue(String raw) {
        switch (raw) {
            case "None":
                return null;
            case "True":
                return Boolean.TRUE;
            case "False":
                return Boolean.FALSE;
            default:
                break;
        }
        if (INTEGER.matcher(raw).matches()) {
            BigInteger parsed = new BigInteger(raw);
            if (parsed.bitLength() < Integer.SIZE) {
                return parsed.intValue();
            }
            if (parsed.compareTo(LONG_MIN) >= 0 && parsed.compareTo(LONG_MAX) <= 0) {
                return parsed.longValue();
            }
            return parsed;
        }
        if (DECIMAL.matcher(raw).matches()) {
            return Double.parseDouble(asciiDigits(raw));
        }
        if (raw.length() >= 2 && (raw.charAt(0) == '"' || raw.charAt(0) == '\'') && raw.charAt(raw.length() - 1) == raw.charAt(0)) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }

    // Double.parseDouble only reads ASCII digits.
    private static String asciiDigits(String raw) {
        StringBuilder ascii = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            ascii.append(Character.isDigit(c) ? (char) ('0' + Character.digit(c, 10)) : c);
        }
        return ascii.toString();
    }
}
