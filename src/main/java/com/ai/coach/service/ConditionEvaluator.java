package com.ai.coach.service;

import com.ai.coach.store.KeyValueStore;
import com.ai.coach.store.StoreValue;
import com.ai.coach.store.ValueConversions;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates route conditions against the key/value store.
 * <p>
 * Single form: {@code left op right} with {@code op} one of {@code >= <= != == > <}, or a bare
 * key tested for truthiness. Compound form joins single conditions with {@code ||} and
 * {@code &&}; all {@code ||} are split before any {@code &&}, and there is no grouping.
 * Operators inside single or double quotes are ignored everywhere.
 * <p>
 * Evaluation never throws: any failure is logged and counts as {@code false}.
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    // longer operators first so ">=" is never split as ">"
    static final List<String> OPERATORS = Arrays.asList(">=", "<=", "!=", "==", ">", "<");

    private static final String OR = "||";
    private static final String AND = "&&";

    private final KeyValueStore store;

    public ConditionEvaluator(KeyValueStore store) {
        this.store = store;
    }

    /**
     * Evaluates a condition that may contain {@code ||} and {@code &&}.
     */
    public boolean evaluateCompound(String condition) {
        if (StringUtils.isBlank(condition)) {
            log.warn("Blank condition evaluates to false");
            return false;
        }
        try {
            List<String> orParts = splitOutsideQuotes(condition, OR);
            if (orParts.size() > 1) {
                for (String part : orParts) {
                    if (evaluateCompoundPart(part.trim())) {
                        return true;
                    }
                }
                return false;
            }
            List<String> andParts = splitOutsideQuotes(condition, AND);
            if (andParts.size() > 1) {
                for (String part : andParts) {
                    if (!evaluateCompoundPart(part.trim())) {
                        return false;
                    }
                }
                return true;
            }
            return evaluate(condition);
        } catch (RuntimeException e) {
            log.error("Failed to evaluate compound condition \"{}\"", condition, e);
            return false;
        }
    }

    /**
     * Evaluates a single comparison or bare-key truthiness check.
     */
    public boolean evaluate(String condition) {
        if (StringUtils.isBlank(condition)) return false;
        try {
            Optional<Comparison> parsed = parse(condition);
            if (parsed.isEmpty()) {
                StoreValue value = lookup(condition.trim());
                boolean result = ValueConversions.isTruthy(value);
                log.debug("Condition \"{}\" truthiness of {} -> {}", condition, value, result);
                return result;
            }
            Comparison c = parsed.get();
            StoreValue left = lookup(c.left);
            StoreValue right = ValueConversions.parseLiteral(c.right);
            boolean result = compare(left, c.operator, right);
            log.debug("Condition \"{}\": {} {} {} -> {}", condition, left, c.operator, right, result);
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to evaluate condition \"{}\"", condition, e);
            return false;
        }
    }

    private boolean evaluateCompoundPart(String part) {
        if (part.contains(OR) || part.contains(AND)) {
            return evaluateCompound(part);
        }
        return evaluate(part);
    }

    private static boolean compare(StoreValue left, String operator, StoreValue right) {
        switch (operator) {
            case "==":
                return ValueConversions.looselyEquals(left, right);
            case "!=":
                return !ValueConversions.looselyEquals(left, right);
            default:
                return compareNumbers(left, operator, right);
        }
    }

    private static boolean compareNumbers(StoreValue left, String operator, StoreValue right) {
        Optional<Number> l = ValueConversions.toNumber(left);
        Optional<Number> r = ValueConversions.toNumber(right);
        if (l.isEmpty() || r.isEmpty()) {
            log.debug("Relational comparison of non-numeric values {} {} {} is false", left, operator, right);
            return false;
        }
        int cmp = ValueConversions.compareNumbers(l.get(), r.get());
        switch (operator) {
            case ">":
                return cmp > 0;
            case "<":
                return cmp < 0;
            case ">=":
                return cmp >= 0;
            case "<=":
                return cmp <= 0;
            default:
                return false;
        }
    }

    /**
     * Resolves {@code namespace.key}; a key without a namespace resolves to null.
     */
    private StoreValue lookup(String key) {
        int dot = key.indexOf('.');
        if (dot <= 0 || dot == key.length() - 1) {
            log.warn("Condition key '{}' has no namespace, treating as null", key);
            return StoreValue.NULL;
        }
        String namespace = key.substring(0, dot);
        String remainder = key.substring(dot + 1);
        return store.get(namespace + "." + remainder);
    }

    static Optional<Comparison> parse(String condition) {
        for (String operator : OPERATORS) {
            int index = indexOutsideQuotes(condition, operator, 0);
            if (index >= 0) {
                return Optional.of(new Comparison(
                        condition.substring(0, index).trim(),
                        operator,
                        condition.substring(index + operator.length()).trim()));
            }
        }
        return Optional.empty();
    }

    /**
     * Whether {@code condition} contains a comparison operator outside quotes.
     */
    public static boolean hasOperator(String condition) {
        return condition != null && parse(condition).isPresent();
    }

    static int indexOutsideQuotes(String text, String token, int from) {
        boolean inSingle = false;
        boolean inDouble = false;
        for (int i = 0; i <= text.length() - token.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (ch == '"' && !inSingle) {
                inDouble = !inDouble;
            }
            if (i >= from && !inSingle && !inDouble && text.startsWith(token, i)) {
                return i;
            }
        }
        return -1;
    }

    static List<String> splitOutsideQuotes(String text, String token) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int index;
        while ((index = indexOutsideQuotes(text, token, start)) >= 0) {
            parts.add(text.substring(start, index));
            start = index + token.length();
        }
        parts.add(text.substring(start));
        return parts;
    }

    static final class Comparison {
        final String left;
        final String operator;
        final String right;

        Comparison(String left, String operator, String right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }
    }
}
