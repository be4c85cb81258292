package com.ai.coach.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Coercion rules shared by the condition evaluator, the data action processor
 * and the templating layer.
 */
public final class ValueConversions {

    private static final Logger log = LoggerFactory.getLogger(ValueConversions.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern INT_PATTERN = Pattern.compile("[-+]?\\d+");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private ValueConversions() {
    }

    /**
     * Parses the right-hand side of a comparison:
     * {@code null}, {@code true}/{@code false}, quoted text, int, float, else the raw string.
     */
    public static StoreValue parseLiteral(String text) {
        if (text == null) return StoreValue.NULL;
        String trimmed = text.trim();
        if ("null".equals(trimmed)) return StoreValue.NULL;
        if ("true".equals(trimmed)) return StoreValue.TRUE;
        if ("false".equals(trimmed)) return StoreValue.FALSE;
        if (isQuoted(trimmed)) {
            return StoreValue.ofString(trimmed.substring(1, trimmed.length() - 1));
        }
        Optional<StoreValue> number = parseNumber(trimmed);
        return number.orElseGet(() -> StoreValue.ofString(trimmed));
    }

    /**
     * INT for integral text, FLOAT for decimal text, empty otherwise.
     */
    public static Optional<StoreValue> parseNumber(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        String t = text.trim();
        if (INT_PATTERN.matcher(t).matches()) {
            try {
                return Optional.of(StoreValue.ofInt(Long.parseLong(t)));
            } catch (NumberFormatException e) {
                // out of long range, still a valid float
                return Optional.of(StoreValue.ofFloat(Double.parseDouble(t)));
            }
        }
        if (FLOAT_PATTERN.matcher(t).matches()) {
            return Optional.of(StoreValue.ofFloat(Double.parseDouble(t)));
        }
        return Optional.empty();
    }

    /**
     * Numeric view of a value: INT and FLOAT directly, STRING when it parses as a number.
     */
    public static Optional<Number> toNumber(StoreValue value) {
        if (value == null) return Optional.empty();
        switch (value.getType()) {
            case INT:
                return Optional.of(value.asLong());
            case FLOAT:
                return Optional.of(value.asDouble());
            case STRING:
                return parseNumber(value.asString()).map(v -> v.is(StoreValue.Type.INT) ? (Number) v.asLong() : (Number) v.asDouble());
            default:
                return Optional.empty();
        }
    }

    public static int compareNumbers(Number left, Number right) {
        if (left instanceof Long && right instanceof Long) {
            return Long.compare(left.longValue(), right.longValue());
        }
        return Double.compare(left.doubleValue(), right.doubleValue());
    }

    /**
     * Equality with coercion: direct equality, then numeric, then string form.
     */
    public static boolean looselyEquals(StoreValue left, StoreValue right) {
        if (left.equals(right)) return true;
        Optional<Number> l = toNumber(left);
        Optional<Number> r = toNumber(right);
        if (l.isPresent() && r.isPresent()) {
            return compareNumbers(l.get(), r.get()) == 0;
        }
        if (!left.isNull() && !right.isNull()) {
            return left.toString().equals(right.toString());
        }
        return false;
    }

    /**
     * null, false, 0, and empty string/list/map are false; everything else is true.
     */
    public static boolean isTruthy(StoreValue value) {
        if (value == null) return false;
        switch (value.getType()) {
            case NULL:
                return false;
            case BOOL:
                return value.asBoolean();
            case INT:
                return value.asLong() != 0;
            case FLOAT:
                return value.asDouble() != 0.0;
            case STRING:
                return !value.asString().isEmpty();
            case LIST:
                return !value.asList().isEmpty();
            case MAP:
                return !value.asMap().isEmpty();
            default:
                return true;
        }
    }

    /**
     * Integer view used by increment/decrement: INT, or a STRING holding an integer.
     */
    public static Optional<Long> toLong(StoreValue value) {
        if (value == null) return Optional.empty();
        if (value.is(StoreValue.Type.INT)) return Optional.of(value.asLong());
        if (value.is(StoreValue.Type.STRING) && INT_PATTERN.matcher(value.asString().trim()).matches()) {
            try {
                return Optional.of(Long.parseLong(value.asString().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a list-like value: a native list, a JSON array string, or a comma-separated string.
     * Empty when the value is none of those.
     */
    public static Optional<List<StoreValue>> toListLike(StoreValue value) {
        if (value == null) return Optional.empty();
        if (value.is(StoreValue.Type.LIST)) return Optional.of(value.asList());
        if (!value.is(StoreValue.Type.STRING)) return Optional.empty();

        String trimmed = value.asString().trim();
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            try {
                Object parsed = MAPPER.readValue(trimmed, Object.class);
                if (parsed instanceof List) {
                    return Optional.of(StoreValue.of(parsed).asList());
                }
            } catch (JsonProcessingException e) {
                log.debug("Value '{}' is not a JSON array, trying comma-separated form", trimmed);
            }
        }
        if (trimmed.contains(",")) {
            List<StoreValue> items = new ArrayList<>();
            for (String part : trimmed.split(",")) {
                items.add(StoreValue.ofString(part.trim()));
            }
            return Optional.of(items);
        }
        return Optional.empty();
    }

    /**
     * Coerces {@code value} to the element type of {@code list} where possible.
     * For an empty list numeric strings become numbers.
     */
    public static StoreValue coerceToElementType(StoreValue value, List<StoreValue> list) {
        StoreValue.Type target = list.stream()
                .filter(v -> !v.isNull())
                .map(StoreValue::getType)
                .findFirst()
                .orElse(null);

        if (target == null) {
            if (value.is(StoreValue.Type.STRING)) {
                return parseNumber(value.asString()).orElse(value);
            }
            return value;
        }
        switch (target) {
            case INT:
                if (value.is(StoreValue.Type.STRING)) {
                    return parseNumber(value.asString()).orElse(value);
                }
                if (value.is(StoreValue.Type.FLOAT) && value.asDouble() == Math.rint(value.asDouble())) {
                    return StoreValue.ofInt((long) value.asDouble());
                }
                return value;
            case FLOAT:
                Optional<Number> n = toNumber(value);
                return n.map(number -> StoreValue.ofFloat(number.doubleValue())).orElse(value);
            case STRING:
                if (value.is(StoreValue.Type.INT) || value.is(StoreValue.Type.FLOAT) || value.is(StoreValue.Type.BOOL)) {
                    return StoreValue.ofString(value.toString());
                }
                return value;
            default:
                return value;
        }
    }

    /**
     * JSON text of a value, used when a list or map has to be shown as a string.
     */
    public static String toJson(StoreValue value) {
        try {
            return MAPPER.writeValueAsString(value.toJava());
        } catch (JsonProcessingException e) {
            return value.toString();
        }
    }

    public static boolean isQuoted(String s) {
        return s.length() >= 2
                && ((s.startsWith("'") && s.endsWith("'")) || (s.startsWith("\"") && s.endsWith("\"")));
    }
}
