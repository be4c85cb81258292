package com.ai.coach.service;

import com.ai.coach.config.ChatEngineSettings;
import com.ai.coach.store.StoreValue;
import com.ai.coach.store.ValueConversions;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Display formatting for template placeholders.
 * <p>
 * A formatter spec is {@code name[:flag...]}. {@code name} is a JSON table
 * ({@code rawValue -> displayString}) under the formatters root, or a case flag on its own.
 * Flags: {@code join} formats each element of a list-like value and joins them
 * ("Monday, Tuesday and Friday"); {@code upper}, {@code lower}, {@code proper}, {@code sentence}
 * change case of the result.
 */
@Service
public class FormatterService {

    private static final Logger log = LoggerFactory.getLogger(FormatterService.class);

    static final String JOIN_FLAG = "join";
    static final List<String> CASE_FLAGS = Arrays.asList("upper", "lower", "proper", "sentence");

    private final ObjectMapper objectMapper;
    private final String basePath;
    private final Map<String, Map<String, String>> tables = new ConcurrentHashMap<>();

    public FormatterService(ObjectMapper objectMapper, ChatEngineSettings settings) {
        this.objectMapper = objectMapper;
        this.basePath = StringUtils.appendIfMissing(settings.getFormattersPath(), "/");
    }

    /**
     * Formats {@code value} with {@code spec}. Empty when the table is missing or has no entry
     * for the value, so the caller can fall back.
     */
    public Optional<String> format(String spec, StoreValue value) {
        if (StringUtils.isBlank(spec) || value == null || value.isNull()) return Optional.empty();
        List<String> parts = Arrays.asList(spec.trim().split(":"));
        String base = parts.get(0);
        List<String> flags = parts.subList(1, parts.size());
        Optional<String> caseFlag = firstCaseFlag(parts);

        Optional<String> formatted;
        if (CASE_FLAGS.contains(base)) {
            formatted = Optional.of(display(value));
        } else if (flags.contains(JOIN_FLAG)) {
            formatted = formatJoined(base, value);
        } else {
            formatted = table(base).map(t -> t.get(display(value)));
        }
        return formatted.map(s -> caseFlag.map(flag -> applyCase(flag, s)).orElse(s));
    }

    /**
     * Applies the case flags found in {@code spec} to a fallback text; other parts are ignored.
     */
    public String formatFallback(String spec, String fallback) {
        if (StringUtils.isBlank(spec)) return fallback;
        return firstCaseFlag(Arrays.asList(spec.trim().split(":")))
                .map(flag -> applyCase(flag, fallback))
                .orElse(fallback);
    }

    private Optional<String> formatJoined(String base, StoreValue value) {
        Optional<Map<String, String>> table = table(base);
        if (table.isEmpty()) return Optional.empty();

        // a whole-value mapping wins, e.g. "1,2,3,4,5" -> "weekdays"
        if (value.is(StoreValue.Type.STRING) && table.get().containsKey(value.asString())) {
            return Optional.of(table.get().get(value.asString()));
        }
        Optional<List<StoreValue>> items = ValueConversions.toListLike(value);
        if (items.isEmpty()) return Optional.empty();

        List<String> names = new ArrayList<>();
        for (StoreValue item : items.get()) {
            String mapped = table.get().get(display(item));
            if (mapped != null) {
                names.add(mapped);
            }
        }
        return Optional.of(joinWithGrammar(names));
    }

    static String joinWithGrammar(List<String> items) {
        if (items.isEmpty()) return "";
        if (items.size() == 1) return items.get(0);
        return String.join(", ", items.subList(0, items.size() - 1)) + " and " + items.get(items.size() - 1);
    }

    static String applyCase(String flag, String text) {
        if (text == null || text.isEmpty()) return text;
        switch (flag) {
            case "upper":
                return text.toUpperCase(Locale.ROOT);
            case "lower":
                return text.toLowerCase(Locale.ROOT);
            case "proper":
                String[] words = text.toLowerCase(Locale.ROOT).split(" ", -1);
                for (int i = 0; i < words.length; i++) {
                    words[i] = StringUtils.capitalize(words[i]);
                }
                return String.join(" ", words);
            case "sentence":
                return StringUtils.capitalize(text.toLowerCase(Locale.ROOT));
            default:
                return text;
        }
    }

    private static Optional<String> firstCaseFlag(List<String> parts) {
        return parts.stream().filter(CASE_FLAGS::contains).findFirst();
    }

    private static String display(StoreValue value) {
        return value.is(StoreValue.Type.STRING) ? value.asString() : value.toString();
    }

    private Optional<Map<String, String>> table(String name) {
        Map<String, String> table = tables.computeIfAbsent(name, this::loadTable);
        return table.isEmpty() ? Optional.empty() : Optional.of(table);
    }

    private Map<String, String> loadTable(String name) {
        ClassPathResource resource = new ClassPathResource(basePath + name + ".json");
        if (!resource.exists()) {
            log.warn("Formatter table '{}' not found under {}", name, basePath);
            return Collections.emptyMap();
        }
        try (InputStream in = resource.getInputStream()) {
            Map<String, Object> raw = objectMapper.readValue(in, new TypeReference<Map<String, Object>>() {
            });
            Map<String, String> table = new LinkedHashMap<>();
            raw.forEach((k, v) -> table.put(k, String.valueOf(v)));
            log.debug("Loaded formatter '{}' with {} entries", name, table.size());
            return Collections.unmodifiableMap(table);
        } catch (IOException e) {
            log.warn("Formatter table '{}' is not valid JSON", name, e);
            return Collections.emptyMap();
        }
    }
}
