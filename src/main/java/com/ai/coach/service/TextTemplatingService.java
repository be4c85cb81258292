package com.ai.coach.service;

import com.ai.coach.store.KeyValueStore;
import com.ai.coach.store.StoreValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {key}}, {@code {key|fallback}} and {@code {key:formatter|fallback}}
 * placeholders from the store. A placeholder with neither a stored value nor a fallback is
 * left as written.
 */
public class TextTemplatingService {

    private static final Logger log = LoggerFactory.getLogger(TextTemplatingService.class);

    static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}:|]+)(?::([^}|]+))?(?:\\|([^}]*))?\\}");

    private final KeyValueStore store;
    private final FormatterService formatterService;

    public TextTemplatingService(KeyValueStore store, FormatterService formatterService) {
        this.store = store;
        this.formatterService = formatterService;
    }

    public String process(String text) {
        if (text == null || text.isEmpty() || text.indexOf('{') < 0) return text;

        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String replacement = resolve(m.group(1).trim(), m.group(2), m.group(3)).orElse(m.group(0));
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Whether the text contains at least one placeholder.
     */
    public static boolean hasPlaceholders(String text) {
        return text != null && PLACEHOLDER.matcher(text).find();
    }

    private Optional<String> resolve(String key, String formatter, String fallback) {
        StoreValue stored = store.get(key);
        if (!stored.isNull()) {
            if (formatter == null) {
                return Optional.of(display(stored));
            }
            Optional<String> formatted = formatterService.format(formatter, stored);
            if (formatted.isPresent()) {
                return formatted;
            }
            log.debug("Formatter '{}' has no entry for {}={}", formatter, key, stored);
        }
        if (fallback != null) {
            return Optional.of(formatter == null ? fallback : formatterService.formatFallback(formatter, fallback));
        }
        return Optional.empty();
    }

    private static String display(StoreValue value) {
        return value.is(StoreValue.Type.STRING) ? value.asString() : value.toString();
    }
}
