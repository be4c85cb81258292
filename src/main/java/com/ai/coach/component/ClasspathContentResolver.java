package com.ai.coach.component;

import com.ai.coach.config.ChatEngineSettings;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Maps {@code actor.action.subject[.modifier...]} onto text files under the content root:
 * <ol>
 *   <li>{@code actor/action/subject_mod1_mod2.txt}, then with trailing modifiers dropped</li>
 *   <li>{@code actor/action/subject.txt}</li>
 *   <li>the same chain for the generic subject ({@code taskCompletion} -> {@code completion})</li>
 *   <li>{@code actor/action/default.txt}</li>
 * </ol>
 * Each non-blank line of a file is one variant; one is picked at random.
 */
@Component
public class ClasspathContentResolver implements ContentResolver {

    private static final Logger log = LoggerFactory.getLogger(ClasspathContentResolver.class);

    private static final List<String> GENERIC_SUBJECTS = Arrays.asList(
            "completion", "failure", "success", "error", "input", "name",
            "welcome", "save", "delete", "update", "create", "status",
            "selection", "permission", "creation", "modification");

    private final String basePath;
    private final Random random;
    private final Map<String, List<String>> variantsByPath = new ConcurrentHashMap<>();

    @Autowired
    public ClasspathContentResolver(ChatEngineSettings settings) {
        this(settings, new Random());
    }

    public ClasspathContentResolver(ChatEngineSettings settings, Random random) {
        this.basePath = StringUtils.appendIfMissing(settings.getContentPath(), "/");
        this.random = random;
    }

    @Override
    public Optional<String> resolve(String contentKey) {
        if (StringUtils.isBlank(contentKey)) return Optional.empty();
        String[] parts = contentKey.trim().split("\\.");
        if (parts.length < 3) {
            log.warn("Content key '{}' is not of the form actor.action.subject", contentKey);
            return Optional.empty();
        }
        for (String path : fallbackChain(parts)) {
            List<String> variants = variantsByPath.computeIfAbsent(path, this::loadVariants);
            if (!variants.isEmpty()) {
                String picked = variants.get(random.nextInt(variants.size()));
                log.debug("Content key '{}' resolved from {}", contentKey, path);
                return Optional.of(picked);
            }
        }
        log.debug("Content key '{}' has no content file, keeping node text", contentKey);
        return Optional.empty();
    }

    List<String> fallbackChain(String[] parts) {
        String dir = basePath + parts[0] + "/" + parts[1] + "/";
        String subject = parts[2];
        List<String> modifiers = Arrays.asList(parts).subList(3, parts.length);

        List<String> paths = new ArrayList<>();
        addSubjectPaths(paths, dir, subject, modifiers);
        String generic = genericSubject(subject);
        if (!generic.equals(subject)) {
            addSubjectPaths(paths, dir, generic, modifiers);
        }
        paths.add(dir + "default.txt");
        return paths;
    }

    private static void addSubjectPaths(List<String> paths, String dir, String subject, List<String> modifiers) {
        for (int i = modifiers.size(); i > 0; i--) {
            paths.add(dir + subject + "_" + String.join("_", modifiers.subList(0, i)) + ".txt");
        }
        paths.add(dir + subject + ".txt");
    }

    static String genericSubject(String subject) {
        for (String suffix : GENERIC_SUBJECTS) {
            if (subject.endsWith(suffix) && !subject.equals(suffix)) {
                return suffix;
            }
        }
        return subject;
    }

    private List<String> loadVariants(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) return Collections.emptyList();
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).lines()
                    .map(String::trim)
                    .filter(StringUtils::isNotEmpty)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to read content file {}", path, e);
            return Collections.emptyList();
        }
    }
}
