package com.ai.coach.component;

import com.ai.coach.config.ChatEngineSettings;
import com.ai.coach.exception.SequenceLoadException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

@Component
public class ClasspathSequenceSource implements SequenceSource {

    private static final Logger log = LoggerFactory.getLogger(ClasspathSequenceSource.class);

    private static final Pattern SEQUENCE_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final String basePath;

    public ClasspathSequenceSource(ChatEngineSettings settings) {
        this.basePath = StringUtils.appendIfMissing(settings.getSequencesPath(), "/");
    }

    @Override
    public String readDocument(String sequenceId) {
        if (StringUtils.isBlank(sequenceId)) {
            throw new SequenceLoadException(sequenceId, "Sequence id must not be blank");
        }
        if (!SEQUENCE_ID.matcher(sequenceId).matches()) {
            throw new SequenceLoadException(sequenceId, "Invalid sequence id '" + sequenceId + "'");
        }
        String path = basePath + sequenceId + ".json";
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new SequenceLoadException(sequenceId, "Sequence document not found: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            String json = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            log.debug("Read sequence document {} ({} chars)", path, json.length());
            return json;
        } catch (IOException e) {
            throw new SequenceLoadException(sequenceId, "Failed to read sequence document " + path, e);
        }
    }
}
