package com.ai.coach.component;

import com.ai.coach.exception.SequenceLoadException;

/**
 * Where raw sequence documents come from.
 */
public interface SequenceSource {

    /**
     * Returns the JSON text of the document for {@code sequenceId}.
     *
     * @throws SequenceLoadException when the document does not exist or cannot be read
     */
    String readDocument(String sequenceId);
}
