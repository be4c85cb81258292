package com.ai.coach.component;

import java.util.Optional;

/**
 * Resolves a semantic {@code contentKey} (e.g. {@code bot.acknowledge.completion.positive})
 * into display text. Empty when nothing matches, in which case the node's own text is used.
 */
public interface ContentResolver {

    Optional<String> resolve(String contentKey);
}
