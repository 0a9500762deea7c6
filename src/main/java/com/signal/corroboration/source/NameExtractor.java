package com.signal.corroboration.source;

import java.util.Optional;

/**
 * Guesses an entity name from free text such as a page title or snippet.
 */
@FunctionalInterface
public interface NameExtractor {

    Optional<String> extract(String text);
}
