package com.signal.corroboration.source;

import java.util.Set;

/**
 * Detects attribute tags (product or technology mentions) in free text.
 */
@FunctionalInterface
public interface TagExtractor {

    Set<String> extract(String text);

    TagExtractor NONE = text -> Set.of();
}
