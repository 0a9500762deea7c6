package com.signal.corroboration.source;

import com.signal.corroboration.core.model.Observation;

import java.util.List;

/**
 * One information source. Turns whatever it retrieves into observations.
 *
 * <p>Implementations treat failed fetches as "no observations" and never let them escape.
 * Any other exception thrown from {@link #collect()} is isolated by the pipeline and does not
 * affect other sources.</p>
 */
public interface SourceAdapter {

    /**
     * Stable identifier used to activate the source, e.g. "press".
     */
    String id();

    List<Observation> collect();
}
