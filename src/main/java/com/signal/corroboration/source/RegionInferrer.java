package com.signal.corroboration.source;

/**
 * Infers a region label from free text; returns "" when nothing matches.
 */
@FunctionalInterface
public interface RegionInferrer {

    String infer(String text);

    RegionInferrer NONE = text -> "";
}
