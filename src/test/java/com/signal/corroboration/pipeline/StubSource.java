package com.signal.corroboration.pipeline;

import com.signal.corroboration.core.model.Observation;
import com.signal.corroboration.source.SourceAdapter;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Adapter returning whatever its supplier produces, counting invocations.
 */
class StubSource implements SourceAdapter {

    private final String id;
    private final Supplier<List<Observation>> body;
    private final AtomicInteger invocations = new AtomicInteger();

    StubSource(String id, Supplier<List<Observation>> body) {
        this.id = id;
        this.body = body;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<Observation> collect() {
        invocations.incrementAndGet();
        return body.get();
    }

    int invocations() {
        return invocations.get();
    }
}
