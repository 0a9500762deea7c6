package com.signal.corroboration.fetch;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link Fetcher#fetch(URI)}: either a document or a failure reason, never both.
 * Callers treat a failure as "no observations from this call".
 */
public final class FetchResult {
    private final URI target;
    private final FetchedDocument document;
    private final FailureReason failureReason;

    private FetchResult(URI target, FetchedDocument document, FailureReason failureReason) {
        this.target = target;
        this.document = document;
        this.failureReason = failureReason;
    }

    public static FetchResult success(FetchedDocument document) {
        Objects.requireNonNull(document, "document is required");
        return new FetchResult(document.requestedUri(), document, null);
    }

    public static FetchResult failure(URI target, FailureReason reason) {
        Objects.requireNonNull(reason, "reason is required");
        return new FetchResult(target, null, reason);
    }

    public URI getTarget() {
        return target;
    }

    public boolean isSuccess() {
        return document != null;
    }

    public Optional<FetchedDocument> getDocument() {
        return Optional.ofNullable(document);
    }

    public Optional<FailureReason> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "FetchResult{success, strategy=" + document.strategy() + ", target=" + target + '}'
                : "FetchResult{failure, reason=" + failureReason + ", target=" + target + '}';
    }
}
