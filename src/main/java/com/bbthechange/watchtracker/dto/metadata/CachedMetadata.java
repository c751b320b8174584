package com.bbthechange.watchtracker.dto.metadata;

import java.util.Objects;

/**
 * A metadata value as served by the cache, with how it was obtained.
 *
 * @param <T> the cached payload
 */
public final class CachedMetadata<T> {

    public enum Source {
        /** Served from the cache within the staleness window. */
        HIT,
        /** Fetched from the catalog for this read. */
        FETCHED,
        /** The re-fetch failed; this is the last value that was fetched successfully. */
        STALE
    }

    private final T value;
    private final Source source;
    private final long fetchedAtMillis;

    public CachedMetadata(T value, Source source, long fetchedAtMillis) {
        this.value = Objects.requireNonNull(value, "value");
        this.source = Objects.requireNonNull(source, "source");
        this.fetchedAtMillis = fetchedAtMillis;
    }

    public T getValue() {
        return value;
    }

    public Source getSource() {
        return source;
    }

    public long getFetchedAtMillis() {
        return fetchedAtMillis;
    }

    public boolean isStale() {
        return source == Source.STALE;
    }
}
