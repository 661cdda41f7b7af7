package com.airsentinel.ingest.api;

/**
 * Outcome of merging one batch into a city's series.
 *
 * @param added readings that extended the series
 * @param duplicates readings whose timestamp was already present
 * @param rejected readings dropped because their concentration could not be classified
 */
public record AppendResult(int added, int duplicates, int rejected) {
    public static AppendResult empty() {
        return new AppendResult(0, 0, 0);
    }

    public int total() {
        return added + duplicates + rejected;
    }
}
