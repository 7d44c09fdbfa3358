package com.vtrates.domain.model;

/**
 * Fetched / saved / rejected counters for one currency class
 */
public record RateCounts(int fetched, int saved, int rejected) {

    public static RateCounts zero() {
        return new RateCounts(0, 0, 0);
    }

    public RateCounts plusFetched(int n) {
        return new RateCounts(fetched + n, saved, rejected);
    }

    public RateCounts plusSaved(int n) {
        return new RateCounts(fetched, saved + n, rejected);
    }

    public RateCounts plusRejected(int n) {
        return new RateCounts(fetched, saved, rejected + n);
    }
}
