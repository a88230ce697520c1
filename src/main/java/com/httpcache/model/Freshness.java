package com.httpcache.model;

/**
 * Read-time verdict on a stored entry.
 *
 * @param state         fresh or stale at the evaluated instant
 * @param revalidatable whether a conditional request can confirm a stale entry
 */
public record Freshness(State state, boolean revalidatable) {

    public enum State {
        FRESH,
        STALE
    }

    public static Freshness fresh(boolean revalidatable) {
        return new Freshness(State.FRESH, revalidatable);
    }

    public static Freshness stale(boolean revalidatable) {
        return new Freshness(State.STALE, revalidatable);
    }

    public boolean isFresh() {
        return state == State.FRESH;
    }
}
