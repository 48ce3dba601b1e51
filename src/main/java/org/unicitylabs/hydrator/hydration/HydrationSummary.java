package org.unicitylabs.hydrator.hydration;

/**
 * Counts reported by a bulk hydration run.
 */
public class HydrationSummary {

    private final int relaysQueried;
    private final int relaysReached;
    private final int fetched;
    private final int saved;
    private final int skipped;
    private final int errors;
    private final int rejected;
    private final long elapsedMs;

    public HydrationSummary(int relaysQueried, int relaysReached, int fetched, int saved,
                            int skipped, int errors, int rejected, long elapsedMs) {
        this.relaysQueried = relaysQueried;
        this.relaysReached = relaysReached;
        this.fetched = fetched;
        this.saved = saved;
        this.skipped = skipped;
        this.errors = errors;
        this.rejected = rejected;
        this.elapsedMs = elapsedMs;
    }

    public int getRelaysQueried() { return relaysQueried; }
    public int getRelaysReached() { return relaysReached; }
    /** Distinct verified events returned by the relays. */
    public int getFetched() { return fetched; }
    /** New records written. */
    public int getSaved() { return saved; }
    /** Events already stored. */
    public int getSkipped() { return skipped; }
    /** Events that could not be projected or persisted. */
    public int getErrors() { return errors; }
    /** Events dropped by verification before projection. */
    public int getRejected() { return rejected; }
    public long getElapsedMs() { return elapsedMs; }

    /**
     * True unless every relay was unreachable.
     */
    public boolean isSuccessful() {
        return relaysReached > 0;
    }

    @Override
    public String toString() {
        return String.format("relays %d/%d reached, fetched %d, saved %d, skipped %d, errors %d, rejected %d (%d ms)",
                relaysReached, relaysQueried, fetched, saved, skipped, errors, rejected, elapsedMs);
    }
}
