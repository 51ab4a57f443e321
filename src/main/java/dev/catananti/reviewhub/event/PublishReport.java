package dev.catananti.reviewhub.event;

/**
 * Outcome of a single publish: how many subscribers took the event and how many were dropped for overflow.
 */
public record PublishReport(int delivered, int dropped) {

    public static final PublishReport EMPTY = new PublishReport(0, 0);

    public boolean degraded() {
        return dropped > 0;
    }
}
