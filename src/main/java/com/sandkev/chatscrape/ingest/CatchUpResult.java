package com.sandkev.chatscrape.ingest;

public record CatchUpResult(long maxId, int count, Outcome outcome) {

    public enum Outcome {
        /** source ran dry */
        COMPLETE,
        /** a page fetch failed; later messages were not seen */
        FETCH_FAILED,
        /** the sink rejected a record; nothing after it was delivered */
        SINK_FAILED,
        CANCELLED
    }

    public boolean complete() {
        return outcome == Outcome.COMPLETE;
    }
}
