package com.sandkev.chatscrape.ingest;

import com.sandkev.chatscrape.source.PeerIdentity;

public record IngestionReport(PeerIdentity peer,
                              long startCursor,
                              CatchUpResult catchUp,
                              int tailProcessed,
                              long cursor,
                              long persistedCursor,
                              boolean cancelled) {

    public int totalProcessed() {
        return catchUp.count() + tailProcessed;
    }

    public boolean checkpointed() {
        return persistedCursor >= cursor;
    }
}
