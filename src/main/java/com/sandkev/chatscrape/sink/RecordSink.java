package com.sandkev.chatscrape.sink;

import com.sandkev.chatscrape.domain.MessageRecord;

/**
 * Destination for normalized records. Writing the same {@code (peer, id)} twice
 * must replace, never duplicate, because catch-up and tail may overlap and a
 * crash between write and checkpoint replays the message on the next run.
 */
public interface RecordSink {

    /** @return true once the record is durably written */
    boolean write(long peerId, MessageRecord record);

    /** Label used in progress lines, e.g. {@code STDOUT}. */
    String mode();
}
