package com.sandkev.chatscrape.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sandkev.chatscrape.domain.MessageRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;

/**
 * Emits one JSON line per record on the data stream. Diagnostics never go here,
 * so the output can be piped straight into a JSON-lines consumer.
 */
@Slf4j
public class StdoutRecordSink implements RecordSink {

    private final PrintStream out;
    private final RecordJson json;

    public StdoutRecordSink(PrintStream out, RecordJson json) {
        this.out = out;
        this.json = json;
    }

    @Override
    public boolean write(long peerId, MessageRecord record) {
        String line;
        try {
            line = json.toJson(record);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialise message {} for peer {}: {}", record.id(), peerId, e.getOriginalMessage());
            return false;
        }
        synchronized (out) {
            out.println(line);
            out.flush();
        }
        return !out.checkError();
    }

    @Override
    public String mode() {
        return "STDOUT";
    }
}
