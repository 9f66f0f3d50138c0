package com.sandkev.chatscrape.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.chatscrape.config.ListFormat;
import com.sandkev.chatscrape.source.DialogInfo;
import com.sandkev.chatscrape.source.MessageSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Prints the dialogs the session can reach, to find the target id to scrape. */
@Slf4j
@Component
public class DialogLister {

    private final MessageSource source;
    private final ObjectMapper mapper;
    private final PrintStream out;

    public DialogLister(MessageSource source, ObjectMapper mapper, @Qualifier("dataOut") PrintStream out) {
        this.source = source;
        this.mapper = mapper;
        this.out = out;
    }

    public int list(ListFormat format) {
        List<DialogInfo> dialogs = source.listDialogs();
        for (DialogInfo d : dialogs) {
            if (format == ListFormat.JSON) {
                printJson(d);
            } else {
                printText(d);
            }
        }
        out.flush();
        log.info("Listed {} dialogs", dialogs.size());
        return dialogs.size();
    }

    private void printJson(DialogInfo d) {
        try {
            out.println(mapper.writeValueAsString(d));
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialise dialog {}: {}", d.peerId(), e.getOriginalMessage());
        }
    }

    private void printText(DialogInfo d) {
        out.println(d.title());
        out.println("  ID: " + d.id());
        out.println("  Username: " + d.username());
        out.println("  Type: " + d.type());
        out.println("  PeerID: " + d.peerId());
        if (d.self()) out.println("  This is your own account");
        if (d.bot()) out.println("  Bot account");
        if (d.deleted()) out.println("  Deleted account");
        if (d.participantsCount() != null) out.println("  Participants: " + d.participantsCount());
        if (Boolean.TRUE.equals(d.megagroup())) out.println("  Supergroup");
        if (Boolean.TRUE.equals(d.broadcast())) out.println("  Channel");
        Map<String, Object> ip = d.inputPeer();
        if (!ip.isEmpty()) {
            String ids = ip.entrySet().stream()
                    .filter(e -> !"type".equals(e.getKey()))
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(", "));
            out.println("  InputPeer: " + ip.get("type") + " (" + ids + ")");
        }
        out.println("-".repeat(40));
    }
}
