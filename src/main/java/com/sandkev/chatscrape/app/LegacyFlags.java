package com.sandkev.chatscrape.app;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class LegacyFlags {

    private static final Map<String, String> FLAGS = Map.of(
            "-f", "--scraper.tail=true",
            "--follow", "--scraper.tail=true",
            "--reset", "--scraper.reset=true",
            "--db", "--scraper.storage=database",
            "--list-chats", "--scraper.list-chats=true",
            "--json", "--scraper.list-format=json");

    private LegacyFlags() {}

    public static String[] translate(String... args) {
        List<String> out = new ArrayList<>(args.length);
        for (String arg : args) {
            out.add(FLAGS.getOrDefault(arg, arg));
        }
        return out.toArray(String[]::new);
    }
}
