package com.sandkev.chatscrape.app;

import com.sandkev.chatscrape.config.ScraperConfigurationException;
import org.springframework.boot.context.properties.bind.BindException;

public final class ExitCodes {

    public static final int OK = 0;
    public static final int FATAL = 1;
    public static final int CONFIG = 2;

    private ExitCodes() {}

    /** Maps a startup failure to a status by walking its cause chain. */
    public static int forStartupFailure(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ScraperConfigurationException || t instanceof BindException) {
                return CONFIG;
            }
        }
        return FATAL;
    }
}
