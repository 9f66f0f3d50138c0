package com.sandkev.chatscrape;

import com.sandkev.chatscrape.app.ExitCodes;
import com.sandkev.chatscrape.app.LegacyFlags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class ChatScrapeApplication {

    public static void main(String[] args) {
        System.exit(launch(args));
    }

    public static int launch(String[] args) {
        SpringApplication app = new SpringApplication(ChatScrapeApplication.class);
        // the coordinator owns shutdown while a run is active
        app.setRegisterShutdownHook(false);
        ConfigurableApplicationContext ctx;
        try {
            ctx = app.run(LegacyFlags.translate(args));
        } catch (RuntimeException e) {
            int code = ExitCodes.forStartupFailure(e);
            log.error("[{}] Startup failed: {}", code == ExitCodes.CONFIG ? "config" : "fatal", rootMessage(e));
            return code;
        }
        return SpringApplication.exit(ctx);
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null) root = root.getCause();
        return root.getMessage();
    }
}
