package com.sandkev.chatscrape.config;

import com.sandkev.chatscrape.checkpoint.CheckpointStore;
import com.sandkev.chatscrape.checkpoint.FileCheckpointStore;
import com.sandkev.chatscrape.sink.RecordJson;
import com.sandkev.chatscrape.sink.RecordSink;
import com.sandkev.chatscrape.sink.StdoutRecordSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

import java.io.PrintStream;

@Slf4j
@Configuration
@Conditional(FileStorageCondition.class)
public class FileStorageConfig {

    @Bean
    CheckpointStore fileCheckpointStore(ScraperProperties props) {
        log.info("[state] Using file checkpoints under {}", props.dataDir().toAbsolutePath());
        return new FileCheckpointStore(props.dataDir());
    }

    @Bean
    RecordSink stdoutRecordSink(@Qualifier("dataOut") PrintStream dataOut, RecordJson json) {
        return new StdoutRecordSink(dataOut, json);
    }
}
