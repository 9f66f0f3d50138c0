package com.sandkev.chatscrape.checkpoint;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * One plain-text file per peer under {@code <dataDir>/state}, holding the cursor
 * as a decimal number. Writes go to a sibling temp file first and are moved into
 * place, so a crash mid-write leaves the previous value intact.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    private final Path stateDir;

    public FileCheckpointStore(Path dataDir) {
        this.stateDir = dataDir.resolve("state");
        try {
            Files.createDirectories(stateDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create state directory " + stateDir, e);
        }
    }

    Path stateFile(long peerId) {
        return stateDir.resolve(Long.toString(peerId));
    }

    @Override
    public long load(long peerId) {
        Path file = stateFile(peerId);
        try {
            long value = Long.parseLong(Files.readString(file, StandardCharsets.UTF_8).trim());
            if (value < 0) {
                log.warn("[state] Negative cursor {} in {}. Starting from 0", value, file);
                return 0L;
            }
            return value;
        } catch (NoSuchFileException e) {
            log.info("[state] No state file found at {}, starting from 0", file);
            return 0L;
        } catch (NumberFormatException | IOException e) {
            log.warn("[state] Error reading {}: {}. Starting from 0", file, e.toString());
            return 0L;
        }
    }

    @Override
    public boolean save(long peerId, long cursor) {
        Path file = stateFile(peerId);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, Long.toString(cursor), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[state] Saved cursor {} for peer {}", cursor, peerId);
            return true;
        } catch (IOException e) {
            log.error("[state] Error saving state file {}: {}", file, e.toString());
            return false;
        }
    }
}
