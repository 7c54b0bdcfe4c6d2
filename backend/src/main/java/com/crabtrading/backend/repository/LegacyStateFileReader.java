package com.crabtrading.backend.repository;

import com.crabtrading.backend.config.LedgerProperties;
import com.crabtrading.backend.exception.LedgerPersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Reads the plain JSON state file left by deployments that predate the database snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LegacyStateFileReader {

    private final LedgerProperties ledgerProperties;

    public Optional<String> read() {
        String configured = ledgerProperties.getState().getLegacyFile();
        if (configured == null || configured.isBlank()) {
            return Optional.empty();
        }
        Path path = Paths.get(configured);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            log.info("Found legacy ledger state file {} ({} bytes)", path, content.length());
            return content.isBlank() ? Optional.empty() : Optional.of(content);
        } catch (IOException e) {
            throw new LedgerPersistenceException("Failed to read legacy state file " + path, e);
        }
    }
}
