package com.trustboundary.infrastructure.persistence;

import java.nio.file.Path;

/**
 * The seal stored in a ledger file does not match the records it holds.
 */
public class LedgerTamperedException extends RuntimeException {

    private final Path file;

    public LedgerTamperedException(Path file) {
        super("Ledger seal does not match its records: " + file);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
