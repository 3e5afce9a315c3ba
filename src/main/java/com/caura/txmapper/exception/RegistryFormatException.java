package com.caura.txmapper.exception;

/**
 * Exception thrown when a registry snapshot is readable but has an invalid shape:
 * neither a flat id-to-record mapping nor a {@code {metadata, clients:[...]}} envelope,
 * malformed JSON, or records that break the unique client id invariant.
 */
public class RegistryFormatException extends RegistryLoadException {

    public RegistryFormatException(String message, String source) {
        super(message, source);
    }

    public RegistryFormatException(String message, String source, Throwable cause) {
        super(message, source, cause);
    }
}
