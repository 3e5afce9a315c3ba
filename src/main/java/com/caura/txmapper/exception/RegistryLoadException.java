package com.caura.txmapper.exception;

/**
 * Exception thrown when the client registry cannot be loaded.
 * No partial registry is ever published when this is raised.
 */
public class RegistryLoadException extends RuntimeException {

    private final String source;

    public RegistryLoadException(String message, String source) {
        super(message);
        this.source = source;
    }

    public RegistryLoadException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * Description of the registry source that failed to load.
     */
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
               "message='" + getMessage() + '\'' +
               ", source='" + source + '\'' +
               '}';
    }
}
