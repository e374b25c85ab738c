package org.silica.compiler.frontend.loader;

/**
 * A file-level failure recorded by the {@link SourceLoader}.
 *
 * @param path    The pattern or path the failure refers to.
 * @param message A description of the failure.
 * @param cause   The underlying exception, or {@code null}.
 */
public record LoadError(String path, String message, Throwable cause) {

    /**
     * Creates an error from an exception, describing it by its type and message.
     *
     * @param path  The pattern or path.
     * @param cause The exception.
     * @return The error.
     */
    public static LoadError of(String path, Throwable cause) {
        String detail = cause.getMessage();
        String message = cause.getClass().getSimpleName() + (detail != null && !detail.equals(path) ? ": " + detail : "");
        return new LoadError(path, message, cause);
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
