package io.github.jakubt4.lumen.description;

/**
 * Point spread function source. Only the analytic Airy model ({@code "airy"}) is available;
 * file based PSFs are rejected when the channel is built.
 */
public record PsfDescription(String format, String value) {

    public boolean isAiry() {
        return (format == null || "airy".equalsIgnoreCase(format)) && (value == null || value.isBlank());
    }
}
