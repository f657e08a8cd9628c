package io.github.simbo1905.cue.ast;

/// Thrown when source text cannot be parsed.
public class CueParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public CueParseException(String message, String source, int position) {
        super(formatMessage(message, source, position));
        this.position = position;
    }

    /// Returns the character offset where the error occurred.
    public int position() {
        return position;
    }

    private static String formatMessage(String message, String source, int position) {
        if (source == null || position < 0) {
            return message;
        }
        int line = 1;
        int col = 1;
        for (int i = 0; i < Math.min(position, source.length()); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
        return message + " at " + line + ":" + col;
    }
}
