package dev.gatekeeper.exception;

/**
 * A file's patch text is not a well-formed unified diff. The file is skipped; the run continues.
 */
public class PatchParseException extends RuntimeException {
    private final int physicalLine;

    public PatchParseException(String message, int physicalLine) {
        super("%s (patch line %d)".formatted(message, physicalLine));
        this.physicalLine = physicalLine;
    }

    public int getPhysicalLine() {
        return physicalLine;
    }
}
