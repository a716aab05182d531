package com.raditha.mvscan.frontend;

/**
 * Source position of a control-flow node as reported by the front-end.
 *
 * @param file      Short file name of the contract source
 * @param startLine First line of the node (1-indexed)
 * @param endLine   Last line of the node (1-indexed, inclusive)
 */
public record SourceLocation(
        String file,
        int startLine,
        int endLine) {

    /**
     * Placeholder used when the front-end could not map a node to source.
     */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    public SourceLocation {
        if (file == null || file.isBlank()) {
            file = "<unknown>";
        }
        if (endLine < startLine) {
            endLine = startLine;
        }
    }

    /**
     * Get total number of lines covered by the node.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Format as "Vault.sol:L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return file + ":L" + startLine;
        }
        return file + ":L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
