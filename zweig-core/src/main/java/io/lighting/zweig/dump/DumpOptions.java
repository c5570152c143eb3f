package io.lighting.zweig.dump;

/**
 * Switches for {@link AstDumper}.
 *
 * @param annotateFields   prefix each value with its field name
 * @param includePositions append {@code lineno} and {@code col_offset} for nodes that carry a position
 */
public record DumpOptions(boolean annotateFields, boolean includePositions) {
    public static final DumpOptions DEFAULT = new DumpOptions(true, false);

    public DumpOptions withAnnotateFields(boolean annotateFields) {
        return new DumpOptions(annotateFields, includePositions);
    }

    public DumpOptions withPositions(boolean includePositions) {
        return new DumpOptions(annotateFields, includePositions);
    }
}
