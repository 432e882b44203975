package com.tpanalyzer.core.model;

/**
 * A label region of one program.
 *
 * <p>The region starts at the label definition and runs up to the next label definition
 * or the end of the instruction block.
 *
 * @param label label number
 * @param name inline label name (empty if none)
 * @param classification role from the label-range convention
 * @param startIndex index of the label definition in the program's instruction list
 * @param endIndex exclusive end index of the region
 * @param firstLine source line of the label definition
 * @param lastLine source line of the last statement in the region
 */
public record FlowNode(
    int label,
    String name,
    LabelClass classification,
    int startIndex,
    int endIndex,
    int firstLine,
    int lastLine
) {
    /**
     * Compact constructor with validation.
     */
    public FlowNode {
        name = name == null ? "" : name;
        if (classification == null) {
            classification = LabelClass.UNCLASSIFIED;
        }
        if (endIndex < startIndex) {
            throw new IllegalArgumentException("endIndex must not be before startIndex");
        }
    }

    /**
     * Returns the number of statements in the region, including the label itself.
     *
     * @return region size
     */
    public int size() {
        return endIndex - startIndex;
    }

    public String display() {
        return name.isEmpty() ? "LBL[" + label + "]" : "LBL[" + label + ":" + name + "]";
    }
}
