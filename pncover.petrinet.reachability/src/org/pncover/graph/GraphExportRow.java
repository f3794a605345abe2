package org.pncover.graph;

/**
 * One node of the exported tree: (name, label, parent name or null,
 * transition label or null).
 */
public final class GraphExportRow {
    public final String name;
    public final String label;
    public final String parentName;
    public final String transitionLabel;

    public GraphExportRow(String name, String label, String parentName, String transitionLabel) {
        this.name = name;
        this.label = label;
        this.parentName = parentName;
        this.transitionLabel = transitionLabel;
    }

    public boolean hasParent() {
        return parentName != null;
    }

    @Override
    public String toString() {
        return String.format("GraphExportRow{name=%s, label=%s, parent=%s, via=%s}",
                name, label.replace("\n", "\\n"), parentName, transitionLabel);
    }
}
