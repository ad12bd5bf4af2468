package ai.pokercoach.solver.cache;

/**
 * Where a cached solution came from.
 */
public enum Provenance {
    /** Bulk-loaded ahead of any caller request. */
    PRECOMPUTED("precomputed"),
    /** Solved on demand for a caller. */
    DYNAMIC("dynamic");

    private final String label;

    Provenance(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Provenance fromLabel(String text) {
        for (Provenance provenance : values()) {
            if (provenance.label.equalsIgnoreCase(text) || provenance.name().equalsIgnoreCase(text)) {
                return provenance;
            }
        }
        throw new IllegalArgumentException("Unknown provenance: " + text);
    }

    @Override
    public String toString() {
        return label;
    }
}
