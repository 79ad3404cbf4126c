package io.bundlemesh.model;

public enum Priority {
    EMERGENCY("emergency", 0),
    EXPEDITED("expedited", 1),
    NORMAL("normal", 2),
    BULK("bulk", 3);

    private final String label;
    private final int rank;

    Priority(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String label() {
        return label;
    }

    /**
     * Lower rank is more urgent. Stored in the bundles table so eviction and
     * listing can order in SQL.
     */
    public int rank() {
        return rank;
    }

    public boolean outranks(Priority other) {
        return rank < other.rank;
    }

    public static Priority fromRank(int rank) {
        for (Priority value : values()) {
            if (value.rank == rank) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority rank: " + rank);
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.label.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
