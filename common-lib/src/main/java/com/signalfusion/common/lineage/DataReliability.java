package com.signalfusion.common.lineage;

/**
 * Trust tier of a recorded value, highest first. {@link #points()} feeds the
 * lineage quality score.
 */
public enum DataReliability {
    HIGH(40),
    MEDIUM(30),
    LOW(20),
    UNCERTAIN(10),
    FALLBACK(5);

    private final int points;

    DataReliability(int points) {
        this.points = points;
    }

    public int points() {
        return points;
    }

    /** The less reliable of the two. */
    public static DataReliability weakest(DataReliability a, DataReliability b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
