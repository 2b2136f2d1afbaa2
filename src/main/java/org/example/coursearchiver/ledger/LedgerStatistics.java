package org.example.coursearchiver.ledger;

/**
 * Aggregate counters. Mutated only by {@link CheckpointStore}, which keeps each counter equal to
 * the number of entities currently in the matching state.
 */
public class LedgerStatistics {
    private int totalCourses;
    private int completedCourses;
    private int failedCourses;
    private int totalUnits;
    private int completedUnits;
    private int failedUnits;

    public int getTotalCourses() {
        return totalCourses;
    }

    public int getCompletedCourses() {
        return completedCourses;
    }

    public int getFailedCourses() {
        return failedCourses;
    }

    public int getTotalUnits() {
        return totalUnits;
    }

    public int getCompletedUnits() {
        return completedUnits;
    }

    public int getFailedUnits() {
        return failedUnits;
    }

    void addTotalCourses(int delta) {
        totalCourses = Math.max(0, totalCourses + delta);
    }

    void addCompletedCourses(int delta) {
        completedCourses = Math.max(0, completedCourses + delta);
    }

    void addFailedCourses(int delta) {
        failedCourses = Math.max(0, failedCourses + delta);
    }

    void addTotalUnits(int delta) {
        totalUnits = Math.max(0, totalUnits + delta);
    }

    void addCompletedUnits(int delta) {
        completedUnits = Math.max(0, completedUnits + delta);
    }

    void addFailedUnits(int delta) {
        failedUnits = Math.max(0, failedUnits + delta);
    }

    void restore(int totalCourses, int completedCourses, int failedCourses,
                 int totalUnits, int completedUnits, int failedUnits) {
        this.totalCourses = totalCourses;
        this.completedCourses = completedCourses;
        this.failedCourses = failedCourses;
        this.totalUnits = totalUnits;
        this.completedUnits = completedUnits;
        this.failedUnits = failedUnits;
    }

    public LedgerStatistics copy() {
        LedgerStatistics copy = new LedgerStatistics();
        copy.restore(totalCourses, completedCourses, failedCourses, totalUnits, completedUnits, failedUnits);
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LedgerStatistics that)) {
            return false;
        }
        return totalCourses == that.totalCourses
                && completedCourses == that.completedCourses
                && failedCourses == that.failedCourses
                && totalUnits == that.totalUnits
                && completedUnits == that.completedUnits
                && failedUnits == that.failedUnits;
    }

    @Override
    public int hashCode() {
        int result = totalCourses;
        result = 31 * result + completedCourses;
        result = 31 * result + failedCourses;
        result = 31 * result + totalUnits;
        result = 31 * result + completedUnits;
        result = 31 * result + failedUnits;
        return result;
    }

    @Override
    public String toString() {
        return "LedgerStatistics{courses=" + completedCourses + "/" + totalCourses
                + " (failed " + failedCourses + "), units=" + completedUnits + "/" + totalUnits
                + " (failed " + failedUnits + ")}";
    }
}
