package caseflow.coordinator.model;

/**
 * Answer of one admission check against a rate window.
 * When not admitted, waitMillis is how long until capacity can free up.
 */
public record Admission(boolean admitted, long waitMillis) {

    public static Admission granted() {
        return new Admission(true, 0);
    }

    public static Admission waitFor(long waitMillis) {
        return new Admission(false, Math.max(1, waitMillis));
    }
}
