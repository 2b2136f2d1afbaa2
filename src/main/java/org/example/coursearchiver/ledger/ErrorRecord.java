package org.example.coursearchiver.ledger;

/**
 * Entry of the append-only failure log. {@code unitId} is {@code null} for course failures.
 */
public record ErrorRecord(Kind kind,
                          String courseId,
                          String unitId,
                          String title,
                          String message,
                          String timestamp) {

    public enum Kind {
        COURSE("course"),
        UNIT("unit");

        private final String wireValue;

        Kind(String wireValue) {
            this.wireValue = wireValue;
        }

        public String getWireValue() {
            return wireValue;
        }

        static Kind fromWire(Object value) {
            return "unit".equals(value) ? UNIT : COURSE;
        }
    }
}
