package org.example.coursearchiver.media;

public enum AcquisitionStrategy {
    DIRECT_MANIFEST("manifiesto directo"),
    FALLBACK_MANIFEST("manifiesto alternativo"),
    BROWSER_INTERCEPTION("intercepción en navegador");

    private final String label;

    AcquisitionStrategy(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
