package org.example.coursearchiver.media;

import java.util.ArrayList;
import java.util.List;

/**
 * Primary manifest advertised by the player plus an optional alternative in the other format.
 */
public record ManifestSet(ManifestRef primary, ManifestRef fallback) {

    public boolean isEmpty() {
        return primary == null && fallback == null;
    }

    public List<ManifestRef> inOrder() {
        List<ManifestRef> refs = new ArrayList<>(2);
        if (primary != null) {
            refs.add(primary);
        }
        if (fallback != null) {
            refs.add(fallback);
        }
        return refs;
    }

    public ManifestRef firstOf(ManifestFormat format) {
        for (ManifestRef ref : inOrder()) {
            if (ref.format() == format) {
                return ref;
            }
        }
        return null;
    }
}
