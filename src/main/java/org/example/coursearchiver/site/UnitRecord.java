package org.example.coursearchiver.site;

import org.example.coursearchiver.media.ManifestSet;

import java.util.List;

/**
 * Everything the archiver needs from a unit page. {@code manifests} is {@code null} for units
 * without video; {@code summaryHtml} may be {@code null}.
 */
public record UnitRecord(String url,
                         String title,
                         UnitType type,
                         ManifestSet manifests,
                         List<SubtitleTrack> subtitles,
                         List<Attachment> attachments,
                         List<String> readings,
                         String summaryHtml) {

    public UnitRecord {
        subtitles = subtitles == null ? List.of() : List.copyOf(subtitles);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        readings = readings == null ? List.of() : List.copyOf(readings);
    }

    public boolean hasVideo() {
        return manifests != null && !manifests.isEmpty();
    }
}
