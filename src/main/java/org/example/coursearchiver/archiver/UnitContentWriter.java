package org.example.coursearchiver.archiver;

import org.example.coursearchiver.http.FileDownloader;
import org.example.coursearchiver.retry.Retrier;
import org.example.coursearchiver.site.Attachment;
import org.example.coursearchiver.site.SubtitleTrack;
import org.example.coursearchiver.site.UnitRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Safelist;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Writes the non-video material of a unit next to its video: subtitles, attached files, the list
 * of recommended readings and a self-contained summary page.
 */
public class UnitContentWriter {

    static final String READINGS_FILE = "Lecturas recomendadas.txt";
    static final String SUMMARY_SUFFIX = "_summary.html";

    private static final String SUMMARY_STYLE =
            "body{font-family:-apple-system,'Segoe UI',Roboto,Arial,sans-serif;line-height:1.8;max-width:900px;"
                    + "margin:0 auto;padding:40px 20px;background:#f5f5f5;color:#2c3e50}"
                    + ".container{background:#fff;padding:40px;border-radius:8px;box-shadow:0 2px 10px rgba(0,0,0,.1)}"
                    + "h1{border-bottom:3px solid #3498db;padding-bottom:10px}"
                    + "code{background:#ecf0f1;padding:2px 6px;border-radius:3px;font-family:'Courier New',monospace}"
                    + "pre{background:#2c3e50;color:#ecf0f1;padding:20px;border-radius:5px;overflow-x:auto}"
                    + "pre code{background:transparent;color:inherit;padding:0}"
                    + "img{max-width:100%}";

    private final FileDownloader downloader;
    private final Retrier retrier;
    private final Logger logger;

    public UnitContentWriter(FileDownloader downloader, Retrier retrier, Logger logger) {
        this.downloader = Objects.requireNonNull(downloader, "downloader");
        this.retrier = Objects.requireNonNull(retrier, "retrier");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * @param unitIndex position of the unit in its chapter
     * @param baseName  {@code "<n>. <title>"}, shared with the video file
     * @return files written
     */
    public List<Path> write(UnitRecord unit, Path chapterDirectory, int unitIndex, String baseName)
            throws IOException, InterruptedException {
        Files.createDirectories(chapterDirectory);
        List<Path> written = new ArrayList<>();
        written.addAll(writeSubtitles(unit, chapterDirectory, baseName));
        written.addAll(writeAttachments(unit, chapterDirectory, unitIndex));
        Path readings = writeReadings(unit, chapterDirectory, unitIndex);
        if (readings != null) {
            written.add(readings);
        }
        Path summary = writeSummary(unit, chapterDirectory, baseName);
        if (summary != null) {
            written.add(summary);
        }
        return written;
    }

    List<Path> writeSubtitles(UnitRecord unit, Path directory, String baseName)
            throws IOException, InterruptedException {
        List<Path> files = new ArrayList<>();
        for (SubtitleTrack track : unit.subtitles()) {
            String suffix = track.language() == null || track.language().isBlank()
                    ? ""
                    : "_" + track.language().trim().toLowerCase(Locale.ROOT);
            Path target = directory.resolve(baseName + suffix + ".vtt");
            fetch("subtítulos", track.url(), target);
            files.add(target);
        }
        return files;
    }

    List<Path> writeAttachments(UnitRecord unit, Path directory, int unitIndex)
            throws IOException, InterruptedException {
        List<Path> files = new ArrayList<>();
        for (Attachment attachment : unit.attachments()) {
            String name = attachment.name() != null && !attachment.name().isBlank()
                    ? attachment.name()
                    : nameFromUrl(attachment.url());
            Path target = directory.resolve(unitIndex + ". " + FileNames.cleanKeepingExtension(name, FileNames.UNIT_TITLE_MAX));
            fetch("archivo adjunto", attachment.url(), target);
            files.add(target);
        }
        return files;
    }

    Path writeReadings(UnitRecord unit, Path directory, int unitIndex) throws IOException {
        if (unit.readings().isEmpty()) {
            return null;
        }
        Path target = directory.resolve(unitIndex + ". " + READINGS_FILE);
        Files.write(target, unit.readings(), StandardCharsets.UTF_8);
        return target;
    }

    Path writeSummary(UnitRecord unit, Path directory, String baseName) throws IOException {
        if (unit.summaryHtml() == null || unit.summaryHtml().isBlank()) {
            return null;
        }
        Path target = directory.resolve(baseName + SUMMARY_SUFFIX);
        Files.writeString(target, renderSummary(unit.title(), unit.summaryHtml()), StandardCharsets.UTF_8);
        return target;
    }

    /**
     * Wraps the sanitized summary in a standalone page; scripts and event handlers are removed.
     */
    static String renderSummary(String title, String summaryHtml) {
        Document page = Document.createShell("");
        page.outputSettings().charset(StandardCharsets.UTF_8);
        page.getElementsByTag("html").attr("lang", "es");
        page.title((title == null ? "" : title) + " - Resumen");
        page.head().prependElement("meta").attr("charset", "UTF-8");
        page.head().appendElement("style").appendChild(new DataNode(SUMMARY_STYLE));
        Element container = page.body().appendElement("div").addClass("container");
        container.appendElement("h1").text(title == null ? "" : title);
        container.append(Jsoup.clean(summaryHtml, Safelist.relaxed()));
        return page.outerHtml();
    }

    private void fetch(String kind, String url, Path target) throws IOException, InterruptedException {
        logger.info(() -> "Descargando " + kind + ": " + target.getFileName());
        retrier.call(kind, () -> {
            downloader.download(url, target);
            return null;
        });
    }

    static String nameFromUrl(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
        }
        if (path == null || path.isBlank()) {
            return "adjunto";
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.isBlank() ? "adjunto" : URLDecoder.decode(name, StandardCharsets.UTF_8);
    }
}
