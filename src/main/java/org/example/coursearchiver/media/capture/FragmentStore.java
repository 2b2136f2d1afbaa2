package org.example.coursearchiver.media.capture;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes captured fragments to a temporary directory, one file per distinct URL, numbered in
 * arrival order.
 */
final class FragmentStore {

    static final String CONCAT_LIST = "concat.txt";
    private static final Pattern SEQUENCE = Pattern.compile("(?:media|seg|frag|chunk)[-_](\\d+)",
            Pattern.CASE_INSENSITIVE);

    private final Path directory;
    private final Set<String> seenUrls = new HashSet<>();
    private final List<Fragment> fragments = new ArrayList<>();
    private int highestSequence = -1;

    FragmentStore(Path directory) {
        this.directory = directory;
    }

    /**
     * Saves a response if it is a transport-stream segment not seen before.
     *
     * @return {@code true} when a new fragment was stored
     */
    boolean add(CapturedResponse response) throws IOException {
        if (response == null || response.body() == null || !isFragmentUrl(response.url())) {
            return false;
        }
        if (!seenUrls.add(response.url())) {
            return false;
        }
        int index = fragments.size() + 1;
        Path file = directory.resolve(String.format(Locale.ROOT, "fragment_%05d.ts", index));
        Files.write(file, response.body());
        int sequence = parseSequence(response.url(), index);
        highestSequence = Math.max(highestSequence, sequence);
        fragments.add(new Fragment(index, response.body().length, response.url(), sequence, file));
        return true;
    }

    int size() {
        return fragments.size();
    }

    int highestSequence() {
        return highestSequence;
    }

    List<Fragment> fragments() {
        return Collections.unmodifiableList(fragments);
    }

    /**
     * Writes the concat list for the first {@code count} fragments in arrival order.
     */
    Path writeConcatList(int count) throws IOException {
        Path list = directory.resolve(CONCAT_LIST);
        try (BufferedWriter writer = Files.newBufferedWriter(list, StandardCharsets.UTF_8)) {
            for (Fragment fragment : fragments.subList(0, Math.min(count, fragments.size()))) {
                writer.write("file '" + fragment.file().getFileName().toString().replace("'", "'\\''") + "'");
                writer.newLine();
            }
        }
        return list;
    }

    static boolean isFragmentUrl(String url) {
        if (url == null) {
            return false;
        }
        String path = url;
        int cut = path.indexOf('?');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        return path.toLowerCase(Locale.ROOT).endsWith(".ts");
    }

    /**
     * Reads the segment number from names such as {@code media_12.ts} or {@code seg-12.ts};
     * falls back to the arrival index when the URL carries none.
     */
    static int parseSequence(String url, int fallback) {
        Matcher matcher = SEQUENCE.matcher(url);
        int sequence = -1;
        while (matcher.find()) {
            try {
                sequence = Integer.parseInt(matcher.group(1));
            } catch (NumberFormatException e) {
                sequence = -1;
            }
        }
        return sequence >= 0 ? sequence : fallback;
    }
}
