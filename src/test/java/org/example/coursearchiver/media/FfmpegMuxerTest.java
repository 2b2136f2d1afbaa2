package org.example.coursearchiver.media;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FfmpegMuxerTest {

    @TempDir
    Path tempDir;

    private final FfmpegMuxer muxer = new FfmpegMuxer("/opt/ffmpeg/bin/ffmpeg",
            Logger.getLogger(FfmpegMuxerTest.class.getName()));

    @Test
    void remuxCopiesStreamsWithoutReencoding() {
        Path output = tempDir.resolve("1. Intro.part.mp4");

        List<String> command = muxer.remuxCommand("https://cdn/v.m3u8", output);

        assertEquals("/opt/ffmpeg/bin/ffmpeg", command.get(0));
        int input = command.indexOf("-i");
        assertEquals("https://cdn/v.m3u8", command.get(input + 1));
        assertEquals("copy", command.get(command.indexOf("-c") + 1));
        assertEquals(output.toAbsolutePath().toString(), command.get(command.size() - 1));
        assertTrue(command.contains("-y"));
    }

    @Test
    void concatReadsListWithUnsafePathsAllowed() {
        Path list = tempDir.resolve("concat.txt");

        List<String> command = muxer.concatCommand(list, tempDir.resolve("out.part.mp4"));

        assertEquals("concat", command.get(command.indexOf("-f") + 1));
        assertEquals("0", command.get(command.indexOf("-safe") + 1));
        assertEquals(list.toAbsolutePath().toString(), command.get(command.indexOf("-i") + 1));
    }

    @Test
    void partialOutputSitsNextToTarget() {
        assertEquals(tempDir.resolve("3. Genéricos.part.mp4"), FfmpegMuxer.partFileFor(tempDir.resolve("3. Genéricos.mp4")));
    }

    @Test
    void forbiddenDiagnosticsAreRecognised() {
        assertTrue(FfmpegMuxer.looksForbidden("[https @ 0x55] HTTP error 403 Forbidden"));
        assertFalse(FfmpegMuxer.looksForbidden("Connection timed out"));
    }

    @Test
    void missingExecutableIsReportedAsMuxingFailure() {
        FfmpegMuxer missing = new FfmpegMuxer(tempDir.resolve("no-existe-ffmpeg").toString());
        Path output = tempDir.resolve("video.mp4");

        MuxingException error = assertThrows(MuxingException.class, () -> missing.remux("https://cdn/v.m3u8", output));

        assertFalse(error.isForbidden());
        assertTrue(error.getMessage().contains("ffmpegPath"));
        assertFalse(Files.exists(output));
    }
}
