package org.example.coursearchiver.media.capture;

import java.io.IOException;
import java.util.List;

/**
 * Unit page opened in the authenticated browser, with its network traffic observed.
 */
public interface CapturePage extends AutoCloseable {

    /**
     * Mutes the video, forces fast playback and starts it at {@code fromSeconds}.
     */
    void startPlayback(double fromSeconds) throws IOException;

    /**
     * Transport-stream responses that finished loading since the previous call.
     */
    List<CapturedResponse> drainResponses() throws IOException;

    PlaybackState playbackState();

    void seek(double seconds) throws IOException;

    void pause() throws IOException;

    /**
     * Reloads the page and resumes playback at {@code resumeAt}.
     */
    void reload(double resumeAt) throws IOException;

    @Override
    void close();

    @FunctionalInterface
    interface Opener {
        CapturePage open(String pageUrl) throws IOException;
    }
}
