package org.example.coursearchiver.media.capture;

/**
 * Snapshot of the page's video element. Times are in seconds; a non-positive or non-finite
 * duration means the player has not reported one yet.
 */
public record PlaybackState(double currentTime, double duration, double bufferedEnd, boolean paused, boolean ended) {

    public static final PlaybackState UNKNOWN = new PlaybackState(0, -1, 0, true, false);

    public boolean hasDuration() {
        return duration > 0 && !Double.isNaN(duration) && !Double.isInfinite(duration);
    }
}
