package org.example.coursearchiver.media.capture;

import java.util.Locale;

/**
 * Decides, once per polling tick, whether an interception capture keeps going, nudges the player
 * or ends. It holds no browser state and is driven entirely by the supplied clock readings,
 * playback snapshots and fragment counts.
 * <p>
 * Segments last about ten seconds, so a video of {@code d} seconds is expected to produce
 * {@code ceil(d / 10) + 2} fragments. Reaching that count is not enough to stop: the playback
 * position must also be within the last fifteen seconds of the video.
 */
final class CaptureMonitor {

    static final double SEGMENT_SECONDS = 10.0;
    static final int EXPECTED_EXTRA_FRAGMENTS = 2;
    static final double COMPLETE_RATIO = 0.95;
    static final double NEAR_END_SECONDS = 15.0;
    static final long IDLE_WINDOW_MS = 60_000L;
    static final double IDLE_ACCEPT_RATIO = 0.70;
    static final double PARTIAL_ACCEPT_RATIO = 0.85;
    static final double DURATION_CHANGE_SECONDS = 30.0;
    static final int FRAGMENT_CEILING = 3000;
    static final long SEEK_INTERVAL_MS = 15_000L;
    static final double MIN_PROGRESS_SECONDS = 2.0;
    static final double START_POSITION_SECONDS = 5.0;
    static final long STUCK_SEEK_MS = 30_000L;
    static final long STUCK_RELOAD_MS = 60_000L;
    static final long STUCK_GIVE_UP_MS = 90_000L;
    static final int MAX_RELOADS = 2;
    static final double FORCED_SEEK_SECONDS = 120.0;
    static final double FORCED_SEEK_END_MARGIN = 20.0;
    static final long UNKNOWN_DURATION_TIMEOUT_MS = 900_000L;
    static final long MIN_TIMEOUT_MS = 600_000L;
    static final long MAX_TIMEOUT_MS = 1_800_000L;

    private final long startedAt;
    private double referenceDuration = -1;
    private int consistentCount;
    private int lastCount;
    private long lastFragmentAt;
    private long lastSeekAt;
    private double progressMark = -1;
    private long progressMarkAt;
    private boolean forcedSeekDone;
    private boolean pauseIssued;
    private int reloads;

    CaptureMonitor(long startedAt) {
        this.startedAt = startedAt;
        this.lastFragmentAt = startedAt;
        this.lastSeekAt = startedAt;
        this.progressMarkAt = startedAt;
    }

    CaptureDecision evaluate(long now, PlaybackState state, int count, int highestSequence) {
        if (count > lastCount) {
            lastCount = count;
            lastFragmentAt = now;
        }

        if (state.hasDuration()) {
            if (referenceDuration < 0) {
                referenceDuration = state.duration();
            } else if (Math.abs(state.duration() - referenceDuration) > DURATION_CHANGE_SECONDS) {
                // The player moved on to another video; fragments from this tick may belong to it.
                return CaptureDecision.stop(consistentCount, String.format(Locale.ROOT,
                        "la duración cambió de %.0f s a %.0f s", referenceDuration, state.duration()));
            }
            // Ticks without a duration (player reloading, next video loading) never extend this.
            consistentCount = count;
        }

        if (count >= FRAGMENT_CEILING) {
            return CaptureDecision.stop(count, "límite de seguridad de " + FRAGMENT_CEILING + " fragmentos");
        }

        int expected = expectedFragments();
        double ratio = completion(count);
        double position = state.currentTime();
        boolean knownDuration = referenceDuration > 0;
        boolean nearEnd = knownDuration && position >= referenceDuration - NEAR_END_SECONDS;

        if (knownDuration && count >= COMPLETE_RATIO * expected && nearEnd) {
            return CaptureDecision.stop(count, "captura completa (" + count + "/" + expected + ")");
        }

        if (now - startedAt >= timeoutMillis()) {
            if (count > 0 && ratio >= PARTIAL_ACCEPT_RATIO) {
                return CaptureDecision.stop(count, "tiempo agotado con " + percent(ratio) + " capturado");
            }
            return CaptureDecision.fail("tiempo de captura agotado con " + count + " fragmentos (" + percent(ratio) + ")");
        }

        if (now - lastFragmentAt >= IDLE_WINDOW_MS) {
            if (!knownDuration) {
                if (count > 0) {
                    return CaptureDecision.stop(count, "sin fragmentos nuevos y sin duración conocida");
                }
            } else if (nearEnd || state.ended()) {
                if (ratio >= IDLE_ACCEPT_RATIO) {
                    return CaptureDecision.stop(count, "fin de la reproducción con " + percent(ratio) + " capturado");
                }
                return CaptureDecision.fail("la reproducción terminó con solo " + percent(ratio) + " capturado");
            } else if (ratio < IDLE_ACCEPT_RATIO) {
                lastFragmentAt = now;
                lastSeekAt = now;
                double target = Math.max(position, state.bufferedEnd());
                progressMark = target;
                return CaptureDecision.seek(target, "sin fragmentos nuevos durante "
                        + IDLE_WINDOW_MS / 1000 + " s con " + percent(ratio));
            }
        }

        if (nearEnd || state.ended()) {
            if (!pauseIssued) {
                pauseIssued = true;
                return CaptureDecision.pause("cerca del final; se evita la reproducción automática del siguiente vídeo");
            }
            return CaptureDecision.CONTINUE;
        }

        CaptureDecision recovery = checkStuck(now, position, ratio, count, highestSequence);
        if (recovery != null) {
            return recovery;
        }

        if (now - lastSeekAt >= SEEK_INTERVAL_MS) {
            lastSeekAt = now;
            double target = knownDuration
                    ? Math.min(state.bufferedEnd(), referenceDuration - NEAR_END_SECONDS)
                    : state.bufferedEnd();
            if (target > position + 1) {
                progressMark = target;
                return CaptureDecision.seek(target, "avance periódico hasta el final del búfer");
            }
        }
        return CaptureDecision.CONTINUE;
    }

    /**
     * Escalates with the time the playback position has been stuck: forced seek at 30 s, page
     * reload at 60 s, and after the reload budget is spent, a final verdict at 90 s.
     */
    private CaptureDecision checkStuck(long now, double position, double ratio, int count, int highestSequence) {
        // Only forward movement counts as progress; a seek that the player ignores leaves it stuck.
        if (progressMark < 0 || position - progressMark >= MIN_PROGRESS_SECONDS) {
            progressMark = position;
            progressMarkAt = now;
            forcedSeekDone = false;
            return null;
        }
        long stuckFor = now - progressMarkAt;
        if (stuckFor < STUCK_SEEK_MS) {
            return null;
        }
        if (position <= START_POSITION_SECONDS && reloads < MAX_RELOADS) {
            return reload(now, 0, "reproducción detenida al inicio");
        }
        if (stuckFor >= STUCK_GIVE_UP_MS && reloads >= MAX_RELOADS) {
            if (count > 0 && ratio >= PARTIAL_ACCEPT_RATIO) {
                return CaptureDecision.stop(count, "reproducción bloqueada; se acepta captura parcial del " + percent(ratio));
            }
            return CaptureDecision.fail("reproducción bloqueada tras " + reloads + " recargas con " + percent(ratio) + " capturado");
        }
        if (stuckFor >= STUCK_RELOAD_MS && reloads < MAX_RELOADS) {
            double resumeAt = Math.max(position, Math.max(highestSequence, 0) * SEGMENT_SECONDS);
            return reload(now, resumeAt, "reproducción bloqueada " + stuckFor / 1000 + " s");
        }
        if (!forcedSeekDone) {
            forcedSeekDone = true;
            double target = position + FORCED_SEEK_SECONDS;
            if (referenceDuration > 0) {
                target = Math.min(target, referenceDuration - FORCED_SEEK_END_MARGIN);
            }
            if (target > position) {
                progressMark = target;
                return CaptureDecision.seek(target, "reproducción bloqueada; salto forzado");
            }
        }
        return null;
    }

    private CaptureDecision reload(long now, double resumeAt, String reason) {
        reloads++;
        progressMark = -1;
        progressMarkAt = now;
        forcedSeekDone = false;
        lastSeekAt = now;
        return CaptureDecision.reload(resumeAt, reason + " (recarga " + reloads + "/" + MAX_RELOADS + ")");
    }

    int expectedFragments() {
        if (referenceDuration <= 0) {
            return -1;
        }
        return (int) Math.ceil(referenceDuration / SEGMENT_SECONDS) + EXPECTED_EXTRA_FRAGMENTS;
    }

    double completion(int count) {
        int expected = expectedFragments();
        if (expected <= 0) {
            return 0;
        }
        return Math.min(1.0, (double) count / expected);
    }

    long timeoutMillis() {
        if (referenceDuration <= 0) {
            return UNKNOWN_DURATION_TIMEOUT_MS;
        }
        long estimate = (long) ((referenceDuration / 4 * 3 + 120) * 1000);
        return Math.max(MIN_TIMEOUT_MS, Math.min(MAX_TIMEOUT_MS, estimate));
    }

    int getReloads() {
        return reloads;
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.0f%%", ratio * 100);
    }
}
