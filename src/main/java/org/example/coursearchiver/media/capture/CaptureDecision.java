package org.example.coursearchiver.media.capture;

/**
 * What the capture loop should do after a polling tick.
 *
 * @param position target time in seconds for {@code SEEK} and {@code RELOAD}
 * @param keep     number of fragments, in arrival order, to reassemble on {@code STOP}
 */
record CaptureDecision(Action action, double position, int keep, String reason) {

    enum Action {
        CONTINUE,
        SEEK,
        PAUSE,
        RELOAD,
        STOP,
        FAIL
    }

    static final CaptureDecision CONTINUE = new CaptureDecision(Action.CONTINUE, 0, 0, null);

    static CaptureDecision seek(double position, String reason) {
        return new CaptureDecision(Action.SEEK, position, 0, reason);
    }

    static CaptureDecision pause(String reason) {
        return new CaptureDecision(Action.PAUSE, 0, 0, reason);
    }

    static CaptureDecision reload(double resumeAt, String reason) {
        return new CaptureDecision(Action.RELOAD, resumeAt, 0, reason);
    }

    static CaptureDecision stop(int keep, String reason) {
        return new CaptureDecision(Action.STOP, 0, keep, reason);
    }

    static CaptureDecision fail(String reason) {
        return new CaptureDecision(Action.FAIL, 0, 0, reason);
    }
}
