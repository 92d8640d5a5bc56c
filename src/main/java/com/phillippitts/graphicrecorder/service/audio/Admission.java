package com.phillippitts.graphicrecorder.service.audio;

/**
 * Result of offering one chunk to the pending-audio guard.
 *
 * @param canBuffer true when the chunk may be appended
 * @param reason    why it was refused; null when accepted
 */
public record Admission(boolean canBuffer, DropReason reason) {

    private static final Admission ACCEPTED = new Admission(true, null);

    public Admission {
        if (canBuffer == (reason != null)) {
            throw new IllegalArgumentException("reason must be present exactly when the chunk is refused");
        }
    }

    public static Admission accepted() {
        return ACCEPTED;
    }

    public static Admission rejected(DropReason reason) {
        return new Admission(false, reason);
    }
}
