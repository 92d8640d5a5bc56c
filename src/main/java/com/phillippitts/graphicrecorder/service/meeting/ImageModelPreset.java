package com.phillippitts.graphicrecorder.service.meeting;

import java.util.Optional;

/** Image quality presets a connection can choose between. */
public enum ImageModelPreset {
    FLASH("flash"),
    PRO("pro");

    private final String wire;

    ImageModelPreset(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Optional<ImageModelPreset> fromWire(String value) {
        for (ImageModelPreset preset : values()) {
            if (preset.wire.equals(value)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
