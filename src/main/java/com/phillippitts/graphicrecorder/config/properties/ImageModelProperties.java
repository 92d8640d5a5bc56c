package com.phillippitts.graphicrecorder.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Image models behind the {@code flash} and {@code pro} presets. The pro preset is only
 * offered when a model is configured for it.
 */
@ConfigurationProperties(prefix = "recording.image-model")
@Validated
public class ImageModelProperties {

    @NotBlank
    private String flash = "gemini-2.5-flash-image";

    private String pro;

    public String getFlash() {
        return flash;
    }

    public void setFlash(String flash) {
        this.flash = flash;
    }

    public String getPro() {
        return pro;
    }

    public void setPro(String pro) {
        this.pro = (pro == null || pro.isBlank()) ? null : pro.trim();
    }
}
