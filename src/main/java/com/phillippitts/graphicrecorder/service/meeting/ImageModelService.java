package com.phillippitts.graphicrecorder.service.meeting;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.graphicrecorder.config.properties.ImageModelProperties;
import com.phillippitts.graphicrecorder.exception.DomainException;
import com.phillippitts.graphicrecorder.exception.ErrorCode;
import com.phillippitts.graphicrecorder.protocol.ServerMessage;
import com.phillippitts.graphicrecorder.protocol.ServerMessages;
import com.phillippitts.graphicrecorder.service.session.ConnectionContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

/**
 * Per-connection choice of image model preset.
 */
@Service
public class ImageModelService {

    private static final Logger LOG = LogManager.getLogger(ImageModelService.class);

    private final ImageModelProperties properties;

    public ImageModelService(ImageModelProperties properties) {
        this.properties = properties;
    }

    /**
     * Handles {@code image:model:set}. The current status is re-sent after a rejection too,
     * so a client that optimistically switched its toggle can roll it back.
     */
    public void setPreset(ConnectionContext ctx, JsonNode data) {
        String requested = MeetingPayloads.readText(data, "preset");
        ImageModelPreset preset = ImageModelPreset.fromWire(requested).orElse(null);
        if (preset == null) {
            ctx.send(status(ctx));
            throw new DomainException(ErrorCode.INVALID_IMAGE_MODEL_PRESET, "Invalid image model preset");
        }
        if (!isAvailable(preset)) {
            ctx.send(status(ctx));
            throw new DomainException(ErrorCode.IMAGE_MODEL_NOT_CONFIGURED, "Pro image model is not configured");
        }
        ctx.setImagePreset(preset);
        LOG.info("Image model preset set to {} (model={})", preset.wire(), resolveModel(preset));
        ctx.send(status(ctx));
    }

    public ServerMessage status(ConnectionContext ctx) {
        ImageModelPreset preset = ctx.imagePreset();
        return ServerMessages.imageModelStatus(preset.wire(), resolveModel(preset), isAvailable(ImageModelPreset.PRO));
    }

    public String resolveModel(ImageModelPreset preset) {
        if (preset == ImageModelPreset.PRO && properties.getPro() != null) {
            return properties.getPro();
        }
        return properties.getFlash();
    }

    public boolean isAvailable(ImageModelPreset preset) {
        return preset == ImageModelPreset.FLASH || properties.getPro() != null;
    }
}
