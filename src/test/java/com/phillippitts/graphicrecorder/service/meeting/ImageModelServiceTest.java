package com.phillippitts.graphicrecorder.service.meeting;

import com.phillippitts.graphicrecorder.exception.DomainException;
import com.phillippitts.graphicrecorder.exception.ErrorCode;
import com.phillippitts.graphicrecorder.protocol.ServerMessages.ImageModelStatusData;
import com.phillippitts.graphicrecorder.testutil.RecorderHarness;
import com.phillippitts.graphicrecorder.testutil.RecorderHarness.Client;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageModelServiceTest {

    private RecorderHarness h;
    private Client client;

    @BeforeEach
    void setUp() {
        h = new RecorderHarness();
        client = h.connect("s1");
    }

    private ImageModelStatusData lastStatus() {
        List<ImageModelStatusData> statuses = client.connection().dataOf("image:model:status", ImageModelStatusData.class);
        assertThat(statuses).isNotEmpty();
        return statuses.get(statuses.size() - 1);
    }

    @Test
    void defaultsToFlash() {
        ImageModelStatusData status = (ImageModelStatusData) h.imageModels.status(client.ctx()).data();

        assertThat(status.preset()).isEqualTo("flash");
        assertThat(status.model()).isEqualTo("gemini-2.5-flash-image");
        assertThat(status.available()).isFalse();
    }

    @Test
    void switchesToProWhenConfigured() {
        h.imageModelProperties.setPro("gemini-3-pro-image");

        h.imageModels.setPreset(client.ctx(), h.json("{\"preset\":\"pro\"}"));

        assertThat(client.ctx().imagePreset()).isEqualTo(ImageModelPreset.PRO);
        assertThat(lastStatus().preset()).isEqualTo("pro");
        assertThat(lastStatus().model()).isEqualTo("gemini-3-pro-image");
        assertThat(lastStatus().available()).isTrue();
    }

    @Test
    void rejectsProWhenNotConfiguredButStillReportsStatus() {
        assertThatThrownBy(() -> h.imageModels.setPreset(client.ctx(), h.json("{\"preset\":\"pro\"}")))
                .isInstanceOf(DomainException.class)
                .extracting(e -> ((DomainException) e).getCode())
                .isEqualTo(ErrorCode.IMAGE_MODEL_NOT_CONFIGURED);

        assertThat(client.ctx().imagePreset()).isEqualTo(ImageModelPreset.FLASH);
        assertThat(lastStatus().preset()).isEqualTo("flash");
    }

    @Test
    void rejectsUnknownPreset() {
        assertThatThrownBy(() -> h.imageModels.setPreset(client.ctx(), h.json("{\"preset\":\"ultra\"}")))
                .isInstanceOf(DomainException.class)
                .extracting(e -> ((DomainException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_IMAGE_MODEL_PRESET);
        assertThatThrownBy(() -> h.imageModels.setPreset(client.ctx(), h.json("{}")))
                .isInstanceOf(DomainException.class);

        assertThat(client.connection().types()).containsExactly("image:model:status", "image:model:status");
    }

    @Test
    void blankProModelCountsAsUnconfigured() {
        h.imageModelProperties.setPro("   ");

        assertThat(h.imageModelProperties.getPro()).isNull();
        assertThat(h.imageModels.isAvailable(ImageModelPreset.PRO)).isFalse();
        assertThat(h.imageModels.resolveModel(ImageModelPreset.PRO)).isEqualTo("gemini-2.5-flash-image");
    }

    @Test
    void routedThroughMessageRouterProducesErrorFrame() {
        h.send(client, "{\"type\":\"image:model:set\",\"data\":{\"preset\":\"pro\"}}");

        assertThat(client.connection().types()).containsExactly("image:model:status", "error");
        assertThat(client.connection().errors().get(0).code()).isEqualTo("IMAGE_MODEL_NOT_CONFIGURED");
    }
}
