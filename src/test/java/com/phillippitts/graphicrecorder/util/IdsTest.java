package com.phillippitts.graphicrecorder.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdsTest {

    @Test
    void generatedMeetingIdsAreValid() {
        String id = Ids.newMeetingId();

        assertThat(Ids.isValidMeetingId(id)).isTrue();
        assertThat(Ids.newMeetingId()).isNotEqualTo(id);
    }

    @Test
    void meetingIdMustBeUuid() {
        assertThat(Ids.isValidMeetingId("1B4E28BA-2FA1-41D2-883F-0016D3CCA427")).isTrue();
        assertThat(Ids.isValidMeetingId(null)).isFalse();
        assertThat(Ids.isValidMeetingId("")).isFalse();
        assertThat(Ids.isValidMeetingId("1b4e28ba2fa141d2883f0016d3cca427")).isFalse();
        assertThat(Ids.isValidMeetingId("../../etc/passwd")).isFalse();
    }

    @Test
    void generatedSessionIdsCarryTimestampAndAreValid() {
        String id = Ids.newSessionId(1_736_935_200_000L);

        assertThat(id).startsWith("session-1736935200000-");
        assertThat(Ids.isValidSessionId(id)).isTrue();
    }

    @Test
    void sessionIdCharset() {
        assertThat(Ids.isValidSessionId("abc_DEF-123")).isTrue();
        assertThat(Ids.isValidSessionId("a".repeat(64))).isTrue();
        assertThat(Ids.isValidSessionId("a".repeat(65))).isFalse();
        assertThat(Ids.isValidSessionId("has space")).isFalse();
        assertThat(Ids.isValidSessionId("")).isFalse();
        assertThat(Ids.isValidSessionId(null)).isFalse();
    }
}
