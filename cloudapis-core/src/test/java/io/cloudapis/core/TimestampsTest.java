package io.cloudapis.core;

import io.cloudapis.core.exception.CloudApiException;
import io.cloudapis.json.jackson.JacksonJsonCodec;
import io.cloudapis.json.spi.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampsTest {

    private final JacksonJsonCodec json = new JacksonJsonCodec();

    @Test
    void parsesIntegralEpochSeconds() throws Exception {
        JsonNode node = json.readTree("{\"t\":1700000000}").get("t");

        assertThat(Timestamps.parse(node)).isEqualTo(Instant.ofEpochSecond(1700000000L));
    }

    @Test
    void parsesFractionalEpochSeconds() throws Exception {
        JsonNode node = json.readTree("{\"t\":1700000000.25}").get("t");

        assertThat(Timestamps.parse(node)).isEqualTo(Instant.ofEpochSecond(1700000000L, 250_000_000L));
    }

    @Test
    void parsesIsoTextWithEveryOffsetForm() {
        Instant expected = Instant.parse("2024-03-01T12:30:00Z");

        assertThat(Timestamps.parse("2024-03-01T12:30:00Z")).isEqualTo(expected);
        assertThat(Timestamps.parse("2024-03-01T12:30:00+00:00")).isEqualTo(expected);
        assertThat(Timestamps.parse("2024-03-01T12:30:00.000+0000")).isEqualTo(expected);
        assertThat(Timestamps.parse("2024-03-01T14:30:00+02:00")).isEqualTo(expected);
    }

    @Test
    void nullAndJsonNullYieldNull() throws Exception {
        assertThat(Timestamps.parse((JsonNode) null)).isNull();
        assertThat(Timestamps.parse(json.readTree("{\"t\":null}").get("t"))).isNull();
    }

    @Test
    void rejectsGarbageText() {
        assertThatThrownBy(() -> Timestamps.parse("yesterday"))
                .isInstanceOf(CloudApiException.MalformedResponse.class)
                .hasMessageContaining("yesterday");
    }

    @Test
    void rejectsEpochSecondsBeyondLongRange() throws Exception {
        JsonNode node = json.readTree("{\"t\":18446744073709551621}").get("t");

        assertThatThrownBy(() -> Timestamps.parse(node))
                .isInstanceOf(CloudApiException.MalformedResponse.class)
                .hasMessageContaining("18446744073709551621");
    }

    @Test
    void rejectsEpochSecondsBeyondInstantRange() throws Exception {
        JsonNode node = json.readTree("{\"t\":9000000000000000000}").get("t");

        assertThatThrownBy(() -> Timestamps.parse(node))
                .isInstanceOf(CloudApiException.MalformedResponse.class);
    }

    @Test
    void rejectsBooleans() throws Exception {
        JsonNode node = json.readTree("{\"t\":true}").get("t");

        assertThatThrownBy(() -> Timestamps.parse(node))
                .isInstanceOf(CloudApiException.MalformedResponse.class);
    }
}
