package io.cloudapis.core;

import io.cloudapis.core.exception.CloudApiException;
import io.cloudapis.json.jackson.JacksonJsonCodec;
import io.cloudapis.json.spi.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class JsonFieldsTest {

    private final JacksonJsonCodec json = new JacksonJsonCodec();

    @Test
    void missingAndNullKeysReadAsNullOrEmpty() throws Exception {
        JsonNode data = json.readTree("{\"Name\":null}");

        assertThat(JsonFields.string(data, "Name")).isNull();
        assertThat(JsonFields.integer(data, "Size")).isNull();
        assertThat(JsonFields.timestamp(data, "When")).isNull();
        assertThat(JsonFields.stringList(data, "Names")).isEmpty();
        assertThat(JsonFields.stringMap(data, "Tags")).isEmpty();
        assertThat(JsonFields.<JsonNode>object(data, "Nested", n -> n)).isNull();
    }

    @Test
    void readsScalarsAndCollections() throws Exception {
        JsonNode data = json.readTree("{\"Name\":\"q\",\"Size\":42,\"Big\":9000000000,\"On\":true,"
                + "\"When\":1700000000,\"Names\":[\"a\",\"b\"],\"Tags\":{\"env\":\"prod\",\"n\":1},"
                + "\"Blob\":\"aGVsbG8=\",\"Ignored\":{\"deep\":[1,2,3]}}");

        assertThat(JsonFields.string(data, "Name")).isEqualTo("q");
        assertThat(JsonFields.integer(data, "Size")).isEqualTo(42);
        assertThat(JsonFields.longValue(data, "Big")).isEqualTo(9_000_000_000L);
        assertThat(JsonFields.bool(data, "On")).isTrue();
        assertThat(JsonFields.timestamp(data, "When")).isEqualTo(Instant.ofEpochSecond(1700000000L));
        assertThat(JsonFields.stringList(data, "Names")).containsExactly("a", "b");
        assertThat(JsonFields.stringMap(data, "Tags")).containsExactly(
                entry("env", "prod"), entry("n", "1"));
        assertThat(JsonFields.blob(data, "Blob")).isEqualTo("hello".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void wrongShapeIsMalformed() throws Exception {
        JsonNode data = json.readTree("{\"Names\":\"not-a-list\",\"Size\":\"12\",\"Nested\":[1]}");

        assertThatThrownBy(() -> JsonFields.stringList(data, "Names"))
                .isInstanceOf(CloudApiException.MalformedResponse.class)
                .hasMessageContaining("Names");
        assertThatThrownBy(() -> JsonFields.integer(data, "Size"))
                .isInstanceOf(CloudApiException.MalformedResponse.class);
        assertThatThrownBy(() -> JsonFields.object(data, "Nested", n -> n))
                .isInstanceOf(CloudApiException.MalformedResponse.class);
    }

    @Test
    void numbersOutsideTheTargetTypeAreMalformed() throws Exception {
        JsonNode data = json.readTree("{\"Int\":3000000000,\"Frac\":1.5,\"Huge\":18446744073709551621,\"Whole\":7.0}");

        assertThatThrownBy(() -> JsonFields.integer(data, "Int"))
                .isInstanceOf(CloudApiException.MalformedResponse.class)
                .hasMessageContaining("Int");
        assertThatThrownBy(() -> JsonFields.integer(data, "Frac"))
                .isInstanceOf(CloudApiException.MalformedResponse.class);
        assertThatThrownBy(() -> JsonFields.longValue(data, "Huge"))
                .isInstanceOf(CloudApiException.MalformedResponse.class);
        assertThatThrownBy(() -> JsonFields.longValue(data, "Frac"))
                .isInstanceOf(CloudApiException.MalformedResponse.class);
        assertThat(JsonFields.longValue(data, "Int")).isEqualTo(3_000_000_000L);
        assertThat(JsonFields.integer(data, "Whole")).isEqualTo(7);
    }

    @Test
    void diagnosticReadsScalarsAndIgnoresOtherShapes() throws Exception {
        JsonNode data = json.readTree("{\"Reason\":\"SLOW_DOWN\",\"Code\":{\"x\":1},\"List\":[\"a\"],\"Empty\":null}");

        assertThat(JsonFields.diagnostic(data, "Reason")).isEqualTo("SLOW_DOWN");
        assertThat(JsonFields.diagnostic(data, "Code")).isNull();
        assertThat(JsonFields.diagnostic(data, "List")).isNull();
        assertThat(JsonFields.diagnostic(data, "Empty")).isNull();
        assertThat(JsonFields.diagnostic(data, "Missing")).isNull();
        assertThat(JsonFields.diagnostic(null, "Reason")).isNull();
    }

    @Test
    void badTimestampNamesTheField() throws Exception {
        JsonNode data = json.readTree("{\"StartDateTime\":\"soon\"}");

        assertThatThrownBy(() -> JsonFields.timestamp(data, "StartDateTime"))
                .isInstanceOf(CloudApiException.MalformedResponse.class)
                .hasMessageContaining("StartDateTime");
    }

    @Test
    void collectionsAreUnmodifiable() throws Exception {
        JsonNode data = json.readTree("{\"Names\":[\"a\"]}");

        assertThatThrownBy(() -> JsonFields.stringList(data, "Names").add("b"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
