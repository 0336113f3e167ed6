package io.cloudapis.sqs.valueobject;

import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.ArrayNode;
import io.cloudapis.json.spi.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A user-specified message attribute value.
 *
 * <p>{@code DataType} is required: {@code String}, {@code Number}, {@code Binary}, optionally
 * followed by a custom suffix such as {@code Number.float}. Binary values travel base64 encoded.
 */
public final class MessageAttributeValue {

    private final String stringValue;
    private final byte[] binaryValue;
    private final List<String> stringListValues;
    private final List<byte[]> binaryListValues;
    private final String dataType;

    private MessageAttributeValue(Builder builder) {
        this.stringValue = builder.stringValue;
        this.binaryValue = builder.binaryValue == null ? null : builder.binaryValue.clone();
        this.stringListValues = builder.stringListValues == null ? null : List.copyOf(builder.stringListValues);
        this.binaryListValues = builder.binaryListValues == null ? null : copyBinaries(builder.binaryListValues);
        this.dataType = builder.dataType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MessageAttributeValue ofString(String value) {
        return builder().dataType("String").stringValue(value).build();
    }

    public static MessageAttributeValue ofNumber(String value) {
        return builder().dataType("Number").stringValue(value).build();
    }

    public static MessageAttributeValue ofBinary(byte[] value) {
        return builder().dataType("Binary").binaryValue(value).build();
    }

    public String getStringValue() {
        return stringValue;
    }

    public byte[] getBinaryValue() {
        return binaryValue == null ? null : binaryValue.clone();
    }

    public List<String> getStringListValues() {
        return stringListValues == null ? List.of() : stringListValues;
    }

    public List<byte[]> getBinaryListValues() {
        return binaryListValues == null ? List.of() : binaryListValues;
    }

    public String getDataType() {
        return dataType;
    }

    /**
     * Writes this value's fields into {@code node}. Used by request serialization.
     */
    public void requestBody(ObjectNode node) {
        if (stringValue != null) {
            node.put("StringValue", stringValue);
        }
        if (binaryValue != null) {
            node.put("BinaryValue", Base64.getEncoder().encodeToString(binaryValue));
        }
        if (stringListValues != null) {
            ArrayNode list = node.putArray("StringListValues");
            stringListValues.forEach(list::add);
        }
        if (binaryListValues != null) {
            ArrayNode list = node.putArray("BinaryListValues");
            for (byte[] value : binaryListValues) {
                list.add(Base64.getEncoder().encodeToString(value));
            }
        }
        node.put("DataType", Validate.required(dataType, "DataType", MessageAttributeValue.class));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MessageAttributeValue)) return false;
        MessageAttributeValue other = (MessageAttributeValue) obj;
        return Objects.equals(stringValue, other.stringValue)
                && Arrays.equals(binaryValue, other.binaryValue)
                && Objects.equals(stringListValues, other.stringListValues)
                && binariesEqual(binaryListValues, other.binaryListValues)
                && Objects.equals(dataType, other.dataType);
    }

    @Override
    public int hashCode() {
        int binaries = 0;
        if (binaryListValues != null) {
            for (byte[] value : binaryListValues) {
                binaries = 31 * binaries + Arrays.hashCode(value);
            }
        }
        return Objects.hash(stringValue, Arrays.hashCode(binaryValue), stringListValues, binaries, dataType);
    }

    private static boolean binariesEqual(List<byte[]> a, List<byte[]> b) {
        if (a == null || b == null) return a == b;
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (!Arrays.equals(a.get(i), b.get(i))) return false;
        }
        return true;
    }

    private static List<byte[]> copyBinaries(List<byte[]> source) {
        List<byte[]> out = new ArrayList<>(source.size());
        for (byte[] value : source) {
            out.add(value.clone());
        }
        return Collections.unmodifiableList(out);
    }

    public static final class Builder {
        private String stringValue;
        private byte[] binaryValue;
        private List<String> stringListValues;
        private List<byte[]> binaryListValues;
        private String dataType;

        private Builder() {}

        public Builder stringValue(String stringValue) {
            this.stringValue = stringValue;
            return this;
        }

        public Builder binaryValue(byte[] binaryValue) {
            this.binaryValue = binaryValue;
            return this;
        }

        public Builder stringListValues(List<String> stringListValues) {
            this.stringListValues = stringListValues;
            return this;
        }

        public Builder binaryListValues(List<byte[]> binaryListValues) {
            this.binaryListValues = binaryListValues;
            return this;
        }

        public Builder dataType(String dataType) {
            this.dataType = dataType;
            return this;
        }

        public MessageAttributeValue build() {
            return new MessageAttributeValue(this);
        }
    }
}
