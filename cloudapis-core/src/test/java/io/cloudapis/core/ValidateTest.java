package io.cloudapis.core;

import io.cloudapis.core.exception.CloudApiException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidateTest {

    enum Color implements WireEnum {
        RED("red"),
        BLUE("blue");

        private final String value;

        Color(String value) {
            this.value = value;
        }

        @Override
        public String value() {
            return value;
        }
    }

    @Test
    void requiredReturnsPresentValue() {
        assertThat(Validate.required("x", "Name", ValidateTest.class)).isEqualTo("x");
    }

    @Test
    void requiredNamesFieldAndOwner() {
        assertThatThrownBy(() -> Validate.required(null, "QueueName", ValidateTest.class))
                .isInstanceOfSatisfying(CloudApiException.MissingRequiredField.class, e -> {
                    assertThat(e.field()).isEqualTo("QueueName");
                    assertThat(e.owner()).isEqualTo(ValidateTest.class.getName());
                })
                .isInstanceOf(CloudApiException.InvalidArgument.class)
                .hasMessageContaining("QueueName");
    }

    @Test
    void memberMatchesWireValueNotConstantName() {
        assertThat(Validate.member("red", Color.class, "Color", ValidateTest.class)).isEqualTo("red");

        assertThatThrownBy(() -> Validate.member("RED", Color.class, "Color", ValidateTest.class))
                .isInstanceOfSatisfying(CloudApiException.InvalidEnumValue.class, e -> {
                    assertThat(e.field()).isEqualTo("Color");
                    assertThat(e.value()).isEqualTo("RED");
                    assertThat(e.enumType()).isEqualTo("Color");
                });
    }

    @Test
    void findReturnsConstant() {
        assertThat(WireEnum.find(Color.class, "blue")).contains(Color.BLUE);
        assertThat(WireEnum.find(Color.class, null)).isEmpty();
    }
}
