package io.cloudapis.lambda.result;

import io.cloudapis.json.jackson.JacksonJsonCodec;
import io.cloudapis.json.spi.ArrayNode;
import io.cloudapis.json.spi.ObjectNode;
import io.cloudapis.lambda.enums.State;
import io.cloudapis.lambda.valueobject.EnvironmentResponse;
import io.cloudapis.lambda.valueobject.FunctionConfiguration;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ListFunctionsResponseTest {

    private final JacksonJsonCodec json = new JacksonJsonCodec();

    @Test
    void functionConfigurationSurvivesWriteAndHydrate() throws Exception {
        ObjectNode written = json.createObjectNode().put("NextMarker", "page-2");
        ObjectNode function = written.putArray("Functions").addObject()
                .put("FunctionName", "resize")
                .put("FunctionArn", "arn:aws:lambda:us-east-1:123456789012:function:resize")
                .put("Runtime", "java17")
                .put("Role", "arn:aws:iam::123456789012:role/lambda")
                .put("Handler", "example.Handler::handleRequest")
                .put("CodeSize", 5_368_709_120L)
                .put("Description", "thumbnails")
                .put("Timeout", 30)
                .put("MemorySize", 512)
                .put("LastModified", "2024-05-01T08:00:00.000+0000")
                .put("CodeSha256", "abc=")
                .put("Version", "$LATEST")
                .put("KMSKeyArn", "arn:aws:kms:us-east-1:123456789012:key/k")
                .put("MasterArn", "arn:aws:lambda:us-east-1:123456789012:function:edge")
                .put("RevisionId", "rev-1")
                .put("State", "Active")
                .put("StateReason", "ready")
                .put("StateReasonCode", "Idle")
                .put("LastUpdateStatus", "Successful")
                .put("PackageType", "Zip");
        ObjectNode environment = function.putObject("Environment");
        environment.putObject("Variables").put("STAGE", "prod");
        environment.putObject("Error").put("ErrorCode", "KMSAccessDenied").put("Message", "denied");
        ArrayNode architectures = function.putArray("Architectures");
        architectures.add("arm64");

        ListFunctionsResponse response = ListFunctionsResponse.hydrate(json.readTree(json.writeBytes(written)));

        assertThat(response.getNextMarker()).isEqualTo("page-2");
        assertThat(response.getFunctions()).hasSize(1);
        FunctionConfiguration read = response.getFunctions().get(0);
        assertThat(read.getFunctionName()).isEqualTo("resize");
        assertThat(read.getFunctionArn()).isEqualTo("arn:aws:lambda:us-east-1:123456789012:function:resize");
        assertThat(read.getRuntime()).isEqualTo("java17");
        assertThat(read.getRole()).isEqualTo("arn:aws:iam::123456789012:role/lambda");
        assertThat(read.getHandler()).isEqualTo("example.Handler::handleRequest");
        assertThat(read.getCodeSize()).isEqualTo(5_368_709_120L);
        assertThat(read.getDescription()).isEqualTo("thumbnails");
        assertThat(read.getTimeout()).isEqualTo(30);
        assertThat(read.getMemorySize()).isEqualTo(512);
        assertThat(read.getLastModified()).isEqualTo("2024-05-01T08:00:00.000+0000");
        assertThat(read.getCodeSha256()).isEqualTo("abc=");
        assertThat(read.getVersion()).isEqualTo("$LATEST");
        assertThat(read.getKmsKeyArn()).isEqualTo("arn:aws:kms:us-east-1:123456789012:key/k");
        assertThat(read.getMasterArn()).isEqualTo("arn:aws:lambda:us-east-1:123456789012:function:edge");
        assertThat(read.getRevisionId()).isEqualTo("rev-1");
        assertThat(read.getState()).isEqualTo("Active");
        assertThat(read.getStateReason()).isEqualTo("ready");
        assertThat(read.getStateReasonCode()).isEqualTo("Idle");
        assertThat(read.getLastUpdateStatus()).isEqualTo("Successful");
        assertThat(read.getPackageType()).isEqualTo("Zip");
        assertThat(read.getArchitectures()).containsExactly("arm64");
        EnvironmentResponse env = read.getEnvironment();
        assertThat(env.getVariables()).containsEntry("STAGE", "prod");
        assertThat(env.getError().getErrorCode()).isEqualTo("KMSAccessDenied");
        assertThat(env.getError().getMessage()).isEqualTo("denied");
    }

    @Test
    void hydratesNestedConfiguration() throws Exception {
        ListFunctionsResponse response = ListFunctionsResponse.hydrate(json.readTree("{"
                + "\"NextMarker\":\"next\","
                + "\"Functions\":[{"
                + "\"FunctionName\":\"resize\",\"FunctionArn\":\"arn:aws:lambda:us-east-1:123:function:resize\","
                + "\"Runtime\":\"java17\",\"Handler\":\"example.Handler::handleRequest\",\"CodeSize\":5242880,"
                + "\"Timeout\":15,\"MemorySize\":512,\"LastModified\":\"2024-02-01T10:00:00.000+0000\","
                + "\"Version\":\"$LATEST\",\"State\":\"Active\",\"Architectures\":[\"arm64\"],"
                + "\"Environment\":{\"Variables\":{\"STAGE\":\"prod\"},"
                + "\"Error\":{\"ErrorCode\":\"KMSAccessDenied\",\"Message\":\"denied\"}},"
                + "\"SomeFutureField\":{\"x\":1}}]}"));

        assertThat(response.getNextMarker()).isEqualTo("next");
        assertThat(response.getFunctions()).hasSize(1);

        FunctionConfiguration function = response.getFunctions().get(0);
        assertThat(function.getFunctionName()).isEqualTo("resize");
        assertThat(function.getRuntime()).isEqualTo("java17");
        assertThat(function.getCodeSize()).isEqualTo(5_242_880L);
        assertThat(function.getTimeout()).isEqualTo(15);
        assertThat(function.getMemorySize()).isEqualTo(512);
        assertThat(function.getLastModified()).isEqualTo("2024-02-01T10:00:00.000+0000");
        assertThat(function.getArchitectures()).containsExactly("arm64");
        assertThat(State.exists(function.getState())).isTrue();
        assertThat(function.getEnvironment().getVariables()).containsEntry("STAGE", "prod");
        assertThat(function.getEnvironment().getError().getErrorCode()).isEqualTo("KMSAccessDenied");
        assertThat(function.getEnvironment().getError().getMessage()).isEqualTo("denied");
        assertThat(function.getDescription()).isNull();
        assertThat(function.getKmsKeyArn()).isNull();
    }

    @Test
    void lastPageHasNoMarker() throws Exception {
        ListFunctionsResponse response = ListFunctionsResponse.hydrate(json.readTree("{\"Functions\":[]}"));

        assertThat(response.getNextMarker()).isNull();
        assertThat(response.getFunctions()).isEmpty();
    }
}
