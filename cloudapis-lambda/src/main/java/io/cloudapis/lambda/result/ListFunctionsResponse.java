package io.cloudapis.lambda.result;

import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;
import io.cloudapis.lambda.valueobject.FunctionConfiguration;

import java.util.List;

/**
 * A list of functions. Only the page returned by this call; pass {@link #getNextMarker()} back as
 * {@code Marker} for the next one.
 */
public final class ListFunctionsResponse {

    private final String nextMarker;
    private final List<FunctionConfiguration> functions;

    private ListFunctionsResponse(String nextMarker, List<FunctionConfiguration> functions) {
        this.nextMarker = nextMarker;
        this.functions = functions;
    }

    public static ListFunctionsResponse hydrate(JsonNode data) {
        return new ListFunctionsResponse(
                JsonFields.string(data, "NextMarker"),
                JsonFields.list(data, "Functions", FunctionConfiguration::hydrate));
    }

    /** Null on the last page. */
    public String getNextMarker() {
        return nextMarker;
    }

    public List<FunctionConfiguration> getFunctions() {
        return functions;
    }
}
