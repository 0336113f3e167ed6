package io.cloudapis.athena.result;

import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;

public final class StartQueryExecutionOutput {

    private final String queryExecutionId;

    private StartQueryExecutionOutput(String queryExecutionId) {
        this.queryExecutionId = queryExecutionId;
    }

    public static StartQueryExecutionOutput hydrate(JsonNode data) {
        return new StartQueryExecutionOutput(JsonFields.string(data, "QueryExecutionId"));
    }

    /** The unique ID of the query that ran as a result of this request. */
    public String getQueryExecutionId() {
        return queryExecutionId;
    }
}
