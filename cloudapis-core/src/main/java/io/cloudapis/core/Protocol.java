package io.cloudapis.core;

/**
 * Header names, content types and error body fields used by the JSON protocols.
 */
public final class Protocol {
    private Protocol() {}

    // Request headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";
    public static final String H_AMZ_TARGET = "X-Amz-Target";

    // Response headers
    public static final String H_REQUEST_ID = "x-amzn-RequestId";
    public static final String H_ERROR_TYPE = "x-amzn-ErrorType";
    public static final String H_QUERY_ERROR = "x-amzn-query-error";
    public static final String H_RETRY_AFTER = "Retry-After";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_AMZ_JSON_1_0 = "application/x-amz-json-1.0";
    public static final String CT_AMZ_JSON_1_1 = "application/x-amz-json-1.1";

    // Error body fields
    public static final String F_TYPE_DISCRIMINATOR = "__type";
    public static final String F_CODE = "code";
    public static final String F_CODE_UPPER = "Code";
    public static final String F_TYPE = "Type";
    public static final String F_TYPE_LOWER = "type";
    public static final String F_MESSAGE = "message";
    public static final String F_MESSAGE_UPPER = "Message";
    public static final String F_DETAIL = "detail";
}
