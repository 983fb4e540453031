package com.github.salilvnair.toolhub.engine;

public final class ToolHubConstants {

    private ToolHubConstants() {
    }

    public static final String SERVICE_GITHUB = "github";
    public static final String SERVICE_LINEAR = "linear";

    public static final String QUALIFIED_NAME_SEPARATOR = ".";

    public static final String CONTRACT_TYPE_OBJECT = "object";

    public static final String PARAM_TYPE_STRING = "string";
    public static final String PARAM_TYPE_INTEGER = "integer";
    public static final String PARAM_TYPE_NUMBER = "number";
    public static final String PARAM_TYPE_BOOLEAN = "boolean";
    public static final String PARAM_TYPE_ARRAY = "array";
    public static final String PARAM_TYPE_OBJECT = "object";

    public static final String DETAIL_VIOLATIONS = "violations";
    public static final String DETAIL_UPSTREAM_CODE = "upstreamCode";
    public static final String DETAIL_UPSTREAM_STATUS = "upstreamStatus";
    public static final String DETAIL_TIMEOUT_MS = "timeoutMs";
    public static final String DETAIL_TOOL = "tool";
    public static final String DETAIL_SERVICE = "service";

    public static final String UPSTREAM_CODE_NOT_FOUND = "not_found";
    public static final String UPSTREAM_CODE_UNPROCESSABLE = "unprocessable";
    public static final String UPSTREAM_CODE_TIMEOUT = "timeout";

    public static final String INTERNAL_ERROR_MESSAGE = "Tool execution failed due to an internal error";
}
