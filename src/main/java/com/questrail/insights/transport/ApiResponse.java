package com.questrail.insights.transport;

/**
 * A complete HTTP response. {@code body} is the UTF-8 decoded payload, empty
 * when the response carried none.
 */
public record ApiResponse(int status, String body)
{
    public ApiResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
