package com.questrail.insights.transport;

/**
 * ApiTransport
 * -----------------------------------------------------------------------------
 * Minimal port for request/response HTTP against the controller host.
 *
 * <p>The transport knows nothing about either management API. It does not
 * interpret status codes, parse bodies, or retry; the HTTP clients above it
 * decide what a response means.</p>
 *
 * <p>Implementations may be backed by Netty or by a test fake.</p>
 */
public interface ApiTransport extends AutoCloseable
{
    /**
     * Execute one request and block until the full response has been received.
     *
     * @throws TransportException if no complete response could be obtained
     */
    ApiResponse execute(ApiRequest request);

    /**
     * Release transport resources. Requests issued afterwards fail.
     */
    @Override
    void close();
}
