/**
 * Transport layer of the example.
 *
 * <p>{@link com.ryuqq.expected.example.transport.TransportClient} turns raw HTTP
 * responses into {@code Result<HttpResponse, TransportError>}. The actual HTTP
 * client sits behind {@link com.ryuqq.expected.example.transport.HttpTransport}.</p>
 *
 * @since 1.0.0
 * @author Expected Team
 */
package com.ryuqq.expected.example.transport;
