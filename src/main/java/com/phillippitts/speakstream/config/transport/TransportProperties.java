package com.phillippitts.speakstream.config.transport;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the HTTP transport to the transcription service.
 */
@Validated
@ConfigurationProperties(prefix = "transport")
public class TransportProperties {

    /** Service base URL, e.g. https://api.example.com. */
    @NotBlank
    private final String baseUrl;

    /** Service name prefixed to every method path. */
    @NotBlank
    private final String serviceName;

    @Min(100)
    @Max(60_000)
    private final int connectTimeoutMs;

    /** Timeout for unary calls. */
    @Min(100)
    @Max(120_000)
    private final int requestTimeoutMs;

    /** Upper bound for one streaming call, from first byte sent to response. */
    @Min(1_000)
    @Max(3_600_000)
    private final int streamTimeoutMs;

    private final String userAgent;

    @ConstructorBinding
    public TransportProperties(String baseUrl,
                               String serviceName,
                               Integer connectTimeoutMs,
                               Integer requestTimeoutMs,
                               Integer streamTimeoutMs,
                               String userAgent) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.serviceName = (serviceName == null || serviceName.isBlank())
                ? "speakstream.v1.TranscriptionService" : serviceName;
        this.connectTimeoutMs = connectTimeoutMs == null ? 5_000 : connectTimeoutMs;
        this.requestTimeoutMs = requestTimeoutMs == null ? 15_000 : requestTimeoutMs;
        this.streamTimeoutMs = streamTimeoutMs == null ? 300_000 : streamTimeoutMs;
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? "speak-stream" : userAgent;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String getBaseUrl() { return baseUrl; }
    public String getServiceName() { return serviceName; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public int getStreamTimeoutMs() { return streamTimeoutMs; }
    public String getUserAgent() { return userAgent; }
}
