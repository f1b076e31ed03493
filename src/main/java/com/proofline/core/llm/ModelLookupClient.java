package com.proofline.core.llm;

import com.proofline.core.config.ProoflineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Asks a vendor's model endpoint ({@code GET .../models/{id}}) whether a model exists.
 */
@Component
public class ModelLookupClient {

    private static final Logger log = LoggerFactory.getLogger(ModelLookupClient.class);

    public enum Result {
        /** The vendor knows the model. */
        FOUND,
        /** The vendor answered 404. */
        NOT_FOUND,
        /** Authentication, connectivity or server failure: the answer is unknown. */
        UNVERIFIABLE
    }

    private final HttpClient httpClient;
    private final Duration timeout;

    public ModelLookupClient(HttpClient httpClient, ProoflineProperties properties) {
        this.httpClient = httpClient;
        this.timeout = Duration.ofSeconds(properties.getModelLookupTimeoutSeconds());
    }

    public Result lookup(String url, Map<String, String> headers) {
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET();
            headers.forEach(builder::header);

            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status == 404) {
                return Result.NOT_FOUND;
            }
            if (status >= 200 && status < 300) {
                return Result.FOUND;
            }
            log.warn("Model lookup {} returned HTTP {}", url, status);
            return Result.UNVERIFIABLE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Model lookup {} interrupted", url);
            return Result.UNVERIFIABLE;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Model lookup {} failed: {}", url, e.getMessage());
            return Result.UNVERIFIABLE;
        }
    }
}
