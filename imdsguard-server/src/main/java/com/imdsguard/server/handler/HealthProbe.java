package com.imdsguard.server.handler;

import com.imdsguard.server.guard.GuardedHandler;
import com.imdsguard.server.guard.HandlerContext;
import com.imdsguard.server.guard.HandlerException;
import com.imdsguard.server.guard.HandlerResult;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/** Reports whether the metadata endpoint answers, by fetching the instance id from it. */
public class HealthProbe implements GuardedHandler {

    public static final String NAME = "health";
    static final String INSTANCE_ID_PATH = "/latest/meta-data/instance-id";

    private final HttpClient client;
    private final URI instanceIdUri;
    private final Duration timeout;

    public HealthProbe(HttpClient client, URI metadataEndpoint, Duration timeout) {
        this.client = client;
        this.instanceIdUri = URI.create(metadataEndpoint.toString() + INSTANCE_ID_PATH);
        this.timeout = timeout;
    }

    @Override
    public HandlerResult handle(HandlerContext context) throws HandlerException {
        HttpRequest request = HttpRequest.newBuilder(instanceIdUri)
                .timeout(bounded(context.remaining()))
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new HandlerException(500, "metadata endpoint unreachable", "timed out calling " + instanceIdUri, e);
        } catch (IOException e) {
            throw new HandlerException(500, "metadata endpoint unreachable", "error calling " + instanceIdUri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HandlerException(504, "request timed out", "interrupted calling " + instanceIdUri, e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new HandlerException(
                    500,
                    "metadata endpoint unhealthy",
                    "metadata endpoint returned " + response.statusCode() + " for " + instanceIdUri);
        }
        return HandlerResult.text(response.body());
    }

    private Duration bounded(Duration remaining) {
        Duration limit = remaining.compareTo(timeout) < 0 ? remaining : timeout;
        return limit.isZero() ? Duration.ofMillis(1) : limit;
    }
}
