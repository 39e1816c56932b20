package com.phillippitts.newwork.service.backend;

import com.phillippitts.newwork.config.properties.BackendProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link HealthProbe} issuing {@code GET <health-path>} on the loopback interface.
 * Only the status code is inspected: 200 means healthy, the body is ignored.
 */
@Component
public class HttpHealthProbe implements HealthProbe {

    private static final Logger LOG = LogManager.getLogger(HttpHealthProbe.class);

    private final URI healthUri;
    private final HttpClient httpClient;

    @Autowired
    public HttpHealthProbe(BackendProperties props) {
        this(URI.create("http://" + props.getHost() + ":" + props.getPort() + props.getHealthPath()),
                HttpClient.newBuilder()
                        .connectTimeout(props.getHealthCheckTimeout())
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .build());
    }

    HttpHealthProbe(URI healthUri, HttpClient httpClient) {
        this.healthUri = Objects.requireNonNull(healthUri, "healthUri");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public boolean isHealthy(Duration timeout) {
        CompletableFuture<HttpResponse<Void>> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(healthUri)
                    .timeout(timeout)
                    .GET()
                    .build();
            response = httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        } catch (RuntimeException e) {
            LOG.debug("Health request to {} could not be sent: {}", healthUri, e.toString());
            return false;
        }
        try {
            int status = response.get(timeout.toMillis(), TimeUnit.MILLISECONDS).statusCode();
            if (status != 200) {
                LOG.debug("Health check {} returned HTTP {}", healthUri, status);
            }
            return status == 200;
        } catch (TimeoutException e) {
            response.cancel(true);
            LOG.debug("Health check {} abandoned after {}ms", healthUri, timeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            LOG.debug("Health check {} failed: {}", healthUri, String.valueOf(e.getCause()));
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response.cancel(true);
            return false;
        }
    }

    public URI getHealthUri() {
        return healthUri;
    }
}
