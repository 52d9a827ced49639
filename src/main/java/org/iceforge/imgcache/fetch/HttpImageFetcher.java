package org.iceforge.imgcache.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ImageFetcher} over Spring's reactive {@link WebClient}, blocking for the body.
 */
public class HttpImageFetcher implements ImageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpImageFetcher.class);

    private final WebClient webClient;
    private final Duration timeout;

    public HttpImageFetcher(WebClient.Builder builder, Duration timeout, int maxImageBytes) {
        this(builder
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(true)))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxImageBytes))
                .build(), timeout);
    }

    /** Takes a fully built client; used by tests with a stub exchange function. */
    public HttpImageFetcher(WebClient webClient, Duration timeout) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public FetchResponse fetch(String url) throws IOException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid image url: " + url, e);
        }

        try {
            FetchResponse response = webClient.get()
                    .uri(uri)
                    .exchangeToMono(resp -> resp.bodyToMono(byte[].class)
                            .defaultIfEmpty(new byte[0])
                            .map(body -> new FetchResponse(
                                    resp.statusCode().value(),
                                    resp.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE),
                                    body)))
                    .timeout(timeout)
                    .block();
            if (response == null) {
                throw new IOException("Empty response for " + url);
            }
            log.debug("Fetched {} status={} contentType={} bytes={}",
                    url, response.statusCode(), response.contentType(), response.body().length);
            return response;
        } catch (RuntimeException e) {
            throw new IOException("Fetch failed for " + url, e);
        }
    }
}
