package dev.pmsignal.generation;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used for chat-completion calls.
 *
 * <p>The read timeout is the external deadline of a single generation call; when it fires the
 * call fails with {@link GenerationUnavailableException} and the caller rotates to another key.
 */
@Configuration
public class GenerationConfig {

    /**
     * Creates the REST client qualified as {@code "generationRestClient"}.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties endpoint and timeout settings
     * @return a JSON REST client bound to the provider base URL
     */
    @Bean
    public RestClient generationRestClient(RestClient.Builder builder, GenerationProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        return builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
