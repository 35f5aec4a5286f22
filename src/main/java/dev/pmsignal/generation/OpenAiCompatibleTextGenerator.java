package dev.pmsignal.generation;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link TextGenerator} backed by an OpenAI-compatible {@code /chat/completions} endpoint (Groq by
 * default).
 *
 * <p>HTTP 429 maps to {@link RateLimitedException}; any other error status, connection failure or
 * read timeout maps to {@link GenerationUnavailableException}; a response without message content
 * maps to {@link MalformedResponseException}.
 */
@Service
public class OpenAiCompatibleTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleTextGenerator.class);

    private final RestClient restClient;
    private final GenerationProperties properties;

    public OpenAiCompatibleTextGenerator(@Qualifier("generationRestClient") RestClient restClient,
                                         GenerationProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public String generate(String credential, String prompt, GenerationOptions options) {
        ChatCompletionRequest request = new ChatCompletionRequest(
                properties.model(),
                List.of(new ChatMessage("system", options.systemPrompt()),
                        new ChatMessage("user", prompt)),
                options.temperature(),
                options.maxTokens());

        ChatCompletionResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + credential)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new RateLimitedException("Provider rate-limited model " + properties.model());
        } catch (RestClientResponseException e) {
            throw new GenerationUnavailableException(
                    "Provider returned HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new GenerationUnavailableException("Generation call failed: " + e.getMessage(), e);
        }

        return extractContent(response);
    }

    private String extractContent(ChatCompletionResponse response) {
        if (response == null || response.choices() == null || response.choices().isEmpty()) {
            throw new MalformedResponseException("Response contained no choices");
        }
        ChatMessage message = response.choices().get(0).message();
        if (message == null || message.content() == null || message.content().isBlank()) {
            throw new MalformedResponseException("Response contained no message content");
        }
        log.debug("Generated {} characters with {}", message.content().length(), properties.model());
        return message.content();
    }
}
