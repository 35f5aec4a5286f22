package dev.pmsignal.generation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Request body of an OpenAI-compatible {@code /chat/completions} call. */
record ChatCompletionRequest(
        String model,
        List<ChatMessage> messages,
        double temperature,
        @JsonProperty("max_tokens") int maxTokens
) {}
