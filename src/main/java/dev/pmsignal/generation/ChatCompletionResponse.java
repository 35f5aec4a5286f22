package dev.pmsignal.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** The subset of an OpenAI-compatible chat-completion response that is read. */
@JsonIgnoreProperties(ignoreUnknown = true)
record ChatCompletionResponse(List<Choice> choices) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(ChatMessage message) {}
}
