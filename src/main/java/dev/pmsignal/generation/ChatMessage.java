package dev.pmsignal.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A single chat message; {@code role} is {@code system}, {@code user} or {@code assistant}. */
@JsonIgnoreProperties(ignoreUnknown = true)
record ChatMessage(String role, String content) {}
