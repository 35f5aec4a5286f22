package dev.pmsignal.generation;

/** Transport failure, timeout, or non-429 error status from the generation endpoint. */
public class GenerationUnavailableException extends GenerationException {

  public GenerationUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
