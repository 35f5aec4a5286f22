package dev.pmsignal.generation;

/** The provider answered, but the payload could not be used. */
public class MalformedResponseException extends GenerationException {

  public MalformedResponseException(String message) {
    super(message);
  }

  public MalformedResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
