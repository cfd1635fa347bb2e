package com.social100.cipherrelay.error;

/**
 * Fatal to the attempt that raised it, never to the server.
 */
public class ResourceException extends RelayException {

  public ResourceException(ErrorCode code, String message) {
    super(code, message);
  }

  public static ResourceException exhaustedNamespace(int live, long capacity) {
    return new ResourceException(ErrorCode.EXHAUSTED_NAMESPACE,
        "No identity available (" + live + " of " + capacity + " in use), try again later");
  }
}
