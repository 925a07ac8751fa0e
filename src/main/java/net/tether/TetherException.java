package net.tether;

import java.io.IOException;

/**
 * Base class for failures raised while supervising a broker connection and the resources on it.
 */
public class TetherException extends IOException {
  private static final long serialVersionUID = 4470218562013473590L;

  public TetherException(String message) {
    super(message);
  }

  public TetherException(String message, Throwable cause) {
    super(message, cause);
  }
}
