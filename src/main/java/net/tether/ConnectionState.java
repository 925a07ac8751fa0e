package net.tether;

/**
 * Lifecycle states of a supervised connection.
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  /** The connection closed without being asked to. */
  CLOSURE_DETECTED,
  RECONNECTING,
  /** Reconnection attempts were exhausted. Terminal. */
  FAILED,
  CLOSING;
}
