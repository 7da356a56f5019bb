package com.consullo.sessions.marshal;

import com.consullo.sessions.session.SessionState;
import java.util.Arrays;
import org.apache.commons.lang3.Validate;

/**
 * Immutable request, built on a background thread, for a mutation the
 * coordinating thread applies to one session.
 *
 * @since 1.0
 */
public final class MarshalledRequest {

  public enum Type {
    /** Output bytes from the session's process. */
    DATA_ARRIVED,
    /** The session's process terminated. */
    PROCESS_EXITED,
    /** Move the session to another state. */
    STATE_CHANGE
  }

  private final Type type;
  private final long sessionId;
  private final byte[] data;
  private final int exitCode;
  private final SessionState targetState;

  private MarshalledRequest(Type type, long sessionId, byte[] data, int exitCode, SessionState targetState) {
    this.type = type;
    this.sessionId = sessionId;
    this.data = data;
    this.exitCode = exitCode;
    this.targetState = targetState;
  }

  /**
   * @param sessionId originating session
   * @param data bytes; copied
   * @param offset start of the bytes to copy
   * @param length number of bytes to copy
   * @return request
   */
  public static MarshalledRequest dataArrived(long sessionId, byte[] data, int offset, int length) {
    Validate.notNull(data, "data must not be null");
    Validate.isTrue(offset >= 0 && length >= 0 && offset + length <= data.length, "Invalid offset/length.");
    return new MarshalledRequest(Type.DATA_ARRIVED, sessionId, Arrays.copyOfRange(data, offset, offset + length), 0, null);
  }

  public static MarshalledRequest processExited(long sessionId, int exitCode) {
    return new MarshalledRequest(Type.PROCESS_EXITED, sessionId, null, exitCode, null);
  }

  public static MarshalledRequest stateChange(long sessionId, SessionState targetState) {
    Validate.notNull(targetState, "targetState must not be null");
    return new MarshalledRequest(Type.STATE_CHANGE, sessionId, null, 0, targetState);
  }

  public Type type() {
    return type;
  }

  public long sessionId() {
    return sessionId;
  }

  /**
   * @return copy of the bytes for {@link Type#DATA_ARRIVED}, otherwise an empty array
   */
  public byte[] data() {
    return data == null ? new byte[0] : data.clone();
  }

  public int exitCode() {
    return exitCode;
  }

  /**
   * @return target for {@link Type#STATE_CHANGE}, otherwise null
   */
  public SessionState targetState() {
    return targetState;
  }

  @Override
  public String toString() {
    switch (type) {
      case DATA_ARRIVED:
        return "DATA_ARRIVED(session=" + sessionId + ", " + data.length + " bytes)";
      case PROCESS_EXITED:
        return "PROCESS_EXITED(session=" + sessionId + ", code=" + exitCode + ")";
      default:
        return "STATE_CHANGE(session=" + sessionId + ", " + targetState + ")";
    }
  }
}
