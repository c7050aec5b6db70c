package com.example.backupmonitor.service.channel;

import com.example.backupmonitor.model.ChannelKind;

public class ChannelDeliveryException extends RuntimeException {

  public enum Kind {
    /** Network failure or timeout; worth retrying. */
    TRANSIENT,
    /** Rejected configuration such as an invalid address or topic; retrying cannot help. */
    PERMANENT
  }

  private final ChannelKind channel;
  private final Kind kind;

  public ChannelDeliveryException(ChannelKind channel, Kind kind, String message) {
    super(message);
    this.channel = channel;
    this.kind = kind;
  }

  public ChannelDeliveryException(ChannelKind channel, Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.channel = channel;
    this.kind = kind;
  }

  public ChannelKind channel() {
    return channel;
  }

  public Kind kind() {
    return kind;
  }

  public boolean permanent() {
    return kind == Kind.PERMANENT;
  }
}
