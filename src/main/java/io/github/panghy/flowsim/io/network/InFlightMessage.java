package io.github.panghy.flowsim.io.network;

import io.github.panghy.flowsim.scheduler.SimInstant;

import java.nio.ByteBuffer;

/**
 * A message between send and delivery. A null payload marks the end of the stream
 * sent by a graceful close.
 */
final class InFlightMessage implements Comparable<InFlightMessage> {

  private final long seq;
  private final SimConnection source;
  private final ByteBuffer payload;
  private final SimInstant deliverAt;

  InFlightMessage(long seq, SimConnection source, ByteBuffer payload, SimInstant deliverAt) {
    this.seq = seq;
    this.source = source;
    this.payload = payload;
    this.deliverAt = deliverAt;
  }

  long getSeq() {
    return seq;
  }

  SimConnection getSource() {
    return source;
  }

  ByteBuffer getPayload() {
    return payload;
  }

  SimInstant getDeliverAt() {
    return deliverAt;
  }

  boolean isFin() {
    return payload == null;
  }

  @Override
  public int compareTo(InFlightMessage o) {
    int cmp = deliverAt.compareTo(o.deliverAt);
    return cmp != 0 ? cmp : Long.compare(seq, o.seq);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof InFlightMessage other && seq == other.seq;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(seq);
  }

  @Override
  public String toString() {
    return "msg#" + seq + " conn " + source.getId() + (isFin() ? " fin" : " " + payload.remaining() + " bytes")
        + " at " + deliverAt;
  }
}
