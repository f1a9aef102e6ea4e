package com.example.marketdata.stream;

import lombok.Value;

/**
 * How a protocol classifies one envelope received while waiting for a handshake reply.
 */
@Value
public class HandshakeReply {

    public enum Kind { ACCEPTED, REJECTED, IGNORED }

    Kind kind;
    String detail;

    public static HandshakeReply accepted() {
        return new HandshakeReply(Kind.ACCEPTED, null);
    }

    public static HandshakeReply rejected(String detail) {
        return new HandshakeReply(Kind.REJECTED, detail);
    }

    public static HandshakeReply ignored() {
        return new HandshakeReply(Kind.IGNORED, null);
    }
}
