package com.example.hookhub.protocol;

/**
 * Constants shared by both ends of the tunnel.
 */
public final class TunnelProtocol {

    /** Path of the WebSocket endpoint; everything else on the server is webhook ingress. */
    public static final String TUNNEL_PATH = "/__hookhub__/";

    /** Bumped whenever the frame layout changes; the server rejects other versions at handshake. */
    public static final int PROTOCOL_VERSION = 1;

    private TunnelProtocol() {
    }
}
