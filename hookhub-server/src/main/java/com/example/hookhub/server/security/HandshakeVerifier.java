package com.example.hookhub.server.security;

import com.example.hookhub.protocol.Handshake;
import com.example.hookhub.protocol.TunnelProtocol;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 隧道握手校验。
 * 共享密钥做常量时间比较，同时要求客户端协议版本与服务端一致。
 */
@Component
@Slf4j
public class HandshakeVerifier {

    private final byte[] secret;

    public HandshakeVerifier(@Value("${hookhub.secret}") String secret) {
        Assert.hasText(secret, "hookhub.secret must not be empty");
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 校验握手消息。
     *
     * @param handshake 客户端握手
     * @return 拒绝原因；校验通过返回 null
     */
    public String verify(Handshake handshake) {
        if (handshake.getProtocolVersion() != TunnelProtocol.PROTOCOL_VERSION) {
            return "Server speaks protocol version " + TunnelProtocol.PROTOCOL_VERSION
                    + " but client sent " + handshake.getProtocolVersion();
        }

        // 常量时间比较，防止计时攻击
        boolean matches = MessageDigest.isEqual(
                secret,
                handshake.getSecret().getBytes(StandardCharsets.UTF_8));
        return matches ? null : "Invalid secret";
    }
}
