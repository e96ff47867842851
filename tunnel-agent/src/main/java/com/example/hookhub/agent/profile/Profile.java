package com.example.hookhub.agent.profile;

import com.example.hookhub.protocol.TunnelProtocol;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Where to connect and where to forward to.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Profile {

    /** Remote server origin, {@code ws://} or {@code wss://}. */
    private String remote;

    @ToString.Exclude
    private String secret;

    /** Local server origin, {@code http://} or {@code https://}. */
    private String local;

    /**
     * Validates the URLs and normalizes them: the remote points at the tunnel endpoint and the
     * local one is reduced to its origin.
     *
     * @throws IllegalArgumentException when a URL is missing, malformed or uses the wrong scheme
     */
    public Profile prepare() {
        URI remoteUri = parse("remote", remote);
        if (!"ws".equalsIgnoreCase(remoteUri.getScheme()) && !"wss".equalsIgnoreCase(remoteUri.getScheme())) {
            throw new IllegalArgumentException("remote must use ws or wss scheme");
        }
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }

        return new Profile(
                origin(remoteUri) + TunnelProtocol.TUNNEL_PATH,
                secret,
                localOrigin(local));
    }

    /**
     * Validates a local server URL and strips it down to scheme, host and port.
     *
     * @throws IllegalArgumentException when the URL is missing, malformed or not http(s)
     */
    public static String localOrigin(String local) {
        URI localUri = parse("local", local);
        if (!"http".equalsIgnoreCase(localUri.getScheme()) && !"https".equalsIgnoreCase(localUri.getScheme())) {
            throw new IllegalArgumentException("local must use http or https scheme");
        }
        return origin(localUri);
    }

    public URI remoteUri() {
        return URI.create(remote);
    }

    public URI localUri() {
        return URI.create(local);
    }

    private static URI parse(String field, String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(field + " must be set");
        }
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                throw new IllegalArgumentException(field + " must be an absolute URL: " + value);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(field + " is not a valid URL: " + value, e);
        }
    }

    private static String origin(URI uri) {
        return uri.getScheme().toLowerCase() + "://" + uri.getRawAuthority();
    }
}
