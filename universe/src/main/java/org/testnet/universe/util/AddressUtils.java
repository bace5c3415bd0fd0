package org.testnet.universe.util;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Contains utility methods to validate and build the network endpoints advertised by nodes.
 * Supports both IPv4 and IPv6 literals as well as host names.
 */
@Slf4j
public final class AddressUtils {

    private static final int MIN_PORT = 1;
    private static final int MAX_PORT = 65535;

    private AddressUtils() {
        // prevent instantiation of this class
    }

    /**
     * Parses an endpoint of the form {@code host:port} and validates both parts.
     *
     * @param endpoint endpoint as advertised by a node, may be null
     * @return the parsed endpoint, or empty if the endpoint is not a well-formed network address
     */
    public static Optional<HostAndPort> parseEndpoint(String endpoint) {
        if (endpoint == null || endpoint.trim().isEmpty()) {
            return Optional.empty();
        }

        HostAndPort hostAndPort;
        try {
            hostAndPort = HostAndPort.fromString(endpoint.trim());
        } catch (IllegalArgumentException ex) {
            log.trace("parseEndpoint: not an endpoint '{}'", endpoint);
            return Optional.empty();
        }

        if (!hostAndPort.hasPort()) {
            return Optional.empty();
        }

        int port = hostAndPort.getPort();
        if (port < MIN_PORT || port > MAX_PORT) {
            return Optional.empty();
        }

        if (!isValidHost(hostAndPort.getHost())) {
            return Optional.empty();
        }

        return Optional.of(hostAndPort);
    }

    public static boolean isWellFormedEndpoint(String endpoint) {
        return parseEndpoint(endpoint).isPresent();
    }

    /**
     * A host is valid if it is an IP literal or a syntactically valid domain name.
     * The unspecified address (0.0.0.0 / ::) is rejected because nobody can connect to it.
     */
    public static boolean isValidHost(String host) {
        if (host == null || host.isEmpty()) {
            return false;
        }

        if (InetAddresses.isInetAddress(host)) {
            return !InetAddresses.forString(host).isAnyLocalAddress();
        }

        return InternetDomainName.isValid(host);
    }

    /**
     * Returns an endpoint string for the host and port, bracketing IPv6 literals.
     *
     * @param host host address
     * @param port port of the endpoint
     * @return endpoint in the form of HOST:PORT
     */
    public static String endpoint(String host, int port) {
        return HostAndPort.fromParts(host, port).toString();
    }
}
