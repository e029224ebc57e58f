package com.nori.tc.netdut.transport.console;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * 장비 콘솔 주소 값 객체.
 *
 * 예:
 * - "telnet://bernie:1001"
 * - "tcp://10.0.0.5:2001"
 * - "10.0.0.5:2001"  (scheme 생략 시 tcp)
 * - "ssh://dut01"    (port 생략 시 22, telnet은 23)
 */
public record DeviceUrl(String scheme, String host, int port) {

    public DeviceUrl {
        Objects.requireNonNull(scheme, "scheme must not be null");
        Objects.requireNonNull(host, "host must not be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host is blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("invalid port: " + port);
        }
    }

    public static DeviceUrl parse(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new IllegalArgumentException("device url is blank");
        }
        String v = s.trim();
        if (!v.contains("://")) {
            v = "tcp://" + v;
        }

        URI uri;
        try {
            uri = URI.create(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid device url: " + s, e);
        }

        String scheme = uri.getScheme() == null ? "tcp" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("device url has no host: " + s);
        }

        int port = uri.getPort();
        if (port < 0) {
            port = switch (scheme) {
                case "telnet" -> 23;
                case "ssh" -> 22;
                default -> throw new IllegalArgumentException("device url must have a port: " + s);
            };
        }
        return new DeviceUrl(scheme, host, port);
    }

    /**
     * 바이트 스트림을 그대로 주고받는 콘솔인지 (tcp / telnet)
     */
    public boolean isRawSocket() {
        return "tcp".equals(scheme) || "telnet".equals(scheme);
    }

    @Override
    public String toString() {
        return scheme + "://" + host + ":" + port;
    }
}
