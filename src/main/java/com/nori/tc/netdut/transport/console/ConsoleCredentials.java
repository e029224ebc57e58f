package com.nori.tc.netdut.transport.console;

import java.util.Objects;

/**
 * 콘솔 login/Password 프롬프트에 보낼 계정.
 * 프롬프트가 나오지 않는 콘솔(이미 로그인된 세션)에서는 쓰이지 않는다.
 */
public record ConsoleCredentials(String username, String password) {

    public static final ConsoleCredentials DEFAULT = new ConsoleCredentials("admin", "");

    public ConsoleCredentials {
        Objects.requireNonNull(username, "username must not be null");
        if (username.isBlank()) {
            throw new IllegalArgumentException("username is blank");
        }
        password = password == null ? "" : password;
    }

    @Override
    public String toString() {
        return "ConsoleCredentials[username=" + username + "]";
    }
}
