package com.nori.tc.netdut.session;

/**
 * 장비와의 연결/송수신 실패. (연결 거부, 응답 timeout, 채널 종료 등)
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
