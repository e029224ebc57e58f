package com.nori.tc.netdut.poll;

/**
 * 폴링 대기 중 스레드가 interrupt 된 경우. interrupt 플래그는 복원된 상태로 던진다.
 */
public class PollInterruptedException extends RuntimeException {

    public PollInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
