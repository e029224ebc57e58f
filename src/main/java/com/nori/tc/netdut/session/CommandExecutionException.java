package com.nori.tc.netdut.session;

import java.util.List;

/**
 * 장비가 명령 실행을 거부한 경우. 실패한 명령 줄을 알 수 있으면 함께 담는다.
 */
public class CommandExecutionException extends RuntimeException {

    private final int code;
    private final String failedCommand;
    private final List<String> deviceErrors;

    public CommandExecutionException(int code, String message, String failedCommand, List<String> deviceErrors) {
        super(buildMessage(code, message, failedCommand, deviceErrors));
        this.code = code;
        this.failedCommand = failedCommand;
        this.deviceErrors = List.copyOf(deviceErrors);
    }

    public int getCode() {
        return code;
    }

    /**
     * @return 실패한 명령 줄. 알 수 없으면 null
     */
    public String getFailedCommand() {
        return failedCommand;
    }

    public List<String> getDeviceErrors() {
        return deviceErrors;
    }

    private static String buildMessage(int code, String message, String failedCommand, List<String> deviceErrors) {
        StringBuilder sb = new StringBuilder("command failed (code ").append(code).append(")");
        if (failedCommand != null) {
            sb.append(" at '").append(failedCommand).append('\'');
        }
        sb.append(": ").append(message);
        if (!deviceErrors.isEmpty()) {
            sb.append(' ').append(deviceErrors);
        }
        return sb.toString();
    }
}
