package com.nori.tc.netdut.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * tc.netdut.*
 *
 * 목적:
 * - 시험 대상 장비(DUT) 1대의 접속 정보와 대기 기본값을 하나의 루트로 바인딩한다.
 *
 * 예 (application.yml):
 * <pre>
 * tc:
 *   netdut:
 *     dialect: mos
 *     console:
 *       url: telnet://bernie:1001
 *     eapi:
 *       username: admin
 * </pre>
 */
@ConfigurationProperties(prefix = "tc.netdut")
public class NetdutProperties {

    /**
     * 장비 dialect (eos, mos ...). translator가 지원하지 않으면 기동 실패.
     * 비어 있으면 콘솔 접속 시 "show version"으로 판별한다.
     */
    private String dialect;

    /**
     * 장비 SKU. 비어 있으면 세션에서 "show version"으로 확인한다.
     */
    private String sku;

    private Defaults defaults = new Defaults();

    private Console console = new Console();

    private Eapi eapi = new Eapi();

    // getters/setters

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public String getSku() {
        return sku;
    }

    public void setSku(String sku) {
        this.sku = sku;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Console getConsole() {
        return console;
    }

    public void setConsole(Console console) {
        this.console = console;
    }

    public Eapi getEapi() {
        return eapi;
    }

    public void setEapi(Eapi eapi) {
        this.eapi = eapi;
    }

    /**
     * 폴링 기본값
     */
    public static class Defaults {

        /**
         * wait 기본 타임아웃(초)
         */
        private long waitTimeoutSec = 30;

        /**
         * 폴링 간격(ms)
         */
        private long pollIntervalMs = 100;

        public long getWaitTimeoutSec() {
            return waitTimeoutSec;
        }

        public void setWaitTimeoutSec(long waitTimeoutSec) {
            this.waitTimeoutSec = waitTimeoutSec;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }
    }

    /**
     * 콘솔(CLI) 접속
     */
    public static class Console {

        /**
         * 예: telnet://bernie:1001, tcp://10.0.0.5:2001
         */
        private String url;

        /**
         * login/Password 프롬프트가 나올 때 보낼 계정
         */
        private String username = "admin";
        private String password = "";

        private long connectTimeoutSec = 10;

        /**
         * 명령 1개의 프롬프트 대기 시간(초). 로그인 단계 전체에도 같은 값을 쓴다.
         */
        private long replyTimeoutSec = 30;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public long getConnectTimeoutSec() {
            return connectTimeoutSec;
        }

        public void setConnectTimeoutSec(long connectTimeoutSec) {
            this.connectTimeoutSec = connectTimeoutSec;
        }

        public long getReplyTimeoutSec() {
            return replyTimeoutSec;
        }

        public void setReplyTimeoutSec(long replyTimeoutSec) {
            this.replyTimeoutSec = replyTimeoutSec;
        }
    }

    /**
     * eAPI(HTTP JSON-RPC) 접속
     * - host가 비어 있으면 콘솔 url의 host를 쓴다.
     */
    public static class Eapi {

        private String host;
        private int port = 80;
        private String path = "/command-api";
        private String username = "admin";
        private String password = "";
        private long connectTimeoutSec = 5;
        private long requestTimeoutSec = 30;

        /**
         * 콘솔로 eAPI를 켠 뒤 응답을 기다리는 최대 시간(초)
         */
        private long enableTimeoutSec = 120;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public long getConnectTimeoutSec() {
            return connectTimeoutSec;
        }

        public void setConnectTimeoutSec(long connectTimeoutSec) {
            this.connectTimeoutSec = connectTimeoutSec;
        }

        public long getRequestTimeoutSec() {
            return requestTimeoutSec;
        }

        public void setRequestTimeoutSec(long requestTimeoutSec) {
            this.requestTimeoutSec = requestTimeoutSec;
        }

        public long getEnableTimeoutSec() {
            return enableTimeoutSec;
        }

        public void setEnableTimeoutSec(long enableTimeoutSec) {
            this.enableTimeoutSec = enableTimeoutSec;
        }
    }
}
