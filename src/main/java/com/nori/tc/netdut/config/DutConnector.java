package com.nori.tc.netdut.config;

import com.nori.tc.netdut.capability.DeviceIdentity;
import com.nori.tc.netdut.dialect.Dialect;
import com.nori.tc.netdut.dialect.DialectDetection;
import com.nori.tc.netdut.logging.StructuredLog;
import com.nori.tc.netdut.poll.Poller;
import com.nori.tc.netdut.session.DeviceSession;
import com.nori.tc.netdut.session.EapiEnablement;
import com.nori.tc.netdut.translate.Translator;
import com.nori.tc.netdut.transport.console.ConsoleCliTransport;
import com.nori.tc.netdut.transport.console.ConsoleCredentials;
import com.nori.tc.netdut.transport.console.DeviceUrl;
import com.nori.tc.netdut.transport.eapi.EapiHttpTransport;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * DutConnector
 *
 * 역할:
 * - 설정(tc.netdut.*)대로 장비 세션을 연다.
 * - 콘솔/eAPI 연결이 공유하는 Netty EventLoopGroup을 소유한다.
 *
 * 정책:
 * - tc.netdut.dialect가 있으면 생성 시 확인한다. translator가 모르는 dialect면 즉시 실패한다.
 * - tc.netdut.dialect가 비어 있으면 콘솔 세션을 열 때 "show version"으로 판별한다.
 *   설정값이 있으면 판별하지 않고 설정값을 쓴다.
 * - MOS 콘솔은 로그인 직후 "enable"을 보내 privileged 모드로 둔다.
 * - 연결은 호출 시점에 연다. (Bean 생성 시 장비에 붙지 않는다)
 */
@SuppressWarnings("deprecation")
public class DutConnector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DutConnector.class);

    private final NetdutProperties props;
    private final Translator translator;
    private final Poller poller;
    private final Dialect configuredDialect;
    private final EventLoopGroup group;

    public DutConnector(NetdutProperties props, Translator translator, Poller poller) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.poller = Objects.requireNonNull(poller, "poller must not be null");
        String configured = props.getDialect();
        if (configured == null || configured.isBlank()) {
            this.configuredDialect = null;
        } else {
            this.configuredDialect = Dialect.of(configured);
            translator.requireSupported(configuredDialect);
        }
        this.group = new NioEventLoopGroup(1);

        log.info(StructuredLog.event("dut_connector_ready",
                "dialect", configuredDialect == null ? "auto" : configuredDialect,
                "console", props.getConsole().getUrl(),
                "supportedDialects", translator.dialects()));
    }

    /**
     * 설정된 dialect. 비어 있으면 콘솔 세션을 열 때 판별한다.
     */
    public Optional<Dialect> configuredDialect() {
        return Optional.ofNullable(configuredDialect);
    }

    /**
     * 콘솔 CLI 세션을 연다. 응답은 텍스트(String)이다.
     * 필요하면 로그인하고, dialect를 정한 뒤 MOS면 "enable"까지 보낸다.
     */
    public DeviceSession openConsoleSession() {
        NetdutProperties.Console c = props.getConsole();
        if (c.getUrl() == null || c.getUrl().isBlank()) {
            throw new IllegalStateException("tc.netdut.console.url is not set");
        }
        DeviceUrl url = DeviceUrl.parse(c.getUrl());
        ConsoleCliTransport transport = ConsoleCliTransport.connect(
                url,
                new ConsoleCredentials(c.getUsername(), c.getPassword()),
                Duration.ofSeconds(c.getConnectTimeoutSec()),
                Duration.ofSeconds(c.getReplyTimeoutSec()),
                group);
        try {
            Dialect dialect = configuredDialect != null ? configuredDialect : detectDialect(transport);
            DeviceSession session = new DeviceSession(transport, dialect, translator);
            if (Dialect.MOS.equals(dialect)) {
                session.sendCommand("enable", false);
            }
            return session;
        } catch (RuntimeException e) {
            transport.close();
            throw e;
        }
    }

    private Dialect detectDialect(ConsoleCliTransport console) {
        String version = String.valueOf(console.execute("show version"));
        Dialect detected = DialectDetection.fromShowVersion(version);
        log.info(StructuredLog.event("dialect_detected",
                "console", props.getConsole().getUrl(),
                "loginDialect", console.loginDialect().orElse(null),
                "dialect", detected));
        return detected;
    }

    /**
     * 콘솔로 eAPI를 켜고 eAPI 세션이 응답할 때까지 기다린다.
     * 반환값을 close() 하면 eAPI를 다시 끈다.
     */
    public EapiEnablement enableEapi(DeviceSession console) {
        NetdutProperties.Eapi e = props.getEapi();
        String host = resolveEapiHost();
        return EapiEnablement.enable(
                console,
                () -> EapiHttpTransport.builder(host, group)
                        .port(e.getPort())
                        .path(e.getPath())
                        .credentials(e.getUsername(), e.getPassword())
                        .connectTimeout(Duration.ofSeconds(e.getConnectTimeoutSec()))
                        .requestTimeout(Duration.ofSeconds(e.getRequestTimeoutSec()))
                        .connect(),
                translator,
                poller,
                Duration.ofSeconds(e.getEnableTimeoutSec()));
    }

    /**
     * 실행 조건 판정용 장비 정보. tc.netdut.sku가 있으면 장비에 묻지 않고 그 값을 쓴다.
     */
    public DeviceIdentity identity(DeviceSession session) {
        String sku = props.getSku();
        if (sku != null && !sku.isBlank()) {
            return new DeviceIdentity(sku.strip(), session.dialect());
        }
        return session.identity();
    }

    String resolveEapiHost() {
        String host = props.getEapi().getHost();
        if (host != null && !host.isBlank()) {
            return host;
        }
        String url = props.getConsole().getUrl();
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("neither tc.netdut.eapi.host nor tc.netdut.console.url is set");
        }
        return DeviceUrl.parse(url).host();
    }

    @Override
    public void close() {
        group.shutdownGracefully().syncUninterruptibly();
        log.info(StructuredLog.event("dut_connector_closed"));
    }
}
