package com.nori.tc.netdut.session;

import com.nori.tc.netdut.dialect.Dialect;
import com.nori.tc.netdut.logging.StructuredLog;
import com.nori.tc.netdut.poll.Poller;
import com.nori.tc.netdut.translate.CommandLines;
import com.nori.tc.netdut.translate.Translator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * EapiEnablement
 *
 * 콘솔(CLI) 세션으로 장비의 eAPI(HTTP 명령 API)를 켜고, eAPI 세션이 응답할 때까지 기다린다.
 * close() 하면 eAPI 세션을 닫고 콘솔로 eAPI를 다시 끈다.
 *
 * - 설정 블록은 dialect마다 다르며 번역 없이 그대로 보낸다.
 * - EOS는 설정 후 "wait-for-warmup Capi CapiApp"로 서비스 기동을 기다린다.
 * - 연결 시도 중 TransportException은 "아직 안 됨"으로 보고 계속 폴링한다.
 *
 * TODO: 이전 management 설정을 저장했다가 복원하도록 바꾼다. 지금은 무조건 disable 블록을 보낸다.
 */
public final class EapiEnablement implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EapiEnablement.class);

    private static final String EOS_ENABLE = """
            configure
            management api http-commands
                no shutdown
                validate-output
            management http-server
                protocol http
            end
            """;

    private static final String EOS_DISABLE = """
            configure
            management http-server
                no protocol http
            management api http-commands
                shutdown
                no validate-output
            end
            """;

    private static final String MOS_ENABLE = """
            configure
            management http
                no protocol secure
            management api
                no shutdown
            end
            """;

    private static final String MOS_DISABLE = """
            configure
            management api
                shutdown
            management http
                default protocol
            end
            """;

    static final String EOS_WARMUP = "wait-for-warmup Capi CapiApp";

    private final DeviceSession console;
    private final DeviceSession eapi;
    private boolean closed = false;

    private EapiEnablement(DeviceSession console, DeviceSession eapi) {
        this.console = console;
        this.eapi = eapi;
    }

    /**
     * @param console       장비 콘솔 세션
     * @param eapiConnector 호출할 때마다 새 eAPI 전송을 여는 함수
     * @param translator    eAPI 세션에 쓸 translator
     * @param poller        연결 대기에 쓸 poller
     * @param timeout       eAPI가 응답할 때까지 기다릴 최대 시간
     * @throws TransportException timeout 안에 eAPI가 응답하지 않은 경우
     */
    public static EapiEnablement enable(DeviceSession console,
                                        Supplier<CommandTransport> eapiConnector,
                                        Translator translator,
                                        Poller poller,
                                        Duration timeout) {
        Objects.requireNonNull(console, "console must not be null");
        Objects.requireNonNull(eapiConnector, "eapiConnector must not be null");
        Objects.requireNonNull(translator, "translator must not be null");
        Objects.requireNonNull(poller, "poller must not be null");

        Dialect dialect = console.dialect();
        translator.requireSupported(dialect);

        console.sendCommands(enableCommands(dialect), false);
        if (Dialect.EOS.equals(dialect)) {
            console.sendCommand(EOS_WARMUP, false);
        }
        log.info(StructuredLog.event("eapi_enable_sent", "dialect", dialect, "timeoutMs", timeout.toMillis()));

        Optional<DeviceSession> eapi = poller.awaitValue(
                () -> tryConnect(eapiConnector, dialect, translator),
                timeout,
                poller.getDefaultInterval(),
                Set.of(TransportException.class));

        if (eapi.isEmpty()) {
            log.warn(StructuredLog.event("eapi_enable_timeout",
                    "dialect", dialect,
                    "timeoutMs", timeout.toMillis(),
                    "action", "disable"));
            TransportException timedOut = new TransportException("eAPI did not answer within " + timeout);
            try {
                console.sendCommands(disableCommands(dialect), false);
            } catch (RuntimeException e) {
                timedOut.addSuppressed(e);
            }
            throw timedOut;
        }

        log.info(StructuredLog.event("eapi_enabled", "dialect", dialect));
        return new EapiEnablement(console, eapi.get());
    }

    public DeviceSession session() {
        return eapi;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        try {
            eapi.close();
        } finally {
            console.sendCommands(disableCommands(console.dialect()), false);
            log.info(StructuredLog.event("eapi_disabled", "dialect", console.dialect()));
        }
    }

    static List<String> enableCommands(Dialect dialect) {
        if (Dialect.EOS.equals(dialect)) return CommandLines.split(EOS_ENABLE);
        if (Dialect.MOS.equals(dialect)) return CommandLines.split(MOS_ENABLE);
        throw new IllegalArgumentException("no eAPI enable commands for dialect: " + dialect);
    }

    static List<String> disableCommands(Dialect dialect) {
        if (Dialect.EOS.equals(dialect)) return CommandLines.split(EOS_DISABLE);
        if (Dialect.MOS.equals(dialect)) return CommandLines.split(MOS_DISABLE);
        throw new IllegalArgumentException("no eAPI disable commands for dialect: " + dialect);
    }

    private static DeviceSession tryConnect(Supplier<CommandTransport> connector, Dialect dialect, Translator translator) {
        CommandTransport transport = connector.get();
        try {
            transport.execute("show version");
        } catch (RuntimeException e) {
            transport.close();
            throw e;
        }
        return new DeviceSession(transport, dialect, translator);
    }
}
