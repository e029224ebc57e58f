package com.nori.tc.netdut.session;

import com.nori.tc.netdut.capability.DeviceIdentity;
import com.nori.tc.netdut.dialect.Dialect;
import com.nori.tc.netdut.logging.StructuredLog;
import com.nori.tc.netdut.translate.CommandLines;
import com.nori.tc.netdut.translate.Translator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DeviceSession
 *
 * 장비 연결 1개의 수명 동안 쓰는 세션.
 * - 테스트는 canonical 명령을 보내고 canonical 키 표기의 응답을 받는다.
 * - translator는 이 세션이 명시적으로 들고 있다. (전역 상태 없음) useTranslator로 교체할 수 있다.
 * - dialect가 translator에서 지원되는지는 생성/교체 시점에 확인한다.
 */
public final class DeviceSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeviceSession.class);

    private final CommandTransport transport;
    private final Dialect dialect;
    private volatile Translator translator;

    public DeviceSession(CommandTransport transport, Dialect dialect, Translator translator) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.translator = checked(translator, dialect);
    }

    public Dialect dialect() {
        return dialect;
    }

    public Translator translator() {
        return translator;
    }

    /**
     * 이 세션의 translator를 교체한다.
     *
     * @throws com.nori.tc.netdut.translate.UnknownDialectException 세션 dialect를 지원하지 않는 경우
     */
    public void useTranslator(Translator translator) {
        this.translator = checked(translator, dialect);
        log.info(StructuredLog.event("translator_changed", "dialect", dialect, "translator", translator));
    }

    public Object sendCommand(String command) {
        return sendCommand(command, true);
    }

    /**
     * 명령 줄 1개를 실행한다.
     *
     * @param translate false면 명령/응답 모두 번역하지 않는다
     */
    public Object sendCommand(String command, boolean translate) {
        Objects.requireNonNull(command, "command must not be null");
        List<String> lines = CommandLines.split(command);
        if (lines.size() != 1) {
            throw new IllegalArgumentException("sendCommand expects exactly one command line, got " + lines.size()
                    + " (use sendCommands)");
        }
        return sendCommands(lines, translate).get(0);
    }

    public List<Object> sendCommands(String block) {
        return sendCommands(CommandLines.split(block), true);
    }

    public List<Object> sendCommands(List<String> commands) {
        return sendCommands(commands, true);
    }

    /**
     * 명령 줄들을 순서대로 실행하고 줄마다 응답 1개를 돌려준다.
     */
    public List<Object> sendCommands(List<String> commands, boolean translate) {
        Objects.requireNonNull(commands, "commands must not be null");
        Translator t = this.translator;

        List<String> lines = translate ? t.translateCommands(dialect, commands) : List.copyOf(commands);
        log.info(StructuredLog.event("commands_send",
                "dialect", dialect,
                "translated", translate,
                "commands", lines));

        List<Object> replies = transport.executeAll(lines);
        if (replies.size() != lines.size()) {
            throw new TransportException("transport returned " + replies.size() + " replies for "
                    + lines.size() + " commands");
        }
        if (!translate) {
            return replies;
        }

        List<Object> out = new ArrayList<>(replies.size());
        for (Object reply : replies) {
            out.add(t.translateResponse(dialect, reply));
        }
        return out;
    }

    /**
     * "show version"으로 장비 SKU를 확인한다.
     */
    public DeviceIdentity identity() {
        Object reply = sendCommand("show version");
        String sku = (reply instanceof Map<?, ?> map)
                ? DeviceIdentity.skuFromReply(map)
                : DeviceIdentity.skuFromText(String.valueOf(reply));
        log.info(StructuredLog.event("device_identity", "sku", sku, "dialect", dialect));
        return new DeviceIdentity(sku, dialect);
    }

    /**
     * 명령을 단어 단위로 이어 붙여 실행하는 빌더. (예: chain().then("show_version").call())
     */
    public CommandChain chain() {
        return new CommandChain(this, List.of());
    }

    @Override
    public void close() {
        transport.close();
    }

    private static Translator checked(Translator translator, Dialect dialect) {
        Objects.requireNonNull(translator, "translator must not be null");
        translator.requireSupported(dialect);
        return translator;
    }
}
