package com.nori.tc.netdut.transport.console;

import com.nori.tc.netdut.logging.StructuredLog;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PromptFrameDecoder
 *
 * 역할:
 * - CLI 콘솔 바이트 스트림을 "장비 프롬프트" 기준으로 자른다.
 * - 프롬프트 앞까지의 출력을 프레임 1개로 내보내고, 프롬프트 자체는 소비만 한다.
 *
 * 프롬프트:
 * - 줄 시작 + (제어코드) + 호스트명 + 모드(">", "#", "(config-if)#", ":~$" 등) + 버퍼 끝
 * - 버퍼 끝에 있어야 하므로 출력 중간의 "x#" 같은 줄은 프롬프트로 보지 않는다.
 *
 * 인코딩:
 * - 프롬프트는 ISO-8859-1로 읽은 문자열에서 찾는다. 문자 1개가 바이트 1개이므로 match 위치가 곧 바이트 위치다.
 * - 프레임은 바이트 그대로 내보낸다. 문자 디코딩(UTF-8 등)은 CliReplyHandler가 한다.
 *
 * keepPrompt:
 * - false(기본): 프롬프트 앞까지만 프레임으로 내보낸다.
 * - true: 프롬프트까지 포함해 내보낸다. 로그인 단계처럼 어떤 프롬프트가 왔는지 봐야 할 때 쓴다.
 *
 * 제한:
 * - 한 번에 읽은 버퍼에 프롬프트가 여러 번 있으면 마지막 프롬프트까지가 프레임 1개다.
 *   명령을 1개씩 보내고 프롬프트를 기다리는 사용 방식을 전제로 한다.
 * - MAX_BUFFER_BYTES 초과 시 버퍼를 버리고 채널을 닫는다.
 */
public class PromptFrameDecoder extends ByteToMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(PromptFrameDecoder.class);

    public static final Pattern DEFAULT_PROMPT = Pattern.compile(
            "(?m)^(?:\\x1B(?:\\[[0-?]*[ -/]*[@-~]|[@-_]))*"
                    + "[a-zA-Z][\\w\\-.]*"
                    + "(?:>|(?:\\([\\w\\-.,/]+\\))?#|:[\\w\\-./~]+[#$])"
                    + " ?\\z");

    private static final int MAX_BUFFER_BYTES = 1024 * 1024;

    private final Pattern prompt;
    private final boolean keepPrompt;

    public PromptFrameDecoder(Pattern prompt) {
        this(prompt, false);
    }

    public PromptFrameDecoder(Pattern prompt, boolean keepPrompt) {
        this.prompt = Objects.requireNonNull(prompt, "prompt must not be null");
        this.keepPrompt = keepPrompt;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int readerIdx = in.readerIndex();
        int readable = in.readableBytes();
        if (readable <= 0) {
            return;
        }

        if (readable > MAX_BUFFER_BYTES) {
            log.warn(StructuredLog.event("console_buffer_overflow",
                    "connId", ctx.channel().id().asShortText(),
                    "readable", readable,
                    "maxBytes", MAX_BUFFER_BYTES,
                    "action", "close"));
            in.skipBytes(readable);
            ctx.close();
            return;
        }

        String s = in.toString(readerIdx, readable, StandardCharsets.ISO_8859_1);
        Matcher m = prompt.matcher(s);
        if (!m.find()) {
            // 프롬프트가 아직 안 왔으면 다음 입력 대기
            return;
        }
        if (m.end() <= m.start()) {
            throw new IllegalStateException("prompt match has invalid range: start=" + m.start() + " end=" + m.end());
        }

        ByteBuf output = in.retainedSlice(readerIdx, keepPrompt ? m.end() : m.start());
        in.readerIndex(readerIdx + m.end());
        out.add(output);
    }
}
