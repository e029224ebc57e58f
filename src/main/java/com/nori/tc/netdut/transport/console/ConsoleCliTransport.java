package com.nori.tc.netdut.transport.console;

import com.nori.tc.netdut.dialect.Dialect;
import com.nori.tc.netdut.dialect.DialectDetection;
import com.nori.tc.netdut.logging.StructuredLog;
import com.nori.tc.netdut.poll.Deadline;
import com.nori.tc.netdut.session.CommandTransport;
import com.nori.tc.netdut.session.TransportException;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * ConsoleCliTransport
 *
 * 역할:
 * - 장비 콘솔(tcp/telnet)에 붙어 CLI 명령 1줄을 보내고, 다음 프롬프트까지의 출력을 문자열로 돌려준다.
 *
 * 정책:
 * - 연결 직후 login/Password 프롬프트가 나오면 계정을 보내 로그인한다.
 *   로그인 배너로 dialect를 추정해 둔다. (loginDialect)
 * - 로그인 후 개행을 보내 프롬프트를 맞추고, 잠시 조용해질 때까지 남은 출력을 버린다.
 * - "en"은 "enable"로 바꿔 보낸다.
 * - 출력 첫 줄이 보낸 명령의 echo이면 제거한다.
 * - 명령 단위로 직렬화한다. (한 번에 명령 1개만 in-flight)
 * - 응답을 기다리다 실패하면 채널을 닫는다. 늦게 온 출력이 다음 명령의 응답으로 읽히면 안 된다.
 *
 * 응답 구조화(JSON)는 하지 않는다. 구조화 응답이 필요하면 eAPI 전송을 쓴다.
 */
public final class ConsoleCliTransport implements CommandTransport {

    private static final Logger log = LoggerFactory.getLogger(ConsoleCliTransport.class);

    static final Duration SETTLE_QUIET = Duration.ofMillis(200);

    /**
     * 로그인 단계에서 아무 출력이 없을 때 개행을 다시 보내는 간격
     */
    static final Duration LOGIN_NUDGE = Duration.ofSeconds(2);

    static final Pattern LOGIN_PROMPT = Pattern.compile("\\S+ login: ?\\z");
    static final Pattern PASSWORD_PROMPT = Pattern.compile("Password: ?\\z");

    private static final Pattern LOGIN_OR_CLI_PROMPT = Pattern.compile(
            "(?:" + LOGIN_PROMPT.pattern() + ")"
                    + "|(?:" + PASSWORD_PROMPT.pattern() + ")"
                    + "|(?:" + PromptFrameDecoder.DEFAULT_PROMPT.pattern() + ")");

    private static final Charset CHARSET = StandardCharsets.UTF_8;

    private final String name;
    private final Channel channel;
    private final CliReplyHandler replies;
    private final Duration replyTimeout;
    private final EventLoopGroup ownedGroup;
    private volatile Dialect loginDialect;

    ConsoleCliTransport(String name, Channel channel, CliReplyHandler replies, Duration replyTimeout, EventLoopGroup ownedGroup) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.replies = Objects.requireNonNull(replies, "replies must not be null");
        this.replyTimeout = Objects.requireNonNull(replyTimeout, "replyTimeout must not be null");
        this.ownedGroup = ownedGroup;
    }

    /**
     * 전용 EventLoopGroup(스레드 1개)을 만들어 연결한다. close() 시 group도 함께 종료한다.
     */
    public static ConsoleCliTransport connect(DeviceUrl url, Duration connectTimeout, Duration replyTimeout) {
        return connect(url, ConsoleCredentials.DEFAULT, connectTimeout, replyTimeout);
    }

    @SuppressWarnings("deprecation")
    public static ConsoleCliTransport connect(DeviceUrl url,
                                              ConsoleCredentials credentials,
                                              Duration connectTimeout,
                                              Duration replyTimeout) {
        EventLoopGroup group = new NioEventLoopGroup(1);
        try {
            return connect(url, credentials, connectTimeout, replyTimeout, group, group);
        } catch (RuntimeException e) {
            group.shutdownGracefully();
            throw e;
        }
    }

    /**
     * 공유 EventLoopGroup으로 연결한다. group 수명은 호출자가 관리한다.
     */
    public static ConsoleCliTransport connect(DeviceUrl url,
                                              ConsoleCredentials credentials,
                                              Duration connectTimeout,
                                              Duration replyTimeout,
                                              EventLoopGroup group) {
        return connect(url, credentials, connectTimeout, replyTimeout, group, null);
    }

    private static ConsoleCliTransport connect(DeviceUrl url,
                                               ConsoleCredentials credentials,
                                               Duration connectTimeout,
                                               Duration replyTimeout,
                                               EventLoopGroup group,
                                               EventLoopGroup ownedGroup) {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(credentials, "credentials must not be null");
        Objects.requireNonNull(group, "group must not be null");
        if (!url.isRawSocket()) {
            throw new IllegalArgumentException("unsupported console scheme: " + url.scheme());
        }

        CliReplyHandler handler = new CliReplyHandler(CHARSET);
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast("promptFramer", new PromptFrameDecoder(LOGIN_OR_CLI_PROMPT, true))
                                .addLast("cliReplies", handler);
                    }
                });

        log.info(StructuredLog.event("console_connecting", "url", url));

        ChannelFuture future = bootstrap.connect(url.host(), url.port()).awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new TransportException("console connect failed: " + url, future.cause());
        }

        Channel ch = future.channel();
        log.info(StructuredLog.event("console_connected",
                "url", url,
                "connId", ch.id().asShortText(),
                "local", String.valueOf(ch.localAddress())));

        ConsoleCliTransport transport = new ConsoleCliTransport(url.toString(), ch, handler, replyTimeout, ownedGroup);
        try {
            transport.login(credentials);
            ch.pipeline().replace("promptFramer", "promptFramer", new PromptFrameDecoder(PromptFrameDecoder.DEFAULT_PROMPT));
            transport.syncPrompt();
        } catch (RuntimeException e) {
            ch.close().awaitUninterruptibly();
            throw e;
        }
        return transport;
    }

    /**
     * CLI 프롬프트가 나올 때까지 login/Password 프롬프트에 답한다.
     * 처음부터 CLI 프롬프트면 아무것도 보내지 않는다.
     *
     * @throws TransportException replyTimeout 안에 CLI 프롬프트가 없거나 계정이 거부된 경우
     */
    void login(ConsoleCredentials credentials) {
        Deadline deadline = Deadline.after(replyTimeout);
        boolean usernameSent = false;
        boolean passwordSent = false;

        while (true) {
            String frame;
            try {
                frame = replies.awaitReply(min(LOGIN_NUDGE, deadline.remaining()));
            } catch (TransportException e) {
                if (!channel.isActive() || deadline.isExpired()) {
                    throw new TransportException("no login or CLI prompt within " + replyTimeout + ": " + name, e);
                }
                write("");
                continue;
            }

            if (PASSWORD_PROMPT.matcher(frame).find()) {
                if (passwordSent) {
                    throw new TransportException("console login rejected: " + name);
                }
                write(credentials.password());
                passwordSent = true;
            } else if (LOGIN_PROMPT.matcher(frame).find()) {
                if (usernameSent) {
                    throw new TransportException("console login rejected: " + name);
                }
                DialectDetection.fromLoginBanner(frame).ifPresent(d -> loginDialect = d);
                write(credentials.username());
                usernameSent = true;
            } else {
                log.info(StructuredLog.event("console_logged_in",
                        "console", name,
                        "username", usernameSent ? credentials.username() : null,
                        "loginDialect", loginDialect));
                return;
            }
        }
    }

    void syncPrompt() {
        write("");
        replies.awaitReply(replyTimeout);
        int dropped = replies.drain(SETTLE_QUIET);
        log.debug(StructuredLog.event("console_prompt_synced", "console", name, "droppedFrames", dropped));
    }

    /**
     * 로그인 배너로 추정한 dialect. 로그인 프롬프트 없이 연결됐으면 empty.
     */
    public Optional<Dialect> loginDialect() {
        return Optional.ofNullable(loginDialect);
    }

    @Override
    public synchronized Object execute(String commandLine) {
        Objects.requireNonNull(commandLine, "commandLine must not be null");
        String cmd = normalize(commandLine);

        if (!channel.isActive()) {
            throw new TransportException("console channel is not active: " + name);
        }

        write(cmd);
        String raw;
        try {
            raw = replies.awaitReply(replyTimeout);
        } catch (TransportException e) {
            log.warn(StructuredLog.event("console_reply_lost",
                    "console", name,
                    "command", cmd,
                    "reason", e.getMessage(),
                    "action", "close"));
            channel.close().awaitUninterruptibly();
            throw e;
        }
        String output = stripEcho(raw, cmd);

        log.debug(StructuredLog.event("console_command",
                "console", name,
                "command", cmd,
                "outputChars", output.length()));
        return output;
    }

    @Override
    public void close() {
        try {
            if (channel.isOpen()) {
                channel.close().awaitUninterruptibly();
            }
            log.info(StructuredLog.event("console_closed", "console", name));
        } finally {
            if (ownedGroup != null) {
                ownedGroup.shutdownGracefully();
            }
        }
    }

    private void write(String line) {
        channel.writeAndFlush(Unpooled.copiedBuffer(line + "\n", CHARSET));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    static String normalize(String commandLine) {
        String cmd = commandLine.strip();
        return "en".equals(cmd) ? "enable" : cmd;
    }

    /**
     * 출력 첫 줄이 보낸 명령과 같으면 그 줄을 제거한다. 나머지 앞뒤 공백도 정리한다.
     */
    static String stripEcho(String raw, String cmd) {
        String out = raw;
        int nl = out.indexOf('\n');
        String first = nl < 0 ? out : out.substring(0, nl);
        if (first.strip().equals(cmd)) {
            out = nl < 0 ? "" : out.substring(nl + 1);
        }
        return out.strip();
    }
}
