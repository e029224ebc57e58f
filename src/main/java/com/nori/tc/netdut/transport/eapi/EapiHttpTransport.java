package com.nori.tc.netdut.transport.eapi;

import com.nori.tc.netdut.logging.StructuredLog;
import com.nori.tc.netdut.session.CommandTransport;
import com.nori.tc.netdut.session.TransportException;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * EapiHttpTransport
 *
 * 역할:
 * - eAPI(JSON-RPC over HTTP)로 명령을 보내고 구조화된(JSON) 응답을 돌려준다.
 * - 여러 줄은 runCmds 요청 1개로 묶어 보낸다.
 *
 * 연결:
 * - 생성 시 1회 연결한다. 연결 실패는 TransportException.
 * - keep-alive 연결을 재사용하고, 끊겨 있으면 다음 요청 때 다시 연결한다.
 * - EventLoopGroup 수명은 호출자가 관리한다.
 */
public final class EapiHttpTransport implements CommandTransport {

    private static final Logger log = LoggerFactory.getLogger(EapiHttpTransport.class);

    public static final String DEFAULT_PATH = "/command-api";

    private static final int MAX_CONTENT_BYTES = 16 * 1024 * 1024;

    private final String host;
    private final int port;
    private final String path;
    private final String authorization;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final EventLoopGroup group;
    private final EapiJsonRpcCodec codec;

    private Channel channel;
    private EapiResponseHandler handler;

    private EapiHttpTransport(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.path = b.path;
        this.authorization = basicAuth(b.username, b.password);
        this.connectTimeout = b.connectTimeout;
        this.requestTimeout = b.requestTimeout;
        this.group = b.group;
        this.codec = b.codec;
    }

    public static Builder builder(String host, EventLoopGroup group) {
        return new Builder(host, group);
    }

    @Override
    public Object execute(String commandLine) {
        return executeAll(List.of(commandLine)).get(0);
    }

    @Override
    public synchronized List<Object> executeAll(List<String> commandLines) {
        if (commandLines.isEmpty()) {
            return List.of();
        }
        ensureConnected();

        byte[] body = codec.encodeRunCmds(commandLines);
        FullHttpRequest request = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.POST, path, Unpooled.wrappedBuffer(body));
        request.headers()
                .set(HttpHeaderNames.HOST, host + ":" + port)
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .set(HttpHeaderNames.CONTENT_LENGTH, body.length)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        if (authorization != null) {
            request.headers().set(HttpHeaderNames.AUTHORIZATION, authorization);
        }

        channel.writeAndFlush(request);
        byte[] reply;
        try {
            reply = handler.awaitBody(requestTimeout);
        } catch (TransportException e) {
            // 늦게 도착한 응답이 다음 요청의 답으로 읽히지 않도록 연결을 버린다.
            log.warn(StructuredLog.event("eapi_connection_dropped",
                    "target", host + ":" + port,
                    "commands", commandLines,
                    "reason", e.getMessage()));
            discardConnection();
            throw e;
        }

        log.debug(StructuredLog.event("eapi_run_cmds",
                "target", host + ":" + port,
                "commands", commandLines,
                "replyBytes", reply.length));
        return codec.decodeReply(reply, commandLines);
    }

    @Override
    public synchronized void close() {
        discardConnection();
    }

    private void discardConnection() {
        if (channel != null && channel.isOpen()) {
            channel.close().awaitUninterruptibly();
        }
        channel = null;
        handler = null;
    }

    private void ensureConnected() {
        if (channel != null && channel.isActive()) {
            return;
        }
        open();
    }

    private void open() {
        EapiResponseHandler h = new EapiResponseHandler();
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
                                .addLast("httpCodec", new HttpClientCodec())
                                .addLast("httpAggregator", new HttpObjectAggregator(MAX_CONTENT_BYTES))
                                .addLast("eapiResponses", h);
                    }
                });

        ChannelFuture future = bootstrap.connect(host, port).awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new TransportException("eAPI connect failed: " + host + ":" + port, future.cause());
        }
        this.channel = future.channel();
        this.handler = h;
        log.info(StructuredLog.event("eapi_connected",
                "target", host + ":" + port,
                "connId", channel.id().asShortText()));
    }

    static String basicAuth(String username, String password) {
        if (username == null) {
            return null;
        }
        String raw = username + ":" + (password == null ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static final class Builder {
        private final String host;
        private final EventLoopGroup group;
        private int port = 80;
        private String path = DEFAULT_PATH;
        private String username;
        private String password;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private EapiJsonRpcCodec codec = new EapiJsonRpcCodec();

        private Builder(String host, EventLoopGroup group) {
            this.host = Objects.requireNonNull(host, "host must not be null");
            this.group = Objects.requireNonNull(group, "group must not be null");
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("invalid port: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder path(String path) {
            this.path = Objects.requireNonNull(path, "path must not be null");
            return this;
        }

        public Builder credentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
            return this;
        }

        public Builder codec(EapiJsonRpcCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec must not be null");
            return this;
        }

        /**
         * 연결까지 마친 전송을 돌려준다.
         *
         * @throws TransportException 연결 실패
         */
        public EapiHttpTransport connect() {
            EapiHttpTransport t = new EapiHttpTransport(this);
            t.open();
            return t;
        }
    }
}
