package com.nori.tc.netdut.transport.console;

import com.nori.tc.netdut.logging.StructuredLog;
import com.nori.tc.netdut.session.TransportException;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * CliReplyHandler
 *
 * PromptFrameDecoder가 자른 출력 프레임을 문자열로 바꿔 큐에 쌓는다.
 * 명령을 보낸 스레드는 awaitReply로 다음 프레임을 기다린다.
 *
 * - "\r\n"은 "\n"으로 바꾼다.
 * - 채널이 닫히거나 예외가 나면 대기 중인 스레드를 즉시 깨운다.
 */
public class CliReplyHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final Logger log = LoggerFactory.getLogger(CliReplyHandler.class);

    private static final Object CLOSED = new Object();

    private final Charset charset;
    private final BlockingQueue<Object> replies = new LinkedBlockingQueue<>();

    public CliReplyHandler(Charset charset) {
        super(true);
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        String text = msg.toString(charset).replace("\r\n", "\n");
        log.debug(StructuredLog.event("console_rx",
                "connId", ctx.channel().id().asShortText(),
                "bytes", msg.readableBytes()));
        replies.offer(text);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn(StructuredLog.event("console_error",
                "connId", ctx.channel().id().asShortText(),
                "error", cause.getClass().getSimpleName()), cause);
        replies.offer(cause);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        replies.offer(CLOSED);
        ctx.fireChannelInactive();
    }

    /**
     * 다음 출력 프레임을 기다린다.
     *
     * @throws TransportException timeout, 채널 종료, 채널 예외, interrupt
     */
    public String awaitReply(Duration timeout) {
        Object item;
        try {
            item = replies.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while waiting for console reply", e);
        }

        if (item == null) {
            throw new TransportException("no prompt within " + timeout);
        }
        if (item == CLOSED) {
            replies.offer(CLOSED);
            throw new TransportException("console channel closed");
        }
        if (item instanceof Throwable t) {
            throw new TransportException("console channel failed", t);
        }
        return (String) item;
    }

    /**
     * quiet 동안 새 프레임이 없을 때까지 쌓인 프레임을 버린다.
     *
     * @return 버린 프레임 수
     */
    public int drain(Duration quiet) {
        int dropped = 0;
        try {
            while (true) {
                Object item = replies.poll(quiet.toNanos(), TimeUnit.NANOSECONDS);
                if (item == null) {
                    return dropped;
                }
                if (!(item instanceof String)) {
                    replies.offer(item);
                    return dropped;
                }
                dropped++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while draining console", e);
        }
    }
}
