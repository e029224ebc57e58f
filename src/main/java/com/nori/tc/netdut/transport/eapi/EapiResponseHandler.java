package com.nori.tc.netdut.transport.eapi;

import com.nori.tc.netdut.logging.StructuredLog;
import com.nori.tc.netdut.session.TransportException;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * EapiResponseHandler
 *
 * HttpObjectAggregator가 합친 응답 1개를 본문 byte[]로 큐에 넣는다.
 * 200이 아닌 상태 코드는 TransportException으로 바꿔 넣는다.
 */
public class EapiResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

    private static final Logger log = LoggerFactory.getLogger(EapiResponseHandler.class);

    private static final Object CLOSED = new Object();

    private final BlockingQueue<Object> responses = new LinkedBlockingQueue<>();

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
        HttpResponseStatus status = msg.status();
        if (!HttpResponseStatus.OK.equals(status)) {
            log.warn(StructuredLog.event("eapi_http_status",
                    "connId", ctx.channel().id().asShortText(),
                    "status", status.code()));
            responses.offer(new TransportException("eAPI HTTP status " + status));
            return;
        }
        responses.offer(ByteBufUtil.getBytes(msg.content()));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn(StructuredLog.event("eapi_channel_error",
                "connId", ctx.channel().id().asShortText(),
                "error", cause.getClass().getSimpleName()), cause);
        responses.offer(new TransportException("eAPI channel failed", cause));
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        responses.offer(CLOSED);
        ctx.fireChannelInactive();
    }

    /**
     * @throws TransportException timeout, 채널 종료, 200 이외 상태, interrupt
     */
    public byte[] awaitBody(Duration timeout) {
        Object item;
        try {
            item = responses.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while waiting for eAPI reply", e);
        }
        if (item == null) {
            throw new TransportException("no eAPI reply within " + timeout);
        }
        if (item == CLOSED) {
            responses.offer(CLOSED);
            throw new TransportException("eAPI connection closed");
        }
        if (item instanceof TransportException e) {
            throw e;
        }
        return (byte[]) item;
    }
}
