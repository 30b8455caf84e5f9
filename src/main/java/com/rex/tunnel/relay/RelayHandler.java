package com.rex.tunnel.relay;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.channel.socket.DuplexChannel;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridge all data to target channel
 *
 * End of stream on the input is forwarded as output shutdown on the target channel.
 */
public final class RelayHandler extends ChannelInboundHandlerAdapter {

    private static final Logger sLogger = LoggerFactory.getLogger(RelayHandler.class);

    public interface Listener {
        void onInputShutdown(Channel input);
        void onFailure(Channel input, Throwable cause);
    }

    private final Channel mOutput;
    private final Listener mListener;

    public RelayHandler(Channel ch) {
        this(ch, null);
    }

    public RelayHandler(Channel ch, Listener listener) {
        sLogger.trace("<init> ch=<{}>", ch);
        mOutput = ch;
        mListener = listener;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        sLogger.trace("ctx={} msg={}", ctx, msg);
        if (mOutput.isActive()) {
            mOutput.writeAndFlush(msg)
                    .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        } else {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof ChannelInputShutdownEvent) {
            sLogger.trace("{} input shutdown", ctx.channel());
            if (mOutput.isActive()) {
                mOutput.writeAndFlush(Unpooled.EMPTY_BUFFER)
                        .addListener(new ChannelFutureListener() {
                            @Override
                            public void operationComplete(ChannelFuture future) throws Exception {
                                if (future.isSuccess() && mOutput instanceof DuplexChannel) {
                                    ((DuplexChannel) mOutput).shutdownOutput();
                                }
                            }
                        });
            }
            if (mListener != null) {
                mListener.onInputShutdown(ctx.channel());
            }
        }
        ctx.fireUserEventTriggered(evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        sLogger.trace("{} inactive", ctx.channel());
        if (mOutput.isActive()) {
            mOutput.writeAndFlush(Unpooled.EMPTY_BUFFER)
                    .addListener(ChannelFutureListener.CLOSE);
        }
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        // ctx: [id: 0x0182c0ea, L:/127.0.0.1:1080 - R:/127.0.0.1:54536]
        // cause: java.io.IOException: Connection reset by peer
        sLogger.warn("{} - {}", ctx.channel(), cause.getMessage());
        if (mListener != null) {
            mListener.onFailure(ctx.channel(), cause);
        }
        ctx.close();
        if (mOutput.isActive()) {
            mOutput.writeAndFlush(Unpooled.EMPTY_BUFFER)
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }
}
