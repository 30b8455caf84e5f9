package com.rex.tunnel.control;

import com.rex.tunnel.protocol.TunnelMessageCodec;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Initialize the control channel pipeline
 */
public class ControlChannelInitializer extends ChannelInitializer<SocketChannel> {

    private static final Logger sLogger = LoggerFactory.getLogger(ControlChannelInitializer.class);

    private final ControlSessionHandler mHandler;

    public ControlChannelInitializer(ControlSessionHandler handler) {
        sLogger.trace("<init>");
        mHandler = handler;
    }

    @Override // ChannelInitializer
    protected void initChannel(SocketChannel ch) throws Exception {
        sLogger.trace("ch:{}", ch);
        //ch.pipeline().addLast(new LoggingHandler(LogLevel.DEBUG));
        TunnelMessageCodec.install(ch.pipeline())
                .addLast(mHandler);
    }
}
