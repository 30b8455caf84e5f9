package com.rex.tunnel.protocol;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.rex.tunnel.ProtocolException;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.netty.handler.codec.Delimiters;
import io.netty.handler.codec.MessageToMessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Codec to convert inbound NUL delimited JSON frames as ServerMessage
 * And convert outbound ClientMessage as NUL terminated JSON frames
 */
public class TunnelMessageCodec extends MessageToMessageCodec<ByteBuf, ClientMessage> {

    private static final Logger sLogger = LoggerFactory.getLogger(TunnelMessageCodec.class);

    public static final int MAX_FRAME_LENGTH = 1 << 16; // 65536
    public static final String FRAME_DECODER = "frameDecoder";
    public static final String MESSAGE_CODEC = "messageCodec";

    private static final byte DELIMITER = 0;

    private final Gson mCodec = new Gson();

    /**
     * Install the framing and message codec at the head of the pipeline
     */
    public static ChannelPipeline install(ChannelPipeline pipeline) {
        return pipeline
                .addFirst(MESSAGE_CODEC, new TunnelMessageCodec())
                .addFirst(FRAME_DECODER, new DelimiterBasedFrameDecoder(MAX_FRAME_LENGTH, Delimiters.nulDelimiter()));
    }

    /**
     * Remove the framing and message codec, the channel carries raw bytes afterwards
     */
    public static ChannelPipeline uninstall(ChannelPipeline pipeline) {
        if (pipeline.get(MESSAGE_CODEC) != null) pipeline.remove(MESSAGE_CODEC);
        if (pipeline.get(FRAME_DECODER) != null) pipeline.remove(FRAME_DECODER);
        return pipeline;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, ClientMessage msg, List<Object> out) throws Exception {
        sLogger.trace("encode {}", msg);
        ByteBuf buf = ctx.alloc().buffer();
        buf.writeCharSequence(mCodec.toJson(msg), StandardCharsets.UTF_8);
        buf.writeByte(DELIMITER);
        out.add(buf);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) throws Exception {
        if (!frame.isReadable()) {
            return;
        }
        String text = frame.toString(StandardCharsets.UTF_8);
        ServerMessage msg;
        try {
            msg = mCodec.fromJson(text, ServerMessage.class);
        } catch (JsonParseException ex) {
            throw new ProtocolException("malformed server message", ex);
        }
        if (msg == null || msg.type == null) {
            throw new ProtocolException("unknown server message: " + text);
        }
        validate(msg);
        sLogger.trace("decode {}", msg);
        out.add(msg);
    }

    private static void validate(ServerMessage msg) throws ProtocolException {
        boolean valid;
        switch (msg.type) {
        case CHALLENGE:
            valid = msg.challenge != null;
            break;
        case FREE_PORT:
        case HELLO:
            if (msg.port == null) msg.port = 0; // Zero port is omitted on the wire
            valid = msg.port >= 0 && msg.port <= 0xFFFF;
            break;
        case CONNECTION:
            valid = msg.connection != null;
            break;
        case ERROR:
            if (msg.error == null) msg.error = "";
            valid = true;
            break;
        case HEARTBEAT:
            if (msg.heartbeat == null) msg.heartbeat = Boolean.FALSE;
            valid = true;
            break;
        default:
            valid = true;
            break;
        }
        if (!valid) {
            throw new ProtocolException("incomplete " + msg.type + " message");
        }
    }
}
