package com.rex.tunnel.control;

import com.rex.tunnel.AuthException;
import com.rex.tunnel.ConnectionException;
import com.rex.tunnel.ProtocolException;
import com.rex.tunnel.ServerException;
import com.rex.tunnel.TunnelException;
import com.rex.tunnel.auth.Authenticator;
import com.rex.tunnel.protocol.ClientMessage;
import com.rex.tunnel.protocol.ServerMessage;
import com.rex.tunnel.relay.TunnelSupervisor;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Control channel state machine
 *
 * 1. Handshake (only if a secret is configured)
 * S -> C Challenge, C -> S Authenticate, S -> C FreePort
 *
 * 2. Port registration
 * C -> S Hello(FREE_PORT)
 * S -> C Hello(PUBLIC_PORT)
 *
 * 3. Notification loop, without read timeout
 * S -> C Heartbeat
 * S -> C Connection(UUID) spawns a tunnel connection
 * S -> C Error(TEXT) terminates the session
 *
 * The established promise completes with the public port, the closed promise fails with the reason the loop exits.
 */
public class ControlSessionHandler extends SimpleChannelInboundHandler<ServerMessage> {

    private static final Logger sLogger = LoggerFactory.getLogger(ControlSessionHandler.class);

    private enum State {
        HANDSHAKE,
        HELLO,
        ESTABLISHED,
        CLOSED
    }

    private final String mClientId;
    private final Authenticator mAuthenticator; // Null if no secret configured
    private final long mTimeoutMillis;
    private final TunnelSupervisor mSupervisor;
    private final Promise<Integer> mEstablished;
    private final Promise<Void> mClosed;

    private State mState = State.HANDSHAKE;
    private ScheduledFuture<?> mTimeout;

    public ControlSessionHandler(String clientId, Authenticator authenticator, long timeoutMillis,
                                 TunnelSupervisor supervisor, Promise<Integer> established, Promise<Void> closed) {
        sLogger.trace("<init>");
        mClientId = clientId;
        mAuthenticator = authenticator;
        mTimeoutMillis = timeoutMillis;
        mSupervisor = supervisor;
        mEstablished = established;
        mClosed = closed;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        sLogger.debug("Control channel active {}", ctx.channel());
        if (mAuthenticator != null) {
            mAuthenticator.performClientHandshake(ctx.channel(), mClientId, mTimeoutMillis)
                    .addListener(new FutureListener<Integer>() {
                        @Override
                        public void operationComplete(Future<Integer> future) throws Exception {
                            if (future.isSuccess()) {
                                sendHello(ctx, future.getNow());
                            } else {
                                fail(ctx, future.cause());
                            }
                        }
                    });
        } else {
            sendHello(ctx, 0);
        }
        ctx.fireChannelActive();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ServerMessage msg) throws Exception {
        sLogger.trace("state:{} msg:{}", mState, msg);
        switch (mState) {
        case HELLO:
            processInitialMessage(ctx, msg);
            break;
        case ESTABLISHED:
            processMessage(ctx, msg);
            break;
        default:
            sLogger.warn("Drop message {} in state {}", msg.type, mState);
            break;
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        sLogger.debug("Control channel inactive {}", ctx.channel());
        fail(ctx, new ConnectionException("control connection closed by server"));
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        Throwable tr = TunnelException.unwrap(cause);
        sLogger.warn("{} - {}", ctx.channel(), tr.toString());
        if (tr instanceof TunnelException) {
            fail(ctx, tr);
        } else {
            fail(ctx, new ConnectionException("failed to receive server message", tr));
        }
    }

    private void sendHello(ChannelHandlerContext ctx, int port) {
        sLogger.debug("Hello with port {}", port);
        mState = State.HELLO;
        armTimeout(ctx);
        ctx.writeAndFlush(ClientMessage.hello(port))
                .addListener(new ChannelFutureListener() {
                    @Override
                    public void operationComplete(ChannelFuture future) throws Exception {
                        if (!future.isSuccess()) {
                            fail(ctx, new ConnectionException("failed to send hello message", future.cause()));
                        }
                    }
                });
    }

    private void processInitialMessage(ChannelHandlerContext ctx, ServerMessage msg) {
        switch (msg.type) {
        case HELLO:
            cancelTimeout();
            mState = State.ESTABLISHED;
            sLogger.info("Session established remote port {}", msg.port);
            mEstablished.trySuccess(msg.port);
            break;
        case ERROR:
            fail(ctx, new ServerException("server error: " + msg.error));
            break;
        case CHALLENGE:
            fail(ctx, new AuthException("server requires authentication, but no client secret was provided"));
            break;
        default:
            fail(ctx, new ProtocolException("unexpected initial non-hello message of type: " + msg.type));
            break;
        }
    }

    private void processMessage(ChannelHandlerContext ctx, ServerMessage msg) {
        switch (msg.type) {
        case HELLO:
            sLogger.warn("Received an unexpected hello message");
            break;
        case CHALLENGE:
            sLogger.warn("Received an unexpected challenge message");
            break;
        case HEARTBEAT:
            sLogger.trace("Heartbeat {}", msg.heartbeat);
            break;
        case CONNECTION:
            sLogger.debug("New connection {}", msg.connection);
            mSupervisor.spawn(msg.connection);
            break;
        case ERROR:
            fail(ctx, new ServerException("server error: " + msg.error));
            break;
        case FREE_PORT:
        default:
            fail(ctx, new ProtocolException("received unexpected message type: " + msg.type));
            break;
        }
    }

    private void armTimeout(ChannelHandlerContext ctx) {
        cancelTimeout();
        mTimeout = ctx.executor().schedule(new Runnable() {
            @Override
            public void run() {
                if (mState == State.HELLO) {
                    fail(ctx, new ConnectionException("timed out after " + mTimeoutMillis + "ms waiting for hello"));
                }
            }
        }, mTimeoutMillis, TimeUnit.MILLISECONDS);
    }

    private void cancelTimeout() {
        if (mTimeout != null) {
            mTimeout.cancel(false);
            mTimeout = null;
        }
    }

    private void fail(ChannelHandlerContext ctx, Throwable cause) {
        if (mState == State.CLOSED) {
            return;
        }
        if (mClosed.isDone()) { // Stopped locally
            sLogger.debug("Session closed in state {}", mState);
        } else if (mState == State.ESTABLISHED) {
            sLogger.warn("Session terminated - {}", cause.getMessage());
        } else {
            sLogger.warn("Session failed to establish in state {} - {}", mState, cause.getMessage());
        }
        mState = State.CLOSED;
        cancelTimeout();
        mEstablished.tryFailure(cause);
        mClosed.tryFailure(cause);
        ctx.close();
    }
}
