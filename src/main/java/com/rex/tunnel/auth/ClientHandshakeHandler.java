package com.rex.tunnel.auth;

import com.rex.tunnel.AuthException;
import com.rex.tunnel.ConnectionException;
import com.rex.tunnel.TunnelException;
import com.rex.tunnel.protocol.ClientMessage;
import com.rex.tunnel.protocol.ServerMessage;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Client side of the challenge/response handshake
 *
 * S -> C Challenge
 * C -> S Authenticate
 * S -> C FreePort
 */
public class ClientHandshakeHandler extends SimpleChannelInboundHandler<ServerMessage> {

    private static final Logger sLogger = LoggerFactory.getLogger(ClientHandshakeHandler.class);

    private enum State {
        AWAIT_CHALLENGE,
        AWAIT_GRANT,
        DONE
    }

    private final Authenticator mAuthenticator;
    private final String mClientId;
    private final long mTimeoutMillis;
    private final Promise<Integer> mPromise;

    private State mState = State.AWAIT_CHALLENGE;
    private ScheduledFuture<?> mTimeout;

    public ClientHandshakeHandler(Authenticator authenticator, String clientId, long timeoutMillis, Promise<Integer> promise) {
        sLogger.trace("<init>");
        mAuthenticator = authenticator;
        mClientId = clientId;
        mTimeoutMillis = timeoutMillis;
        mPromise = promise;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) throws Exception {
        if (ctx.channel().isActive()) {
            armTimeout(ctx);
        }
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        if (mState == State.AWAIT_CHALLENGE && mTimeout == null) {
            armTimeout(ctx);
        }
        ctx.fireChannelActive();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ServerMessage msg) throws Exception {
        sLogger.trace("state:{} msg:{}", mState, msg);
        switch (mState) {
        case AWAIT_CHALLENGE:
            if (msg.type != ServerMessage.Type.CHALLENGE) {
                fail(ctx, new AuthException("no secret provided / invalid secret key"));
                return;
            }
            mState = State.AWAIT_GRANT;
            armTimeout(ctx);
            ctx.writeAndFlush(ClientMessage.authenticate(mAuthenticator.generateAnswer(msg.challenge), mClientId))
                    .addListener(new ChannelFutureListener() {
                        @Override
                        public void operationComplete(ChannelFuture future) throws Exception {
                            if (!future.isSuccess()) {
                                fail(ctx, new ConnectionException("failed to send authenticate message", future.cause()));
                            }
                        }
                    });
            break;
        case AWAIT_GRANT:
            if (msg.type != ServerMessage.Type.FREE_PORT) {
                String reason = (msg.type == ServerMessage.Type.ERROR) ? ": " + msg.error : "";
                fail(ctx, new AuthException("rejection response from server" + reason));
                return;
            }
            mState = State.DONE;
            cancelTimeout();
            ctx.pipeline().remove(this);
            sLogger.debug("Handshake complete channel:{} port:{}", ctx.channel(), msg.port);
            mPromise.trySuccess(msg.port);
            break;
        default:
            ctx.fireChannelRead(msg);
            break;
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        fail(ctx, new ConnectionException("connection closed during handshake"));
        ctx.fireChannelInactive();
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof ChannelInputShutdownEvent) {
            fail(ctx, new ConnectionException("connection closed during handshake"));
        }
        ctx.fireUserEventTriggered(evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        Throwable tr = TunnelException.unwrap(cause);
        sLogger.warn("{} - {}", ctx.channel(), tr.toString());
        if (tr instanceof TunnelException) {
            fail(ctx, (TunnelException) tr);
        } else {
            fail(ctx, new ConnectionException("handshake transport failure", tr));
        }
    }

    private void armTimeout(ChannelHandlerContext ctx) {
        cancelTimeout();
        final State state = mState;
        mTimeout = ctx.executor().schedule(new Runnable() {
            @Override
            public void run() {
                if (mState == state) {
                    fail(ctx, new ConnectionException("timed out after " + mTimeoutMillis + "ms waiting for " + state));
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

    private void fail(ChannelHandlerContext ctx, TunnelException cause) {
        if (mState == State.DONE) {
            return;
        }
        sLogger.debug("Handshake failed channel:{} state:{} - {}", ctx.channel(), mState, cause.getMessage());
        mState = State.DONE;
        cancelTimeout();
        if (!ctx.isRemoved()) {
            ctx.pipeline().remove(this);
        }
        mPromise.tryFailure(cause);
    }
}
