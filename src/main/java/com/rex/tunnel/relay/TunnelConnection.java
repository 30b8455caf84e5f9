package com.rex.tunnel.relay;

import com.rex.tunnel.ConnectionException;
import com.rex.tunnel.RelayException;
import com.rex.tunnel.TunnelConfig;
import com.rex.tunnel.auth.Authenticator;
import com.rex.tunnel.protocol.ClientMessage;
import com.rex.tunnel.protocol.TunnelMessageCodec;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * One tunnel for a public connection reported by the server
 *
 * 1. Connect to server
 * 2. Handshake with a fresh challenge (only if a secret is configured)
 * 3. C -> S Accept(UUID)
 * 4. Connect to local service
 * 5. Relay both directions until both reach end of stream, or either fails
 *
 * Both channels run on the same event loop, all the state below is confined to it.
 */
public class TunnelConnection implements RelayHandler.Listener {

    private static final Logger sLogger = LoggerFactory.getLogger(TunnelConnection.class);

    private static final String RELAY_HANDLER = "relay";

    private final UUID mId;
    private final TunnelConfig mConfig;
    private final Authenticator mAuthenticator; // Null if no secret configured
    private final EventLoop mLoop;
    private final Promise<Void> mResult;

    private Channel mServerChannel;
    private Channel mLocalChannel;
    private boolean mRelaying;
    private int mShutdownInputs;
    private int mClosedChannels;
    private Throwable mRelayError;

    public TunnelConnection(UUID id, TunnelConfig config, Authenticator authenticator, EventLoopGroup group) {
        sLogger.trace("<init> id:{}", id);
        mId = id;
        mConfig = config;
        mAuthenticator = authenticator;
        mLoop = group.next();
        mResult = mLoop.newPromise();
    }

    public UUID id() {
        return mId;
    }

    /**
     * Completed when both sockets are closed, failed with the first error met
     */
    public Future<Void> closeFuture() {
        return mResult;
    }

    public Future<Void> open() {
        sLogger.debug("Open tunnel {} via {}:{}", mId, mConfig.server, mConfig.serverPort);
        new Bootstrap()
                .group(mLoop)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) mConfig.networkTimeout.longValue())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) throws Exception {
                        TunnelMessageCodec.install(ch.pipeline());
                    }
                })
                .connect(mConfig.server, mConfig.serverPort)
                .addListener(new ChannelFutureListener() {
                    @Override
                    public void operationComplete(ChannelFuture future) throws Exception {
                        if (!future.isSuccess()) {
                            fail(new ConnectionException("failed to connect to " + mConfig.server + ":" + mConfig.serverPort, future.cause()));
                            return;
                        }
                        mServerChannel = future.channel();
                        mServerChannel.closeFuture().addListener(new ChannelFutureListener() {
                            @Override
                            public void operationComplete(ChannelFuture f) throws Exception {
                                if (mRelaying) {
                                    onChannelClosed();
                                } else {
                                    fail(new ConnectionException("server closed the data connection"));
                                }
                            }
                        });
                        if (mResult.isDone()) { // Cancelled while connecting
                            mServerChannel.close();
                            return;
                        }
                        handshake();
                    }
                });
        return mResult;
    }

    /**
     * Close both sockets, no matter which step the tunnel reached
     */
    public void cancel() {
        mLoop.execute(new Runnable() {
            @Override
            public void run() {
                if (mResult.cancel(false)) {
                    sLogger.debug("Tunnel {} cancelled", mId);
                    closeAll();
                }
            }
        });
    }

    @Override // RelayHandler.Listener
    public void onInputShutdown(Channel input) {
        mShutdownInputs++;
        sLogger.trace("Tunnel {} end of stream from {} ({}/2)", mId, input, mShutdownInputs);
        if (mShutdownInputs >= 2) {
            flushAndCloseAll();
        }
    }

    @Override // RelayHandler.Listener
    public void onFailure(Channel input, Throwable cause) {
        if (mRelayError == null) {
            mRelayError = cause;
        }
        closeAll();
    }

    private void handshake() {
        if (mAuthenticator == null) {
            accept();
            return;
        }
        mAuthenticator.performClientHandshake(mServerChannel, mConfig.clientId, mConfig.networkTimeout)
                .addListener(new FutureListener<Integer>() {
                    @Override
                    public void operationComplete(Future<Integer> future) throws Exception {
                        if (future.isSuccess()) {
                            accept();
                        } else {
                            sLogger.debug("Tunnel {} client handshake failed", mId);
                            fail(future.cause());
                        }
                    }
                });
    }

    private void accept() {
        // No more read until the relay installed, so no raw byte reaches the message decoder
        mServerChannel.config().setAutoRead(false);
        mServerChannel.writeAndFlush(ClientMessage.accept(mId))
                .addListener(new ChannelFutureListener() {
                    @Override
                    public void operationComplete(ChannelFuture future) throws Exception {
                        if (future.isSuccess()) {
                            connectLocal();
                        } else {
                            fail(new ConnectionException("failed to send accept message", future.cause()));
                        }
                    }
                });
    }

    private void connectLocal() {
        if (mResult.isDone()) {
            return;
        }
        sLogger.debug("Tunnel {} connect local {}:{}", mId, mConfig.localHost, mConfig.localPort);
        new Bootstrap()
                .group(mLoop)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) mConfig.networkTimeout.longValue())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) throws Exception {
                        ch.pipeline().addLast(RELAY_HANDLER, new RelayHandler(mServerChannel, TunnelConnection.this));
                    }
                })
                .connect(mConfig.localHost, mConfig.localPort)
                .addListener(new ChannelFutureListener() {
                    @Override
                    public void operationComplete(ChannelFuture future) throws Exception {
                        if (!future.isSuccess()) {
                            fail(new ConnectionException("failed to connect to local host " + mConfig.localHost + ":" + mConfig.localPort, future.cause()));
                            return;
                        }
                        mLocalChannel = future.channel();
                        if (mResult.isDone() || !mServerChannel.isActive()) {
                            fail(new ConnectionException("server closed the data connection"));
                            return;
                        }
                        startRelay();
                    }
                });
    }

    private void startRelay() {
        sLogger.debug("Relay {} with {}", mServerChannel, mLocalChannel);
        mRelaying = true;
        mLocalChannel.closeFuture().addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) throws Exception {
                onChannelClosed();
            }
        });
        mServerChannel.pipeline().addLast(RELAY_HANDLER, new RelayHandler(mLocalChannel, this));
        TunnelMessageCodec.uninstall(mServerChannel.pipeline()); // Pending bytes flow into relay
        mServerChannel.config().setAutoRead(true);
        sLogger.trace("FINAL pipeline:{}", mServerChannel.pipeline());
    }

    private void onChannelClosed() {
        mClosedChannels++;
        if (mClosedChannels < 2) {
            flushAndCloseAll();
            return;
        }
        if (mRelayError != null) {
            mResult.tryFailure(new RelayException("data transfer failed", mRelayError));
        } else {
            mResult.trySuccess(null);
        }
    }

    private void fail(Throwable cause) {
        closeAll();
        mResult.tryFailure(cause);
    }

    private void closeAll() {
        if (mServerChannel != null) mServerChannel.close();
        if (mLocalChannel != null) mLocalChannel.close();
    }

    private void flushAndCloseAll() {
        flushAndClose(mServerChannel);
        flushAndClose(mLocalChannel);
    }

    private static void flushAndClose(Channel ch) {
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(Unpooled.EMPTY_BUFFER)
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }
}
