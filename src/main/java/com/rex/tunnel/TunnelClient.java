package com.rex.tunnel;

import com.rex.tunnel.auth.Authenticator;
import com.rex.tunnel.control.ControlChannelInitializer;
import com.rex.tunnel.control.ControlSessionHandler;
import com.rex.tunnel.relay.TunnelSupervisor;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reverse tunnel client
 *
 * Keep one control connection with the server, and open a tunnel to the local service for each public connection.
 * There is no reconnect, once the control session terminated the client has to be started again.
 */
public class TunnelClient {

    private static final Logger sLogger = LoggerFactory.getLogger(TunnelClient.class);

    private final EventLoopGroup mWorkerGroup = new NioEventLoopGroup(); // Default use Runtime.getRuntime().availableProcessors() * 2

    private final TunnelConfig.Builder mConfigBuilder = new TunnelConfig.Builder();
    private TunnelConfig mConfig;
    private TunnelSupervisor mSupervisor;
    private Channel mControlChannel;
    private Promise<Integer> mEstablished;
    private Promise<Void> mCloseFuture;

    /**
     * Construct the client
     */
    public TunnelClient() {
        sLogger.trace("<init>");
    }

    synchronized public TunnelClient config(TunnelConfig conf) {
        mConfigBuilder.merge(conf);
        return this;
    }

    /**
     * Connect and establish the control session, block until the public port is known
     *
     * @throws TunnelException if the session can not be established, nothing is left running then
     */
    synchronized public TunnelClient start() throws TunnelException {
        if (mControlChannel != null) {
            sLogger.warn("already started");
            return this;
        }
        mConfig = mConfigBuilder.build().validate();
        sLogger.info("Start {}", mConfig);

        Authenticator authenticator = (mConfig.secretKey != null) ? new Authenticator(mConfig.secretKey) : null;
        mSupervisor = new TunnelSupervisor(mConfig, authenticator, mWorkerGroup);

        EventLoop loop = mWorkerGroup.next();
        mEstablished = loop.newPromise();
        mCloseFuture = loop.newPromise();
        mCloseFuture.addListener(new FutureListener<Void>() {
            @Override
            public void operationComplete(Future<Void> future) throws Exception {
                mSupervisor.shutdown();
            }
        });

        ControlSessionHandler handler = new ControlSessionHandler(mConfig.clientId, authenticator,
                mConfig.networkTimeout, mSupervisor, mEstablished, mCloseFuture);
        ChannelFuture connectFuture = new Bootstrap()
                .group(loop)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) mConfig.networkTimeout.longValue())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ControlChannelInitializer(handler))
                .connect(mConfig.server, mConfig.serverPort)
                .awaitUninterruptibly();
        mControlChannel = connectFuture.channel();
        if (!connectFuture.isSuccess()) {
            ConnectionException ex = new ConnectionException("failed to connect to " + mConfig.server + ":" + mConfig.serverPort, connectFuture.cause());
            mCloseFuture.tryFailure(ex);
            abort();
            throw ex;
        }

        mEstablished.awaitUninterruptibly();
        if (!mEstablished.isSuccess()) {
            Throwable cause = mEstablished.cause();
            abort();
            if (cause instanceof TunnelException) {
                throw (TunnelException) cause;
            }
            throw new ConnectionException("failed to establish session", cause);
        }

        sLogger.info("Connected to server at {}:{}", mConfig.server, remotePort());
        sLogger.info("Listening for connection to redirect");
        return this;
    }

    /**
     * Stop the control session and all the tunnels
     */
    synchronized public TunnelClient stop() {
        sLogger.info("stop");
        if (mControlChannel == null) {
            sLogger.warn("not started");
            return this;
        }
        mCloseFuture.trySuccess(null);
        abort();
        return this;
    }

    /**
     * Port publicly exposed on the server, valid once started
     */
    public int remotePort() {
        if (mEstablished == null || !mEstablished.isSuccess()) {
            throw new IllegalStateException("session not established");
        }
        return mEstablished.getNow();
    }

    /**
     * Completed when the control session terminated, failed with the reason unless stopped locally
     */
    public Future<Void> closeFuture() {
        if (mCloseFuture == null) {
            throw new IllegalStateException("not started");
        }
        return mCloseFuture;
    }

    /**
     * Block until the control session terminated
     *
     * @throws TunnelException the reason the session terminated
     */
    public void awaitTermination() throws TunnelException {
        Future<Void> future = closeFuture().awaitUninterruptibly();
        if (!future.isSuccess()) {
            Throwable cause = future.cause();
            if (cause instanceof TunnelException) {
                throw (TunnelException) cause;
            }
            throw new ConnectionException("session terminated", cause);
        }
    }

    public int activeTunnels() {
        return (mSupervisor != null) ? mSupervisor.activeCount() : 0;
    }

    private void abort() {
        if (mSupervisor != null) {
            mSupervisor.shutdown();
        }
        if (mControlChannel != null) {
            mControlChannel.close();
        }
        mWorkerGroup.shutdownGracefully();
    }
}
