package com.rex.tunnel.relay;

import com.rex.tunnel.TunnelConfig;
import com.rex.tunnel.auth.Authenticator;
import io.netty.channel.EventLoopGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keep track of the running tunnels
 *
 * A tunnel failure is logged and dropped here, it never reaches the control session nor the other tunnels.
 */
public class TunnelSupervisor {

    private static final Logger sLogger = LoggerFactory.getLogger(TunnelSupervisor.class);

    private final TunnelConfig mConfig;
    private final Authenticator mAuthenticator;
    private final EventLoopGroup mGroup;
    private final Map<UUID, TunnelConnection> mActive = new ConcurrentHashMap<>();
    private volatile boolean mShutdown;

    public TunnelSupervisor(TunnelConfig config, Authenticator authenticator, EventLoopGroup group) {
        sLogger.trace("<init>");
        mConfig = config;
        mAuthenticator = authenticator;
        mGroup = group;
    }

    /**
     * Start a tunnel for the connection, return without waiting for it
     */
    public Future<Void> spawn(final UUID id) {
        if (mShutdown) {
            sLogger.warn("Drop connection {} after shutdown", id);
            return mGroup.next().newFailedFuture(new CancellationException("supervisor shutdown"));
        }
        final TunnelConnection conn = new TunnelConnection(id, mConfig, mAuthenticator, mGroup);
        mActive.put(id, conn);
        conn.closeFuture().addListener(new FutureListener<Void>() {
            @Override
            public void operationComplete(Future<Void> future) throws Exception {
                mActive.remove(id, conn);
                if (future.isSuccess()) {
                    sLogger.info("Connection {} closed gracefully", id);
                } else if (future.isCancelled()) {
                    sLogger.info("Connection {} cancelled", id);
                } else {
                    sLogger.warn("Connection {} exited with error - {}", id, describe(future.cause()));
                }
            }
        });
        return conn.open();
    }

    public Collection<TunnelConnection> active() {
        return new ArrayList<>(mActive.values());
    }

    public int activeCount() {
        return mActive.size();
    }

    /**
     * Cancel all running tunnels, later connections are refused
     */
    public void shutdown() {
        sLogger.debug("shutdown active:{}", mActive.size());
        mShutdown = true;
        for (TunnelConnection conn : active()) {
            conn.cancel();
        }
    }

    private static String describe(Throwable cause) {
        StringBuilder builder = new StringBuilder(String.valueOf(cause.getMessage()));
        Throwable tr = cause.getCause();
        while (tr != null) {
            builder.append(": ").append(tr.getMessage());
            tr = tr.getCause();
        }
        return builder.toString();
    }
}
