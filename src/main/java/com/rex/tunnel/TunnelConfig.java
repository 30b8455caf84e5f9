package com.rex.tunnel;

import java.util.Map;
import java.util.Properties;

/**
 * Reverse tunnel client configuration
 */
public class TunnelConfig {

    public static final long DEFAULT_NETWORK_TIMEOUT = 2 * 60 * 1000L; // 2 minutes
    public static final String DEFAULT_LOCAL_HOST = "127.0.0.1";

    public String server;
    public Integer serverPort;
    public String localHost;
    public Integer localPort;
    public String clientId;
    public String secretKey; // Leave it null if server does not require auth
    public Long networkTimeout; // Milliseconds, bound every connect and handshake receive

    public TunnelConfig() {
    }

    public TunnelConfig(String server, int serverPort, String localHost, int localPort) {
        this.server = server;
        this.serverPort = serverPort;
        this.localHost = localHost;
        this.localPort = localPort;
    }

    /**
     * Throw IllegalArgumentException if any mandatory value missing
     */
    public TunnelConfig validate() {
        if (server == null || server.isEmpty()) throw new IllegalArgumentException("server not specified");
        checkPort("serverPort", serverPort);
        if (localHost == null || localHost.isEmpty()) throw new IllegalArgumentException("localHost not specified");
        checkPort("localPort", localPort);
        if (secretKey != null && (clientId == null || clientId.isEmpty())) {
            throw new IllegalArgumentException("clientId not specified");
        }
        if (networkTimeout == null || networkTimeout <= 0 || networkTimeout > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid networkTimeout " + networkTimeout);
        }
        return this;
    }

    private static void checkPort(String name, Integer port) {
        if (port == null || port <= 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("Invalid " + name + " " + port);
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("<@");
        builder.append(Integer.toHexString(hashCode()));
        builder.append(" server:").append(server);
        builder.append(" serverPort:").append(serverPort);
        builder.append(" localHost:").append(localHost);
        builder.append(" localPort:").append(localPort);
        builder.append(" clientId:").append(clientId);
        builder.append(" secretKey:").append(secretKey == null ? null : "***");
        builder.append(" networkTimeout:").append(networkTimeout);
        builder.append(">");
        return builder.toString();
    }

    public static class Builder {

        static final String ENV_SERVER = "SERVER";
        static final String ENV_SERVER_PORT = "SERVER_PORT";
        static final String ENV_LOCAL_HOST = "LOCAL_HOST";
        static final String ENV_LOCAL_PORT = "LOCAL_PORT";
        static final String ENV_CLIENT_ID = "CLIENT_ID";
        static final String ENV_SECRET_KEY = "SECRET_KEY";

        private final TunnelConfig mConfig = new TunnelConfig();

        public Builder() {
        }

        public Builder(TunnelConfig conf) {
            merge(conf);
        }

        public Builder(Properties properties) {
            for (String name : properties.stringPropertyNames()) {
                String value = properties.getProperty(name).trim();
                switch (name) {
                case "server":
                    mConfig.server = value;
                    break;
                case "serverPort":
                    mConfig.serverPort = Integer.parseInt(value);
                    break;
                case "localHost":
                    mConfig.localHost = value;
                    break;
                case "localPort":
                    mConfig.localPort = Integer.parseInt(value);
                    break;
                case "clientId":
                    mConfig.clientId = value;
                    break;
                case "secretKey":
                    mConfig.secretKey = value;
                    break;
                case "networkTimeout":
                    mConfig.networkTimeout = Long.parseLong(value);
                    break;
                }
            }
        }

        /**
         * Override with the non-null values
         */
        public Builder merge(TunnelConfig conf) {
            if (conf.server != null) mConfig.server = conf.server;
            if (conf.serverPort != null) mConfig.serverPort = conf.serverPort;
            if (conf.localHost != null) mConfig.localHost = conf.localHost;
            if (conf.localPort != null) mConfig.localPort = conf.localPort;
            if (conf.clientId != null) mConfig.clientId = conf.clientId;
            if (conf.secretKey != null) mConfig.secretKey = conf.secretKey;
            if (conf.networkTimeout != null) mConfig.networkTimeout = conf.networkTimeout;
            return this;
        }

        /**
         * Fill the values still missing from environment variables
         */
        public Builder fallback(Map<String, String> env) {
            if (mConfig.server == null) mConfig.server = env.get(ENV_SERVER);
            if (mConfig.serverPort == null && env.containsKey(ENV_SERVER_PORT)) mConfig.serverPort = Integer.parseInt(env.get(ENV_SERVER_PORT));
            if (mConfig.localHost == null) mConfig.localHost = env.get(ENV_LOCAL_HOST);
            if (mConfig.localPort == null && env.containsKey(ENV_LOCAL_PORT)) mConfig.localPort = Integer.parseInt(env.get(ENV_LOCAL_PORT));
            if (mConfig.clientId == null) mConfig.clientId = env.get(ENV_CLIENT_ID);
            if (mConfig.secretKey == null) mConfig.secretKey = env.get(ENV_SECRET_KEY);
            return this;
        }

        public Builder setServer(String value) {
            mConfig.server = value;
            return this;
        }

        public Builder setServerPort(int value) {
            mConfig.serverPort = value;
            return this;
        }

        public Builder setLocalHost(String value) {
            mConfig.localHost = value;
            return this;
        }

        public Builder setLocalPort(int value) {
            mConfig.localPort = value;
            return this;
        }

        public Builder setClientId(String value) {
            mConfig.clientId = value;
            return this;
        }

        public Builder setSecretKey(String value) {
            mConfig.secretKey = value;
            return this;
        }

        public Builder setNetworkTimeout(long millis) {
            mConfig.networkTimeout = millis;
            return this;
        }

        public TunnelConfig build() {
            if (mConfig.localHost == null) mConfig.localHost = DEFAULT_LOCAL_HOST;
            if (mConfig.networkTimeout == null) mConfig.networkTimeout = DEFAULT_NETWORK_TIMEOUT;
            if (mConfig.secretKey != null && mConfig.secretKey.isEmpty()) mConfig.secretKey = null;
            return mConfig;
        }
    }
}
