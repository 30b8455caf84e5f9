package com.rex.tunnel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reverse tunnel client launcher
 */
public class Tunnel {

    private static final Logger sLogger = LoggerFactory.getLogger(Tunnel.class);

    static final String ENV_CONFIG = "TUNNEL_CONF";

    static TunnelConfig loadConfig(String configFile) throws IOException {
        Properties properties = new Properties();
        if (configFile != null) {
            try (InputStream is = new FileInputStream(configFile)) {
                properties.load(is);
            }
        }
        return new TunnelConfig.Builder(properties)
                .fallback(System.getenv())
                .build();
    }

    public static void main(String[] args) {
        String configFile = System.getProperty(ENV_CONFIG);
        if (System.getenv().containsKey(ENV_CONFIG)) {
            configFile = System.getenv(ENV_CONFIG);
        }

        int idx = 0;
        while (idx < args.length) {
            String key = args[idx++];
            if (("-c".equals(key) || "--config".equals(key)) && idx < args.length) {
                configFile = args[idx++];
            }
            if ("-h".equals(key) || "--help".equals(key)) {
                printHelp();
                return;
            }
        }

        TunnelConfig config;
        try {
            config = loadConfig(configFile).validate();
        } catch (IOException | IllegalArgumentException ex) {
            sLogger.error("Failed to load config file {} - {}", configFile, ex.getMessage());
            printHelp();
            System.exit(1);
            return;
        }

        TunnelClient client = new TunnelClient().config(config);
        try {
            client.start();
            client.awaitTermination();
        } catch (TunnelException ex) {
            sLogger.error("Tunnel client terminated - {}", ex.getMessage());
            client.stop();
            System.exit(1);
        }
    }

    private static void printHelp() {
        System.out.println("Usage: Tunnel [options]");
        System.out.println("    -c | --config   Configuration file");
        System.out.println("    -h | --help     Help page");
        System.out.println("Missing values are read from environment variables");
        System.out.println("    SERVER SERVER_PORT LOCAL_HOST LOCAL_PORT CLIENT_ID SECRET_KEY");
    }
}
