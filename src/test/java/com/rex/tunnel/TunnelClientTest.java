package com.rex.tunnel;

import com.rex.tunnel.auth.Authenticator;
import com.rex.tunnel.protocol.ClientMessage;
import com.rex.tunnel.protocol.ServerMessage;
import com.rex.tunnel.utils.EchoServer;
import com.rex.tunnel.utils.MockTunnelServer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TunnelClientTest {

    private static final String SECRET = "SECRET";

    private final Authenticator mAuthenticator = new Authenticator(SECRET);
    private final ExecutorService mExecutor = Executors.newSingleThreadExecutor();
    private MockTunnelServer mServer;
    private EchoServer mEcho;

    @Before
    public void setUp() throws Exception {
        mServer = new MockTunnelServer();
        mEcho = new EchoServer().start();
    }

    @After
    public void tearDown() throws Exception {
        mExecutor.shutdownNow();
        mEcho.stop();
        mServer.close();
    }

    private TunnelConfig config(String secret) {
        return new TunnelConfig.Builder()
                .setServer("127.0.0.1")
                .setServerPort(mServer.port())
                .setLocalPort(mEcho.port())
                .setClientId("client-1")
                .setSecretKey(secret)
                .setNetworkTimeout(3000)
                .build();
    }

    private Future<TunnelClient> startAsync(TunnelClient client) {
        return mExecutor.submit(client::start);
    }

    /**
     * Run the control handshake and hello exchange, return the connected peer
     */
    private MockTunnelServer.Peer establish(int publicPort) throws Exception {
        MockTunnelServer.Peer peer = mServer.accept();
        assertEquals("client-1", peer.handshake(mAuthenticator, 5000));
        ClientMessage hello = peer.receive();
        assertEquals(ClientMessage.Type.HELLO, hello.type);
        assertEquals(Integer.valueOf(5000), hello.port);
        peer.send(ServerMessage.hello(publicPort));
        return peer;
    }

    @Test
    public void testEstablish() throws Exception {
        TunnelClient client = new TunnelClient().config(config(SECRET));
        Future<TunnelClient> started = startAsync(client);

        try (MockTunnelServer.Peer peer = mServer.accept()) {
            peer.send(ServerMessage.challenge(UUID.fromString("c5c7c9d7-051c-4356-b133-0d04ba6a0a41")));
            ClientMessage auth = peer.receive();
            assertEquals(ClientMessage.Type.AUTHENTICATE, auth.type);
            assertEquals("71d79ceb53a5369b02b317657ff44c48c5815ad8bd8f7b295c15ea6623e6c1dd", auth.authenticate);
            assertEquals("client-1", auth.clientId);

            peer.send(ServerMessage.freePort(5000));
            ClientMessage hello = peer.receive();
            assertEquals(ClientMessage.Type.HELLO, hello.type);
            assertEquals(Integer.valueOf(5000), hello.port);

            peer.send(ServerMessage.hello(9090));
            started.get(5, TimeUnit.SECONDS);
            assertEquals(9090, client.remotePort());
            assertFalse(client.closeFuture().isDone());

            client.stop();
            assertTrue(client.closeFuture().await(3, TimeUnit.SECONDS));
            assertTrue(client.closeFuture().isSuccess());
        }
    }

    @Test
    public void testWithoutSecret() throws Exception {
        TunnelClient client = new TunnelClient().config(config(null));
        Future<TunnelClient> started = startAsync(client);

        try (MockTunnelServer.Peer peer = mServer.accept()) {
            ClientMessage hello = peer.receive();
            assertEquals(ClientMessage.Type.HELLO, hello.type);
            assertEquals(Integer.valueOf(0), hello.port);
            peer.send(ServerMessage.hello(9091));
            started.get(5, TimeUnit.SECONDS);
            assertEquals(9091, client.remotePort());
        } finally {
            client.stop();
        }
    }

    @Test
    public void testServerError() throws Exception {
        TunnelClient client = new TunnelClient().config(config(SECRET));
        Future<TunnelClient> started = startAsync(client);

        try (MockTunnelServer.Peer peer = establish(9090)) {
            started.get(5, TimeUnit.SECONDS);
            peer.send(ServerMessage.error("bad client"));
            try {
                client.awaitTermination();
                fail("Session should terminate with server error");
            } catch (ServerException ex) {
                assertTrue(ex.getMessage().contains("bad client"));
            }
            assertEquals("Control socket closed", -1, peer.input().read());
        } finally {
            client.stop();
        }
    }

    @Test
    public void testServerClosed() throws Exception {
        TunnelClient client = new TunnelClient().config(config(SECRET));
        Future<TunnelClient> started = startAsync(client);

        MockTunnelServer.Peer peer = establish(9090);
        started.get(5, TimeUnit.SECONDS);
        peer.close();
        try {
            client.awaitTermination();
            fail("Session should terminate when the server closes");
        } catch (ConnectionException ex) {
            assertEquals("control connection closed by server", ex.getMessage());
        } finally {
            client.stop();
        }
    }

    @Test
    public void testConnection() throws Exception {
        TunnelClient client = new TunnelClient().config(config(SECRET));
        Future<TunnelClient> started = startAsync(client);

        try (MockTunnelServer.Peer control = establish(9090)) {
            started.get(5, TimeUnit.SECONDS);

            UUID id = UUID.randomUUID();
            control.send(ServerMessage.connection(id));
            try (MockTunnelServer.Peer data = mServer.accept()) {
                assertEquals(id, data.accept(mAuthenticator));
                data.output().write("ping".getBytes(StandardCharsets.UTF_8));
                data.output().flush();
                assertEquals("ping", new String(data.readFully(4), StandardCharsets.UTF_8));
                assertEquals(1, client.activeTunnels());
            }
            assertFalse(client.closeFuture().isDone());
        } finally {
            client.stop();
        }
    }

    @Test
    public void testFailingTunnelIsolated() throws Exception {
        TunnelClient client = new TunnelClient().config(config(SECRET));
        Future<TunnelClient> started = startAsync(client);

        try (MockTunnelServer.Peer control = establish(9090)) {
            started.get(5, TimeUnit.SECONDS);

            control.send(ServerMessage.connection(UUID.randomUUID()));
            try (MockTunnelServer.Peer data = mServer.accept()) {
                data.send(ServerMessage.challenge(UUID.randomUUID()));
                data.receive();
                data.send(ServerMessage.error("invalid secret"));
                assertEquals("Data socket closed", -1, data.input().read());
            }

            control.send(ServerMessage.heartbeat());

            UUID id = UUID.randomUUID();
            control.send(ServerMessage.connection(id));
            try (MockTunnelServer.Peer data = mServer.accept()) {
                assertEquals(id, data.accept(mAuthenticator));
                data.output().write("ping".getBytes(StandardCharsets.UTF_8));
                data.output().flush();
                assertEquals("ping", new String(data.readFully(4), StandardCharsets.UTF_8));
            }
            assertFalse(client.closeFuture().isDone());
        } finally {
            client.stop();
        }
    }

    @Test
    public void testStopCancelsTunnels() throws Exception {
        TunnelClient client = new TunnelClient().config(config(SECRET));
        Future<TunnelClient> started = startAsync(client);

        try (MockTunnelServer.Peer control = establish(9090)) {
            started.get(5, TimeUnit.SECONDS);

            control.send(ServerMessage.connection(UUID.randomUUID()));
            try (MockTunnelServer.Peer data = mServer.accept()) {
                data.accept(mAuthenticator);
                data.output().write("ping".getBytes(StandardCharsets.UTF_8));
                data.output().flush();
                assertEquals("ping", new String(data.readFully(4), StandardCharsets.UTF_8));

                client.stop();
                assertEquals("Data socket closed", -1, data.input().read());
                assertEquals("Control socket closed", -1, control.input().read());
            }
            client.awaitTermination();
        }
    }

    @Test
    public void testConnectRefused() throws Exception {
        TunnelConfig config = config(SECRET);
        try (ServerSocket socket = new ServerSocket(0)) {
            config.serverPort = socket.getLocalPort();
        }
        TunnelClient client = new TunnelClient().config(config);
        try {
            client.start();
            fail("Start should fail without server");
        } catch (ConnectionException ex) {
            assertTrue(ex.getMessage().startsWith("failed to connect to"));
        }
    }

    @Test
    public void testHandshakeRejected() throws Exception {
        TunnelClient client = new TunnelClient().config(config("WRONG"));
        Future<TunnelClient> started = startAsync(client);

        try (MockTunnelServer.Peer peer = mServer.accept()) {
            UUID challenge = UUID.randomUUID();
            peer.send(ServerMessage.challenge(challenge));
            ClientMessage auth = peer.receive();
            assertFalse(mAuthenticator.validateAnswer(challenge, auth.authenticate));
            peer.send(ServerMessage.error("invalid secret"));
            try {
                started.get(5, TimeUnit.SECONDS);
                fail("Start should fail on rejection");
            } catch (ExecutionException ex) {
                assertTrue(ex.getCause() instanceof AuthException);
                assertEquals("rejection response from server: invalid secret", ex.getCause().getMessage());
            }
        }
    }

    @Test
    public void testChallengeWithoutSecret() throws Exception {
        TunnelClient client = new TunnelClient().config(config(null));
        Future<TunnelClient> started = startAsync(client);

        try (MockTunnelServer.Peer peer = mServer.accept()) {
            assertEquals(ClientMessage.Type.HELLO, peer.receive().type);
            peer.send(ServerMessage.challenge(UUID.randomUUID()));
            try {
                started.get(5, TimeUnit.SECONDS);
                fail("Start should fail on challenge");
            } catch (ExecutionException ex) {
                assertTrue(ex.getCause() instanceof AuthException);
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidConfig() throws Exception {
        new TunnelClient()
                .config(new TunnelConfig.Builder().setServer("127.0.0.1").build())
                .start();
    }
}
