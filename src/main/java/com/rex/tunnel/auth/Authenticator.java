package com.rex.tunnel.auth;

import com.rex.tunnel.protocol.TunnelMessageCodec;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelPipeline;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Shared secret challenge/response authenticator
 *
 * KEY    = SHA256(SECRET)
 * ANSWER = HEX(HMAC.init(KEY).update(CHALLENGE))
 *
 * The challenge is hashed as its 16 raw bytes, most significant bits first.
 * The key is never logged nor sent, only the answers cross the wire.
 */
public class Authenticator {

    private static final Logger sLogger = LoggerFactory.getLogger(Authenticator.class);

    public static final String HANDSHAKE_HANDLER = "clientHandshake";

    private static final String ALGORITHM = "HmacSHA256";
    private static final String DIGEST = "SHA-256";

    private final byte[] mKey;

    public Authenticator(String secret) {
        sLogger.trace("<init>");
        try {
            mKey = MessageDigest.getInstance(DIGEST).digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException(DIGEST + " not supported", ex);
        }
    }

    /**
     * Compute the answer for the challenge, the same challenge always gives the same answer
     */
    public String generateAnswer(UUID challenge) {
        return ByteBufUtil.hexDump(sign(challenge));
    }

    /**
     * Check the answer against the challenge in constant time, malformed answer is rejected without exception
     */
    public boolean validateAnswer(UUID challenge, String answer) {
        if (answer == null) {
            return false;
        }
        byte[] decoded;
        try {
            decoded = ByteBufUtil.decodeHexDump(answer);
        } catch (IllegalArgumentException ex) {
            sLogger.debug("Malformed answer - {}", ex.getMessage());
            return false;
        }
        return MessageDigest.isEqual(sign(challenge), decoded);
    }

    /**
     * Answer the server challenge on the channel
     *
     * The handshake handler is installed right after the message codec, it removes itself once done.
     * Each message must arrive within the timeout.
     *
     * @return future completed with the port granted by server
     */
    public Future<Integer> performClientHandshake(Channel channel, String clientId, long timeoutMillis) {
        sLogger.trace("channel:{} clientId:{}", channel, clientId);
        Promise<Integer> promise = channel.eventLoop().newPromise();
        ClientHandshakeHandler handler = new ClientHandshakeHandler(this, clientId, timeoutMillis, promise);
        ChannelPipeline pipeline = channel.pipeline();
        if (pipeline.get(TunnelMessageCodec.MESSAGE_CODEC) != null) {
            pipeline.addAfter(TunnelMessageCodec.MESSAGE_CODEC, HANDSHAKE_HANDLER, handler);
        } else {
            pipeline.addFirst(HANDSHAKE_HANDLER, handler);
        }
        return promise;
    }

    private byte[] sign(UUID challenge) {
        try {
            Mac hmac = Mac.getInstance(ALGORITHM);
            hmac.init(new SecretKeySpec(mKey, ALGORITHM));
            hmac.update(ByteBuffer.allocate(Long.BYTES * 2)
                    .putLong(challenge.getMostSignificantBits())
                    .putLong(challenge.getLeastSignificantBits())
                    .array());
            return hmac.doFinal();
        } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
            throw new IllegalStateException("Failed to sign challenge - " + ex.getMessage(), ex);
        }
    }
}
