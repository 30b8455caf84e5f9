package com.rex.tunnel.protocol;

import com.google.gson.annotations.SerializedName;

import java.util.UUID;

/**
 * Message sent from client to server
 *
 * C -> S {'type':'Hello', 'port':5000}
 * C -> S {'type':'Authenticate', 'authenticate':'ANSWER', 'clientId':'CLIENT'}
 * C -> S {'type':'Accept', 'accept':'CONNECTION_UUID'}
 */
public class ClientMessage {

    public enum Type {
        @SerializedName("Hello") HELLO,
        @SerializedName("Authenticate") AUTHENTICATE,
        @SerializedName("Accept") ACCEPT
    }

    public Type type;
    public Integer port;
    public String authenticate;
    public String clientId;
    public UUID accept;

    public static ClientMessage hello(int port) {
        ClientMessage msg = new ClientMessage();
        msg.type = Type.HELLO;
        msg.port = port;
        return msg;
    }

    public static ClientMessage authenticate(String answer, String clientId) {
        ClientMessage msg = new ClientMessage();
        msg.type = Type.AUTHENTICATE;
        msg.authenticate = answer;
        msg.clientId = clientId;
        return msg;
    }

    public static ClientMessage accept(UUID connectionId) {
        ClientMessage msg = new ClientMessage();
        msg.type = Type.ACCEPT;
        msg.accept = connectionId;
        return msg;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("<ClientMessage");
        builder.append(" type:").append(type);
        switch (type) {
        case HELLO:
            builder.append(" port:").append(port);
            break;
        case AUTHENTICATE:
            builder.append(" clientId:").append(clientId);
            break;
        case ACCEPT:
            builder.append(" accept:").append(accept);
            break;
        }
        builder.append(">");
        return builder.toString();
    }
}
