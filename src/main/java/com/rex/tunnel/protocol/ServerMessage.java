package com.rex.tunnel.protocol;

import com.google.gson.annotations.SerializedName;

import java.util.UUID;

/**
 * Message sent from server to client
 *
 * 1. Handshake
 * S -> C {'type':'Challenge', 'challenge':'UUID'}
 * S -> C {'type':'FreePort', 'hello':5000}
 * S -> C {'type':'Hello', 'hello':9090}
 *
 * 2. Notification
 * S -> C {'type':'Heartbeat', 'heartbeat':true}
 * S -> C {'type':'Connection', 'connection':'UUID'}
 * S -> C {'type':'Error', 'error':'TEXT'}
 */
public class ServerMessage {

    public enum Type {
        @SerializedName("Challenge") CHALLENGE,
        @SerializedName("FreePort") FREE_PORT,
        @SerializedName("Hello") HELLO,
        @SerializedName("Heartbeat") HEARTBEAT,
        @SerializedName("Connection") CONNECTION,
        @SerializedName("Error") ERROR
    }

    public Type type;
    public UUID challenge;
    @SerializedName("hello")
    public Integer port; // Shared by Hello and FreePort
    public Boolean heartbeat;
    public UUID connection;
    public String error;

    public static ServerMessage challenge(UUID challenge) {
        ServerMessage msg = new ServerMessage();
        msg.type = Type.CHALLENGE;
        msg.challenge = challenge;
        return msg;
    }

    public static ServerMessage freePort(int port) {
        ServerMessage msg = new ServerMessage();
        msg.type = Type.FREE_PORT;
        msg.port = port;
        return msg;
    }

    public static ServerMessage hello(int port) {
        ServerMessage msg = new ServerMessage();
        msg.type = Type.HELLO;
        msg.port = port;
        return msg;
    }

    public static ServerMessage heartbeat() {
        ServerMessage msg = new ServerMessage();
        msg.type = Type.HEARTBEAT;
        msg.heartbeat = Boolean.TRUE;
        return msg;
    }

    public static ServerMessage connection(UUID id) {
        ServerMessage msg = new ServerMessage();
        msg.type = Type.CONNECTION;
        msg.connection = id;
        return msg;
    }

    public static ServerMessage error(String error) {
        ServerMessage msg = new ServerMessage();
        msg.type = Type.ERROR;
        msg.error = error;
        return msg;
    }

    @Override
    public String toString() {
        return "<ServerMessage type:" + type
                + " challenge:" + challenge
                + " port:" + port
                + " heartbeat:" + heartbeat
                + " connection:" + connection
                + " error:" + error
                + ">";
    }
}
