package com.rebenew.stageParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Un miembro tal como lo ve un stage. Inmutable: el stage cambia la instancia.
 */
public record Member(
        String id,
        String displayName,
        ConnectionState connectionState,
        MemberRole role
) {
    public Member {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("member id must not be blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("member role is required");
        }
        if (connectionState == null) {
            connectionState = ConnectionState.CONNECTED;
        }
    }

    public static Member host(String id, String displayName) {
        return new Member(id, displayName, ConnectionState.CONNECTED, MemberRole.HOST);
    }

    public static Member audience(String id, String displayName) {
        return new Member(id, displayName, ConnectionState.CONNECTED, MemberRole.AUDIENCE);
    }

    public Member withDisplayName(String newName) {
        return new Member(id, newName, connectionState, role);
    }

    public Member withConnectionState(ConnectionState state) {
        return new Member(id, displayName, state, role);
    }

    @JsonIgnore
    public boolean isHost() {
        return role == MemberRole.HOST;
    }
}
