package com.rebenew.stageParty.syncserver.core;

import com.rebenew.stageParty.syncserver.protocol.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Todos los miembros conocidos, conectados o dentro de su ventana de reconexión. También
 * es el sink por el que los stages entregan sus eventos.
 */
@Component
public class MemberRegistry implements StageEventSink {

    private static final Logger logger = LoggerFactory.getLogger(MemberRegistry.class);

    private final Map<String, MemberSession> members = new ConcurrentHashMap<>();

    public MemberSession register(Outbox outbox) {
        String memberId = StageIds.next();
        MemberSession member = new MemberSession(memberId, outbox);
        members.put(memberId, member);
        logger.info("🔗 Member registered: {}", memberId);
        return member;
    }

    /**
     * Asocia un miembro conocido a una conexión nueva. Si la anterior sigue abierta, se cierra.
     */
    public Optional<MemberSession> resume(String memberId, Outbox outbox) {
        MemberSession member = members.get(memberId);
        if (member == null) {
            return Optional.empty();
        }
        member.attach(outbox);
        return Optional.of(member);
    }

    public Optional<MemberSession> find(String memberId) {
        if (memberId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(members.get(memberId));
    }

    public void remove(String memberId) {
        members.remove(memberId);
    }

    public Collection<MemberSession> all() {
        return List.copyOf(members.values());
    }

    public long connectedCount() {
        return members.values().stream().filter(MemberSession::isConnected).count();
    }

    public int size() {
        return members.size();
    }

    @Override
    public void deliver(String memberId, ServerEvent event) {
        MemberSession member = members.get(memberId);
        if (member != null) {
            member.send(event);
        }
    }

    public void broadcastAll(ServerEvent event) {
        for (MemberSession member : members.values()) {
            member.send(event);
        }
    }
}
