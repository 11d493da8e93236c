package com.rebenew.stageParty.syncserver.core;

import com.rebenew.stageParty.syncserver.protocol.ServerEvent;

// Destino de los eventos que emite un Stage; la entrega no puede bloquear
@FunctionalInterface
public interface StageEventSink {

    void deliver(String memberId, ServerEvent event);
}
