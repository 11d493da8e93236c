package com.rebenew.stageParty.syncserver.core;

import com.rebenew.stageParty.syncserver.protocol.ServerEvent;

/**
 * Canal de salida de una conexión. {@link #send} nunca bloquea al llamante;
 * los eventos para una conexión cerrada se descartan.
 */
public interface Outbox {

    void send(ServerEvent event);

    boolean isOpen();

    void close();
}
