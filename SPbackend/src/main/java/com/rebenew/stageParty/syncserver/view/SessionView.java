package com.rebenew.stageParty.syncserver.view;

import com.rebenew.stageParty.syncserver.core.MemberSession;
import com.rebenew.stageParty.syncserver.protocol.ClientCommand;

/**
 * Lo que puede hacer un miembro según dónde está. Una implementación por rol: el rol
 * se comprueba una vez, al elegir la vista, y no dentro de cada comando.
 */
public interface SessionView extends ClientCommand.Handler<MemberSession> {
}
