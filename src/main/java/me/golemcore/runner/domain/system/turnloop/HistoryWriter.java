package me.golemcore.runner.domain.system.turnloop;

import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.port.outbound.SessionPort;

import java.util.List;

/**
 * Bridge between the turn loop and a session store.
 */
public interface HistoryWriter {

    List<ProtocolItem> loadHistory(SessionPort session);

    void appendInput(SessionPort session, List<ProtocolItem> input);

    void appendTurnItems(SessionPort session, List<RunItem> items);
}
