package me.golemcore.runner.domain.system.turnloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.port.outbound.SessionPort;

import java.util.List;
import java.util.Objects;

/**
 * Persists run input and turn items into a {@link SessionPort}. Approval
 * placeholders are never persisted.
 */
@Slf4j
public class SessionHistoryWriter implements HistoryWriter {

    private final int historyLimit;

    public SessionHistoryWriter(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    @Override
    public List<ProtocolItem> loadHistory(SessionPort session) {
        if (session == null) {
            return List.of();
        }
        List<ProtocolItem> history = session.getItems(historyLimit);
        log.debug("[Session] Loaded {} items from session {}", history.size(), session.getSessionId());
        return history;
    }

    @Override
    public void appendInput(SessionPort session, List<ProtocolItem> input) {
        if (session == null || input.isEmpty()) {
            return;
        }
        session.addItems(input);
    }

    @Override
    public void appendTurnItems(SessionPort session, List<RunItem> items) {
        if (session == null) {
            return;
        }
        List<ProtocolItem> persistable = items.stream()
                .map(RunItem::toInputItem)
                .filter(Objects::nonNull)
                .toList();
        if (persistable.isEmpty()) {
            return;
        }
        session.addItems(persistable);
        log.debug("[Session] Saved {} items to session {}", persistable.size(), session.getSessionId());
    }
}
