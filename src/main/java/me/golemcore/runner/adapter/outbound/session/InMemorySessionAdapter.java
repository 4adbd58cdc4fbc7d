package me.golemcore.runner.adapter.outbound.session;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.exception.AgentRunException;
import me.golemcore.runner.domain.exception.RunPhase;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;
import me.golemcore.runner.port.outbound.SessionPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory implementation of SessionPort.
 *
 * <p>
 * Items are kept as JSON documents, so what a caller reads back is detached
 * from the instances a run keeps mutating. Safe for use by several runs.
 *
 * @see me.golemcore.runner.port.outbound.SessionPort
 */
@Slf4j
public class InMemorySessionAdapter implements SessionPort {

    private final String sessionId;
    private final ObjectMapper objectMapper;
    private final List<String> items = new ArrayList<>();

    public InMemorySessionAdapter(ObjectMapper objectMapper) {
        this(UUID.randomUUID().toString(), objectMapper);
    }

    public InMemorySessionAdapter(String sessionId, ObjectMapper objectMapper) {
        this.sessionId = sessionId;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    @Override
    public synchronized List<ProtocolItem> getItems(int limit) {
        int from = limit > 0 ? Math.max(0, items.size() - limit) : 0;
        List<ProtocolItem> result = new ArrayList<>(items.size() - from);
        for (String json : items.subList(from, items.size())) {
            result.add(read(json));
        }
        return result;
    }

    @Override
    public synchronized void addItems(List<ProtocolItem> newItems) {
        for (ProtocolItem item : newItems) {
            try {
                items.add(objectMapper.writeValueAsString(item));
            } catch (JsonProcessingException e) {
                throw new AgentRunException(RunPhase.EXECUTE, "Failed to store " + item.getType()
                        + " item in session " + sessionId, e);
            }
        }
        log.debug("[Session] Session {} now holds {} items", sessionId, items.size());
    }

    @Override
    public synchronized Optional<ProtocolItem> popItem() {
        if (items.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(read(items.remove(items.size() - 1)));
    }

    @Override
    public synchronized void clearSession() {
        items.clear();
        log.debug("[Session] Cleared session {}", sessionId);
    }

    private ProtocolItem read(String json) {
        try {
            return objectMapper.readValue(json, ProtocolItem.class);
        } catch (JsonProcessingException e) {
            throw new AgentRunException(RunPhase.EXECUTE, "Corrupted item in session " + sessionId, e);
        }
    }
}
