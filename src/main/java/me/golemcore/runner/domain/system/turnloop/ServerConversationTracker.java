package me.golemcore.runner.domain.system.turnloop;

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
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.item.RunItem;
import me.golemcore.runner.domain.model.item.RunItemType;
import me.golemcore.runner.domain.model.protocol.ProtocolItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Decides what to send when the provider keeps the conversation history itself
 * (by conversation id or previous response id): only items the server has not
 * seen yet.
 *
 * <p>
 * Items are tracked by identity, by server item id, by the call id of outputs
 * the server already has, and by a content fingerprint (JSON with sorted keys)
 * for states loaded from a snapshot, where identities are new.
 */
@Slf4j
public class ServerConversationTracker {

    private static final ObjectMapper FINGERPRINT_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    @Getter
    private final String conversationId;
    @Getter
    private String previousResponseId;
    private final boolean autoPreviousResponseId;

    private final Set<ProtocolItem> sentItems = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<ProtocolItem> serverItems = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<String> serverItemIds = new HashSet<>();
    private final Set<String> serverToolCallIds = new HashSet<>();
    private final Set<String> sentItemFingerprints = new HashSet<>();
    private boolean sentInitialInput;
    private List<ProtocolItem> remainingInitialInput;
    private boolean primedFromState;

    public ServerConversationTracker(String conversationId, String previousResponseId,
            boolean autoPreviousResponseId) {
        this.conversationId = conversationId;
        this.previousResponseId = previousResponseId;
        this.autoPreviousResponseId = autoPreviousResponseId;
    }

    /**
     * Primes the tracker from a resumed run: everything in the state has been
     * sent or was produced by the server. A second call is a no-op.
     */
    public void hydrateFromState(List<ProtocolItem> originalInput, List<RunItem> generatedItems,
            List<ModelResponse> modelResponses, List<ProtocolItem> sessionItems) {
        if (sentInitialInput) {
            return;
        }

        for (ProtocolItem item : originalInput) {
            if (item == null) {
                continue;
            }
            sentItems.add(item);
            if (item.itemId() != null) {
                serverItemIds.add(item.itemId());
            }
            addFingerprint(item, sentItemFingerprints);
        }
        sentInitialInput = true;
        remainingInitialInput = null;

        ModelResponse latest = null;
        for (ModelResponse response : modelResponses) {
            latest = response;
            for (ProtocolItem item : response.getOutput()) {
                if (item != null) {
                    rememberServerItem(item);
                }
            }
        }
        if (conversationId == null && latest != null && latest.getResponseId() != null) {
            previousResponseId = latest.getResponseId();
        }

        if (sessionItems != null) {
            for (ProtocolItem item : sessionItems) {
                rememberIds(item);
                addFingerprint(item, sentItemFingerprints);
            }
        }

        for (RunItem runItem : generatedItems) {
            ProtocolItem raw = runItem.getRawItem();
            if (raw == null || (raw.itemId() == null && !(raw.callId() != null && raw.carriesOutput()))) {
                continue;
            }
            sentItems.add(raw);
            addFingerprint(raw, sentItemFingerprints);
            rememberIds(raw);
        }
        primedFromState = true;
        log.debug("[Conversation] Primed from state: {} server ids, {} closed calls", serverItemIds.size(),
                serverToolCallIds.size());
    }

    /**
     * Records the items of a model response as known to the server.
     */
    public void trackServerItems(ModelResponse response) {
        if (response == null) {
            return;
        }

        Set<String> serverFingerprints = new HashSet<>();
        for (ProtocolItem item : response.getOutput()) {
            if (item == null) {
                continue;
            }
            rememberServerItem(item);
            addFingerprint(item, serverFingerprints);
        }
        sentItemFingerprints.addAll(serverFingerprints);

        if (remainingInitialInput != null && !serverFingerprints.isEmpty()) {
            List<ProtocolItem> remaining = new ArrayList<>();
            for (ProtocolItem pending : remainingInitialInput) {
                if (!serverFingerprints.contains(fingerprint(pending))) {
                    remaining.add(pending);
                }
            }
            remainingInitialInput = remaining.isEmpty() ? null : remaining;
        }

        if (conversationId == null && (previousResponseId != null || autoPreviousResponseId)
                && response.getResponseId() != null) {
            previousResponseId = response.getResponseId();
        }
    }

    /**
     * Marks items as delivered to the server.
     */
    public void markInputAsSent(List<ProtocolItem> items) {
        if (items == null || items.isEmpty()) {
            return;
        }

        Set<ProtocolItem> delivered = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<String> deliveredFingerprints = new HashSet<>();
        for (ProtocolItem item : items) {
            if (item == null) {
                continue;
            }
            delivered.add(item);
            sentItems.add(item);
            addFingerprint(item, deliveredFingerprints);
        }

        if (remainingInitialInput == null) {
            return;
        }
        List<ProtocolItem> remaining = new ArrayList<>();
        for (ProtocolItem pending : remainingInitialInput) {
            if (delivered.contains(pending) || deliveredFingerprints.contains(fingerprint(pending))) {
                continue;
            }
            remaining.add(pending);
        }
        remainingInitialInput = remaining.isEmpty() ? null : remaining;
    }

    /**
     * Puts items back in front of the queue so that the next call resends them,
     * e.g. after the conversation was reported locked.
     */
    public void rewindInput(List<ProtocolItem> items) {
        if (items == null || items.isEmpty()) {
            return;
        }

        List<ProtocolItem> rewind = new ArrayList<>();
        for (ProtocolItem item : items) {
            if (item == null) {
                continue;
            }
            rewind.add(item);
            sentItems.remove(item);
            String fingerprint = fingerprint(item);
            if (fingerprint != null) {
                sentItemFingerprints.remove(fingerprint);
            }
        }
        if (rewind.isEmpty()) {
            return;
        }

        log.debug("[Conversation] Queued {} items to resend after conversation retry", rewind.size());
        if (remainingInitialInput != null) {
            rewind.addAll(remainingInitialInput);
        }
        remainingInitialInput = rewind;
    }

    /**
     * Queues input the caller adds to a run that has already started, so the
     * next call delivers it after any input still waiting.
     */
    public void addPendingInput(List<ProtocolItem> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        List<ProtocolItem> pending = remainingInitialInput != null
                ? new ArrayList<>(remainingInitialInput)
                : new ArrayList<>();
        for (ProtocolItem item : items) {
            if (item != null) {
                pending.add(item);
            }
        }
        remainingInitialInput = pending.isEmpty() ? null : pending;
    }

    /**
     * Input for the next call: the not-yet-delivered initial input followed by
     * generated items the server has not seen.
     */
    public List<ProtocolItem> prepareInput(List<ProtocolItem> originalInput, List<RunItem> generatedItems) {
        List<ProtocolItem> input = new ArrayList<>();

        if (!sentInitialInput) {
            List<ProtocolItem> initial = new ArrayList<>();
            for (ProtocolItem item : originalInput) {
                if (item != null) {
                    initial.add(item);
                }
            }
            input.addAll(initial);
            remainingInitialInput = initial.isEmpty() ? null : initial;
            sentInitialInput = true;
        } else if (remainingInitialInput != null) {
            input.addAll(remainingInitialInput);
        }

        for (RunItem runItem : generatedItems) {
            if (runItem.getType() == RunItemType.TOOL_APPROVAL) {
                continue;
            }
            ProtocolItem raw = runItem.getRawItem();
            if (raw == null) {
                continue;
            }
            if (raw.itemId() != null && serverItemIds.contains(raw.itemId())) {
                continue;
            }
            if (raw.callId() != null && raw.carriesOutput() && serverToolCallIds.contains(raw.callId())) {
                continue;
            }
            if (sentItems.contains(raw) || serverItems.contains(raw)) {
                continue;
            }
            ProtocolItem inputItem = runItem.toInputItem();
            if (inputItem == null) {
                continue;
            }
            if (primedFromState && sentItemFingerprints.contains(fingerprint(inputItem))) {
                continue;
            }
            input.add(inputItem);
            sentItems.add(raw);
        }
        return input;
    }

    public List<ProtocolItem> getRemainingInitialInput() {
        return remainingInitialInput;
    }

    private void rememberServerItem(ProtocolItem item) {
        serverItems.add(item);
        rememberIds(item);
    }

    private void rememberIds(ProtocolItem item) {
        if (item.itemId() != null) {
            serverItemIds.add(item.itemId());
        }
        if (item.callId() != null && item.carriesOutput()) {
            serverToolCallIds.add(item.callId());
        }
    }

    private static void addFingerprint(ProtocolItem item, Set<String> target) {
        String fingerprint = fingerprint(item);
        if (fingerprint != null) {
            target.add(fingerprint);
        }
    }

    static String fingerprint(ProtocolItem item) {
        try {
            return FINGERPRINT_MAPPER.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            log.debug("[Conversation] Cannot fingerprint {}: {}", item.getType(), e.getMessage());
            return null;
        }
    }
}
