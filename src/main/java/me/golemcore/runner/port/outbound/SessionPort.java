package me.golemcore.runner.port.outbound;

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

import me.golemcore.runner.domain.model.protocol.ProtocolItem;

import java.util.List;
import java.util.Optional;

/**
 * Port for conversation history storage. The runner reads history to seed a
 * run's input and appends each turn's new items. Backends may be shared by
 * several runs; the runner never assumes exclusive access.
 */
public interface SessionPort {

    String getSessionId();

    /**
     * Returns stored items in chronological order.
     *
     * @param limit
     *            if positive, only the latest {@code limit} items
     */
    List<ProtocolItem> getItems(int limit);

    void addItems(List<ProtocolItem> items);

    /**
     * Removes and returns the most recent item.
     */
    Optional<ProtocolItem> popItem();

    void clearSession();
}
