package me.golemcore.runner.domain.model.item;

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

import me.golemcore.runner.domain.model.Agent;
import me.golemcore.runner.domain.model.protocol.Message;

public class MessageOutputItem extends RunItem {

    public MessageOutputItem(Agent agent, Message rawItem) {
        super(agent, rawItem);
    }

    @Override
    public RunItemType getType() {
        return RunItemType.MESSAGE_OUTPUT;
    }

    @Override
    public Message getRawItem() {
        return (Message) super.getRawItem();
    }

    public String text() {
        String content = getRawItem().getContent();
        return content != null ? content : "";
    }
}
