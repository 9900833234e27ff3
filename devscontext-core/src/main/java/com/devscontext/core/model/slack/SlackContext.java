package com.devscontext.core.model.slack;

import lombok.Value;

import java.util.List;

@Value
public class SlackContext {
    List<SlackThread> threads;
    List<SlackMessage> standaloneMessages;

    public boolean isEmpty() {
        return threads.isEmpty() && standaloneMessages.isEmpty();
    }
}
