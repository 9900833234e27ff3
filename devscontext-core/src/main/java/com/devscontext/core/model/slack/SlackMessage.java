package com.devscontext.core.model.slack;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SlackMessage {
    String messageId;
    String channelId;
    String channelName;
    String userId;
    String userName;
    String text;
    Instant timestamp;
    String threadTs;
    String permalink;
}
