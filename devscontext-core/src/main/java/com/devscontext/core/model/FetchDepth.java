package com.devscontext.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How much each adapter pulls. On-demand requests use {@link #STANDARD};
 * the preprocessing pipeline has time to spare and uses {@link #DEEP}.
 */
@Getter
@RequiredArgsConstructor
public enum FetchDepth {

    STANDARD(10, 3, 20, 10),
    DEEP(50, 10, 50, 30);

    private final int maxComments;
    private final int maxMeetings;
    private final int maxMessages;
    private final int maxDocSections;
}
