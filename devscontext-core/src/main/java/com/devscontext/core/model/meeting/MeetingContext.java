package com.devscontext.core.model.meeting;

import lombok.Value;

import java.util.List;

@Value
public class MeetingContext {
    List<MeetingExcerpt> meetings;
}
