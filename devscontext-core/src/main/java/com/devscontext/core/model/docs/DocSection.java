package com.devscontext.core.model.docs;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class DocSection {
    /** Relative to the configured docs root it was found under. */
    String filePath;
    String sectionTitle;
    String content;
    DocType docType;
}
