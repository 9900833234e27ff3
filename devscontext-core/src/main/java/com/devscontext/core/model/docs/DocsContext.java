package com.devscontext.core.model.docs;

import lombok.Value;

import java.util.List;

@Value
public class DocsContext {

    List<DocSection> sections;

    /** True when at least one section matched the task rather than being an always-included standard. */
    public boolean hasMatches() {
        return sections.stream().anyMatch(s -> s.getDocType() != DocType.STANDARDS);
    }
}
