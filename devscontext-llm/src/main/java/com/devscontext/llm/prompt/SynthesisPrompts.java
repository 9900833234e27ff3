package com.devscontext.llm.prompt;

public final class SynthesisPrompts {

    public static final String SYNTHESIS_PROMPT = """
        You are a senior engineer preparing context for a colleague about to start
        working on a task with an AI coding assistant.

        Your job: combine the raw data below into a concise, structured context block
        that gives the AI agent everything it needs to write correct, well-integrated code.

        Rules:
        - Target 2000-3000 tokens. Be concise but don't omit important details.
        - Use these sections (skip any section with no relevant data):
          ## Task: {task_id} - {title}
          ### Requirements
          ### Key Decisions
          ### Team Discussions
          ### Architecture Context
          ### Coding Standards
          ### Related Work
        - For each fact, note the source in [brackets] at the end of the paragraph.
        - If sources conflict, note the conflict explicitly.
        - Extract acceptance criteria clearly as a checklist if available.
        - For decisions from meetings, include WHO decided and WHEN.
        - Do NOT include generic advice. Only include specific, actionable context.

        Section guidance:
        - Requirements: ticket description and acceptance criteria as a checklist, plus constraints from comments.
        - Key Decisions: meeting decisions with who, when and why.
        - Team Discussions: Slack clarifications and action items, marked [Slack].
        - Architecture Context: exact file paths, data flow, tables, queues and endpoints. No general overview.
        - Coding Standards: the specific rules that apply to this task. No generic advice.
        - Related Work: linked tickets and their status.

        Raw data:
        {raw_data}
        """;

    public static final String REFINEMENT_PROMPT = """
        Below is a draft context block for task {task_id}, followed by the raw data it was built from.

        Tighten the draft:
        - Keep the section structure (## Task, ### Requirements, ### Key Decisions, ### Team Discussions,
          ### Architecture Context, ### Coding Standards, ### Related Work). Drop empty sections.
        - Every fact must end with a source citation in [brackets] that exists in the raw data.
          Remove facts you cannot attribute.
        - Merge duplicates and state conflicts between sources explicitly.
        - Do not add information that is not in the raw data.

        Return only the improved context block.

        Draft:
        ---
        {draft}
        ---

        Raw data:
        ---
        {raw_data}
        ---
        """;

    public static final String GAP_DETECTION_PROMPT = """
        Review this context for a ticket and identify what's MISSING that a developer might need.

        Check for these common gaps:
        1. Missing acceptance criteria (how to know when done?)
        2. Missing architecture documentation (where does this code go?)
        3. Missing coding standards (what patterns to follow?)
        4. No meeting discussions (was this design reviewed?)
        5. No related ADRs (should decisions be documented?)
        6. Unclear dependencies (what needs to be done first?)
        7. Missing test requirements (what needs to be tested?)

        Return a JSON array of strings, each describing a gap. If no gaps, return [].

        Example output:
        ["No acceptance criteria defined in ticket", "No architecture docs found"]

        Context to review:
        ---
        {context}
        ---

        Return ONLY a JSON array, no other text.
        """;

    private SynthesisPrompts() {}

    public static String buildSynthesisPrompt(String template, String taskId, String title, String rawData) {
        String effective = template != null && !template.isBlank() ? template : SYNTHESIS_PROMPT;
        return effective
            .replace("{task_id}", taskId)
            .replace("{title}", title != null && !title.isBlank() ? title : "Untitled")
            .replace("{raw_data}", rawData);
    }

    public static String buildRefinementPrompt(String taskId, String draft, String rawData) {
        return REFINEMENT_PROMPT
            .replace("{task_id}", taskId)
            .replace("{draft}", draft)
            .replace("{raw_data}", rawData);
    }

    public static String buildGapDetectionPrompt(String context) {
        return GAP_DETECTION_PROMPT.replace("{context}", context);
    }
}
