package com.devscontext.core.adapter.jira;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Flattens Atlassian Document Format (Jira REST v3 rich text) to plain text.
 */
final class AdfText {

    private AdfText() {}

    static String toText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        StringBuilder out = new StringBuilder();
        append(node, out);
        return out.toString().strip();
    }

    private static void append(JsonNode node, StringBuilder out) {
        String type = node.path("type").asText("");
        if ("text".equals(type)) {
            out.append(node.path("text").asText(""));
            return;
        }
        if ("hardBreak".equals(type)) {
            out.append('\n');
            return;
        }
        if ("heading".equals(type)) {
            out.append("#".repeat(Math.max(1, node.path("attrs").path("level").asInt(2)))).append(' ');
        } else if ("listItem".equals(type)) {
            out.append("- ");
        }
        for (JsonNode child : node.path("content")) {
            append(child, out);
        }
        if ("paragraph".equals(type) || "heading".equals(type)) {
            out.append('\n');
        }
    }
}
