package com.zzf.coder.core.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.core.plan.PlanItem;
import com.zzf.coder.core.plan.PlanStatus;
import com.zzf.coder.core.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the JSON action protocol:
 * <pre>
 * {"type":"final","thought":"...","finalAnswer":"..."}
 * {"type":"tool","thought":"...","toolCalls":[{"id":"c1","tool":"ls","args":{}}],
 *  "plan":[...],"planUpdates":[{"id":"todo_1","status":"completed"}]}
 * </pre>
 * A single {@code tool}/{@code args} pair is accepted in place of {@code toolCalls}, and a
 * {@code final} reply that names a tool is read as a tool reply.
 */
@Slf4j
public class ReasoningReplyParser {
    public static final String CORRECTION_HINT = "Your output does not match the required JSON format. Error: %s\n"
            + "Please re-output pure JSON (no markdown, no explanatory text, just one JSON object) with "
            + "\"type\" set to \"tool\" (with \"toolCalls\") or \"final\" (with \"finalAnswer\").";

    private final ObjectMapper mapper;

    public ReasoningReplyParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ReasoningReply parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ReasoningParseException("empty reply");
        }
        JsonNode node;
        try {
            node = mapper.readTree(JsonUtils.extractFirstJsonObject(raw));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new ReasoningParseException("reply is not a JSON object: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ReasoningParseException("reply is not a JSON object");
        }

        String type = node.path("type").asText("").trim().toLowerCase();
        if ("final".equals(type) && !node.path("tool").asText("").isBlank()) {
            log.warn("reasoning.correction reason=final_type_with_tool_intent tool={}", node.path("tool").asText());
            type = "tool";
        }
        String thought = node.path("thought").asText("");
        List<String> warnings = new ArrayList<>();
        ReasoningReply.ReasoningReplyBuilder reply = ReasoningReply.builder().thought(thought);
        readPlan(node, reply, warnings);

        switch (type) {
            case "final": {
                String answer = node.path("finalAnswer").asText("");
                if (answer.isBlank()) {
                    answer = node.path("answer").asText("");
                }
                if (answer.isBlank()) {
                    throw new ReasoningParseException("type=final but finalAnswer is missing");
                }
                return reply.type(ReasoningReply.Type.FINAL).finalAnswer(answer).warnings(warnings).build();
            }
            case "tool":
            case "tools":
            case "tool_calls":
                return reply.type(ReasoningReply.Type.TOOL_CALLS).calls(readCalls(node)).warnings(warnings).build();
            default:
                throw new ReasoningParseException("unknown reply type '" + node.path("type").asText("") + "'");
        }
    }

    private List<ReasoningReply.RequestedCall> readCalls(JsonNode node) {
        List<ReasoningReply.RequestedCall> calls = new ArrayList<>();
        JsonNode list = node.has("toolCalls") ? node.get("toolCalls") : node.get("tool_calls");
        if (list != null && !list.isNull()) {
            if (!list.isArray()) {
                throw new ReasoningParseException("toolCalls must be an array");
            }
            int index = 0;
            for (JsonNode call : list) {
                calls.add(readCall(call, "toolCalls[" + index++ + "]"));
            }
        } else if (node.hasNonNull("tool")) {
            calls.add(readCall(node, "reply"));
        } else {
            throw new ReasoningParseException("type=tool but neither toolCalls nor tool was given");
        }
        // an empty toolCalls array is a plan-only step
        return calls;
    }

    private ReasoningReply.RequestedCall readCall(JsonNode call, String where) {
        if (!call.isObject()) {
            throw new ReasoningParseException(where + " must be an object");
        }
        String tool = call.path("tool").asText("");
        if (tool.isBlank()) {
            tool = call.path("name").asText("");
        }
        if (tool.isBlank()) {
            throw new ReasoningParseException(where + " has no tool name");
        }
        JsonNode args = call.has("args") ? call.get("args") : call.get("arguments");
        if (args == null || args.isNull()) {
            args = mapper.createObjectNode();
        } else if (args.isTextual()) {
            // some models send the arguments as an encoded JSON string
            try {
                args = mapper.readTree(args.asText());
            } catch (JsonProcessingException e) {
                throw new ReasoningParseException(where + ".args is not valid JSON: " + e.getOriginalMessage(), e);
            }
        }
        if (!args.isObject()) {
            throw new ReasoningParseException(where + ".args must be a JSON object");
        }
        String id = call.path("id").asText("");
        return new ReasoningReply.RequestedCall(id.isBlank() ? null : id.trim(), tool.trim(), args);
    }

    private void readPlan(JsonNode node, ReasoningReply.ReasoningReplyBuilder reply, List<String> warnings) {
        JsonNode plan = node.get("plan");
        if (plan != null && plan.isArray()) {
            List<PlanItem> items = new ArrayList<>();
            boolean valid = true;
            for (JsonNode item : plan) {
                try {
                    items.add(PlanItem.fromJson(item));
                } catch (IllegalArgumentException e) {
                    warnings.add("plan ignored: " + e.getMessage());
                    valid = false;
                    break;
                }
            }
            if (valid) {
                reply.plan(items);
            }
        } else if (plan != null && !plan.isNull()) {
            warnings.add("plan ignored: expected an array of items");
        }

        JsonNode updates = node.get("planUpdates");
        if (updates != null && updates.isArray()) {
            List<ReasoningReply.PlanUpdate> parsed = new ArrayList<>();
            for (JsonNode update : updates) {
                String id = update.path("id").asText("");
                if (id.isBlank() || update.path("status").asText("").isBlank()) {
                    warnings.add("plan update ignored: id and status are required");
                    continue;
                }
                try {
                    parsed.add(new ReasoningReply.PlanUpdate(id, PlanStatus.from(update.path("status").asText(""))));
                } catch (IllegalArgumentException e) {
                    warnings.add("plan update for '" + id + "' ignored: " + e.getMessage());
                }
            }
            reply.planUpdates(parsed);
        }
    }
}
