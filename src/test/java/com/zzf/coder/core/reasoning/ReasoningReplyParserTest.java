package com.zzf.coder.core.reasoning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.coder.core.plan.PlanStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReasoningReplyParserTest {

    private final ReasoningReplyParser parser = new ReasoningReplyParser(new ObjectMapper());

    @Test
    void shouldParseFinalAnswer() {
        ReasoningReply reply = parser.parse("{\"type\":\"final\",\"thought\":\"done\",\"finalAnswer\":\"All good\"}");

        assertTrue(reply.isFinal());
        assertEquals("All good", reply.getFinalAnswer());
        assertEquals("done", reply.getThought());
        assertTrue(reply.getCalls().isEmpty());
    }

    @Test
    void shouldParseFencedToolCalls() {
        String raw = "Sure:\n```json\n{\"type\":\"tool\",\"thought\":\"look\",\"toolCalls\":["
                + "{\"id\":\"c1\",\"tool\":\"ls\",\"args\":{\"path\":\"src\"}},"
                + "{\"tool\":\"grep\",\"args\":\"{\\\"pattern\\\":\\\"TODO\\\"}\"}]}\n```";

        ReasoningReply reply = parser.parse(raw);

        assertEquals(ReasoningReply.Type.TOOL_CALLS, reply.getType());
        assertEquals(2, reply.getCalls().size());
        assertEquals("c1", reply.getCalls().get(0).getId());
        assertEquals("src", reply.getCalls().get(0).getArgs().path("path").asText());
        assertNull(reply.getCalls().get(1).getId());
        assertEquals("TODO", reply.getCalls().get(1).getArgs().path("pattern").asText());
    }

    @Test
    void shouldAcceptSingleToolShorthand() {
        ReasoningReply reply = parser.parse("{\"type\":\"tool\",\"tool\":\"tree\",\"args\":{}}");

        assertEquals(1, reply.getCalls().size());
        assertEquals("tree", reply.getCalls().get(0).getTool());
    }

    @Test
    void shouldReadFinalReplyThatNamesToolAsToolReply() {
        ReasoningReply reply = parser.parse("{\"type\":\"final\",\"tool\":\"bash\",\"args\":{\"command\":\"ls\"}}");

        assertEquals(ReasoningReply.Type.TOOL_CALLS, reply.getType());
        assertEquals("bash", reply.getCalls().get(0).getTool());
    }

    @Test
    void shouldRejectMalformedReplies() {
        assertThrows(ReasoningParseException.class, () -> parser.parse(""));
        assertThrows(ReasoningParseException.class, () -> parser.parse("I will now list the files."));
        assertThrows(ReasoningParseException.class, () -> parser.parse("{\"type\":\"final\"}"));
        assertThrows(ReasoningParseException.class, () -> parser.parse("{\"type\":\"dance\"}"));
        assertThrows(ReasoningParseException.class, () -> parser.parse("{\"type\":\"tool\",\"thought\":\"hmm\"}"));
        assertThrows(ReasoningParseException.class, () -> parser.parse("{\"type\":\"tool\",\"toolCalls\":[{\"args\":{}}]}"));
        assertThrows(ReasoningParseException.class, () -> parser.parse("{\"type\":\"tool\",\"toolCalls\":[{\"tool\":\"ls\",\"args\":[1]}]}"));
    }

    @Test
    void shouldAcceptPlanOnlyToolReply() {
        ReasoningReply reply = parser.parse("{\"type\":\"tool\",\"thought\":\"plan first\",\"toolCalls\":[],"
                + "\"plan\":[{\"id\":\"a\",\"content\":\"explore\",\"status\":\"in_progress\"}]}");

        assertEquals(ReasoningReply.Type.TOOL_CALLS, reply.getType());
        assertTrue(reply.getCalls().isEmpty());
        assertEquals(1, reply.getPlan().size());
        assertEquals("explore", reply.getPlan().get(0).getDescription());
    }

    @Test
    void shouldReadPlanAndPlanUpdates() {
        ReasoningReply reply = parser.parse("{\"type\":\"tool\",\"toolCalls\":[{\"tool\":\"ls\",\"args\":{}}],"
                + "\"plan\":[{\"id\":\"todo_1\",\"content\":\"explore\",\"status\":\"in_progress\"}],"
                + "\"planUpdates\":[{\"id\":\"todo_1\",\"status\":\"done\"},{\"id\":\"todo_2\"},{\"id\":\"todo_3\",\"status\":\"nope\"}]}");

        assertEquals(1, reply.getPlan().size());
        assertEquals(PlanStatus.IN_PROGRESS, reply.getPlan().get(0).getStatus());
        assertEquals(1, reply.getPlanUpdates().size());
        assertEquals(PlanStatus.COMPLETED, reply.getPlanUpdates().get(0).getStatus());
        assertEquals(2, reply.getWarnings().size());
        assertTrue(reply.getWarnings().contains("plan update ignored: id and status are required"));
    }

    @Test
    void shouldDowngradeBadPlanToWarning() {
        ReasoningReply reply = parser.parse("{\"type\":\"final\",\"finalAnswer\":\"ok\",\"plan\":{\"not\":\"a list\"}}");

        assertTrue(reply.isFinal());
        assertNull(reply.getPlan());
        assertEquals("plan ignored: expected an array of items", reply.getWarnings().get(0));
    }

    @Test
    void shouldFormatCorrectionHint() {
        String hint = String.format(ReasoningReplyParser.CORRECTION_HINT, "type=final but finalAnswer is missing");

        assertTrue(hint.startsWith("Your output does not match the required JSON format. Error: type=final"));
    }
}
