package com.zzf.miniagent.directive;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectiveParserTest {

    private final DirectiveParser parser = new DirectiveParser(new ObjectMapper());

    @Test
    void parsesToolCall() {
        Directive directive = parser.parse("Let me look.\n<tool_code>{\"name\":\"bash\",\"args\":{\"command\":\"ls\"}}</tool_code>");

        assertEquals(Directive.Type.TOOL_CALL, directive.getType());
        assertEquals("bash", directive.getToolCall().getName());
        assertEquals("ls", directive.getToolCall().getArgs().get("command").asText());
        assertFalse(directive.hasParallelTasks());
    }

    @Test
    void toolCallSpansLinesAndIgnoresSurroundingWhitespace() {
        Directive directive = parser.parse("<tool_code>\n{\n  \"name\": \"bash\",\n  \"args\": {\"command\": \"pwd\"}\n}\n</tool_code>");
        assertEquals(Directive.Type.TOOL_CALL, directive.getType());
        assertEquals("pwd", directive.getToolCall().getArgs().path("command").asText());
    }

    @Test
    void malformedToolCallFallsBackToNone() {
        assertSame(Directive.none(), parser.parse("<tool_code>{\"name\": \"bash\", args}</tool_code>"));
        assertSame(Directive.none(), parser.parse("<tool_code>{\"args\": {}}</tool_code>"));
        assertSame(Directive.none(), parser.parse("<tool_code>{\"name\": 3, \"args\": {}}</tool_code>"));
        assertSame(Directive.none(), parser.parse("<tool_code>{\"name\": \"bash\"}</tool_code>"));
        assertSame(Directive.none(), parser.parse("<tool_code>[1,2]</tool_code>"));
    }

    @Test
    void malformedToolCallStillHonoursFinal() {
        Directive directive = parser.parse("<tool_code>not json</tool_code><final>done anyway</final>");
        assertEquals(Directive.Type.FINAL_ANSWER, directive.getType());
        assertEquals("done anyway", directive.getFinalText());
    }

    @Test
    void toolCallWinsOverFinal() {
        Directive directive = parser.parse("<final>x</final><tool_code>{\"name\":\"a\",\"args\":null}</tool_code>");
        assertEquals(Directive.Type.TOOL_CALL, directive.getType());
        assertEquals("a", directive.getToolCall().getName());
    }

    @Test
    void finalAnswerIsTrimmed() {
        Directive directive = parser.parse("thinking...\n<final>\n  done  \n</final>");
        assertEquals(Directive.Type.FINAL_ANSWER, directive.getType());
        assertEquals("done", directive.getFinalText());
        assertNull(directive.getToolCall());
    }

    @Test
    void emptyFinalIsNone() {
        assertSame(Directive.none(), parser.parse("<final></final>"));
        assertSame(Directive.none(), parser.parse("<final>   </final>"));
        assertSame(Directive.none(), parser.parse("<final>\n\n</final>"));
    }

    @Test
    void tagsAreCaseSensitive() {
        assertSame(Directive.none(), parser.parse("<FINAL>done</FINAL>"));
        assertSame(Directive.none(), parser.parse("<Tool_Code>{\"name\":\"a\",\"args\":{}}</Tool_Code>"));
    }

    @Test
    void plainTextIsNone() {
        assertSame(Directive.none(), parser.parse("just chatting"));
        assertSame(Directive.none(), parser.parse(""));
        assertSame(Directive.none(), parser.parse(null));
        assertSame(Directive.none(), parser.parse("<final>unterminated"));
    }

    @Test
    void parallelBatchRidesOnToolCall() {
        String text = "<tool_code>{\"name\":\"bash\",\"args\":{\"command\":\"ls\"}}</tool_code>\n"
                + "<parallel>{\"task\":\"A\",\"type\":\"code\"}{\"task\":\"B\",\"type\":\"test\",\"max_loops\":5}</parallel>";

        Directive directive = parser.parse(text);

        assertEquals(Directive.Type.TOOL_CALL, directive.getType());
        List<SubTaskSpec> tasks = directive.getParallelTasks();
        assertEquals(2, tasks.size());
        assertEquals(SubTaskSpec.builder().task("A").agentKind("code").maxIterations(20).build(), tasks.get(0));
        assertEquals(SubTaskSpec.builder().task("B").agentKind("test").maxIterations(5).build(), tasks.get(1));
    }

    @Test
    void parallelWithoutValidToolCallIsIgnored() {
        assertSame(Directive.none(), parser.parse("<parallel>{\"task\":\"A\"}</parallel>"));
    }

    @Test
    void parallelDefaultsAndSkipsTasklessObjects() {
        List<SubTaskSpec> tasks = parser.parseParallel(
                "<parallel>\n{\"task\":\"only task\"}\n{\"type\":\"code\"}\n{broken}\n{\"task\":\"neg\",\"max_loops\":-1}</parallel>");

        assertEquals(2, tasks.size());
        assertEquals("only task", tasks.get(0).getTask());
        assertEquals("dynamic", tasks.get(0).getAgentKind());
        assertEquals(20, tasks.get(0).getMaxIterations());
        assertEquals(20, tasks.get(1).getMaxIterations());
    }

    @Test
    void parallelHandlesNestedObjectsAndBracesInStrings() {
        List<SubTaskSpec> tasks = parser.parseParallel("<parallel>"
                + "{\"task\":\"write {braces} here\",\"type\":\"doc\",\"meta\":{\"owner\":{\"name\":\"x\"}}}"
                + "{\"task\":\"quote \\\" and }\",\"max_loops\":3}"
                + "</parallel>");

        assertEquals(2, tasks.size());
        assertEquals("write {braces} here", tasks.get(0).getTask());
        assertEquals("doc", tasks.get(0).getAgentKind());
        assertEquals("quote \" and }", tasks.get(1).getTask());
        assertEquals(3, tasks.get(1).getMaxIterations());
    }

    @Test
    void emptyParallelYieldsNoBatch() {
        Directive directive = parser.parse("<tool_code>{\"name\":\"bash\",\"args\":{}}</tool_code><parallel> </parallel>");
        assertEquals(Directive.Type.TOOL_CALL, directive.getType());
        assertTrue(directive.getParallelTasks().isEmpty());
    }
}
