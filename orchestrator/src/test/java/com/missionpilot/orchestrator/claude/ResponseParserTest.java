package com.missionpilot.orchestrator.claude;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResponseParser is static and does no I/O: no Spring context, no mocks.
 */
class ResponseParserTest {

    // ------------------------------------------------------------------
    // extractJson
    // ------------------------------------------------------------------

    @Test
    void extractJson_fencedBlock_returnsBlockContent() {
        String reply = """
                Here is the plan.
                ```json
                {"tasks":[{"id":1,"description":"compile"}]}
                ```
                Let me know.
                """;
        assertThat(ResponseParser.extractJson(reply))
                .contains("{\"tasks\":[{\"id\":1,\"description\":\"compile\"}]}");
    }

    @Test
    void extractJson_unlabelledFence_returnsBlockContent() {
        String reply = """
                ```
                {"score": 7}
                ```
                """;
        assertThat(ResponseParser.extractJson(reply)).contains("{\"score\": 7}");
    }

    @Test
    void extractJson_fenceWinsOverEarlierBraces() {
        String reply = """
                I considered {a, b} first.
                ```json
                {"score": 3}
                ```
                """;
        assertThat(ResponseParser.extractJson(reply)).contains("{\"score\": 3}");
    }

    @Test
    void extractJson_bareObject_takesOutermostSpan() {
        String reply = "Sure: {\"action\":{\"tool\":\"read_file\",\"args\":{\"path\":\"a\"}}} done.";
        assertThat(ResponseParser.extractJson(reply))
                .contains("{\"action\":{\"tool\":\"read_file\",\"args\":{\"path\":\"a\"}}}");
    }

    @Test
    void extractJson_bareArray_whenArrayComesFirst() {
        String reply = "Candidates: [{\"thought\":\"x\"}, {\"thought\":\"y\"}]";
        assertThat(ResponseParser.extractJson(reply))
                .contains("[{\"thought\":\"x\"}, {\"thought\":\"y\"}]");
    }

    @Test
    void extractJson_noJson_returnsEmpty() {
        assertThat(ResponseParser.extractJson("I will now think about the problem.")).isEmpty();
    }

    @Test
    void extractJson_unclosedBrace_returnsEmpty() {
        assertThat(ResponseParser.extractJson("oops } then {")).isEmpty();
    }

    // ------------------------------------------------------------------
    // extractResult
    // ------------------------------------------------------------------

    @Test
    void extractResult_returnsStrippedTagContent() {
        String reply = """
                All checks passed.
                <result>
                  Deployed build 42
                </result>
                """;
        Optional<String> result = ResponseParser.extractResult(reply);
        assertThat(result).contains("Deployed build 42");
    }

    @Test
    void extractResult_multipleTags_returnsFirst() {
        String reply = "<result>first</result> and <result>second</result>";
        assertThat(ResponseParser.extractResult(reply)).contains("first");
    }

    @Test
    void extractResult_noTag_returnsEmpty() {
        assertThat(ResponseParser.extractResult("no answer yet")).isEmpty();
    }
}
