package com.copilot.gateway.proxy;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SseLineParserTest {

    @Test
    void shouldEmitDataOnBlankLine() {
        List<String> events = feed(
                "data: {\"a\":1}",
                "",
                "data:{\"b\":2}\r",
                "\r",
                "data: [DONE]",
                "");

        assertThat(events).containsExactly("{\"a\":1}", "{\"b\":2}", SseLineParser.DONE);
    }

    @Test
    void shouldJoinMultiLineDataAndIgnoreCommentsAndOtherFields() {
        List<String> events = feed(
                ": keep-alive",
                "event: chunk",
                "id: 7",
                "data: first",
                "data: second",
                "");

        assertThat(events).containsExactly("first\nsecond");
    }

    @Test
    void shouldFlushTrailingEventWithoutBlankLine() {
        SseLineParser parser = new SseLineParser();
        assertThat(parser.feed("data: tail")).isNull();

        assertThat(parser.flush()).isEqualTo("tail");
        assertThat(parser.flush()).isNull();
    }

    private static List<String> feed(String... lines) {
        SseLineParser parser = new SseLineParser();
        List<String> events = new ArrayList<>();
        for (String line : lines) {
            String data = parser.feed(line);
            if (data != null) {
                events.add(data);
            }
        }
        return events;
    }
}
