package com.autonomous.swarm.terminal;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputSanitizerTest {

    @Test
    void shouldStripColorAndEraseSequences() {
        String raw = "\u001b[2K\u001b[31mred\u001b[0m text";

        assertEquals("red text", OutputSanitizer.stripControlSequences(raw));
    }

    @Test
    void shouldReplaceCursorForwardWithSpace() {
        assertEquals("hello world", OutputSanitizer.stripControlSequences("hello\u001b[1Cworld"));
    }

    @Test
    void shouldRemoveOscTitleSequences() {
        assertEquals("prompt", OutputSanitizer.stripControlSequences("\u001b]0;my title\u0007prompt"));
    }

    @Test
    void shouldCollapseLongSpaceRuns() {
        assertEquals("a b", OutputSanitizer.stripControlSequences("a      b"));
    }

    @Test
    void shouldRepairSgrSplitAcrossChunks() {
        assertEquals("text", OutputSanitizer.stripControlSequences("\u001b[1;3\n2mtext"));
        assertEquals("done", OutputSanitizer.stripControlSequences("[0mdone"));
    }

    @Test
    void shouldReturnEmptyForNullInput() {
        assertEquals("", OutputSanitizer.stripControlSequences(null));
        assertEquals("", OutputSanitizer.cleanForDisplay(null));
    }

    @Test
    void shouldDropDecorationAndStatusLines() {
        String raw = "╭──────╮\n"
            + "│ Hello world │\n"
            + "✻ Thinking…\n"
            + "? for shortcuts\n"
            + "esc to interrupt\n"
            + "ctrl+r to expand\n"
            + "-----\n"
            + "Done 42";

        assertEquals("Hello world\nDone 42", OutputSanitizer.cleanForDisplay(raw));
    }

    @Test
    void shouldKeepEveryOrdinaryLineWithAlphanumerics() {
        String raw = "Edited src/App.java\n\n\n\n\nAdded 3 tests\n...\nAll tests pass";

        String cleaned = OutputSanitizer.cleanForDisplay(raw);

        assertEquals("Edited src/App.java\nAdded 3 tests\nAll tests pass", cleaned);
    }

    @Test
    void shouldSummarizePullRequestsCommitsAndDiffStats() {
        String raw = "Pushing...\n"
            + "https://github.com/acme/app/pull/42\n"
            + "Created pull request #42\n"
            + "[main abc1234] commit abc1234def\n"
            + " 3 files changed, 10 insertions(+), 2 deletions(-)\n";

        String summary = OutputSanitizer.extractCompletionSummary(raw);

        assertEquals("https://github.com/acme/app/pull/42\n"
            + "commit abc1234def\n"
            + "3 files changed, 10 insertions(+), 2 deletions(-)", summary);
    }

    @Test
    void shouldFallBackToCreatedPullRequestPhrase() {
        String summary = OutputSanitizer.extractCompletionSummary("Created pull request #7 for the fix");

        assertEquals("Created pull request #7 for the fix", summary);
    }

    @Test
    void shouldBeIdempotentWhenSummarizingTwice() {
        String raw = "https://github.com/acme/app/pull/42\n"
            + "https://github.com/acme/app/pull/42\n"
            + "committed 9f8e7d6c\n"
            + "1 file changed, 1 insertion(+)\n";

        String once = OutputSanitizer.extractCompletionSummary(raw);
        String twice = OutputSanitizer.extractCompletionSummary(once);

        assertEquals(once, twice);
        assertEquals(3, once.lines().count());
    }

    @Test
    void shouldReturnEmptySummaryWhenNothingFound() {
        assertEquals("", OutputSanitizer.extractCompletionSummary("just chatting"));
    }

    @Test
    void shouldCaptureOutputSinceMarkerOnlyOnce() {
        Map<String, List<String>> buffers = new HashMap<>();
        buffers.put("s1", new ArrayList<>(List.of("old", "\u001b[32mnew output\u001b[0m", "more")));
        Map<String, Integer> markers = new HashMap<>();
        markers.put("s1", 1);

        assertEquals("new output\nmore", OutputSanitizer.captureSinceMarker("s1", buffers, markers));
        assertFalse(markers.containsKey("s1"));
        assertEquals("", OutputSanitizer.captureSinceMarker("s1", buffers, markers));
    }

    @Test
    void shouldReturnEmptyCaptureForUnknownSession() {
        assertEquals("", OutputSanitizer.captureSinceMarker("missing", new HashMap<>(), new HashMap<>()));
    }

    @Test
    void shouldFindLocalDevServerUrl() {
        assertEquals("http://localhost:5173/",
            OutputSanitizer.extractDevServerUrl("  VITE ready at \u001b[36mhttp://localhost:5173/\u001b[0m"));
        assertEquals("http://127.0.0.1:8080",
            OutputSanitizer.extractDevServerUrl("listening on http://127.0.0.1:8080"));
        assertNull(OutputSanitizer.extractDevServerUrl("see https://example.com"));
    }
}
