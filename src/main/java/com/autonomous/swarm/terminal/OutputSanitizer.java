package com.autonomous.swarm.terminal;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns raw terminal byte streams into text that can be classified or shown to an operator.
 * All methods are stateless.
 */
public final class OutputSanitizer {

    private static final Pattern SPLIT_SGR = Pattern.compile("(\\[[\\d;]*)\\r?\\n([\\d;]*m)");
    private static final Pattern CURSOR_MOVEMENT = Pattern.compile("\\x1B\\[\\d*[CDABGdEF]");
    private static final Pattern CURSOR_POSITION = Pattern.compile("\\x1B\\[\\d*(?:;\\d+)?[Hf]");
    private static final Pattern ERASE = Pattern.compile("\\x1B\\[\\d*[JK]");
    private static final Pattern OSC = Pattern.compile("\\x1B\\][^\\x07\\x1B]*(?:\\x07|\\x1B\\\\)");
    private static final Pattern ALL_ANSI = Pattern.compile("\\x1B(?:[@-Z\\\\-_]|\\[[0-?]*[ -/]*[@-~])");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    // left behind when a chunk boundary splits an SGR sequence
    private static final Pattern ORPHAN_SGR = Pattern.compile("\\[[\\d;]*m");
    private static final Pattern LONG_SPACES = Pattern.compile(" {3,}");

    private static final Pattern TUI_DECORATIVE = Pattern.compile(
        "[│╭╰╮╯─═╌║╔╗╚╝╠╣╦╩╬┌┐└┘├┤┬┴┼●○❮❯▶◀⠋⠙⠹⠸⠼⠴⠦⠧⠇⠏⣾⣽⣻⢿⡿⣟⣯⣷✽✻✶✳✢⏺←→↑↓⬆⬇◆▪▫■□▲△▼▽◈⟨⟩⌘⏎⏏⌫⌦⇧⇪⌥·⎿✔◼]");

    static final Pattern LOADING_LINE = Pattern.compile(
        "^\\s*(?:thinking|Forging|Shenaniganing|Inferring|Cooking|Brewing|Loading|Scheming|Pondering|Conjuring"
            + "|Manifesting|Reflecting|Synthesizing|Vibing|Summoning|Compiling|processing|Elucidating"
            + "|Cogitat\\w+|Bak\\w+)(?:…|\\.{3})?(?:\\s*\\(.*\\))?\\s*$",
        Pattern.CASE_INSENSITIVE);

    static final Pattern STATUS_LINE = Pattern.compile(
        "^\\s*(?:\\d+[smh]\\s+\\d+s?\\s*·|↓\\s*[\\d.]+k?\\s*tokens|·\\s*↓|esc\\s+to\\s+interrupt"
            + "|[Uu]pdate available|ate available|Run:\\s+brew|brew\\s+upgrade|\\d+\\s+files?\\s+\\+\\d+\\s+-\\d+"
            + "|ctrl\\+\\w|\\+\\d+\\s+lines|Wrote\\s+\\d+\\s+lines\\s+to|\\?\\s+for\\s+shortcuts"
            + "|Cooked for|Baked for|Cogitated for)",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern ALPHANUMERIC = Pattern.compile("[a-zA-Z0-9]");
    private static final Pattern MULTI_SPACE = Pattern.compile(" {2,}");
    private static final Pattern BLANK_RUN = Pattern.compile("\\n{3,}");

    private static final Pattern PR_URL = Pattern.compile("https?://github\\.com/[\\w.-]+/[\\w.-]+/pull/\\d+");
    private static final Pattern PR_CREATED = Pattern.compile(
        "(?:Created|Opened)\\s+pull\\s+request\\s+#\\d+[^\\n]*", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMIT = Pattern.compile(
        "(?:committed|commit)[ \\t]+[a-f0-9]{7,40}", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIFF_STAT = Pattern.compile(
        "\\d+\\s+files?\\s+changed.*?(?:insertion|deletion)[^\\n]*", Pattern.CASE_INSENSITIVE);

    private static final Pattern DEV_SERVER_URL = Pattern.compile(
        "https?://(?:localhost|127\\.0\\.0\\.1|0\\.0\\.0\\.0)(?::\\d+)?(?:/[^\\s]*)?");

    private OutputSanitizer() {
    }

    /**
     * Removes cursor, erase and OSC control sequences. Cursor movement becomes a single space
     * because TUIs move the cursor instead of padding with spaces.
     */
    public static String stripControlSequences(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String text = SPLIT_SGR.matcher(raw).replaceAll("$1$2");
        text = CURSOR_MOVEMENT.matcher(text).replaceAll(" ");
        text = CURSOR_POSITION.matcher(text).replaceAll(" ");
        text = ERASE.matcher(text).replaceAll("");
        text = OSC.matcher(text).replaceAll("");
        text = ALL_ANSI.matcher(text).replaceAll("");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = ORPHAN_SGR.matcher(text).replaceAll("");
        text = LONG_SPACES.matcher(text).replaceAll(" ");
        return text.strip();
    }

    /**
     * Strips control sequences, decorative glyphs, spinner/status lines and lines with no
     * alphanumeric content.
     */
    public static String cleanForDisplay(String raw) {
        String stripped = stripControlSequences(raw);
        if (stripped.isEmpty()) {
            return "";
        }
        String undecorated = TUI_DECORATIVE.matcher(stripped).replaceAll(" ").replace('\u00a0', ' ');

        String joined = undecorated.lines()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .filter(line -> !LOADING_LINE.matcher(line).find())
            .filter(line -> !STATUS_LINE.matcher(line).find())
            .filter(line -> ALPHANUMERIC.matcher(line).find())
            .map(line -> MULTI_SPACE.matcher(line).replaceAll(" ").strip())
            .filter(line -> !line.isEmpty())
            .collect(Collectors.joining("\n"));

        return BLANK_RUN.matcher(joined).replaceAll("\n\n").strip();
    }

    /**
     * Pulls PR links, commit hashes and diff stats out of a transcript so operators get the
     * result rather than the raw terminal.
     */
    public static String extractCompletionSummary(String raw) {
        String stripped = stripControlSequences(raw);
        Set<String> lines = new LinkedHashSet<>();

        List<String> prUrls = findAll(PR_URL, stripped);
        lines.addAll(prUrls);
        if (prUrls.isEmpty()) {
            lines.addAll(findAll(PR_CREATED, stripped));
        }
        lines.addAll(findAll(COMMIT, stripped));
        lines.addAll(findAll(DIFF_STAT, stripped));

        return String.join("\n", lines);
    }

    /**
     * Returns the cleaned output produced since the turn marker and consumes the marker.
     * Returns an empty string when there is no buffer or no marker for the session.
     */
    public static String captureSinceMarker(String sessionId,
                                            Map<String, List<String>> buffers,
                                            Map<String, Integer> markers) {
        List<String> buffer = buffers.get(sessionId);
        Integer marker = markers.get(sessionId);
        if (buffer == null || marker == null) {
            return "";
        }
        markers.remove(sessionId);

        List<String> responseLines;
        synchronized (buffer) {
            int from = Math.min(Math.max(marker, 0), buffer.size());
            responseLines = List.copyOf(buffer.subList(from, buffer.size()));
        }
        return cleanForDisplay(String.join("\n", responseLines));
    }

    /**
     * First local dev-server URL in the output, or {@code null}.
     */
    public static String extractDevServerUrl(String raw) {
        Matcher matcher = DEV_SERVER_URL.matcher(stripControlSequences(raw));
        return matcher.find() ? matcher.group() : null;
    }

    private static List<String> findAll(Pattern pattern, String text) {
        return pattern.matcher(text).results()
            .map(result -> result.group().strip())
            .filter(match -> !match.isEmpty())
            .distinct()
            .collect(Collectors.toList());
    }
}
