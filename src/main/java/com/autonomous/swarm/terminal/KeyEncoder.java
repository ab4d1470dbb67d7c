package com.autonomous.swarm.terminal;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps key names used by the decision oracle ({@code "enter"}, {@code "down"}, ...) to the
 * bytes a terminal UI expects. Anything that is not a known key name is sent literally.
 */
public final class KeyEncoder {

    private static final Map<String, String> NAMED_KEYS = Map.ofEntries(
        Map.entry("enter", "\r"),
        Map.entry("return", "\r"),
        Map.entry("tab", "\t"),
        Map.entry("space", " "),
        Map.entry("backspace", "\u007f"),
        Map.entry("escape", "\u001b"),
        Map.entry("esc", "\u001b"),
        Map.entry("up", "\u001b[A"),
        Map.entry("down", "\u001b[B"),
        Map.entry("right", "\u001b[C"),
        Map.entry("left", "\u001b[D"),
        Map.entry("ctrl+c", "\u0003"),
        Map.entry("ctrl+d", "\u0004")
    );

    private KeyEncoder() {
    }

    public static String encode(String key) {
        if (key == null) {
            return "";
        }
        String named = NAMED_KEYS.get(key.toLowerCase(Locale.ROOT));
        return named != null ? named : key;
    }

    public static String encodeAll(List<String> keys) {
        StringBuilder encoded = new StringBuilder();
        for (String key : keys) {
            encoded.append(encode(key));
        }
        return encoded.toString();
    }
}
