package com.autonomous.swarm.terminal;

import com.autonomous.swarm.model.AgentAdapterConfig;
import com.autonomous.swarm.model.PromptInfo;
import com.autonomous.swarm.model.PromptRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Regex-driven classifier built from an adapter config. Checks, in order: login prompts,
 * blocking prompts, an idle input prompt on the last line, readiness, external tool activity.
 */
public class PatternOutputClassifier implements OutputClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    private final List<Pattern> loginPatterns;
    private final List<CompiledRule> promptRules;
    private final List<Pattern> turnCompletePatterns;
    private final List<Pattern> readyPatterns;
    private final List<Pattern> toolRunningPatterns;

    public PatternOutputClassifier(AgentAdapterConfig config) {
        this.loginPatterns = compile(config.getLoginPatterns());
        this.turnCompletePatterns = compile(config.getTurnCompletePatterns());
        this.readyPatterns = compile(config.getReadyPatterns());
        this.toolRunningPatterns = compile(config.getToolRunningPatterns());
        this.promptRules = new ArrayList<>();
        for (PromptRule rule : config.getPromptRules()) {
            promptRules.add(new CompiledRule(Pattern.compile(rule.getPattern(), FLAGS), rule));
        }
    }

    @Override
    public Classification classify(String recentOutput) {
        if (recentOutput == null || recentOutput.isBlank()) {
            return Classification.none();
        }

        Optional<String> login = firstMatchingLine(loginPatterns, recentOutput);
        if (login.isPresent()) {
            return Classification.of(Classification.Kind.LOGIN_REQUIRED, login.get());
        }

        for (CompiledRule compiled : promptRules) {
            Matcher matcher = compiled.pattern.matcher(recentOutput);
            if (matcher.find()) {
                PromptRule rule = compiled.rule;
                PromptInfo info = PromptInfo.builder()
                    .type(rule.getType())
                    .prompt(lineAround(recentOutput, matcher.start()))
                    .instructions(rule.getDescription())
                    .canAutoRespond(rule.isAutoRespond())
                    .build();
                return Classification.blocked(info, rule);
            }
        }

        String lastLine = lastNonBlankLine(recentOutput);
        if (anyMatch(turnCompletePatterns, lastLine)) {
            return Classification.of(Classification.Kind.TURN_COMPLETE, lastLine);
        }

        Optional<String> ready = firstMatchingLine(readyPatterns, recentOutput);
        if (ready.isPresent()) {
            return Classification.of(Classification.Kind.READY, ready.get());
        }

        Optional<String> tool = firstMatchingLine(toolRunningPatterns, recentOutput);
        return tool.map(line -> Classification.of(Classification.Kind.TOOL_RUNNING, line))
            .orElseGet(Classification::none);
    }

    private static List<Pattern> compile(List<String> patterns) {
        if (patterns == null) {
            return List.of();
        }
        return patterns.stream()
            .map(pattern -> Pattern.compile(pattern, FLAGS))
            .collect(Collectors.toList());
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private static Optional<String> firstMatchingLine(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(lineAround(text, matcher.start()));
            }
        }
        return Optional.empty();
    }

    static String lineAround(String text, int index) {
        int start = text.lastIndexOf('\n', Math.max(index - 1, 0));
        int end = text.indexOf('\n', index);
        String line = text.substring(start < 0 ? 0 : start + 1, end < 0 ? text.length() : end);
        return line.strip();
    }

    static String lastNonBlankLine(String text) {
        String[] lines = text.split("\\r?\\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!lines[i].isBlank()) {
                return lines[i].strip();
            }
        }
        return "";
    }

    private static final class CompiledRule {
        private final Pattern pattern;
        private final PromptRule rule;

        private CompiledRule(Pattern pattern, PromptRule rule) {
            this.pattern = pattern;
            this.rule = rule;
        }
    }
}
