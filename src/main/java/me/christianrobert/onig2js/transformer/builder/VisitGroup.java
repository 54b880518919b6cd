package me.christianrobert.onig2js.transformer.builder;

import me.christianrobert.onig2js.transformer.builder.group.AbsenceGroupEmulator;
import me.christianrobert.onig2js.transformer.builder.group.AtomicGroupEmulator;
import me.christianrobert.onig2js.transformer.context.ConversionContext;
import me.christianrobert.onig2js.transformer.context.WarningCategory;
import me.christianrobert.onig2js.transformer.node.GroupNode;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts parenthesized constructs.
 *
 * <h3>Mapping:</h3>
 * <pre>
 * (x)           → (x)                 capture index registered before the content
 * (?&lt;name&gt;x)     → (x)                 name dropped, numbering kept
 * (?:x)         → (?:x)
 * (?#...)       → (nothing)
 * (?i-m:x)      → (?:x)               options emulated elsewhere or dropped
 * (?i-m)        → (nothing)
 * (?=x) (?!x)   → unchanged
 * (?&lt;=x)        → (?:x)               with warning
 * (?&lt;!x)        → (nothing)           with warning
 * (?&gt;x)         → (?=(x))\N(?:)       see AtomicGroupEmulator
 * (?~x)         → see AbsenceGroupEmulator
 * unknown       → (?:)                with warning
 * </pre>
 */
public class VisitGroup {

    /** Options the parser folds into the tree (i via annotations, m and x via root flags/whitespace). */
    private static final String IN_PATTERN_OPTIONS = "imx";

    public static String v(GroupNode node, JsRegexBuilder b) {
        ConversionContext context = b.getContext();

        switch (node.getType()) {
            case CAPTURE, NAMED -> {
                // register before converting content, nested groups come after this one
                context.registerCapture(node.getCaptureIndex(), node.getName());
                return "(" + b.visitSequence(node.getChildren()) + ")";
            }
            case PASSIVE -> {
                return "(?:" + b.visitSequence(node.getChildren()) + ")";
            }
            case ATOMIC -> {
                return AtomicGroupEmulator.emulate(node, b);
            }
            case ABSENCE -> {
                return AbsenceGroupEmulator.emulate(node, b);
            }
            case COMMENT -> {
                return "";
            }
            case OPTIONS -> {
                warnOfEncodingOptions(node, context);
                return "(?:" + b.visitSequence(node.getChildren()) + ")";
            }
            case OPTIONS_SWITCH -> {
                warnOfEncodingOptions(node, context);
                return "";
            }
            case LOOKAHEAD -> {
                return "(?=" + b.visitSequence(node.getChildren()) + ")";
            }
            case NEGATIVE_LOOKAHEAD -> {
                return "(?!" + b.visitSequence(node.getChildren()) + ")";
            }
            case LOOKBEHIND -> {
                context.warn(WarningCategory.LOOKBEHIND,
                        "Converted unsupported lookbehind '" + node.getText() + "' into a passive group");
                return "(?:" + b.visitSequence(node.getChildren()) + ")";
            }
            case NEGATIVE_LOOKBEHIND -> {
                context.warnOfUnsupported(WarningCategory.LOOKBEHIND,
                        "negative lookbehind '" + node.getText() + "'");
                return "";
            }
            default -> {
                context.warn(WarningCategory.UNKNOWN_GROUP,
                        "Replaced group of unknown kind '" + node.getText() + "' with an empty group");
                return "(?:)";
            }
        }
    }

    private static void warnOfEncodingOptions(GroupNode node, ConversionContext context) {
        Set<Character> dropped = new LinkedHashSet<>();
        for (char option : (node.getEnabledOptions() + node.getDisabledOptions()).toCharArray()) {
            if (IN_PATTERN_OPTIONS.indexOf(option) < 0) {
                dropped.add(option);
            }
        }
        if (!dropped.isEmpty()) {
            String letters = dropped.stream()
                    .map(option -> "\"" + option + "\"")
                    .collect(Collectors.joining(", ", "[", "]"));
            context.warnOfUnsupported(WarningCategory.ENCODING_OPTIONS, "encoding options " + letters);
        }
    }
}
