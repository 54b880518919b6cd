package me.christianrobert.onig2js.transformer.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a conversion.
 * Contains either the converted pattern (with flags and warnings) or an error message.
 * Optionally includes the node tree representation for debugging.
 */
public class ConversionResult {

    private final boolean success;
    private final String pattern;
    private final String flags;
    private final List<ConversionWarning> warnings;
    private final String errorMessage;
    private final String source;
    private final String nodeTree;

    private ConversionResult(boolean success, String pattern, String flags, List<ConversionWarning> warnings,
                             String errorMessage, String source, String nodeTree) {
        this.success = success;
        this.pattern = pattern;
        this.flags = flags;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.errorMessage = errorMessage;
        this.source = source;
        this.nodeTree = nodeTree;
    }

    /**
     * Creates a successful conversion result.
     */
    public static ConversionResult success(String source, String pattern, String flags,
                                           List<ConversionWarning> warnings) {
        return new ConversionResult(true, pattern, flags, warnings, null, source, null);
    }

    /**
     * Creates a successful conversion result with node tree.
     */
    public static ConversionResult successWithTree(String source, String pattern, String flags,
                                                   List<ConversionWarning> warnings, String nodeTree) {
        return new ConversionResult(true, pattern, flags, warnings, null, source, nodeTree);
    }

    /**
     * Creates a failed conversion result. Failed results carry no pattern.
     */
    public static ConversionResult failure(String source, String errorMessage) {
        return new ConversionResult(false, null, null, List.of(), errorMessage, source, null);
    }

    /**
     * Creates a failed conversion result from an exception.
     */
    public static ConversionResult failure(String source, ConversionException exception) {
        return new ConversionResult(false, null, null, List.of(), exception.getDetailedMessage(), source, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getPattern() {
        return pattern;
    }

    public String getFlags() {
        return flags;
    }

    public List<ConversionWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getSource() {
        return source;
    }

    public String getNodeTree() {
        return nodeTree;
    }

    public boolean hasNodeTree() {
        return nodeTree != null;
    }

    /**
     * Renders the pattern as a regex literal, {@code /pattern/flags}, escaping
     * forward slashes that are not escaped yet. An empty pattern is written as
     * {@code (?:)}, since {@code //} would start a comment.
     *
     * @throws IllegalStateException for failed results
     */
    public String toLiteral() {
        if (!success) {
            throw new IllegalStateException("Failed conversion has no pattern: " + errorMessage);
        }
        if (pattern.isEmpty()) {
            return "/(?:)/" + flags;
        }
        StringBuilder sb = new StringBuilder("/");
        boolean escaped = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '/' && !escaped) {
                sb.append('\\');
            }
            sb.append(c);
            escaped = c == '\\' && !escaped;
        }
        return sb.append('/').append(flags).toString();
    }

    @Override
    public String toString() {
        if (success) {
            return "ConversionResult{success=true, pattern='" + pattern + "', flags='" + flags + "'" +
                   ", warnings=" + warnings.size() +
                   (nodeTree != null ? ", hasNodeTree=true" : "") + "}";
        } else {
            return "ConversionResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
