package me.christianrobert.onig2js.transformer.context;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Mutable state shared across one whole-tree conversion.
 *
 * <p>Contains:
 * <ul>
 *   <li>Capture bookkeeping (emitted group count, source→emitted index maps)</li>
 *   <li>Set buffers for the outermost character class being converted</li>
 *   <li>Case-insensitivity scope stack</li>
 *   <li>Atomic emulation depth and recursion depth</li>
 *   <li>Warnings, in discovery order</li>
 * </ul>
 *
 * <p>A context is created for exactly one top-level conversion and must not be
 * shared between conversions. Once {@link #complete()} has been called it
 * refuses further use.</p>
 */
public class ConversionContext {

    private static final int MAX_SOURCE_LENGTH = 200;

    private final ConversionOptions options;
    private final boolean rootCaseInsensitive;
    private final boolean rootDotAll;

    // Capture bookkeeping
    private int captureCount;
    private final Map<Integer, Integer> emittedIndexBySourceIndex;
    private final Map<String, Integer> emittedIndexByName;

    // Set state, valid while one outermost set is converted
    private final List<String> bufferedSetMembers;
    private final List<String> bufferedSetExtractions;
    private boolean negativeBaseSet;
    private boolean inSet;

    // Case scopes pushed by annotated subtrees (the root pushes the bottom entry)
    private final Deque<Boolean> caseScopeStack;

    private int atomicDepth;
    private int depth;
    private boolean started;
    private boolean completed;

    private final List<ConversionWarning> warnings;

    public ConversionContext(ConversionOptions options, boolean rootCaseInsensitive, boolean rootDotAll) {
        if (options == null) {
            throw new IllegalArgumentException("Options cannot be null");
        }
        this.options = options;
        this.rootCaseInsensitive = rootCaseInsensitive;
        this.rootDotAll = rootDotAll;
        this.emittedIndexBySourceIndex = new HashMap<>();
        this.emittedIndexByName = new HashMap<>();
        this.bufferedSetMembers = new ArrayList<>();
        this.bufferedSetExtractions = new ArrayList<>();
        this.caseScopeStack = new ArrayDeque<>();
        this.warnings = new ArrayList<>();
    }

    public ConversionOptions getOptions() {
        return options;
    }

    public boolean isRootCaseInsensitive() {
        return rootCaseInsensitive;
    }

    public boolean isRootDotAll() {
        return rootDotAll;
    }

    // ========== Lifecycle ==========

    /**
     * Marks the start of the conversion this context belongs to.
     *
     * @throws MalformedTreeException if the context was already used
     */
    public void start() {
        if (started) {
            throw new MalformedTreeException("Conversion context cannot be reused across conversions");
        }
        started = true;
    }

    public void complete() {
        completed = true;
    }

    public boolean isCompleted() {
        return completed;
    }

    // ========== Recursion depth ==========

    /**
     * Enters one tree level.
     *
     * @param source Renders the text of the node being entered; only called
     *               when the bound is exceeded
     * @throws NestingDepthExceededException if the configured bound is exceeded
     */
    public void enterNode(Supplier<String> source) {
        if (completed) {
            throw new MalformedTreeException("Conversion context has already completed");
        }
        depth++;
        if (depth > options.getMaxNestingDepth()) {
            throw new NestingDepthExceededException(options.getMaxNestingDepth(), abbreviate(source.get()));
        }
    }

    static String abbreviate(String text) {
        if (text == null || text.length() <= MAX_SOURCE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_SOURCE_LENGTH) + "...";
    }

    public void exitNode() {
        depth--;
    }

    public int getDepth() {
        return depth;
    }

    // ========== Captures ==========

    /**
     * Registers a capturing group of the source pattern and returns its index
     * in the emitted pattern.
     *
     * @param sourceIndex Group number in the source pattern (may be null)
     * @param name Group name (null for unnamed groups)
     * @return Emitted group number
     */
    public int registerCapture(Integer sourceIndex, String name) {
        int emitted = ++captureCount;
        if (sourceIndex != null) {
            emittedIndexBySourceIndex.put(sourceIndex, emitted);
        }
        if (name != null) {
            emittedIndexByName.put(name, emitted);
        }
        return emitted;
    }

    /**
     * Opens a capturing group that only exists in the emitted pattern
     * (atomic group emulation).
     *
     * @return Emitted group number
     */
    public int openSyntheticCapture() {
        return ++captureCount;
    }

    public int getCaptureCount() {
        return captureCount;
    }

    /**
     * @return Emitted group number for a source group number, or null if no such group was emitted (yet)
     */
    public Integer resolveCapture(int sourceIndex) {
        return emittedIndexBySourceIndex.get(sourceIndex);
    }

    /**
     * @return Emitted group number for a group name, or null if no such group was emitted (yet)
     */
    public Integer resolveCapture(String name) {
        return emittedIndexByName.get(name);
    }

    // ========== Atomic emulation ==========

    public void enterAtomicEmulation() {
        atomicDepth++;
    }

    public void exitAtomicEmulation() {
        atomicDepth--;
    }

    public boolean isInAtomicEmulation() {
        return atomicDepth > 0;
    }

    // ========== Set buffers ==========

    /**
     * Starts converting an outermost set (nesting level 0).
     *
     * @param negative Whether the outermost set is negated
     * @throws MalformedTreeException if buffers are not empty, which means the
     *         context is being reused or a set was entered twice
     */
    public void beginSet(boolean negative) {
        if (inSet || !bufferedSetMembers.isEmpty() || !bufferedSetExtractions.isEmpty()) {
            throw new MalformedTreeException("Set buffers are not empty on entering an outermost set");
        }
        inSet = true;
        negativeBaseSet = negative;
    }

    public boolean isInSet() {
        return inSet;
    }

    public boolean isNegativeBaseSet() {
        return negativeBaseSet;
    }

    public void bufferSetMember(String member) {
        bufferedSetMembers.add(member);
    }

    public void bufferSetExtraction(String extraction) {
        bufferedSetExtractions.add(extraction);
    }

    public List<String> getBufferedSetMembers() {
        return Collections.unmodifiableList(bufferedSetMembers);
    }

    public List<String> getBufferedSetExtractions() {
        return Collections.unmodifiableList(bufferedSetExtractions);
    }

    /**
     * Finishes the outermost set and empties both buffers.
     */
    public void endSet() {
        bufferedSetMembers.clear();
        bufferedSetExtractions.clear();
        negativeBaseSet = false;
        inSet = false;
    }

    // ========== Case scopes ==========

    public void pushCaseScope(boolean caseInsensitive) {
        caseScopeStack.push(caseInsensitive);
    }

    public void popCaseScope() {
        if (caseScopeStack.isEmpty()) {
            throw new IllegalStateException("Cannot pop case scope: stack is empty");
        }
        caseScopeStack.pop();
    }

    /**
     * Effective case-insensitivity at the current position.
     */
    public boolean isCaseInsensitive() {
        Boolean top = caseScopeStack.peek();
        return top != null ? top : rootCaseInsensitive;
    }

    /**
     * True when an inline option made matching case-insensitive although the
     * pattern as a whole is case-sensitive. The target has no local {@code i}
     * option, so such content needs case-swapped duplicates.
     */
    public boolean isLocallyCaseInsensitive() {
        return isCaseInsensitive() && !rootCaseInsensitive;
    }

    /**
     * True when an inline option made matching case-sensitive inside a
     * case-insensitive pattern. The target cannot express this.
     */
    public boolean isLocallyCaseSensitive() {
        return !isCaseInsensitive() && rootCaseInsensitive;
    }

    // ========== Warnings ==========

    public void warn(WarningCategory category, String message) {
        warnings.add(new ConversionWarning(category, message));
    }

    /**
     * Records a dropped feature, e.g. {@code warnOfUnsupported(SET_INTERSECTION, "set intersection")}.
     */
    public void warnOfUnsupported(WarningCategory category, String feature) {
        warn(category, "Dropped unsupported " + feature);
    }

    public List<ConversionWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
