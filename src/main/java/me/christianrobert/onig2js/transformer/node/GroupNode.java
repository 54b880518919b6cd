package me.christianrobert.onig2js.transformer.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Any parenthesized construct.
 *
 * <p>{@code captureIndex} is the group number in the source pattern and is only
 * set for capturing types. Option letters are only set for {@link GroupType#OPTIONS}
 * and {@link GroupType#OPTIONS_SWITCH}.</p>
 */
public class GroupNode extends Node {

    private final GroupType type;
    private final List<Node> children;
    private final String name;
    private final Integer captureIndex;
    private final String enabledOptions;
    private final String disabledOptions;

    public GroupNode(GroupType type, List<Node> children, String name, Integer captureIndex,
                     String enabledOptions, String disabledOptions) {
        if (type == null) {
            throw new IllegalArgumentException("Group type cannot be null");
        }
        this.type = type;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.name = name;
        this.captureIndex = captureIndex;
        this.enabledOptions = enabledOptions != null ? enabledOptions : "";
        this.disabledOptions = disabledOptions != null ? disabledOptions : "";
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GROUP;
    }

    public GroupType getType() {
        return type;
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    public String getName() {
        return name;
    }

    public Integer getCaptureIndex() {
        return captureIndex;
    }

    public String getEnabledOptions() {
        return enabledOptions;
    }

    public String getDisabledOptions() {
        return disabledOptions;
    }

    @Override
    protected List<Node> textChildren() {
        return children;
    }

    @Override
    protected String textPrefix() {
        StringBuilder sb = new StringBuilder(type.getHead());
        switch (type) {
            case NAMED -> sb.append(name).append('>');
            case OPTIONS, OPTIONS_SWITCH -> {
                sb.append(enabledOptions);
                if (!disabledOptions.isEmpty()) {
                    sb.append('-').append(disabledOptions);
                }
                if (type == GroupType.OPTIONS) {
                    sb.append(':');
                }
            }
            default -> {
            }
        }
        return sb.toString();
    }

    @Override
    protected String textSuffix() {
        return type.getTail();
    }
}
