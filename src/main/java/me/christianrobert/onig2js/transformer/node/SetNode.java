package me.christianrobert.onig2js.transformer.node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Character class. Members are literal, range, character type, property,
 * intersection or nested set nodes.
 *
 * <p>The nesting level is 0 for an outermost class and grows by one per
 * enclosing class. {@link Nodes} assigns it when a class is wrapped.</p>
 */
public class SetNode extends Node {

    private final List<Node> members;
    private final boolean negative;
    private int nestingLevel;

    public SetNode(List<Node> members, boolean negative, int nestingLevel) {
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
        this.negative = negative;
        this.nestingLevel = nestingLevel;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SET;
    }

    public List<Node> getMembers() {
        return members;
    }

    @Override
    public List<Node> getChildren() {
        return members;
    }

    public boolean isNegative() {
        return negative;
    }

    public int getNestingLevel() {
        return nestingLevel;
    }

    void assignNestingLevel(int level) {
        Deque<SetNode> pending = new ArrayDeque<>();
        this.nestingLevel = level;
        pending.push(this);
        while (!pending.isEmpty()) {
            SetNode set = pending.pop();
            for (Node member : set.members) {
                if (member instanceof SetNode) {
                    SetNode nested = (SetNode) member;
                    nested.nestingLevel = set.nestingLevel + 1;
                    pending.push(nested);
                }
            }
        }
    }

    @Override
    protected List<Node> textChildren() {
        return members;
    }

    @Override
    protected String textPrefix() {
        return negative ? "[^" : "[";
    }

    @Override
    protected String textSuffix() {
        return "]";
    }
}
