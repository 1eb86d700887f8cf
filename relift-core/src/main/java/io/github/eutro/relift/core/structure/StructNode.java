package io.github.eutro.relift.core.structure;

import io.github.eutro.relift.core.ir.Varnode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the structure tree recovered from a function's control flow graph.
 * <p>
 * Conditional nodes ({@link Kind#IF_THEN}, {@link Kind#IF_THEN_ELSE}, {@link Kind#WHILE}, {@link Kind#DO_WHILE}
 * and {@link Kind#SWITCH}) own their condition {@link #getBlock() block}: its statements belong to the node
 * and the block does not appear again among the children. The condition of a node is the condition of that
 * block's branch being taken, or its negation if the node is {@link #isNegated() negated}.
 * <p>
 * An {@link Kind#INFINITE_LOOP} only records its header, which is the first block of its body.
 */
public final class StructNode {
    public enum Kind {
        SEQUENCE,
        IF_THEN,
        IF_THEN_ELSE,
        WHILE,
        DO_WHILE,
        INFINITE_LOOP,
        SWITCH,
        BLOCK,
        BREAK,
        CONTINUE,
        GOTO,
    }

    /**
     * One arm of a {@link Kind#SWITCH}.
     */
    public static final class Case {
        private final List<Long> values;
        private final StructNode body;

        public Case(List<Long> values, StructNode body) {
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
            this.body = body;
        }

        /**
         * @return The values selecting this case; empty for the default case.
         */
        public List<Long> getValues() {
            return values;
        }

        public boolean isDefault() {
            return values.isEmpty();
        }

        public StructNode getBody() {
            return body;
        }

        @Override
        public String toString() {
            return (isDefault() ? "default" : "case" + values) + ": " + body;
        }
    }

    private final Kind kind;
    private final int block;
    private final boolean negated;
    private final List<StructNode> children;
    private final List<Case> cases;
    @Nullable
    private final Varnode switchValue;

    private StructNode(Kind kind,
                       int block,
                       boolean negated,
                       List<StructNode> children,
                       List<Case> cases,
                       @Nullable Varnode switchValue) {
        this.kind = kind;
        this.block = block;
        this.negated = negated;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
        this.switchValue = switchValue;
    }

    private static StructNode of(Kind kind, int block, boolean negated, StructNode... children) {
        List<StructNode> list = new ArrayList<>();
        Collections.addAll(list, children);
        return new StructNode(kind, block, negated, list, Collections.emptyList(), null);
    }

    public static StructNode sequence(List<StructNode> children) {
        return new StructNode(Kind.SEQUENCE, -1, false, children, Collections.emptyList(), null);
    }

    public static StructNode block(int block) {
        return of(Kind.BLOCK, block, false);
    }

    public static StructNode ifThen(int condition, boolean negated, StructNode then) {
        return of(Kind.IF_THEN, condition, negated, then);
    }

    public static StructNode ifThenElse(int condition, boolean negated, StructNode then, StructNode otherwise) {
        return of(Kind.IF_THEN_ELSE, condition, negated, then, otherwise);
    }

    /**
     * Create a loop node.
     *
     * @param kind      The kind of loop.
     * @param block     The header of a while or infinite loop, or the latch of a do-while loop.
     * @param negated   Whether the loop continues when the branch is not taken.
     * @param body      The body.
     * @return The node.
     */
    public static StructNode loop(Loop.Kind kind, int block, boolean negated, StructNode body) {
        Kind nodeKind;
        switch (kind) {
            case WHILE:
                nodeKind = Kind.WHILE;
                break;
            case DO_WHILE:
                nodeKind = Kind.DO_WHILE;
                break;
            case INFINITE_LOOP:
                nodeKind = Kind.INFINITE_LOOP;
                break;
            default:
                throw new IllegalArgumentException(String.format("unknown loop kind %s", kind));
        }
        return of(nodeKind, block, negated, body);
    }

    public static StructNode switchOf(int block, Varnode value, List<Case> cases) {
        return new StructNode(Kind.SWITCH, block, false, Collections.emptyList(), cases, value);
    }

    public static StructNode breakNode() {
        return of(Kind.BREAK, -1, false);
    }

    public static StructNode continueNode() {
        return of(Kind.CONTINUE, -1, false);
    }

    public static StructNode gotoNode(int target) {
        return of(Kind.GOTO, target, false);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return The leaf block, condition block, loop block or goto target; -1 for other kinds.
     */
    public int getBlock() {
        return block;
    }

    public boolean isNegated() {
        return negated;
    }

    public List<StructNode> getChildren() {
        return children;
    }

    public StructNode getChild(int i) {
        return children.get(i);
    }

    public List<Case> getCases() {
        return cases;
    }

    public @Nullable Varnode getSwitchValue() {
        return switchValue;
    }

    /**
     * Visit this node and all of its descendants, parents first.
     *
     * @return The nodes.
     */
    public List<StructNode> flatten() {
        List<StructNode> out = new ArrayList<>();
        flatten(out);
        return out;
    }

    private void flatten(List<StructNode> out) {
        out.add(this);
        for (StructNode child : children) {
            child.flatten(out);
        }
        for (Case c : cases) {
            c.body.flatten(out);
        }
    }

    private static String kindName(Kind kind) {
        return kind.name().toLowerCase().replace('_', '-');
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kindName(kind));
        switch (kind) {
            case BREAK:
            case CONTINUE:
                return sb.toString();
            case BLOCK:
            case GOTO:
                return sb.append('(').append(block).append(')').toString();
            case SEQUENCE:
                sb.append('(');
                break;
            case SWITCH:
                sb.append('(').append(block).append(", ").append(switchValue);
                for (Case c : cases) {
                    sb.append(", ").append(c);
                }
                return sb.append(')').toString();
            default:
                sb.append('(').append(negated ? "!" : "").append(block).append(", ");
                break;
        }
        for (int i = 0; i < children.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
