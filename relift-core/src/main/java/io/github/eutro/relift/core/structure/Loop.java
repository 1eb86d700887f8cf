package io.github.eutro.relift.core.structure;

import java.util.*;

/**
 * A natural loop: a header, the latches that branch back to it, and the blocks of its body.
 * <p>
 * Loops sharing a header are merged, so each back edge {@code latch -> header} belongs to exactly one loop.
 */
public final class Loop {
    public enum Kind {
        /**
         * The header tests the exit condition before the body runs.
         */
        WHILE,
        /**
         * A single latch tests the condition after the body has run.
         */
        DO_WHILE,
        /**
         * Neither; the loop is left only by breaking out of it, if at all.
         */
        INFINITE_LOOP,
    }

    private final int header;
    private final List<Integer> latches;
    private final Set<Integer> body;
    private final Kind kind;
    private final int follow;

    public Loop(int header, Collection<Integer> latches, Collection<Integer> body, Kind kind, int follow) {
        this.header = header;
        this.latches = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(latches)));
        this.body = Collections.unmodifiableSet(new TreeSet<>(body));
        this.kind = kind;
        this.follow = follow;
    }

    public int getHeader() {
        return header;
    }

    /**
     * @return The sources of the back edges to the header, in ascending order.
     */
    public List<Integer> getLatches() {
        return latches;
    }

    /**
     * @return Every block of the loop, the header and latches included.
     */
    public Set<Integer> getBody() {
        return body;
    }

    public boolean contains(int block) {
        return body.contains(block);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return The block control reaches when the loop exits normally, or -1 if there is none.
     */
    public int getFollow() {
        return follow;
    }

    @Override
    public String toString() {
        return String.format("%s(header=%d, latches=%s, body=%s, follow=%d)",
                kind, header, latches, body, follow);
    }
}
