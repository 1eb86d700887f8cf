package io.github.eutro.relift.core.util;

import io.github.eutro.relift.core.ir.Function;

import java.util.*;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The root of the walk.
     */
    final T root;
    /**
     * The successor function.
     */
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the block ids of a {@link Function}, from the entry,
     * following {@link Function#flowSuccessors(io.github.eutro.relift.core.ir.BasicBlock) flow successors}.
     *
     * @param func The function whose blocks should be iterated over.
     * @return The graph walker.
     */
    public static GraphWalker<Integer> blockWalker(Function func) {
        return new GraphWalker<>(0, $ -> func.flowSuccessors(func.block($)));
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the depth-first post-order traversal of the graph.
     * <p>
     * Successors are visited in the order the successor function yields them.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    /**
     * Get the reverse post-order of the graph, starting at the root.
     *
     * @return The nodes reachable from the root in reverse post-order.
     */
    public List<T> reversePostOrder() {
        List<T> ls = postOrder().toList();
        Collections.reverse(ls);
        return ls;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        private final Deque<T> nodes = new ArrayDeque<>();
        private final Deque<Iterator<? extends T>> iters = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            push(root);
        }

        private void push(T node) {
            seen.add(node);
            nodes.addLast(node);
            iters.addLast(getChildren.apply(node).iterator());
        }

        @Override
        public boolean hasNext() {
            return !nodes.isEmpty();
        }

        @Override
        public T next() {
            if (nodes.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Iterator<? extends T> it = iters.getLast();
                T child = null;
                while (it.hasNext()) {
                    T next = it.next();
                    if (!seen.contains(next)) {
                        child = next;
                        break;
                    }
                }
                if (child == null) {
                    iters.removeLast();
                    return nodes.removeLast();
                }
                push(child);
            }
        }
    }
}
