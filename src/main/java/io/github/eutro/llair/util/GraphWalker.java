package io.github.eutro.llair.util;

import io.github.eutro.llair.exp.App;
import io.github.eutro.llair.exp.Exp;
import io.github.eutro.llair.exp.StructRec;

import java.util.*;
import java.util.function.Function;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 * <p>
 * Nodes are told apart by reference identity, not {@link Object#equals(Object)},
 * so a graph with cycles, or with distinct nodes that happen to be equal, is walked
 * exactly once per physical node.
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
    final Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the subexpressions of an {@link Exp}.
     * <p>
     * The children of an {@link App} are its operator and its argument, in that order,
     * the children of a {@link StructRec} are its elements, and other expressions have none.
     *
     * @param root The root expression.
     * @return The graph walker.
     */
    public static GraphWalker<Exp> expWalker(Exp root) {
        return new GraphWalker<>(root, GraphWalker::expChildren);
    }

    private static List<Exp> expChildren(Exp exp) {
        if (exp instanceof App) {
            App app = (App) exp;
            return Arrays.asList(app.op(), app.arg());
        } else if (exp instanceof StructRec) {
            return ((StructRec) exp).elts();
        }
        return Collections.emptyList();
    }

    private static <T> Set<T> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
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
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the post-order traversal of the graph.
     * <p>
     * Every node is yielded after all of its children that are not among its own ancestors,
     * and the root is yielded last.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = identitySet();

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
        private final Deque<Pair<T, Iterator<? extends T>>> stack = new ArrayDeque<>();
        private final Set<T> seen = identitySet();

        {
            push(root);
        }

        private void push(T node) {
            seen.add(node);
            stack.addLast(Pair.of(node, getChildren.apply(node).iterator()));
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Pair<T, Iterator<? extends T>> top = stack.getLast();
                boolean descended = false;
                while (top.right.hasNext()) {
                    T child = top.right.next();
                    if (!seen.contains(child)) {
                        push(child);
                        descended = true;
                        break;
                    }
                }
                if (!descended) {
                    return stack.removeLast().left;
                }
            }
        }
    }
}
