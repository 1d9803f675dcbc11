package ai.framekit.frames;

import java.awt.Container;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/** LIFO of the containers currently open for construction. Only used while building a widget tree. */
public final class ParentStack {
    private final Deque<Level> stack = new ArrayDeque<>();

    /**
     * One push onto the stack. Identity distinguishes two pushes of the same container, so a stale
     * scope cannot pop a later one.
     */
    static final class Level {
        private final Container container;

        private Level(Container container) {
            this.container = container;
        }

        Container container() {
            return container;
        }
    }

    Level push(Container container) {
        var level = new Level(container);
        stack.push(level);
        return level;
    }

    Container pop() {
        if (stack.isEmpty()) {
            throw new ParentStackUnderflowException("exit() called with no open nesting scope");
        }
        return stack.pop().container();
    }

    boolean contains(Level level) {
        return stack.contains(level);
    }

    @Nullable
    Level peekLevel() {
        return stack.peek();
    }

    @Nullable
    public Container peek() {
        var top = stack.peek();
        return top != null ? top.container() : null;
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public int size() {
        return stack.size();
    }

    /** Snapshot from the top of the stack down. */
    public List<Container> snapshot() {
        return stack.stream().map(Level::container).collect(Collectors.toUnmodifiableList());
    }
}
