package ai.framekit.frames;

import java.awt.Component;
import java.awt.Container;
import java.util.Objects;
import java.util.function.Supplier;
import javax.swing.JPanel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Scoped construction of nested container trees.
 *
 * <p>Each {@link #enter()} opens a new container under the current parent and makes it the parent
 * for everything added until the matching exit. Scopes are meant for try-with-resources, which pops
 * the stack on every exit path:
 *
 * <pre>{@code
 * var nested = new NestedFrame(NestedFrameConfig.under(window.getContentPane()));
 * try (var outer = nested.enter()) {
 *     nested.add(new JLabel("x"));
 *     try (var inner = nested.enter()) {
 *         nested.add(new JLabel("x1"));
 *     }
 *     nested.add(new JLabel("y")); // back in outer
 * }
 * }</pre>
 *
 * <p>Building only; the frame has no effect on layout once construction is done.
 */
public final class NestedFrame {
    private static final Logger logger = LogManager.getLogger(NestedFrame.class);

    private final Container root;
    private final Supplier<? extends Container> containerFactory;
    private final ParentStack stack = new ParentStack();

    public NestedFrame(NestedFrameConfig config) {
        this(config, JPanel::new);
    }

    public NestedFrame(NestedFrameConfig config, Supplier<? extends Container> containerFactory) {
        this.root = config.parent() != null ? config.parent() : new JPanel();
        this.containerFactory = containerFactory;
    }

    /** Creates a new container under the current parent and pushes it. */
    public Scope enter() {
        return enter(containerFactory.get());
    }

    /**
     * Pushes an existing container, attaching it to the current parent unless it already has one.
     * Lets special frames (a scroll panel's content, an aspect-ratio panel's content) nest like
     * plain containers.
     */
    public Scope enter(Container container) {
        Objects.requireNonNull(container, "container");
        var parent = currentParent();
        if (container.getParent() == null) {
            parent.add(container);
        }
        var level = stack.push(container);
        logger.trace("Entered nesting level {}", stack.size());
        return new Scope(level, parent);
    }

    /** Pops the innermost open container. */
    public Container exit() {
        var popped = stack.pop();
        logger.trace("Exited to nesting level {}", stack.size());
        return popped;
    }

    /** Adds a widget to the current parent. */
    public <T extends Component> T add(T widget) {
        currentParent().add(widget);
        return widget;
    }

    /** Adds a widget to the current parent with layout constraints. */
    public <T extends Component> T add(T widget, @Nullable Object constraints) {
        currentParent().add(widget, constraints);
        return widget;
    }

    /** Top of the stack, or the root when no scope is open. */
    public Container currentParent() {
        var top = stack.peek();
        return top != null ? top : root;
    }

    public Container root() {
        return root;
    }

    public int depth() {
        return stack.size();
    }

    public ParentStack stack() {
        return stack;
    }

    /** Short label for a container in log messages: its name, or its type and identity. */
    static String describe(Container container) {
        var name = container.getName();
        if (name != null) {
            return name;
        }
        return container.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(container));
    }

    /**
     * An open nesting level. Closing it pops its container, first unwinding any inner levels that
     * were left open. Closing it again does nothing.
     */
    public final class Scope implements AutoCloseable {
        private final ParentStack.Level level;
        private final Container parent;
        private boolean closed;

        private Scope(ParentStack.Level level, Container parent) {
            this.level = level;
            this.parent = parent;
        }

        /** The container widgets in this scope are parented to. */
        public Container container() {
            return level.container();
        }

        /** The container this scope's container was opened under. */
        public Container parent() {
            return parent;
        }

        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (!stack.contains(level)) {
                // already popped through exit()
                return;
            }
            while (stack.peekLevel() != level) {
                int depth = stack.size();
                var abandoned = exit();
                logger.warn("Unwinding nesting scope left open at level {}: {}", depth, describe(abandoned));
            }
            exit();
        }
    }
}
