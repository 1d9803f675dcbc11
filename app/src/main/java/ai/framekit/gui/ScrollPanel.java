package ai.framekit.gui;

import ai.framekit.frames.FrameCommands;
import ai.framekit.frames.ScrollAxis;
import ai.framekit.frames.ScrollFrame;
import ai.framekit.frames.ScrollFrameConfig;
import ai.framekit.frames.ScrollbarState;
import java.awt.Adjustable;
import java.awt.BorderLayout;
import java.awt.Component;
import java.awt.Container;
import java.awt.Dimension;
import java.awt.LayoutManager;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.ContainerEvent;
import java.awt.event.ContainerListener;
import java.awt.event.MouseWheelEvent;
import javax.swing.BoxLayout;
import javax.swing.JComponent;
import javax.swing.JPanel;
import javax.swing.JScrollBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Swing binding of {@link ScrollFrame}: a viewport panel showing a window of
 * the content panel, plus a horizontal and a vertical scrollbar that hide themselves according to
 * the configured policies.
 *
 * <p>The viewport's layout manager keeps the content at its preferred size, so adding, removing or
 * resizing widgets in {@link #getContent()} followed by the usual {@code revalidate()} updates the
 * scrollable area.
 */
public final class ScrollPanel {
    private static final Logger logger = LogManager.getLogger(ScrollPanel.class);

    /** Scrollbar model units per full content length. */
    static final int SCROLLBAR_RESOLUTION = 10_000;

    private final JPanel base = new JPanel(new BorderLayout());
    private final JPanel viewport = new JPanel(new ContentLayout());
    private final JScrollBar horizontalBar =
            new JScrollBar(Adjustable.HORIZONTAL, 0, SCROLLBAR_RESOLUTION, 0, SCROLLBAR_RESOLUTION);
    private final JScrollBar verticalBar =
            new JScrollBar(Adjustable.VERTICAL, 0, SCROLLBAR_RESOLUTION, 0, SCROLLBAR_RESOLUTION);
    private final JComponent content;
    private final ScrollFrame frame;

    // set while the frame pushes state into the scrollbars so their listeners stay quiet
    private boolean applyingFrameState;

    // content preferred size last reported to the frame
    private Dimension reportedContentSize;

    public ScrollPanel(ScrollFrameConfig config) {
        this(config, createDefaultContent());
    }

    public ScrollPanel(ScrollFrameConfig config, JComponent content) {
        this.content = content;
        this.frame = new ScrollFrame(config, new SwingScrollCommands());
        this.reportedContentSize = content.getPreferredSize();

        viewport.add(content);
        content.setSize(config.initialContentWidth(), config.initialContentHeight());
        base.add(viewport, BorderLayout.CENTER);
        base.add(verticalBar, BorderLayout.EAST);
        base.add(horizontalBar, BorderLayout.SOUTH);

        viewport.addComponentListener(new ComponentAdapter() {
            @Override
            public void componentResized(ComponentEvent e) {
                handleViewportResized();
            }
        });
        viewport.addMouseWheelListener(this::handleMouseWheel);
        content.addContainerListener(new ContainerListener() {
            @Override
            public void componentAdded(ContainerEvent e) {
                refreshContentSize();
            }

            @Override
            public void componentRemoved(ContainerEvent e) {
                refreshContentSize();
            }
        });
        horizontalBar.addAdjustmentListener(e -> handleScrollbarAdjusted(ScrollAxis.HORIZONTAL));
        verticalBar.addAdjustmentListener(e -> handleScrollbarAdjusted(ScrollAxis.VERTICAL));

        handleViewportResized();
    }

    private static JPanel createDefaultContent() {
        var panel = new JPanel();
        panel.setLayout(new BoxLayout(panel, BoxLayout.Y_AXIS));
        return panel;
    }

    /** The outer component to lay out in a parent container. */
    public JPanel getComponent() {
        return base;
    }

    /** The scrollable content; add widgets here. */
    public JComponent getContent() {
        return content;
    }

    public JPanel getViewport() {
        return viewport;
    }

    public JScrollBar getScrollBar(ScrollAxis axis) {
        return axis == ScrollAxis.HORIZONTAL ? horizontalBar : verticalBar;
    }

    public ScrollFrame frame() {
        return frame;
    }

    /**
     * Re-reads the content's preferred size and feeds it to the frame right away. Layout does the
     * same on every {@code revalidate()}, so this is only needed before the panel is laid out.
     */
    public void refreshContentSize() {
        reportContentSize(content.getPreferredSize());
        content.validate();
    }

    void handleViewportResized() {
        frame.onResize(viewport.getWidth(), viewport.getHeight());
    }

    void handleMouseWheel(MouseWheelEvent e) {
        if (frame.onWheel(e.getWheelRotation(), e.isShiftDown())) {
            e.consume();
        }
    }

    void handleScrollbarAdjusted(ScrollAxis axis) {
        if (applyingFrameState) {
            return;
        }
        var bar = getScrollBar(axis);
        int range = bar.getMaximum() - bar.getVisibleAmount();
        double fraction = range > 0 ? (double) bar.getValue() / range : 0.0;
        int offset = (int) Math.round(fraction * frame.maxOffset(axis));
        var box = frame.content();
        if (axis == ScrollAxis.HORIZONTAL) {
            frame.scrollTo(offset, box.offsetY());
        } else {
            frame.scrollTo(box.offsetX(), offset);
        }
    }

    private void reportContentSize(Dimension preferred) {
        reportedContentSize = new Dimension(preferred);
        content.setSize(preferred);
        frame.onContentResize(preferred.width, preferred.height);
        base.revalidate();
    }

    /** Feeds a changed content preferred size to the frame, as a child resize or add/remove causes. */
    private void syncContentSize() {
        var preferred = content.getPreferredSize();
        if (!preferred.equals(reportedContentSize)) {
            logger.debug("Content preferred size changed to {}x{}", preferred.width, preferred.height);
            reportContentSize(preferred);
        }
    }

    /**
     * Viewport layout: keeps the content at its preferred size and reports size changes to the
     * frame. Content position is owned by {@link SwingScrollCommands#setVisibleRegion}.
     */
    private final class ContentLayout implements LayoutManager {
        @Override
        public void addLayoutComponent(String name, Component comp) {}

        @Override
        public void removeLayoutComponent(Component comp) {}

        @Override
        public Dimension preferredLayoutSize(Container parent) {
            syncContentSize();
            var size = frame.preferredViewportSize();
            return new Dimension(size.width(), size.height());
        }

        @Override
        public Dimension minimumLayoutSize(Container parent) {
            return new Dimension(0, 0);
        }

        @Override
        public void layoutContainer(Container parent) {
            syncContentSize();
        }
    }

    private final class SwingScrollCommands implements FrameCommands {
        @Override
        public void setVisibleRegion(int offsetX, int offsetY) {
            content.setLocation(-offsetX, -offsetY);
            viewport.repaint();
        }

        @Override
        public void setScrollbar(ScrollAxis axis, ScrollbarState state) {
            var bar = getScrollBar(axis);
            int extent = Math.max(1, (int) Math.round(state.extent() * SCROLLBAR_RESOLUTION));
            int value = (int) Math.round(state.position() * (SCROLLBAR_RESOLUTION - extent));
            applyingFrameState = true;
            try {
                bar.setValues(value, extent, 0, SCROLLBAR_RESOLUTION);
                bar.setBlockIncrement(extent);
                bar.setUnitIncrement(Math.max(1, extent / 10));
            } finally {
                applyingFrameState = false;
            }
            bar.setEnabled(state.enabled());
            if (bar.isVisible() != state.visible()) {
                logger.debug("{} scrollbar {}", axis, state.visible() ? "shown" : "hidden");
                bar.setVisible(state.visible());
                base.revalidate();
            }
        }
    }
}
