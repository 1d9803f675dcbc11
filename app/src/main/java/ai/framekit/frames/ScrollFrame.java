package ai.framekit.frames;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A fixed-size viewport over content that may be larger than it.
 *
 * <p>Every operation re-clamps the offsets into {@code [0, max(0, content - viewport)]} and then
 * emits the visible region followed by one scrollbar update per axis. An axis whose content fits
 * into the viewport is pinned at offset 0 and its scrollbar is disabled.
 */
public final class ScrollFrame {
    private static final Logger logger = LogManager.getLogger(ScrollFrame.class);

    private final ScrollFrameConfig config;
    private final FrameCommands commands;
    private final Viewport viewport = new Viewport(0, 0);
    private final ContentBox content;

    public ScrollFrame(ScrollFrameConfig config, FrameCommands commands) {
        this.config = config;
        this.commands = commands;
        this.content = new ContentBox(config.initialContentWidth(), config.initialContentHeight());
    }

    public void onResize(double width, double height) {
        viewport.resize(Geometry.floorPixels(width), Geometry.floorPixels(height));
        logger.trace("Viewport resized to {}", viewport);
        reconcile(content.offsetX(), content.offsetY());
    }

    public void onScroll(int deltaX, int deltaY) {
        reconcile((long) content.offsetX() + deltaX, (long) content.offsetY() + deltaY);
    }

    public void onContentResize(double width, double height) {
        content.resize(Geometry.floorPixels(width), Geometry.floorPixels(height));
        logger.trace("Content resized to {}", content);
        reconcile(content.offsetX(), content.offsetY());
    }

    /** Moves the visible window to an absolute offset, clamped like every other operation. */
    public void scrollTo(int offsetX, int offsetY) {
        reconcile(offsetX, offsetY);
    }

    /**
     * Scrolls by whole wheel notches. Positive rotation scrolls towards the end of the content. The
     * wheel only moves an axis that currently has something to scroll.
     *
     * @return true if the wheel event applied to a scrollable axis
     */
    public boolean onWheel(int rotation, boolean horizontal) {
        var axis = horizontal ? ScrollAxis.HORIZONTAL : ScrollAxis.VERTICAL;
        if (!isScrollable(axis)) {
            return false;
        }
        long delta = (long) rotation * config.wheelUnit();
        if (horizontal) {
            reconcile(content.offsetX() + delta, content.offsetY());
        } else {
            reconcile(content.offsetX(), content.offsetY() + delta);
        }
        return true;
    }

    public boolean isScrollable(ScrollAxis axis) {
        return content.size(axis) > viewport.size(axis);
    }

    /** Largest valid offset on an axis. */
    public int maxOffset(ScrollAxis axis) {
        return Math.max(0, content.size(axis) - viewport.size(axis));
    }

    public ScrollbarState scrollbar(ScrollAxis axis) {
        boolean scrollable = isScrollable(axis);
        double extent = scrollable ? (double) viewport.size(axis) / content.size(axis) : 1.0;
        double position = scrollable ? (double) content.offset(axis) / maxOffset(axis) : 0.0;
        return new ScrollbarState(position, extent, config.policy(axis).isVisible(scrollable), scrollable);
    }

    /**
     * Viewport size the frame asks its container for: the content size, capped at the configured
     * maximum on each axis.
     */
    public Size preferredViewportSize() {
        int w = content.width();
        int h = content.height();
        if (config.maxWidth() != null) {
            w = Math.min(w, config.maxWidth());
        }
        if (config.maxHeight() != null) {
            h = Math.min(h, config.maxHeight());
        }
        return new Size(w, h);
    }

    public Viewport viewport() {
        return viewport;
    }

    public ContentBox content() {
        return content;
    }

    public ScrollFrameConfig config() {
        return config;
    }

    private void reconcile(long requestedX, long requestedY) {
        int x = Geometry.clampOffset(requestedX, maxOffset(ScrollAxis.HORIZONTAL));
        int y = Geometry.clampOffset(requestedY, maxOffset(ScrollAxis.VERTICAL));
        content.moveTo(x, y);

        commands.setVisibleRegion(x, y);
        commands.setScrollbar(ScrollAxis.HORIZONTAL, scrollbar(ScrollAxis.HORIZONTAL));
        commands.setScrollbar(ScrollAxis.VERTICAL, scrollbar(ScrollAxis.VERTICAL));
    }
}
