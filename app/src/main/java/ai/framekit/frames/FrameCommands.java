package ai.framekit.frames;

/**
 * Outbound placement commands a frame issues to its toolkit delegate after recomputing geometry.
 *
 * <p>Implementations run on the UI thread and must not call back into the frame that issued the
 * command. Every method defaults to a no-op so a delegate only overrides what its frame emits.
 */
public interface FrameCommands {

    /** Places the (single) child at the given bounds. */
    default void placeChild(Placement placement) {}

    /** Updates the scrollbar of one axis. */
    default void setScrollbar(ScrollAxis axis, ScrollbarState state) {}

    /** Shows the content starting at the given top-left offset. */
    default void setVisibleRegion(int offsetX, int offsetY) {}
}
