package ai.framekit.frames;

/**
 * Snapshot of one scrollbar as computed by {@link ScrollFrame}.
 *
 * @param position thumb position as a fraction of the scrollable range, {@code 0} when not scrollable
 * @param extent visible fraction of the content, {@code 1.0} when the content fits
 * @param visible whether the scrollbar policy shows the bar
 * @param enabled whether the content exceeds the viewport on this axis
 */
public record ScrollbarState(double position, double extent, boolean visible, boolean enabled) {}
