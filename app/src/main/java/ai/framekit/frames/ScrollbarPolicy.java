package ai.framekit.frames;

/** When a scrollbar is shown. Visibility only; offsets are clamped the same way under every policy. */
public enum ScrollbarPolicy {
    /** Always shown, disabled while there is nothing to scroll. */
    ALWAYS,
    /** Shown only while the content exceeds the viewport on that axis. */
    AUTO,
    NEVER;

    public boolean isVisible(boolean scrollable) {
        return switch (this) {
            case ALWAYS -> true;
            case AUTO -> scrollable;
            case NEVER -> false;
        };
    }
}
