package ai.framekit.frames;

/** Where a child gets placed inside its frame, in the frame's pixel coordinates. */
public record Placement(int x, int y, int width, int height) {
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
}
