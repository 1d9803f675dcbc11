package ai.framekit.frames;

/** The currently rendered pixel size of a container. Mutated in place by the frame that owns it. */
public final class Viewport {
    private int width;
    private int height;

    Viewport(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    int size(ScrollAxis axis) {
        return axis == ScrollAxis.HORIZONTAL ? width : height;
    }

    void resize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    @Override
    public String toString() {
        return "Viewport[" + width + "x" + height + "]";
    }
}
