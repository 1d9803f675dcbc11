package ai.framekit.frames;

/**
 * Full logical size of scrollable content plus the top-left corner of the visible window inside it.
 *
 * <p>{@link ScrollFrame} keeps {@code 0 <= offset <= max(0, content - viewport)} on both axes.
 */
public final class ContentBox {
    private int width;
    private int height;
    private int offsetX;
    private int offsetY;

    ContentBox(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int offsetX() {
        return offsetX;
    }

    public int offsetY() {
        return offsetY;
    }

    int size(ScrollAxis axis) {
        return axis == ScrollAxis.HORIZONTAL ? width : height;
    }

    int offset(ScrollAxis axis) {
        return axis == ScrollAxis.HORIZONTAL ? offsetX : offsetY;
    }

    void resize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    void moveTo(int offsetX, int offsetY) {
        this.offsetX = offsetX;
        this.offsetY = offsetY;
    }

    @Override
    public String toString() {
        return "ContentBox[" + width + "x" + height + " @ " + offsetX + "," + offsetY + "]";
    }
}
