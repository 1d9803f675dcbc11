package ai.framekit.frames;

/**
 * Result of fitting an {@link AspectConstraint} into an outer box: the rendered child size in whole
 * pixels together with the outer size it was fitted into.
 */
public record AspectFit(int outerWidth, int outerHeight, int width, int height) {

    /** Exact horizontal letterbox margin on each side when centered; may be fractional. */
    public double marginX() {
        return (outerWidth - width) / 2.0;
    }

    /** Exact vertical letterbox margin on each side when centered; may be fractional. */
    public double marginY() {
        return (outerHeight - height) / 2.0;
    }

    public Placement placement(Anchor anchor) {
        return new Placement(
                anchor.offsetX(outerWidth - width), anchor.offsetY(outerHeight - height), width, height);
    }
}
