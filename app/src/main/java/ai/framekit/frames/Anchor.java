package ai.framekit.frames;

/**
 * Where a fitted child sits inside the space left over by the aspect-ratio constraint. Compass
 * points name the side (or corner) the child is pushed against; {@link #CENTER} splits the leftover
 * space evenly.
 */
public enum Anchor {
    N(0.5, 0.0),
    NE(1.0, 0.0),
    E(1.0, 0.5),
    SE(1.0, 1.0),
    S(0.5, 1.0),
    SW(0.0, 1.0),
    W(0.0, 0.5),
    NW(0.0, 0.0),
    CENTER(0.5, 0.5);

    private final double horizontalWeight;
    private final double verticalWeight;

    Anchor(double horizontalWeight, double verticalWeight) {
        this.horizontalWeight = horizontalWeight;
        this.verticalWeight = verticalWeight;
    }

    /** Left offset for a child leaving {@code leftoverWidth} pixels unused. Fractions are floored. */
    public int offsetX(int leftoverWidth) {
        return (int) Math.floor(leftoverWidth * horizontalWeight);
    }

    /** Top offset for a child leaving {@code leftoverHeight} pixels unused. Fractions are floored. */
    public int offsetY(int leftoverHeight) {
        return (int) Math.floor(leftoverHeight * verticalWeight);
    }
}
