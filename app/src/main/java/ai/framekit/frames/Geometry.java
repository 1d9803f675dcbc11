package ai.framekit.frames;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Pixel arithmetic shared by the frames.
 *
 * <p>Rounding rule: fractional sizes are floored to whole pixels after adding {@link #EPSILON}, so a
 * value such as {@code 799.9999999} produced by floating-point error counts as {@code 800}. Flooring
 * guarantees a rendered box never grows past the space it was fitted into.
 */
public final class Geometry {
    private static final Logger logger = LogManager.getLogger(Geometry.class);

    static final double EPSILON = 1e-9;

    private Geometry() {}

    /** Clamps a size reported by the toolkit to a finite, non-negative value. */
    public static double sanitize(double size) {
        if (Double.isNaN(size) || Double.isInfinite(size) || size < 0) {
            logger.debug("Clamping invalid size {} to 0", size);
            return 0;
        }
        return size;
    }

    /** Floors a non-negative size to whole pixels using the rounding rule above. */
    public static int floorPixels(double size) {
        double clean = sanitize(size);
        if (clean >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.floor(clean + EPSILON);
    }

    /** Clamps {@code value} into {@code [0, max(0, limit)]}. */
    public static int clampOffset(long value, int limit) {
        int upper = Math.max(0, limit);
        if (value < 0) {
            return 0;
        }
        return value > upper ? upper : (int) value;
    }
}
