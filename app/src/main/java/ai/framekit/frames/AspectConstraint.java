package ai.framekit.frames;

/**
 * A fixed width:height ratio. Both terms must be positive and finite.
 *
 * <p>{@link #fit} returns the largest box of this ratio inside an outer box, using the pixel rounding
 * rule documented on {@link Geometry}: the constrained dimension is floored, so the box never exceeds
 * the outer bounds and its ratio is off by less than one pixel in the constrained dimension.
 */
public record AspectConstraint(double ratioWidth, double ratioHeight) {

    public AspectConstraint {
        if (!isPositiveFinite(ratioWidth) || !isPositiveFinite(ratioHeight)) {
            throw new IllegalArgumentException(
                    "Aspect ratio terms must be positive and finite, got " + ratioWidth + ":" + ratioHeight);
        }
    }

    public AspectFit fit(double outerWidth, double outerHeight) {
        int outerW = Geometry.floorPixels(outerWidth);
        int outerH = Geometry.floorPixels(outerHeight);
        if (outerW == 0 || outerH == 0) {
            return new AspectFit(outerW, outerH, 0, 0);
        }

        int width;
        int height;
        double candidateWidth = outerH * ratioWidth / ratioHeight;
        if (candidateWidth <= outerW) {
            width = Geometry.floorPixels(candidateWidth);
            height = outerH;
        } else {
            width = outerW;
            height = Geometry.floorPixels(outerW * ratioHeight / ratioWidth);
        }

        // A box this thin has no meaningful ratio left
        if (width == 0 || height == 0) {
            return new AspectFit(outerW, outerH, 0, 0);
        }
        return new AspectFit(outerW, outerH, width, height);
    }

    private static boolean isPositiveFinite(double v) {
        return v > 0 && !Double.isInfinite(v) && !Double.isNaN(v);
    }
}
