package ai.framekit.frames;

import java.util.Objects;

/** Construction-time settings of an {@link AspectRatioFrame}. */
public record AspectRatioConfig(AspectConstraint constraint, Anchor anchor) {

    public AspectRatioConfig {
        Objects.requireNonNull(constraint, "constraint");
        Objects.requireNonNull(anchor, "anchor");
    }

    /** A centered frame keeping {@code ratioWidth:ratioHeight}. */
    public static AspectRatioConfig of(double ratioWidth, double ratioHeight) {
        return new AspectRatioConfig(new AspectConstraint(ratioWidth, ratioHeight), Anchor.CENTER);
    }

    public AspectRatioConfig withAnchor(Anchor anchor) {
        return new AspectRatioConfig(constraint, anchor);
    }
}
