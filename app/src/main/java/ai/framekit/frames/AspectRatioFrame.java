package ai.framekit.frames;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps its single child at a fixed aspect ratio. On every resize of the outer container the child
 * gets the largest box of that ratio that fits, parked at the configured {@link Anchor}.
 */
public final class AspectRatioFrame {
    private static final Logger logger = LogManager.getLogger(AspectRatioFrame.class);

    private final AspectConstraint constraint;
    private final FrameCommands commands;
    private Anchor anchor;

    @Nullable
    private AspectFit lastFit;

    public AspectRatioFrame(AspectRatioConfig config, FrameCommands commands) {
        this.constraint = config.constraint();
        this.anchor = config.anchor();
        this.commands = commands;
    }

    /** Refits the child into the new outer size and issues a single placement command. */
    public Placement onResize(double outerWidth, double outerHeight) {
        var fit = constraint.fit(outerWidth, outerHeight);
        lastFit = fit;
        return place(fit);
    }

    /** Changes the anchor and re-places the child for the last known outer size, if any. */
    public void setAnchor(Anchor anchor) {
        this.anchor = anchor;
        if (lastFit != null) {
            place(lastFit);
        }
    }

    public Anchor anchor() {
        return anchor;
    }

    public AspectConstraint constraint() {
        return constraint;
    }

    /** The most recent fit, or null before the first resize. */
    @Nullable
    public AspectFit lastFit() {
        return lastFit;
    }

    private Placement place(AspectFit fit) {
        var placement = fit.placement(anchor);
        logger.debug(
                "Fitted {}:{} into {}x{} -> {}",
                constraint.ratioWidth(),
                constraint.ratioHeight(),
                fit.outerWidth(),
                fit.outerHeight(),
                placement);
        commands.placeChild(placement);
        return placement;
    }
}
