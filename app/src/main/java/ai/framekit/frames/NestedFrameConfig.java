package ai.framekit.frames;

import java.awt.Container;
import org.jetbrains.annotations.Nullable;

/**
 * Construction-time settings of a {@link NestedFrame}.
 *
 * @param parent root that outermost scopes attach to, or null to create a fresh root panel
 */
public record NestedFrameConfig(@Nullable Container parent) {

    public static NestedFrameConfig newRoot() {
        return new NestedFrameConfig(null);
    }

    public static NestedFrameConfig under(Container parent) {
        return new NestedFrameConfig(parent);
    }
}
