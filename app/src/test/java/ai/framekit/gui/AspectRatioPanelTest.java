package ai.framekit.gui;

import static ai.framekit.testutil.EdtTestUtil.onEdt;
import static org.junit.jupiter.api.Assertions.*;

import ai.framekit.frames.Anchor;
import ai.framekit.frames.AspectRatioConfig;
import java.awt.Rectangle;
import javax.swing.JLabel;
import org.junit.jupiter.api.Test;

class AspectRatioPanelTest {

    @Test
    void baseResize_constrainsContentBounds() throws Exception {
        onEdt(() -> {
            var panel = new AspectRatioPanel(AspectRatioConfig.of(16, 9));
            panel.getComponent().setSize(1000, 400);

            panel.handleBaseResized();

            assertEquals(new Rectangle(144, 0, 711, 400), panel.getContent().getBounds());
        });
    }

    @Test
    void baseResize_letterboxesTallWindows() throws Exception {
        onEdt(() -> {
            var panel = new AspectRatioPanel(AspectRatioConfig.of(2, 1));
            panel.getComponent().setSize(600, 900);

            panel.handleBaseResized();

            assertEquals(new Rectangle(0, 300, 600, 300), panel.getContent().getBounds());
        });
    }

    @Test
    void setAnchor_movesContent() throws Exception {
        onEdt(() -> {
            var panel = new AspectRatioPanel(AspectRatioConfig.of(2, 1));
            panel.getComponent().setSize(600, 400);
            panel.handleBaseResized();

            panel.setAnchor(Anchor.NW);

            assertEquals(new Rectangle(0, 0, 600, 300), panel.getContent().getBounds());
        });
    }

    @Test
    void contentIsOnlyChildOfBase() throws Exception {
        onEdt(() -> {
            var panel = new AspectRatioPanel(AspectRatioConfig.of(1, 1));
            var label = new JLabel("inner");
            panel.getContent().add(label);

            assertEquals(1, panel.getComponent().getComponentCount());
            assertSame(panel.getComponent(), panel.getContent().getParent());
            assertSame(panel.getContent(), label.getParent());
        });
    }
}
