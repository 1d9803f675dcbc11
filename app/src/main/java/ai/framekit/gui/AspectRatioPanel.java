package ai.framekit.gui;

import ai.framekit.frames.Anchor;
import ai.framekit.frames.AspectRatioConfig;
import ai.framekit.frames.AspectRatioFrame;
import ai.framekit.frames.FrameCommands;
import ai.framekit.frames.Placement;
import java.awt.BorderLayout;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import javax.swing.JComponent;
import javax.swing.JPanel;

/**
 * Swing binding of {@link AspectRatioFrame}. The base panel has no layout manager; whenever it is
 * resized the content panel is given the largest bounds of the configured ratio.
 *
 * <p>Put {@link #getComponent()} into the surrounding layout and add widgets to {@link #getContent()}.
 */
public final class AspectRatioPanel {
    private final JPanel base = new JPanel(null);
    private final JComponent content;
    private final AspectRatioFrame frame;

    public AspectRatioPanel(AspectRatioConfig config) {
        this(config, new JPanel(new BorderLayout()));
    }

    public AspectRatioPanel(AspectRatioConfig config, JComponent content) {
        this.content = content;
        this.frame = new AspectRatioFrame(config, new ContentPlacer());
        base.add(content);
        base.addComponentListener(new ComponentAdapter() {
            @Override
            public void componentResized(ComponentEvent e) {
                handleBaseResized();
            }

            @Override
            public void componentShown(ComponentEvent e) {
                handleBaseResized();
            }
        });
    }

    /** The outer component to lay out in a parent container. */
    public JPanel getComponent() {
        return base;
    }

    /** The ratio-constrained child; add widgets here. */
    public JComponent getContent() {
        return content;
    }

    public AspectRatioFrame frame() {
        return frame;
    }

    public void setAnchor(Anchor anchor) {
        frame.setAnchor(anchor);
    }

    void handleBaseResized() {
        frame.onResize(base.getWidth(), base.getHeight());
    }

    private final class ContentPlacer implements FrameCommands {
        @Override
        public void placeChild(Placement placement) {
            content.setBounds(placement.x(), placement.y(), placement.width(), placement.height());
            content.revalidate();
            base.repaint();
        }
    }
}
