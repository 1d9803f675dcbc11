package ai.framekit.cli;

import ai.framekit.gui.SwingUtil;
import java.awt.GraphicsEnvironment;
import java.util.Set;
import javax.swing.JFrame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Opens each selected demo in its own window on the EDT. */
final class SwingDemoLauncher implements DemoLauncher {
    private static final Logger logger = LogManager.getLogger(SwingDemoLauncher.class);

    @Override
    public int launch(Set<DemoComponent> components) {
        if (GraphicsEnvironment.isHeadless()) {
            logger.error("Cannot open demo windows: no display available");
            System.err.println("Error: no display available for the demo windows.");
            return 1;
        }
        SwingUtil.runOnEdt(() -> components.forEach(SwingDemoLauncher::show));
        return 0;
    }

    private static void show(DemoComponent component) {
        JFrame window = switch (component) {
            case NESTED_FRAME -> FrameDemos.nestedFrameDemo();
            case SCROLL_FRAME -> FrameDemos.scrollFrameDemo();
            case ASPECT_RATIO_FRAME -> FrameDemos.aspectRatioFrameDemo();
        };
        window.setDefaultCloseOperation(JFrame.DISPOSE_ON_CLOSE);
        window.setLocationByPlatform(true);
        window.setVisible(true);
        logger.debug("Opened {} demo", component.componentName());
    }
}
