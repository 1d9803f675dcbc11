package ai.framekit.gui;

import javax.swing.SwingUtilities;

public final class SwingUtil {
    private SwingUtil() {}

    /** Runs the task right away when already on the EDT, otherwise queues it there. */
    public static void runOnEdt(Runnable task) {
        if (SwingUtilities.isEventDispatchThread()) {
            task.run();
        } else {
            SwingUtilities.invokeLater(task);
        }
    }
}
