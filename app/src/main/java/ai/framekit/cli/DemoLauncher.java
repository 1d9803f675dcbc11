package ai.framekit.cli;

import java.util.Set;

/** Opens the selected demos. Returns the process exit code. */
public interface DemoLauncher {
    int launch(Set<DemoComponent> components);
}
