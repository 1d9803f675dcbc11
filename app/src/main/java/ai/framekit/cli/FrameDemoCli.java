package ai.framekit.cli;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

@CommandLine.Command(
        name = "framekit-demo",
        mixinStandardHelpOptions = true,
        description = "Opens demo windows for the framekit container widgets.")
public final class FrameDemoCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(FrameDemoCli.class);

    @CommandLine.Option(
            names = {"-t", "--test"},
            required = true,
            split = ",",
            converter = DemoComponent.Converter.class,
            paramLabel = "<ComponentName>",
            description = "Demo to open: NestedFrame, ScrollFrame or AspectRatioFrame. Can be repeated.")
    private List<DemoComponent> components = new ArrayList<>();

    private final DemoLauncher launcher;

    public FrameDemoCli() {
        this(new SwingDemoLauncher());
    }

    FrameDemoCli(DemoLauncher launcher) {
        this.launcher = launcher;
    }

    public static void main(String[] args) {
        logger.info("Starting framekit demo...");
        int exitCode = new CommandLine(new FrameDemoCli()).execute(args);
        // on success the demo windows keep the EDT alive until the last one is closed
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    @Override
    public Integer call() {
        var selected = EnumSet.noneOf(DemoComponent.class);
        selected.addAll(components);
        logger.info("Launching demos: {}", selected);
        return launcher.launch(selected);
    }
}
