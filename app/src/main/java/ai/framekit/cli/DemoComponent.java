package ai.framekit.cli;

import java.util.Arrays;
import java.util.stream.Collectors;
import picocli.CommandLine;

/** The demos the launcher can open, selected by component name on the command line. */
public enum DemoComponent {
    NESTED_FRAME("NestedFrame"),
    SCROLL_FRAME("ScrollFrame"),
    ASPECT_RATIO_FRAME("AspectRatioFrame");

    private final String componentName;

    DemoComponent(String componentName) {
        this.componentName = componentName;
    }

    public String componentName() {
        return componentName;
    }

    public static DemoComponent fromName(String name) {
        for (var c : values()) {
            if (c.componentName.equals(name.trim())) {
                return c;
            }
        }
        throw new CommandLine.TypeConversionException(
                "Unknown component '" + name + "', expected one of " + names());
    }

    public static String names() {
        return Arrays.stream(values()).map(DemoComponent::componentName).collect(Collectors.joining(", "));
    }

    /** picocli converter for {@code -t} values. */
    public static final class Converter implements CommandLine.ITypeConverter<DemoComponent> {
        @Override
        public DemoComponent convert(String value) {
            return fromName(value);
        }
    }
}
