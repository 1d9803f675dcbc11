package ai.framekit.cli;

import ai.framekit.frames.Anchor;
import ai.framekit.frames.AspectRatioConfig;
import ai.framekit.frames.NestedFrame;
import ai.framekit.frames.NestedFrameConfig;
import ai.framekit.frames.ScrollFrameConfig;
import ai.framekit.gui.AspectRatioPanel;
import ai.framekit.gui.ScrollPanel;
import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.Container;
import java.awt.Dimension;
import java.awt.FlowLayout;
import java.awt.GridLayout;
import javax.swing.BoxLayout;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JPanel;

/** Demo windows for the three frames. The {@code build*} methods fill a given root and are headless-safe. */
final class FrameDemos {
    static final int SCROLL_DEMO_ENTRIES = 20;

    private FrameDemos() {}

    /** The pieces of the scroll demo a caller may want to poke at. */
    record ScrollDemo(NestedFrame nested, ScrollPanel scroll, JButton addButton) {}

    static JFrame nestedFrameDemo() {
        var window = new JFrame("NestedFrame-Test");
        buildNestedFrameDemo(window.getContentPane());
        window.pack();
        return window;
    }

    static JFrame scrollFrameDemo() {
        var window = new JFrame("ScrollFrame-Test");
        buildScrollFrameDemo(window.getContentPane());
        window.pack();
        return window;
    }

    static JFrame aspectRatioFrameDemo() {
        var window = new JFrame("AspectRatioFrame-Test");
        buildAspectRatioFrameDemo(window.getContentPane());
        window.setSize(600, 400);
        return window;
    }

    static NestedFrame buildNestedFrameDemo(Container root) {
        root.setLayout(new BorderLayout());
        var nested = new NestedFrame(NestedFrameConfig.under(root), FrameDemos::column);
        try (var outer = nested.enter()) {
            outer.container().setBackground(Color.BLUE);
            try (var x = nested.enter()) {
                nested.add(label("x"));
                try (var x1 = nested.enter()) {
                    nested.add(label("x1"));
                }
            }
            // back two levels
            try (var x2 = nested.enter()) {
                nested.add(label("x2"));
            }
            try (var grid = nested.enter(new JPanel(new GridLayout(3, 3)))) {
                grid.container().setBackground(Color.RED);
                nested.add(label("y"));
                for (int i = 0; i < 7; i++) {
                    nested.add(new JLabel());
                }
                try (var cell = nested.enter(new JPanel(new FlowLayout(FlowLayout.LEFT)))) {
                    nested.add(label("y1"));
                    nested.add(label("y2"));
                }
            }
            try (var z = nested.enter()) {
                nested.add(label("z"));
            }
        }
        return nested;
    }

    static ScrollDemo buildScrollFrameDemo(Container root) {
        root.setLayout(new BoxLayout(root, BoxLayout.Y_AXIS));
        var nested = new NestedFrame(NestedFrameConfig.under(root), FrameDemos::column);
        var scroll = new ScrollPanel(ScrollFrameConfig.defaults().withMaxSize(500, 150));
        try (var outer = nested.enter()) {
            try (var a = nested.enter()) {
                try (var b = nested.enter()) {
                    nested.add(label("nested"));
                }
            }
            nested.add(scroll.getComponent());
            try (var content = nested.enter(scroll.getContent())) {
                for (int i = 0; i < SCROLL_DEMO_ENTRIES; i++) {
                    nested.add(entry(i));
                }
            }
        }

        nested.add(label("x"));
        var addButton = nested.add(new JButton("Add list entry"));
        int[] next = {100};
        addButton.addActionListener(e -> {
            scroll.getContent().add(entry(next[0]++));
            scroll.getComponent().revalidate();
        });
        scroll.getViewport().setBackground(Color.GRAY);
        return new ScrollDemo(nested, scroll, addButton);
    }

    static AspectRatioPanel buildAspectRatioFrameDemo(Container root) {
        root.setLayout(new BorderLayout());
        var nested = new NestedFrame(NestedFrameConfig.under(root), FrameDemos::column);
        var aspect = new AspectRatioPanel(AspectRatioConfig.of(2.0, 1.0).withAnchor(Anchor.SE));
        aspect.getContent().setBackground(Color.BLUE);
        try (var outer = nested.enter(new JPanel(new BorderLayout()))) {
            nested.add(aspect.getComponent(), BorderLayout.CENTER);
            aspect.setAnchor(Anchor.CENTER);
            try (var inner = nested.enter(aspect.getContent())) {
                nested.add(label("inner content"), BorderLayout.NORTH);
            }
        }
        nested.add(label("outer content"), BorderLayout.SOUTH);
        return aspect;
    }

    private static JPanel column() {
        var panel = new JPanel();
        panel.setLayout(new BoxLayout(panel, BoxLayout.Y_AXIS));
        return panel;
    }

    private static JLabel label(String text) {
        var label = new JLabel(text);
        label.setOpaque(true);
        label.setBackground(Color.YELLOW);
        label.setPreferredSize(new Dimension(72, 20));
        return label;
    }

    private static JCheckBox entry(int i) {
        var box = new JCheckBox("*".repeat(50) + i);
        box.setBackground(new Color(173, 216, 230));
        return box;
    }
}
