package ai.framekit.frames;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.Container;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import javax.swing.JLabel;
import javax.swing.JPanel;
import org.junit.jupiter.api.Test;

class NestedFrameTest {

    @Test
    void scopes_parentWidgetsToTheirContainer() {
        var root = new JPanel();
        var nested = new NestedFrame(NestedFrameConfig.under(root));

        JLabel x;
        JLabel x1;
        JLabel y;
        Container outerContainer;
        Container innerContainer;
        try (var outer = nested.enter()) {
            outerContainer = outer.container();
            x = nested.add(new JLabel("x"));
            try (var inner = nested.enter()) {
                innerContainer = inner.container();
                x1 = nested.add(new JLabel("x1"));
                assertSame(outerContainer, inner.parent());
            }
            y = nested.add(new JLabel("y"));
        }

        assertSame(root, outerContainer.getParent());
        assertSame(outerContainer, innerContainer.getParent());
        assertSame(outerContainer, x.getParent());
        assertSame(innerContainer, x1.getParent());
        assertSame(outerContainer, y.getParent());
        assertEquals(0, nested.depth());
        assertTrue(nested.stack().isEmpty());
        assertSame(root, nested.currentParent());
    }

    @Test
    void withoutParent_createsFreshRoot() {
        var nested = new NestedFrame(NestedFrameConfig.newRoot());

        try (var scope = nested.enter()) {
            assertSame(nested.root(), scope.parent());
        }

        assertNotNull(nested.root());
        assertEquals(1, nested.root().getComponentCount());
    }

    @Test
    void exceptionInsideScope_stillPopsStack() {
        var nested = new NestedFrame(NestedFrameConfig.newRoot());

        var thrown = assertThrows(IllegalStateException.class, () -> {
            try (var outer = nested.enter()) {
                try (var inner = nested.enter()) {
                    nested.add(new JLabel("boom"));
                    throw new IllegalStateException("construction failed");
                }
            }
        });

        assertEquals("construction failed", thrown.getMessage());
        assertEquals(0, nested.depth());
    }

    @Test
    void exitOnEmptyStack_isUnderflow() {
        var nested = new NestedFrame(NestedFrameConfig.newRoot());

        assertThrows(ParentStackUnderflowException.class, nested::exit);
    }

    @Test
    void manualEnterExit_balances() {
        var nested = new NestedFrame(NestedFrameConfig.newRoot());
        var scope = nested.enter();
        nested.enter();

        nested.exit();
        var popped = nested.exit();

        assertSame(scope.container(), popped);
        assertEquals(0, nested.depth());
        assertThrows(ParentStackUnderflowException.class, nested::exit);
    }

    @Test
    void closingTwice_popsOnce() {
        var nested = new NestedFrame(NestedFrameConfig.newRoot());
        var outer = nested.enter();
        var inner = nested.enter();

        inner.close();
        inner.close();

        assertEquals(1, nested.depth());
        assertTrue(inner.isClosed());
        outer.close();
        assertEquals(0, nested.depth());
    }

    @Test
    void closingOuterScope_unwindsInnerScopesLeftOpen() {
        var nested = new NestedFrame(NestedFrameConfig.newRoot());
        var outer = nested.enter();
        nested.enter();
        nested.enter();

        outer.close();

        assertEquals(0, nested.depth());
    }

    @Test
    void closingScopeAlreadyExited_doesNotPopOthers() {
        var nested = new NestedFrame(NestedFrameConfig.newRoot());
        var outer = nested.enter();
        var inner = nested.enter();
        nested.exit();

        inner.close();

        assertEquals(1, nested.depth());
        assertSame(outer.container(), nested.currentParent());
        outer.close();
    }

    @Test
    void enterExistingContainer_attachesOnlyWhenUnparented() {
        var root = new JPanel();
        var nested = new NestedFrame(NestedFrameConfig.under(root));
        var elsewhere = new JPanel();
        var alreadyPlaced = new JPanel();
        elsewhere.add(alreadyPlaced);
        var loose = new JPanel();

        try (var a = nested.enter(loose)) {
            nested.add(new JLabel("a"));
        }
        try (var b = nested.enter(alreadyPlaced)) {
            var label = nested.add(new JLabel("b"));
            assertSame(alreadyPlaced, label.getParent());
        }

        assertSame(root, loose.getParent());
        assertSame(elsewhere, alreadyPlaced.getParent());
    }

    @Test
    void customContainerFactory_isUsed() {
        var created = new ArrayList<JPanel>();
        var nested = new NestedFrame(NestedFrameConfig.newRoot(), () -> {
            var panel = new JPanel();
            created.add(panel);
            return panel;
        });

        try (var scope = nested.enter()) {
            assertSame(created.get(0), scope.container());
        }
        assertEquals(1, created.size());
    }

    @Test
    void randomBalancedSequences_leaveEmptyStackAndCorrectParents() {
        var random = new Random(3);
        for (int run = 0; run < 200; run++) {
            var root = new JPanel();
            var nested = new NestedFrame(NestedFrameConfig.under(root));
            var open = new ArrayList<Container>();
            var placed = new ArrayList<JLabel>();
            var expectedParents = new ArrayList<Container>();
            for (int step = 0; step < 60; step++) {
                int op = random.nextInt(3);
                if (op == 0) {
                    open.add(nested.enter().container());
                } else if (op == 1 && !open.isEmpty()) {
                    assertSame(open.remove(open.size() - 1), nested.exit());
                } else {
                    placed.add(nested.add(new JLabel()));
                    expectedParents.add(open.isEmpty() ? root : open.get(open.size() - 1));
                }
            }
            while (!open.isEmpty()) {
                assertSame(open.remove(open.size() - 1), nested.exit());
            }

            assertTrue(nested.stack().isEmpty());
            for (int i = 0; i < placed.size(); i++) {
                assertSame(expectedParents.get(i), placed.get(i).getParent());
            }
        }
    }

    @Test
    void stackSnapshot_listsTopFirst() {
        var nested = new NestedFrame(NestedFrameConfig.newRoot());
        try (var outer = nested.enter();
                var inner = nested.enter()) {
            assertEquals(List.of(inner.container(), outer.container()), nested.stack().snapshot());
        }
    }

    @Test
    void staleScope_doesNotCloseLaterScopeOfSameContainer() {
        var nested = new NestedFrame(NestedFrameConfig.newRoot());
        var panel = new JPanel();
        var first = nested.enter(panel);
        nested.exit();
        var second = nested.enter(panel);

        first.close();

        assertEquals(1, nested.depth());
        assertFalse(second.isClosed());
        assertSame(panel, nested.currentParent());
        second.close();
        assertEquals(0, nested.depth());
    }

    @Test
    void describe_usesNameOrTypeAndIdentity() {
        var unnamed = new JPanel();
        var named = new JPanel();
        named.setName("toolbar");

        assertTrue(NestedFrame.describe(unnamed).startsWith("JPanel@"), NestedFrame.describe(unnamed));
        assertEquals("toolbar", NestedFrame.describe(named));
    }
}
