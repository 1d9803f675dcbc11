package ai.framekit.frames;

import static org.junit.jupiter.api.Assertions.*;

import ai.framekit.testutil.RecordingCommands;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AspectRatioFrameTest {

    @Test
    void onResize_issuesSingleCenteredPlacement() {
        var commands = new RecordingCommands();
        var frame = new AspectRatioFrame(AspectRatioConfig.of(16, 9), commands);

        var placement = frame.onResize(1000, 400);

        assertEquals(new Placement(144, 0, 711, 400), placement);
        assertEquals(1, commands.placements().size());
        assertEquals(placement, commands.lastPlacement());
    }

    @Test
    void onResize_isIdempotent() {
        var commands = new RecordingCommands();
        var frame = new AspectRatioFrame(AspectRatioConfig.of(4, 3), commands);

        frame.onResize(801, 333);
        frame.onResize(801, 333);

        assertEquals(2, commands.placements().size());
        assertEquals(commands.placements().get(0), commands.placements().get(1));
    }

    @Test
    void onResize_withZeroSize_placesEmptyChild() {
        var commands = new RecordingCommands();
        var frame = new AspectRatioFrame(AspectRatioConfig.of(16, 9), commands);

        var placement = frame.onResize(0, 400);

        assertTrue(placement.isEmpty());
        assertEquals(0, placement.width());
        assertEquals(0, placement.height());
    }

    @ParameterizedTest
    @CsvSource({
        "N, 144, 0",
        "NE, 289, 0",
        "E, 289, 0",
        "SE, 289, 0",
        "S, 144, 0",
        "SW, 0, 0",
        "W, 0, 0",
        "NW, 0, 0",
        "CENTER, 144, 0"
    })
    void anchor_parksChildInLeftoverSpace(Anchor anchor, int x, int y) {
        var commands = new RecordingCommands();
        var frame = new AspectRatioFrame(AspectRatioConfig.of(16, 9).withAnchor(anchor), commands);

        var placement = frame.onResize(1000, 400);

        assertEquals(x, placement.x());
        assertEquals(y, placement.y());
    }

    @Test
    void anchor_appliesToLetterboxAxisToo() {
        var commands = new RecordingCommands();
        var frame = new AspectRatioFrame(AspectRatioConfig.of(2, 1).withAnchor(Anchor.S), commands);

        var placement = frame.onResize(200, 301);

        assertEquals(new Placement(0, 201, 200, 100), placement);
    }

    @Test
    void setAnchor_replacesChildForLastSize() {
        var commands = new RecordingCommands();
        var frame = new AspectRatioFrame(AspectRatioConfig.of(2, 1).withAnchor(Anchor.SE), commands);
        frame.onResize(600, 400);
        assertEquals(new Placement(0, 100, 600, 300), commands.lastPlacement());

        frame.setAnchor(Anchor.CENTER);

        assertEquals(Anchor.CENTER, frame.anchor());
        assertEquals(new Placement(0, 50, 600, 300), commands.lastPlacement());
    }

    @Test
    void setAnchor_beforeFirstResize_placesNothing() {
        var commands = new RecordingCommands();
        var frame = new AspectRatioFrame(AspectRatioConfig.of(2, 1), commands);

        frame.setAnchor(Anchor.NW);

        assertTrue(commands.placements().isEmpty());
        assertNull(frame.lastFit());
    }
}
