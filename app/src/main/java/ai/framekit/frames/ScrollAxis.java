package ai.framekit.frames;

public enum ScrollAxis {
    HORIZONTAL,
    VERTICAL
}
