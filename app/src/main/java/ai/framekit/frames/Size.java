package ai.framekit.frames;

public record Size(int width, int height) {}
