package flowclaim.worker.codec;

import java.util.Arrays;

/**
 * Dense 2D displacement field: one (dx, dy) vector per pixel of the reference
 * frame, stored row-major and interleaved.
 */
public final class FlowField {

    private final int width;
    private final int height;
    private final float[] data;

    public FlowField(int width, int height, float[] data) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative dimensions: " + width + "x" + height);
        }
        long expected = (long) width * height * 2;
        if (data.length != expected) {
            throw new IllegalArgumentException(
                    "Expected " + expected + " values for " + width + "x" + height + ", got " + data.length);
        }
        this.width = width;
        this.height = height;
        this.data = data.clone();
    }

    public static FlowField zeros(int width, int height) {
        return new FlowField(width, height, new float[width * height * 2]);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float dx(int x, int y) {
        return data[offset(x, y)];
    }

    public float dy(int x, int y) {
        return data[offset(x, y) + 1];
    }

    /** Copy of the interleaved (dx, dy) values. */
    public float[] toArray() {
        return data.clone();
    }

    // no copy, callers must not mutate
    float[] values() {
        return data;
    }

    private int offset(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return (y * width + x) * 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FlowField))
            return false;
        FlowField other = (FlowField) o;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "FlowField{" + width + "x" + height + '}';
    }
}
