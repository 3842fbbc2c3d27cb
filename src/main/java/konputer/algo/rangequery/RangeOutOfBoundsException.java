package konputer.algo.rangequery;

/**
 * Thrown when a query range or update position falls outside {@code [0, size - 1]},
 * or when a query range is inverted.
 */
public class RangeOutOfBoundsException extends IndexOutOfBoundsException {

    public RangeOutOfBoundsException(String message) {
        super(message);
    }

    static RangeOutOfBoundsException forRange(int l, int r, int size) {
        return new RangeOutOfBoundsException(
                "Range [" + l + ", " + r + "] is out of bounds for size " + size);
    }

    static RangeOutOfBoundsException forPosition(int pos, int size) {
        return new RangeOutOfBoundsException(
                "Position " + pos + " is out of bounds for size " + size);
    }
}
