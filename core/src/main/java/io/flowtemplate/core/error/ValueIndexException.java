package io.flowtemplate.core.error;

/** Thrown when an array index is outside the bounds of the array. */
public final class ValueIndexException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    private final long index;
    private final int size;

    public ValueIndexException(long index, int size) {
        super("Index " + index + " out of bounds for collection of size " + size);
        this.index = index;
        this.size = size;
    }

    @Override
    public String detail() {
        return "Index out of bounds";
    }

    public long index() {
        return index;
    }

    public int size() {
        return size;
    }
}
