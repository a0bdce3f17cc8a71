package com.scidbshim.abi;

/**
 * Caller-held slot for an opaque handle passed into and out of {@link ShimClientApi}.
 *
 * <p>Calls that give up ownership of the handle clear the slot, so the caller's only
 * reference goes away together with the resource.
 *
 * @param <T> handle type
 */
public final class OpaqueRef<T> {
    private T value;

    public OpaqueRef() {
    }

    public OpaqueRef(T value) {
        this.value = value;
    }

    public static <T> OpaqueRef<T> of(T value) {
        return new OpaqueRef<>(value);
    }

    public T get() {
        return value;
    }

    public void set(T value) {
        this.value = value;
    }

    public void clear() {
        this.value = null;
    }

    public boolean isNull() {
        return value == null;
    }
}
