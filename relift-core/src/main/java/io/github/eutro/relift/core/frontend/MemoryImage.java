package io.github.eutro.relift.core.frontend;

/**
 * Read-only access to the loaded bytes of the program, used to recover jump tables.
 */
public interface MemoryImage {
    /**
     * Check whether {@code size} bytes at {@code address} are mapped.
     *
     * @param address The address.
     * @param size    The number of bytes.
     * @return Whether they can be read.
     */
    boolean contains(long address, int size);

    /**
     * Read a little-endian unsigned integer.
     *
     * @param address The address.
     * @param size    The number of bytes, at most 8.
     * @return The value, zero-extended.
     * @throws IndexOutOfBoundsException If the bytes are not mapped.
     */
    long read(long address, int size);

    /**
     * Create an image of a single contiguous region.
     *
     * @param base  The address of the first byte.
     * @param bytes The bytes. These are not copied.
     * @return The image.
     */
    static MemoryImage ofBytes(long base, byte[] bytes) {
        return new MemoryImage() {
            @Override
            public boolean contains(long address, int size) {
                return address >= base && size >= 0 && address - base + size <= bytes.length;
            }

            @Override
            public long read(long address, int size) {
                if (!contains(address, size)) {
                    throw new IndexOutOfBoundsException(String.format("0x%x:%d is not mapped", address, size));
                }
                int start = (int) (address - base);
                long value = 0;
                for (int i = size - 1; i >= 0; i--) {
                    value = (value << 8) | (bytes[start + i] & 0xFF);
                }
                return value;
            }
        };
    }
}
