package server;

import java.util.Arrays;

/**
 * 소켓에서 읽었지만 아직 디코딩되지 않은 바이트를 모아두는 연결 전용 버퍼.
 * 스레드 안전하지 않으며 하나의 {@link ClientHandler} 만 사용합니다.
 */
public class ConnectionBuffer {

    private static final int INITIAL_CAPACITY = 512;

    private byte[] data = new byte[INITIAL_CAPACITY];
    private int size = 0;

    public void append(byte[] bytes, int offset, int length) {
        ensureCapacity(size + length);
        System.arraycopy(bytes, offset, data, size, length);
        size += length;
    }

    /**
     * 앞에서부터 count 바이트를 버리고 나머지를 앞으로 당깁니다.
     */
    public void discard(int count) {
        if (count < 0 || count > size) {
            throw new IllegalArgumentException("Cannot discard " + count + " of " + size + " bytes");
        }
        System.arraycopy(data, count, data, 0, size - count);
        size -= count;
    }

    /**
     * 내부 배열. 유효한 범위는 [0, size()) 입니다.
     */
    public byte[] array() {
        return data;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private void ensureCapacity(int required) {
        if (required < 0) {
            throw new IllegalStateException("Connection buffer overflow");
        }
        if (required > data.length) {
            int grown = Math.max(required, data.length * 2);
            data = Arrays.copyOf(data, grown < 0 ? required : grown);
        }
    }
}
