package protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * RESP 프로토콜로 디코딩된 값 (simple string, error, integer, bulk string, array)
 */
public interface RespValue {

    /**
     * {@code +text\r\n}
     */
    record SimpleString(String value) implements RespValue {
    }

    /**
     * {@code -text\r\n}. 첫 토큰은 관례상 에러 종류(ERR, WRONGTYPE 등)입니다.
     */
    record Error(String message) implements RespValue {
    }

    /**
     * {@code :n\r\n}
     */
    record Integer(long value) implements RespValue {
    }

    /**
     * {@code $len\r\n<data>\r\n}. data 가 null 이면 null bulk string ({@code $-1\r\n}) 입니다.
     */
    record BulkString(byte[] data) implements RespValue {

        public static final BulkString NULL = new BulkString(null);

        public static BulkString of(String value) {
            return new BulkString(value.getBytes(StandardCharsets.UTF_8));
        }

        public boolean isNull() {
            return data == null;
        }

        /**
         * payload 를 UTF-8 문자열로 반환합니다. null bulk string 이면 null.
         */
        public String asString() {
            return data == null ? null : new String(data, StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BulkString)) return false;
            return Arrays.equals(data, ((BulkString) o).data);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return isNull() ? "BulkString[null]" : "BulkString[" + asString() + "]";
        }
    }

    /**
     * {@code *n\r\n<elements>}. elements 가 null 이면 null array ({@code *-1\r\n}) 이며,
     * 빈 배열({@code *0\r\n})과는 구분됩니다.
     */
    record Array(List<RespValue> elements) implements RespValue {

        public static final Array NULL = new Array(null);

        public Array {
            if (elements != null) {
                elements = Collections.unmodifiableList(elements);
            }
        }

        public static Array of(RespValue... elements) {
            return new Array(Arrays.asList(elements));
        }

        public boolean isNull() {
            return elements == null;
        }

        public int size() {
            return elements == null ? 0 : elements.size();
        }

        /**
         * index 위치의 원소. 범위를 벗어나면 null.
         */
        public RespValue get(int index) {
            if (elements == null || index < 0 || index >= elements.size()) {
                return null;
            }
            return elements.get(index);
        }
    }
}
