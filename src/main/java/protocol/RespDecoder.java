package protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 바이트 버퍼의 앞부분에서 RESP 값 하나를 디코딩하는 상태 없는 재귀 하강 파서.
 *
 * <p>버퍼는 임의의 조각 단위로 도착할 수 있습니다. 프레임이 덜 도착했으면
 * {@link IncompleteFrameException} 을 던지며, 호출자는 바이트를 더 읽은 뒤
 * 같은 위치부터 다시 호출하면 됩니다. bulk string payload 는 바이트 그대로 다루므로
 * 텍스트가 아닌 데이터도 안전합니다.
 */
public final class RespDecoder {

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 배열 선언 길이만 믿고 미리 할당하지 않도록 상한을 둔다
    private static final int MAX_INITIAL_ARRAY_CAPACITY = 16;

    // 재귀 하강이 스택을 넘치지 않도록 배열 중첩 깊이를 제한한다
    static final int MAX_NESTING_DEPTH = 128;

    // payload + CRLF 가 하나의 byte[] 에 들어갈 수 있는 최대 길이
    private static final long MAX_BULK_LENGTH = Integer.MAX_VALUE - 8;

    private RespDecoder() {
    }

    /**
     * 디코딩 결과: 값과 소비하지 않은 나머지의 시작 위치
     */
    public record DecodeResult(RespValue value, int nextOffset) {
    }

    public static DecodeResult decode(byte[] buffer) throws RespParseException {
        return decode(buffer, 0, buffer.length);
    }

    /**
     * buffer[offset, limit) 범위의 앞부분에서 값 하나를 디코딩합니다.
     */
    public static DecodeResult decode(byte[] buffer, int offset, int limit) throws RespParseException {
        return decode(buffer, offset, limit, 0);
    }

    private static DecodeResult decode(byte[] buffer, int offset, int limit, int depth) throws RespParseException {
        if (offset >= limit) {
            throw new InvalidFormatException("empty input");
        }

        byte type = buffer[offset];
        int start = offset + 1;
        switch (type) {
            case '+':
                return parseSimpleString(buffer, start, limit);
            case '-':
                return parseError(buffer, start, limit);
            case ':':
                return parseInteger(buffer, start, limit);
            case '$':
                return parseBulkString(buffer, start, limit);
            case '*':
                return parseArray(buffer, start, limit, depth);
            default:
                throw new InvalidFormatException("unknown type byte '" + (char) type + "'");
        }
    }

    private static DecodeResult parseSimpleString(byte[] buffer, int start, int limit) throws RespParseException {
        int lineEnd = findLineEnd(buffer, start, limit);
        String text = new String(buffer, start, lineEnd - start, StandardCharsets.UTF_8);
        return new DecodeResult(new RespValue.SimpleString(text), lineEnd + 2);
    }

    private static DecodeResult parseError(byte[] buffer, int start, int limit) throws RespParseException {
        int lineEnd = findLineEnd(buffer, start, limit);
        String text = new String(buffer, start, lineEnd - start, StandardCharsets.UTF_8);
        return new DecodeResult(new RespValue.Error(text), lineEnd + 2);
    }

    private static DecodeResult parseInteger(byte[] buffer, int start, int limit) throws RespParseException {
        int lineEnd = findLineEnd(buffer, start, limit);
        long value = parseLong(buffer, start, lineEnd);
        return new DecodeResult(new RespValue.Integer(value), lineEnd + 2);
    }

    private static DecodeResult parseBulkString(byte[] buffer, int start, int limit) throws RespParseException {
        int lineEnd = findLineEnd(buffer, start, limit);
        long length = parseLong(buffer, start, lineEnd);
        int payloadStart = lineEnd + 2;

        if (length == -1) {
            return new DecodeResult(RespValue.BulkString.NULL, payloadStart);
        }
        if (length < 0) {
            throw new InvalidFormatException("negative bulk string length: " + length);
        }
        if (length > MAX_BULK_LENGTH) {
            throw new InvalidFormatException("bulk string length too large: " + length);
        }
        if (limit - payloadStart < length + 2) {
            throw new IncompleteFrameException("bulk string payload incomplete");
        }

        int payloadEnd = payloadStart + (int) length;
        if (buffer[payloadEnd] != CR || buffer[payloadEnd + 1] != LF) {
            throw new InvalidFormatException("bulk string payload not terminated by CRLF");
        }

        byte[] data = new byte[(int) length];
        System.arraycopy(buffer, payloadStart, data, 0, data.length);
        return new DecodeResult(new RespValue.BulkString(data), payloadEnd + 2);
    }

    private static DecodeResult parseArray(byte[] buffer, int start, int limit, int depth)
            throws RespParseException {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new InvalidFormatException("array nesting deeper than " + MAX_NESTING_DEPTH);
        }
        int lineEnd = findLineEnd(buffer, start, limit);
        long count = parseLong(buffer, start, lineEnd);
        int offset = lineEnd + 2;

        if (count == -1) {
            return new DecodeResult(RespValue.Array.NULL, offset);
        }
        if (count < 0) {
            throw new InvalidFormatException("negative array length: " + count);
        }

        List<RespValue> elements = new ArrayList<>((int) Math.min(count, MAX_INITIAL_ARRAY_CAPACITY));
        for (long i = 0; i < count; i++) {
            DecodeResult element = decode(buffer, offset, limit, depth + 1);
            elements.add(element.value());
            offset = element.nextOffset();
        }
        return new DecodeResult(new RespValue.Array(elements), offset);
    }

    /**
     * start 이후 처음 나오는 CRLF 의 CR 위치를 반환합니다.
     */
    private static int findLineEnd(byte[] buffer, int start, int limit) throws IncompleteFrameException {
        for (int i = start; i + 1 < limit; i++) {
            if (buffer[i] == CR && buffer[i + 1] == LF) {
                return i;
            }
        }
        throw new IncompleteFrameException("line terminator not found");
    }

    private static long parseLong(byte[] buffer, int start, int end) throws InvalidFormatException {
        String text = new String(buffer, start, end - start, StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new InvalidFormatException("not an integer: '" + text + "'");
        }
    }
}
