package protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RespDecoderTest {

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static RespDecoder.DecodeResult decode(String text) throws RespParseException {
        return RespDecoder.decode(bytes(text));
    }

    @Test
    void decodesSimpleString() throws Exception {
        RespDecoder.DecodeResult result = decode("+OK\r\n");
        assertEquals(new RespValue.SimpleString("OK"), result.value());
        assertEquals(5, result.nextOffset());
    }

    @Test
    void decodesErrorWithoutValidatingKind() throws Exception {
        assertEquals(new RespValue.Error("WRONGTYPE bad"), decode("-WRONGTYPE bad\r\n").value());
        assertEquals(new RespValue.Error("whatever"), decode("-whatever\r\n").value());
    }

    @Test
    void decodesSignedIntegers() throws Exception {
        assertEquals(new RespValue.Integer(1000), decode(":1000\r\n").value());
        assertEquals(new RespValue.Integer(-42), decode(":-42\r\n").value());
        assertEquals(new RespValue.Integer(Long.MAX_VALUE), decode(":9223372036854775807\r\n").value());
    }

    @Test
    void rejectsNonNumericInteger() {
        assertThrows(InvalidFormatException.class, () -> decode(":abc\r\n"));
        assertThrows(InvalidFormatException.class, () -> decode(":\r\n"));
    }

    @Test
    void decodesBulkString() throws Exception {
        RespDecoder.DecodeResult result = decode("$5\r\nhello\r\n");
        assertEquals(RespValue.BulkString.of("hello"), result.value());
        assertEquals(11, result.nextOffset());
    }

    @Test
    void decodesEmptyBulkString() throws Exception {
        assertEquals(RespValue.BulkString.of(""), decode("$0\r\n\r\n").value());
    }

    @Test
    void bulkStringPayloadMayContainCrlf() throws Exception {
        assertEquals(RespValue.BulkString.of("a\r\nb"), decode("$4\r\na\r\nb\r\n").value());
    }

    @Test
    void decodesNullBulkStringWithoutConsumingPayload() throws Exception {
        RespDecoder.DecodeResult result = decode("$-1\r\n+OK\r\n");
        assertEquals(RespValue.BulkString.NULL, result.value());
        assertEquals(5, result.nextOffset());
    }

    @Test
    void bulkStringIsBinarySafe() throws Exception {
        byte[] frame = {'$', '3', '\r', '\n', (byte) 0xff, 0x00, (byte) 0xfe, '\r', '\n'};
        RespValue.BulkString value = (RespValue.BulkString) RespDecoder.decode(frame).value();
        assertArrayEquals(new byte[]{(byte) 0xff, 0x00, (byte) 0xfe}, value.data());
    }

    @Test
    void bulkStringLengthCountsBytesNotCharacters() throws Exception {
        // "é" is two bytes in UTF-8
        assertEquals(RespValue.BulkString.of("é"), decode("$2\r\né\r\n").value());
    }

    @Test
    void incompleteBulkStringPayload() {
        assertThrows(IncompleteFrameException.class, () -> decode("$5\r\nhel"));
        assertThrows(IncompleteFrameException.class, () -> decode("$5\r\nhello"));
        assertThrows(IncompleteFrameException.class, () -> decode("$5\r\nhello\r"));
    }

    @Test
    void bulkStringWithoutTerminatorIsInvalid() {
        assertThrows(InvalidFormatException.class, () -> decode("$3\r\nhelloo\r\n"));
    }

    @Test
    void rejectsMalformedBulkLength() {
        assertThrows(InvalidFormatException.class, () -> decode("$x\r\nabc\r\n"));
        assertThrows(InvalidFormatException.class, () -> decode("$-2\r\n"));
    }

    @Test
    void decodesArrayOfBulkStrings() throws Exception {
        RespValue value = decode("*2\r\n$4\r\nECHO\r\n$3\r\nfoo\r\n").value();
        assertEquals(RespValue.Array.of(RespValue.BulkString.of("ECHO"), RespValue.BulkString.of("foo")), value);
    }

    @Test
    void decodesNestedMixedArray() throws Exception {
        RespValue value = decode("*3\r\n:1\r\n*2\r\n+a\r\n-b\r\n$-1\r\n").value();
        RespValue expected = RespValue.Array.of(
                new RespValue.Integer(1),
                RespValue.Array.of(new RespValue.SimpleString("a"), new RespValue.Error("b")),
                RespValue.BulkString.NULL);
        assertEquals(expected, value);
    }

    @Test
    void nullArrayIsDistinctFromEmptyArray() throws Exception {
        RespValue nullArray = decode("*-1\r\n").value();
        RespValue emptyArray = decode("*0\r\n").value();

        assertTrue(((RespValue.Array) nullArray).isNull());
        assertEquals(new RespValue.Array(List.of()), emptyArray);
        assertNotEquals(nullArray, emptyArray);
    }

    @Test
    void incompleteArrayElements() {
        assertThrows(IncompleteFrameException.class, () -> decode("*2\r\n$4\r\nECHO\r\n"));
        assertThrows(IncompleteFrameException.class, () -> decode("*1\r\n$4\r\nPI"));
        assertThrows(IncompleteFrameException.class, () -> decode("*1"));
    }

    @Test
    void invalidNestedElementPropagates() {
        assertThrows(InvalidFormatException.class, () -> decode("*2\r\n$4\r\nECHO\r\n?oops\r\n"));
    }

    @Test
    void incompleteHeaderLines() {
        assertThrows(IncompleteFrameException.class, () -> decode("+OK"));
        assertThrows(IncompleteFrameException.class, () -> decode("-ERR\r"));
        assertThrows(IncompleteFrameException.class, () -> decode(":12"));
        assertThrows(IncompleteFrameException.class, () -> decode("$"));
    }

    @Test
    void rejectsUnknownTypeByteAndEmptyInput() {
        assertThrows(InvalidFormatException.class, () -> decode("PING\r\n"));
        assertThrows(InvalidFormatException.class, () -> decode(""));
    }

    @Test
    void leavesRemainderForNextFrame() throws Exception {
        byte[] buffer = bytes("+first\r\n+second\r\n");
        RespDecoder.DecodeResult first = RespDecoder.decode(buffer);
        RespDecoder.DecodeResult second = RespDecoder.decode(buffer, first.nextOffset(), buffer.length);

        assertEquals(new RespValue.SimpleString("first"), first.value());
        assertEquals(new RespValue.SimpleString("second"), second.value());
        assertEquals(buffer.length, second.nextOffset());
    }

    @Test
    void respectsLimit() {
        byte[] buffer = bytes("+OK\r\n");
        assertThrows(IncompleteFrameException.class, () -> RespDecoder.decode(buffer, 0, 4));
    }

    @Test
    void acceptsNestingUpToLimit() throws Exception {
        String frame = "*1\r\n".repeat(RespDecoder.MAX_NESTING_DEPTH) + "+x\r\n";
        RespValue value = decode(frame).value();
        for (int i = 0; i < RespDecoder.MAX_NESTING_DEPTH; i++) {
            value = ((RespValue.Array) value).get(0);
        }
        assertEquals(new RespValue.SimpleString("x"), value);
    }

    @Test
    void rejectsNestingBeyondLimit() {
        String tooDeep = "*1\r\n".repeat(RespDecoder.MAX_NESTING_DEPTH + 1) + "+x\r\n";
        assertThrows(InvalidFormatException.class, () -> decode(tooDeep));

        String veryDeep = "*1\r\n".repeat(200_000) + "+x\r\n";
        assertThrows(InvalidFormatException.class, () -> decode(veryDeep));
    }

    @Test
    void deepNestingIsRejectedBeforeFrameIsComplete() {
        String partial = "*1\r\n".repeat(RespDecoder.MAX_NESTING_DEPTH + 1);
        assertThrows(InvalidFormatException.class, () -> decode(partial));
    }
}
