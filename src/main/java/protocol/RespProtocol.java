package protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Redis RESP 응답 생성과 인코딩을 담당하는 클래스
 */
public class RespProtocol {

    private static final byte[] CRLF = {'\r', '\n'};

    public static final RespValue PONG_RESPONSE = createSimpleString("PONG");
    public static final RespValue OK_RESPONSE = createSimpleString("OK");
    public static final RespValue PROTOCOL_ERROR_RESPONSE = createErrorResponse("protocol error");

    /**
     * RespValue 를 RESP 와이어 형식의 바이트로 인코딩합니다.
     */
    public static byte[] encode(RespValue value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeValue(out, value);
        return out.toByteArray();
    }

    private static void writeValue(ByteArrayOutputStream out, RespValue value) {
        if (value instanceof RespValue.SimpleString) {
            writeLine(out, '+', ((RespValue.SimpleString) value).value());
        } else if (value instanceof RespValue.Error) {
            writeLine(out, '-', ((RespValue.Error) value).message());
        } else if (value instanceof RespValue.Integer) {
            writeLine(out, ':', Long.toString(((RespValue.Integer) value).value()));
        } else if (value instanceof RespValue.BulkString) {
            RespValue.BulkString bulk = (RespValue.BulkString) value;
            if (bulk.isNull()) {
                writeLine(out, '$', "-1");
                return;
            }
            writeLine(out, '$', Integer.toString(bulk.data().length));
            out.writeBytes(bulk.data());
            out.writeBytes(CRLF);
        } else if (value instanceof RespValue.Array) {
            RespValue.Array array = (RespValue.Array) value;
            if (array.isNull()) {
                writeLine(out, '*', "-1");
                return;
            }
            writeLine(out, '*', Integer.toString(array.size()));
            for (RespValue element : array.elements()) {
                writeValue(out, element);
            }
        } else {
            throw new IllegalArgumentException("Unsupported RESP value: " + value);
        }
    }

    private static void writeLine(ByteArrayOutputStream out, char type, String text) {
        out.write(type);
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    /**
     * RESP bulk string 을 생성합니다. value 가 null 이면 null bulk string.
     */
    public static RespValue createBulkString(byte[] value) {
        if (value == null) {
            return createNullBulkString();
        }
        return new RespValue.BulkString(value);
    }

    public static RespValue createNullBulkString() {
        return RespValue.BulkString.NULL;
    }

    /**
     * 에러 메시지를 RESP 형식으로 생성합니다.
     */
    public static RespValue createErrorResponse(String message) {
        return new RespValue.Error("ERR " + singleLine(message));
    }

    /**
     * 단순 문자열 응답을 생성합니다.
     */
    public static RespValue createSimpleString(String value) {
        return new RespValue.SimpleString(singleLine(value));
    }

    /**
     * status/error 한 줄 안에 CR, LF 가 섞여 응답이 둘로 쪼개지지 않도록 공백으로 바꿉니다.
     */
    private static String singleLine(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }
}
