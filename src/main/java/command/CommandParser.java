package command;

import protocol.InvalidFormatException;
import protocol.RespValue;

import java.util.Locale;

/**
 * 디코딩된 RESP 값을 타입이 있는 {@link Command} 로 변환합니다.
 * 명령어는 첫 원소가 bulk string 인 배열이어야 합니다.
 */
public final class CommandParser {

    private CommandParser() {
    }

    public static Command parse(RespValue value) throws InvalidFormatException {
        if (!(value instanceof RespValue.Array)) {
            throw new InvalidFormatException("command must be an array");
        }
        RespValue.Array items = (RespValue.Array) value;

        RespValue.BulkString nameValue = bulkString(items, 0);
        if (nameValue == null) {
            throw new InvalidFormatException("command name must be a bulk string");
        }
        String name = nameValue.asString();

        switch (name.toUpperCase(Locale.ROOT)) {
            case "PING":
                RespValue.BulkString message = bulkString(items, 1);
                return new PingCommand(message == null ? null : message.asString());
            case "ECHO":
                return new EchoCommand(requireBulkString(items, 1, "ECHO message"));
            case "GET":
                return new GetCommand(requireBulkString(items, 1, "GET key"));
            case "SET":
                return parseSet(items);
            default:
                return new UnknownCommand(name);
        }
    }

    private static Command parseSet(RespValue.Array items) throws InvalidFormatException {
        RespValue.BulkString key = requireBulkString(items, 1, "SET key");
        RespValue.BulkString value = requireBulkString(items, 2, "SET value");

        // PX 옵션이 아니거나 숫자가 아니면 조용히 무시한다
        Long expiryMillis = null;
        if (items.size() >= 5) {
            RespValue.BulkString option = bulkString(items, 3);
            RespValue.BulkString millis = bulkString(items, 4);
            if (option != null && millis != null && "PX".equalsIgnoreCase(option.asString())) {
                expiryMillis = parseMillis(millis.asString());
            }
        }
        return new SetCommand(key, value, expiryMillis);
    }

    /**
     * 부호 없는 64비트 정수로 해석합니다. Long.MAX_VALUE 를 넘는 값은 Long.MAX_VALUE 로 포화시키고,
     * 음수이거나 숫자가 아니면 null.
     */
    private static Long parseMillis(String text) {
        try {
            long parsed = Long.parseUnsignedLong(text);
            return parsed < 0 ? Long.MAX_VALUE : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static RespValue.BulkString requireBulkString(RespValue.Array items, int index, String what)
            throws InvalidFormatException {
        RespValue.BulkString bulk = bulkString(items, index);
        if (bulk == null) {
            throw new InvalidFormatException(what + " must be a bulk string");
        }
        return bulk;
    }

    /**
     * index 위치가 null 이 아닌 bulk string 이면 그 값을, 아니면 null 을 반환합니다.
     */
    private static RespValue.BulkString bulkString(RespValue.Array items, int index) {
        RespValue element = items.get(index);
        if (element instanceof RespValue.BulkString && !((RespValue.BulkString) element).isNull()) {
            return (RespValue.BulkString) element;
        }
        return null;
    }
}
