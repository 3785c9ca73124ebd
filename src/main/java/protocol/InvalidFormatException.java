package protocol;

/**
 * 잘못된 타입 바이트, 숫자로 해석되지 않는 길이, 누락된 CRLF 등 복구할 수 없는 형식 오류.
 * 명령어 해석 단계에서 명령어 모양이 틀린 경우에도 사용됩니다.
 */
public class InvalidFormatException extends RespParseException {

    public InvalidFormatException(String message) {
        super(message);
    }
}
