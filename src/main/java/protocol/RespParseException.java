package protocol;

/**
 * RESP 프레임 해석 실패의 공통 상위 예외
 */
public abstract class RespParseException extends Exception {

    protected RespParseException(String message) {
        super(message);
    }
}
