package protocol;

/**
 * 버퍼에 프레임이 아직 다 도착하지 않았음을 나타냅니다.
 * 실패가 아니라, 바이트를 더 읽은 뒤 같은 버퍼의 처음부터 다시 시도하라는 신호입니다.
 */
public class IncompleteFrameException extends RespParseException {

    public IncompleteFrameException(String message) {
        super(message);
    }
}
