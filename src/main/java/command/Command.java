package command;

import protocol.RespValue;
import service.StorageService;

/**
 * 해석이 끝난 Redis 명령어의 공통 인터페이스
 */
public interface Command {

    /**
     * 명령어 실행 로직
     * @param storageService 모든 연결이 공유하는 저장소
     * @return 클라이언트에게 보낼 응답 값
     */
    RespValue execute(StorageService storageService);
}
