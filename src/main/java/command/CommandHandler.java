package command;

import lombok.extern.slf4j.Slf4j;
import protocol.InvalidFormatException;
import protocol.RespValue;
import service.StorageService;

/**
 * 요청 프레임을 명령어로 해석하고, 공유 저장소에 실행한 결과를 돌려주는 핸들러 클래스
 */
@Slf4j
public class CommandHandler {

    private final StorageService storageService;

    public CommandHandler(StorageService storageService) {
        this.storageService = storageService;
    }

    /**
     * @throws InvalidFormatException 프레임이 명령어 모양이 아닐 때. 호출자는 연결을 닫아야 합니다.
     */
    public RespValue handleCommand(RespValue frame) throws InvalidFormatException {
        Command command = CommandParser.parse(frame);
        log.debug("Executing {}", command);
        return command.execute(storageService);
    }
}
