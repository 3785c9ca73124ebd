package command;

import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

/**
 * 지원하지 않는 명령어. 이름은 클라이언트가 보낸 그대로 유지합니다.
 */
public record UnknownCommand(String name) implements Command {

    @Override
    public RespValue execute(StorageService storageService) {
        return RespProtocol.createErrorResponse("unknown command '" + name + "'");
    }
}
