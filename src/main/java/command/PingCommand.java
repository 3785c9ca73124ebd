package command;

import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

/**
 * PING [message]. message 가 있으면 그대로 status 응답으로 돌려줍니다.
 */
public record PingCommand(String message) implements Command {

    @Override
    public RespValue execute(StorageService storageService) {
        if (message == null) {
            return RespProtocol.PONG_RESPONSE;
        }
        return RespProtocol.createSimpleString(message);
    }
}
