package command;

import protocol.RespValue;
import service.StorageService;

public record EchoCommand(RespValue.BulkString message) implements Command {

    @Override
    public RespValue execute(StorageService storageService) {
        return message;
    }
}
