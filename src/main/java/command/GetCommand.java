package command;

import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

public record GetCommand(RespValue.BulkString key) implements Command {

    @Override
    public RespValue execute(StorageService storageService) {
        byte[] value = storageService.get(key.data());

        if (value == null) {
            return RespProtocol.createNullBulkString();
        } else {
            return RespProtocol.createBulkString(value);
        }
    }
}
