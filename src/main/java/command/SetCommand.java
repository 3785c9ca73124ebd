package command;

import protocol.RespProtocol;
import protocol.RespValue;
import service.StorageService;

/**
 * SET key value [PX milliseconds]. expiryMillis 가 null 이면 만료 없이 저장합니다.
 */
public record SetCommand(RespValue.BulkString key, RespValue.BulkString value, Long expiryMillis) implements Command {

    @Override
    public RespValue execute(StorageService storageService) {
        if (expiryMillis != null) {
            storageService.setWithExpiry(key.data(), value.data(), expiryMillis);
        } else {
            storageService.set(key.data(), value.data());
        }
        return RespProtocol.OK_RESPONSE;
    }
}
