package service;

/**
 * 저장된 값(바이트 그대로)과 만료 시각(밀리초 단위 timestamp, 없으면 null)
 */
public record StorageEntry(byte[] value, Long expiresAt) {

    public boolean isExpired(long now) {
        return expiresAt != null && now > expiresAt;
    }
}
