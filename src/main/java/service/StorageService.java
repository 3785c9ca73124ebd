package service;

import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 키-값 저장소와 만료 시간 관리를 담당하는 서비스 클래스.
 *
 * <p>키와 값은 클라이언트가 보낸 바이트 그대로 저장합니다. 모든 연결이 하나의 인스턴스를 공유하며,
 * 읽기(만료로 인한 삭제 포함)와 쓰기는 모두 하나의 lock 아래에서 실행됩니다.
 * 만료는 읽을 때만 검사하며 백그라운드 정리는 없습니다.
 */
@Slf4j
public class StorageService {

    // ByteBuffer 는 내용 기준으로 equals/hashCode 를 계산한다. 저장 후 키 배열을 수정하면 안 된다
    private final Map<ByteBuffer, StorageEntry> store = new HashMap<>();
    private final Lock lock = new ReentrantLock();
    private final Clock clock;

    public StorageService() {
        this(Clock.systemUTC());
    }

    public StorageService(Clock clock) {
        this.clock = clock;
    }

    /**
     * 키-값을 저장합니다. 기존 값과 만료 시간은 모두 대체됩니다.
     */
    public void set(byte[] key, byte[] value) {
        lock.lock();
        try {
            store.put(ByteBuffer.wrap(key), new StorageEntry(value, null));
            if (log.isDebugEnabled()) {
                log.debug("Stored: {}", printable(key));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 시각 + ttlMillis 에 만료되도록 키-값을 저장합니다.
     */
    public void setWithExpiry(byte[] key, byte[] value, long ttlMillis) {
        lock.lock();
        try {
            long now = clock.millis();
            long expiresAt = ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
            store.put(ByteBuffer.wrap(key), new StorageEntry(value, expiresAt));
            if (log.isDebugEnabled()) {
                log.debug("Stored with expiry: {} (expires at: {})", printable(key), expiresAt);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 키에 해당하는 값을 가져옵니다. 만료된 키는 이 시점에 삭제되고 null 을 반환합니다.
     */
    public byte[] get(byte[] key) {
        ByteBuffer storeKey = ByteBuffer.wrap(key);
        lock.lock();
        try {
            StorageEntry entry = store.get(storeKey);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(clock.millis())) {
                store.remove(storeKey);
                if (log.isDebugEnabled()) {
                    log.debug("Key expired and removed: {}", printable(key));
                }
                return null;
            }
            return entry.value();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 저장된 항목 수. 아직 읽히지 않은 만료 항목도 포함됩니다.
     */
    public int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    private static String printable(byte[] key) {
        return new String(key, StandardCharsets.UTF_8);
    }
}
