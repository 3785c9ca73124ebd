package server;

import command.CommandHandler;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import protocol.IncompleteFrameException;
import protocol.RespDecoder;
import protocol.RespParseException;
import protocol.RespProtocol;
import protocol.RespValue;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;

/**
 * 클라이언트 연결 하나를 처리합니다.
 *
 * <p>읽은 바이트를 {@link ConnectionBuffer} 에 누적하고, 완성된 프레임이 있는 동안
 * 디코딩 → 명령어 실행 → 응답 전송을 반복합니다. 한 번의 read 에 여러 명령어가 들어와도
 * 순서대로 하나씩 처리됩니다.
 */
@Slf4j
public class ClientHandler implements Runnable {

    private static final int READ_CHUNK_SIZE = 512;

    private final Socket clientSocket;
    private final CommandHandler commandHandler;
    private final ServerConfig config;
    private final String clientAddress;
    private final ConnectionBuffer buffer = new ConnectionBuffer();

    public ClientHandler(Socket clientSocket, CommandHandler commandHandler, ServerConfig config) {
        this.clientSocket = clientSocket;
        this.commandHandler = commandHandler;
        this.config = config;
        this.clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());
    }

    @Override
    public void run() {
        try {
            if (config.getIdleTimeoutMillis() > 0) {
                clientSocket.setSoTimeout(config.getIdleTimeoutMillis());
            }
            handleClientLoop(clientSocket.getInputStream(), clientSocket.getOutputStream());
        } catch (SocketTimeoutException e) {
            log.info("Client idle for {} ms, closing: {}", config.getIdleTimeoutMillis(), clientAddress);
        } catch (IOException e) {
            log.warn("Error reading from client {}: {}", clientAddress, e.getMessage());
        } finally {
            IOUtils.closeQuietly(clientSocket,
                    e -> log.warn("Error closing client socket {}: {}", clientAddress, e.getMessage()));
        }

        log.info("Client connection closed: {}", clientAddress);
    }

    private void handleClientLoop(InputStream inputStream, OutputStream outputStream) throws IOException {
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        int read;
        while ((read = inputStream.read(chunk)) != -1) {
            if (!onBytesReceived(chunk, read, outputStream)) {
                return;
            }
        }
    }

    /**
     * 새로 읽은 바이트를 버퍼에 붙이고 완성된 프레임을 모두 처리합니다.
     *
     * @return 연결을 유지해야 하면 true, 프로토콜 오류로 닫아야 하면 false
     */
    boolean onBytesReceived(byte[] chunk, int length, OutputStream outputStream) {
        buffer.append(chunk, 0, length);
        if (config.hasBufferLimit() && buffer.size() > config.getMaxBufferSize()) {
            log.warn("Buffer limit of {} bytes exceeded by client {}", config.getMaxBufferSize(), clientAddress);
            sendResponse(outputStream, RespProtocol.PROTOCOL_ERROR_RESPONSE);
            return false;
        }

        while (!buffer.isEmpty()) {
            try {
                RespDecoder.DecodeResult result = RespDecoder.decode(buffer.array(), 0, buffer.size());
                buffer.discard(result.nextOffset());
                RespValue response = commandHandler.handleCommand(result.value());
                sendResponse(outputStream, response);
            } catch (IncompleteFrameException e) {
                return true;
            } catch (RespParseException e) {
                log.warn("Invalid command format from client {}: {}", clientAddress, e.getMessage());
                sendResponse(outputStream, RespProtocol.PROTOCOL_ERROR_RESPONSE);
                return false;
            }
        }
        return true;
    }

    /**
     * 클라이언트에게 응답을 전송합니다. 쓰기 실패는 기록만 하고, 연결 종료는 다음 read 실패에 맡깁니다.
     */
    private void sendResponse(OutputStream outputStream, RespValue response) {
        try {
            outputStream.write(RespProtocol.encode(response));
            outputStream.flush();
        } catch (IOException e) {
            log.warn("Failed to send response to {}: {}", clientAddress, e.getMessage());
        }
    }
}
