package server;

import command.CommandHandler;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import service.StorageService;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * 서버의 메인 클래스
 * 서버 시작, 클라이언트 연결 처리를 담당
 */
@Slf4j
public class RedisServer implements AutoCloseable {

    private final ServerConfig config;
    private final CommandHandler commandHandler;
    private ServerSocket serverSocket;

    public RedisServer(ServerConfig config) {
        this(config, new StorageService());
    }

    /**
     * @param storageService 모든 연결이 공유할 저장소
     */
    public RedisServer(ServerConfig config, StorageService storageService) {
        this.config = config;
        this.commandHandler = new CommandHandler(storageService);
    }

    /**
     * 서버를 시작합니다. 소켓이 닫힐 때까지 반환하지 않습니다.
     */
    public void start() throws IOException {
        bind();
        serve();
    }

    public void bind() throws IOException {
        serverSocket = createServerSocket();
        log.info("Server listening on {}", serverSocket.getLocalSocketAddress());
    }

    /**
     * 연결을 수락하고 연결마다 별도의 스레드로 처리합니다.
     */
    public void serve() {
        while (!serverSocket.isClosed()) {
            try {
                Socket clientSocket = serverSocket.accept();
                log.info("Client connected: {}", clientSocket.getRemoteSocketAddress());

                ClientHandler clientHandler = new ClientHandler(clientSocket, commandHandler, config);
                new Thread(clientHandler, "client-" + clientSocket.getPort()).start();
            } catch (IOException e) {
                if (serverSocket.isClosed()) {
                    break;
                }
                log.error("Error accepting client connection: {}", e.getMessage());
            }
        }
        log.info("Server stopped accepting connections");
    }

    public int getLocalPort() {
        return serverSocket.getLocalPort();
    }

    @Override
    public void close() throws IOException {
        if (serverSocket != null) {
            serverSocket.close();
        }
    }

    /**
     * 서버 소켓을 생성하고 설정합니다.
     */
    private ServerSocket createServerSocket() throws IOException {
        ServerSocket socket = new ServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(config.getHost(), config.getPort()));
        return socket;
    }
}
