package org.brown.judgegrid.docker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;

/**
 * 호스트 임시 포트 할당
 *
 * 루프백에 0번 포트로 바인드해 OS가 고른 포트를 받고 바로 닫는다.
 * 닫은 뒤 Docker가 바인드하기 전까지 다른 프로세스가 가져갈 수 있으며,
 * 그 경우 컨테이너 시작 실패로 드러난다.
 */
@Slf4j
@Component
public class PortAllocator {

    public int allocate() {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            int port = socket.getLocalPort();
            log.debug("Found free TCP port: {}", port);
            return port;
        } catch (IOException e) {
            throw new SetupFailureException("Failed to allocate a free host port", e);
        }
    }
}
