package net.cadence.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/** 프로세스 스트림 → BoundedOutputBuffer. 스트림이 닫히면 종료 */
public final class OutputPump implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(OutputPump.class);

    private final InputStream in;
    private final BoundedOutputBuffer sink;

    public OutputPump(InputStream in, BoundedOutputBuffer sink) {
        this.in = in;
        this.sink = sink;
    }

    @Override
    public void run() {
        char[] chunk = new char[8192];
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = r.read(chunk)) >= 0) {
                if (n > 0) sink.append(chunk, 0, n);
            }
        } catch (IOException e) {
            // 프로세스 강제 종료 시 파이프가 먼저 닫힐 수 있다
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }
}
