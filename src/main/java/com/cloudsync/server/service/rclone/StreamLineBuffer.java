package com.cloudsync.server.service.rclone;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles lines from arbitrary output chunks. The incomplete trailing fragment is held
 * until a later chunk ends it. Splits on bytes so a multibyte character cut in half is never
 * decoded early.
 */
public class StreamLineBuffer {

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    public synchronized List<String> append(byte[] chunk) {
        List<String> lines = new ArrayList<>();
        if (chunk == null || chunk.length == 0) {
            return lines;
        }
        int start = 0;
        for (int i = 0; i < chunk.length; i++) {
            if (chunk[i] != '\n') {
                continue;
            }
            this.pending.write(chunk, start, i - start);
            lines.add(this.drain());
            start = i + 1;
        }
        if (start < chunk.length) {
            this.pending.write(chunk, start, chunk.length - start);
        }
        return lines;
    }

    // 进程结束时取出最后一段
    public synchronized String flush() {
        if (this.pending.size() == 0) {
            return null;
        }
        return this.drain();
    }

    private String drain() {
        String line = this.pending.toString(StandardCharsets.UTF_8);
        this.pending.reset();
        // \r\n
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        return line;
    }
}
