package com.condortrader.feed;

import com.condortrader.domain.model.Tick;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a recorded tick file (plain or gzip-compressed) written by {@link TickRecorder},
 * verifying the tick count and CRC32 from the header.
 */
public final class TickFileReader {

    private static final Logger log = LoggerFactory.getLogger(TickFileReader.class);

    private TickFileReader() {}

    public static List<Tick> read(Path path) throws IOException {
        try (InputStream raw = Files.newInputStream(path);
                InputStream in = path.getFileName().toString().endsWith(".gz")
                        ? new GZIPInputStream(new BufferedInputStream(raw))
                        : new BufferedInputStream(raw);
                DataInputStream dis = new DataInputStream(in)) {

            TickFileFormat.FileHeader header = TickFileFormat.readHeader(dis);
            byte[] body = dis.readAllBytes();
            if (body.length != header.tickCount() * TickFileFormat.TICK_SIZE) {
                throw new IOException("Tick file " + path + " is truncated: header says " + header.tickCount()
                        + " ticks, body holds " + body.length / TickFileFormat.TICK_SIZE);
            }

            CRC32 crc = new CRC32();
            crc.update(body);
            if (crc.getValue() != header.crc32()) {
                throw new IOException("Tick file " + path + " failed CRC32 check");
            }

            List<Tick> ticks = new ArrayList<>(header.tickCount());
            try (DataInputStream bodyStream = new DataInputStream(new ByteArrayInputStream(body))) {
                for (int i = 0; i < header.tickCount(); i++) {
                    ticks.add(TickFileFormat.readTick(bodyStream));
                }
            }
            log.info("Loaded {} ticks from {}", ticks.size(), path);
            return ticks;
        }
    }
}
