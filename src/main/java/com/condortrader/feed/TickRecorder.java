package com.condortrader.feed;

import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.Tick;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records live ticks into daily binary files for later backtests.
 *
 * <p>Ticks are buffered in memory and appended in the {@link TickFileFormat} layout every
 * {@code bufferFlushSize} ticks, on {@link #flush()} and on {@link #stop()}. The header is
 * rewritten in place after each append with the running tick count and CRC32. The file
 * day is the exchange date of the tick, so a replayed file holds exactly one session.
 *
 * <p>The instruments of the session are written once as {@code instruments-<date>.json}.
 */
public class TickRecorder {

    private static final Logger log = LoggerFactory.getLogger(TickRecorder.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path directory;
    private final int bufferFlushSize;
    private final boolean compressOnStop;

    private final List<Tick> buffer = new ArrayList<>();
    private final CRC32 dailyCrc = new CRC32();
    private LocalDate currentDay;
    private Path currentFile;
    private long flushedCount;
    private boolean recording;

    public TickRecorder(Path directory, int bufferFlushSize, boolean compressOnStop) {
        this.directory = directory;
        this.bufferFlushSize = bufferFlushSize;
        this.compressOnStop = compressOnStop;
    }

    /**
     * Starts recording. A file left by an earlier run on the same day is kept and this run
     * writes {@code ticks-<date>-2.bin}, {@code -3} and so on.
     */
    public synchronized void start(LocalDate day, List<OptionContract> contracts) {
        if (recording) {
            log.warn("Tick recording already active, ignoring start request");
            return;
        }
        currentDay = day;
        flushedCount = 0;
        dailyCrc.reset();
        currentFile = tickFile(day);
        for (int run = 2; Files.exists(currentFile); run++) {
            currentFile = directory.resolve("ticks-" + day.format(DATE_FORMAT) + "-" + run + ".bin");
        }
        try {
            InstrumentFiles.write(instrumentsFile(day), contracts);
        } catch (IOException e) {
            log.error("Failed to prepare tick recording for {}: {}", day, e.getMessage(), e);
            return;
        }
        recording = true;
        log.info("Tick recording started: day={}, instruments={}", day, contracts.size());
    }

    public synchronized void record(Tick tick) {
        if (!recording) {
            return;
        }
        LocalDate tickDay = tick.getTimestamp().toLocalDate();
        if (!tickDay.equals(currentDay)) {
            log.debug("Skipping tick of {} while recording {}", tickDay, currentDay);
            return;
        }
        buffer.add(tick);
        if (buffer.size() >= bufferFlushSize) {
            flush();
        }
    }

    /**
     * Appends buffered ticks to the day's file and rewrites the header. On I/O failure the
     * ticks stay buffered for the next flush.
     */
    public synchronized void flush() {
        if (buffer.isEmpty() || currentDay == null) {
            return;
        }

        Path filePath = currentFile;
        List<byte[]> records = buffer.stream().map(TickFileFormat::encode).toList();
        try {
            Files.createDirectories(directory);
            boolean newFile = !Files.exists(filePath);

            try (DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(
                    Files.newOutputStream(filePath, StandardOpenOption.CREATE, StandardOpenOption.APPEND)))) {
                if (newFile) {
                    // placeholder header, rewritten below
                    TickFileFormat.writeHeader(dos, 0, 0);
                }
                for (byte[] record : records) {
                    dos.write(record);
                }
            }
            records.forEach(dailyCrc::update);

            flushedCount += buffer.size();
            updateFileHeader(filePath, (int) flushedCount, dailyCrc.getValue());
            log.debug("Flushed {} ticks to {} (total: {})", buffer.size(), filePath, flushedCount);
            buffer.clear();
        } catch (IOException e) {
            log.error("Failed to flush ticks to disk: {}", e.getMessage(), e);
        }
    }

    /** Stops recording after a final flush; compresses the file when configured. */
    public synchronized void stop() {
        if (!recording) {
            return;
        }
        flush();
        recording = false;
        log.info("Tick recording stopped. {} ticks recorded for {}", flushedCount, currentDay);
        if (compressOnStop && flushedCount > 0) {
            compress(currentFile);
        }
    }

    public synchronized boolean isRecording() {
        return recording;
    }

    public synchronized long getFlushedCount() {
        return flushedCount;
    }

    public synchronized Path getCurrentFile() {
        return currentFile;
    }

    public Path tickFile(LocalDate day) {
        return directory.resolve("ticks-" + day.format(DATE_FORMAT) + ".bin");
    }

    public Path instrumentsFile(LocalDate day) {
        return directory.resolve("instruments-" + day.format(DATE_FORMAT) + ".json");
    }

    private void updateFileHeader(Path filePath, int tickCount, long crc32) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(filePath.toFile(), "rw")) {
            raf.seek(0);
            raf.writeLong(TickFileFormat.MAGIC);
            raf.writeInt(TickFileFormat.VERSION);
            raf.writeInt(tickCount);
            raf.writeLong(System.currentTimeMillis());
            raf.writeLong(crc32);
        }
    }

    private void compress(Path sourcePath) {
        Path gzPath = Path.of(sourcePath + ".gz");
        try {
            try (var in = Files.newInputStream(sourcePath);
                    var out = new GZIPOutputStream(new BufferedOutputStream(Files.newOutputStream(gzPath)))) {
                in.transferTo(out);
            }
            Files.delete(sourcePath);
            log.info("Compressed tick file: {} -> {}", sourcePath.getFileName(), gzPath.getFileName());
        } catch (IOException e) {
            log.error("Failed to compress tick file {}: {}", sourcePath, e.getMessage(), e);
        }
    }
}
