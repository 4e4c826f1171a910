package com.condortrader.feed;

import com.condortrader.domain.model.Tick;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.zip.CRC32;

/**
 * Binary tick file format.
 *
 * <p>Header layout (32 bytes):
 * <ul>
 *   <li>magic(8): 0x5449434B46494C45 ("TICKFILE" in ASCII)</li>
 *   <li>version(4): format version (currently 2)</li>
 *   <li>tickCount(4): number of ticks in the file</li>
 *   <li>createdAtEpochMs(8): file creation timestamp</li>
 *   <li>crc32(8): CRC32 checksum of all tick data (after header)</li>
 * </ul>
 *
 * <p>Per-tick layout (48 bytes):
 * <ul>
 *   <li>timestampEpochMs(8) + instrumentToken(8) + lastPrice(8) + bid(8) + ask(8) + volume(8)</li>
 * </ul>
 * Missing bid/ask are written as NaN.
 */
public final class TickFileFormat {

    public static final long MAGIC = 0x5449434B46494C45L; // "TICKFILE"
    public static final int VERSION = 2;
    public static final int HEADER_SIZE = 32;
    public static final int TICK_SIZE = 48;

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private TickFileFormat() {}

    /**
     * Writes the file header. CRC32 is initially 0 and is rewritten after ticks are appended.
     */
    public static void writeHeader(DataOutputStream dos, int tickCount, long crc32) throws IOException {
        dos.writeLong(MAGIC);
        dos.writeInt(VERSION);
        dos.writeInt(tickCount);
        dos.writeLong(System.currentTimeMillis());
        dos.writeLong(crc32);
    }

    /**
     * Writes a single tick record and updates the CRC32 accumulator.
     */
    public static void writeTick(DataOutputStream dos, Tick tick, CRC32 crc) throws IOException {
        byte[] buffer = encode(tick);
        crc.update(buffer);
        dos.write(buffer);
    }

    /** Encodes one tick record. */
    public static byte[] encode(Tick tick) {
        long timestampMs = tick.getTimestamp().atZone(IST).toInstant().toEpochMilli();

        byte[] buffer = new byte[TICK_SIZE];
        int offset = 0;
        offset = putLong(buffer, offset, timestampMs);
        offset = putLong(buffer, offset, tick.getInstrumentToken());
        offset = putDouble(buffer, offset, toDouble(tick.getLastPrice()));
        offset = putDouble(buffer, offset, toDouble(tick.getBid()));
        offset = putDouble(buffer, offset, toDouble(tick.getAsk()));
        putLong(buffer, offset, tick.getVolume());
        return buffer;
    }

    /**
     * Reads a single tick record from the input stream.
     */
    public static Tick readTick(DataInputStream dis) throws IOException {
        long timestampMs = dis.readLong();
        long instrumentToken = dis.readLong();
        double lastPrice = dis.readDouble();
        double bid = dis.readDouble();
        double ask = dis.readDouble();
        long volume = dis.readLong();

        return Tick.builder()
                .timestamp(LocalDateTime.ofInstant(Instant.ofEpochMilli(timestampMs), IST))
                .instrumentToken(instrumentToken)
                .lastPrice(BigDecimal.valueOf(lastPrice))
                .bid(fromDouble(bid))
                .ask(fromDouble(ask))
                .volume(volume)
                .build();
    }

    /**
     * Validates the file header and returns it; throws if the file is not a tick file.
     */
    public static FileHeader readHeader(DataInputStream dis) throws IOException {
        long magic = dis.readLong();
        if (magic != MAGIC) {
            throw new IOException("Invalid tick file: bad magic number");
        }
        int version = dis.readInt();
        if (version != VERSION) {
            throw new IOException("Unsupported tick file version: " + version);
        }
        int tickCount = dis.readInt();
        long createdAtMs = dis.readLong();
        long crc32 = dis.readLong();

        return new FileHeader(version, tickCount, createdAtMs, crc32);
    }

    private static double toDouble(BigDecimal value) {
        return value != null ? value.doubleValue() : Double.NaN;
    }

    private static BigDecimal fromDouble(double value) {
        return Double.isNaN(value) ? null : BigDecimal.valueOf(value);
    }

    // big-endian, matching DataInputStream
    private static int putLong(byte[] buffer, int offset, long value) {
        buffer[offset] = (byte) (value >>> 56);
        buffer[offset + 1] = (byte) (value >>> 48);
        buffer[offset + 2] = (byte) (value >>> 40);
        buffer[offset + 3] = (byte) (value >>> 32);
        buffer[offset + 4] = (byte) (value >>> 24);
        buffer[offset + 5] = (byte) (value >>> 16);
        buffer[offset + 6] = (byte) (value >>> 8);
        buffer[offset + 7] = (byte) value;
        return offset + 8;
    }

    private static int putDouble(byte[] buffer, int offset, double value) {
        return putLong(buffer, offset, Double.doubleToLongBits(value));
    }

    /**
     * Parsed file header.
     */
    public record FileHeader(int version, int tickCount, long createdAtEpochMs, long crc32) {}
}
