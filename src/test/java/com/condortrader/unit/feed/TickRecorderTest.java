package com.condortrader.unit.feed;

import static com.condortrader.support.ChainFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.condortrader.domain.enums.OptionType;
import com.condortrader.domain.model.OptionContract;
import com.condortrader.domain.model.Tick;
import com.condortrader.feed.InstrumentFiles;
import com.condortrader.feed.TickFileFormat;
import com.condortrader.feed.TickFileReader;
import com.condortrader.feed.TickRecorder;
import com.condortrader.support.ChainFixtures;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for TickRecorder and TickFileReader: the binary layout, header checks,
 * compression, run-suffixed files and the instruments file.
 */
class TickRecorderTest {

    @TempDir
    Path directory;

    private final List<OptionContract> contracts =
            List.of(ChainFixtures.contract(22300, OptionType.CE), ChainFixtures.contract(21700, OptionType.PE));

    private static Tick quote(long token, String last, String bid, String ask, int secondsAfter) {
        return Tick.builder()
                .instrumentToken(token)
                .lastPrice(new BigDecimal(last))
                .bid(bid != null ? new BigDecimal(bid) : null)
                .ask(ask != null ? new BigDecimal(ask) : null)
                .volume(1200)
                .timestamp(T0.plusSeconds(secondsAfter))
                .build();
    }

    @Test
    @DisplayName("Recorded ticks read back with prices, depth and timestamps")
    void recordAndRead() throws IOException {
        TickRecorder recorder = new TickRecorder(directory, 2, false);
        recorder.start(T0.toLocalDate(), contracts);

        recorder.record(quote(223001, "50.25", "50.2", "50.3", 0));
        recorder.record(quote(217002, "45.5", null, null, 1));
        recorder.record(quote(223001, "51", "50.95", "51.05", 2));
        recorder.stop();

        List<Tick> ticks = TickFileReader.read(recorder.tickFile(T0.toLocalDate()));

        assertThat(recorder.getFlushedCount()).isEqualTo(3);
        assertThat(ticks).hasSize(3);
        assertThat(ticks.get(0).getTimestamp()).isEqualTo(T0);
        assertThat(ticks.get(0).getLastPrice()).isEqualByComparingTo("50.25");
        assertThat(ticks.get(0).getBid()).isEqualByComparingTo("50.2");
        assertThat(ticks.get(1).getBid()).isNull();
        assertThat(ticks.get(1).getAsk()).isNull();
        assertThat(ticks.get(2).getVolume()).isEqualTo(1200);
        assertThat(Files.size(recorder.tickFile(T0.toLocalDate())))
                .isEqualTo(TickFileFormat.HEADER_SIZE + 3L * TickFileFormat.TICK_SIZE);
    }

    @Test
    @DisplayName("Ticks of another day are not written to the session file")
    void otherDaySkipped() throws IOException {
        TickRecorder recorder = new TickRecorder(directory, 100, false);
        recorder.start(T0.toLocalDate(), contracts);

        recorder.record(quote(223001, "50", null, null, 0));
        recorder.record(quote(223001, "50", null, null, 86_400));
        recorder.stop();

        assertThat(TickFileReader.read(recorder.tickFile(T0.toLocalDate()))).hasSize(1);
    }

    @Test
    @DisplayName("Compressed files read back the same")
    void compressed() throws IOException {
        TickRecorder recorder = new TickRecorder(directory, 100, true);
        recorder.start(T0.toLocalDate(), contracts);
        recorder.record(quote(223001, "50", null, null, 0));
        recorder.stop();

        Path gz = Path.of(recorder.tickFile(T0.toLocalDate()) + ".gz");

        assertThat(Files.exists(recorder.tickFile(T0.toLocalDate()))).isFalse();
        assertThat(TickFileReader.read(gz)).hasSize(1);
    }

    @Test
    @DisplayName("A second run on the same day writes a run-suffixed file")
    void secondRunSuffixed() throws IOException {
        TickRecorder first = new TickRecorder(directory, 100, false);
        first.start(T0.toLocalDate(), contracts);
        first.record(quote(223001, "50", null, null, 0));
        first.stop();

        TickRecorder second = new TickRecorder(directory, 100, false);
        second.start(T0.toLocalDate(), contracts);
        second.record(quote(223001, "52", null, null, 60));
        second.stop();

        assertThat(second.getCurrentFile().getFileName().toString()).isEqualTo("ticks-2024-01-15-2.bin");
        assertThat(TickFileReader.read(first.tickFile(T0.toLocalDate()))).hasSize(1);
        assertThat(TickFileReader.read(second.getCurrentFile())).hasSize(1);
    }

    @Test
    @DisplayName("Corrupted body fails the CRC check")
    void corruptedFileRejected() throws IOException {
        TickRecorder recorder = new TickRecorder(directory, 100, false);
        recorder.start(T0.toLocalDate(), contracts);
        recorder.record(quote(223001, "50", null, null, 0));
        recorder.stop();
        Path file = recorder.tickFile(T0.toLocalDate());

        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            raf.seek(TickFileFormat.HEADER_SIZE + 16);
            raf.writeDouble(99.0);
        }

        assertThatThrownBy(() -> TickFileReader.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("CRC32");
    }

    @Test
    @DisplayName("Instruments of the session are written next to the ticks")
    void instrumentsFile() throws IOException {
        TickRecorder recorder = new TickRecorder(directory, 100, false);
        recorder.start(T0.toLocalDate(), contracts);
        recorder.stop();

        List<OptionContract> read = InstrumentFiles.read(recorder.instrumentsFile(T0.toLocalDate()));

        assertThat(read).containsExactlyElementsOf(contracts);
    }
}
