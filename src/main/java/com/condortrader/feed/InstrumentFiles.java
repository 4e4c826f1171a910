package com.condortrader.feed;

import com.condortrader.domain.model.OptionContract;
import com.condortrader.mapper.JsonHelper;
import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Instruments JSON written next to a tick file, so a recorded session can be replayed
 * without the broker's instrument dump.
 */
public final class InstrumentFiles {

    private static final TypeReference<List<OptionContract>> CONTRACT_LIST = new TypeReference<>() {};

    private InstrumentFiles() {}

    public static void write(Path path, List<OptionContract> contracts) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        JsonHelper.objectMapper().writerWithDefaultPrettyPrinter().writeValue(path.toFile(), contracts);
    }

    public static List<OptionContract> read(Path path) throws IOException {
        return JsonHelper.objectMapper().readValue(path.toFile(), CONTRACT_LIST);
    }
}
