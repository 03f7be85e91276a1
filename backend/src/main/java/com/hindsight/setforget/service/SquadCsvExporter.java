package com.hindsight.setforget.service;

import com.hindsight.setforget.model.OptimalSquadMember;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Writes a final squad as CSV, one row per member with its role flags.
 */
@Service
public class SquadCsvExporter {
    private static final Logger log = LoggerFactory.getLogger(SquadCsvExporter.class);

    static final String[] HEADER = {
            "id", "web_name", "positions", "club", "start_cost",
            "in_lineup", "on_bench", "is_captain", "is_vice_captain", "slot"
    };

    private final Path exportDir;

    public SquadCsvExporter(@Value("${hindsight.export.dir:optimal_teams}") String exportDir) {
        this.exportDir = Paths.get(exportDir);
    }

    /** Writes {@code set_and_forget_<season>.csv} into the export directory and returns its path. */
    public Path export(String season, List<OptimalSquadMember> rows) {
        Path target = exportDir.resolve("set_and_forget_" + season + ".csv");
        try {
            Files.createDirectories(exportDir);
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                write(writer, rows);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        log.info("[CsvExport] season={} rows={} file={}", season, rows.size(), target.toAbsolutePath());
        return target;
    }

    public String toCsv(List<OptimalSquadMember> rows) {
        StringWriter out = new StringWriter();
        try {
            write(out, rows);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private static void write(Writer writer, List<OptimalSquadMember> rows) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader(HEADER)
                .build();
        try (CSVPrinter printer = new CSVPrinter(writer, fmt)) {
            for (OptimalSquadMember m : rows) {
                printer.printRecord(m.getPlayerId(), m.getPlayerName(), m.getPosition(), m.getClub(), m.getStartCost(),
                        m.isInLineup(), m.isOnBench(), m.isCaptain(), m.isViceCaptain(), m.getSlot());
            }
        }
    }
}
