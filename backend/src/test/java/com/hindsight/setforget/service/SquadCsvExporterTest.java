package com.hindsight.setforget.service;

import com.hindsight.setforget.SquadFixtures;
import com.hindsight.setforget.model.OptimalSquadMember;
import com.hindsight.setforget.model.Squad;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SquadCsvExporterTest {

    @TempDir
    Path dir;

    @Test
    void exportWritesOneRowPerMemberWithRoleFlags() throws IOException {
        Squad squad = SquadFixtures.sampleSquad();
        List<OptimalSquadMember> rows = OptimalSquadService.toRows("job-1", "2023-2024", squad);

        Path file = new SquadCsvExporter(dir.resolve("out").toString()).export("2023-2024", rows);

        assertThat(file.getFileName().toString()).isEqualTo("set_and_forget_2023-2024.csv");
        List<CSVRecord> records;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build().parse(reader)) {
            assertThat(parser.getHeaderNames()).containsExactly(SquadCsvExporter.HEADER);
            records = parser.getRecords();
        }
        assertThat(records).hasSize(15);
        assertThat(records).filteredOn(r -> r.get("in_lineup").equals("true")).hasSize(11);
        assertThat(records).filteredOn(r -> r.get("on_bench").equals("true")).hasSize(4);
        assertThat(records).filteredOn(r -> r.get("is_captain").equals("true"))
                .singleElement().satisfies(r -> assertThat(r.get("id")).isEqualTo("1"));
        assertThat(records).filteredOn(r -> r.get("is_vice_captain").equals("true"))
                .singleElement().satisfies(r -> assertThat(r.get("id")).isEqualTo("2"));
        // bench rows follow the lineup, goalkeeper first
        assertThat(records.get(11).get("positions")).isEqualTo("GK");
        assertThat(records.get(11).get("slot")).isEqualTo("0");
        assertThat(records.get(14).get("slot")).isEqualTo("3");
    }

    @Test
    void toCsvStartsWithHeader() {
        String csv = new SquadCsvExporter(dir.toString())
                .toCsv(OptimalSquadService.toRows("job-1", "2023-2024", SquadFixtures.sampleSquad()));

        assertThat(csv.lines().findFirst()).hasValue(String.join(",", SquadCsvExporter.HEADER));
        assertThat(csv.lines().count()).isEqualTo(16);
    }
}
