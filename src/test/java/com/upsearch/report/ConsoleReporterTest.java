package com.upsearch.report;

import com.upsearch.model.PropertyRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintSearchResultsWithHeader() {
        ConsoleReporter reporter = new ConsoleReporter(false, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        PropertyRecord record = PropertyRecord.builder("P1").ownerName("SMITH JOHN").ownerCity("FRESNO")
            .amountReported(new BigDecimal("25.50")).holderName("ACME BANK").build();

        reporter.printSearchResults("smith", List.of(record));

        assertThat(output())
            .contains("1 result(s) for 'smith'")
            .contains("P1")
            .contains("SMITH JOHN")
            .contains("25.50");
    }

    @Test
    void shouldOmitHeaderWhenQuiet() {
        ConsoleReporter reporter = new ConsoleReporter(true, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        reporter.printSearchResults("smith", List.of());

        assertThat(output()).isEmpty();
    }

    @Test
    void shouldPrintIndexLagInStatus() {
        ConsoleReporter reporter = new ConsoleReporter(false, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        reporter.printStatus("data/unclaimed.db", 120, 100, 120);

        assertThat(output()).contains("Records:         120").contains("Index Lag:       20");
    }
}
