package com.example.ticketmatch.embedding;

import com.example.ticketmatch.domain.TicketQuery;
import com.example.ticketmatch.domain.TicketRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TicketTextNormalizerTest {

    @Test
    void joinsFieldsInFixedOrder() {
        assertThat(TicketTextNormalizer.normalize("Printer offline", "Hardware", "Cannot print"))
                .isEqualTo("Printer offline Hardware Cannot print");
    }

    @Test
    void missingLeadingOrTrailingFieldsAreTrimmedAway() {
        assertThat(TicketTextNormalizer.normalize(null, "Hardware", "Cannot print"))
                .isEqualTo("Hardware Cannot print");
        assertThat(TicketTextNormalizer.normalize("Printer offline", null, null))
                .isEqualTo("Printer offline");
        assertThat(TicketTextNormalizer.normalize("  VPN timeout ", "", "  "))
                .isEqualTo("VPN timeout");
    }

    @Test
    void missingMiddleFieldKeepsBothSeparators() {
        assertThat(TicketTextNormalizer.normalize("VPN", null, "timeout")).isEqualTo("VPN  timeout");
    }

    @Test
    void allFieldsMissingYieldsEmptyString() {
        assertThat(TicketTextNormalizer.normalize(null, null, null)).isEmpty();
    }

    @Test
    void recordAndQueryNormalizeIdentically() {
        TicketRecord record = TicketRecord.builder()
                .ticketId("T1").issue("Printer WiFi issue").category("Hardware").build();
        TicketQuery query = TicketQuery.builder().issue("Printer WiFi issue").category("Hardware").build();

        assertThat(TicketTextNormalizer.normalize(record))
                .isEqualTo(TicketTextNormalizer.normalize(query))
                .isEqualTo("Printer WiFi issue Hardware");
    }
}
