package com.flagship.banking_ledger.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for the CSV account store.
 *
 * Cells are read verbatim (no trimming) because account names are matched exactly.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
            // Blank trailing lines in hand-edited files
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
    }
}
