package com.example.waterrights.config;

import com.example.waterrights.application.service.extraction.TextDecoder;
import com.example.waterrights.infrastructure.concurrent.ParserExecutors;
import com.example.waterrights.infrastructure.pdf.PdfBoxTextDecoder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans of the report pipeline that depend on configuration values.
 */
@Configuration
public class ReportParserConfiguration {

    @Bean
    public TextDecoder reportTextDecoder(ReportParserProperties properties) {
        return PdfBoxTextDecoder.forEncoding(properties.textEncoding());
    }

    @Bean(destroyMethod = "close")
    public ParserExecutors parserExecutors(ReportParserProperties properties) {
        return ParserExecutors.create(properties.effectiveWorkerThreads());
    }
}
