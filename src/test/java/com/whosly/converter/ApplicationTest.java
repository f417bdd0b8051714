package com.whosly.converter;

import com.whosly.converter.config.ConverterConfig;
import com.whosly.converter.controller.ConversionController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ApplicationTest {

    @Autowired
    private ConversionController conversionController;

    @Autowired
    private ConverterConfig converterConfig;

    @Test
    void testContextLoads() {
        assertThat(conversionController).isNotNull();
        assertThat(converterConfig.getRulesRoot()).isEqualTo("config/conversion");
        assertThat(converterConfig.getTargetVersion()).isEqualTo("19c");
        assertThat(converterConfig.getParallelism()).isEqualTo(1);
        assertThat(converterConfig.getSqlExtension()).isEqualTo(".sql");
    }
}
