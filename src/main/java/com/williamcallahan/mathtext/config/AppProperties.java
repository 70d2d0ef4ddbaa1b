package com.williamcallahan.mathtext.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root of the {@code app.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private FormattingConfig formatting = new FormattingConfig();

    /**
     * Validates every configuration section at startup.
     */
    @PostConstruct
    public void validateConfiguration() {
        formatting.validateConfiguration();
    }

    public FormattingConfig getFormatting() {
        return formatting;
    }

    public void setFormatting(FormattingConfig formatting) {
        this.formatting = formatting;
    }
}
