package com.flagship.contribution_ledger.config;

import com.flagship.contribution_ledger.ledger.EventKind;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets path variables use event kind wire names such as "quantity_change".
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, EventKind.class, EventKind::fromWireName);
    }
}
