package com.github.dimitryivaniuta.scheduling.frequency;

import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Lets Spring Boot bind {@code application.yml} / properties values straight into {@link Frequency} fields.
 *
 * A blank value binds to {@link Frequency#NONE} ("not set"), so the owning properties class can apply its
 * own default. Anything else must parse.
 */
@Component
@ConfigurationPropertiesBinding
public class FrequencyConverter implements Converter<String, Frequency> {

    @Override
    public Frequency convert(String source) {
        if (source.isBlank()) {
            return Frequency.NONE;
        }
        return Frequency.parse(source.trim());
    }
}
