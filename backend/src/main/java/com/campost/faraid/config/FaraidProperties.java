package com.campost.faraid.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.RoundingMode;

/**
 * Calculation settings. Define them in application.yml under 'faraid'.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "faraid")
public class FaraidProperties {

    /** Decimal places of the estate's currency unit. */
    private int currencyScale = 2;

    private int percentageScale = 2;

    /** Decimal places used when reporting parts as a number. */
    private int partsScale = 4;

    private RoundingMode roundingMode = RoundingMode.HALF_UP;

    /** Fail instead of excluding heirs whose relationship label cannot be mapped. */
    private boolean rejectUnmappedRelationships = false;
}
