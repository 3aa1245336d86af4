package io.b2mash.batchflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Domain settings for batch tracking and settlement.
 *
 * @param defaultActorId user id recorded in batch history when the caller does not identify itself
 * @param invoiceSequenceStart first sequential suffix issued for an invoice number prefix
 * @param batchCodeWidth zero-padding width of generated batch codes
 */
@ConfigurationProperties(prefix = "batchflow")
public record BatchflowProperties(
    @DefaultValue("1") long defaultActorId,
    @DefaultValue("1000") int invoiceSequenceStart,
    @DefaultValue("3") int batchCodeWidth) {}
