package com.scorpius.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Optional correlation identifiers attached to a notification (scan, contract, transaction).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationMetadata {

    String scanId;
    String contractAddress;
    String transactionHash;
    String alertId;
    String source;
}
