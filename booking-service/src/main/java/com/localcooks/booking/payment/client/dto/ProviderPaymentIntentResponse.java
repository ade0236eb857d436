package com.localcooks.booking.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderPaymentIntentResponse(
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("amount") Long amount,
        @JsonProperty("amount_received") Long amountReceived,
        @JsonProperty("latest_charge") String latestCharge
) {
}
