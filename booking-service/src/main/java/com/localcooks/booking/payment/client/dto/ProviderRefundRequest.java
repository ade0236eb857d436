package com.localcooks.booking.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProviderRefundRequest(
        @JsonProperty("charge") String chargeRef,
        @JsonProperty("amount") long amount
) {
}
