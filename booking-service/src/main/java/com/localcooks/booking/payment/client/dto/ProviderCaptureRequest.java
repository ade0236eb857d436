package com.localcooks.booking.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProviderCaptureRequest(
        @JsonProperty("amount_to_capture") long amountToCapture
) {
}
