package com.localcooks.booking.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Kept off the application class so web-layer test slices do not need the provider URL.
 */
@Configuration
@EnableFeignClients(basePackages = "com.localcooks.booking.payment.client")
public class FeignConfig {
}
