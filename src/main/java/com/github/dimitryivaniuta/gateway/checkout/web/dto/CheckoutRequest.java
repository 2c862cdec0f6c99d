package com.github.dimitryivaniuta.gateway.checkout.web.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Request payload for starting a hosted checkout.
 *
 * <p>Required: amount, currency, payer name and email, description, reference. Optional: payer mobile
 * (used only when the customer record has none), title, and the redirect hints carried to the landing page.</p>
 */
public record CheckoutRequest(
        @NotNull @Positive @Digits(integer = 17, fraction = 2) BigDecimal amount,
        @NotBlank @Size(min = 3, max = 3) String currency,
        @NotBlank @Size(max = 255) String payerName,
        @NotBlank @Email String payerEmail,
        @Size(max = 32) String payerMobile,
        @Size(max = 255) String title,
        @NotBlank @Size(max = 1000) String description,
        @NotBlank @Size(max = 64) String referenceType,
        @NotBlank @Size(max = 140) String referenceId,
        @Size(max = 1024) String redirectTo,
        @Size(max = 512) String redirectMessage
) {}
