package com.github.dimitryivaniuta.gateway.checkout.provider.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Customer block of a provider invoice. {@code mobileNumber} is omitted from the payload when absent.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvoiceCustomer(String givenNames, String email, String mobileNumber) {}
