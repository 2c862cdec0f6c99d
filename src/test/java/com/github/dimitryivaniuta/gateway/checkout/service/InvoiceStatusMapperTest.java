package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.config.AppProperties;
import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InvoiceStatusMapperTest {

    private final InvoiceStatusMapper mapper = new InvoiceStatusMapper(new AppProperties());

    @Test
    void paidAndSettledCountAsCompleted() {
        Assertions.assertEquals(CheckoutStatus.COMPLETED, mapper.map("PAID"));
        Assertions.assertEquals(CheckoutStatus.COMPLETED, mapper.map("settled"));
    }

    @Test
    void expiredCountsAsFailed() {
        Assertions.assertEquals(CheckoutStatus.FAILED, mapper.map("EXPIRED"));
    }

    @Test
    void anythingElseIsStillPending() {
        Assertions.assertEquals(CheckoutStatus.PENDING, mapper.map("PENDING"));
        Assertions.assertEquals(CheckoutStatus.PENDING, mapper.map("SOMETHING_NEW"));
        Assertions.assertEquals(CheckoutStatus.PENDING, mapper.map(""));
        Assertions.assertEquals(CheckoutStatus.PENDING, mapper.map(null));
    }
}
