package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.config.AppProperties;
import java.net.URI;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RedirectBuilderTest {

    private final AppProperties properties = new AppProperties();
    private final RedirectBuilder builder = new RedirectBuilder(properties);

    @Test
    void overrideTargetKeepsItsQueryAndHintsAreEncoded() {
        String url = builder.build("payment-success", "thanks?id=7", null, "hi there");
        Assertions.assertEquals("http://localhost:8080/thanks?id=7&redirect_message=hi%20there", url);
    }

    @Test
    void defaultTargetWithBothHints() {
        String url = builder.build("payment-failed", null, "/orders/1", "try again");
        Assertions.assertEquals(
                "http://localhost:8080/payment-failed?redirect_to=%2Forders%2F1&redirect_message=try%20again", url);
    }

    @Test
    void blankHintsAreLeftOut() {
        Assertions.assertEquals("http://localhost:8080/payment-failed", builder.build("payment-failed", " ", "", null));
    }

    @Test
    void overrideWithSpacesIsPercentEncoded() {
        String url = builder.build("payment-success", "terima kasih?id=7", null, "hi there");
        Assertions.assertEquals("http://localhost:8080/terima%20kasih?id=7&redirect_message=hi%20there", url);
        Assertions.assertDoesNotThrow(() -> URI.create(url));
    }

    @Test
    void nonAsciiOverrideIsPercentEncoded() {
        Assertions.assertEquals("http://localhost:8080/terima-kasih/%C3%BC",
                builder.build("payment-success", "terima-kasih/\u00fc", null, null));
    }

    @Test
    void encodedOverrideIsNotEncodedTwice() {
        Assertions.assertEquals("http://localhost:8080/terima%20kasih",
                builder.build("payment-success", "terima%20kasih", null, null));
    }

    @Test
    void offSiteOverrideIsIgnored() {
        Assertions.assertEquals("http://localhost:8080/payment-success",
                builder.build("payment-success", "https://evil.example/phish", null, null));
        Assertions.assertEquals("http://localhost:8080/payment-success",
                builder.build("payment-success", "//evil.example/phish", null, null));
    }

    @Test
    void absoluteOverrideOnSameSiteIsKept() {
        Assertions.assertEquals("http://localhost:8080/orders/1",
                builder.build("payment-success", "http://localhost:8080/orders/1", null, null));
    }

    @Test
    void trailingSlashOnBaseUrlIsNormalized() {
        properties.getCheckout().setSiteBaseUrl("https://shop.example/");
        Assertions.assertEquals("https://shop.example/payment-failed", builder.build("/payment-failed", null, null, null));
    }

    @Test
    void successTargetNamesTheReferenceRecord() {
        Assertions.assertEquals("payment-success?doctype=PaymentRequest&docname=PR%2F0001",
                builder.successTarget("PaymentRequest", "PR/0001"));
    }

    @Test
    void confirmationUrlCarriesOnlyTheToken() {
        Assertions.assertEquals("http://localhost:8080/api/checkout/confirm_payment?token=PR%200001",
                builder.confirmationUrl("PR 0001"));
    }
}
