package com.github.dimitryivaniuta.gateway.checkout.web;

import com.github.dimitryivaniuta.gateway.checkout.service.CheckoutService;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.CheckoutResult;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.ConfirmationResult;
import com.github.dimitryivaniuta.gateway.checkout.web.dto.CheckoutRequest;
import com.github.dimitryivaniuta.gateway.checkout.web.dto.CheckoutResponse;
import com.github.dimitryivaniuta.gateway.checkout.web.dto.CheckoutTokenResponse;
import jakarta.validation.Valid;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for hosted checkouts.
 */
@RestController
@RequestMapping("/api/checkout")
public class CheckoutController {

    private static final Logger log = LoggerFactory.getLogger(CheckoutController.class);

    private final CheckoutService checkoutService;

    public CheckoutController(CheckoutService checkoutService) {
        this.checkoutService = checkoutService;
    }

    /**
     * Creates a hosted invoice and returns its URL.
     *
     * @param request request
     * @return token and invoice URL
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CheckoutResponse> requestCheckout(@Valid @RequestBody CheckoutRequest request) {
        CheckoutResult result = checkoutService.requestCheckout(request);
        return ResponseEntity.created(URI.create("/api/checkout/tokens/" + result.token()))
                .body(CheckoutResponse.from(result));
    }

    /**
     * Landing point of the provider redirect. Guest-accessible and always answers with a redirect, never
     * with an error body.
     *
     * @param token checkout token
     * @return 302 to the success or failure page
     */
    @GetMapping("/confirm_payment")
    public ResponseEntity<Void> confirmPayment(@RequestParam(name = "token", required = false) String token) {
        ConfirmationResult result = checkoutService.confirm(token);
        return ResponseEntity.status(HttpStatus.FOUND).location(redirectLocation(result.redirectUrl())).build();
    }

    /**
     * Returns the stored checkout record.
     *
     * @param token token
     * @return record
     */
    @GetMapping(value = "/tokens/{token}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CheckoutTokenResponse> getToken(@PathVariable String token) {
        return ResponseEntity.ok(CheckoutTokenResponse.from(checkoutService.getToken(token)));
    }

    private URI redirectLocation(String url) {
        if (url != null) {
            try {
                return URI.create(url);
            } catch (IllegalArgumentException e) {
                log.error("Unusable confirmation redirect, sending payer to the failure page. url={} error={}",
                        url, e.getMessage());
            }
        }
        return URI.create(checkoutService.failureRedirectUrl());
    }
}
