package com.github.dimitryivaniuta.gateway.checkout.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.checkout.config.AppProperties;
import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;
import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutToken;
import com.github.dimitryivaniuta.gateway.checkout.domain.OutboxEvent;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.ProviderInvoice;
import com.github.dimitryivaniuta.gateway.checkout.repo.CheckoutTokenRepository;
import com.github.dimitryivaniuta.gateway.checkout.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.PaymentAuthorizationResult;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.SettlementResult;
import com.github.dimitryivaniuta.gateway.checkout.service.events.CheckoutCompletedEvent;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional settlement of a paid checkout.
 *
 * <p>Lives in its own bean so that {@code @Transactional} goes through the Spring proxy when called from
 * {@link CheckoutService}. Within one transaction it:
 * <ol>
 *   <li>refuses an invoice whose amount or currency differs from what the checkout was created for,</li>
 *   <li>flips the token PENDING to COMPLETED with a conditional update on the token and its current invoice,</li>
 *   <li>only if that update hit a row: notifies the reference record owner, stores its redirect hints and
 *       writes a {@code CheckoutCompleted} outbox event.</li>
 * </ol>
 * A concurrent confirmation for the same token blocks on the row lock taken by the update and then matches
 * no row, so the notification runs exactly once. If the notification throws, everything rolls back and the
 * token stays PENDING.</p>
 */
@Service
public class CheckoutSettlementTxService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutSettlementTxService.class);

    static final String EVENT_TYPE = "CheckoutCompleted";

    private final CheckoutTokenRepository tokenRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final PaymentAuthorizationHandler authorizationHandler;
    private final ObjectMapper objectMapper;
    private final AppProperties properties;

    /**
     * Creates the settlement service.
     *
     * @param tokenRepository checkout token repository
     * @param outboxEventRepository outbox repository
     * @param authorizationHandler reference record owner to notify
     * @param objectMapper JSON mapper for event payloads
     * @param properties app config
     */
    public CheckoutSettlementTxService(
            CheckoutTokenRepository tokenRepository,
            OutboxEventRepository outboxEventRepository,
            PaymentAuthorizationHandler authorizationHandler,
            ObjectMapper objectMapper,
            AppProperties properties
    ) {
        this.tokenRepository = tokenRepository;
        this.outboxEventRepository = outboxEventRepository;
        this.authorizationHandler = authorizationHandler;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Settles a checkout whose invoice the provider reports as paid.
     *
     * @param token stored token (as read before the provider call)
     * @param invoice freshly fetched provider invoice
     * @return settlement result; {@code settled} is false when another confirmation got there first
     */
    @Transactional
    public SettlementResult complete(CheckoutToken token, ProviderInvoice invoice) {
        if (!chargesWhatWasRequested(token, invoice)) {
            log.error("Paid invoice does not match checkout. token={} invoiceId={} invoiceAmount={} {} expected={} {}",
                    token.getToken(), invoice.id(), invoice.amount(), invoice.currency(),
                    token.getAmount(), token.getCurrency());
            return new SettlementResult(false, token.getStatus(), storedHints(token));
        }

        int updated = tokenRepository.markCompleted(
                token.getToken(), token.getProviderInvoiceId(), invoice.rawJson(), Instant.now());
        if (updated == 0) {
            CheckoutToken latest = tokenRepository.findById(token.getToken()).orElse(token);
            log.info("Checkout not settled again. token={} status={}", token.getToken(), latest.getStatus());
            return new SettlementResult(false, latest.getStatus(), storedHints(latest));
        }

        PaymentAuthorizationResult callback = authorizationHandler.onPaymentAuthorized(
                token.getReferenceType(), token.getReferenceId(), CheckoutStatus.COMPLETED);
        PaymentAuthorizationResult hints = merge(callback, token);
        tokenRepository.updateRedirectHints(token.getToken(), hints.redirectTarget(), hints.redirectTo(), hints.redirectMessage());

        CheckoutCompletedEvent event = new CheckoutCompletedEvent(
                "1",
                UUID.randomUUID().toString(),
                Instant.now(),
                token.getToken(),
                token.getReferenceType(),
                token.getReferenceId(),
                invoice.id(),
                invoice.status(),
                token.getAmount(),
                token.getCurrency(),
                properties.getCheckout().getGatewayName()
        );
        outboxEventRepository.save(OutboxEvent.forCheckout(EVENT_TYPE, token.getToken(), toJson(event)));

        log.info("Checkout settled. token={} invoiceId={} reference={}/{}",
                token.getToken(), invoice.id(), token.getReferenceType(), token.getReferenceId());
        return new SettlementResult(true, CheckoutStatus.COMPLETED, hints);
    }

    private static boolean chargesWhatWasRequested(CheckoutToken token, ProviderInvoice invoice) {
        return invoice.amount() != null
                && token.getAmount() != null
                && invoice.amount().compareTo(token.getAmount()) == 0
                && invoice.currency() != null
                && invoice.currency().equalsIgnoreCase(token.getCurrency());
    }

    private PaymentAuthorizationResult merge(PaymentAuthorizationResult callback, CheckoutToken token) {
        PaymentAuthorizationResult c = callback == null ? PaymentAuthorizationResult.none() : callback;
        return new PaymentAuthorizationResult(
                c.redirectTarget(),
                c.redirectTo() != null ? c.redirectTo() : token.getRedirectTo(),
                c.redirectMessage() != null ? c.redirectMessage() : token.getRedirectMessage()
        );
    }

    private static PaymentAuthorizationResult storedHints(CheckoutToken token) {
        return new PaymentAuthorizationResult(token.getRedirectTarget(), token.getRedirectTo(), token.getRedirectMessage());
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize outbox payload", e);
        }
    }
}
