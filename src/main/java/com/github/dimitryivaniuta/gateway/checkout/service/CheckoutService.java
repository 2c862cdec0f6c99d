package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.config.AppProperties;
import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;
import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutToken;
import com.github.dimitryivaniuta.gateway.checkout.provider.InvoiceProvider;
import com.github.dimitryivaniuta.gateway.checkout.provider.ProviderException;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.CreateInvoiceCommand;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.InvoiceCustomer;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.InvoiceFee;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.InvoiceItem;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.ProviderInvoice;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.CheckoutResult;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.ConfirmationResult;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.PaymentAuthorizationResult;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.ReferenceRecord;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.SettlementResult;
import com.github.dimitryivaniuta.gateway.checkout.service.error.InvalidReferenceException;
import com.github.dimitryivaniuta.gateway.checkout.service.error.ProviderUnavailableException;
import com.github.dimitryivaniuta.gateway.checkout.service.error.UnknownTokenException;
import com.github.dimitryivaniuta.gateway.checkout.web.dto.CheckoutRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Checkout lifecycle: creates hosted invoices and reconciles their outcome.
 *
 * <p>Request flow:
 * <ol>
 *   <li>Reject currencies outside the allow-list (no provider call)</li>
 *   <li>Resolve the reference record, its line items and customer contact</li>
 *   <li>Reject an amount or currency that differs from what the reference record owes</li>
 *   <li>Compute the gateway fee on the amount owed</li>
 *   <li>Create the provider invoice; success and failure redirects both point at the confirmation endpoint</li>
 *   <li>Persist the PENDING token and hand back the hosted invoice URL</li>
 * </ol>
 *
 * <p>Confirmation never trusts the redirect: it re-reads the invoice from the provider and settles through
 * {@link CheckoutSettlementTxService}. It never throws; every problem ends in a failure redirect and a log line.</p>
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    /** MDC key carrying the checkout token. */
    public static final String MDC_TOKEN = "checkoutToken";

    private final InvoiceProvider invoiceProvider;
    private final ReferenceRecordResolver referenceResolver;
    private final CheckoutTokenStore tokenStore;
    private final CheckoutSettlementTxService settlementTxService;
    private final FeeCalculator feeCalculator;
    private final InvoiceStatusMapper statusMapper;
    private final RedirectBuilder redirectBuilder;
    private final AppProperties properties;

    private final Counter requestedCounter;
    private final Counter completedCounter;
    private final Counter replayedCounter;
    private final Counter confirmFailedCounter;

    /**
     * Creates the checkout service.
     *
     * @param invoiceProvider hosted invoice provider
     * @param referenceResolver resolves reference records
     * @param tokenStore checkout token persistence
     * @param settlementTxService transactional settlement
     * @param feeCalculator gateway fee
     * @param statusMapper provider status to checkout status
     * @param redirectBuilder payer redirect URLs
     * @param properties app config
     * @param meterRegistry metrics registry
     */
    public CheckoutService(
            InvoiceProvider invoiceProvider,
            ReferenceRecordResolver referenceResolver,
            CheckoutTokenStore tokenStore,
            CheckoutSettlementTxService settlementTxService,
            FeeCalculator feeCalculator,
            InvoiceStatusMapper statusMapper,
            RedirectBuilder redirectBuilder,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.invoiceProvider = invoiceProvider;
        this.referenceResolver = referenceResolver;
        this.tokenStore = tokenStore;
        this.settlementTxService = settlementTxService;
        this.feeCalculator = feeCalculator;
        this.statusMapper = statusMapper;
        this.redirectBuilder = redirectBuilder;
        this.properties = properties;

        this.requestedCounter = Counter.builder("checkout.requested").register(meterRegistry);
        this.completedCounter = Counter.builder("checkout.completed").register(meterRegistry);
        this.replayedCounter = Counter.builder("checkout.confirm.replayed").register(meterRegistry);
        this.confirmFailedCounter = Counter.builder("checkout.confirm.failed").register(meterRegistry);
    }

    /**
     * Creates a hosted invoice for a reference record.
     *
     * @param request checkout request
     * @return token and hosted invoice URL
     */
    public CheckoutResult requestCheckout(CheckoutRequest request) {
        AppProperties.Checkout checkout = properties.getCheckout();
        String currency = feeCalculator.requireSupportedCurrency(request.currency());

        ReferenceRecord reference = referenceResolver.resolve(request.referenceType(), request.referenceId());
        String token = reference.referenceId();
        tokenStore.requireNotSettled(reference.referenceType(), token);
        requireAmountOwed(reference, request.amount(), currency);

        List<InvoiceItem> items = reference.items().stream()
                .map(i -> new InvoiceItem(i.name(), i.price(), i.quantity()))
                .toList();

        String mobile = reference.customerMobile() != null ? reference.customerMobile() : blankToNull(request.payerMobile());
        InvoiceCustomer customer = new InvoiceCustomer(request.payerName(), request.payerEmail(), mobile);

        long fee = feeCalculator.computeFee(reference.amountOwed(), currency);
        String confirmationUrl = redirectBuilder.confirmationUrl(token);

        CreateInvoiceCommand command = new CreateInvoiceCommand(
                token,
                request.payerEmail(),
                request.description() != null && !request.description().isBlank() ? request.description() : request.title(),
                request.amount(),
                customer,
                checkout.isSendEmail(),
                checkout.getInvoiceDuration().toSeconds(),
                confirmationUrl,
                confirmationUrl,
                currency,
                List.of(new InvoiceFee(checkout.getFee().getType(), fee)),
                items
        );

        ProviderInvoice invoice;
        try {
            invoice = invoiceProvider.createInvoice(command);
            if (invoice.invoiceUrl() == null) {
                throw new ProviderException(ProviderException.Kind.UNEXPECTED_RESPONSE, "Provider invoice without invoice_url");
            }
        } catch (ProviderException e) {
            log.error("Invoice creation failed. token={} kind={} error={}", token, e.getKind(), e.getMessage());
            throw new ProviderUnavailableException(checkout.getGatewayName(), e);
        }

        CheckoutToken candidate = CheckoutToken.pending(
                reference.referenceType(),
                token,
                invoice.id(),
                invoice.invoiceUrl(),
                request.amount(),
                currency,
                invoice.rawJson()
        );
        candidate.withRedirectHints(blankToNull(request.redirectTo()), blankToNull(request.redirectMessage()));
        CheckoutToken saved = tokenStore.save(candidate);

        requestedCounter.increment();
        log.info("Checkout requested. token={} invoiceId={} amount={} {} fee={}",
                token, invoice.id(), request.amount(), currency, fee);
        return new CheckoutResult(saved.getToken(), invoice.invoiceUrl(), invoice.id());
    }

    /**
     * Reconciles a checkout with the provider and decides where the payer goes next.
     *
     * @param token checkout token from the provider redirect
     * @return redirect decision; never throws
     */
    public ConfirmationResult confirm(String token) {
        MDC.put(MDC_TOKEN, String.valueOf(token));
        try {
            CheckoutToken stored = token == null ? null : tokenStore.find(token).orElse(null);
            if (stored == null) {
                log.warn("Confirmation for unknown checkout token");
                confirmFailedCounter.increment();
                return failure(null, null);
            }

            ProviderInvoice invoice;
            try {
                invoice = invoiceProvider.getInvoice(stored.getProviderInvoiceId());
            } catch (ProviderException e) {
                log.error("Failed to fetch provider invoice. invoiceId={} kind={} error={}",
                        stored.getProviderInvoiceId(), e.getKind(), e.getMessage());
                confirmFailedCounter.increment();
                return failure(stored, stored.getStatus());
            }

            if (!belongsTo(invoice, stored)) {
                log.error("Provider returned an invoice for another checkout. expectedInvoiceId={} invoiceId={} externalId={}",
                        stored.getProviderInvoiceId(), invoice.id(), invoice.externalId());
                confirmFailedCounter.increment();
                return failure(stored, stored.getStatus());
            }

            CheckoutStatus mapped = statusMapper.map(invoice.status());
            if (mapped == CheckoutStatus.COMPLETED) {
                return settle(stored, invoice);
            }

            CheckoutStatus after = stored.getStatus();
            if (mapped == CheckoutStatus.FAILED || properties.getCheckout().isFailUnpaidOnConfirm()) {
                if (tokenStore.markFailed(stored.getToken(), stored.getProviderInvoiceId(), invoice.rawJson())) {
                    after = CheckoutStatus.FAILED;
                }
            }
            log.info("Checkout not paid. invoiceId={} providerStatus={} status={}",
                    invoice.id(), invoice.status(), after);
            return failure(stored, after);
        } catch (RuntimeException e) {
            log.error("Checkout confirmation failed", e);
            confirmFailedCounter.increment();
            return failure(null, null);
        } finally {
            MDC.remove(MDC_TOKEN);
        }
    }

    /**
     * Reads a token for audit purposes.
     *
     * @param token token
     * @return stored token
     * @throws UnknownTokenException if absent
     */
    public CheckoutToken getToken(String token) {
        return tokenStore.find(token).orElseThrow(() -> new UnknownTokenException(token));
    }

    /**
     * Redirect used when a confirmation result cannot be turned into a valid URL.
     *
     * @return absolute failure page URL
     */
    public String failureRedirectUrl() {
        return redirectBuilder.build(redirectBuilder.failureTarget(), null, null, null);
    }

    private void requireAmountOwed(ReferenceRecord reference, BigDecimal amount, String currency) {
        if (reference.amountOwed() == null || amount == null || reference.amountOwed().compareTo(amount) != 0) {
            throw new InvalidReferenceException(reference.referenceType() + " '" + reference.referenceId()
                    + "' owes " + reference.amountOwed() + ", checkout requested " + amount);
        }
        if (!currency.equalsIgnoreCase(reference.currency())) {
            throw new InvalidReferenceException(reference.referenceType() + " '" + reference.referenceId()
                    + "' is in " + reference.currency() + ", checkout requested " + currency);
        }
    }

    private static boolean belongsTo(ProviderInvoice invoice, CheckoutToken stored) {
        return stored.getProviderInvoiceId().equals(invoice.id())
                && (invoice.externalId() == null || stored.getToken().equals(invoice.externalId()));
    }

    private ConfirmationResult settle(CheckoutToken stored, ProviderInvoice invoice) {
        SettlementResult result = settlementTxService.complete(stored, invoice);

        if (result.status() != CheckoutStatus.COMPLETED) {
            log.error("Provider reports invoice {} as {} but checkout is {}; manual reconciliation needed",
                    invoice.id(), invoice.status(), result.status());
            confirmFailedCounter.increment();
            return failure(stored, result.status());
        }

        if (result.settled()) {
            completedCounter.increment();
        } else {
            replayedCounter.increment();
        }

        PaymentAuthorizationResult hints = result.hints();
        String url = redirectBuilder.build(
                redirectBuilder.successTarget(stored.getReferenceType(), stored.getReferenceId()),
                hints.redirectTarget(),
                hints.redirectTo(),
                hints.redirectMessage()
        );
        return new ConfirmationResult(url, CheckoutStatus.COMPLETED, true);
    }

    private ConfirmationResult failure(CheckoutToken stored, CheckoutStatus status) {
        String url = stored == null
                ? failureRedirectUrl()
                : redirectBuilder.build(redirectBuilder.failureTarget(), null, stored.getRedirectTo(), stored.getRedirectMessage());
        return new ConfirmationResult(url, status, false);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
