package com.github.dimitryivaniuta.gateway.checkout.provider;

import com.github.dimitryivaniuta.gateway.checkout.provider.dto.CreateInvoiceCommand;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.ProviderInvoice;
import java.util.List;

/**
 * Abstraction over the hosted-invoice payment provider.
 *
 * <p>All calls are synchronous and never retried. Every failure surfaces as a {@link ProviderException};
 * after a failed {@link #createInvoice} the caller must assume no invoice exists.</p>
 */
public interface InvoiceProvider {

    /**
     * Creates a hosted invoice. {@code externalId} must be the local checkout token.
     *
     * @param command invoice data
     * @return created invoice
     * @throws ProviderException on network, authentication or validation failure
     */
    ProviderInvoice createInvoice(CreateInvoiceCommand command);

    /**
     * Fetches the current state of an invoice from the provider.
     *
     * @param invoiceId provider invoice id
     * @return invoice
     * @throws ProviderException if the invoice cannot be fetched
     */
    ProviderInvoice getInvoice(String invoiceId);

    /**
     * Lists recent invoices. Used as a cheap credential probe.
     *
     * @param limit max number of invoices
     * @return invoices
     * @throws ProviderException if the provider cannot be reached or rejects the credentials
     */
    List<ProviderInvoice> listInvoices(int limit);
}
