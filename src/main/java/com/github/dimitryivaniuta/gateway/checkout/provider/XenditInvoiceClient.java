package com.github.dimitryivaniuta.gateway.checkout.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.CreateInvoiceCommand;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.ProviderInvoice;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Xendit invoice API client (v2 invoices).
 *
 * <p>Responses are read as text first so the exact payload can be stored as the checkout's raw output,
 * then parsed. No retries: an error is reported to the caller immediately.</p>
 */
@Component
public class XenditInvoiceClient implements InvoiceProvider {

    private static final Logger log = LoggerFactory.getLogger(XenditInvoiceClient.class);

    static final String INVOICES_PATH = "/v2/invoices";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    /**
     * Creates the client.
     *
     * @param restClient rest client bound to the provider base URL with credentials
     * @param objectMapper jackson mapper
     */
    public XenditInvoiceClient(@Qualifier("providerRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderInvoice createInvoice(CreateInvoiceCommand command) {
        String body = call("create invoice for " + command.externalId(), () -> restClient.post()
                .uri(INVOICES_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(command)
                .retrieve()
                .body(String.class));

        ProviderInvoice invoice = toInvoice(readTree(body), body);
        log.info("Provider invoice created. externalId={} invoiceId={} status={}",
                command.externalId(), invoice.id(), invoice.status());
        return invoice;
    }

    @Override
    public ProviderInvoice getInvoice(String invoiceId) {
        String body = call("get invoice " + invoiceId, () -> restClient.get()
                .uri(INVOICES_PATH + "/{id}", invoiceId)
                .retrieve()
                .body(String.class));
        return toInvoice(readTree(body), body);
    }

    @Override
    public List<ProviderInvoice> listInvoices(int limit) {
        String body = call("list invoices", () -> restClient.get()
                .uri(uri -> uri.path(INVOICES_PATH).queryParam("limit", limit).build())
                .retrieve()
                .body(String.class));

        JsonNode root = readTree(body);
        if (!root.isArray()) {
            throw new ProviderException(ProviderException.Kind.UNEXPECTED_RESPONSE, "Invoice list is not a JSON array");
        }
        List<ProviderInvoice> invoices = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            invoices.add(toInvoice(node, node.toString()));
        }
        return invoices;
    }

    private String call(String operation, Supplier<String> request) {
        try {
            String body = request.get();
            if (body == null || body.isBlank()) {
                throw new ProviderException(ProviderException.Kind.UNEXPECTED_RESPONSE,
                        "Empty response from provider on " + operation);
            }
            return body;
        } catch (RestClientResponseException e) {
            HttpStatusCode status = e.getStatusCode();
            ProviderException.Kind kind = classify(status);
            log.warn("Provider call failed. operation={} status={} kind={}", operation, status.value(), kind);
            throw new ProviderException(kind,
                    "Provider rejected " + operation + " with HTTP " + status.value() + ": " + errorCode(e),
                    status.value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Provider unreachable. operation={} error={}", operation, e.getMessage());
            throw new ProviderException(ProviderException.Kind.UNAVAILABLE,
                    "Provider unreachable on " + operation, null, e);
        } catch (RestClientException e) {
            throw new ProviderException(ProviderException.Kind.UNEXPECTED_RESPONSE,
                    "Unexpected provider response on " + operation, null, e);
        }
    }

    private ProviderException.Kind classify(HttpStatusCode status) {
        if (status.value() == 401 || status.value() == 403) {
            return ProviderException.Kind.AUTHENTICATION;
        }
        if (status.value() == 404) {
            return ProviderException.Kind.NOT_FOUND;
        }
        if (status.is4xxClientError()) {
            return ProviderException.Kind.REJECTED;
        }
        return ProviderException.Kind.UNAVAILABLE;
    }

    private String errorCode(RestClientResponseException e) {
        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            return error.path("error_code").asText("UNKNOWN");
        } catch (JsonProcessingException ex) {
            return "UNKNOWN";
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.UNEXPECTED_RESPONSE,
                    "Provider response is not valid JSON", null, e);
        }
    }

    private ProviderInvoice toInvoice(JsonNode node, String rawJson) {
        String id = text(node, "id");
        String status = text(node, "status");
        if (id == null || status == null) {
            throw new ProviderException(ProviderException.Kind.UNEXPECTED_RESPONSE,
                    "Provider invoice without id or status");
        }
        JsonNode amount = node.get("amount");
        return new ProviderInvoice(
                id,
                text(node, "external_id"),
                status,
                text(node, "invoice_url"),
                amount == null || amount.isNull() ? null : new BigDecimal(amount.asText()),
                text(node, "currency"),
                rawJson
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
