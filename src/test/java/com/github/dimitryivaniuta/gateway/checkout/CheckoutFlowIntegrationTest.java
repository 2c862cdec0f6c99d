package com.github.dimitryivaniuta.gateway.checkout;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;
import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutToken;
import com.github.dimitryivaniuta.gateway.checkout.domain.Customer;
import com.github.dimitryivaniuta.gateway.checkout.domain.PaymentRequest;
import com.github.dimitryivaniuta.gateway.checkout.domain.PaymentRequestStatus;
import com.github.dimitryivaniuta.gateway.checkout.domain.SalesOrder;
import com.github.dimitryivaniuta.gateway.checkout.domain.SalesOrderItem;
import com.github.dimitryivaniuta.gateway.checkout.provider.InvoiceProvider;
import com.github.dimitryivaniuta.gateway.checkout.provider.dto.ProviderInvoice;
import com.github.dimitryivaniuta.gateway.checkout.repo.CheckoutTokenRepository;
import com.github.dimitryivaniuta.gateway.checkout.repo.CustomerRepository;
import com.github.dimitryivaniuta.gateway.checkout.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.gateway.checkout.repo.PaymentRequestRepository;
import com.github.dimitryivaniuta.gateway.checkout.repo.SalesOrderRepository;
import com.github.dimitryivaniuta.gateway.checkout.service.CheckoutService;
import com.github.dimitryivaniuta.gateway.checkout.service.CheckoutTokenStore;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.ConfirmationResult;
import com.github.dimitryivaniuta.gateway.checkout.service.error.AlreadySettledException;
import com.github.dimitryivaniuta.gateway.checkout.service.error.InvalidReferenceException;
import com.github.dimitryivaniuta.gateway.checkout.web.dto.CheckoutRequest;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * End-to-end checkout flow on Postgres with a mocked provider.
 */
@SpringBootTest
class CheckoutFlowIntegrationTest extends PostgresContainerSupport {

    @Autowired
    CheckoutService checkoutService;

    @Autowired
    CheckoutTokenRepository tokenRepository;

    @Autowired
    CheckoutTokenStore tokenStore;

    @Autowired
    PaymentRequestRepository paymentRequestRepository;

    @Autowired
    SalesOrderRepository salesOrderRepository;

    @Autowired
    CustomerRepository customerRepository;

    @Autowired
    OutboxEventRepository outboxEventRepository;

    @MockBean
    InvoiceProvider invoiceProvider;

    @MockBean
    KafkaTemplate<String, String> kafkaTemplate;

    private String paymentRequestId;

    @BeforeEach
    void seed() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);

        Customer customer = new Customer();
        customer.setId("CUST-" + suffix);
        customer.setCustomerName("Budi Santoso");
        customer.setMobileNo("+6281234567");
        customerRepository.save(customer);

        SalesOrder order = new SalesOrder();
        order.setId("SO-" + suffix);
        order.setCustomerId(customer.getId());
        order.setItems(new ArrayList<>(List.of(new SalesOrderItem("Widget", new BigDecimal("50000"), 2))));
        salesOrderRepository.save(order);

        PaymentRequest pr = new PaymentRequest();
        pr.setId("PR-" + suffix);
        pr.setSalesOrderId(order.getId());
        pr.setGrandTotal(new BigDecimal("100000"));
        pr.setCurrency("IDR");
        pr.setStatus(PaymentRequestStatus.INITIATED);
        paymentRequestRepository.save(pr);

        paymentRequestId = pr.getId();
    }

    @Test
    void checkoutStoresPendingTokenForTheInvoice() {
        when(invoiceProvider.createInvoice(any())).thenReturn(invoice("inv-1", "PENDING"));

        checkoutService.requestCheckout(request());

        CheckoutToken token = tokenRepository.findById(paymentRequestId).orElseThrow();
        Assertions.assertEquals(CheckoutStatus.PENDING, token.getStatus());
        Assertions.assertEquals("inv-1", token.getProviderInvoiceId());
        Assertions.assertEquals("PaymentRequest", token.getReferenceType());
        Assertions.assertNotNull(token.getRawOutput());
    }

    @Test
    void newCheckoutSupersedesPendingOne() {
        when(invoiceProvider.createInvoice(any()))
                .thenReturn(invoice("inv-1", "PENDING"), invoice("inv-2", "PENDING"));

        checkoutService.requestCheckout(request());
        checkoutService.requestCheckout(request());

        CheckoutToken token = tokenRepository.findById(paymentRequestId).orElseThrow();
        Assertions.assertEquals("inv-2", token.getProviderInvoiceId());
        Assertions.assertEquals(CheckoutStatus.PENDING, token.getStatus());
    }

    @Test
    void concurrentConfirmationsSettleExactlyOnce() throws Exception {
        when(invoiceProvider.createInvoice(any())).thenReturn(invoice("inv-1", "PENDING"));
        checkoutService.requestCheckout(request());
        when(invoiceProvider.getInvoice("inv-1")).thenReturn(invoice("inv-1", "PAID"));

        int callers = 6;
        ExecutorService exec = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<ConfirmationResult>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(exec.submit(() -> {
                go.await(5, TimeUnit.SECONDS);
                return checkoutService.confirm(paymentRequestId);
            }));
        }
        go.countDown();
        exec.shutdown();
        Assertions.assertTrue(exec.awaitTermination(30, TimeUnit.SECONDS));

        String expected = "http://localhost:8080/payment-success?doctype=PaymentRequest&docname=" + paymentRequestId;
        for (Future<ConfirmationResult> f : results) {
            ConfirmationResult r = f.get();
            Assertions.assertTrue(r.success());
            Assertions.assertEquals(expected, r.redirectUrl());
        }

        Assertions.assertEquals(CheckoutStatus.COMPLETED, tokenRepository.findById(paymentRequestId).orElseThrow().getStatus());
        Assertions.assertEquals(PaymentRequestStatus.PAID, paymentRequestRepository.findById(paymentRequestId).orElseThrow().getStatus());
        Assertions.assertEquals(1, outboxEventRepository.findByTokenOrderByCreatedAt(paymentRequestId).size(),
                "Exactly one completion event must be recorded");
    }

    @Test
    void settledReferenceCannotBeCheckedOutAgain() {
        when(invoiceProvider.createInvoice(any())).thenReturn(invoice("inv-1", "PENDING"));
        checkoutService.requestCheckout(request());
        when(invoiceProvider.getInvoice("inv-1")).thenReturn(invoice("inv-1", "PAID"));
        Assertions.assertTrue(checkoutService.confirm(paymentRequestId).success());

        Assertions.assertThrows(AlreadySettledException.class, () -> checkoutService.requestCheckout(request()));
        verify(invoiceProvider, times(1)).createInvoice(any());
    }

    @Test
    void expiredInvoiceFailsTokenAndNewCheckoutReopensIt() {
        when(invoiceProvider.createInvoice(any()))
                .thenReturn(invoice("inv-1", "PENDING"), invoice("inv-2", "PENDING"));
        checkoutService.requestCheckout(request());
        when(invoiceProvider.getInvoice("inv-1")).thenReturn(invoice("inv-1", "EXPIRED"));

        ConfirmationResult result = checkoutService.confirm(paymentRequestId);

        Assertions.assertFalse(result.success());
        Assertions.assertEquals(CheckoutStatus.FAILED, tokenRepository.findById(paymentRequestId).orElseThrow().getStatus());

        checkoutService.requestCheckout(request());
        CheckoutToken reopened = tokenRepository.findById(paymentRequestId).orElseThrow();
        Assertions.assertEquals(CheckoutStatus.PENDING, reopened.getStatus());
        Assertions.assertEquals("inv-2", reopened.getProviderInvoiceId());
    }

    @Test
    void outcomeOfSupersededInvoiceDoesNotTouchTheNewOne() {
        when(invoiceProvider.createInvoice(any()))
                .thenReturn(invoice("inv-1", "PENDING"), invoice("inv-2", "PENDING"));
        checkoutService.requestCheckout(request());
        checkoutService.requestCheckout(request());

        Assertions.assertFalse(tokenStore.markFailed(paymentRequestId, "inv-1", "{\"status\":\"EXPIRED\"}"));
        Assertions.assertEquals(CheckoutStatus.PENDING, tokenRepository.findById(paymentRequestId).orElseThrow().getStatus());

        when(invoiceProvider.getInvoice("inv-2")).thenReturn(invoice("inv-2", "PAID"));
        ConfirmationResult result = checkoutService.confirm(paymentRequestId);

        Assertions.assertTrue(result.success());
        Assertions.assertEquals(PaymentRequestStatus.PAID, paymentRequestRepository.findById(paymentRequestId).orElseThrow().getStatus());
    }

    @Test
    void checkoutForLessThanOwedIsRejected() {
        Assertions.assertThrows(InvalidReferenceException.class,
                () -> checkoutService.requestCheckout(request(new BigDecimal("1"))));

        Assertions.assertTrue(tokenRepository.findById(paymentRequestId).isEmpty());
        verify(invoiceProvider, times(0)).createInvoice(any());
    }

    private CheckoutRequest request() {
        return request(new BigDecimal("100000"));
    }

    private CheckoutRequest request(BigDecimal amount) {
        return new CheckoutRequest(
                amount,
                "IDR",
                "Budi Santoso",
                "budi@example.co.id",
                null,
                null,
                "Payment for " + paymentRequestId,
                "PaymentRequest",
                paymentRequestId,
                null,
                null
        );
    }

    private ProviderInvoice invoice(String id, String status) {
        return new ProviderInvoice(
                id,
                paymentRequestId,
                status,
                "https://checkout.xendit.co/web/" + id,
                new BigDecimal("100000"),
                "IDR",
                "{\"id\":\"" + id + "\",\"status\":\"" + status + "\"}"
        );
    }
}
