package com.github.dimitryivaniuta.gateway.checkout.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;
import com.github.dimitryivaniuta.gateway.checkout.domain.Customer;
import com.github.dimitryivaniuta.gateway.checkout.domain.PaymentRequest;
import com.github.dimitryivaniuta.gateway.checkout.domain.PaymentRequestStatus;
import com.github.dimitryivaniuta.gateway.checkout.domain.SalesOrder;
import com.github.dimitryivaniuta.gateway.checkout.domain.SalesOrderItem;
import com.github.dimitryivaniuta.gateway.checkout.repo.CustomerRepository;
import com.github.dimitryivaniuta.gateway.checkout.repo.PaymentRequestRepository;
import com.github.dimitryivaniuta.gateway.checkout.repo.SalesOrderRepository;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.PaymentAuthorizationResult;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.ReferenceRecord;
import com.github.dimitryivaniuta.gateway.checkout.service.error.InvalidReferenceException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OrderReferenceServiceTest {

    private PaymentRequestRepository paymentRequestRepository;
    private SalesOrderRepository salesOrderRepository;
    private CustomerRepository customerRepository;
    private OrderReferenceService service;

    @BeforeEach
    void setUp() {
        paymentRequestRepository = mock(PaymentRequestRepository.class);
        salesOrderRepository = mock(SalesOrderRepository.class);
        customerRepository = mock(CustomerRepository.class);
        service = new OrderReferenceService(paymentRequestRepository, salesOrderRepository, customerRepository);
    }

    @Test
    void resolvesItemsAndCustomerMobile() {
        givenOrder("+6281234567");

        ReferenceRecord record = service.resolve("PaymentRequest", "PR-0001");

        Assertions.assertEquals("PR-0001", record.referenceId());
        Assertions.assertEquals(2, record.items().size());
        Assertions.assertEquals("Widget", record.items().get(0).name());
        Assertions.assertEquals(2, record.items().get(0).quantity());
        Assertions.assertEquals("+6281234567", record.customerMobile());
        Assertions.assertEquals(new BigDecimal("125000"), record.amountOwed());
    }

    @Test
    void blankMobileCountsAsMissing() {
        givenOrder("  ");

        Assertions.assertNull(service.resolve("PaymentRequest", "PR-0001").customerMobile());
    }

    @Test
    void otherReferenceTypesAreRejected() {
        InvalidReferenceException ex = Assertions.assertThrows(InvalidReferenceException.class,
                () -> service.resolve("Invoice", "INV-1"));
        Assertions.assertEquals(422, ex.getStatusCode().value());
    }

    @Test
    void missingPaymentRequestIsRejected() {
        when(paymentRequestRepository.findById("PR-404")).thenReturn(Optional.empty());

        Assertions.assertThrows(InvalidReferenceException.class, () -> service.resolve("PaymentRequest", "PR-404"));
    }

    @Test
    void paymentRequestWithoutSalesOrderIsRejected() {
        when(paymentRequestRepository.findById("PR-0001")).thenReturn(Optional.of(paymentRequest()));
        when(salesOrderRepository.findById("SO-1")).thenReturn(Optional.empty());

        Assertions.assertThrows(InvalidReferenceException.class, () -> service.resolve("PaymentRequest", "PR-0001"));
    }

    @Test
    void authorizationMarksPaidOnceAndReturnsSuccessPage() {
        PaymentRequest pr = paymentRequest();
        pr.setSuccessRedirect("orders/SO-1/thanks");
        when(paymentRequestRepository.findById("PR-0001")).thenReturn(Optional.of(pr));

        PaymentAuthorizationResult result = service.onPaymentAuthorized("PaymentRequest", "PR-0001", CheckoutStatus.COMPLETED);

        Assertions.assertEquals("orders/SO-1/thanks", result.redirectTarget());
        Assertions.assertEquals(PaymentRequestStatus.PAID, pr.getStatus());
        Assertions.assertNotNull(pr.getPaidAt());
        verify(paymentRequestRepository).save(pr);
    }

    @Test
    void alreadyPaidRequestIsNotSavedAgain() {
        PaymentRequest pr = paymentRequest();
        pr.setStatus(PaymentRequestStatus.PAID);
        when(paymentRequestRepository.findById("PR-0001")).thenReturn(Optional.of(pr));

        service.onPaymentAuthorized("PaymentRequest", "PR-0001", CheckoutStatus.COMPLETED);

        verify(paymentRequestRepository, never()).save(any());
    }

    private void givenOrder(String mobile) {
        SalesOrder order = new SalesOrder();
        order.setId("SO-1");
        order.setCustomerId("CUST-1");
        order.setItems(List.of(
                new SalesOrderItem("Widget", new BigDecimal("50000"), 2),
                new SalesOrderItem("Shipping", new BigDecimal("25000"), 1)));

        Customer customer = new Customer();
        customer.setId("CUST-1");
        customer.setCustomerName("Budi Santoso");
        customer.setMobileNo(mobile);

        when(paymentRequestRepository.findById("PR-0001")).thenReturn(Optional.of(paymentRequest()));
        when(salesOrderRepository.findById("SO-1")).thenReturn(Optional.of(order));
        when(customerRepository.findById("CUST-1")).thenReturn(Optional.of(customer));
    }

    private static PaymentRequest paymentRequest() {
        PaymentRequest pr = new PaymentRequest();
        pr.setId("PR-0001");
        pr.setSalesOrderId("SO-1");
        pr.setGrandTotal(new BigDecimal("125000"));
        pr.setCurrency("IDR");
        pr.setStatus(PaymentRequestStatus.INITIATED);
        return pr;
    }
}
