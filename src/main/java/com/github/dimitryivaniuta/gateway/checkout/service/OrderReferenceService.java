package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;
import com.github.dimitryivaniuta.gateway.checkout.domain.Customer;
import com.github.dimitryivaniuta.gateway.checkout.domain.PaymentRequest;
import com.github.dimitryivaniuta.gateway.checkout.domain.SalesOrder;
import com.github.dimitryivaniuta.gateway.checkout.repo.CustomerRepository;
import com.github.dimitryivaniuta.gateway.checkout.repo.PaymentRequestRepository;
import com.github.dimitryivaniuta.gateway.checkout.repo.SalesOrderRepository;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.PaymentAuthorizationResult;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.ReferenceLineItem;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.ReferenceRecord;
import com.github.dimitryivaniuta.gateway.checkout.service.error.InvalidReferenceException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Order-side collaborator: checkouts pay {@link PaymentRequest}s, which in turn point at a {@link SalesOrder}.
 */
@Service
public class OrderReferenceService implements ReferenceRecordResolver, PaymentAuthorizationHandler {

    private static final Logger log = LoggerFactory.getLogger(OrderReferenceService.class);

    private final PaymentRequestRepository paymentRequestRepository;
    private final SalesOrderRepository salesOrderRepository;
    private final CustomerRepository customerRepository;

    public OrderReferenceService(
            PaymentRequestRepository paymentRequestRepository,
            SalesOrderRepository salesOrderRepository,
            CustomerRepository customerRepository
    ) {
        this.paymentRequestRepository = paymentRequestRepository;
        this.salesOrderRepository = salesOrderRepository;
        this.customerRepository = customerRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public ReferenceRecord resolve(String referenceType, String referenceId) {
        if (!PaymentRequest.REFERENCE_TYPE.equals(referenceType)) {
            throw new InvalidReferenceException("Referenced record for checkout is not a " + PaymentRequest.REFERENCE_TYPE
                    + ": " + referenceType);
        }
        PaymentRequest paymentRequest = paymentRequestRepository.findById(referenceId)
                .orElseThrow(() -> new InvalidReferenceException(
                        PaymentRequest.REFERENCE_TYPE + " '" + referenceId + "' does not exist"));

        SalesOrder order = salesOrderRepository.findById(paymentRequest.getSalesOrderId())
                .orElseThrow(() -> new InvalidReferenceException(
                        "Record referenced by " + PaymentRequest.REFERENCE_TYPE + " '" + referenceId
                                + "' is not a sales order"));

        List<ReferenceLineItem> items = order.getItems().stream()
                .map(i -> new ReferenceLineItem(i.getItemCode(), i.getRate(), i.getQty()))
                .toList();

        String mobile = customerRepository.findById(order.getCustomerId())
                .map(Customer::getMobileNo)
                .filter(m -> !m.isBlank())
                .orElse(null);

        return new ReferenceRecord(
                PaymentRequest.REFERENCE_TYPE,
                paymentRequest.getId(),
                items,
                mobile,
                paymentRequest.getGrandTotal(),
                paymentRequest.getCurrency()
        );
    }

    /**
     * Marks the payment request as paid. Runs inside the settlement transaction.
     */
    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentAuthorizationResult onPaymentAuthorized(String referenceType, String referenceId, CheckoutStatus status) {
        PaymentRequest paymentRequest = paymentRequestRepository.findById(referenceId)
                .orElseThrow(() -> new IllegalStateException(
                        referenceType + " '" + referenceId + "' disappeared before payment authorization"));

        if (paymentRequest.markPaid()) {
            paymentRequestRepository.save(paymentRequest);
            log.info("Payment request marked paid. paymentRequest={} salesOrder={}",
                    paymentRequest.getId(), paymentRequest.getSalesOrderId());
        }
        return new PaymentAuthorizationResult(paymentRequest.getSuccessRedirect(), null, null);
    }
}
