package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutToken;
import com.github.dimitryivaniuta.gateway.checkout.repo.CheckoutTokenRepository;
import com.github.dimitryivaniuta.gateway.checkout.service.error.AlreadySettledException;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistence of checkout tokens.
 *
 * <p>The latest checkout for a reference supersedes a PENDING one. A COMPLETED one is never touched again.</p>
 */
@Service
public class CheckoutTokenStore {

    private static final Logger log = LoggerFactory.getLogger(CheckoutTokenStore.class);

    static final String LOCK_SCOPE = "checkout:token";

    private final CheckoutTokenRepository repository;
    private final PostgresAdvisoryLockService advisoryLockService;

    public CheckoutTokenStore(CheckoutTokenRepository repository, PostgresAdvisoryLockService advisoryLockService) {
        this.repository = repository;
        this.advisoryLockService = advisoryLockService;
    }

    @Transactional(readOnly = true)
    public Optional<CheckoutToken> find(String token) {
        return repository.findById(token);
    }

    /**
     * Fails fast when the reference record already has a completed checkout.
     *
     * @param referenceType reference type
     * @param referenceId reference id (the token)
     */
    @Transactional(readOnly = true)
    public void requireNotSettled(String referenceType, String referenceId) {
        if (repository.findById(referenceId).filter(CheckoutToken::isCompleted).isPresent()) {
            throw new AlreadySettledException(referenceType, referenceId);
        }
    }

    /**
     * Saves a freshly created checkout, superseding a PENDING or FAILED one for the same reference.
     *
     * @param candidate new PENDING token
     * @return persisted token
     * @throws AlreadySettledException if the reference got paid in the meantime
     */
    @Transactional
    public CheckoutToken save(CheckoutToken candidate) {
        advisoryLockService.lock(LOCK_SCOPE, candidate.getToken());

        Optional<CheckoutToken> existing = repository.findByTokenForUpdate(candidate.getToken());
        if (existing.isEmpty()) {
            return repository.save(candidate);
        }

        CheckoutToken current = existing.get();
        if (current.isCompleted()) {
            log.warn("Reference settled while a new invoice was created; invoice {} is orphaned. token={}",
                    candidate.getProviderInvoiceId(), candidate.getToken());
            throw new AlreadySettledException(current.getReferenceType(), current.getReferenceId());
        }

        log.info("Superseding checkout. token={} previousInvoiceId={} previousStatus={} newInvoiceId={}",
                current.getToken(), current.getProviderInvoiceId(), current.getStatus(), candidate.getProviderInvoiceId());
        current.supersede(candidate);
        return repository.save(current);
    }

    /**
     * PENDING to FAILED. No-op for any other status, or when the token already points at another invoice.
     *
     * @param token token
     * @param invoiceId provider invoice that was found unpaid
     * @param rawOutput latest provider payload
     * @return true if the status changed
     */
    @Transactional
    public boolean markFailed(String token, String invoiceId, String rawOutput) {
        return repository.markFailed(token, invoiceId, rawOutput, Instant.now()) == 1;
    }
}
