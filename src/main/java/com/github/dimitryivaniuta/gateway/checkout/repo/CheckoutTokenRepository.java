package com.github.dimitryivaniuta.gateway.checkout.repo;

import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutToken;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * JPA repository for {@link CheckoutToken}.
 *
 * <p>Status changes go through the conditional updates below. Each is a single statement guarded by
 * {@code status = 'PENDING'} and by the provider invoice the caller reconciled, so when two confirmations race,
 * Postgres lets exactly one of them see an affected row; the other blocks on the row lock and then matches
 * nothing. A confirmation holding an invoice that has since been superseded never matches either.</p>
 */
public interface CheckoutTokenRepository extends JpaRepository<CheckoutToken, String> {

    /**
     * Finds the token and locks it for the duration of the transaction.
     *
     * @param token token
     * @return token
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from CheckoutToken t where t.token = :token")
    Optional<CheckoutToken> findByTokenForUpdate(@Param("token") String token);

    /**
     * PENDING to COMPLETED.
     *
     * @param token token
     * @param invoiceId provider invoice the payload belongs to
     * @param rawOutput latest provider payload
     * @param now timestamp
     * @return number of rows changed (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update CheckoutToken t
               set t.status = com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus.COMPLETED,
                   t.rawOutput = :rawOutput,
                   t.completedAt = :now,
                   t.updatedAt = :now
             where t.token = :token
               and t.providerInvoiceId = :invoiceId
               and t.status = com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus.PENDING
            """)
    int markCompleted(
            @Param("token") String token,
            @Param("invoiceId") String invoiceId,
            @Param("rawOutput") String rawOutput,
            @Param("now") Instant now
    );

    /**
     * PENDING to FAILED.
     *
     * @param token token
     * @param invoiceId provider invoice the payload belongs to
     * @param rawOutput latest provider payload
     * @param now timestamp
     * @return number of rows changed (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update CheckoutToken t
               set t.status = com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus.FAILED,
                   t.rawOutput = :rawOutput,
                   t.updatedAt = :now
             where t.token = :token
               and t.providerInvoiceId = :invoiceId
               and t.status = com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus.PENDING
            """)
    int markFailed(
            @Param("token") String token,
            @Param("invoiceId") String invoiceId,
            @Param("rawOutput") String rawOutput,
            @Param("now") Instant now
    );

    /**
     * Stores the redirect hints in effect after settlement, so later confirmations redirect to the same place.
     *
     * @param token token
     * @param redirectTarget override target or null
     * @param redirectTo redirect_to hint or null
     * @param redirectMessage redirect_message hint or null
     * @return number of rows changed
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update CheckoutToken t
               set t.redirectTarget = :redirectTarget,
                   t.redirectTo = :redirectTo,
                   t.redirectMessage = :redirectMessage
             where t.token = :token
            """)
    int updateRedirectHints(
            @Param("token") String token,
            @Param("redirectTarget") String redirectTarget,
            @Param("redirectTo") String redirectTo,
            @Param("redirectMessage") String redirectMessage
    );
}
