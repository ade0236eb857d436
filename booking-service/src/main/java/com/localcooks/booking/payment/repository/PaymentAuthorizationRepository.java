package com.localcooks.booking.payment.repository;

import com.localcooks.booking.payment.model.PaymentAuthorization;
import com.localcooks.booking.payment.model.PaymentAuthorization.AuthorizationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

public interface PaymentAuthorizationRepository extends JpaRepository<PaymentAuthorization, Long> {

    Optional<PaymentAuthorization> findByAuthorizationRef(String authorizationRef);

    /**
     * Books {@code amount} against the hold before the provider is asked to capture it.
     * Returns 0 when the hold is not capturable or has less than {@code amount} left.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PaymentAuthorization a
           SET a.amountCapturedCents = a.amountCapturedCents + :amount,
               a.status = CASE WHEN a.amountCapturedCents + :amount >= a.amountAuthorizedCents
                               THEN :captured ELSE :partial END,
               a.updatedAt = :now
           WHERE a.authorizationRef = :ref
             AND a.status IN (:capturable)
             AND a.amountAuthorizedCents - a.amountCapturedCents >= :amount
           """)
    int reserveCapture(@Param("ref") String authorizationRef,
                       @Param("amount") long amount,
                       @Param("captured") AuthorizationStatus captured,
                       @Param("partial") AuthorizationStatus partial,
                       @Param("capturable") Collection<AuthorizationStatus> capturable,
                       @Param("now") LocalDateTime now);

    /** Undoes {@link #reserveCapture} after the provider refused the capture. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PaymentAuthorization a
           SET a.amountCapturedCents = a.amountCapturedCents - :amount,
               a.status = CASE WHEN a.amountCapturedCents - :amount = 0
                               THEN :uncaptured ELSE :partial END,
               a.updatedAt = :now
           WHERE a.authorizationRef = :ref
             AND a.amountCapturedCents >= :amount
           """)
    int releaseCapture(@Param("ref") String authorizationRef,
                       @Param("amount") long amount,
                       @Param("uncaptured") AuthorizationStatus uncaptured,
                       @Param("partial") AuthorizationStatus partial,
                       @Param("now") LocalDateTime now);

    /** Latest charge only; each capture keeps its own charge id in its idempotency record. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PaymentAuthorization a
           SET a.providerChargeId = :chargeId,
               a.updatedAt = :now
           WHERE a.authorizationRef = :ref
           """)
    int recordCharge(@Param("ref") String authorizationRef,
                     @Param("chargeId") String providerChargeId,
                     @Param("now") LocalDateTime now);

    /** Moves an untouched hold to {@code status}. Returns 0 once anything was captured. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PaymentAuthorization a
           SET a.status = :status,
               a.updatedAt = :now
           WHERE a.authorizationRef = :ref
             AND a.amountCapturedCents = 0
             AND a.status IN (:from)
           """)
    int transitionUncaptured(@Param("ref") String authorizationRef,
                             @Param("from") Collection<AuthorizationStatus> from,
                             @Param("status") AuthorizationStatus status,
                             @Param("now") LocalDateTime now);

    /**
     * Books a refund against the captured funds of a hold. Returns 0 when it would exceed what was captured.
     * Keyed by the hold, since a shared hold carries one charge per capture.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PaymentAuthorization a
           SET a.amountRefundedCents = a.amountRefundedCents + :amount,
               a.status = CASE WHEN a.amountRefundedCents + :amount >= a.amountCapturedCents
                               THEN :refunded ELSE a.status END,
               a.updatedAt = :now
           WHERE a.authorizationRef = :ref
             AND a.amountCapturedCents - a.amountRefundedCents >= :amount
           """)
    int reserveRefund(@Param("ref") String authorizationRef,
                      @Param("amount") long amount,
                      @Param("refunded") AuthorizationStatus refunded,
                      @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE PaymentAuthorization a
           SET a.amountRefundedCents = a.amountRefundedCents - :amount,
               a.status = CASE WHEN a.amountCapturedCents >= a.amountAuthorizedCents
                               THEN :captured ELSE :partial END,
               a.updatedAt = :now
           WHERE a.authorizationRef = :ref
             AND a.amountRefundedCents >= :amount
           """)
    int releaseRefund(@Param("ref") String authorizationRef,
                      @Param("amount") long amount,
                      @Param("captured") AuthorizationStatus captured,
                      @Param("partial") AuthorizationStatus partial,
                      @Param("now") LocalDateTime now);
}
