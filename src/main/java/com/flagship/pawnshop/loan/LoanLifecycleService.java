package com.flagship.pawnshop.loan;

import com.flagship.pawnshop.application.LoanApplicationRepository;
import com.flagship.pawnshop.common.CodeGenerator;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.InvalidStateException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.inventory.ItemRepository;
import com.flagship.pawnshop.inventory.ItemStatus;
import com.flagship.pawnshop.loan.dto.CreateLoanRequest;
import com.flagship.pawnshop.loan.dto.DefaultLoanRequest;
import com.flagship.pawnshop.loan.dto.ExtendLoanRequest;
import com.flagship.pawnshop.loan.dto.RedeemLoanRequest;
import com.flagship.pawnshop.loan.dto.UpdateLoanRequest;
import com.flagship.pawnshop.loan.event.LoanDefaultedEvent;
import com.flagship.pawnshop.loan.event.LoanEvent;
import com.flagship.pawnshop.loan.event.LoanExtendedEvent;
import com.flagship.pawnshop.loan.event.LoanOriginatedEvent;
import com.flagship.pawnshop.loan.event.LoanPaymentRecordedEvent;
import com.flagship.pawnshop.loan.event.LoanRedeemedEvent;
import com.flagship.pawnshop.observability.CorrelationContext;
import com.flagship.pawnshop.observability.LoanMetrics;
import com.flagship.pawnshop.outbox.OutboxService;
import com.flagship.pawnshop.payment.IdempotencyService;
import com.flagship.pawnshop.payment.PaymentEntity;
import com.flagship.pawnshop.payment.PaymentRepository;
import com.flagship.pawnshop.payment.dto.PaymentRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Loan lifecycle engine: origination, payments, extension, redemption, default
 * and operator corrections.
 *
 * Key principles:
 * - Each operation is one transaction; the loan, its payments, the collateral item
 *   and the outbox event commit or roll back together
 * - The loan row is locked for the duration of every mutation, so concurrent
 *   payments on one loan serialize their balance recomputation
 * - Validate-then-write: every status and business check runs before the first write
 * - Totals are recomputed from the payments table, the stored values are a cache
 * - Terminal loans (COMPLETED, DEFAULTED, CANCELLED) are never written again
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanLifecycleService {

    private final LoanRepository loanRepository;
    private final CustomerRepository customerRepository;
    private final ItemRepository itemRepository;
    private final LoanApplicationRepository applicationRepository;
    private final PaymentRepository paymentRepository;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final LoanMetrics loanMetrics;
    private final Clock clock;

    /**
     * Originates a loan against a pledgeable item, optionally with a first payment.
     * The item is marked PAWNED, or REDEEMED if the first payment already settles the loan.
     *
     * @throws NotFoundException if the customer, item or application does not exist
     * @throws InvalidStateException if the item is not PAWNED or FOR_SALE
     * @throws BusinessValidationException on invalid terms or initial status
     */
    @Transactional
    public LoanView createLoan(CreateLoanRequest request) {
        UUID loanId = UUID.randomUUID();
        return run("create", loanId, () -> {
            if (!customerRepository.existsById(request.getCustomerId())) {
                throw new NotFoundException("Customer", request.getCustomerId());
            }
            ItemEntity item = itemRepository.findById(request.getItemId())
                .orElseThrow(() -> new NotFoundException("Item", request.getItemId()));
            if (request.getApplicationId() != null && !applicationRepository.existsById(request.getApplicationId())) {
                throw new NotFoundException("Application", request.getApplicationId());
            }
            if (!item.isPledgeable()) {
                throw new InvalidStateException(String.format(
                    "Item %s is not available for a loan", item.getItemCode()), item.getStatus());
            }

            LocalDate today = LocalDate.now(clock);
            Loan loan = Loan.originate(loanId, CodeGenerator.loanCode(), request.getCustomerId(),
                request.getItemId(), request.getApplicationId(), request.getPrincipal(),
                request.getInterestRate(), request.getTermDays(), request.getStartDate(),
                request.getDueDate(), request.getStatus(), request.getCollateralDescription(),
                request.getNotes());

            PaymentRequest initialPayment = request.getInitialPayment();
            BigDecimal totalPaid = initialPayment != null ? initialPayment.getAmount() : BigDecimal.ZERO;
            LoanDetails details = LoanCalculator.computeLoanDetails(loan, totalPaid, today);
            Loan toStore = loan.withTotals(details);
            if (initialPayment != null && details.isFullyPaid()) {
                toStore = toStore.completeByPayment(today);
            }

            // Writes
            LoanEntity saved = loanRepository.save(LoanEntity.fromDomain(toStore));
            item.changeStatus(toStore.getStatus() == LoanStatus.COMPLETED ? ItemStatus.REDEEMED : ItemStatus.PAWNED);
            itemRepository.save(item);

            Loan stored = saved.toDomain();
            saveEvent(stored, LoanOriginatedEvent.EVENT_TYPE, LoanOriginatedEvent.from(stored));
            if (initialPayment != null) {
                PaymentEntity payment = paymentRepository.save(toPayment(loanId, initialPayment, today, null));
                saveEvent(stored, LoanPaymentRecordedEvent.EVENT_TYPE, LoanPaymentRecordedEvent.from(
                    stored, payment.getId(), payment.getPaymentNumber(), payment.getAmount()));
                loanMetrics.recordPayment(payment.getPaymentMethod().name(), payment.getAmount().doubleValue());
            }

            loanMetrics.incrementOriginated();
            if (stored.getStatus() == LoanStatus.COMPLETED) {
                loanMetrics.incrementCompleted();
            }
            log.info("Loan created: loanCode={}, customerId={}, itemId={}, principal={}, status={}",
                stored.getLoanCode(), stored.getCustomerId(), stored.getItemId(),
                stored.getPrincipal(), stored.getStatus());
            return new LoanView(stored, details);
        });
    }

    /**
     * Posts a payment. When the payments cover principal plus interest the loan
     * becomes COMPLETED and its item REDEEMED, in the same transaction.
     *
     * @param idempotencyKey optional; a repeated key returns the original payment
     * @throws NotFoundException if the loan does not exist
     * @throws InvalidStateException unless the loan is PENDING, ACTIVE, OVERDUE or EXTENDED
     * @throws BusinessValidationException if the key was already used for another loan
     */
    @Transactional
    public PaymentPosting addPayment(UUID loanId, PaymentRequest request, String idempotencyKey) {
        return run("payment", loanId, () -> {
            if (idempotencyKey != null) {
                Optional<PaymentPosting> replay = findReplay(loanId, idempotencyKey);
                if (replay.isPresent()) {
                    return replay.get();
                }
            }

            LoanEntity entity = lockLoan(loanId);
            Loan loan = entity.toDomain();
            LocalDate today = LocalDate.now(clock);
            if (idempotencyKey != null) {
                // A concurrent request with the same key may have committed while we waited for the lock
                Optional<PaymentEntity> committed = paymentRepository.findByIdempotencyKey(idempotencyKey);
                if (committed.isPresent()) {
                    return replayOf(committed.get(), loanId, loan, today);
                }
            }
            loan.requirePayable();

            BigDecimal totalPaid = paymentRepository.sumAmountByLoanId(loanId).add(request.getAmount());
            LoanDetails details = LoanCalculator.computeLoanDetails(loan, totalPaid, today);
            Loan updated = loan.withTotals(details);
            boolean paidOff = details.isFullyPaid();
            if (paidOff) {
                updated = updated.completeByPayment(today);
            }

            // Writes
            PaymentEntity payment = paymentRepository.save(toPayment(loanId, request, today, idempotencyKey));
            if (paidOff) {
                changeItemStatus(loan.getItemId(), ItemStatus.REDEEMED);
            }
            entity.updateFromDomain(updated);
            loanRepository.save(entity);

            saveEvent(updated, LoanPaymentRecordedEvent.EVENT_TYPE, LoanPaymentRecordedEvent.from(
                updated, payment.getId(), payment.getPaymentNumber(), payment.getAmount()));
            if (idempotencyKey != null) {
                rememberAfterCommit(idempotencyKey, payment.getId());
            }

            loanMetrics.recordPayment(payment.getPaymentMethod().name(), payment.getAmount().doubleValue());
            if (paidOff) {
                loanMetrics.incrementCompleted();
            }
            log.info("Payment recorded: paymentNumber={}, amount={}, totalPaid={}, remaining={}, status={}",
                payment.getPaymentNumber(), payment.getAmount(), details.getTotalPaid(),
                details.getRemainingBalance(), updated.getStatus());
            return new PaymentPosting(payment, new LoanView(updated, details), false);
        });
    }

    /**
     * Pushes the due date back and marks the loan EXTENDED. An optional fee is recorded
     * first; a fee large enough to settle the loan is refused, redemption is the way to close it.
     *
     * @throws InvalidStateException unless the loan is ACTIVE or OVERDUE
     * @throws BusinessValidationException if additionalDays is not positive or the fee would settle the loan
     */
    @Transactional
    public LoanView extendLoan(UUID loanId, ExtendLoanRequest request) {
        return run("extend", loanId, () -> {
            LoanEntity entity = lockLoan(loanId);
            Loan loan = entity.toDomain();
            LocalDate today = LocalDate.now(clock);
            Loan extended = loan.extend(request.getAdditionalDays(), today, request.getNotes());

            PaymentRequest fee = request.getPayment();
            BigDecimal totalPaid = paymentRepository.sumAmountByLoanId(loanId);
            if (fee != null) {
                totalPaid = totalPaid.add(fee.getAmount());
            }
            LoanDetails details = LoanCalculator.computeLoanDetails(extended, totalPaid, today);
            if (fee != null && details.isFullyPaid()) {
                throw new BusinessValidationException("extension_settles_loan",
                    "Extension payment would settle the loan; redeem it instead");
            }
            Loan updated = extended.withTotals(details);

            // Writes
            PaymentEntity payment = fee != null
                ? paymentRepository.save(toPayment(loanId, fee, today, null))
                : null;
            entity.updateFromDomain(updated);
            loanRepository.save(entity);

            if (payment != null) {
                saveEvent(updated, LoanPaymentRecordedEvent.EVENT_TYPE, LoanPaymentRecordedEvent.from(
                    updated, payment.getId(), payment.getPaymentNumber(), payment.getAmount()));
                loanMetrics.recordPayment(payment.getPaymentMethod().name(), payment.getAmount().doubleValue());
            }
            saveEvent(updated, LoanExtendedEvent.EVENT_TYPE,
                LoanExtendedEvent.from(updated, request.getAdditionalDays()));

            loanMetrics.incrementExtended();
            log.info("Loan extended: loanCode={}, additionalDays={}, newDueDate={}, extensionCount={}",
                updated.getLoanCode(), request.getAdditionalDays(), updated.getDueDate(),
                updated.getExtensionCount());
            return new LoanView(updated, details);
        });
    }

    /**
     * Closes the loan against a payment that covers the remaining balance and
     * hands the item back (REDEEMED).
     *
     * @throws InvalidStateException unless the loan is ACTIVE, OVERDUE or EXTENDED
     * @throws BusinessValidationException if the payment is below the remaining balance
     */
    @Transactional
    public LoanView redeemLoan(UUID loanId, RedeemLoanRequest request) {
        return run("redeem", loanId, () -> {
            LoanEntity entity = lockLoan(loanId);
            Loan loan = entity.toDomain();
            LocalDate today = LocalDate.now(clock);
            Loan redeemed = loan.redeem(today, request.getNotes());

            PaymentRequest payment = request.getPayment();
            BigDecimal paidSoFar = paymentRepository.sumAmountByLoanId(loanId);
            LoanDetails before = LoanCalculator.computeLoanDetails(loan, paidSoFar, today);
            if (payment.getAmount().compareTo(before.getRemainingBalance()) < 0) {
                throw new BusinessValidationException("redemption_covers_balance", String.format(
                    "Payment amount %s is less than the remaining balance %s",
                    payment.getAmount(), before.getRemainingBalance()));
            }
            LoanDetails details = LoanCalculator.computeLoanDetails(redeemed, paidSoFar.add(payment.getAmount()), today);
            Loan updated = redeemed.withTotals(details);

            // Writes
            PaymentEntity saved = paymentRepository.save(toPayment(loanId, payment, today, null));
            changeItemStatus(loan.getItemId(), ItemStatus.REDEEMED);
            entity.updateFromDomain(updated);
            loanRepository.save(entity);

            saveEvent(updated, LoanPaymentRecordedEvent.EVENT_TYPE, LoanPaymentRecordedEvent.from(
                updated, saved.getId(), saved.getPaymentNumber(), saved.getAmount()));
            saveEvent(updated, LoanRedeemedEvent.EVENT_TYPE, LoanRedeemedEvent.from(updated));

            loanMetrics.recordPayment(saved.getPaymentMethod().name(), saved.getAmount().doubleValue());
            loanMetrics.incrementCompleted();
            log.info("Loan redeemed: loanCode={}, payment={}, totalPaid={}",
                updated.getLoanCode(), saved.getAmount(), details.getTotalPaid());
            return new LoanView(updated, details);
        });
    }

    /**
     * Forfeits the loan; the item becomes the shop's (DEFAULTED).
     *
     * @throws InvalidStateException unless the loan is ACTIVE, OVERDUE or EXTENDED
     */
    @Transactional
    public LoanView defaultLoan(UUID loanId, DefaultLoanRequest request) {
        return run("default", loanId, () -> {
            LoanEntity entity = lockLoan(loanId);
            Loan loan = entity.toDomain();
            LocalDate today = LocalDate.now(clock);
            LocalDate defaultDate = request.getDefaultDate() != null ? request.getDefaultDate() : today;
            Loan defaulted = loan.markDefaulted(defaultDate, request.getReason(), request.getNotes());

            LoanDetails details = LoanCalculator.computeLoanDetails(
                defaulted, paymentRepository.sumAmountByLoanId(loanId), today);
            Loan updated = defaulted.withTotals(details);

            // Writes
            changeItemStatus(loan.getItemId(), ItemStatus.DEFAULTED);
            entity.updateFromDomain(updated);
            loanRepository.save(entity);
            saveEvent(updated, LoanDefaultedEvent.EVENT_TYPE, LoanDefaultedEvent.from(updated, request.getReason()));

            loanMetrics.incrementDefaulted();
            log.info("Loan defaulted: loanCode={}, defaultDate={}, remaining={}",
                updated.getLoanCode(), defaultDate, details.getRemainingBalance());
            return new LoanView(updated, details);
        });
    }

    /**
     * Operator correction of terms and manual status moves
     * (PENDING to ACTIVE or CANCELLED, ACTIVE or EXTENDED to OVERDUE, OVERDUE to ACTIVE).
     *
     * @throws InvalidStateException if the loan is terminal or the status move is not allowed
     */
    @Transactional
    public LoanView updateLoan(UUID loanId, UpdateLoanRequest request) {
        return run("update", loanId, () -> {
            LoanEntity entity = lockLoan(loanId);
            Loan loan = entity.toDomain();
            Loan revised = loan.revise(request.getPrincipal(), request.getInterestRate(), request.getTermDays(),
                request.getStartDate(), request.getDueDate(), request.getCollateralDescription(),
                request.getNotes());
            if (request.getStatus() != null) {
                revised = revised.transitionTo(request.getStatus());
            }

            LoanDetails details = LoanCalculator.computeLoanDetails(
                revised, paymentRepository.sumAmountByLoanId(loanId), LocalDate.now(clock));
            Loan updated = revised.withTotals(details);

            entity.updateFromDomain(updated);
            loanRepository.save(entity);
            if (loan.getStatus() != updated.getStatus()) {
                log.info("Loan status changed by operator: loanCode={}, {} -> {}",
                    updated.getLoanCode(), loan.getStatus(), updated.getStatus());
            }
            return new LoanView(updated, details);
        });
    }

    /**
     * Locks the loan ahead of a payment correction or deletion.
     *
     * @throws ConflictException if the loan is COMPLETED or DEFAULTED
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockForPaymentCorrection(UUID loanId) {
        LoanEntity entity = lockLoan(loanId);
        if (entity.getStatus() == LoanStatus.COMPLETED || entity.getStatus() == LoanStatus.DEFAULTED) {
            throw new ConflictException(String.format(
                "Cannot modify payments of a loan in %s status", entity.getStatus()));
        }
    }

    /**
     * Recomputes the stored totals after a payment correction. The status is left as is.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void refreshTotals(UUID loanId) {
        LoanEntity entity = lockLoan(loanId);
        Loan loan = entity.toDomain();
        LoanDetails details = LoanCalculator.computeLoanDetails(
            loan, paymentRepository.sumAmountByLoanId(loanId), LocalDate.now(clock));
        entity.updateFromDomain(loan.withTotals(details));
        loanRepository.save(entity);
        log.debug("Loan totals refreshed: loanId={}, totalPaid={}, remaining={}",
            loanId, details.getTotalPaid(), details.getRemainingBalance());
    }

    private Optional<PaymentPosting> findReplay(UUID loanId, String idempotencyKey) {
        Optional<UUID> existingId = idempotencyService.findPaymentId(idempotencyKey);
        if (existingId.isEmpty()) {
            loanMetrics.recordIdempotencyMiss();
            return Optional.empty();
        }
        PaymentEntity existing = paymentRepository.findById(existingId.get())
            .orElseThrow(() -> new IllegalStateException(
                "Payment found by idempotency key but not found by ID: " + existingId.get()));
        requireSameLoan(existing, loanId);
        Loan loan = loanRepository.findById(loanId)
            .orElseThrow(() -> new NotFoundException("Loan", loanId))
            .toDomain();
        return Optional.of(replayOf(existing, loanId, loan, LocalDate.now(clock)));
    }

    private PaymentPosting replayOf(PaymentEntity existing, UUID loanId, Loan loan, LocalDate today) {
        requireSameLoan(existing, loanId);
        loanMetrics.recordIdempotencyHit();
        LoanDetails details = LoanCalculator.computeLoanDetails(
            loan, paymentRepository.sumAmountByLoanId(loanId), today);
        log.info("Idempotency key already used, returning existing payment {}", existing.getPaymentNumber());
        return new PaymentPosting(existing, new LoanView(loan, details), true);
    }

    private static void requireSameLoan(PaymentEntity existing, UUID loanId) {
        if (!existing.getLoanId().equals(loanId)) {
            throw new BusinessValidationException("idempotency_key_reused",
                "Idempotency key was already used for a payment on another loan");
        }
    }

    private LoanEntity lockLoan(UUID loanId) {
        return loanRepository.findByIdForUpdate(loanId)
            .orElseThrow(() -> new NotFoundException("Loan", loanId));
    }

    private void changeItemStatus(UUID itemId, ItemStatus status) {
        ItemEntity item = itemRepository.findById(itemId)
            .orElseThrow(() -> new NotFoundException("Item", itemId));
        item.changeStatus(status);
        itemRepository.save(item);
    }

    private PaymentEntity toPayment(UUID loanId, PaymentRequest request, LocalDate today, String idempotencyKey) {
        return PaymentEntity.record(loanId, request.getAmount(),
            request.getPaymentDate() != null ? request.getPaymentDate() : today,
            request.getPaymentMethod(), request.getReferenceNumber(), request.getNotes(), idempotencyKey);
    }

    private void saveEvent(Loan loan, String eventType, LoanEvent event) {
        outboxService.saveEvent(LoanEvent.AGGREGATE_TYPE, loan.getId(), eventType, event);
    }

    /**
     * The Redis entry is written only once the payment row is committed.
     */
    private void rememberAfterCommit(String idempotencyKey, UUID paymentId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            idempotencyService.remember(idempotencyKey, paymentId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyService.remember(idempotencyKey, paymentId);
            }
        });
    }

    /**
     * Runs one lifecycle operation with the loan id in the MDC, timing it and
     * counting rule rejections.
     */
    private <T> T run(String operation, UUID loanId, Supplier<T> work) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loanId.toString());
        try {
            return loanMetrics.time(operation, work);
        } catch (InvalidStateException | BusinessValidationException | NotFoundException e) {
            loanMetrics.recordRejection(operation, rejectionReason(e));
            log.warn("Loan {} rejected: {}, duration={}ms",
                operation, e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        } catch (RuntimeException e) {
            log.error("Loan {} failed: error={}, duration={}ms",
                operation, e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
        }
    }

    private static String rejectionReason(RuntimeException e) {
        if (e instanceof BusinessValidationException validation) {
            return validation.getRule();
        }
        if (e instanceof InvalidStateException) {
            return "invalid_state";
        }
        return "not_found";
    }
}
