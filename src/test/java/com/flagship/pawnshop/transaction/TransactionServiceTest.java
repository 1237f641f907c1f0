package com.flagship.pawnshop.transaction;

import com.flagship.pawnshop.access.UserRepository;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.InvalidStateException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.inventory.ItemRepository;
import com.flagship.pawnshop.loan.LoanRepository;
import com.flagship.pawnshop.organization.BranchRepository;
import com.flagship.pawnshop.organization.EmployeeRepository;
import com.flagship.pawnshop.payment.PaymentMethod;
import com.flagship.pawnshop.payment.PaymentRepository;
import com.flagship.pawnshop.transaction.dto.TransactionRequest;
import com.flagship.pawnshop.transaction.dto.TransactionStats;
import com.flagship.pawnshop.transaction.dto.TransactionUpdateRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-15T10:00:00Z");

    @Mock
    private TransactionRepository transactionRepository;
    @Mock
    private BranchRepository branchRepository;
    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private EmployeeRepository employeeRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private LoanRepository loanRepository;
    @Mock
    private ItemRepository itemRepository;
    @Mock
    private PaymentRepository paymentRepository;

    private TransactionService service;

    private final UUID branchId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new TransactionService(transactionRepository, branchRepository, customerRepository,
            employeeRepository, userRepository, loanRepository, itemRepository, paymentRepository,
            Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(transactionRepository.save(any(TransactionEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(branchRepository.existsById(branchId)).thenReturn(true);
    }

    private TransactionRequest request(TransactionStatus status, UUID customerId, Instant date) {
        return new TransactionRequest(TransactionType.SALE, new BigDecimal("250.00"), PaymentMethod.CREDIT_CARD, status,
            "REF-1", branchId, customerId, null, null, null, null, "walk-in sale", date);
    }

    private TransactionEntity stored(TransactionStatus status) {
        TransactionEntity transaction = TransactionEntity.create("TXN-0001", request(status, null, null), NOW);
        lenient().when(transactionRepository.findById(transaction.getId())).thenReturn(Optional.of(transaction));
        return transaction;
    }

    @Test
    void newTransactionIsPendingAndDatedNow() {
        TransactionEntity created = service.create(request(null, null, null));

        assertEquals(TransactionStatus.PENDING, created.getStatus());
        assertEquals(NOW, created.getTransactionDate());
        assertTrue(created.getTransactionCode().startsWith("T-"));
    }

    @Test
    void unknownCustomerIsNotFound() {
        UUID customerId = UUID.randomUUID();
        when(customerRepository.existsById(customerId)).thenReturn(false);

        NotFoundException e = assertThrows(NotFoundException.class,
            () -> service.create(request(null, customerId, null)));

        assertTrue(e.getMessage().contains("Customer"));
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void unknownBranchIsNotFound() {
        UUID otherBranch = UUID.randomUUID();
        when(branchRepository.existsById(otherBranch)).thenReturn(false);

        assertThrows(NotFoundException.class, () -> service.create(new TransactionRequest(TransactionType.PAYMENT,
            BigDecimal.TEN, PaymentMethod.CASH, null, null, otherBranch, null, null, null, null, null, null, null)));
    }

    @ParameterizedTest
    @EnumSource(value = TransactionStatus.class, names = {"COMPLETED", "CANCELLED"})
    @DisplayName("Completed and cancelled transactions are frozen")
    void finalTransactionsAreFrozen(TransactionStatus status) {
        TransactionEntity transaction = stored(status);
        UUID id = transaction.getId();

        InvalidStateException update = assertThrows(InvalidStateException.class, () -> service.update(id,
            new TransactionUpdateRequest(BigDecimal.ONE, null, null, null, null)));
        assertEquals("Cannot update transaction with status: " + status, update.getMessage());
        assertThrows(InvalidStateException.class, () -> service.cancel(id, null));
        assertThrows(InvalidStateException.class, () -> service.complete(id, null));
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void failedTransactionCanStillBeCompleted() {
        TransactionEntity transaction = stored(TransactionStatus.FAILED);

        assertEquals(TransactionStatus.COMPLETED, service.complete(transaction.getId(), null).getStatus());
    }

    @Test
    @DisplayName("Cancelling with a note appends a dated line")
    void cancelAppendsNote() {
        TransactionEntity transaction = stored(TransactionStatus.PENDING);

        TransactionEntity cancelled = service.cancel(transaction.getId(), "customer changed mind");

        assertEquals(TransactionStatus.CANCELLED, cancelled.getStatus());
        assertEquals("walk-in sale\nCancelled on 2024-06-15T10:00:00Z: customer changed mind", cancelled.getNotes());
    }

    @Test
    void completeWithoutNoteKeepsNotes() {
        TransactionEntity transaction = stored(TransactionStatus.PENDING);

        TransactionEntity completed = service.complete(transaction.getId(), "  ");

        assertEquals(TransactionStatus.COMPLETED, completed.getStatus());
        assertEquals("walk-in sale", completed.getNotes());
    }

    @Test
    void updateChangesAmount() {
        TransactionEntity transaction = stored(TransactionStatus.PENDING);

        TransactionEntity updated = service.update(transaction.getId(),
            new TransactionUpdateRequest(new BigDecimal("300.00"), null, null, null, null));

        assertEquals(0, new BigDecimal("300.00").compareTo(updated.getAmount()));
        assertEquals(PaymentMethod.CREDIT_CARD, updated.getPaymentMethod());
    }

    @Test
    @DisplayName("Statistics fill every enum value and bucket completed transactions by day and month")
    void statsSeries() {
        TransactionEntity today = TransactionEntity.create("TXN-1",
            request(TransactionStatus.COMPLETED, null, NOW), NOW);
        TransactionEntity lastMonth = TransactionEntity.create("TXN-2",
            request(TransactionStatus.COMPLETED, null, Instant.parse("2024-05-02T09:00:00Z")), NOW);
        when(transactionRepository.findByStatusAndTransactionDateGreaterThanEqualAndTransactionDateLessThan(
            any(), any(), any())).thenReturn(List.of(today, lastMonth));
        when(transactionRepository.count()).thenReturn(5L);
        when(transactionRepository.sumAmountByStatus(TransactionStatus.COMPLETED)).thenReturn(new BigDecimal("500.00"));
        when(transactionRepository.countGroupedByType()).thenReturn(List.<Object[]>of(new Object[]{TransactionType.SALE, 5L}));
        when(transactionRepository.countGroupedByStatus()).thenReturn(List.of());
        when(transactionRepository.countGroupedByPaymentMethod()).thenReturn(List.of());

        TransactionStats stats = service.stats();

        assertEquals(5L, stats.getTotalTransactions());
        assertEquals(5L, stats.getTransactionsByType().get(TransactionType.SALE));
        assertEquals(0L, stats.getTransactionsByType().get(TransactionType.REFUND));
        assertEquals(TransactionStatus.values().length, stats.getTransactionsByStatus().size());

        assertEquals(30, stats.getDailyTransactions().size());
        TransactionStats.Daily first = stats.getDailyTransactions().get(0);
        assertEquals(LocalDate.of(2024, 6, 15), first.getDate());
        assertEquals(1L, first.getCount());

        assertEquals(12, stats.getMonthlyTransactions().size());
        assertEquals("2024-06", stats.getMonthlyTransactions().get(0).getMonth());
        assertEquals("2024-05", stats.getMonthlyTransactions().get(1).getMonth());
        assertEquals(0, new BigDecimal("250.00").compareTo(stats.getMonthlyTransactions().get(1).getAmount()));
    }
}
