package com.flagship.pawnshop.transaction;

import com.flagship.pawnshop.access.UserRepository;
import com.flagship.pawnshop.common.CodeGenerator;
import com.flagship.pawnshop.common.Specs;
import com.flagship.pawnshop.common.TimeWindows;
import com.flagship.pawnshop.customer.CustomerEntity;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.InvalidStateException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.inventory.ItemRepository;
import com.flagship.pawnshop.loan.LoanEntity;
import com.flagship.pawnshop.loan.LoanRepository;
import com.flagship.pawnshop.organization.BranchRepository;
import com.flagship.pawnshop.organization.EmployeeRepository;
import com.flagship.pawnshop.payment.PaymentMethod;
import com.flagship.pawnshop.payment.PaymentRepository;
import com.flagship.pawnshop.transaction.dto.TransactionRequest;
import com.flagship.pawnshop.transaction.dto.TransactionResponse;
import com.flagship.pawnshop.transaction.dto.TransactionSearchRequest;
import com.flagship.pawnshop.transaction.dto.TransactionStats;
import com.flagship.pawnshop.transaction.dto.TransactionUpdateRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Counter transactions: create, correct, settle (complete or cancel), search and statistics.
 * COMPLETED and CANCELLED transactions are frozen.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    static final int DAYS_OF_HISTORY = 30;
    static final int MONTHS_OF_HISTORY = 12;

    private final TransactionRepository transactionRepository;
    private final BranchRepository branchRepository;
    private final CustomerRepository customerRepository;
    private final EmployeeRepository employeeRepository;
    private final UserRepository userRepository;
    private final LoanRepository loanRepository;
    private final ItemRepository itemRepository;
    private final PaymentRepository paymentRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<TransactionEntity> list(TransactionType type, TransactionStatus status, UUID customerId,
                                        LocalDate startDate, LocalDate endDate, Pageable pageable) {
        Specification<TransactionEntity> spec = Specification
            .where(Specs.<TransactionEntity>equal("type", type))
            .and(Specs.equal("status", status))
            .and(Specs.equal("customerId", customerId))
            .and(dateWindow(startDate, endDate));
        return transactionRepository.findAll(spec, pageable).getContent();
    }

    @Transactional(readOnly = true)
    public List<TransactionEntity> search(TransactionSearchRequest criteria, Pageable pageable) {
        Specification<TransactionEntity> spec = Specification
            .where(Specs.<TransactionEntity>textSearch(criteria.getSearchTerm(),
                "transactionCode", "referenceNumber", "notes"))
            .and(Specs.equal("type", criteria.getTransactionType()))
            .and(Specs.equal("status", criteria.getStatus()))
            .and(Specs.equal("paymentMethod", criteria.getPaymentMethod()))
            .and(Specs.atLeast("amount", criteria.getMinAmount()))
            .and(Specs.atMost("amount", criteria.getMaxAmount()))
            .and(Specs.equal("customerId", criteria.getCustomerId()))
            .and(Specs.equal("employeeId", criteria.getEmployeeId()))
            .and(Specs.equal("loanId", criteria.getLoanId()))
            .and(Specs.equal("itemId", criteria.getItemId()))
            .and(dateWindow(criteria.getStartDate(), criteria.getEndDate()));
        return transactionRepository.findAll(spec, pageable).getContent();
    }

    @Transactional(readOnly = true)
    public TransactionEntity get(UUID id) {
        return transactionRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Transaction", id));
    }

    /**
     * The transaction with the names of the rows it references; missing rows leave the name out.
     */
    @Transactional(readOnly = true)
    public TransactionResponse getDetail(UUID id) {
        TransactionEntity transaction = get(id);
        TransactionResponse.TransactionResponseBuilder detail = TransactionResponse.from(transaction).toBuilder();
        if (transaction.getCustomerId() != null) {
            customerRepository.findById(transaction.getCustomerId())
                .map(CustomerEntity::getFullName)
                .ifPresent(detail::customerName);
        }
        if (transaction.getEmployeeId() != null) {
            employeeRepository.findById(transaction.getEmployeeId())
                .flatMap(employee -> userRepository.findById(employee.getUserId()))
                .map(user -> user.getFirstName() + " " + user.getLastName())
                .ifPresent(detail::employeeName);
        }
        if (transaction.getLoanId() != null) {
            loanRepository.findById(transaction.getLoanId())
                .map(LoanEntity::getLoanCode)
                .ifPresent(detail::loanCode);
        }
        if (transaction.getItemId() != null) {
            itemRepository.findById(transaction.getItemId())
                .map(ItemEntity::getName)
                .ifPresent(detail::itemName);
        }
        return detail.build();
    }

    /**
     * @throws NotFoundException if the branch or any referenced customer, employee, loan, item or payment is missing
     */
    @Transactional
    public TransactionEntity create(TransactionRequest request) {
        requireExists(branchRepository, "Branch", request.getBranchId());
        requireExists(customerRepository, "Customer", request.getCustomerId());
        requireExists(employeeRepository, "Employee", request.getEmployeeId());
        requireExists(loanRepository, "Loan", request.getLoanId());
        requireExists(itemRepository, "Item", request.getItemId());
        requireExists(paymentRepository, "Payment", request.getPaymentId());

        TransactionEntity saved = transactionRepository.save(
            TransactionEntity.create(CodeGenerator.transactionCode(), request, Instant.now(clock)));
        log.info("Transaction recorded: transactionId={}, code={}, type={}, amount={}",
            saved.getId(), saved.getTransactionCode(), saved.getType(), saved.getAmount());
        return saved;
    }

    /**
     * @throws InvalidStateException if the transaction is COMPLETED or CANCELLED
     */
    @Transactional
    public TransactionEntity update(UUID id, TransactionUpdateRequest request) {
        TransactionEntity transaction = get(id);
        requireOpen(transaction, "update");
        transaction.apply(request);
        return transactionRepository.save(transaction);
    }

    @Transactional
    public TransactionEntity cancel(UUID id, String notes) {
        return settle(id, TransactionStatus.CANCELLED, "cancel", "Cancelled", notes);
    }

    @Transactional
    public TransactionEntity complete(UUID id, String notes) {
        return settle(id, TransactionStatus.COMPLETED, "complete", "Completed", notes);
    }

    @Transactional(readOnly = true)
    public TransactionStats stats() {
        LocalDate today = LocalDate.now(clock);
        YearMonth firstMonth = YearMonth.from(today).minusMonths(MONTHS_OF_HISTORY - 1L);
        List<TransactionEntity> completed = transactionRepository
            .findByStatusAndTransactionDateGreaterThanEqualAndTransactionDateLessThan(
                TransactionStatus.COMPLETED,
                TimeWindows.startOfMonth(firstMonth, clock),
                TimeWindows.endOfDay(today, clock));

        return TransactionStats.builder()
            .totalTransactions(transactionRepository.count())
            .totalAmount(transactionRepository.sumAmountByStatus(TransactionStatus.COMPLETED))
            .transactionsByType(toCounts(transactionRepository.countGroupedByType(), TransactionType.class))
            .transactionsByStatus(toCounts(transactionRepository.countGroupedByStatus(), TransactionStatus.class))
            .transactionsByPaymentMethod(toCounts(transactionRepository.countGroupedByPaymentMethod(),
                PaymentMethod.class))
            .dailyTransactions(dailySeries(completed, today))
            .monthlyTransactions(monthlySeries(completed, YearMonth.from(today)))
            .build();
    }

    private TransactionEntity settle(UUID id, TransactionStatus target, String action, String verb, String notes) {
        TransactionEntity transaction = get(id);
        requireOpen(transaction, action);
        transaction.settle(target, verb, notes, Instant.now(clock));
        TransactionEntity saved = transactionRepository.save(transaction);
        log.info("Transaction {}: transactionId={}", target, id);
        return saved;
    }

    private static void requireOpen(TransactionEntity transaction, String action) {
        if (transaction.getStatus().isFinal()) {
            throw new InvalidStateException(
                String.format("Cannot %s transaction with status: %s", action, transaction.getStatus()),
                transaction.getStatus());
        }
    }

    private static void requireExists(JpaRepository<?, UUID> repository, String entity, UUID id) {
        if (id != null && !repository.existsById(id)) {
            throw new NotFoundException(entity, id);
        }
    }

    private Specification<TransactionEntity> dateWindow(LocalDate startDate, LocalDate endDate) {
        return Specification
            .where(Specs.<TransactionEntity, Instant>atLeast("transactionDate",
                startDate == null ? null : TimeWindows.startOfDay(startDate, clock)))
            .and(Specs.before("transactionDate",
                endDate == null ? null : TimeWindows.endOfDay(endDate, clock)));
    }

    private List<TransactionStats.Daily> dailySeries(List<TransactionEntity> completed, LocalDate today) {
        List<TransactionStats.Daily> days = new ArrayList<>(DAYS_OF_HISTORY);
        for (int i = 0; i < DAYS_OF_HISTORY; i++) {
            LocalDate day = today.minusDays(i);
            List<TransactionEntity> onDay = completed.stream()
                .filter(t -> localDate(t).equals(day))
                .toList();
            days.add(new TransactionStats.Daily(day, onDay.size(), sum(onDay)));
        }
        return days;
    }

    private List<TransactionStats.Monthly> monthlySeries(List<TransactionEntity> completed, YearMonth current) {
        List<TransactionStats.Monthly> months = new ArrayList<>(MONTHS_OF_HISTORY);
        for (int i = 0; i < MONTHS_OF_HISTORY; i++) {
            YearMonth month = current.minusMonths(i);
            List<TransactionEntity> inMonth = completed.stream()
                .filter(t -> YearMonth.from(localDate(t)).equals(month))
                .toList();
            months.add(new TransactionStats.Monthly(month.toString(), inMonth.size(), sum(inMonth)));
        }
        return months;
    }

    private LocalDate localDate(TransactionEntity transaction) {
        return LocalDate.ofInstant(transaction.getTransactionDate(), clock.getZone());
    }

    private static BigDecimal sum(List<TransactionEntity> transactions) {
        return transactions.stream()
            .map(TransactionEntity::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static <E extends Enum<E>> Map<E, Long> toCounts(List<Object[]> rows, Class<E> type) {
        Map<E, Long> counts = new EnumMap<>(type);
        for (E value : type.getEnumConstants()) {
            counts.put(value, 0L);
        }
        for (Object[] row : rows) {
            counts.put(type.cast(row[0]), (Long) row[1]);
        }
        return counts;
    }
}
