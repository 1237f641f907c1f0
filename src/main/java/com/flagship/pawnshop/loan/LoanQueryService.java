package com.flagship.pawnshop.loan;

import com.flagship.pawnshop.common.Specs;
import com.flagship.pawnshop.common.TimeWindows;
import com.flagship.pawnshop.customer.CustomerEntity;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.inventory.ItemRepository;
import com.flagship.pawnshop.loan.dto.LoanResponse;
import com.flagship.pawnshop.loan.dto.LoanSearchRequest;
import com.flagship.pawnshop.loan.dto.LoanStats;
import com.flagship.pawnshop.payment.PaymentRepository;
import com.flagship.pawnshop.payment.dto.PaymentResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the loan ledger: filtered lists, search, detail view and statistics.
 * Every loan is returned with its figures computed for today from the payments table.
 */
@Service
@RequiredArgsConstructor
public class LoanQueryService {

    private static final int MONTHS_OF_HISTORY = 12;
    private static final Instant FAR_FUTURE = LocalDate.of(9999, 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC);

    private final LoanRepository loanRepository;
    private final PaymentRepository paymentRepository;
    private final CustomerRepository customerRepository;
    private final ItemRepository itemRepository;
    private final Clock clock;

    /**
     * @param overdue true keeps loans past due and still ACTIVE or OVERDUE; false keeps all others
     */
    @Transactional(readOnly = true)
    public List<LoanView> list(LoanStatus status, UUID customerId, UUID itemId, Boolean overdue, Pageable pageable) {
        Specification<LoanEntity> spec = Specification.where(Specs.<LoanEntity>equal("status", status))
            .and(Specs.equal("customerId", customerId))
            .and(Specs.equal("itemId", itemId))
            .and(overdueFilter(overdue));
        return toViews(loanRepository.findAll(spec, pageable).getContent());
    }

    @Transactional(readOnly = true)
    public List<LoanView> search(LoanSearchRequest criteria, Pageable pageable) {
        Specification<LoanEntity> spec = Specification
            .where(Specs.<LoanEntity>textSearch(criteria.getSearchTerm(), "loanCode", "notes"))
            .and(Specs.equal("status", criteria.getStatus()))
            .and(Specs.equal("customerId", criteria.getCustomerId()))
            .and(Specs.equal("itemId", criteria.getItemId()))
            .and(Specs.atLeast("principal", criteria.getMinAmount()))
            .and(Specs.atMost("principal", criteria.getMaxAmount()))
            .and(Specs.atLeast("startDate", criteria.getStartDateFrom()))
            .and(Specs.atMost("startDate", criteria.getStartDateTo()))
            .and(Specs.atLeast("dueDate", criteria.getDueDateFrom()))
            .and(Specs.atMost("dueDate", criteria.getDueDateTo()))
            .and(overdueFilter(criteria.getOverdue()));
        return toViews(loanRepository.findAll(spec, pageable).getContent());
    }

    @Transactional(readOnly = true)
    public LoanView get(UUID id) {
        LoanEntity entity = loanRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Loan", id));
        Loan loan = entity.toDomain();
        return new LoanView(loan, LoanCalculator.computeLoanDetails(
            loan, paymentRepository.sumAmountByLoanId(id), LocalDate.now(clock)));
    }

    /**
     * Every loan created in [startDate, endDate] (inclusive days), oldest first, for exports.
     */
    @Transactional(readOnly = true)
    public List<LoanView> createdBetween(LocalDate startDate, LocalDate endDate) {
        Specification<LoanEntity> spec = Specification
            .where(Specs.<LoanEntity, Instant>atLeast("createdAt", TimeWindows.startOfDay(startDate, clock)))
            .and(Specs.before("createdAt", TimeWindows.endOfDay(endDate, clock)));
        return toViews(loanRepository.findAll(spec, Sort.by(Sort.Direction.ASC, "createdAt")));
    }

    /**
     * Loan with customer, item and payment history.
     */
    @Transactional(readOnly = true)
    public LoanResponse getDetail(UUID id) {
        LoanView view = get(id);
        Loan loan = view.getLoan();
        CustomerEntity customer = customerRepository.findById(loan.getCustomerId()).orElse(null);
        ItemEntity item = itemRepository.findById(loan.getItemId()).orElse(null);
        List<PaymentResponse> payments = paymentRepository.findByLoanIdOrderByPaymentDateAscCreatedAtAsc(id).stream()
            .map(PaymentResponse::from)
            .toList();
        return LoanResponse.from(view.getLoan(), view.getDetails()).withDetail(customer, item, payments);
    }

    /**
     * Statistics over loans created in [startDate, endDate], both optional and inclusive.
     * The monthly history always covers the twelve months up to the current one.
     */
    @Transactional(readOnly = true)
    public LoanStats stats(LocalDate startDate, LocalDate endDate) {
        Instant from = startDate != null ? TimeWindows.startOfDay(startDate, clock) : Instant.EPOCH;
        Instant to = endDate != null ? TimeWindows.endOfDay(endDate, clock) : FAR_FUTURE;
        LocalDate today = LocalDate.now(clock);

        Map<LoanStatus, Long> byStatus = new EnumMap<>(LoanStatus.class);
        for (LoanStatus status : LoanStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (Object[] row : loanRepository.countByStatusCreatedBetween(from, to)) {
            byStatus.put((LoanStatus) row[0], (Long) row[1]);
        }

        long total = loanRepository.countCreatedBetween(from, to);
        BigDecimal totalPrincipal = loanRepository.sumPrincipalCreatedBetween(from, to);
        BigDecimal totalPayments = loanRepository.sumPaymentsForLoansCreatedBetween(from, to);
        BigDecimal interestEarned = totalPayments.subtract(totalPrincipal).max(BigDecimal.ZERO);
        Double averageTerm = loanRepository.averageTermDaysCreatedBetween(from, to);

        return LoanStats.builder()
            .totalLoans(total)
            .activeLoans(byStatus.get(LoanStatus.ACTIVE))
            .completedLoans(byStatus.get(LoanStatus.COMPLETED))
            .defaultedLoans(byStatus.get(LoanStatus.DEFAULTED))
            .overdueLoans(loanRepository.countOverdueCreatedBetween(from, to, today, LoanStatus.OPEN))
            .totalLoanAmount(totalPrincipal)
            .totalInterestEarned(interestEarned)
            .averageLoanAmount(total > 0
                ? totalPrincipal.divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO)
            .averageLoanTerm(averageTerm != null
                ? BigDecimal.valueOf(averageTerm).setScale(2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO)
            .loansByStatus(byStatus)
            .loansByMonth(monthlyHistory())
            .build();
    }

    // Most recent month first
    private List<LoanStats.MonthlyLoans> monthlyHistory() {
        YearMonth current = YearMonth.now(clock);
        List<LoanStats.MonthlyLoans> months = new ArrayList<>(MONTHS_OF_HISTORY);
        for (int i = 0; i < MONTHS_OF_HISTORY; i++) {
            YearMonth month = current.minusMonths(i);
            Instant monthStart = TimeWindows.startOfMonth(month, clock);
            Instant monthEnd = TimeWindows.startOfMonth(month.plusMonths(1), clock);
            months.add(new LoanStats.MonthlyLoans(
                month.toString(),
                loanRepository.countCreatedBetween(monthStart, monthEnd),
                loanRepository.sumPrincipalCreatedBetween(monthStart, monthEnd)));
        }
        return months;
    }

    private Specification<LoanEntity> overdueFilter(Boolean overdue) {
        if (overdue == null) {
            return null;
        }
        LocalDate today = LocalDate.now(clock);
        Specification<LoanEntity> pastDueAndOpen = Specification.where(Specs.<LoanEntity, LocalDate>before("dueDate", today))
            .and(Specs.in("status", LoanStatus.OPEN));
        return overdue ? pastDueAndOpen : Specification.not(pastDueAndOpen);
    }

    private List<LoanView> toViews(List<LoanEntity> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        Map<UUID, BigDecimal> paidByLoan = paymentRepository.sumAmountsByLoanIds(
                entities.stream().map(LoanEntity::getId).toList())
            .stream()
            .collect(Collectors.toMap(row -> (UUID) row[0], row -> (BigDecimal) row[1]));
        LocalDate today = LocalDate.now(clock);
        return entities.stream()
            .map(entity -> {
                Loan loan = entity.toDomain();
                BigDecimal paid = paidByLoan.getOrDefault(loan.getId(), BigDecimal.ZERO);
                return new LoanView(loan, LoanCalculator.computeLoanDetails(loan, paid, today));
            })
            .toList();
    }
}
