package com.flagship.pawnshop.report;

import com.flagship.pawnshop.common.TimeWindows;
import com.flagship.pawnshop.customer.CustomerEntity;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.inventory.ItemRepository;
import com.flagship.pawnshop.inventory.ItemStatus;
import com.flagship.pawnshop.loan.LoanQueryService;
import com.flagship.pawnshop.loan.LoanRepository;
import com.flagship.pawnshop.loan.LoanStatus;
import com.flagship.pawnshop.loan.LoanView;
import com.flagship.pawnshop.payment.PaymentRepository;
import com.flagship.pawnshop.report.dto.DashboardStats;
import com.flagship.pawnshop.report.dto.LoanExportRow;
import com.flagship.pawnshop.report.dto.TransactionExportRow;
import com.flagship.pawnshop.transaction.TransactionEntity;
import com.flagship.pawnshop.transaction.TransactionRepository;
import com.flagship.pawnshop.transaction.TransactionStatus;
import com.flagship.pawnshop.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cross-module figures for the dashboard and the loan/transaction report exports.
 */
@Service
@RequiredArgsConstructor
public class ReportService {

    static final int MAX_CHART_DAYS = 365;

    private final CustomerRepository customerRepository;
    private final LoanRepository loanRepository;
    private final LoanQueryService loanQueryService;
    private final PaymentRepository paymentRepository;
    private final ItemRepository itemRepository;
    private final TransactionRepository transactionRepository;
    private final Clock clock;

    /**
     * @param days length of the daily charts ending today, 1 to 365
     */
    @Transactional(readOnly = true)
    public DashboardStats dashboard(int days) {
        if (days < 1 || days > MAX_CHART_DAYS) {
            throw new BusinessValidationException("chart_days", "days must be between 1 and " + MAX_CHART_DAYS);
        }
        LocalDate today = LocalDate.now(clock);
        Instant startOfToday = TimeWindows.startOfDay(today, clock);
        Instant endOfToday = TimeWindows.endOfDay(today, clock);

        BigDecimal totalPrincipal = loanRepository.sumPrincipalCreatedBetween(Instant.EPOCH, endOfToday);
        BigDecimal interestEarned = paymentRepository.sumAllAmounts().subtract(totalPrincipal).max(BigDecimal.ZERO);
        BigDecimal completedToday = transactionRepository.sumAmountByStatusBetween(
            TransactionStatus.COMPLETED, startOfToday, endOfToday);

        return DashboardStats.builder()
            .totalCustomers(customerRepository.count())
            .newCustomersThisMonth(customerRepository.countByCreatedAtGreaterThanEqual(
                TimeWindows.startOfCurrentMonth(clock)))
            .totalLoans(loanRepository.count())
            .activeLoans(loanRepository.countByStatus(LoanStatus.ACTIVE))
            .overdueLoans(loanRepository.countByDueDateBeforeAndStatusIn(today, LoanStatus.OPEN))
            .defaultedLoans(loanRepository.countByStatus(LoanStatus.DEFAULTED))
            .totalLoanAmount(totalPrincipal)
            .totalInterestEarned(interestEarned)
            .itemsInInventory(itemRepository.countByStatusIn(ItemStatus.IN_STOCK))
            .totalInventoryValue(itemRepository.sumAppraisedValueByStatusIn(ItemStatus.IN_STOCK))
            .transactionsToday(transactionRepository
                .countByTransactionDateGreaterThanEqualAndTransactionDateLessThan(startOfToday, endOfToday))
            .revenueToday(paymentRepository.sumAmountOn(today).add(completedToday))
            .salesToday(transactionRepository.sumAmountByTypeAndStatusBetween(
                TransactionType.SALE, TransactionStatus.COMPLETED, startOfToday, endOfToday))
            .revenueByDay(revenueByDay(today.minusDays(days - 1L), today))
            .loansByDay(loansByDay(today.minusDays(days - 1L), today))
            .build();
    }

    /**
     * Loans created in the window, oldest first. Defaults to the last 30 days up to today.
     */
    @Transactional(readOnly = true)
    public List<LoanView> loansForExport(LocalDate startDate, LocalDate endDate) {
        ReportWindow window = ReportWindow.resolve(startDate, endDate, clock);
        return loanQueryService.createdBetween(window.getStart(), window.getEnd());
    }

    @Transactional(readOnly = true)
    public List<LoanExportRow> loanRows(List<LoanView> loans) {
        Map<UUID, CustomerEntity> customers = customersById(loans.stream().map(v -> v.getLoan().getCustomerId()).toList());
        Map<UUID, ItemEntity> items = itemsById(loans.stream().map(v -> v.getLoan().getItemId()).toList());
        return loans.stream()
            .map(view -> LoanExportRow.from(view,
                LocalDate.ofInstant(view.getLoan().getCreatedAt(), clock.getZone()),
                customers.get(view.getLoan().getCustomerId()),
                items.get(view.getLoan().getItemId())))
            .toList();
    }

    /**
     * Transactions dated in the window, oldest first, optionally of one type.
     * Defaults to the last 30 days up to today.
     */
    @Transactional(readOnly = true)
    public List<TransactionEntity> transactionsForExport(LocalDate startDate, LocalDate endDate, TransactionType type) {
        ReportWindow window = ReportWindow.resolve(startDate, endDate, clock);
        Instant from = window.from(clock);
        Instant to = window.to(clock);
        Specification<TransactionEntity> spec = (root, query, cb) -> cb.and(
            cb.greaterThanOrEqualTo(root.get("transactionDate"), from),
            cb.lessThan(root.get("transactionDate"), to));
        if (type != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("type"), type));
        }
        return transactionRepository.findAll(spec, Sort.by(Sort.Direction.ASC, "transactionDate"));
    }

    @Transactional(readOnly = true)
    public List<TransactionExportRow> transactionRows(List<TransactionEntity> transactions) {
        Map<UUID, CustomerEntity> customers = customersById(transactions.stream()
            .map(TransactionEntity::getCustomerId).filter(Objects::nonNull).toList());
        Map<UUID, ItemEntity> items = itemsById(transactions.stream()
            .map(TransactionEntity::getItemId).filter(Objects::nonNull).toList());
        return transactions.stream()
            .map(t -> TransactionExportRow.from(t,
                t.getCustomerId() != null ? customers.get(t.getCustomerId()) : null,
                t.getItemId() != null ? items.get(t.getItemId()) : null))
            .toList();
    }

    private List<DashboardStats.DailyRevenue> revenueByDay(LocalDate first, LocalDate last) {
        Map<LocalDate, BigDecimal> revenue = new HashMap<>();
        for (Object[] row : paymentRepository.sumAmountsByDayBetween(first, last)) {
            revenue.merge((LocalDate) row[0], (BigDecimal) row[1], BigDecimal::add);
        }
        List<TransactionEntity> completed = transactionRepository
            .findByStatusAndTransactionDateGreaterThanEqualAndTransactionDateLessThan(
                TransactionStatus.COMPLETED, TimeWindows.startOfDay(first, clock), TimeWindows.endOfDay(last, clock));
        for (TransactionEntity transaction : completed) {
            revenue.merge(LocalDate.ofInstant(transaction.getTransactionDate(), clock.getZone()),
                transaction.getAmount(), BigDecimal::add);
        }

        List<DashboardStats.DailyRevenue> days = new ArrayList<>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            days.add(new DashboardStats.DailyRevenue(day, revenue.getOrDefault(day, BigDecimal.ZERO)));
        }
        return days;
    }

    private List<DashboardStats.DailyLoans> loansByDay(LocalDate first, LocalDate last) {
        List<DashboardStats.DailyLoans> days = new ArrayList<>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            days.add(new DashboardStats.DailyLoans(day, loanRepository.countCreatedBetween(
                TimeWindows.startOfDay(day, clock), TimeWindows.endOfDay(day, clock))));
        }
        return days;
    }

    private Map<UUID, CustomerEntity> customersById(Collection<UUID> ids) {
        return customerRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(CustomerEntity::getId, Function.identity()));
    }

    private Map<UUID, ItemEntity> itemsById(Collection<UUID> ids) {
        return itemRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(ItemEntity::getId, Function.identity()));
    }
}
