package com.flagship.pawnshop.report;

import com.flagship.pawnshop.common.Specs;
import com.flagship.pawnshop.common.TimeWindows;
import com.flagship.pawnshop.customer.CustomerEntity;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.inventory.ItemCategory;
import com.flagship.pawnshop.inventory.ItemEntity;
import com.flagship.pawnshop.inventory.ItemRepository;
import com.flagship.pawnshop.inventory.ItemStatus;
import com.flagship.pawnshop.loan.LoanEntity;
import com.flagship.pawnshop.loan.LoanRepository;
import com.flagship.pawnshop.loan.LoanStatus;
import com.flagship.pawnshop.organization.BranchEntity;
import com.flagship.pawnshop.organization.BranchRepository;
import com.flagship.pawnshop.payment.PaymentMethod;
import com.flagship.pawnshop.payment.PaymentRepository;
import com.flagship.pawnshop.report.dto.CustomerReport;
import com.flagship.pawnshop.report.dto.DailyTotal;
import com.flagship.pawnshop.report.dto.InventoryReport;
import com.flagship.pawnshop.report.dto.LoanReport;
import com.flagship.pawnshop.report.dto.SalesExportRow;
import com.flagship.pawnshop.report.dto.SalesReport;
import com.flagship.pawnshop.transaction.TransactionEntity;
import com.flagship.pawnshop.transaction.TransactionRepository;
import com.flagship.pawnshop.transaction.TransactionStatus;
import com.flagship.pawnshop.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sales, loan, inventory and customer reports.
 *
 * Figures are aggregated in memory over the rows a report covers. Loans carry no
 * branch of their own; they are attributed to the branch holding their item.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BusinessReportService {

    static final int TOP_ROWS = 10;
    static final int NEW_CUSTOMER_DAYS = 30;
    static final int ACQUISITION_MONTHS = 12;

    private final TransactionRepository transactionRepository;
    private final LoanRepository loanRepository;
    private final PaymentRepository paymentRepository;
    private final ItemRepository itemRepository;
    private final CustomerRepository customerRepository;
    private final BranchRepository branchRepository;
    private final Clock clock;

    // ==================== Sales ====================

    /**
     * COMPLETED sales dated in the window, optionally for one branch.
     *
     * @throws NotFoundException if branchId names no branch
     */
    @Transactional(readOnly = true)
    public SalesReport sales(LocalDate startDate, LocalDate endDate, UUID branchId) {
        ReportWindow window = ReportWindow.resolve(startDate, endDate, clock);
        requireBranch(branchId);
        List<TransactionEntity> sales = completedSales(window, branchId);

        BigDecimal total = sum(sales, TransactionEntity::getAmount);
        Map<LocalDate, List<TransactionEntity>> byDay = sales.stream()
            .collect(Collectors.groupingBy(this::dayOf, TreeMap::new, Collectors.toList()));
        List<DailyTotal> salesByDate = byDay.entrySet().stream()
            .map(day -> new DailyTotal(day.getKey(), sum(day.getValue(), TransactionEntity::getAmount),
                day.getValue().size()))
            .toList();

        Map<PaymentMethod, BigDecimal> byMethod = new EnumMap<>(PaymentMethod.class);
        for (PaymentMethod method : PaymentMethod.values()) {
            byMethod.put(method, BigDecimal.ZERO);
        }
        sales.stream()
            .filter(sale -> sale.getPaymentMethod() != null)
            .forEach(sale -> byMethod.merge(sale.getPaymentMethod(), sale.getAmount(), BigDecimal::add));

        Map<UUID, String> branchNames = branchNames(sales.stream().map(TransactionEntity::getBranchId).toList());
        Map<String, BigDecimal> byBranch = new TreeMap<>();
        sales.forEach(sale -> byBranch.merge(branchNames.getOrDefault(sale.getBranchId(), "Unknown"),
            sale.getAmount(), BigDecimal::add));

        SalesReport report = SalesReport.builder()
            .startDate(window.getStart())
            .endDate(window.getEnd())
            .totalSales(total)
            .totalTransactions(sales.size())
            .averageSaleValue(average(total, sales.size()))
            .salesByDate(salesByDate)
            .salesByPaymentMethod(byMethod)
            .salesByBranch(byBranch)
            .topSellingItems(topSellingItems(sales))
            .build();
        log.debug("Sales report: start={}, end={}, branchId={}, transactions={}, total={}",
            window.getStart(), window.getEnd(), branchId, sales.size(), total);
        return report;
    }

    /**
     * Rows of the sales CSV export, same selection as {@link #sales}.
     */
    @Transactional(readOnly = true)
    public List<TransactionEntity> salesForExport(LocalDate startDate, LocalDate endDate, UUID branchId) {
        ReportWindow window = ReportWindow.resolve(startDate, endDate, clock);
        requireBranch(branchId);
        return completedSales(window, branchId);
    }

    @Transactional(readOnly = true)
    public List<SalesExportRow> salesRows(List<TransactionEntity> sales) {
        Map<UUID, BranchEntity> branches = branchRepository.findAllById(
                sales.stream().map(TransactionEntity::getBranchId).collect(Collectors.toSet())).stream()
            .collect(Collectors.toMap(BranchEntity::getId, Function.identity()));
        Map<UUID, CustomerEntity> customers = customerRepository.findAllById(sales.stream()
                .map(TransactionEntity::getCustomerId).filter(Objects::nonNull).collect(Collectors.toSet())).stream()
            .collect(Collectors.toMap(CustomerEntity::getId, Function.identity()));
        Map<UUID, ItemEntity> items = itemsById(sales.stream()
            .map(TransactionEntity::getItemId).filter(Objects::nonNull).toList());
        return sales.stream()
            .map(sale -> SalesExportRow.from(sale, dayOf(sale), branches.get(sale.getBranchId()),
                sale.getCustomerId() != null ? customers.get(sale.getCustomerId()) : null,
                sale.getItemId() != null ? items.get(sale.getItemId()) : null))
            .toList();
    }

    private List<TransactionEntity> completedSales(ReportWindow window, UUID branchId) {
        Specification<TransactionEntity> spec = Specification
            .where(Specs.<TransactionEntity>equal("type", TransactionType.SALE))
            .and(Specs.equal("status", TransactionStatus.COMPLETED))
            .and(Specs.equal("branchId", branchId))
            .and(Specs.<TransactionEntity, Instant>atLeast("transactionDate", window.from(clock)))
            .and(Specs.<TransactionEntity, Instant>before("transactionDate", window.to(clock)));
        return transactionRepository.findAll(spec, Sort.by(Sort.Direction.ASC, "transactionDate"));
    }

    private List<SalesReport.TopItem> topSellingItems(List<TransactionEntity> sales) {
        Map<UUID, List<TransactionEntity>> byItem = sales.stream()
            .filter(sale -> sale.getItemId() != null)
            .collect(Collectors.groupingBy(TransactionEntity::getItemId));
        Map<UUID, ItemEntity> items = itemsById(byItem.keySet());
        return byItem.entrySet().stream()
            .filter(entry -> items.containsKey(entry.getKey()))
            .map(entry -> {
                ItemEntity item = items.get(entry.getKey());
                return new SalesReport.TopItem(item.getId(), item.getName(), item.getCategory(),
                    entry.getValue().size(), sum(entry.getValue(), TransactionEntity::getAmount));
            })
            .sorted(Comparator.comparingLong(SalesReport.TopItem::getTransactionCount).reversed()
                .thenComparing(SalesReport.TopItem::getTotalAmount, Comparator.reverseOrder()))
            .limit(TOP_ROWS)
            .toList();
    }

    // ==================== Loans ====================

    /**
     * Loans created in the window, optionally only those whose item sits in one branch.
     *
     * @throws NotFoundException if branchId names no branch
     */
    @Transactional(readOnly = true)
    public LoanReport loans(LocalDate startDate, LocalDate endDate, UUID branchId) {
        ReportWindow window = ReportWindow.resolve(startDate, endDate, clock);
        requireBranch(branchId);
        Specification<LoanEntity> spec = Specification
            .where(Specs.<LoanEntity, Instant>atLeast("createdAt", window.from(clock)))
            .and(Specs.<LoanEntity, Instant>before("createdAt", window.to(clock)));
        List<LoanEntity> created = loanRepository.findAll(spec, Sort.by(Sort.Direction.ASC, "createdAt"));

        Map<UUID, ItemEntity> items = itemsById(created.stream().map(LoanEntity::getItemId).toList());
        List<LoanEntity> loans = created.stream()
            .filter(loan -> branchId == null || inBranch(items.get(loan.getItemId()), branchId))
            .toList();

        BigDecimal totalPrincipal = sum(loans, LoanEntity::getPrincipal);
        BigDecimal paid = paidOn(loans.stream().map(LoanEntity::getId).toList());

        Map<LocalDate, List<LoanEntity>> byDay = loans.stream()
            .collect(Collectors.groupingBy(loan -> LocalDate.ofInstant(loan.getCreatedAt(), clock.getZone()),
                TreeMap::new, Collectors.toList()));
        List<DailyTotal> loansByDate = byDay.entrySet().stream()
            .map(day -> new DailyTotal(day.getKey(), sum(day.getValue(), LoanEntity::getPrincipal),
                day.getValue().size()))
            .toList();

        Map<UUID, String> branchNames = branchNames(items.values().stream().map(ItemEntity::getBranchId).toList());
        Map<String, BigDecimal> byBranch = new TreeMap<>();
        for (LoanEntity loan : loans) {
            ItemEntity item = items.get(loan.getItemId());
            if (item != null && branchNames.containsKey(item.getBranchId())) {
                byBranch.merge(branchNames.get(item.getBranchId()), loan.getPrincipal(), BigDecimal::add);
            }
        }

        return LoanReport.builder()
            .startDate(window.getStart())
            .endDate(window.getEnd())
            .totalLoans(loans.size())
            .totalLoanAmount(totalPrincipal)
            .totalInterestCollected(paid.subtract(totalPrincipal).max(BigDecimal.ZERO))
            .activeLoans(countStatus(loans, LoanStatus.ACTIVE))
            .overdueLoans(countStatus(loans, LoanStatus.OVERDUE))
            .extendedLoans(countStatus(loans, LoanStatus.EXTENDED))
            .completedLoans(countStatus(loans, LoanStatus.COMPLETED))
            .defaultedLoans(countStatus(loans, LoanStatus.DEFAULTED))
            .loansByDate(loansByDate)
            .loansByBranch(byBranch)
            .averageLoanAmount(average(totalPrincipal, loans.size()))
            .averageLoanDuration(loans.stream().mapToInt(LoanEntity::getTermDays).average().orElse(0))
            .build();
    }

    private BigDecimal paidOn(Collection<UUID> loanIds) {
        if (loanIds.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal paid = BigDecimal.ZERO;
        for (Object[] row : paymentRepository.sumAmountsByLoanIds(loanIds)) {
            paid = paid.add((BigDecimal) row[1]);
        }
        return paid;
    }

    private static long countStatus(List<LoanEntity> loans, LoanStatus status) {
        return loans.stream().filter(loan -> loan.getStatus() == status).count();
    }

    // ==================== Inventory ====================

    /**
     * @throws NotFoundException if branchId names no branch
     */
    @Transactional(readOnly = true)
    public InventoryReport inventory(UUID branchId) {
        requireBranch(branchId);
        List<ItemEntity> items = itemRepository.findAll(
            Specification.where(Specs.<ItemEntity>equal("branchId", branchId)));

        Map<ItemStatus, Long> byStatus = new EnumMap<>(ItemStatus.class);
        for (ItemStatus status : ItemStatus.values()) {
            byStatus.put(status, 0L);
        }
        Map<ItemCategory, Long> byCategory = new EnumMap<>(ItemCategory.class);
        for (ItemCategory category : ItemCategory.values()) {
            byCategory.put(category, 0L);
        }
        Map<UUID, String> branchNames = branchNames(items.stream().map(ItemEntity::getBranchId).toList());
        Map<String, Long> byBranch = new TreeMap<>();
        for (ItemEntity item : items) {
            byStatus.merge(item.getStatus(), 1L, Long::sum);
            byCategory.merge(item.getCategory(), 1L, Long::sum);
            byBranch.merge(branchNames.getOrDefault(item.getBranchId(), "Unknown"), 1L, Long::sum);
        }

        return InventoryReport.builder()
            .totalItems(items.size())
            .totalInventoryValue(sum(items, ItemEntity::getAppraisedValue))
            .itemsByStatus(byStatus)
            .itemsByCategory(byCategory)
            .itemsByBranch(byBranch)
            .recentlyAcquiredItems(items.stream()
                .sorted(Comparator.comparing(ItemEntity::getCreatedAt,
                    Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(TOP_ROWS)
                .map(InventoryReport.ItemSummary::from)
                .toList())
            .highestValueItems(items.stream()
                .sorted(Comparator.comparing(ItemEntity::getAppraisedValue,
                    Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(TOP_ROWS)
                .map(InventoryReport.ItemSummary::from)
                .toList())
            .build();
    }

    // ==================== Customers ====================

    /**
     * With a branch, only customers who pawned an item held by that branch are counted.
     *
     * @throws NotFoundException if branchId names no branch
     */
    @Transactional(readOnly = true)
    public CustomerReport customers(UUID branchId) {
        requireBranch(branchId);
        List<LoanEntity> allLoans = loanRepository.findAll();
        Map<UUID, ItemEntity> items = itemsById(allLoans.stream().map(LoanEntity::getItemId).toList());
        List<LoanEntity> loans = allLoans.stream()
            .filter(loan -> branchId == null || inBranch(items.get(loan.getItemId()), branchId))
            .toList();

        List<CustomerEntity> customers = customerRepository.findAll();
        if (branchId != null) {
            Set<UUID> borrowers = loans.stream().map(LoanEntity::getCustomerId).collect(Collectors.toSet());
            customers = customers.stream().filter(customer -> borrowers.contains(customer.getId())).toList();
        }

        LocalDate today = LocalDate.now(clock);
        Instant newSince = TimeWindows.startOfDay(today.minusDays(NEW_CUSTOMER_DAYS), clock);
        long active = customers.stream().filter(CustomerEntity::isActive).count();
        long newCustomers = customers.stream()
            .filter(customer -> customer.getCreatedAt() != null && !customer.getCreatedAt().isBefore(newSince))
            .count();

        return CustomerReport.builder()
            .totalCustomers(customers.size())
            .activeCustomers(active)
            .inactiveCustomers(customers.size() - active)
            .newCustomers(newCustomers)
            .customersByBranch(customersByBranch(loans, items))
            .topCustomers(topCustomers(loans, customers))
            .customerAcquisitionByDate(acquisitionByMonth(customers, YearMonth.now(clock)))
            .build();
    }

    private Map<String, Long> customersByBranch(List<LoanEntity> loans, Map<UUID, ItemEntity> items) {
        Map<UUID, Set<UUID>> borrowersByBranch = new HashMap<>();
        for (LoanEntity loan : loans) {
            ItemEntity item = items.get(loan.getItemId());
            if (item != null && item.getBranchId() != null) {
                borrowersByBranch.computeIfAbsent(item.getBranchId(), id -> new HashSet<>()).add(loan.getCustomerId());
            }
        }
        Map<UUID, String> branchNames = branchNames(borrowersByBranch.keySet());
        Map<String, Long> byBranch = new TreeMap<>();
        borrowersByBranch.forEach((id, borrowers) ->
            byBranch.merge(branchNames.getOrDefault(id, "Unknown"), (long) borrowers.size(), Long::sum));
        return byBranch;
    }

    private List<CustomerReport.RankedCustomer> topCustomers(List<LoanEntity> loans, List<CustomerEntity> customers) {
        Map<UUID, CustomerEntity> byId = customers.stream()
            .collect(Collectors.toMap(CustomerEntity::getId, Function.identity()));
        Map<UUID, List<LoanEntity>> loansByCustomer = loans.stream()
            .filter(loan -> byId.containsKey(loan.getCustomerId()))
            .collect(Collectors.groupingBy(LoanEntity::getCustomerId));
        return loansByCustomer.entrySet().stream()
            .map(entry -> {
                CustomerEntity customer = byId.get(entry.getKey());
                return new CustomerReport.RankedCustomer(customer.getId(), customer.getFullName(),
                    customer.getEmail(), customer.getPhone(), entry.getValue().size(),
                    sum(entry.getValue(), LoanEntity::getPrincipal));
            })
            .sorted(Comparator.comparing(CustomerReport.RankedCustomer::getTotalLoanAmount).reversed())
            .limit(TOP_ROWS)
            .toList();
    }

    /**
     * New customers per month for the last 12 months including the current one, oldest first.
     */
    private List<CustomerReport.MonthlyCount> acquisitionByMonth(List<CustomerEntity> customers, YearMonth current) {
        Map<YearMonth, Long> counts = new LinkedHashMap<>();
        for (int i = ACQUISITION_MONTHS - 1; i >= 0; i--) {
            counts.put(current.minusMonths(i), 0L);
        }
        for (CustomerEntity customer : customers) {
            if (customer.getCreatedAt() != null) {
                YearMonth month = YearMonth.from(customer.getCreatedAt().atZone(clock.getZone()));
                counts.computeIfPresent(month, (m, count) -> count + 1);
            }
        }
        List<CustomerReport.MonthlyCount> months = new ArrayList<>();
        counts.forEach((month, count) -> months.add(new CustomerReport.MonthlyCount(month.toString(), count)));
        return months;
    }

    // ==================== Helpers ====================

    private void requireBranch(UUID branchId) {
        if (branchId != null && !branchRepository.existsById(branchId)) {
            throw new NotFoundException("Branch", branchId);
        }
    }

    private static boolean inBranch(ItemEntity item, UUID branchId) {
        return item != null && branchId.equals(item.getBranchId());
    }

    private LocalDate dayOf(TransactionEntity transaction) {
        return LocalDate.ofInstant(transaction.getTransactionDate(), clock.getZone());
    }

    private Map<UUID, String> branchNames(Collection<UUID> ids) {
        Set<UUID> distinct = ids.stream().filter(Objects::nonNull).collect(Collectors.toSet());
        if (distinct.isEmpty()) {
            return Map.of();
        }
        return branchRepository.findAllById(distinct).stream()
            .collect(Collectors.toMap(BranchEntity::getId, BranchEntity::getName));
    }

    private Map<UUID, ItemEntity> itemsById(Collection<UUID> ids) {
        Set<UUID> distinct = ids.stream().filter(Objects::nonNull).collect(Collectors.toSet());
        if (distinct.isEmpty()) {
            return Map.of();
        }
        return itemRepository.findAllById(distinct).stream()
            .collect(Collectors.toMap(ItemEntity::getId, Function.identity()));
    }

    private static <T> BigDecimal sum(Collection<T> rows, Function<T, BigDecimal> amount) {
        return rows.stream()
            .map(amount)
            .filter(Objects::nonNull)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal average(BigDecimal total, long count) {
        return count == 0 ? BigDecimal.ZERO : total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }
}
