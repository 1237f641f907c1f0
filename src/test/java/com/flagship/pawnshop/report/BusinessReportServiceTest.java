package com.flagship.pawnshop.report;

import com.flagship.pawnshop.customer.CustomerEntity;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.BusinessValidationException;
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
import com.flagship.pawnshop.report.dto.InventoryReport;
import com.flagship.pawnshop.report.dto.LoanReport;
import com.flagship.pawnshop.report.dto.SalesReport;
import com.flagship.pawnshop.transaction.TransactionEntity;
import com.flagship.pawnshop.transaction.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BusinessReportServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private TransactionRepository transactionRepository;
    @Mock
    private LoanRepository loanRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private ItemRepository itemRepository;
    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private BranchRepository branchRepository;

    private BusinessReportService service;
    private BranchEntity downtown;
    private BranchEntity uptown;

    @BeforeEach
    void setUp() {
        service = new BusinessReportService(transactionRepository, loanRepository, paymentRepository,
            itemRepository, customerRepository, branchRepository, CLOCK);
        downtown = branch("Downtown");
        uptown = branch("Uptown");
    }

    @Test
    @DisplayName("Sales are totalled per day, per payment method and per branch")
    void salesReportAggregatesCompletedSales() {
        ItemEntity ring = item(downtown, ItemStatus.SOLD, ItemCategory.JEWELRY, "900", "2024-05-01T09:00:00Z");
        ItemEntity guitar = item(downtown, ItemStatus.SOLD, ItemCategory.MUSICAL_INSTRUMENTS, "400",
            "2024-05-02T09:00:00Z");
        List<TransactionEntity> sales = List.of(
            sale(ring, PaymentMethod.CASH, "100", "2024-06-10T11:00:00Z"),
            sale(ring, PaymentMethod.CASH, "50", "2024-06-10T15:00:00Z"),
            sale(guitar, PaymentMethod.CREDIT_CARD, "150", "2024-06-12T12:00:00Z"));
        when(transactionRepository.findAll(any(Specification.class), any(Sort.class))).thenReturn(sales);
        when(branchRepository.findAllById(any())).thenReturn(List.of(downtown));
        when(itemRepository.findAllById(any())).thenReturn(List.of(ring, guitar));

        SalesReport report = service.sales(null, null, null);

        assertEquals(LocalDate.of(2024, 5, 16), report.getStartDate());
        assertEquals(LocalDate.of(2024, 6, 15), report.getEndDate());
        assertEquals(0, new BigDecimal("300").compareTo(report.getTotalSales()));
        assertEquals(3, report.getTotalTransactions());
        assertEquals(new BigDecimal("100.00"), report.getAverageSaleValue());

        assertEquals(2, report.getSalesByDate().size());
        assertEquals(LocalDate.of(2024, 6, 10), report.getSalesByDate().get(0).getDate());
        assertEquals(0, new BigDecimal("150").compareTo(report.getSalesByDate().get(0).getAmount()));
        assertEquals(2, report.getSalesByDate().get(0).getCount());

        assertEquals(PaymentMethod.values().length, report.getSalesByPaymentMethod().size());
        assertEquals(0, new BigDecimal("150").compareTo(report.getSalesByPaymentMethod().get(PaymentMethod.CASH)));
        assertEquals(0, BigDecimal.ZERO.compareTo(report.getSalesByPaymentMethod().get(PaymentMethod.CHECK)));
        assertEquals(0, new BigDecimal("300").compareTo(report.getSalesByBranch().get("Downtown")));

        SalesReport.TopItem top = report.getTopSellingItems().get(0);
        assertEquals(ring.getId(), top.getItemId());
        assertEquals(2, top.getTransactionCount());
        assertEquals(ItemCategory.JEWELRY, top.getCategory());
    }

    @Test
    void unknownBranchIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(branchRepository.existsById(missing)).thenReturn(false);

        assertThrows(NotFoundException.class, () -> service.sales(null, null, missing));
        assertThrows(NotFoundException.class, () -> service.inventory(missing));
        verify(transactionRepository, never()).findAll(any(Specification.class), any(Sort.class));
    }

    @Test
    void startAfterEndIsRejected() {
        BusinessValidationException e = assertThrows(BusinessValidationException.class,
            () -> service.loans(LocalDate.of(2024, 6, 10), LocalDate.of(2024, 6, 1), null));

        assertEquals("date_range", e.getRule());
    }

    @Test
    @DisplayName("A branch filter keeps only loans whose item sits in that branch")
    void loanReportFiltersByItemBranch() {
        ItemEntity watch = item(downtown, ItemStatus.PAWNED, ItemCategory.WATCHES, "1500", "2024-06-01T09:00:00Z");
        ItemEntity drill = item(uptown, ItemStatus.REDEEMED, ItemCategory.TOOLS, "700", "2024-06-02T09:00:00Z");
        LoanEntity watchLoan = loan(watch, "1000", LoanStatus.ACTIVE, 30, "2024-06-01T10:00:00Z");
        LoanEntity drillLoan = loan(drill, "500", LoanStatus.COMPLETED, 60, "2024-06-02T10:00:00Z");
        UUID downtownId = downtown.getId();
        when(branchRepository.existsById(downtownId)).thenReturn(true);
        when(loanRepository.findAll(any(Specification.class), any(Sort.class)))
            .thenReturn(List.of(watchLoan, drillLoan));
        when(itemRepository.findAllById(any())).thenReturn(List.of(watch, drill));
        when(branchRepository.findAllById(any())).thenReturn(List.of(downtown, uptown));
        UUID watchLoanId = watchLoan.getId();
        when(paymentRepository.sumAmountsByLoanIds(List.of(watchLoanId)))
            .thenReturn(List.<Object[]>of(new Object[]{watchLoanId, new BigDecimal("1100")}));

        LoanReport report = service.loans(null, null, downtownId);

        assertEquals(1, report.getTotalLoans());
        assertEquals(0, new BigDecimal("1000").compareTo(report.getTotalLoanAmount()));
        assertEquals(0, new BigDecimal("100").compareTo(report.getTotalInterestCollected()));
        assertEquals(1, report.getActiveLoans());
        assertEquals(0, report.getCompletedLoans());
        assertEquals(30.0, report.getAverageLoanDuration());
        assertEquals(1, report.getLoansByBranch().size());
        assertEquals(0, new BigDecimal("1000").compareTo(report.getLoansByBranch().get("Downtown")));
        assertEquals(LocalDate.of(2024, 6, 1), report.getLoansByDate().get(0).getDate());
    }

    @Test
    void inventoryReportListsEveryStatusAndCategory() {
        ItemEntity necklace = item(downtown, ItemStatus.PAWNED, ItemCategory.JEWELRY, "500", "2024-06-01T09:00:00Z");
        ItemEntity camera = item(uptown, ItemStatus.FOR_SALE, ItemCategory.ELECTRONICS, "800", "2024-05-01T09:00:00Z");
        when(itemRepository.findAll(any(Specification.class))).thenReturn(List.of(necklace, camera));
        when(branchRepository.findAllById(any())).thenReturn(List.of(downtown, uptown));

        InventoryReport report = service.inventory(null);

        assertEquals(2, report.getTotalItems());
        assertEquals(0, new BigDecimal("1300").compareTo(report.getTotalInventoryValue()));
        assertEquals(ItemStatus.values().length, report.getItemsByStatus().size());
        assertEquals(1L, report.getItemsByStatus().get(ItemStatus.PAWNED));
        assertEquals(0L, report.getItemsByStatus().get(ItemStatus.DEFAULTED));
        assertEquals(0L, report.getItemsByCategory().get(ItemCategory.FIREARMS));
        assertEquals(1L, report.getItemsByBranch().get("Uptown"));
        assertEquals(camera.getId(), report.getHighestValueItems().get(0).getId());
        assertEquals(necklace.getId(), report.getRecentlyAcquiredItems().get(0).getId());
    }

    @Test
    @DisplayName("Customer acquisition covers the last twelve months, oldest first")
    void customerReportCountsAcquisitionByMonth() {
        CustomerEntity recent = customer("Ada Price", true, "2024-06-01T09:00:00Z");
        CustomerEntity lapsed = customer("Ben Ortiz", false, "2023-12-10T09:00:00Z");
        CustomerEntity longtime = customer("Cy Lee", true, "2022-01-01T09:00:00Z");
        ItemEntity bracelet = item(downtown, ItemStatus.PAWNED, ItemCategory.JEWELRY, "1200", "2024-06-01T09:00:00Z");
        LoanEntity loan = loan(bracelet, "1000", LoanStatus.ACTIVE, 30, "2024-06-01T10:00:00Z");
        UUID recentId = recent.getId();
        lenient().when(loan.getCustomerId()).thenReturn(recentId);
        when(loanRepository.findAll()).thenReturn(List.of(loan));
        when(itemRepository.findAllById(any())).thenReturn(List.of(bracelet));
        when(branchRepository.findAllById(any())).thenReturn(List.of(downtown));
        when(customerRepository.findAll()).thenReturn(List.of(recent, lapsed, longtime));

        CustomerReport report = service.customers(null);

        assertEquals(3, report.getTotalCustomers());
        assertEquals(2, report.getActiveCustomers());
        assertEquals(1, report.getInactiveCustomers());
        assertEquals(1, report.getNewCustomers());
        assertEquals(1L, report.getCustomersByBranch().get("Downtown"));

        List<CustomerReport.MonthlyCount> months = report.getCustomerAcquisitionByDate();
        assertEquals(12, months.size());
        assertEquals("2023-07", months.get(0).getMonth());
        assertEquals("2024-06", months.get(11).getMonth());
        assertEquals(1, months.get(11).getCount());
        assertEquals(1, months.get(5).getCount());

        CustomerReport.RankedCustomer top = report.getTopCustomers().get(0);
        assertEquals("Ada Price", top.getName());
        assertEquals(1, top.getLoanCount());
    }

    private static BranchEntity branch(String name) {
        BranchEntity branch = mock(BranchEntity.class);
        lenient().when(branch.getId()).thenReturn(UUID.randomUUID());
        lenient().when(branch.getName()).thenReturn(name);
        return branch;
    }

    private static ItemEntity item(BranchEntity branch, ItemStatus status, ItemCategory category,
                                   String appraised, String createdAt) {
        ItemEntity item = mock(ItemEntity.class);
        UUID branchId = branch.getId();
        lenient().when(item.getId()).thenReturn(UUID.randomUUID());
        lenient().when(item.getBranchId()).thenReturn(branchId);
        lenient().when(item.getStatus()).thenReturn(status);
        lenient().when(item.getCategory()).thenReturn(category);
        lenient().when(item.getAppraisedValue()).thenReturn(new BigDecimal(appraised));
        lenient().when(item.getCreatedAt()).thenReturn(Instant.parse(createdAt));
        return item;
    }

    private static TransactionEntity sale(ItemEntity item, PaymentMethod method, String amount, String date) {
        TransactionEntity sale = mock(TransactionEntity.class);
        UUID itemId = item.getId();
        UUID branchId = item.getBranchId();
        lenient().when(sale.getItemId()).thenReturn(itemId);
        lenient().when(sale.getBranchId()).thenReturn(branchId);
        lenient().when(sale.getPaymentMethod()).thenReturn(method);
        lenient().when(sale.getAmount()).thenReturn(new BigDecimal(amount));
        lenient().when(sale.getTransactionDate()).thenReturn(Instant.parse(date));
        return sale;
    }

    private static LoanEntity loan(ItemEntity item, String principal, LoanStatus status, int termDays,
                                   String createdAt) {
        LoanEntity loan = mock(LoanEntity.class);
        UUID itemId = item.getId();
        lenient().when(loan.getId()).thenReturn(UUID.randomUUID());
        lenient().when(loan.getItemId()).thenReturn(itemId);
        lenient().when(loan.getPrincipal()).thenReturn(new BigDecimal(principal));
        lenient().when(loan.getStatus()).thenReturn(status);
        lenient().when(loan.getTermDays()).thenReturn(termDays);
        lenient().when(loan.getCreatedAt()).thenReturn(Instant.parse(createdAt));
        return loan;
    }

    private static CustomerEntity customer(String name, boolean active, String createdAt) {
        CustomerEntity customer = mock(CustomerEntity.class);
        lenient().when(customer.getId()).thenReturn(UUID.randomUUID());
        lenient().when(customer.getFullName()).thenReturn(name);
        lenient().when(customer.isActive()).thenReturn(active);
        lenient().when(customer.getCreatedAt()).thenReturn(Instant.parse(createdAt));
        return customer;
    }
}
