package com.flagship.pawnshop.report;

import com.flagship.pawnshop.access.AccessGuard;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.loan.LoanView;
import com.flagship.pawnshop.loan.dto.LoanResponse;
import com.flagship.pawnshop.report.dto.CustomerReport;
import com.flagship.pawnshop.report.dto.DashboardStats;
import com.flagship.pawnshop.report.dto.InventoryReport;
import com.flagship.pawnshop.report.dto.LoanExportRow;
import com.flagship.pawnshop.report.dto.LoanReport;
import com.flagship.pawnshop.report.dto.SalesExportRow;
import com.flagship.pawnshop.report.dto.SalesReport;
import com.flagship.pawnshop.report.dto.TransactionExportRow;
import com.flagship.pawnshop.transaction.TransactionEntity;
import com.flagship.pawnshop.transaction.TransactionType;
import com.flagship.pawnshop.transaction.dto.TransactionResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Dashboard and report exports, all behind view_reports.
 */
@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;
    private final BusinessReportService businessReportService;
    private final ExportWriter exportWriter;

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardStats> dashboard(
            @RequestParam(value = "days", defaultValue = "30") int days) {
        AccessGuard.require(Permission.VIEW_REPORTS);
        return ResponseEntity.ok(reportService.dashboard(days));
    }

    @GetMapping("/sales")
    public ResponseEntity<SalesReport> sales(
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "branch_id", required = false) UUID branchId) {
        AccessGuard.require(Permission.VIEW_REPORTS);
        return ResponseEntity.ok(businessReportService.sales(startDate, endDate, branchId));
    }

    @GetMapping("/loans")
    public ResponseEntity<LoanReport> loans(
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "branch_id", required = false) UUID branchId) {
        AccessGuard.require(Permission.VIEW_REPORTS);
        return ResponseEntity.ok(businessReportService.loans(startDate, endDate, branchId));
    }

    @GetMapping("/inventory")
    public ResponseEntity<InventoryReport> inventory(
            @RequestParam(value = "branch_id", required = false) UUID branchId) {
        AccessGuard.require(Permission.VIEW_REPORTS);
        return ResponseEntity.ok(businessReportService.inventory(branchId));
    }

    @GetMapping("/customers")
    public ResponseEntity<CustomerReport> customers(
            @RequestParam(value = "branch_id", required = false) UUID branchId) {
        AccessGuard.require(Permission.VIEW_REPORTS);
        return ResponseEntity.ok(businessReportService.customers(branchId));
    }

    @GetMapping("/export/sales")
    public ResponseEntity<?> exportSales(
            @RequestParam(value = "format", defaultValue = "csv") String format,
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "branch_id", required = false) UUID branchId) {
        AccessGuard.require(Permission.VIEW_REPORTS);
        ExportFormat exportFormat = ExportFormat.parse(format);

        List<TransactionEntity> sales = businessReportService.salesForExport(startDate, endDate, branchId);
        if (exportFormat == ExportFormat.JSON) {
            return ResponseEntity.ok(sales.stream().map(TransactionResponse::from).toList());
        }
        return exportWriter.csv("sales_report", businessReportService.salesRows(sales), SalesExportRow.class);
    }

    @GetMapping("/export/loans")
    public ResponseEntity<?> exportLoans(
            @RequestParam(value = "format", defaultValue = "csv") String format,
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        AccessGuard.require(Permission.VIEW_REPORTS);
        ExportFormat exportFormat = ExportFormat.parse(format);

        List<LoanView> loans = reportService.loansForExport(startDate, endDate);
        if (exportFormat == ExportFormat.JSON) {
            return ResponseEntity.ok(loans.stream()
                .map(view -> LoanResponse.from(view.getLoan(), view.getDetails()))
                .toList());
        }
        return exportWriter.csv("loan_report", reportService.loanRows(loans), LoanExportRow.class);
    }

    @GetMapping("/export/transactions")
    public ResponseEntity<?> exportTransactions(
            @RequestParam(value = "format", defaultValue = "csv") String format,
            @RequestParam(value = "transaction_type", required = false) TransactionType type,
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        AccessGuard.require(Permission.VIEW_REPORTS);
        ExportFormat exportFormat = ExportFormat.parse(format);

        List<TransactionEntity> transactions = reportService.transactionsForExport(startDate, endDate, type);
        if (exportFormat == ExportFormat.JSON) {
            return ResponseEntity.ok(transactions.stream().map(TransactionResponse::from).toList());
        }
        return exportWriter.csv("transaction_report", reportService.transactionRows(transactions),
            TransactionExportRow.class);
    }
}
