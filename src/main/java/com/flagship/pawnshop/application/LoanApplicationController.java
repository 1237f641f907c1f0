package com.flagship.pawnshop.application;

import com.flagship.pawnshop.access.AccessGuard;
import com.flagship.pawnshop.access.Caller;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.application.dto.ApplicationExportRow;
import com.flagship.pawnshop.application.dto.ApplicationFilter;
import com.flagship.pawnshop.application.dto.ApplicationRequest;
import com.flagship.pawnshop.application.dto.ApplicationResponse;
import com.flagship.pawnshop.application.dto.ApplicationStats;
import com.flagship.pawnshop.application.dto.ApplicationTrend;
import com.flagship.pawnshop.application.dto.ApplicationUpdateRequest;
import com.flagship.pawnshop.application.dto.BulkUpdateRequest;
import com.flagship.pawnshop.common.PageLimits;
import com.flagship.pawnshop.report.ExportFormat;
import com.flagship.pawnshop.report.ExportWriter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/applications")
@RequiredArgsConstructor
public class LoanApplicationController {

    /**
     * API sort keys mapped to entity attributes.
     */
    private static final Map<String, String> SORT_FIELDS = Map.of(
        "created_at", "createdAt",
        "updated_at", "updatedAt",
        "application_number", "applicationNumber",
        "estimated_value", "estimatedValue",
        "loan_amount", "loanAmount"
    );

    private final LoanApplicationService applicationService;
    private final PageLimits pageLimits;
    private final ExportWriter exportWriter;

    @GetMapping
    public ResponseEntity<List<ApplicationResponse>> list(
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "status", required = false) ApplicationStatus status,
            @RequestParam(value = "branch_id", required = false) UUID branchId,
            @RequestParam(value = "customer_id", required = false) UUID customerId,
            @RequestParam(value = "min_value", required = false) BigDecimal minValue,
            @RequestParam(value = "max_value", required = false) BigDecimal maxValue,
            @RequestParam(value = "min_loan", required = false) BigDecimal minLoan,
            @RequestParam(value = "max_loan", required = false) BigDecimal maxLoan,
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "sort_by", defaultValue = "created_at") String sortBy,
            @RequestParam(value = "sort_order", defaultValue = "desc") String sortOrder) {
        AccessGuard.require(Permission.VIEW_LOANS);

        ApplicationFilter filter = ApplicationFilter.builder()
            .status(status)
            .branchId(branchId)
            .customerId(customerId)
            .minValue(minValue)
            .maxValue(maxValue)
            .minLoan(minLoan)
            .maxLoan(maxLoan)
            .startDate(startDate)
            .endDate(endDate)
            .search(search)
            .build();
        return ResponseEntity.ok(toResponses(
            applicationService.list(filter, pageLimits.of(skip, limit, toSort(sortBy, sortOrder)))));
    }

    @PostMapping
    public ResponseEntity<ApplicationResponse> create(@Valid @RequestBody ApplicationRequest request) {
        AccessGuard.require(Permission.CREATE_LOANS);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApplicationResponse.from(applicationService.create(request)));
    }

    @PostMapping("/bulk-update")
    public ResponseEntity<List<ApplicationResponse>> bulkUpdate(@Valid @RequestBody BulkUpdateRequest request) {
        Caller caller = AccessGuard.require(Permission.APPROVE_LOANS);
        return ResponseEntity.ok(toResponses(applicationService.bulkUpdate(
            request.getApplicationIds(), request.getUpdateData(), caller.getUserId())));
    }

    @PostMapping("/bulk-delete")
    public ResponseEntity<Void> bulkDelete(@RequestBody List<UUID> applicationIds) {
        AccessGuard.require(Permission.APPROVE_LOANS);
        applicationService.bulkDelete(applicationIds);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/stats")
    public ResponseEntity<ApplicationStats> stats(
            @RequestParam(value = "branch_id", required = false) UUID branchId,
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        AccessGuard.require(Permission.VIEW_LOANS);
        return ResponseEntity.ok(applicationService.stats(branchId, startDate, endDate));
    }

    @GetMapping("/trends")
    public ResponseEntity<List<ApplicationTrend>> trends(
            @RequestParam(value = "days", defaultValue = "30") int days,
            @RequestParam(value = "branch_id", required = false) UUID branchId) {
        AccessGuard.require(Permission.VIEW_LOANS);
        return ResponseEntity.ok(applicationService.trends(days, branchId));
    }

    @GetMapping("/export")
    public ResponseEntity<?> export(
            @RequestParam(value = "format", defaultValue = "csv") String format,
            @RequestParam(value = "status", required = false) ApplicationStatus status,
            @RequestParam(value = "branch_id", required = false) UUID branchId,
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        AccessGuard.require(Permission.VIEW_LOANS);
        ExportFormat exportFormat = ExportFormat.parse(format);

        List<LoanApplicationEntity> applications = applicationService.export(ApplicationFilter.builder()
            .status(status)
            .branchId(branchId)
            .startDate(startDate)
            .endDate(endDate)
            .build());
        if (exportFormat == ExportFormat.JSON) {
            return ResponseEntity.ok(toResponses(applications));
        }
        return exportWriter.csv("applications",
            applications.stream().map(ApplicationExportRow::from).toList(), ApplicationExportRow.class);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApplicationResponse> get(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_LOANS);
        return ResponseEntity.ok(ApplicationResponse.from(applicationService.get(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApplicationResponse> update(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody ApplicationUpdateRequest request) {
        Caller caller = AccessGuard.require(Permission.APPROVE_LOANS);
        return ResponseEntity.ok(ApplicationResponse.from(
            applicationService.update(id, request, caller.getUserId())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.APPROVE_LOANS);
        applicationService.delete(id);
        return ResponseEntity.noContent().build();
    }

    private static Sort toSort(String sortBy, String sortOrder) {
        String attribute = SORT_FIELDS.get(sortBy);
        if (attribute == null) {
            throw new IllegalArgumentException("sort_by must be one of " + SORT_FIELDS.keySet());
        }
        Sort.Direction direction = switch (sortOrder) {
            case "asc" -> Sort.Direction.ASC;
            case "desc" -> Sort.Direction.DESC;
            default -> throw new IllegalArgumentException("sort_order must be asc or desc");
        };
        return Sort.by(direction, attribute);
    }

    private static List<ApplicationResponse> toResponses(List<LoanApplicationEntity> applications) {
        return applications.stream().map(ApplicationResponse::from).toList();
    }
}
