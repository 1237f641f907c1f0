package com.flagship.pawnshop.loan;

import com.flagship.pawnshop.access.AccessGuard;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.common.PageLimits;
import com.flagship.pawnshop.loan.dto.CreateLoanRequest;
import com.flagship.pawnshop.loan.dto.DefaultLoanRequest;
import com.flagship.pawnshop.loan.dto.ExtendLoanRequest;
import com.flagship.pawnshop.loan.dto.LoanResponse;
import com.flagship.pawnshop.loan.dto.LoanSearchRequest;
import com.flagship.pawnshop.loan.dto.LoanStats;
import com.flagship.pawnshop.loan.dto.RedeemLoanRequest;
import com.flagship.pawnshop.loan.dto.UpdateLoanRequest;
import com.flagship.pawnshop.payment.dto.PaymentRequest;
import com.flagship.pawnshop.payment.dto.PaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Loan endpoints.
 *
 * Reads need view_loans. Origination, payments, extension and redemption need
 * create_loans; corrections and default need approve_loans.
 */
@RestController
@RequestMapping("/api/v1/loans")
@RequiredArgsConstructor
public class LoanController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LoanLifecycleService lifecycleService;
    private final LoanQueryService queryService;
    private final PageLimits pageLimits;

    @GetMapping
    public ResponseEntity<List<LoanResponse>> list(
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "status", required = false) LoanStatus status,
            @RequestParam(value = "customer_id", required = false) UUID customerId,
            @RequestParam(value = "item_id", required = false) UUID itemId,
            @RequestParam(value = "is_overdue", required = false) Boolean overdue) {
        AccessGuard.require(Permission.VIEW_LOANS);
        return ResponseEntity.ok(toResponses(
            queryService.list(status, customerId, itemId, overdue, pageLimits.of(skip, limit))));
    }

    @PostMapping
    public ResponseEntity<LoanResponse> create(@Valid @RequestBody CreateLoanRequest request) {
        AccessGuard.require(Permission.CREATE_LOANS);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(lifecycleService.createLoan(request)));
    }

    @PostMapping("/search")
    public ResponseEntity<List<LoanResponse>> search(
            @RequestBody LoanSearchRequest criteria,
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit) {
        AccessGuard.require(Permission.VIEW_LOANS);
        return ResponseEntity.ok(toResponses(queryService.search(criteria, pageLimits.of(skip, limit))));
    }

    @GetMapping("/stats/overview")
    public ResponseEntity<LoanStats> stats(
            @RequestParam(value = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        AccessGuard.require(Permission.VIEW_LOANS);
        return ResponseEntity.ok(queryService.stats(startDate, endDate));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LoanResponse> get(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_LOANS);
        return ResponseEntity.ok(queryService.getDetail(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<LoanResponse> update(@PathVariable("id") UUID id,
                                               @Valid @RequestBody UpdateLoanRequest request) {
        AccessGuard.require(Permission.APPROVE_LOANS);
        return ResponseEntity.ok(toResponse(lifecycleService.updateLoan(id, request)));
    }

    /**
     * Posts a payment and returns the refreshed loan with the payment nested under
     * {@code payment}. With an Idempotency-Key header, a retried request returns the
     * original payment with 200 instead of 201.
     */
    @PostMapping("/{id}/payments")
    public ResponseEntity<LoanResponse> addPayment(
            @PathVariable("id") UUID id,
            @Valid @RequestBody PaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        AccessGuard.require(Permission.CREATE_LOANS);
        String key = idempotencyKey != null && !idempotencyKey.isBlank() ? idempotencyKey : null;
        PaymentPosting posting = lifecycleService.addPayment(id, request, key);
        return ResponseEntity.status(posting.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(toResponse(posting.getLoan()).withPayment(PaymentResponse.from(posting.getPayment())));
    }

    @PutMapping("/{id}/extend")
    public ResponseEntity<LoanResponse> extend(@PathVariable("id") UUID id,
                                               @Valid @RequestBody ExtendLoanRequest request) {
        AccessGuard.require(Permission.CREATE_LOANS);
        return ResponseEntity.ok(toResponse(lifecycleService.extendLoan(id, request)));
    }

    @PutMapping("/{id}/redeem")
    public ResponseEntity<LoanResponse> redeem(@PathVariable("id") UUID id,
                                               @Valid @RequestBody RedeemLoanRequest request) {
        AccessGuard.require(Permission.CREATE_LOANS);
        return ResponseEntity.ok(toResponse(lifecycleService.redeemLoan(id, request)));
    }

    @PutMapping("/{id}/default")
    public ResponseEntity<LoanResponse> markDefaulted(@PathVariable("id") UUID id,
                                                      @RequestBody(required = false) DefaultLoanRequest request) {
        AccessGuard.require(Permission.APPROVE_LOANS);
        DefaultLoanRequest effective = request != null ? request : new DefaultLoanRequest(null, null, null);
        return ResponseEntity.ok(toResponse(lifecycleService.defaultLoan(id, effective)));
    }

    private static LoanResponse toResponse(LoanView view) {
        return LoanResponse.from(view.getLoan(), view.getDetails());
    }

    private static List<LoanResponse> toResponses(List<LoanView> views) {
        return views.stream().map(LoanController::toResponse).toList();
    }
}
