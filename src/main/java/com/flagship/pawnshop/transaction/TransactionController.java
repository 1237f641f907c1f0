package com.flagship.pawnshop.transaction;

import com.flagship.pawnshop.access.AccessGuard;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.common.PageLimits;
import com.flagship.pawnshop.transaction.dto.TransactionNoteRequest;
import com.flagship.pawnshop.transaction.dto.TransactionRequest;
import com.flagship.pawnshop.transaction.dto.TransactionResponse;
import com.flagship.pawnshop.transaction.dto.TransactionSearchRequest;
import com.flagship.pawnshop.transaction.dto.TransactionStats;
import com.flagship.pawnshop.transaction.dto.TransactionUpdateRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "transactionDate", "createdAt");

    private final TransactionService transactionService;
    private final PageLimits pageLimits;

    @GetMapping
    public ResponseEntity<List<TransactionResponse>> list(
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "transaction_type", required = false) TransactionType type,
            @RequestParam(value = "status", required = false) TransactionStatus status,
            @RequestParam(value = "customer_id", required = false) UUID customerId,
            @RequestParam(value = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        AccessGuard.require(Permission.VIEW_TRANSACTIONS);
        return ResponseEntity.ok(toResponses(transactionService.list(
            type, status, customerId, startDate, endDate, pageLimits.of(skip, limit, NEWEST_FIRST))));
    }

    @PostMapping
    public ResponseEntity<TransactionResponse> create(@Valid @RequestBody TransactionRequest request) {
        AccessGuard.require(Permission.MANAGE_TRANSACTIONS);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TransactionResponse.from(transactionService.create(request)));
    }

    @PostMapping("/search")
    public ResponseEntity<List<TransactionResponse>> search(
            @RequestBody TransactionSearchRequest criteria,
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit) {
        AccessGuard.require(Permission.VIEW_TRANSACTIONS);
        return ResponseEntity.ok(toResponses(
            transactionService.search(criteria, pageLimits.of(skip, limit, NEWEST_FIRST))));
    }

    @GetMapping("/stats/overview")
    public ResponseEntity<TransactionStats> stats() {
        AccessGuard.require(Permission.VIEW_TRANSACTIONS);
        return ResponseEntity.ok(transactionService.stats());
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> get(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_TRANSACTIONS);
        return ResponseEntity.ok(transactionService.getDetail(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TransactionResponse> update(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody TransactionUpdateRequest request) {
        AccessGuard.require(Permission.MANAGE_TRANSACTIONS);
        return ResponseEntity.ok(TransactionResponse.from(transactionService.update(id, request)));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<TransactionResponse> cancel(@PathVariable("id") UUID id,
                                                      @RequestBody(required = false) TransactionNoteRequest body) {
        AccessGuard.require(Permission.MANAGE_TRANSACTIONS);
        return ResponseEntity.ok(TransactionResponse.from(transactionService.cancel(id, notesOf(body))));
    }

    @PutMapping("/{id}/complete")
    public ResponseEntity<TransactionResponse> complete(@PathVariable("id") UUID id,
                                                        @RequestBody(required = false) TransactionNoteRequest body) {
        AccessGuard.require(Permission.MANAGE_TRANSACTIONS);
        return ResponseEntity.ok(TransactionResponse.from(transactionService.complete(id, notesOf(body))));
    }

    private static String notesOf(TransactionNoteRequest body) {
        return body == null ? null : body.getNotes();
    }

    private static List<TransactionResponse> toResponses(List<TransactionEntity> transactions) {
        return transactions.stream().map(TransactionResponse::from).toList();
    }
}
