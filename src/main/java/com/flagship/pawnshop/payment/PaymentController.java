package com.flagship.pawnshop.payment;

import com.flagship.pawnshop.access.AccessGuard;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.common.PageLimits;
import com.flagship.pawnshop.payment.dto.PaymentResponse;
import com.flagship.pawnshop.payment.dto.UpdatePaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;
    private final PageLimits pageLimits;

    @GetMapping
    public ResponseEntity<List<PaymentResponse>> list(
            @RequestParam(value = "loan_id", required = false) UUID loanId,
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit) {
        AccessGuard.require(Permission.VIEW_LOANS);
        List<PaymentEntity> payments = paymentService.list(loanId,
            pageLimits.of(skip, limit, Sort.by(Sort.Direction.DESC, "paymentDate", "createdAt")));
        return ResponseEntity.ok(payments.stream().map(PaymentResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> get(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_LOANS);
        return ResponseEntity.ok(PaymentResponse.from(paymentService.get(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PaymentResponse> update(@PathVariable("id") UUID id,
                                                  @Valid @RequestBody UpdatePaymentRequest request) {
        AccessGuard.require(Permission.MANAGE_LOANS);
        return ResponseEntity.ok(PaymentResponse.from(paymentService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.MANAGE_LOANS);
        paymentService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
