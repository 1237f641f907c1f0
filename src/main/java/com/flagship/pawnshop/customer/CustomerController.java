package com.flagship.pawnshop.customer;

import com.flagship.pawnshop.access.AccessGuard;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.common.PageLimits;
import com.flagship.pawnshop.customer.dto.CustomerRequest;
import com.flagship.pawnshop.customer.dto.CustomerResponse;
import com.flagship.pawnshop.customer.dto.CustomerSearchRequest;
import com.flagship.pawnshop.customer.dto.CustomerStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerService customerService;
    private final PageLimits pageLimits;

    @GetMapping
    public ResponseEntity<List<CustomerResponse>> list(
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "is_active", required = false) Boolean active) {
        AccessGuard.require(Permission.VIEW_CUSTOMERS);
        return ResponseEntity.ok(toResponses(customerService.list(search, active, pageLimits.of(skip, limit))));
    }

    @PostMapping
    public ResponseEntity<CustomerResponse> create(
            @Validated(CustomerRequest.OnCreate.class) @RequestBody CustomerRequest request) {
        AccessGuard.require(Permission.MANAGE_CUSTOMERS);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(CustomerResponse.from(customerService.create(request)));
    }

    @PostMapping("/search")
    public ResponseEntity<List<CustomerResponse>> search(
            @RequestBody CustomerSearchRequest criteria,
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit) {
        AccessGuard.require(Permission.VIEW_CUSTOMERS);
        return ResponseEntity.ok(toResponses(customerService.search(criteria, pageLimits.of(skip, limit))));
    }

    @GetMapping("/stats/overview")
    public ResponseEntity<CustomerStats> stats() {
        AccessGuard.require(Permission.VIEW_CUSTOMERS);
        return ResponseEntity.ok(customerService.stats());
    }

    @GetMapping("/{id}")
    public ResponseEntity<CustomerResponse> get(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_CUSTOMERS);
        return ResponseEntity.ok(CustomerResponse.from(customerService.get(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<CustomerResponse> update(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody CustomerRequest request) {
        AccessGuard.require(Permission.MANAGE_CUSTOMERS);
        return ResponseEntity.ok(CustomerResponse.from(customerService.update(id, request)));
    }

    /**
     * Returns the deactivated customer.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<CustomerResponse> delete(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.MANAGE_CUSTOMERS);
        return ResponseEntity.ok(CustomerResponse.from(customerService.delete(id)));
    }

    private static List<CustomerResponse> toResponses(List<CustomerEntity> customers) {
        return customers.stream().map(CustomerResponse::from).toList();
    }
}
