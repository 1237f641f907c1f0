package com.flagship.pawnshop.organization;

import com.flagship.pawnshop.access.AccessGuard;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.common.PageLimits;
import com.flagship.pawnshop.organization.dto.BranchRequest;
import com.flagship.pawnshop.organization.dto.BranchResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/branches")
@RequiredArgsConstructor
public class BranchController {

    private final BranchService branchService;
    private final PageLimits pageLimits;

    @GetMapping
    public ResponseEntity<List<BranchResponse>> list(
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit) {
        AccessGuard.require(Permission.VIEW_BRANCHES);
        return ResponseEntity.ok(branchService.list(pageLimits.of(skip, limit)).stream()
            .map(BranchResponse::from)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<BranchResponse> get(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_BRANCHES);
        return ResponseEntity.ok(BranchResponse.from(branchService.get(id)));
    }

    @PostMapping
    public ResponseEntity<BranchResponse> create(@Valid @RequestBody BranchRequest request) {
        AccessGuard.require(Permission.MANAGE_BRANCHES);
        return ResponseEntity.status(HttpStatus.CREATED).body(BranchResponse.from(branchService.create(request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BranchResponse> update(@PathVariable("id") UUID id,
                                                 @Valid @RequestBody BranchRequest request) {
        AccessGuard.require(Permission.MANAGE_BRANCHES);
        return ResponseEntity.ok(BranchResponse.from(branchService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.MANAGE_BRANCHES);
        branchService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
