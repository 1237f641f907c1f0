package com.flagship.pawnshop.inventory;

import com.flagship.pawnshop.access.AccessGuard;
import com.flagship.pawnshop.access.Permission;
import com.flagship.pawnshop.common.PageLimits;
import com.flagship.pawnshop.inventory.dto.ItemRequest;
import com.flagship.pawnshop.inventory.dto.ItemResponse;
import com.flagship.pawnshop.inventory.dto.ItemSearchRequest;
import com.flagship.pawnshop.inventory.dto.ItemStats;
import com.flagship.pawnshop.inventory.dto.ItemStatusRequest;
import com.flagship.pawnshop.inventory.dto.ItemUpdateRequest;
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
@RequestMapping("/api/v1/inventory")
@RequiredArgsConstructor
public class ItemController {

    private final ItemService itemService;
    private final PageLimits pageLimits;

    @GetMapping
    public ResponseEntity<List<ItemResponse>> list(
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "status", required = false) ItemStatus status,
            @RequestParam(value = "category", required = false) ItemCategory category,
            @RequestParam(value = "search", required = false) String search) {
        AccessGuard.require(Permission.VIEW_INVENTORY);
        return ResponseEntity.ok(toResponses(
            itemService.list(status, category, search, pageLimits.of(skip, limit))));
    }

    @PostMapping
    public ResponseEntity<ItemResponse> create(@Valid @RequestBody ItemRequest request) {
        AccessGuard.require(Permission.MANAGE_INVENTORY);
        return ResponseEntity.status(HttpStatus.CREATED).body(ItemResponse.from(itemService.create(request)));
    }

    @PostMapping("/search")
    public ResponseEntity<List<ItemResponse>> search(
            @RequestBody ItemSearchRequest criteria,
            @RequestParam(value = "skip", required = false) Integer skip,
            @RequestParam(value = "limit", required = false) Integer limit) {
        AccessGuard.require(Permission.VIEW_INVENTORY);
        return ResponseEntity.ok(toResponses(itemService.search(criteria, pageLimits.of(skip, limit))));
    }

    @GetMapping("/stats/overview")
    public ResponseEntity<ItemStats> stats() {
        AccessGuard.require(Permission.VIEW_INVENTORY);
        return ResponseEntity.ok(itemService.stats());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ItemResponse> get(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.VIEW_INVENTORY);
        return ResponseEntity.ok(ItemResponse.from(itemService.get(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ItemResponse> update(@PathVariable("id") UUID id,
                                               @Valid @RequestBody ItemUpdateRequest request) {
        AccessGuard.require(Permission.MANAGE_INVENTORY);
        return ResponseEntity.ok(ItemResponse.from(itemService.update(id, request)));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<ItemResponse> updateStatus(@PathVariable("id") UUID id,
                                                     @Valid @RequestBody ItemStatusRequest request) {
        AccessGuard.require(Permission.MANAGE_INVENTORY);
        return ResponseEntity.ok(ItemResponse.from(
            itemService.updateStatus(id, request.getStatus(), request.getNotes())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        AccessGuard.require(Permission.MANAGE_INVENTORY);
        itemService.delete(id);
        return ResponseEntity.noContent().build();
    }

    private static List<ItemResponse> toResponses(List<ItemEntity> items) {
        return items.stream().map(ItemResponse::from).toList();
    }
}
