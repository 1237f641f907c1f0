package com.flagship.pawnshop.inventory;

import com.flagship.pawnshop.common.CodeGenerator;
import com.flagship.pawnshop.common.Specs;
import com.flagship.pawnshop.common.TimeWindows;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.inventory.dto.ItemRequest;
import com.flagship.pawnshop.inventory.dto.ItemSearchRequest;
import com.flagship.pawnshop.inventory.dto.ItemStats;
import com.flagship.pawnshop.inventory.dto.ItemUpdateRequest;
import com.flagship.pawnshop.loan.LoanRepository;
import com.flagship.pawnshop.loan.LoanStatus;
import com.flagship.pawnshop.organization.BranchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Collateral inventory: CRUD, search and stock statistics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ItemService {

    private final ItemRepository itemRepository;
    private final BranchRepository branchRepository;
    private final CustomerRepository customerRepository;
    private final LoanRepository loanRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ItemEntity> list(ItemStatus status, ItemCategory category, String search, Pageable pageable) {
        Specification<ItemEntity> spec = Specification.where(Specs.<ItemEntity>equal("status", status))
            .and(Specs.equal("category", category))
            .and(Specs.textSearch(search, "name", "description", "serialNumber", "itemCode"));
        return itemRepository.findAll(spec, pageable).getContent();
    }

    @Transactional(readOnly = true)
    public List<ItemEntity> search(ItemSearchRequest criteria, Pageable pageable) {
        Instant createdFrom = criteria.getCreatedAfter() != null
            ? TimeWindows.startOfDay(criteria.getCreatedAfter(), clock) : null;
        Instant createdUntil = criteria.getCreatedBefore() != null
            ? TimeWindows.endOfDay(criteria.getCreatedBefore(), clock) : null;

        Specification<ItemEntity> spec = Specification
            .where(Specs.<ItemEntity>textSearch(criteria.getSearchTerm(),
                "name", "description", "serialNumber", "itemCode"))
            .and(Specs.equal("category", criteria.getCategory()))
            .and(Specs.equal("status", criteria.getStatus()))
            .and(Specs.atLeast("appraisedValue", criteria.getMinValue()))
            .and(Specs.atMost("appraisedValue", criteria.getMaxValue()))
            .and(Specs.equal("customerId", criteria.getCustomerId()))
            .and(Specs.equal("branchId", criteria.getBranchId()))
            .and(Specs.atLeast("createdAt", createdFrom))
            .and(Specs.before("createdAt", createdUntil));
        return itemRepository.findAll(spec, pageable).getContent();
    }

    @Transactional(readOnly = true)
    public ItemEntity get(UUID id) {
        return itemRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Item", id));
    }

    /**
     * @throws NotFoundException if the branch, or the customer when given, does not exist
     */
    @Transactional
    public ItemEntity create(ItemRequest request) {
        requireReferences(request.getBranchId(), request.getCustomerId());
        ItemEntity saved = itemRepository.save(ItemEntity.create(CodeGenerator.itemCode(), request));
        log.info("Item created: itemId={}, itemCode={}, category={}",
            saved.getId(), saved.getItemCode(), saved.getCategory());
        return saved;
    }

    @Transactional
    public ItemEntity update(UUID id, ItemUpdateRequest request) {
        ItemEntity item = get(id);
        requireReferences(request.getBranchId(), null);
        item.apply(request);
        return itemRepository.save(item);
    }

    /**
     * Operator status change. Non-blank notes replace the item's notes.
     */
    @Transactional
    public ItemEntity updateStatus(UUID id, ItemStatus status, String notes) {
        ItemEntity item = get(id);
        ItemStatus previous = item.getStatus();
        item.changeStatus(status, notes);
        ItemEntity saved = itemRepository.save(item);
        log.info("Item status changed: itemId={}, {} -> {}", id, previous, status);
        return saved;
    }

    /**
     * Hard delete.
     *
     * @throws ConflictException if an ACTIVE or OVERDUE loan is secured by the item
     */
    @Transactional
    public void delete(UUID id) {
        ItemEntity item = get(id);
        long openLoans = loanRepository.countByItemIdAndStatusIn(id, LoanStatus.OPEN);
        if (openLoans > 0) {
            throw new ConflictException("Cannot delete item that is associated with an active loan");
        }
        itemRepository.delete(item);
        log.info("Item deleted: itemId={}", id);
    }

    @Transactional(readOnly = true)
    public ItemStats stats() {
        long total = itemRepository.count();

        Map<ItemStatus, Long> byStatus = new EnumMap<>(ItemStatus.class);
        for (ItemStatus status : ItemStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (Object[] row : itemRepository.countGroupedByStatus()) {
            byStatus.put((ItemStatus) row[0], (Long) row[1]);
        }

        Map<ItemCategory, Long> byCategory = new EnumMap<>(ItemCategory.class);
        for (ItemCategory category : ItemCategory.values()) {
            byCategory.put(category, 0L);
        }
        for (Object[] row : itemRepository.countGroupedByCategory()) {
            byCategory.put((ItemCategory) row[0], (Long) row[1]);
        }

        BigDecimal totalValue = itemRepository.sumAppraisedValue();
        BigDecimal average = total > 0
            ? totalValue.divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
            : BigDecimal.ZERO;
        Instant monthStart = TimeWindows.startOfCurrentMonth(clock);

        return ItemStats.builder()
            .totalItems(total)
            .itemsByStatus(byStatus)
            .itemsByCategory(byCategory)
            .totalInventoryValue(totalValue)
            .averageItemValue(average)
            .itemsAddedThisMonth(itemRepository.countByCreatedAtGreaterThanEqual(monthStart))
            .itemsSoldThisMonth(itemRepository.countByStatusAndUpdatedAtGreaterThanEqual(ItemStatus.SOLD, monthStart))
            .build();
    }

    private void requireReferences(UUID branchId, UUID customerId) {
        if (branchId != null && !branchRepository.existsById(branchId)) {
            throw new NotFoundException("Branch", branchId);
        }
        if (customerId != null && !customerRepository.existsById(customerId)) {
            throw new NotFoundException("Customer", customerId);
        }
    }
}
