package com.flagship.pawnshop.inventory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ItemRepository extends JpaRepository<ItemEntity, UUID>, JpaSpecificationExecutor<ItemEntity> {

    long countByStatusIn(Collection<ItemStatus> statuses);

    long countByCreatedAtGreaterThanEqual(Instant since);

    long countByStatusAndUpdatedAtGreaterThanEqual(ItemStatus status, Instant since);

    @Query("SELECT COALESCE(SUM(i.appraisedValue), 0) FROM ItemEntity i")
    BigDecimal sumAppraisedValue();

    @Query("SELECT COALESCE(SUM(i.appraisedValue), 0) FROM ItemEntity i WHERE i.status IN :statuses")
    BigDecimal sumAppraisedValueByStatusIn(@Param("statuses") Collection<ItemStatus> statuses);

    @Query("SELECT i.status, COUNT(i) FROM ItemEntity i GROUP BY i.status")
    List<Object[]> countGroupedByStatus();

    @Query("SELECT i.category, COUNT(i) FROM ItemEntity i GROUP BY i.category")
    List<Object[]> countGroupedByCategory();
}
