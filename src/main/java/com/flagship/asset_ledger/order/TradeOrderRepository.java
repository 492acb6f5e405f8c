package com.flagship.asset_ledger.order;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface TradeOrderRepository extends JpaRepository<TradeOrderEntity, UUID>,
        JpaSpecificationExecutor<TradeOrderEntity> {

    long countByActiveTrue();
}
