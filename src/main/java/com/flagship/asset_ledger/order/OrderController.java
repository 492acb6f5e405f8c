package com.flagship.asset_ledger.order;

import com.flagship.asset_ledger.order.dto.CreateOrderRequest;
import com.flagship.asset_ledger.order.dto.TradeOrderResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Slf4j
public class OrderController {

    private final OrderBookService orderBookService;

    @PostMapping
    public ResponseEntity<TradeOrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        log.info("Received order: asset={}, owner={}, type={}",
                request.getAssetId(), request.getOwnerId(), request.getOrderType());

        TradeOrder order = orderBookService.createOrder(
            request.getAssetId(),
            request.getOwnerId(),
            request.getOrderType(),
            request.getQuantity(),
            request.getPricePerUnit()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(TradeOrderResponse.from(order));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TradeOrderResponse> getOrder(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TradeOrderResponse.from(orderBookService.getOrder(id)));
    }

    @GetMapping
    public ResponseEntity<List<TradeOrderResponse>> listOrders(
            @RequestParam(name = "asset_id", required = false) UUID assetId,
            @RequestParam(name = "owner_id", required = false) String ownerId,
            @RequestParam(name = "order_type", required = false) OrderType orderType,
            @RequestParam(name = "active", required = false) Boolean active) {

        List<TradeOrderResponse> orders = orderBookService.listOrders(assetId, ownerId, orderType, active).stream()
            .map(TradeOrderResponse::from)
            .toList();
        return ResponseEntity.ok(orders);
    }
}
