package com.flagship.asset_ledger.trade;

import com.flagship.asset_ledger.asset.Asset;
import com.flagship.asset_ledger.asset.AssetRegistryService;
import com.flagship.asset_ledger.asset.AssetType;
import com.flagship.asset_ledger.auth.TransactionSigners;
import com.flagship.asset_ledger.error.InsufficientFundsException;
import com.flagship.asset_ledger.error.OrderInactiveException;
import com.flagship.asset_ledger.error.UnauthorizedException;
import com.flagship.asset_ledger.order.OrderBookService;
import com.flagship.asset_ledger.order.OrderType;
import com.flagship.asset_ledger.order.TradeOrder;
import com.flagship.asset_ledger.settlement.EntryType;
import com.flagship.asset_ledger.settlement.LedgerEntry;
import com.flagship.asset_ledger.settlement.SettlementAccountService;
import com.flagship.asset_ledger.settlement.SettlementLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Trade execution against a real database.
 *
 * These tests verify that:
 * - A trade moves ownership, consumes the order and settles in one unit
 * - A failed trade leaves asset, order and settlement balances exactly as they were
 * - A consumed order cannot be executed twice
 * - The ownership primitive refuses to run outside a trade
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class TradeExecutionIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("asset_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("ledger.events.enabled", () -> "false");
    }

    @Autowired
    private AssetRegistryService assetRegistryService;

    @Autowired
    private OrderBookService orderBookService;

    @Autowired
    private TradeExecutionService tradeExecutionService;

    @Autowired
    private SettlementAccountService settlementAccountService;

    @Autowired
    private SettlementLedger settlementLedger;

    private String seller;
    private String buyer;
    private UUID sellerAccount;
    private UUID buyerAccount;

    @BeforeEach
    void setUp() {
        // Unique identities keep tests independent on the shared database
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        seller = "A-" + suffix;
        buyer = "B-" + suffix;
        sellerAccount = settlementAccountService.openAccount(seller).getId();
        buyerAccount = settlementAccountService.openAccount(buyer).getId();
        settlementAccountService.deposit(sellerAccount, 100);
    }

    private ExecuteTradeCommand command(TradeOrder order, Asset asset) {
        return ExecuteTradeCommand.builder()
            .orderId(order.getId())
            .assetId(asset.getId())
            .orderOwner(seller)
            .buyer(buyer)
            .settlementSource(sellerAccount)
            .settlementDestination(buyerAccount)
            .build();
    }

    @Test
    @DisplayName("Gold asset sold to B: owner becomes B, order consumed, 10 units settled")
    void endToEndTrade() {
        // given
        Asset asset = assetRegistryService.createAsset(seller, AssetType.GOLD, 1000, 99, "C1", 5000);
        TradeOrder order = orderBookService.createOrder(asset.getId(), seller, OrderType.SELL, 10, 5000);

        // when
        TradeExecution execution = tradeExecutionService.executeTrade(
            command(order, asset), TransactionSigners.of(seller, buyer));

        // then
        Asset after = assetRegistryService.getAsset(asset.getId());
        TradeOrder consumed = orderBookService.getOrder(order.getId());
        assertEquals(buyer, after.getOwnerId());
        assertFalse(consumed.isActive());
        assertEquals(0, consumed.getQuantity());

        assertEquals(10, execution.getSettledAmount());
        assertEquals(90, settlementAccountService.balanceOf(sellerAccount));
        assertEquals(10, settlementAccountService.balanceOf(buyerAccount));

        List<LedgerEntry> entries = settlementLedger.entriesForTransfer(execution.getSettlementTransferId());
        assertEquals(2, entries.size());
        assertEquals(EntryType.DEBIT, entries.get(0).getEntryType());
        assertEquals(EntryType.CREDIT, entries.get(1).getEntryType());
    }

    @Test
    @DisplayName("A consumed order cannot be executed again")
    void secondExecutionFails() {
        Asset asset = assetRegistryService.createAsset(seller, AssetType.SILVER, 500, 92, "C2", 30);
        TradeOrder order = orderBookService.createOrder(asset.getId(), seller, OrderType.SELL, 10, 30);
        tradeExecutionService.executeTrade(command(order, asset), TransactionSigners.of(seller, buyer));

        assertThrows(OrderInactiveException.class, () -> tradeExecutionService.executeTrade(
            command(order, asset), TransactionSigners.of(seller, buyer)));

        assertEquals(90, settlementAccountService.balanceOf(sellerAccount));
    }

    @Test
    @DisplayName("Settlement failure rolls back: order stays active and asset stays with the seller")
    void settlementFailureRollsBack() {
        Asset asset = assetRegistryService.createAsset(seller, AssetType.PLATINUM, 200, 95, "C3", 900);
        TradeOrder order = orderBookService.createOrder(asset.getId(), seller, OrderType.SELL, 500, 900);

        assertThrows(InsufficientFundsException.class, () -> tradeExecutionService.executeTrade(
            command(order, asset), TransactionSigners.of(seller, buyer)));

        TradeOrder unchanged = orderBookService.getOrder(order.getId());
        assertTrue(unchanged.isActive());
        assertEquals(500, unchanged.getQuantity());
        assertEquals(seller, assetRegistryService.getAsset(asset.getId()).getOwnerId());
        assertEquals(100, settlementAccountService.balanceOf(sellerAccount));
        assertEquals(0, settlementAccountService.balanceOf(buyerAccount));
    }

    @Test
    @DisplayName("Missing buyer signature leaves everything untouched")
    void unauthorizedLeavesNoTrace() {
        Asset asset = assetRegistryService.createAsset(seller, AssetType.EMERALD, 5, 80, "C4", 1200);
        TradeOrder order = orderBookService.createOrder(asset.getId(), seller, OrderType.SELL, 10, 1200);

        assertThrows(UnauthorizedException.class, () -> tradeExecutionService.executeTrade(
            command(order, asset), TransactionSigners.of(seller)));

        assertTrue(orderBookService.getOrder(order.getId()).isActive());
        assertEquals(seller, assetRegistryService.getAsset(asset.getId()).getOwnerId());
        assertEquals(100, settlementAccountService.balanceOf(sellerAccount));
    }

    @Test
    @DisplayName("One owner may hold two assets of the same type")
    void sameOwnerSameType() {
        Asset first = assetRegistryService.createAsset(seller, AssetType.GOLD, 1000, 99, "C1", 5000);
        Asset second = assetRegistryService.createAsset(seller, AssetType.GOLD, 2000, 99, "C2", 5000);

        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, assetRegistryService.listAssets(seller, AssetType.GOLD, true).size());
    }

    @Test
    @DisplayName("Two orders placed by one owner back to back get distinct ids")
    void ordersDoNotCollide() {
        UUID assetRef = UUID.randomUUID();
        TradeOrder first = orderBookService.createOrder(assetRef, seller, OrderType.BUY, 1, 1);
        TradeOrder second = orderBookService.createOrder(assetRef, seller, OrderType.BUY, 1, 1);

        assertNotEquals(first.getId(), second.getId());
        assertEquals(2, orderBookService.listOrders(assetRef, seller, null, null).size());
    }

    @Test
    @DisplayName("Ownership cannot be transferred outside a trade")
    void transferOwnershipRequiresTransaction() {
        Asset asset = assetRegistryService.createAsset(seller, AssetType.RUBY, 3, 70, "C5", 400);

        assertThrows(IllegalTransactionStateException.class,
            () -> assetRegistryService.transferOwnership(asset.getId(), buyer));
        assertEquals(seller, assetRegistryService.getAsset(asset.getId()).getOwnerId());
    }

    @Test
    @DisplayName("Total active value is summed beyond the bigint range")
    void totalValueBeyondBigint() {
        assetRegistryService.createAsset(seller, AssetType.PLATINUM, 1_000_000, 95, "C6", 10_000_000_000_000L);

        BigInteger total = assetRegistryService.totalActiveValue();

        assertTrue(total.compareTo(BigInteger.valueOf(Long.MAX_VALUE)) > 0);
    }
}
