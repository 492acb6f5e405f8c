package com.flagship.asset_ledger.settlement;

import com.flagship.asset_ledger.error.ErrorCode;
import com.flagship.asset_ledger.error.InsufficientFundsException;
import com.flagship.asset_ledger.error.RecordNotFoundException;
import com.flagship.asset_ledger.error.UnauthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerSettlementTransferProviderTest {

    @Mock
    private SettlementLedger ledger;

    private LedgerSettlementTransferProvider provider;

    private final UUID source = UUID.randomUUID();
    private final UUID destination = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        provider = new LedgerSettlementTransferProvider(ledger);
    }

    private void givenAccounts() {
        when(ledger.lockAccount(source)).thenReturn(Optional.of(new SettlementAccount(source, "A", Instant.EPOCH)));
        when(ledger.findAccount(destination)).thenReturn(Optional.of(new SettlementAccount(destination, "B", Instant.EPOCH)));
    }

    @Test
    @DisplayName("Posts a balanced debit/credit pair for the amount")
    void transfer() {
        givenAccounts();
        when(ledger.balanceOf(source)).thenReturn(100L);
        UUID transferId = UUID.randomUUID();
        when(ledger.post(any(LedgerPosting.class))).thenReturn(transferId);

        assertEquals(transferId, provider.transfer(source, destination, 10, "A"));

        ArgumentCaptor<LedgerPosting> posting = ArgumentCaptor.forClass(LedgerPosting.class);
        verify(ledger).post(posting.capture());
        assertTrue(posting.getValue().isBalanced());
        assertEquals(10, posting.getValue().getDebitTotal());
        assertEquals(source, posting.getValue().getDebits().get(0).getAccountId());
        assertEquals(destination, posting.getValue().getCredits().get(0).getAccountId());
        assertEquals("A", posting.getValue().getAuthority());
    }

    @Test
    @DisplayName("Balance exactly equal to the amount is enough")
    void transferWholeBalance() {
        givenAccounts();
        when(ledger.balanceOf(source)).thenReturn(10L);
        when(ledger.post(any(LedgerPosting.class))).thenReturn(UUID.randomUUID());

        assertNotNull(provider.transfer(source, destination, 10, "A"));
    }

    @Test
    @DisplayName("Insufficient balance is rejected without posting")
    void insufficientFunds() {
        givenAccounts();
        when(ledger.balanceOf(source)).thenReturn(9L);

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> provider.transfer(source, destination, 10, "A"));

        assertEquals(10, e.getRequested());
        assertEquals(9, e.getAvailable());
        verify(ledger, never()).post(any());
    }

    @Test
    @DisplayName("Authority that does not own the source is rejected")
    void wrongAuthority() {
        givenAccounts();

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
            () -> provider.transfer(source, destination, 10, "B"));

        assertEquals("B", e.getIdentity());
        verify(ledger, never()).post(any());
    }

    @Test
    @DisplayName("Unknown source account fails with SETTLEMENT_ACCOUNT_NOT_FOUND")
    void unknownSource() {
        when(ledger.lockAccount(source)).thenReturn(Optional.empty());

        RecordNotFoundException e = assertThrows(RecordNotFoundException.class,
            () -> provider.transfer(source, destination, 10, "A"));

        assertEquals(ErrorCode.SETTLEMENT_ACCOUNT_NOT_FOUND, e.getCode());
        assertEquals(source, e.getRecordId());
    }

    @Test
    @DisplayName("Non-positive amounts and self transfers are programming errors")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> provider.transfer(source, destination, 0, "A"));
        assertThrows(IllegalArgumentException.class, () -> provider.transfer(source, destination, -1, "A"));
        assertThrows(IllegalArgumentException.class, () -> provider.transfer(source, source, 10, "A"));
        verifyNoInteractions(ledger);
    }
}
