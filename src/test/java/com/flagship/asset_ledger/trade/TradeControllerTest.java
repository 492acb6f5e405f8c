package com.flagship.asset_ledger.trade;

import com.flagship.asset_ledger.auth.TransactionSigners;
import com.flagship.asset_ledger.error.InsufficientFundsException;
import com.flagship.asset_ledger.error.InvalidQuantityException;
import com.flagship.asset_ledger.error.OrderInactiveException;
import com.flagship.asset_ledger.error.RecordNotFoundException;
import com.flagship.asset_ledger.error.UnauthorizedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TradeController.class)
class TradeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TradeExecutionService tradeExecutionService;

    private final UUID orderId = UUID.randomUUID();
    private final UUID assetId = UUID.randomUUID();
    private final UUID source = UUID.randomUUID();
    private final UUID destination = UUID.randomUUID();

    private String body() {
        return """
            {
              "order_id": "%s",
              "asset_id": "%s",
              "order_owner": "A",
              "buyer": "B",
              "settlement_source": "%s",
              "settlement_destination": "%s"
            }
            """.formatted(orderId, assetId, source, destination);
    }

    @Test
    @DisplayName("POST /api/trades returns the execution and passes the signer header through")
    void executeTrade() throws Exception {
        UUID transferId = UUID.randomUUID();
        when(tradeExecutionService.executeTrade(any(ExecuteTradeCommand.class), any(TransactionSigners.class)))
            .thenReturn(new TradeExecution(orderId, assetId, "A", "B", 10, transferId, 1_700_000_000L));

        mockMvc.perform(post("/api/trades")
                .contentType(MediaType.APPLICATION_JSON)
                .header(TransactionSigners.HEADER, "A,B")
                .content(body()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.order_id").value(orderId.toString()))
            .andExpect(jsonPath("$.seller").value("A"))
            .andExpect(jsonPath("$.buyer").value("B"))
            .andExpect(jsonPath("$.settled_amount").value(10))
            .andExpect(jsonPath("$.settlement_transfer_id").value(transferId.toString()))
            .andExpect(header().exists("X-Correlation-ID"));

        ArgumentCaptor<ExecuteTradeCommand> command = ArgumentCaptor.forClass(ExecuteTradeCommand.class);
        ArgumentCaptor<TransactionSigners> signers = ArgumentCaptor.forClass(TransactionSigners.class);
        verify(tradeExecutionService).executeTrade(command.capture(), signers.capture());
        assertEquals(orderId, command.getValue().getOrderId());
        assertEquals(source, command.getValue().getSettlementSource());
        assertTrue(signers.getValue().hasSigned("A"));
        assertTrue(signers.getValue().hasSigned("B"));
    }

    @Test
    @DisplayName("OrderInactive maps to 409")
    void orderInactive() throws Exception {
        when(tradeExecutionService.executeTrade(any(), any())).thenThrow(new OrderInactiveException(orderId));

        mockMvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON)
                .header(TransactionSigners.HEADER, "A,B").content(body()))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ORDER_INACTIVE"));
    }

    @Test
    @DisplayName("InvalidQuantity maps to 422")
    void invalidQuantity() throws Exception {
        when(tradeExecutionService.executeTrade(any(), any())).thenThrow(new InvalidQuantityException(orderId, 0));

        mockMvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON)
                .header(TransactionSigners.HEADER, "A,B").content(body()))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("INVALID_QUANTITY"));
    }

    @Test
    @DisplayName("Unauthorized maps to 403")
    void unauthorized() throws Exception {
        when(tradeExecutionService.executeTrade(any(), any()))
            .thenThrow(new UnauthorizedException("B", "did not co-sign the transaction"));

        mockMvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON).content(body()))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    @DisplayName("InsufficientFunds maps to 422")
    void insufficientFunds() throws Exception {
        when(tradeExecutionService.executeTrade(any(), any()))
            .thenThrow(new InsufficientFundsException(source, 10, 0));

        mockMvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON)
                .header(TransactionSigners.HEADER, "A,B").content(body()))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_FUNDS"));
    }

    @Test
    @DisplayName("Unknown order maps to 404")
    void unknownOrder() throws Exception {
        when(tradeExecutionService.executeTrade(any(), any())).thenThrow(RecordNotFoundException.order(orderId));

        mockMvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON)
                .header(TransactionSigners.HEADER, "A,B").content(body()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("ORDER_NOT_FOUND"));
    }

    @Test
    @DisplayName("Missing buyer fails validation")
    void missingBuyer() throws Exception {
        String incomplete = """
            {
              "order_id": "%s",
              "asset_id": "%s",
              "order_owner": "A",
              "settlement_source": "%s",
              "settlement_destination": "%s"
            }
            """.formatted(orderId, assetId, source, destination);

        mockMvc.perform(post("/api/trades").contentType(MediaType.APPLICATION_JSON).content(incomplete))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.buyer").exists());

        verifyNoInteractions(tradeExecutionService);
    }
}
