package com.simfolio.backend.controller;

import com.simfolio.backend.repository.AccountRepository;
import com.simfolio.backend.repository.LedgerTransactionRepository;
import com.simfolio.backend.service.AccountService;
import com.simfolio.backend.service.marketdata.PriceOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ExtendWith(OutputCaptureExtension.class)
class TradeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private LedgerTransactionRepository transactionRepository;

    @MockBean
    private PriceOracle priceOracle;

    private final Long userId = 401L;

    @BeforeEach
    void setup() {
        transactionRepository.deleteAll();
        accountRepository.deleteAll();
        accountService.openAccount(userId, null);
        when(priceOracle.getPrice("AAPL")).thenReturn(Optional.of(new BigDecimal("150")));
    }

    @Test
    void buyReturnsCommittedTrade() throws Exception {
        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":" aapl ","type":"buy","quantity":100}
                                """))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.symbol").value("AAPL"))
                .andExpect(jsonPath("$.type").value("BUY"))
                .andExpect(jsonPath("$.price").value(150.0))
                .andExpect(jsonPath("$.totalAmount").value(15000.0))
                .andExpect(jsonPath("$.newBalance").value(85000.0))
                .andExpect(jsonPath("$.transactionId").isNumber());

        mockMvc.perform(get("/api/trades").header("X-User-Id", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].symbol").value("AAPL"))
                .andExpect(jsonPath("$[0].quantity").value(100));
    }

    @Test
    void unknownTypeIsInvalidInput() throws Exception {
        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"AAPL","type":"HOLD","quantity":1}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.message").value("Invalid type. Must be BUY or SELL"));
    }

    @Test
    void nonPositiveQuantityIsRejectedWithDetails() throws Exception {
        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"AAPL","type":"BUY","quantity":0}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.details[0].field").value("quantity"));
    }

    @Test
    void fractionalQuantityIsNotTruncated() throws Exception {
        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"AAPL","type":"BUY","quantity":1.5}
                                """))
                .andExpect(status().isBadRequest());

        assertThat(transactionRepository.countByUserId(userId)).isZero();
    }

    @Test
    void overdraftIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"AAPL","type":"BUY","quantity":10000}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_BALANCE"))
                .andExpect(jsonPath("$.message").value("Insufficient balance"));
    }

    @Test
    void tradeOutcomeIsAuditedWithActingUser(CapturedOutput output) throws Exception {
        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"AAPL","type":"BUY","quantity":10000}
                                """))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"AAPL","type":"BUY","quantity":1}
                                """))
                .andExpect(status().isOk());

        assertThat(output.getOut())
                .contains("Trade REJECTED user=401 status=422 errorCode=INSUFFICIENT_BALANCE")
                .contains("Trade ACCEPTED user=401 status=200 errorCode=-");
    }

    @Test
    void oversellIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"AAPL","type":"SELL","quantity":1}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_HOLDINGS"));
    }

    @Test
    void missingPriceIsServiceUnavailable() throws Exception {
        when(priceOracle.getPrice("GHOST")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/trades")
                        .header("X-User-Id", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"symbol":"GHOST","type":"BUY","quantity":1}
                                """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("PRICE_UNAVAILABLE"));
    }

    @Test
    void missingUserHeaderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/trades"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/trades").header("X-User-Id", "abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownAccountIsNotFound() throws Exception {
        mockMvc.perform(get("/api/trades").header("X-User-Id", 999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("ACCOUNT_NOT_FOUND"));
    }
}
