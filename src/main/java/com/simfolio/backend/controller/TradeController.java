package com.simfolio.backend.controller;

import com.simfolio.backend.dto.TradeRequest;
import com.simfolio.backend.dto.TradeResponse;
import com.simfolio.backend.dto.TransactionDTO;
import com.simfolio.backend.exception.InvalidInputException;
import com.simfolio.backend.model.TransactionType;
import com.simfolio.backend.service.AccountService;
import com.simfolio.backend.service.TradeExecutionService;
import jakarta.validation.Valid;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@Tag(name = "Trades")
@RequestMapping("/api/trades")
@RequiredArgsConstructor
public class TradeController {

    private final TradeExecutionService tradeExecutionService;
    private final AccountService accountService;

    @PostMapping
    @Operation(summary = "Execute a market BUY or SELL")
    public TradeResponse executeTrade(@RequestHeader(UserHeaders.USER_ID) Long userId,
                                      @Valid @RequestBody TradeRequest request) {
        TransactionType type;
        try {
            type = TransactionType.fromRequest(request.getType());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Invalid type. Must be BUY or SELL");
        }
        return TradeResponse.from(tradeExecutionService.executeTrade(userId, request.getSymbol(), type, request.getQuantity()));
    }

    @GetMapping
    @Operation(summary = "List ledger transactions in commit order")
    public List<TransactionDTO> getTransactions(@RequestHeader(UserHeaders.USER_ID) Long userId) {
        return accountService.getTransactions(userId).stream()
                .map(TransactionDTO::from)
                .toList();
    }
}
