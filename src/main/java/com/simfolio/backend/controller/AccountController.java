package com.simfolio.backend.controller;

import com.simfolio.backend.dto.AccountDTO;
import com.simfolio.backend.dto.OpenAccountRequest;
import com.simfolio.backend.model.Account;
import com.simfolio.backend.service.AccountService;
import jakarta.validation.Valid;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@Tag(name = "Account")
@RequestMapping("/api/account")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    @PostMapping
    @Operation(summary = "Open a simulated account")
    public ResponseEntity<AccountDTO> openAccount(@RequestHeader(UserHeaders.USER_ID) Long userId,
                                                  @Valid @RequestBody(required = false) OpenAccountRequest request) {
        Account account = accountService.openAccount(userId, request == null ? null : request.getStartingBalance());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountDTO.from(account));
    }

    @GetMapping
    @Operation(summary = "Get account balances")
    public AccountDTO getAccount(@RequestHeader(UserHeaders.USER_ID) Long userId) {
        return AccountDTO.from(accountService.getAccount(userId));
    }

    @GetMapping("/reconciliation")
    @Operation(summary = "Check the stored balance against the ledger")
    public AccountService.Reconciliation reconcile(@RequestHeader(UserHeaders.USER_ID) Long userId) {
        return accountService.reconcile(userId);
    }
}
