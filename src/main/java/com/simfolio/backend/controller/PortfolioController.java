package com.simfolio.backend.controller;

import com.simfolio.backend.dto.PortfolioDTO;
import com.simfolio.backend.model.PortfolioSnapshot;
import com.simfolio.backend.service.PortfolioService;
import com.simfolio.backend.service.analytics.PortfolioAnalyticsService;
import com.simfolio.backend.service.ledger.EquityPoint;
import com.simfolio.backend.service.ledger.PnlPoint;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Tag(name = "Portfolio")
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
public class PortfolioController {

    private final PortfolioService portfolioService;
    private final PortfolioAnalyticsService analyticsService;

    @GetMapping
    @Operation(summary = "Get positions valued at live prices")
    public PortfolioDTO getPortfolio(@RequestHeader(UserHeaders.USER_ID) Long userId) {
        return PortfolioDTO.from(portfolioService.getPortfolio(userId));
    }

    @GetMapping("/equity")
    @Operation(summary = "Get the equity curve")
    public ResponseEntity<List<EquityPoint>> getEquityCurve(@RequestHeader(UserHeaders.USER_ID) Long userId) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(portfolioService.getEquityCurve(userId));
    }

    @GetMapping("/pnl")
    @Operation(summary = "Get the P&L curve")
    public ResponseEntity<List<PnlPoint>> getPnlCurve(@RequestHeader(UserHeaders.USER_ID) Long userId) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(portfolioService.getPnlCurve(userId));
    }

    @GetMapping("/snapshot")
    @Operation(summary = "Get allocation and risk analytics")
    public PortfolioSnapshot getSnapshot(@RequestHeader(UserHeaders.USER_ID) Long userId) {
        return analyticsService.buildSnapshot(userId);
    }
}
