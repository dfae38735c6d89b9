package com.baladi.settlement.controller;

import com.baladi.common.dto.ApiResponse;
import com.baladi.settlement.dto.CloseWeekRequest;
import com.baladi.settlement.dto.ReviewSettlementRequest;
import com.baladi.settlement.dto.SettlementReport;
import com.baladi.settlement.service.SettlementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/settlements")
@RequiredArgsConstructor
public class SettlementController {

    private final SettlementService settlementService;

    @GetMapping("/current")
    public ApiResponse<SettlementReport.Period> getCurrentPeriod() {
        return ApiResponse.ok(settlementService.getCurrentWeekSettlement()
                .map(SettlementReport.Period::from)
                .orElse(null));
    }

    @GetMapping("/periods")
    public ApiResponse<List<SettlementReport.Period>> getPeriods() {
        return ApiResponse.ok(settlementService.getPeriods().stream()
                .map(SettlementReport.Period::from)
                .toList());
    }

    @PostMapping("/close")
    public ApiResponse<SettlementReport.Period> closeWeek(@Valid @RequestBody CloseWeekRequest request) {
        return ApiResponse.ok(settlementService.closeWeek(request.adminId(), request.note())
                .map(SettlementReport.Period::from)
                .getOrThrow());
    }

    @GetMapping("/periods/{periodId}/shops")
    public ApiResponse<List<SettlementReport.Shop>> getShopSettlements(@PathVariable Long periodId) {
        return ApiResponse.ok(settlementService.getShopSettlements(periodId).stream()
                .map(SettlementReport.Shop::from)
                .toList());
    }

    @GetMapping("/periods/{periodId}/riders")
    public ApiResponse<List<SettlementReport.Rider>> getRiderSettlements(@PathVariable Long periodId) {
        return ApiResponse.ok(settlementService.getRiderSettlements(periodId).stream()
                .map(SettlementReport.Rider::from)
                .toList());
    }

    @GetMapping("/shops/{shopId}/history")
    public ApiResponse<List<SettlementReport.Shop>> getShopHistory(@PathVariable Long shopId) {
        return ApiResponse.ok(settlementService.getShopHistory(shopId).stream()
                .map(SettlementReport.Shop::from)
                .toList());
    }

    @GetMapping("/riders/{riderId}/history")
    public ApiResponse<List<SettlementReport.Rider>> getRiderHistory(@PathVariable Long riderId) {
        return ApiResponse.ok(settlementService.getRiderHistory(riderId).stream()
                .map(SettlementReport.Rider::from)
                .toList());
    }

    @GetMapping("/periods/{periodId}/report")
    public SettlementReport getReport(@PathVariable Long periodId) {
        return settlementService.getSettlementReport(periodId).getOrThrow();
    }

    @PatchMapping("/shops/{settlementId}")
    public ApiResponse<SettlementReport.Shop> reviewShop(@PathVariable Long settlementId,
                                                         @Valid @RequestBody ReviewSettlementRequest request) {
        return ApiResponse.ok(settlementService.reviewShopSettlement(
                        settlementId, request.status(), request.adminId(), request.note())
                .map(SettlementReport.Shop::from)
                .getOrThrow());
    }

    @PatchMapping("/riders/{settlementId}")
    public ApiResponse<SettlementReport.Rider> reviewRider(@PathVariable Long settlementId,
                                                           @Valid @RequestBody ReviewSettlementRequest request) {
        return ApiResponse.ok(settlementService.reviewRiderSettlement(
                        settlementId, request.status(), request.adminId(), request.note())
                .map(SettlementReport.Rider::from)
                .getOrThrow());
    }

    @PostMapping("/periods/{periodId}/settle")
    public ApiResponse<SettlementReport.Period> markSettled(@PathVariable Long periodId) {
        return ApiResponse.ok(settlementService.markPeriodSettled(periodId)
                .map(SettlementReport.Period::from)
                .getOrThrow());
    }
}
