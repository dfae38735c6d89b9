package com.baladi.points.controller;

import com.baladi.common.dto.ApiResponse;
import com.baladi.points.dto.PointsAdjustmentRequest;
import com.baladi.points.dto.PointsBalanceResponse;
import com.baladi.points.dto.PointsTransactionResponse;
import com.baladi.points.service.PointsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/points")
@RequiredArgsConstructor
public class PointsController {

    private final PointsService pointsService;

    @GetMapping("/{customerId}")
    public ApiResponse<PointsBalanceResponse> getBalance(@PathVariable Long customerId) {
        return ApiResponse.ok(pointsService.getAccount(customerId)
                .map(PointsBalanceResponse::from)
                .getOrThrow());
    }

    /** Opens the account (and referral code) if the customer has none yet. */
    @PostMapping("/{customerId}")
    public ApiResponse<PointsBalanceResponse> openAccount(@PathVariable Long customerId) {
        return ApiResponse.ok(PointsBalanceResponse.from(pointsService.openAccount(customerId)));
    }

    @GetMapping("/{customerId}/history")
    public ApiResponse<List<PointsTransactionResponse>> getHistory(@PathVariable Long customerId) {
        return ApiResponse.ok(pointsService.getHistory(customerId).stream()
                .map(PointsTransactionResponse::from)
                .toList());
    }

    @PostMapping("/{customerId}/adjustments")
    public ApiResponse<PointsTransactionResponse> adjust(@PathVariable Long customerId,
                                                         @Valid @RequestBody PointsAdjustmentRequest request) {
        return ApiResponse.ok(pointsService.adjustPoints(customerId, request.delta(), request.reason())
                .map(PointsTransactionResponse::from)
                .getOrThrow());
    }
}
