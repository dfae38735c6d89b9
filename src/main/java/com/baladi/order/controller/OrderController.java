package com.baladi.order.controller;

import com.baladi.common.dto.ApiResponse;
import com.baladi.order.dto.*;
import com.baladi.order.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<OrderResponse> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        return ApiResponse.ok(orderService.placeOrder(request).map(OrderResponse::from).getOrThrow());
    }

    @GetMapping("/{id}")
    public ApiResponse<OrderResponse> getOrder(@PathVariable Long id) {
        return ApiResponse.ok(orderService.getOrder(id).map(OrderResponse::from).getOrThrow());
    }

    @GetMapping("/customer/{customerId}")
    public ApiResponse<List<OrderResponse>> getCustomerOrders(@PathVariable Long customerId) {
        return ApiResponse.ok(orderService.getOrdersByCustomer(customerId).stream()
                .map(OrderResponse::from)
                .toList());
    }

    @GetMapping("/{id}/history")
    public ApiResponse<List<StatusHistoryResponse>> getHistory(@PathVariable Long id) {
        return ApiResponse.ok(orderService.getStatusHistory(id).stream()
                .map(StatusHistoryResponse::from)
                .toList());
    }

    @GetMapping("/{id}/cash-transactions")
    public ApiResponse<List<CashTransactionResponse>> getCashTransactions(@PathVariable Long id) {
        return ApiResponse.ok(orderService.getCashTransactions(id).stream()
                .map(CashTransactionResponse::from)
                .toList());
    }

    @PatchMapping("/{id}/status")
    public ApiResponse<OrderResponse> updateStatus(@PathVariable Long id,
                                                   @Valid @RequestBody UpdateStatusRequest request) {
        return ApiResponse.ok(orderService.updateOrderStatus(
                        id, request.status(), request.actorId(), request.actorRole(), request.note())
                .map(OrderResponse::from)
                .getOrThrow());
    }

    @PostMapping("/{id}/rider")
    public ApiResponse<OrderResponse> assignRider(@PathVariable Long id, @RequestParam Long riderId) {
        return ApiResponse.ok(orderService.assignRider(id, riderId).map(OrderResponse::from).getOrThrow());
    }

    @PostMapping("/{id}/cash/collected")
    public ApiResponse<OrderResponse> collectCash(@PathVariable Long id, @RequestParam Long riderId) {
        return ApiResponse.ok(orderService.collectCash(id, riderId).map(OrderResponse::from).getOrThrow());
    }

    @PostMapping("/{id}/cash/handed-to-shop")
    public ApiResponse<OrderResponse> handCashToShop(@PathVariable Long id, @RequestParam Long riderId) {
        return ApiResponse.ok(orderService.handCashToShop(id, riderId).map(OrderResponse::from).getOrThrow());
    }

    @PostMapping("/{id}/cash/confirmed")
    public ApiResponse<OrderResponse> confirmCash(@PathVariable Long id, @RequestParam Long shopId) {
        return ApiResponse.ok(orderService.confirmShopReceivedCash(id, shopId).map(OrderResponse::from).getOrThrow());
    }
}
