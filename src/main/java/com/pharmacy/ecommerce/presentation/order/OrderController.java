package com.pharmacy.ecommerce.presentation.order;

import com.pharmacy.ecommerce.application.event.DomainEventDispatcher;
import com.pharmacy.ecommerce.application.order.OrderQueryService;
import com.pharmacy.ecommerce.application.order.OrderService;
import com.pharmacy.ecommerce.application.order.dto.OrderTransitionResult;
import com.pharmacy.ecommerce.domain.common.page.PageQuery;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import com.pharmacy.ecommerce.presentation.common.RequestHeaders;
import com.pharmacy.ecommerce.presentation.order.mapper.OrderMapper;
import com.pharmacy.ecommerce.presentation.order.request.CancelOrderRequest;
import com.pharmacy.ecommerce.presentation.order.response.OrderDetailResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderHistoryResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderSummaryResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderTransitionResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * OrderController - 주문 API 엔드포인트
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final OrderQueryService orderQueryService;
    private final OrderMapper orderMapper;
    private final DomainEventDispatcher eventDispatcher;

    public OrderController(OrderService orderService, OrderQueryService orderQueryService,
                           OrderMapper orderMapper, DomainEventDispatcher eventDispatcher) {
        this.orderService = orderService;
        this.orderQueryService = orderQueryService;
        this.orderMapper = orderMapper;
        this.eventDispatcher = eventDispatcher;
    }

    /**
     * GET /orders - 주문 이력 (DRAFT 제외, page는 1부터)
     */
    @GetMapping
    public ResponseEntity<OrderHistoryResponse> getOrderHistory(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "limit", required = false) Integer limit) {
        var history = orderQueryService.getOrderHistory(userId, PageQuery.of(page, limit),
                RequestHeaders.resolveCorrelationId(correlationId));
        return ResponseEntity.ok(orderMapper.toHistoryResponse(history));
    }

    /**
     * GET /orders/all - 전체 주문 목록 (status 필터 선택)
     */
    @GetMapping("/all")
    public ResponseEntity<List<OrderSummaryResponse>> getOrders(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId,
            @RequestParam(value = "status", required = false) String status) {
        Optional<OrderStatus> statusFilter = Optional.ofNullable(status).map(OrderStatus::from);
        var orders = orderQueryService.getOrders(userId, statusFilter,
                RequestHeaders.resolveCorrelationId(correlationId));
        return ResponseEntity.ok(orderMapper.toSummaries(orders));
    }

    /**
     * GET /orders/{order_id} - 주문 상세
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderDetailResponse> getOrderDetail(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId,
            @PathVariable("order_id") String orderId) {
        var detail = orderQueryService.getOrderById(orderId, userId,
                RequestHeaders.resolveCorrelationId(correlationId));
        return ResponseEntity.ok(orderMapper.toDetailResponse(detail));
    }

    /**
     * POST /orders - 장바구니로 주문 접수 (DRAFT → CREATED)
     */
    @PostMapping
    public ResponseEntity<OrderTransitionResponse> placeOrder(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId) {
        OrderTransitionResult result = orderService.placeOrder(userId,
                RequestHeaders.resolveCorrelationId(correlationId));
        return respond(HttpStatus.CREATED, result);
    }

    @PostMapping("/{order_id}/confirm")
    public ResponseEntity<OrderTransitionResponse> confirmOrder(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId,
            @PathVariable("order_id") String orderId) {
        OrderTransitionResult result = orderService.confirmOrder(userId, orderId,
                RequestHeaders.resolveCorrelationId(correlationId));
        return respond(HttpStatus.OK, result);
    }

    @PostMapping("/{order_id}/pay")
    public ResponseEntity<OrderTransitionResponse> payForOrder(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId,
            @PathVariable("order_id") String orderId) {
        OrderTransitionResult result = orderService.payForOrder(userId, orderId,
                RequestHeaders.resolveCorrelationId(correlationId));
        return respond(HttpStatus.OK, result);
    }

    /**
     * POST /orders/{order_id}/cancel - 주문 취소 (body 선택)
     */
    @PostMapping("/{order_id}/cancel")
    public ResponseEntity<OrderTransitionResponse> cancelOrder(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId,
            @PathVariable("order_id") String orderId,
            @Valid @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request != null ? request.getReason() : null;
        OrderTransitionResult result = orderService.cancelOrder(userId, orderId, reason,
                RequestHeaders.resolveCorrelationId(correlationId));
        return respond(HttpStatus.OK, result);
    }

    private ResponseEntity<OrderTransitionResponse> respond(HttpStatus status, OrderTransitionResult result) {
        eventDispatcher.dispatch(result.getEvents());
        return ResponseEntity.status(status).body(orderMapper.toTransitionResponse(result));
    }
}
