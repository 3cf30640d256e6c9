package com.pharmacy.ecommerce.presentation.cart;

import com.pharmacy.ecommerce.application.cart.CartService;
import com.pharmacy.ecommerce.application.cart.dto.CheckoutResult;
import com.pharmacy.ecommerce.application.event.DomainEventDispatcher;
import com.pharmacy.ecommerce.application.order.dto.OrderTransitionResult;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.presentation.cart.request.AddCartItemRequest;
import com.pharmacy.ecommerce.presentation.cart.request.UpdateQuantityRequest;
import com.pharmacy.ecommerce.presentation.cart.response.CheckoutResponse;
import com.pharmacy.ecommerce.presentation.common.RequestHeaders;
import com.pharmacy.ecommerce.presentation.order.mapper.OrderMapper;
import com.pharmacy.ecommerce.presentation.order.response.OrderResponse;
import com.pharmacy.ecommerce.presentation.order.response.OrderTransitionResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CartController - 장바구니 API
 */
@RestController
@RequestMapping("/cart")
public class CartController {

    private final CartService cartService;
    private final OrderMapper orderMapper;
    private final DomainEventDispatcher eventDispatcher;

    public CartController(CartService cartService, OrderMapper orderMapper, DomainEventDispatcher eventDispatcher) {
        this.cartService = cartService;
        this.orderMapper = orderMapper;
        this.eventDispatcher = eventDispatcher;
    }

    /**
     * GET /cart - 장바구니 조회 (없으면 204)
     */
    @GetMapping
    public ResponseEntity<OrderResponse> getCart(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId) {
        return cartService.getCart(userId, RequestHeaders.resolveCorrelationId(correlationId))
                .map(cart -> ResponseEntity.ok(orderMapper.toOrderResponse(cart)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * POST /cart - 장바구니 생성 (멱등)
     */
    @PostMapping
    public ResponseEntity<OrderResponse> createCart(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId) {
        Order cart = cartService.createDraftOrder(userId, RequestHeaders.resolveCorrelationId(correlationId));
        return ResponseEntity.ok(orderMapper.toOrderResponse(cart));
    }

    /**
     * POST /cart/items - 상품 추가 (같은 상품이면 수량 합산)
     */
    @PostMapping("/items")
    public ResponseEntity<OrderResponse> addItem(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId,
            @Valid @RequestBody AddCartItemRequest request) {
        Order cart = cartService.addItemToCart(userId, request.getProductId(), request.getQuantity(),
                RequestHeaders.resolveCorrelationId(correlationId));
        return ResponseEntity.status(HttpStatus.CREATED).body(orderMapper.toOrderResponse(cart));
    }

    /**
     * PATCH /cart/items/{product_id} - 수량 변경
     */
    @PatchMapping("/items/{product_id}")
    public ResponseEntity<OrderResponse> updateItemQuantity(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId,
            @PathVariable("product_id") String productId,
            @RequestBody UpdateQuantityRequest request) {
        Order cart = cartService.updateItemQuantity(userId, productId, request.getQuantity(),
                RequestHeaders.resolveCorrelationId(correlationId));
        return ResponseEntity.ok(orderMapper.toOrderResponse(cart));
    }

    /**
     * DELETE /cart/items/{product_id} - 상품 삭제
     */
    @DeleteMapping("/items/{product_id}")
    public ResponseEntity<OrderResponse> removeItem(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId,
            @PathVariable("product_id") String productId) {
        Order cart = cartService.removeItemFromCart(userId, productId,
                RequestHeaders.resolveCorrelationId(correlationId));
        return ResponseEntity.ok(orderMapper.toOrderResponse(cart));
    }

    /**
     * DELETE /cart/items - 장바구니 비우기
     */
    @DeleteMapping("/items")
    public ResponseEntity<OrderResponse> clearCart(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId) {
        Order cart = cartService.clearCart(userId, RequestHeaders.resolveCorrelationId(correlationId));
        return ResponseEntity.ok(orderMapper.toOrderResponse(cart));
    }

    /**
     * DELETE /cart - 장바구니 포기 (DRAFT → CANCELLED)
     */
    @DeleteMapping
    public ResponseEntity<OrderTransitionResponse> abandonCart(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId) {
        OrderTransitionResult result = cartService.abandonCart(userId,
                RequestHeaders.resolveCorrelationId(correlationId));
        eventDispatcher.dispatch(result.getEvents());
        return ResponseEntity.ok(orderMapper.toTransitionResponse(result));
    }

    /**
     * POST /cart/checkout - 체크아웃 (DRAFT → CONFIRMED)
     */
    @PostMapping("/checkout")
    public ResponseEntity<CheckoutResponse> checkout(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.CORRELATION_ID, required = false) String correlationId) {
        CheckoutResult result = cartService.confirmDraftOrder(userId,
                RequestHeaders.resolveCorrelationId(correlationId));
        eventDispatcher.dispatch(result.getEvents());
        return ResponseEntity.ok(orderMapper.toCheckoutResponse(result));
    }
}
