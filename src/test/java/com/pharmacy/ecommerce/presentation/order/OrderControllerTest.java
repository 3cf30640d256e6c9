package com.pharmacy.ecommerce.presentation.order;

import com.pharmacy.ecommerce.application.event.DomainEventDispatcher;
import com.pharmacy.ecommerce.application.order.OrderQueryService;
import com.pharmacy.ecommerce.application.order.OrderService;
import com.pharmacy.ecommerce.application.order.dto.OrderDetail;
import com.pharmacy.ecommerce.application.order.dto.OrderTransitionResult;
import com.pharmacy.ecommerce.common.BaseControllerTest;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import com.pharmacy.ecommerce.common.exception.SystemException;
import com.pharmacy.ecommerce.domain.common.page.PageQuery;
import com.pharmacy.ecommerce.domain.common.page.PagedResult;
import com.pharmacy.ecommerce.domain.common.vo.Money;
import com.pharmacy.ecommerce.domain.compliance.ComplianceInfo;
import com.pharmacy.ecommerce.domain.order.InvalidOrderStateTransitionException;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import com.pharmacy.ecommerce.domain.order.OrderNotFoundException;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import com.pharmacy.ecommerce.domain.order.OrderTerminalStateException;
import com.pharmacy.ecommerce.domain.order.UnauthorizedOrderAccessException;
import com.pharmacy.ecommerce.domain.order.event.DomainEvent;
import com.pharmacy.ecommerce.domain.order.event.OrderCancelledEvent;
import com.pharmacy.ecommerce.presentation.order.mapper.OrderMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * OrderControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: OrderController
 * - GET /orders, GET /orders/all, GET /orders/{order_id}
 * - POST /orders, POST /orders/{order_id}/confirm|pay|cancel
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderController 단위 테스트")
class OrderControllerTest extends BaseControllerTest {

    private static final String USER_ID = "user-1";
    private static final String ORDER_ID = "order-1";
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 2, 1, 9, 0);

    private MockMvc mockMvc;

    @Mock
    private OrderService orderService;

    @Mock
    private OrderQueryService orderQueryService;

    @Mock
    private DomainEventDispatcher eventDispatcher;

    @BeforeEach
    void setup() {
        OrderController controller = new OrderController(orderService, orderQueryService, new OrderMapper(),
                eventDispatcher);
        mockMvc = buildMockMvc(controller);
    }

    private Order order(String orderId, OrderStatus status) {
        return Order.builder()
                .id(orderId)
                .userId(USER_ID)
                .status(status)
                .items(List.of(OrderItem.create("prod-003", "Amoxicillin 500mg", Money.of(12000), 1, NOW)))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    // ========== 조회 ==========

    @Test
    @DisplayName("GET /orders - 페이지 파라미터 정규화 후 조회, pagination 응답")
    void testGetOrderHistory() throws Exception {
        // Given
        PageQuery expected = PageQuery.of(3, 10);
        PagedResult<Order> page = PagedResult.of(List.of(order("o-21", OrderStatus.PAID)), 21, expected);
        when(orderQueryService.getOrderHistory(eq(USER_ID), eq(expected), anyString())).thenReturn(page);

        // When & Then
        mockMvc.perform(get("/orders")
                        .header("X-USER-ID", USER_ID)
                        .param("page", "3")
                        .param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orders[0].order_id").value("o-21"))
                .andExpect(jsonPath("$.orders[0].total.amount").value(12000))
                .andExpect(jsonPath("$.pagination.page").value(3))
                .andExpect(jsonPath("$.pagination.total").value(21))
                .andExpect(jsonPath("$.pagination.total_pages").value(3))
                .andExpect(jsonPath("$.pagination.has_next_page").value(false))
                .andExpect(jsonPath("$.pagination.has_previous_page").value(true));
    }

    @Test
    @DisplayName("GET /orders - 범위를 벗어난 limit은 100으로 보정")
    void testGetOrderHistory_LimitClamped() throws Exception {
        PageQuery expected = PageQuery.of(1, 100);
        when(orderQueryService.getOrderHistory(eq(USER_ID), eq(expected), anyString()))
                .thenReturn(PagedResult.of(List.of(), 0, expected));

        mockMvc.perform(get("/orders").header("X-USER-ID", USER_ID).param("limit", "1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pagination.limit").value(100))
                .andExpect(jsonPath("$.pagination.total_pages").value(0));
    }

    @Test
    @DisplayName("GET /orders - 숫자가 아닌 page는 400")
    void testGetOrderHistory_InvalidPage() throws Exception {
        mockMvc.perform(get("/orders").header("X-USER-ID", USER_ID).param("page", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("GET /orders/all?status=paid - 대소문자 무시 필터")
    void testGetOrders_StatusFilter() throws Exception {
        when(orderQueryService.getOrders(eq(USER_ID), eq(Optional.of(OrderStatus.PAID)), anyString()))
                .thenReturn(List.of(order(ORDER_ID, OrderStatus.PAID)));

        mockMvc.perform(get("/orders/all").header("X-USER-ID", USER_ID).param("status", "paid"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("PAID"));
    }

    @Test
    @DisplayName("GET /orders/all?status=UNKNOWN - 400")
    void testGetOrders_UnknownStatus() throws Exception {
        mockMvc.perform(get("/orders/all").header("X-USER-ID", USER_ID).param("status", "UNKNOWN"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("GET /orders/{order_id} - 처방 필요 주문은 compliance 포함")
    void testGetOrderDetail_WithCompliance() throws Exception {
        when(orderQueryService.getOrderById(eq(ORDER_ID), eq(USER_ID), anyString()))
                .thenReturn(new OrderDetail(order(ORDER_ID, OrderStatus.CONFIRMED), true, ComplianceInfo.pending()));

        mockMvc.perform(get("/orders/" + ORDER_ID).header("X-USER-ID", USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order.order_id").value(ORDER_ID))
                .andExpect(jsonPath("$.requires_prescription").value(true))
                .andExpect(jsonPath("$.compliance.status").value("PENDING"))
                .andExpect(jsonPath("$.compliance.prescriptions").isEmpty());
    }

    @Test
    @DisplayName("GET /orders/{order_id} - 처방 불필요 주문은 compliance 없음")
    void testGetOrderDetail_WithoutCompliance() throws Exception {
        when(orderQueryService.getOrderById(eq(ORDER_ID), eq(USER_ID), anyString()))
                .thenReturn(new OrderDetail(order(ORDER_ID, OrderStatus.PAID), false, null));

        mockMvc.perform(get("/orders/" + ORDER_ID).header("X-USER-ID", USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requires_prescription").value(false))
                .andExpect(jsonPath("$.compliance").doesNotExist());
    }

    @Test
    @DisplayName("GET /orders/{order_id} - 없는 주문 404, 다른 사용자 주문 403")
    void testGetOrderDetail_Errors() throws Exception {
        when(orderQueryService.getOrderById(eq("missing"), eq(USER_ID), anyString()))
                .thenThrow(new OrderNotFoundException("missing"));
        when(orderQueryService.getOrderById(eq("theirs"), eq(USER_ID), anyString()))
                .thenThrow(new UnauthorizedOrderAccessException());

        mockMvc.perform(get("/orders/missing").header("X-USER-ID", USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("ORDER_NOT_FOUND"));
        mockMvc.perform(get("/orders/theirs").header("X-USER-ID", USER_ID))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error_code").value("UNAUTHORIZED_ORDER_ACCESS"));
    }

    // ========== 상태 전이 ==========

    @Test
    @DisplayName("POST /orders - 주문 접수 201")
    void testPlaceOrder() throws Exception {
        when(orderService.placeOrder(eq(USER_ID), anyString()))
                .thenReturn(new OrderTransitionResult(order(ORDER_ID, OrderStatus.CREATED), List.of()));

        mockMvc.perform(post("/orders").header("X-USER-ID", USER_ID))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order.status").value("CREATED"))
                .andExpect(jsonPath("$.events").isEmpty());
    }

    @Test
    @DisplayName("POST /orders/{order_id}/confirm - 허용되지 않는 전이는 409 + allowed_transitions")
    void testConfirm_InvalidTransition() throws Exception {
        when(orderService.confirmOrder(eq(USER_ID), eq(ORDER_ID), anyString()))
                .thenThrow(InvalidOrderStateTransitionException.of(OrderStatus.PAID, OrderStatus.CONFIRMED));

        mockMvc.perform(post("/orders/" + ORDER_ID + "/confirm").header("X-USER-ID", USER_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("INVALID_ORDER_STATE_TRANSITION"))
                .andExpect(jsonPath("$.allowed_transitions[0]").value("SHIPPED"))
                .andExpect(jsonPath("$.allowed_transitions[1]").value("CANCELLED"));
    }

    @Test
    @DisplayName("POST /orders/{order_id}/pay - 락 획득 실패는 503")
    void testPay_LockFailure() throws Exception {
        when(orderService.payForOrder(eq(USER_ID), eq(ORDER_ID), anyString()))
                .thenThrow(new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key=user:orders:user-1"));

        mockMvc.perform(post("/orders/" + ORDER_ID + "/pay").header("X-USER-ID", USER_ID))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("LOCK_ACQUISITION_FAILED"));
    }

    @Test
    @DisplayName("POST /orders/{order_id}/cancel - 사유 전달, 이벤트 발행")
    void testCancel_WithReason() throws Exception {
        // Given
        Order paid = order(ORDER_ID, OrderStatus.PAID);
        List<DomainEvent> events = List.of(OrderCancelledEvent.of(paid, "고객 요청", "c", NOW));
        when(orderService.cancelOrder(eq(USER_ID), eq(ORDER_ID), eq("고객 요청"), anyString()))
                .thenReturn(new OrderTransitionResult(order(ORDER_ID, OrderStatus.CANCELLED), events));

        // When & Then
        mockMvc.perform(post("/orders/" + ORDER_ID + "/cancel")
                        .header("X-USER-ID", USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"고객 요청\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order.status").value("CANCELLED"))
                .andExpect(jsonPath("$.events[0].type").value("ORDER_CANCELLED"));

        verify(eventDispatcher).dispatch(events);
    }

    @Test
    @DisplayName("POST /orders/{order_id}/cancel - 본문 없이 취소, 종료 상태면 409")
    void testCancel_NoBody_Terminal() throws Exception {
        when(orderService.cancelOrder(eq(USER_ID), eq(ORDER_ID), isNull(), anyString()))
                .thenThrow(new OrderTerminalStateException(ORDER_ID, OrderStatus.DELIVERED));

        mockMvc.perform(post("/orders/" + ORDER_ID + "/cancel").header("X-USER-ID", USER_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("ORDER_TERMINAL_STATE"));
    }
}
