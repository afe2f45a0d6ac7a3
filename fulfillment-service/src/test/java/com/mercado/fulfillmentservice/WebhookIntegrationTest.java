package com.mercado.fulfillmentservice;

import com.mercado.fulfillmentservice.dto.CheckoutItemRequest;
import com.mercado.fulfillmentservice.dto.CheckoutRequest;
import com.mercado.fulfillmentservice.dto.OrderResponse;
import com.mercado.fulfillmentservice.dto.WebhookRetryResult;
import com.mercado.fulfillmentservice.dto.WebhookRetryStats;
import com.mercado.fulfillmentservice.model.OrderStatus;
import com.mercado.fulfillmentservice.model.Product;
import com.mercado.fulfillmentservice.model.WebhookEvent;
import com.mercado.fulfillmentservice.model.WebhookEventStatus;
import com.mercado.fulfillmentservice.repository.WebhookEventRepository;
import com.mercado.fulfillmentservice.service.CheckoutService;
import com.mercado.fulfillmentservice.service.OrderService;
import com.mercado.fulfillmentservice.service.WebhookService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
public class WebhookIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CheckoutService checkoutService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private WebhookService webhookService;

    @Autowired
    private WebhookEventRepository webhookEventRepository;

    @Autowired
    private TestFulfillmentService testFulfillmentService;

    private Product product;
    private OrderResponse order;

    @BeforeEach
    void setUp() {
        product = testFulfillmentService.createProduct("pour-over kettle", "40.00", 10);
        var request = new CheckoutRequest();
        request.setItems(List.of(new CheckoutItemRequest(product.getId(), null, 2)));
        order = checkoutService.checkout(request, UUID.randomUUID());
    }

    @AfterEach
    void tearDown() {
        testFulfillmentService.deleteAll();
    }

    private String paymentBody(String eventId, String type, String amount) {
        return "{\"eventId\":\"" + eventId + "\",\"type\":\"" + type + "\",\"orderId\":\"" + order.getId()
                + "\",\"paymentReference\":\"tb-" + eventId + "\",\"amount\":" + amount + ",\"currency\":\"ETB\"}";
    }

    private ResultActions deliver(String body, String signature) throws Exception {
        return mockMvc.perform(post("/api/v1/payments/webhook/telebirr")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Webhook-Signature", signature)
                .content(body));
    }

    @Test
    void should_mark_order_paid_once_for_repeated_deliveries() throws Exception {
        // 1. ARRANGE
        String body = paymentBody("evt-100", "payment.succeeded", "80.00");
        String signature = "sha256=" + TestFulfillmentService.sign(TestFulfillmentService.TELEBIRR_SECRET, body);

        // 2. ACT
        deliver(body, signature)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("ACCEPTED"));
        deliver(body, signature)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("DUPLICATE_IGNORED"));

        // 3. ASSERT
        assertEquals(OrderStatus.PAID, orderService.getOrder(order.getId(), null).getStatus());
        assertEquals(8, testFulfillmentService.physicalStock(product.getId()), "deducted exactly once");

        List<WebhookEvent> stored = webhookEventRepository.findAll();
        assertEquals(1, stored.size());
        assertEquals(WebhookEventStatus.PROCESSED, stored.get(0).getStatus());
        assertEquals(order.getId(), stored.get(0).getOrderId());
    }

    @Test
    void should_reject_forged_signature_and_keep_audit_row() throws Exception {
        String body = paymentBody("evt-200", "payment.succeeded", "80.00");
        String forged = TestFulfillmentService.sign("not-the-secret", body);

        deliver(body, forged)
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.result").value("INVALID_SIGNATURE"));

        assertEquals(OrderStatus.PENDING, orderService.getOrder(order.getId(), null).getStatus());
        List<WebhookEvent> stored = webhookEventRepository.findAll();
        assertEquals(1, stored.size());
        assertTrue(stored.get(0).isArchived());
        assertNull(stored.get(0).getExternalEventId());

        // the genuine delivery is still accepted afterwards
        deliver(body, TestFulfillmentService.sign(TestFulfillmentService.TELEBIRR_SECRET, body))
                .andExpect(jsonPath("$.result").value("ACCEPTED"));
        assertEquals(OrderStatus.PAID, orderService.getOrder(order.getId(), null).getStatus());
    }

    @Test
    void should_retry_failed_event_until_archived() throws Exception {
        // amount does not match the order total: every attempt fails
        String body = paymentBody("evt-300", "payment.succeeded", "79.00");
        deliver(body, TestFulfillmentService.sign(TestFulfillmentService.TELEBIRR_SECRET, body))
                .andExpect(status().isOk());

        WebhookEvent event = webhookEventRepository.findAll().get(0);
        assertEquals(WebhookEventStatus.ERROR, event.getStatus());
        assertEquals(1, event.getRetryCount());
        assertNotNull(event.getNextRetryAt());

        // not due yet: the sweep leaves it alone
        assertEquals(0, webhookService.retryFailedWebhooks(10).getProcessed());

        // max-retries is 3 in the test profile
        for (int attempt = 2; attempt <= 3; attempt++) {
            testFulfillmentService.makeRetryDue(event.getId());
            WebhookRetryResult result = webhookService.retryFailedWebhooks(10);
            assertEquals(1, result.getProcessed());
            assertEquals(1, result.getFailed());
        }

        WebhookEvent archived = webhookEventRepository.findById(event.getId()).orElseThrow();
        assertEquals(3, archived.getRetryCount());
        assertTrue(archived.isArchived());
        assertNull(archived.getNextRetryAt());
        assertEquals(OrderStatus.PENDING, orderService.getOrder(order.getId(), null).getStatus());

        mockMvc.perform(get("/api/v1/admin/webhooks/stats")
                        .with(jwt().jwt(builder -> builder.subject("ops-admin"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.archivedWebhooks").value(1))
                .andExpect(jsonPath("$.pendingRetries").value(0));
    }

    @Test
    void should_apply_event_on_retry_once_the_cause_is_gone() throws Exception {
        // a refund for a PENDING order is not a legal edge yet
        String refund = paymentBody("evt-400", "refund.succeeded", "80.00");
        deliver(refund, TestFulfillmentService.sign(TestFulfillmentService.TELEBIRR_SECRET, refund))
                .andExpect(status().isOk());
        UUID refundEventId = webhookEventRepository.findAll().get(0).getId();

        String paid = paymentBody("evt-401", "payment.succeeded", "80.00");
        deliver(paid, TestFulfillmentService.sign(TestFulfillmentService.TELEBIRR_SECRET, paid))
                .andExpect(jsonPath("$.result").value("ACCEPTED"));

        testFulfillmentService.makeRetryDue(refundEventId);
        mockMvc.perform(post("/api/v1/admin/webhooks/retry")
                        .param("batchSize", "5")
                        .with(jwt().jwt(builder -> builder.subject("ops-admin"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(1))
                .andExpect(jsonPath("$.succeeded").value(1));

        assertEquals(OrderStatus.REFUNDED, orderService.getOrder(order.getId(), null).getStatus());
        assertEquals(10, testFulfillmentService.physicalStock(product.getId()), "refund before shipment restocks");

        WebhookRetryStats stats = webhookService.getRetryStats();
        assertEquals(0, stats.getFailedWebhooks());
    }

    @Test
    void should_require_compensation_for_payment_after_cancellation() throws Exception {
        orderService.cancelOrder(order.getId(), order.getUserId());

        String body = paymentBody("evt-500", "payment.succeeded", "80.00");
        deliver(body, TestFulfillmentService.sign(TestFulfillmentService.TELEBIRR_SECRET, body))
                .andExpect(jsonPath("$.result").value("ACCEPTED"));

        OrderResponse after = orderService.getOrder(order.getId(), null);
        assertEquals(OrderStatus.CANCELLED, after.getStatus());
        assertTrue(after.isCompensationRequired());
        assertEquals("tb-evt-500", after.getPaymentReference());
        assertEquals(WebhookEventStatus.PROCESSED, webhookEventRepository.findAll().get(0).getStatus());
    }

    @Test
    void should_finish_event_left_pending_by_interrupted_attempt() {
        // the process died after storing the event, before recording any outcome
        String body = paymentBody("evt-600", "payment.succeeded", "80.00");
        WebhookEvent stalled = testFulfillmentService.insertInterruptedWebhook(
                "telebirr", "evt-600", order.getId(), body, Instant.now().minus(Duration.ofMinutes(30)));
        // an attempt still in flight elsewhere is left alone
        WebhookEvent inFlight = testFulfillmentService.insertInterruptedWebhook(
                "telebirr", "evt-601", order.getId(), paymentBody("evt-601", "payment.pending", "80.00"),
                Instant.now());

        WebhookRetryResult result = webhookService.retryFailedWebhooks(10);

        assertEquals(1, result.getProcessed());
        assertEquals(1, result.getSucceeded());
        WebhookEvent finished = webhookEventRepository.findById(stalled.getId()).orElseThrow();
        assertEquals(WebhookEventStatus.PROCESSED, finished.getStatus());
        assertEquals(1, finished.getRetryCount(), "the lost attempt counts against the cap");
        assertEquals(WebhookEventStatus.PENDING,
                webhookEventRepository.findById(inFlight.getId()).orElseThrow().getStatus());
        assertEquals(OrderStatus.PAID, orderService.getOrder(order.getId(), null).getStatus());
        assertEquals(8, testFulfillmentService.physicalStock(product.getId()));
    }

    @Test
    void should_archive_signed_but_unreadable_delivery() throws Exception {
        String body = "{\"eventId\":\"evt-700\",\"type\":\"payment.succeeded\",\"orderId\":\"not-a-uuid\"}";
        String signature = TestFulfillmentService.sign(TestFulfillmentService.TELEBIRR_SECRET, body);

        mockMvc.perform(post("/api/v1/payments/webhook/telebirr")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Webhook-Signature", signature)
                        .header("X-Webhook-Event-Id", "evt-700")
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("MALFORMED_PAYLOAD"));

        // the provider redelivers: recognised by the event id, no second row
        mockMvc.perform(post("/api/v1/payments/webhook/telebirr")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Webhook-Signature", signature)
                        .header("X-Webhook-Event-Id", "evt-700")
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("DUPLICATE_IGNORED"));

        List<WebhookEvent> stored = webhookEventRepository.findAll();
        assertEquals(1, stored.size());
        assertEquals(WebhookEventStatus.ERROR, stored.get(0).getStatus());
        assertTrue(stored.get(0).isArchived());
        assertTrue(stored.get(0).getErrorMessage().startsWith("Unreadable payload"));
        assertEquals(1, webhookService.getRetryStats().getArchivedWebhooks());
        assertEquals(OrderStatus.PENDING, orderService.getOrder(order.getId(), null).getStatus());
    }
}
