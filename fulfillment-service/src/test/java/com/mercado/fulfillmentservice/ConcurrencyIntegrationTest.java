package com.mercado.fulfillmentservice;

import com.mercado.common.exception.InsufficientStockException;
import com.mercado.fulfillmentservice.dto.CheckoutItemRequest;
import com.mercado.fulfillmentservice.dto.CheckoutRequest;
import com.mercado.fulfillmentservice.dto.ReservationRequest;
import com.mercado.fulfillmentservice.dto.ReservationResponse;
import com.mercado.fulfillmentservice.model.Product;
import com.mercado.fulfillmentservice.model.Reservation;
import com.mercado.fulfillmentservice.model.ReservationStatus;
import com.mercado.fulfillmentservice.repository.ReservationRepository;
import com.mercado.fulfillmentservice.service.CheckoutService;
import com.mercado.fulfillmentservice.service.ReservationService;
import com.mercado.fulfillmentservice.service.StockLedgerService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.RepeatedTest;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reservations under concurrent load.
 *
 * Every reserver takes the product's row lock before summing the active holds, so
 * the check and the insert cannot interleave. Commit and the expiry sweep both
 * update the hold conditionally on ACTIVE, so exactly one of them wins.
 */
public class ConcurrencyIntegrationTest extends AbstractIntegrationTest {

  @Autowired
  private CheckoutService checkoutService;

  @Autowired
  private ReservationService reservationService;

  @Autowired
  private StockLedgerService stockLedgerService;

  @Autowired
  private ReservationRepository reservationRepository;

  @Autowired
  private TestFulfillmentService testFulfillmentService;

  @AfterEach
  void clear() {
    testFulfillmentService.deleteAll();
  }

  @RepeatedTest(5) // race conditions are intermittent, run it a few times
  void should_never_reserve_more_than_available() throws InterruptedException, ExecutionException {
    // 1. ARRANGE: 10 units, 11 buyers of one unit each
    Product product = testFulfillmentService.createProduct("Laptop", "1000.00", 10);
    int buyers = 11;

    ExecutorService executor = Executors.newFixedThreadPool(buyers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> futures = new ArrayList<>();

    // 2. ACT: everybody fires at once
    for (int i = 0; i < buyers; i++) {
      String requester = "buyer-" + i;
      futures.add(executor.submit(() -> {
        start.await();
        try {
          checkoutService.reserve(new ReservationRequest(product.getId(), null, 1), requester);
          return true;
        } catch (InsufficientStockException e) {
          return false;
        }
      }));
    }
    start.countDown();

    int succeeded = 0;
    int rejected = 0;
    for (Future<Boolean> future : futures) {
      if (future.get()) {
        succeeded++;
      } else {
        rejected++;
      }
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

    // 3. ASSERT
    assertEquals(10, succeeded, "exactly the available units are reserved");
    assertEquals(1, rejected);
    assertEquals(0, stockLedgerService.getAvailableStock(product.getId(), null));
    assertEquals(10, testFulfillmentService.physicalStock(product.getId()), "holds never touch physical stock");
  }

  @RepeatedTest(3)
  void should_not_oversell_across_concurrent_checkouts_of_two_products() throws Exception {
    // two items per checkout, listed in opposite order by half of the buyers
    Product first = testFulfillmentService.createProduct("Mouse", "20.00", 5);
    Product second = testFulfillmentService.createProduct("Keyboard", "40.00", 5);
    int buyers = 8;

    ExecutorService executor = Executors.newFixedThreadPool(buyers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> futures = new ArrayList<>();

    for (int i = 0; i < buyers; i++) {
      boolean reversed = i % 2 == 0;
      futures.add(executor.submit(() -> {
        start.await();
        CheckoutRequest request = new CheckoutRequest();
        List<CheckoutItemRequest> items = new ArrayList<>(List.of(
            new CheckoutItemRequest(first.getId(), null, 1),
            new CheckoutItemRequest(second.getId(), null, 1)));
        if (reversed) {
          Collections.reverse(items);
        }
        request.setItems(items);
        try {
          checkoutService.checkout(request, UUID.randomUUID());
          return true;
        } catch (InsufficientStockException e) {
          return false;
        }
      }));
    }
    start.countDown();

    int succeeded = 0;
    for (Future<Boolean> future : futures) {
      // a deadlock would surface here as an ExecutionException
      if (future.get(30, TimeUnit.SECONDS)) {
        succeeded++;
      }
    }
    executor.shutdown();

    assertEquals(5, succeeded);
    assertEquals(0, stockLedgerService.getAvailableStock(first.getId(), null));
    assertEquals(0, stockLedgerService.getAvailableStock(second.getId(), null));
  }

  @RepeatedTest(5)
  void commit_and_expiry_sweep_have_exactly_one_winner() throws Exception {
    // ARRANGE: an active hold whose deadline already passed
    Product product = testFulfillmentService.createProduct("Phone", "500.00", 10);
    ReservationResponse hold = checkoutService.reserve(new ReservationRequest(product.getId(), null, 4), "buyer");
    testFulfillmentService.backdateReservation(hold.getId());
    UUID orderId = UUID.randomUUID();

    ExecutorService executor = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);

    // ACT
    Future<Boolean> commit = executor.submit(() -> {
      start.await();
      return reservationService.commitReservation(hold.getId(), orderId);
    });
    Future<Integer> sweep = executor.submit(() -> {
      start.await();
      return reservationService.expireStaleReservations(Instant.now());
    });
    start.countDown();

    boolean committed = commit.get(30, TimeUnit.SECONDS);
    int expired = sweep.get(30, TimeUnit.SECONDS);
    executor.shutdown();

    // ASSERT
    Reservation after = reservationRepository.findById(hold.getId()).orElseThrow();
    if (committed) {
      assertEquals(0, expired);
      assertEquals(ReservationStatus.COMMITTED, after.getStatus());
      assertEquals(6, testFulfillmentService.physicalStock(product.getId()));
      assertEquals(6, stockLedgerService.getAvailableStock(product.getId(), null));
    } else {
      assertEquals(1, expired);
      assertEquals(ReservationStatus.EXPIRED, after.getStatus());
      assertEquals(10, testFulfillmentService.physicalStock(product.getId()));
      assertEquals(10, stockLedgerService.getAvailableStock(product.getId(), null));
    }
  }
}
