package com.mercado.fulfillmentservice.service;

import com.mercado.common.exception.ResourceNotFoundException;
import com.mercado.fulfillmentservice.exception.ConsistencyViolationException;
import com.mercado.fulfillmentservice.model.Product;
import com.mercado.fulfillmentservice.model.ProductVariant;
import com.mercado.fulfillmentservice.repository.ProductRepository;
import com.mercado.fulfillmentservice.repository.ProductVariantRepository;
import com.mercado.fulfillmentservice.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class StockLedgerServiceImpl implements StockLedgerService {

    private final ProductRepository productRepository;
    private final ProductVariantRepository variantRepository;
    private final ReservationRepository reservationRepository;

    @Override
    @Transactional(readOnly = true)
    public int getAvailableStock(UUID productId, UUID variantId) {
        return getStockLevel(productId, variantId).getAvailable();
    }

    @Override
    @Transactional(readOnly = true)
    public StockLevel getStockLevel(UUID productId, UUID variantId) {
        int physical = variantId == null
                ? productRepository.findById(productId)
                        .map(Product::getStock)
                        .orElseThrow(() -> productNotFound(productId))
                : variantRepository.findByIdAndProductId(variantId, productId)
                        .map(ProductVariant::getStock)
                        .orElseThrow(() -> variantNotFound(productId, variantId));

        return new StockLevel(productId, variantId, physical, reservedQuantity(productId, variantId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public StockLevel lockStock(UUID productId, UUID variantId) {
        int physical = variantId == null
                ? productRepository.findByIdForUpdate(productId)
                        .map(Product::getStock)
                        .orElseThrow(() -> productNotFound(productId))
                : variantRepository.findByIdAndProductIdForUpdate(variantId, productId)
                        .map(ProductVariant::getStock)
                        .orElseThrow(() -> variantNotFound(productId, variantId));

        // summed after the lock: every writer of ACTIVE holds for this row is now queued behind us
        return new StockLevel(productId, variantId, physical, reservedQuantity(productId, variantId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void deductPhysicalStock(UUID productId, UUID variantId, int quantity) {
        int updated = variantId == null
                ? productRepository.decreaseStock(productId, quantity)
                : variantRepository.decreaseStock(variantId, quantity);

        if (updated == 0) {
            // the hold guaranteed these units; physical stock was cut under it by hand
            log.error("Physical stock below committed quantity: productId={}, variantId={}, quantity={}",
                    productId, variantId, quantity);
            throw new ConsistencyViolationException("Physical stock of product " + productId
                    + (variantId != null ? " variant " + variantId : "")
                    + " is below the committed quantity " + quantity);
        }
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void addPhysicalStock(UUID productId, UUID variantId, int quantity) {
        int updated = variantId == null
                ? productRepository.increaseStock(productId, quantity)
                : variantRepository.increaseStock(variantId, quantity);

        if (updated == 0) {
            throw variantId == null ? productNotFound(productId) : variantNotFound(productId, variantId);
        }
    }

    private long reservedQuantity(UUID productId, UUID variantId) {
        return variantId == null
                ? reservationRepository.sumActiveQuantityForProduct(productId)
                : reservationRepository.sumActiveQuantityForVariant(productId, variantId);
    }

    private ResourceNotFoundException productNotFound(UUID productId) {
        return new ResourceNotFoundException("Product not found with id: " + productId);
    }

    private ResourceNotFoundException variantNotFound(UUID productId, UUID variantId) {
        return new ResourceNotFoundException("Variant " + variantId + " not found for product " + productId);
    }
}
