package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 * Port(CartRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
@Primary
public class MySQLCartRepository implements CartRepository {

    private final CartJpaRepository cartJpaRepository;

    public MySQLCartRepository(CartJpaRepository cartJpaRepository) {
        this.cartJpaRepository = cartJpaRepository;
    }

    @Override
    public Optional<Cart> findByOwnerId(String ownerId) {
        return cartJpaRepository.findByOwnerId(ownerId);
    }

    @Override
    public boolean existsByOwnerId(String ownerId) {
        return cartJpaRepository.existsByOwnerId(ownerId);
    }

    @Override
    public Optional<Cart> findByOwnerIdForUpdate(String ownerId) {
        return cartJpaRepository.findByOwnerIdForUpdate(ownerId);
    }

    @Override
    public Cart save(Cart cart) {
        return cartJpaRepository.save(cart);
    }

    @Override
    public Cart saveAndFlush(Cart cart) {
        return cartJpaRepository.saveAndFlush(cart);
    }
}
