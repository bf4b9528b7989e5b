package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 최초 상품 추가 시 빈 장바구니 행을 만든다.
 *
 * 별도 트랜잭션(REQUIRES_NEW)으로 분리하여, 같은 소유자의 동시 생성 경쟁에서 진 쪽의
 * 유니크 제약 위반이 호출자 트랜잭션을 오염시키지 않게 한다.
 * 호출자는 DataIntegrityViolationException 을 잡고 다시 잠금 조회한다.
 */
@Service
@RequiredArgsConstructor
public class CartProvisioner {

    private final CartRepository cartRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void createIfAbsent(String ownerId) {
        if (cartRepository.findByOwnerId(ownerId).isPresent()) {
            return;
        }
        cartRepository.saveAndFlush(Cart.create(ownerId, LocalDateTime.now(clock)));
    }
}
