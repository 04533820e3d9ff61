package com.hotelhub.booking.domain.service;

import com.hotelhub.booking.domain.model.User;
import com.hotelhub.booking.domain.repository.UserRepository;
import com.hotelhub.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Narrow view of the user store: lookups and loyalty balance updates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserAccountService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public User getUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    @Transactional
    public User addBonusPoints(Long userId, int points) {
        User user = getUser(userId);
        user.addBonusPoints(points);
        log.info("Added {} bonus points to user {} (balance {})", points, userId, user.getBonusPoints());
        return userRepository.save(user);
    }
}
